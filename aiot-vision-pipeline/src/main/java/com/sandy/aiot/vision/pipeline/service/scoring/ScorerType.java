package com.sandy.aiot.vision.pipeline.service.scoring;

public enum ScorerType {
    /** z-score of the window mean against a rolling per-sensor baseline. */
    STATISTICAL,
    /** Isolation forest over a rolling per-sensor feature history. */
    ENSEMBLE,
    /** Reconstruction error of the last K feature vectors through a loaded sequence model. */
    SEQUENCE
}
