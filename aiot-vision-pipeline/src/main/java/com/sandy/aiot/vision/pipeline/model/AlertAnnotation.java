package com.sandy.aiot.vision.pipeline.model;

import java.time.Instant;

public record AlertAnnotation(Instant at, String author, String text) {
}
