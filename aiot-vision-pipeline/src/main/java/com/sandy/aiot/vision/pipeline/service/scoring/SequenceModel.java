package com.sandy.aiot.vision.pipeline.service.scoring;

/**
 * Sequence autoencoder: maps a {@code [steps][features]} input to its reconstruction of the same shape.
 */
public interface SequenceModel extends AutoCloseable {

    String id();

    /**
     * @throws ModelInvocationException when inference fails
     */
    float[][] reconstruct(float[][] sequence);

    @Override
    default void close() {
    }
}
