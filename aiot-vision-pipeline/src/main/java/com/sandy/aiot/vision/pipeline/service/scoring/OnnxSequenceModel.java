package com.sandy.aiot.vision.pipeline.service.scoring;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

import java.nio.FloatBuffer;
import java.util.Map;

/**
 * {@link SequenceModel} backed by an ONNX Runtime session. The model takes one float tensor of
 * shape {@code [1, steps, features]} and returns a tensor of the same shape.
 */
@Slf4j
public class OnnxSequenceModel implements SequenceModel {

    private final String id;
    private final String inputName;
    private final OrtEnvironment env;
    private final OrtSession session;

    public OnnxSequenceModel(String id, String modelPath, String inputName) throws OrtException {
        this.id = id;
        this.inputName = inputName;
        this.env = OrtEnvironment.getEnvironment();
        this.session = env.createSession(modelPath, new OrtSession.SessionOptions());
        log.info("ONNX model loaded modelId={} path={} inputs={}", id, modelPath, session.getInputNames());
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public float[][] reconstruct(float[][] sequence) {
        int steps = sequence.length;
        int features = sequence[0].length;
        float[] flat = new float[steps * features];
        for (int i = 0; i < steps; i++) {
            System.arraycopy(sequence[i], 0, flat, i * features, features);
        }
        long[] shape = new long[]{1, steps, features};
        try (OnnxTensor input = OnnxTensor.createTensor(env, FloatBuffer.wrap(flat), shape);
             OrtSession.Result result = session.run(Map.of(inputName, input))) {
            OnnxValue output = result.get(0);
            Object value = output.getValue();
            if (!(value instanceof float[][][] out) || out.length == 0 || out[0].length != steps) {
                throw new ModelInvocationException("model " + id + " returned an unexpected output shape");
            }
            return out[0];
        } catch (OrtException e) {
            throw new ModelInvocationException("ONNX inference failed for model " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            session.close();
        } catch (OrtException e) {
            log.warn("Failed to close ONNX session modelId={} err={}", id, e.getMessage());
        }
    }
}
