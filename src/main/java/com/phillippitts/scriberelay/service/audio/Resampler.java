package com.phillippitts.scriberelay.service.audio;

/**
 * Nearest-neighbor downsampler from the microphone's native rate to the wire rate.
 *
 * <p>{@code outLength = round(inLength / ratio)} and {@code out[i] = in[floor(i * ratio)]}
 * where {@code ratio = inputRate / targetRate}. Identity when the rates match.
 * No anti-aliasing filter is applied; speech engines tolerate the aliasing at these rates.
 */
public final class Resampler {

    private final int targetRate;

    public Resampler() {
        this(AudioFormat.WIRE_SAMPLE_RATE);
    }

    public Resampler(int targetRate) {
        if (targetRate <= 0) {
            throw new IllegalArgumentException("targetRate must be positive: " + targetRate);
        }
        this.targetRate = targetRate;
    }

    public float[] resample(float[] input, int inputRate) {
        if (inputRate <= 0) {
            throw new IllegalArgumentException("inputRate must be positive: " + inputRate);
        }
        if (inputRate == targetRate || input.length == 0) {
            return input;
        }
        double ratio = (double) inputRate / targetRate;
        int outLength = (int) Math.round(input.length / ratio);
        float[] out = new float[outLength];
        for (int i = 0; i < outLength; i++) {
            int src = (int) Math.floor(i * ratio);
            out[i] = input[Math.min(src, input.length - 1)];
        }
        return out;
    }

    public int targetRate() {
        return targetRate;
    }
}
