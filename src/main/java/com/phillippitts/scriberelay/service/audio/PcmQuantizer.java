package com.phillippitts.scriberelay.service.audio;

/**
 * Conversions between float samples in [-1, 1] and signed 16-bit PCM.
 */
public final class PcmQuantizer {

    private PcmQuantizer() {}

    /**
     * Clamps each sample to [-1, 1] and scales negatives by 0x8000 and positives by 0x7FFF,
     * so both -1.0 and 1.0 map to the extremes of the 16-bit range.
     */
    public static short[] toPcm16(float[] samples) {
        short[] out = new short[samples.length];
        for (int i = 0; i < samples.length; i++) {
            float s = Math.max(-1f, Math.min(1f, samples[i]));
            out[i] = (short) (s < 0 ? s * 0x8000 : s * 0x7FFF);
        }
        return out;
    }

    public static byte[] toLittleEndianBytes(short[] samples) {
        byte[] out = new byte[samples.length * 2];
        for (int i = 0; i < samples.length; i++) {
            out[2 * i] = (byte) (samples[i] & 0xFF);
            out[2 * i + 1] = (byte) ((samples[i] >> 8) & 0xFF);
        }
        return out;
    }

    /**
     * Reads {@code length} bytes of signed 16-bit little-endian PCM as floats in [-1, 1).
     */
    public static float[] fromPcm16le(byte[] data, int length) {
        int count = length / 2;
        float[] out = new float[count];
        for (int i = 0; i < count; i++) {
            int lo = data[2 * i] & 0xFF;
            int hi = data[2 * i + 1];
            out[i] = (short) ((hi << 8) | lo) / 32768f;
        }
        return out;
    }
}
