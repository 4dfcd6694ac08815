package com.phillippitts.scriberelay.codec;

/**
 * Table-driven CRC32 (reflected polynomial 0xEDB88320) used by the event-stream framing.
 *
 * <p>The 256-entry table is built once and shared by all callers.
 */
final class Crc32 {

    private static final int[] TABLE = buildTable();

    private Crc32() {
    }

    private static int[] buildTable() {
        int[] table = new int[256];
        for (int n = 0; n < 256; n++) {
            int c = n;
            for (int k = 0; k < 8; k++) {
                c = (c & 1) != 0 ? 0xEDB88320 ^ (c >>> 1) : c >>> 1;
            }
            table[n] = c;
        }
        return table;
    }

    static int compute(byte[] data, int offset, int length) {
        int crc = 0xFFFFFFFF;
        for (int i = offset; i < offset + length; i++) {
            crc = TABLE[(crc ^ data[i]) & 0xFF] ^ (crc >>> 8);
        }
        return ~crc;
    }

    static int compute(byte[] data) {
        return compute(data, 0, data.length);
    }
}
