package com.phillippitts.scriberelay.service.audio.capture;

/**
 * Bounded ring of wire-format PCM bytes between the capture thread (single producer) and the
 * send timer (single consumer).
 *
 * <p>When the consumer falls behind (for example while a connection is still being set up)
 * the oldest samples are overwritten, so memory stays bounded. {@link #append} reports how many
 * bytes it overwrote so the producer can surface the loss.
 */
final class FrameAccumulator {

    private final byte[] buffer;
    private int writePos = 0;
    private int size = 0;
    private long droppedBytes = 0;

    FrameAccumulator(int capacityBytes) {
        if (capacityBytes < 2) {
            throw new IllegalArgumentException("capacity must hold at least one sample");
        }
        this.buffer = new byte[capacityBytes & ~1];
    }

    int capacity() {
        return buffer.length;
    }

    synchronized int size() {
        return size;
    }

    synchronized long droppedBytes() {
        return droppedBytes;
    }

    /** Returns the number of buffered or incoming bytes lost to make room. */
    synchronized int append(byte[] src, int off, int len) {
        if (len <= 0) {
            return 0;
        }
        if (len >= buffer.length) {
            int dropped = size + (len - buffer.length);
            droppedBytes += dropped;
            System.arraycopy(src, off + (len - buffer.length), buffer, 0, buffer.length);
            writePos = 0;
            size = buffer.length;
            return dropped;
        }
        int space = buffer.length - size;
        int overflow = 0;
        if (len > space) {
            // read position is derived from writePos - size, so shrinking size drops the oldest bytes
            overflow = len - space;
            size -= overflow;
            droppedBytes += overflow;
        }
        int first = Math.min(len, buffer.length - writePos);
        System.arraycopy(src, off, buffer, writePos, first);
        int rest = len - first;
        if (rest > 0) {
            System.arraycopy(src, off + first, buffer, 0, rest);
            writePos = rest;
        } else {
            writePos = (writePos + first) % buffer.length;
        }
        size += len;
        return overflow;
    }

    /**
     * Removes and returns everything buffered, oldest first. Returns an empty array when nothing
     * has been captured since the last drain.
     */
    synchronized byte[] drain() {
        if (size == 0) {
            return new byte[0];
        }
        byte[] out = new byte[size];
        int start = (writePos - size + buffer.length) % buffer.length;
        int first = Math.min(size, buffer.length - start);
        System.arraycopy(buffer, start, out, 0, first);
        if (first < size) {
            System.arraycopy(buffer, 0, out, first, size - first);
        }
        writePos = 0;
        size = 0;
        return out;
    }

    synchronized void clear() {
        writePos = 0;
        size = 0;
    }
}
