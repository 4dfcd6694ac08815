package com.phillippitts.scriberelay.service.audio.capture;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FrameAccumulatorTest {

    private static byte[] seq(int from, int len) {
        byte[] b = new byte[len];
        for (int i = 0; i < len; i++) {
            b[i] = (byte) (from + i);
        }
        return b;
    }

    @Test
    void drainReturnsEverythingInOrderAndEmpties() {
        FrameAccumulator acc = new FrameAccumulator(16);
        acc.append(seq(0, 4), 0, 4);
        acc.append(seq(4, 6), 0, 6);

        assertThat(acc.drain()).containsExactly(seq(0, 10));
        assertThat(acc.size()).isZero();
        assertThat(acc.drain()).isEmpty();
    }

    @Test
    void overflowDropsOldestBytes() {
        FrameAccumulator acc = new FrameAccumulator(8);
        assertThat(acc.append(seq(0, 6), 0, 6)).isZero();
        assertThat(acc.append(seq(6, 6), 0, 6)).isEqualTo(4);

        assertThat(acc.drain()).containsExactly(seq(4, 8));
        assertThat(acc.droppedBytes()).isEqualTo(4);
    }

    @Test
    void wrapAroundKeepsOrder() {
        FrameAccumulator acc = new FrameAccumulator(8);
        acc.append(seq(0, 6), 0, 6);
        acc.drain();
        acc.append(seq(10, 4), 0, 4);
        acc.append(seq(14, 4), 0, 4);

        assertThat(acc.drain()).containsExactly(seq(10, 8));
    }

    @Test
    void appendLargerThanCapacityKeepsNewestTail() {
        FrameAccumulator acc = new FrameAccumulator(4);
        acc.append(seq(0, 2), 0, 2);
        assertThat(acc.append(seq(10, 10), 0, 10)).isEqualTo(8);

        assertThat(acc.drain()).containsExactly(seq(16, 4));
        assertThat(acc.droppedBytes()).isEqualTo(2 + 6);
    }

    @Test
    void capacityIsRoundedDownToWholeSamples() {
        assertThat(new FrameAccumulator(9).capacity()).isEqualTo(8);
    }

    @Test
    void clearDiscardsBufferedBytes() {
        FrameAccumulator acc = new FrameAccumulator(8);
        acc.append(seq(0, 4), 0, 4);
        acc.clear();
        assertThat(acc.drain()).isEmpty();
    }
}
