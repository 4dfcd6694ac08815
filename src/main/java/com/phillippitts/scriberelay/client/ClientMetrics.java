package com.phillippitts.scriberelay.client;

/**
 * Immutable snapshot of one dictation session's client-side measurements.
 *
 * @param connectionTimeMs        start to ready, or -1 if the session never became ready
 * @param stopToFinalTranscriptMs stop request to the last final result, or -1 if none arrived
 * @param audioBytesSent          PCM bytes handed to the transport
 * @param partialCount            partial results received
 * @param finalCount              final results received
 */
public record ClientMetrics(
        long connectionTimeMs,
        long stopToFinalTranscriptMs,
        long audioBytesSent,
        int partialCount,
        int finalCount
) {

    public static ClientMetrics empty() {
        return new ClientMetrics(-1, -1, 0, 0, 0);
    }
}
