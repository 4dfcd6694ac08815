package com.phillippitts.scriberelay.service.engine;

import com.phillippitts.scriberelay.domain.TranscriptFragment;

import java.util.Optional;

/**
 * On-device streaming speech recognizer.
 */
public interface NativeRecognizer {

    boolean isAvailable();

    /**
     * Opens a recognition stream for PCM16LE mono audio.
     */
    Session open(int sampleRate);

    /**
     * One recognition stream. Not thread-safe.
     */
    interface Session extends AutoCloseable {

        /**
         * Feeds audio.
         *
         * @return a final fragment when an utterance ended, a partial one while speech continues,
         *         empty when nothing was recognized
         */
        Optional<TranscriptFragment> accept(byte[] pcm);

        /** Flushes the stream; returns the last final fragment, if any. */
        Optional<TranscriptFragment> finish();

        @Override
        void close();
    }
}
