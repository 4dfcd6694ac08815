package com.phillippitts.scriberelay.service.engine;

/**
 * Transcribes one self-contained WAV chunk over HTTP.
 */
public interface ChunkTranscriptionClient {

    boolean isConfigured();

    /**
     * @param wav complete WAV file (16 kHz mono 16-bit)
     * @return transcript text, possibly empty
     * @throws com.phillippitts.scriberelay.exception.TransientNetworkException when the request
     *         still fails after retries
     * @throws com.phillippitts.scriberelay.exception.UpstreamFatalException when the endpoint
     *         rejects the chunk
     */
    String transcribe(byte[] wav);
}
