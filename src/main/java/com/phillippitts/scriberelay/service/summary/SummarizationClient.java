package com.phillippitts.scriberelay.service.summary;

/**
 * Produces an updated running summary from the previous one and new transcript text.
 */
public interface SummarizationClient {

    boolean isConfigured();

    /**
     * @return the new running summary
     * @throws com.phillippitts.scriberelay.exception.ScribeRelayException on any failure
     */
    String summarize(SummaryRequest request);
}
