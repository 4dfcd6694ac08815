package com.phillippitts.scriberelay.service.summary;

import java.time.Instant;

/**
 * Point-in-time view of the summary throttler.
 *
 * @param callCount         summarization calls attempted in this session
 * @param lastCallAt        start of the last call, or null
 * @param lastError         message of the last failed call, or null after a success
 * @param inFlight          a call is running
 * @param scheduled         a call is waiting for its debounce
 * @param lastSummaryLength transcript length covered by the current summary
 * @param summaryLength     length of the current running summary
 */
public record SummaryDiagnostics(
        int callCount,
        Instant lastCallAt,
        String lastError,
        boolean inFlight,
        boolean scheduled,
        int lastSummaryLength,
        int summaryLength
) {
}
