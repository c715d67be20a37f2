package com.phillippitts.voicerelay.domain;

import java.util.List;

/**
 * Result of dispatching one turn's segments to synthesis.
 *
 * @param dispatched        segments submitted to synthesis
 * @param released          segments whose audio reached the sink
 * @param failedSequences   sequence numbers whose synthesis failed
 * @param fallbackSubstituted true when a failed terminal segment was replaced by the fallback phrase
 * @param firstAudioMillis  dispatch start to first audio release, -1 if nothing was released
 * @param streamError       error event received from the segment channel (nullable)
 * @param cancelled         true when dispatch stopped because the call hung up
 */
public record DispatchReport(
        int dispatched,
        int released,
        List<Integer> failedSequences,
        boolean fallbackSubstituted,
        long firstAudioMillis,
        Throwable streamError,
        boolean cancelled
) {

    public DispatchReport {
        failedSequences = failedSequences == null ? List.of() : List.copyOf(failedSequences);
    }

    public boolean hasStreamError() {
        return streamError != null;
    }
}
