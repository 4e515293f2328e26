package com.phillippitts.speakstream.service.synthesis;

/**
 * Point-in-time counters of a {@link SynthesisQueueManager}.
 */
public record SynthesisQueueStats(
        int queued,
        int inFlight,
        int maxConcurrent,
        int peakInFlight,
        long enqueued,
        long completed,
        long failed,
        long cancelled,
        long retries,
        boolean aborted
) {
}
