package com.phillippitts.speakstream.service.synthesis;

import com.phillippitts.speakstream.domain.AudioSegment;
import com.phillippitts.speakstream.exception.SynthesisException;

/**
 * Receives the outcome of each synthesis task.
 *
 * <p>Callbacks run on executor threads, in completion order rather than submission order.
 * Use the sequence number to restore order. Implementations must not block.
 */
public interface SynthesisListener {

    /**
     * Called once per task that produced audio.
     */
    void onComplete(int sequenceNumber, AudioSegment segment);

    /**
     * Called once per task that failed after the failure policy ran (retries exhausted,
     * skipped, or the task that triggered the fallback).
     */
    void onError(int sequenceNumber, SynthesisException error);

    /**
     * Called after the FALLBACK policy cancelled the rest of the response.
     *
     * @param context what was left unspoken
     */
    default void onFallback(FallbackContext context) {
    }
}
