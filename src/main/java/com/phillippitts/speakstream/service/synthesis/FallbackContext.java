package com.phillippitts.speakstream.service.synthesis;

/**
 * Snapshot taken when the FALLBACK policy aborts a response.
 *
 * @param failedSequence sequence number of the task whose failure triggered the fallback
 * @param firstUndelivered lowest sequence number that never reached {@code onComplete}
 * @param remainingText text of every unfinished task, in sequence order
 */
public record FallbackContext(int failedSequence, int firstUndelivered, String remainingText) {
}
