package com.phillippitts.speakstream.service.synthesis;

/**
 * What a session does when synthesis of a chunk fails.
 */
public enum FailurePolicy {
    /** Drop the chunk and carry on with the rest. */
    SKIP,
    /** Re-run the same chunk up to {@code max-retries} times, then skip it. */
    RETRY,
    /** Give up on the whole response: cancel everything queued and in flight. */
    FALLBACK
}
