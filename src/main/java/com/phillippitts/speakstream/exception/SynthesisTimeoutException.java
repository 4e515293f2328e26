package com.phillippitts.speakstream.exception;

import java.time.Duration;

/**
 * Thrown when a synthesis call does not return within the configured timeout.
 * The remote call may still be running; its result is discarded when it arrives.
 */
public class SynthesisTimeoutException extends SynthesisException {

    private final Duration timeout;

    public SynthesisTimeoutException(int sequenceNumber, Duration timeout, Throwable cause) {
        super("Synthesis timed out after " + timeout.toMillis() + "ms", sequenceNumber, cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String reason() {
        return "timeout";
    }
}
