package com.phillippitts.speakstream.exception;

/**
 * Base exception for all speakstream application-specific errors.
 * All pipeline exceptions extend this class so callers can handle them uniformly.
 */
public class SpeakStreamException extends RuntimeException {

    public SpeakStreamException(String message) {
        super(message);
    }

    public SpeakStreamException(String message, Throwable cause) {
        super(message, cause);
    }

    public SpeakStreamException(Throwable cause) {
        super(cause);
    }
}
