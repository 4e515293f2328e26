package com.phillippitts.speakstream.exception;

/**
 * Thrown when the synthesis provider rejects or fails a request, or when the request could not
 * be submitted at all.
 */
public class SynthesisProviderException extends SynthesisException {

    public SynthesisProviderException(String message) {
        super(message);
    }

    public SynthesisProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    public SynthesisProviderException(String message, int sequenceNumber, Throwable cause) {
        super(message, sequenceNumber, cause);
    }

    @Override
    public String reason() {
        return "provider";
    }
}
