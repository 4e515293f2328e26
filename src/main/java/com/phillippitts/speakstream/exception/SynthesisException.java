package com.phillippitts.speakstream.exception;

/**
 * Base type for failures of a single synthesis task.
 *
 * <p>These never escape {@code SynthesisQueueManager} as thrown exceptions; they are handed to
 * the session's error callback after the failure policy has run.
 */
public class SynthesisException extends SpeakStreamException {

    /** Sequence number used when the failing task is not known. */
    public static final int UNKNOWN_SEQUENCE = -1;

    private final int sequenceNumber;

    public SynthesisException(String message) {
        this(message, UNKNOWN_SEQUENCE, null);
    }

    public SynthesisException(String message, Throwable cause) {
        this(message, UNKNOWN_SEQUENCE, cause);
    }

    public SynthesisException(String message, int sequenceNumber, Throwable cause) {
        super(sequenceNumber == UNKNOWN_SEQUENCE ? message : message + " (sequence: " + sequenceNumber + ")", cause);
        this.sequenceNumber = sequenceNumber;
    }

    public int getSequenceNumber() {
        return sequenceNumber;
    }

    /**
     * Short category used as a metrics tag.
     *
     * @return failure reason (e.g. "timeout", "provider")
     */
    public String reason() {
        return "error";
    }
}
