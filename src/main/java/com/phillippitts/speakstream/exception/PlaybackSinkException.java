package com.phillippitts.speakstream.exception;

/**
 * Thrown when the audio sink fails to play one segment.
 * Playback continues with the next eligible segment.
 */
public class PlaybackSinkException extends SpeakStreamException {

    private final int sequenceNumber;

    public PlaybackSinkException(String message, int sequenceNumber, Throwable cause) {
        super(message + " (sequence: " + sequenceNumber + ")", cause);
        this.sequenceNumber = sequenceNumber;
    }

    public int getSequenceNumber() {
        return sequenceNumber;
    }
}
