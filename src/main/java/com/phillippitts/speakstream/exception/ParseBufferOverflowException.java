package com.phillippitts.speakstream.exception;

/**
 * Thrown when the sentence parser accumulates more undecided text than its configured limit.
 * This is fatal for the session: the upstream producer is emitting text with no usable
 * sentence boundaries.
 */
public class ParseBufferOverflowException extends SpeakStreamException {

    private final int bufferedChars;
    private final int limit;

    public ParseBufferOverflowException(int bufferedChars, int limit) {
        super("Sentence buffer overflow: " + bufferedChars + " chars without a boundary (limit " + limit + ")");
        this.bufferedChars = bufferedChars;
        this.limit = limit;
    }

    public int getBufferedChars() {
        return bufferedChars;
    }

    public int getLimit() {
        return limit;
    }
}
