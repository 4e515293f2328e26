package com.phillippitts.speakstream.domain;

import java.util.Objects;

/**
 * One semantic unit of a streamed response, normally a sentence, as emitted by the parser.
 *
 * <p>{@code text} is the exact slice of the source stream, including the whitespace that
 * separated it from the previous chunk, so concatenating every chunk of a session reproduces
 * the source. {@link #spokenText()} is what gets synthesized.
 *
 * @param sequenceNumber position of this chunk within the session, starting at 0
 * @param text exact source text of the chunk
 */
public record TextChunk(int sequenceNumber, String text) {

    public TextChunk {
        if (sequenceNumber < 0) {
            throw new IllegalArgumentException("Sequence number must be >= 0, got: " + sequenceNumber);
        }
        Objects.requireNonNull(text, "Chunk text must not be null");
    }

    /**
     * Returns the chunk text without surrounding whitespace.
     *
     * @return text to synthesize (may be empty for a whitespace-only trailing chunk)
     */
    public String spokenText() {
        return text.strip();
    }

    /**
     * @return true if there is nothing to speak in this chunk
     */
    public boolean isBlank() {
        return text.isBlank();
    }
}
