package com.phillippitts.speakstream.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Synthesized audio for one chunk. Produced once per successful synthesis task; ownership moves
 * to the playback queue on enqueue.
 *
 * @param sequenceNumber sequence number of the source chunk
 * @param audio opaque audio bytes handed to the sink unchanged
 * @param sourceText text that was synthesized
 * @param synthesisLatency time spent in the provider call that produced this audio
 */
public record AudioSegment(
        int sequenceNumber,
        byte[] audio,
        String sourceText,
        Duration synthesisLatency
) {

    public AudioSegment {
        Objects.requireNonNull(audio, "Audio bytes must not be null");
        Objects.requireNonNull(sourceText, "Source text must not be null");
        if (synthesisLatency == null) {
            synthesisLatency = Duration.ZERO;
        }
    }

    public int sizeBytes() {
        return audio.length;
    }
}
