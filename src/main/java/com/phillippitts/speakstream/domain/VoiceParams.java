package com.phillippitts.speakstream.domain;

import java.util.Objects;

/**
 * Voice selection passed unchanged to the synthesis provider with every request of a session.
 *
 * @param voiceId provider-specific voice identifier
 * @param speed speech rate multiplier between 0.5 and 2.0
 */
public record VoiceParams(String voiceId, double speed) {

    public static final double MIN_SPEED = 0.5;
    public static final double MAX_SPEED = 2.0;

    public VoiceParams {
        Objects.requireNonNull(voiceId, "Voice id must not be null");
        if (voiceId.isBlank()) {
            throw new IllegalArgumentException("Voice id must not be blank");
        }
        if (speed < MIN_SPEED || speed > MAX_SPEED) {
            throw new IllegalArgumentException(
                    "Speed must be between " + MIN_SPEED + " and " + MAX_SPEED + ", got: " + speed);
        }
    }

    public static VoiceParams of(String voiceId) {
        return new VoiceParams(voiceId, 1.0);
    }
}
