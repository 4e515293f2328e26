package com.phillippitts.speakstream.service.synthesis;

import com.phillippitts.speakstream.config.properties.SpeechPipelineProperties;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of one {@link SynthesisQueueManager}.
 *
 * @param maxConcurrent parallel synthesis calls allowed for the session
 * @param failurePolicy what to do when a call fails
 * @param maxRetries extra attempts per task under {@link FailurePolicy#RETRY}
 * @param timeout bound on each synthesis call
 */
public record SynthesisSettings(int maxConcurrent, FailurePolicy failurePolicy, int maxRetries, Duration timeout) {

    public static final int DEFAULT_MAX_CONCURRENT = 3;
    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public SynthesisSettings {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1, got: " + maxConcurrent);
        }
        Objects.requireNonNull(failurePolicy, "failurePolicy");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
    }

    public static SynthesisSettings defaults() {
        return new SynthesisSettings(DEFAULT_MAX_CONCURRENT, FailurePolicy.RETRY, DEFAULT_MAX_RETRIES, DEFAULT_TIMEOUT);
    }

    public static SynthesisSettings from(SpeechPipelineProperties props) {
        return new SynthesisSettings(props.getMaxConcurrent(), props.getErrorStrategy(),
                props.getMaxRetries(), props.getSynthesisTimeout());
    }
}
