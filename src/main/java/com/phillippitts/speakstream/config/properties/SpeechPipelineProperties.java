package com.phillippitts.speakstream.config.properties;

import com.phillippitts.speakstream.service.playback.InterruptionStrategy;
import com.phillippitts.speakstream.service.synthesis.FailurePolicy;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-session settings for the spoken-response pipeline.
 *
 * <p>Every session reads these values once at construction; changing them affects only
 * sessions opened afterwards.
 *
 * <p>Properties:
 * <ul>
 *   <li>speech.pipeline.min-chunk-length - shortest chunk sent to synthesis (default: 10)</li>
 *   <li>speech.pipeline.max-concurrent - parallel synthesis calls per session (default: 3)</li>
 *   <li>speech.pipeline.error-strategy - SKIP, RETRY or FALLBACK (default: RETRY)</li>
 *   <li>speech.pipeline.max-retries - extra attempts under RETRY (default: 2)</li>
 *   <li>speech.pipeline.synthesis-timeout-ms - bound on each synthesis call (default: 30000)</li>
 *   <li>speech.pipeline.interruption-strategy - IMMEDIATE, GRACEFUL or DRAIN (default: GRACEFUL)</li>
 *   <li>speech.pipeline.drain-count - segments still played under DRAIN (default: 2)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "speech.pipeline")
@Validated
public class SpeechPipelineProperties {

    /** Chunks shorter than this (trimmed) are merged into the following chunk. */
    @Min(value = 0, message = "Minimum chunk length must not be negative")
    @Max(value = 200, message = "Minimum chunk length must be at most 200")
    private int minChunkLength = 10;

    /** Upper bound on undecided text held by the parser before it gives up. */
    @Positive(message = "Max buffer chars must be positive")
    private int maxBufferChars = 4000;

    /** Extra abbreviations (without the trailing period) that never end a sentence. */
    private List<String> additionalAbbreviations = new ArrayList<>();

    @Min(value = 1, message = "Max concurrent synthesis must be at least 1")
    @Max(value = 8, message = "Max concurrent synthesis must be at most 8")
    private int maxConcurrent = 3;

    @NotNull
    private FailurePolicy errorStrategy = FailurePolicy.RETRY;

    @Min(value = 0, message = "Max retries must not be negative")
    private int maxRetries = 2;

    @Positive(message = "Synthesis timeout must be positive")
    private int synthesisTimeoutMs = 30_000;

    /** Re-synthesize the unspoken remainder as one request after the FALLBACK policy fires. */
    private boolean fallbackResynthesis = true;

    @NotNull
    private InterruptionStrategy interruptionStrategy = InterruptionStrategy.GRACEFUL;

    @Min(value = 0, message = "Drain count must not be negative")
    private int drainCount = 2;

    @NotBlank
    private String defaultVoiceId = "default";

    @DecimalMin("0.5")
    @DecimalMax("2.0")
    private double defaultSpeed = 1.0;

    public int getMinChunkLength() {
        return minChunkLength;
    }

    public void setMinChunkLength(int minChunkLength) {
        this.minChunkLength = minChunkLength;
    }

    public int getMaxBufferChars() {
        return maxBufferChars;
    }

    public void setMaxBufferChars(int maxBufferChars) {
        this.maxBufferChars = maxBufferChars;
    }

    public List<String> getAdditionalAbbreviations() {
        return additionalAbbreviations;
    }

    public void setAdditionalAbbreviations(List<String> additionalAbbreviations) {
        this.additionalAbbreviations = additionalAbbreviations == null ? new ArrayList<>() : additionalAbbreviations;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public void setMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
    }

    public FailurePolicy getErrorStrategy() {
        return errorStrategy;
    }

    public void setErrorStrategy(FailurePolicy errorStrategy) {
        this.errorStrategy = errorStrategy;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getSynthesisTimeoutMs() {
        return synthesisTimeoutMs;
    }

    public void setSynthesisTimeoutMs(int synthesisTimeoutMs) {
        this.synthesisTimeoutMs = synthesisTimeoutMs;
    }

    public Duration getSynthesisTimeout() {
        return Duration.ofMillis(synthesisTimeoutMs);
    }

    public boolean isFallbackResynthesis() {
        return fallbackResynthesis;
    }

    public void setFallbackResynthesis(boolean fallbackResynthesis) {
        this.fallbackResynthesis = fallbackResynthesis;
    }

    public InterruptionStrategy getInterruptionStrategy() {
        return interruptionStrategy;
    }

    public void setInterruptionStrategy(InterruptionStrategy interruptionStrategy) {
        this.interruptionStrategy = interruptionStrategy;
    }

    public int getDrainCount() {
        return drainCount;
    }

    public void setDrainCount(int drainCount) {
        this.drainCount = drainCount;
    }

    public String getDefaultVoiceId() {
        return defaultVoiceId;
    }

    public void setDefaultVoiceId(String defaultVoiceId) {
        this.defaultVoiceId = defaultVoiceId;
    }

    public double getDefaultSpeed() {
        return defaultSpeed;
    }

    public void setDefaultSpeed(double defaultSpeed) {
        this.defaultSpeed = defaultSpeed;
    }
}
