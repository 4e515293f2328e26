package com.phillippitts.speakstream.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the spoken-response pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Chunks detected by the sentence parser</li>
 *   <li>Synthesis starts, latency, failures (by reason), retries and cancellations</li>
 *   <li>Playback queue wait, playback duration and sink failures</li>
 *   <li>Interruptions by strategy</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class SpeechPipelineMetrics {

    static final String METRIC_PREFIX = "speakstream.pipeline";

    private final MeterRegistry registry;

    public SpeechPipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementChunksDetected() {
        Counter.builder(METRIC_PREFIX + ".chunks.detected")
                .description("Number of text chunks emitted by the sentence parser")
                .register(registry)
                .increment();
    }

    public void incrementSynthesisStarted() {
        Counter.builder(METRIC_PREFIX + ".synthesis.started")
                .description("Number of synthesis attempts started, retries included")
                .register(registry)
                .increment();
    }

    /**
     * Records a successful synthesis call.
     *
     * @param durationNanos provider latency in nanoseconds
     */
    public void recordSynthesisCompleted(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".synthesis.latency")
                .description("Time taken by successful synthesis calls")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts a sentence that will not be spoken because synthesis failed for good.
     *
     * @param reason failure reason (timeout, provider, error)
     */
    public void incrementSentencesFailed(String reason) {
        Counter.builder(METRIC_PREFIX + ".sentences.failed")
                .description("Number of sentences dropped after synthesis failure")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementRetries() {
        Counter.builder(METRIC_PREFIX + ".synthesis.retries")
                .description("Number of synthesis retry attempts")
                .register(registry)
                .increment();
    }

    /**
     * @param scope cancellation granularity (all, pending, after, fallback)
     * @param count number of tasks cancelled
     */
    public void incrementCancelled(String scope, int count) {
        Counter.builder(METRIC_PREFIX + ".synthesis.cancelled")
                .description("Number of synthesis tasks cancelled")
                .tag("scope", scope)
                .register(registry)
                .increment(count);
    }

    public void recordPlaybackQueueWait(long waitNanos) {
        Timer.builder(METRIC_PREFIX + ".playback.queue.wait")
                .description("Time between a segment arriving and its playback starting")
                .register(registry)
                .record(waitNanos, TimeUnit.NANOSECONDS);
    }

    public void recordPlaybackCompleted(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".playback.duration")
                .description("Time the sink took to play a segment")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementPlaybackFailed() {
        Counter.builder(METRIC_PREFIX + ".playback.failed")
                .description("Number of segments the sink failed to play")
                .register(registry)
                .increment();
    }

    /**
     * @param strategy interruption strategy used
     */
    public void incrementInterruptions(String strategy) {
        Counter.builder(METRIC_PREFIX + ".interruptions")
                .description("Number of interruptions by strategy")
                .tag("strategy", strategy)
                .register(registry)
                .increment();
    }
}
