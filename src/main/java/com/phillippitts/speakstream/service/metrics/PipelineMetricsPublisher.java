package com.phillippitts.speakstream.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Recording hooks used by the parser session, the synthesis queue and the playback queue.
 *
 * <p><b>Null Safety:</b> All methods tolerate a missing {@link SpeechPipelineMetrics}, so the
 * pipeline components can run without a meter registry in tests.
 *
 * @since 1.0
 * @see SpeechPipelineMetrics
 */
@Component
public final class PipelineMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(PipelineMetricsPublisher.class);

    /**
     * Shared no-op instance for tests and components constructed outside Spring.
     */
    public static final PipelineMetricsPublisher NOOP = new PipelineMetricsPublisher(null);

    private final SpeechPipelineMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public PipelineMetricsPublisher(SpeechPipelineMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("PipelineMetricsPublisher created without metrics (test mode)");
        }
    }

    public void chunkDetected() {
        if (metrics != null) {
            metrics.incrementChunksDetected();
        }
    }

    public void synthesisStarted() {
        if (metrics != null) {
            metrics.incrementSynthesisStarted();
        }
    }

    public void synthesisCompleted(long durationNanos) {
        if (metrics != null) {
            metrics.recordSynthesisCompleted(durationNanos);
        }
    }

    public void synthesisFailed(String reason) {
        if (metrics != null) {
            metrics.incrementSentencesFailed(reason);
        }
    }

    public void retryAttempted() {
        if (metrics != null) {
            metrics.incrementRetries();
        }
    }

    public void tasksCancelled(String scope, int count) {
        if (metrics != null && count > 0) {
            metrics.incrementCancelled(scope, count);
        }
    }

    public void playbackQueueWait(long waitNanos) {
        if (metrics != null) {
            metrics.recordPlaybackQueueWait(waitNanos);
        }
    }

    public void playbackCompleted(long durationNanos) {
        if (metrics != null) {
            metrics.recordPlaybackCompleted(durationNanos);
        }
    }

    public void playbackFailed() {
        if (metrics != null) {
            metrics.incrementPlaybackFailed();
        }
    }

    public void interruptionTriggered(String strategy) {
        if (metrics != null) {
            metrics.incrementInterruptions(strategy);
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
