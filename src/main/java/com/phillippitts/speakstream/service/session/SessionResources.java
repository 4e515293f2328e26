package com.phillippitts.speakstream.service.session;

import com.phillippitts.speakstream.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.speakstream.service.synthesis.SynthesisProvider;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Collaborators shared by every {@link SpeechSession} (parameter object).
 *
 * @param provider synthesis provider client
 * @param synthesisExecutor executor for provider calls
 * @param playbackExecutor executor for playback workers
 * @param metrics metrics facade
 * @param eventPublisher Spring event publisher (nullable)
 */
public record SessionResources(
        SynthesisProvider provider,
        Executor synthesisExecutor,
        Executor playbackExecutor,
        PipelineMetricsPublisher metrics,
        ApplicationEventPublisher eventPublisher
) {
    public SessionResources {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(synthesisExecutor, "synthesisExecutor");
        Objects.requireNonNull(playbackExecutor, "playbackExecutor");
        if (metrics == null) {
            metrics = PipelineMetricsPublisher.NOOP;
        }
    }
}
