package com.phillippitts.speakstream.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the synthesis and playback thread pools via Micrometer.
 *
 * <p>Gauges, tagged with {@code pool=synthesis|playback}:
 * <ul>
 *   <li>speakstream.pool.size - Current number of threads in the pool</li>
 *   <li>speakstream.pool.active - Number of actively executing tasks</li>
 *   <li>speakstream.pool.queued - Number of tasks waiting in the queue</li>
 *   <li>speakstream.pool.completed - Cumulative count of completed tasks</li>
 *   <li>speakstream.pool.max.size - Configured maximum pool size</li>
 * </ul>
 *
 * <p>Additionally logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<Executor> synthesisExecutorProvider;
    private final ObjectProvider<Executor> playbackExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("synthesisExecutor") ObjectProvider<Executor> synthesisExecutorProvider,
            @Qualifier("playbackExecutor") ObjectProvider<Executor> playbackExecutorProvider) {
        this.synthesisExecutorProvider = synthesisExecutorProvider;
        this.playbackExecutorProvider = playbackExecutorProvider;
    }

    /**
     * Binds both pools to the meter registry.
     *
     * @return MeterBinder that registers the pool gauges
     */
    @Bean
    public MeterBinder pipelineExecutorMetrics() {
        return registry -> {
            bind(registry, "synthesis", synthesisExecutorProvider.getIfAvailable());
            bind(registry, "playback", playbackExecutorProvider.getIfAvailable());
        };
    }

    private void bind(MeterRegistry registry, String pool, Executor candidate) {
        ThreadPoolExecutor executor = unwrap(candidate);
        if (executor == null) {
            LOG.debug("Executor '{}' is not a thread pool; skipping pool metrics", pool);
            return;
        }
        Gauge.builder("speakstream.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .tag("pool", pool)
                .description("Current number of threads in the pool")
                .register(registry);
        Gauge.builder("speakstream.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .tag("pool", pool)
                .description("Number of threads actively executing tasks")
                .register(registry);
        Gauge.builder("speakstream.pool.queued", executor, e -> e.getQueue().size())
                .tag("pool", pool)
                .description("Number of tasks waiting in the queue")
                .register(registry);
        Gauge.builder("speakstream.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .tag("pool", pool)
                .description("Cumulative count of completed tasks")
                .register(registry);
        Gauge.builder("speakstream.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                .tag("pool", pool)
                .description("Configured maximum pool size")
                .register(registry);
        LOG.info("Thread pool metrics registered for '{}' pool", pool);
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        logPool("Synthesis", unwrap(synthesisExecutorProvider.getIfAvailable()));
        logPool("Playback", unwrap(playbackExecutorProvider.getIfAvailable()));
    }

    private static void logPool(String name, ThreadPoolExecutor executor) {
        if (executor == null) {
            return;
        }
        LOG.info("{} Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                name,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }

    private static ThreadPoolExecutor unwrap(Executor executor) {
        if (executor instanceof ThreadPoolTaskExecutor taskExecutor) {
            return taskExecutor.getThreadPoolExecutor();
        }
        return null;
    }
}
