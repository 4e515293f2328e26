package com.phillippitts.speakstream.config;

import com.phillippitts.speakstream.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools behind synthesis and playback.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on the expected number of concurrent sessions.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the shared executor that runs synthesis-provider calls for all sessions.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Submissions happen on the
     * caller's text-arrival path, which must never block or run provider calls itself; a
     * rejected submission surfaces as a provider failure and goes through the session's
     * failure policy.
     *
     * <p>Each session still caps its own parallelism with a semaphore of
     * {@code speech.pipeline.max-concurrent} permits. Every permit needs a thread of its own, so
     * the default pool hands jobs straight to a thread instead of queueing them.
     *
     * @return Configured executor for synthesis calls
     */
    @Bean(name = "synthesisExecutor")
    public Executor synthesisExecutor() {
        return buildExecutor(threadPoolProperties.getSynthesis(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Creates the executor that runs playback drain jobs.
     *
     * <p>A playback job lives while a session has segments ready to play and holds its thread for
     * that whole time, so a job must never wait in a queue behind another channel's job. The
     * default pool hands jobs straight to a thread. Rejection policy is
     * {@link ThreadPoolExecutor.AbortPolicy}; the playback queue retries a rejected job after a
     * short delay.
     *
     * @return Configured executor for playback
     */
    @Bean(name = "playbackExecutor")
    public Executor playbackExecutor() {
        return buildExecutor(threadPoolProperties.getPlayback(), new ThreadPoolExecutor.AbortPolicy());
    }

    private ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props,
                                                 RejectedExecutionHandler rejectionHandler) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionHandler);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the Log4j2 ThreadContext (MDC) of the submitting thread onto the worker so that
     * session and channel ids stay on every log line.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
