package com.phillippitts.voicerelay.config;

import com.phillippitts.voicerelay.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools behind the voice-turn pipeline.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on expected call volume.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs turns: scoring, routing, the generation stream consumer and dispatch coordination.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue
     * are full the submitting thread runs the turn, providing backpressure instead of failing.
     *
     * @return executor for turn processing
     */
    @Bean(name = "turnExecutor")
    public ThreadPoolTaskExecutor turnExecutor() {
        return buildExecutor(threadPoolProperties.getTurn(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Runs each turn's generation stream consumer beside the turn thread that dispatches its
     * segments.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Running a consumer on the
     * caller's thread would leave nobody to drain its segment channel, so a saturated pool fails
     * the turn instead.
     *
     * @return executor for generation stream consumers
     */
    @Bean(name = "streamExecutor")
    public ThreadPoolTaskExecutor streamExecutor() {
        return buildExecutor(threadPoolProperties.getStream(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Runs synthesis calls. Each turn bounds its own outstanding calls with a semaphore, so this
     * pool only caps the process-wide total.
     *
     * @return executor for synthesis calls
     */
    @Bean(name = "synthesisExecutor")
    public ThreadPoolTaskExecutor synthesisExecutor() {
        return buildExecutor(threadPoolProperties.getSynthesis(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Records telemetry off the hot path.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.DiscardPolicy}. A saturated telemetry pool
     * drops data points rather than slowing a turn down.
     *
     * @return executor for telemetry publishing
     */
    @Bean(name = "telemetryExecutor")
    public ThreadPoolTaskExecutor telemetryExecutor() {
        return buildExecutor(threadPoolProperties.getTelemetry(), new ThreadPoolExecutor.DiscardPolicy());
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props,
                                                        RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the Log4j2 ThreadContext (MDC) from the submitting thread to the worker thread so
     * {@code callId} and {@code turn} survive the hop, then restores the worker's own context.
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
