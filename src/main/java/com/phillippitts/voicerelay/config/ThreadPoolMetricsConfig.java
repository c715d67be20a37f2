package com.phillippitts.voicerelay.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pool metrics exposure via Micrometer.
 *
 * <p>Exposes, per pool (tag {@code pool=turn|stream|synthesis|telemetry}):
 * <ul>
 *   <li>voicerelay.pool.size - Current number of threads in the pool</li>
 *   <li>voicerelay.pool.active - Number of actively executing tasks</li>
 *   <li>voicerelay.pool.queued - Number of tasks waiting in the queue</li>
 *   <li>voicerelay.pool.completed - Cumulative count of completed tasks</li>
 *   <li>voicerelay.pool.max.size - Configured maximum pool size</li>
 * </ul>
 *
 * <p>Prometheus names follow the usual mapping, e.g. {@code voicerelay_pool_active}.
 *
 * <p>Additionally logs a health summary every 5 minutes for operational visibility.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final Map<String, ThreadPoolTaskExecutor> executors = new LinkedHashMap<>();

    public ThreadPoolMetricsConfig(@Qualifier("turnExecutor") ThreadPoolTaskExecutor turnExecutor,
                                   @Qualifier("streamExecutor") ThreadPoolTaskExecutor streamExecutor,
                                   @Qualifier("synthesisExecutor") ThreadPoolTaskExecutor synthesisExecutor,
                                   @Qualifier("telemetryExecutor") ThreadPoolTaskExecutor telemetryExecutor) {
        executors.put("turn", turnExecutor);
        executors.put("stream", streamExecutor);
        executors.put("synthesis", synthesisExecutor);
        executors.put("telemetry", telemetryExecutor);
    }

    /**
     * Binds pool gauges to the Micrometer registry.
     *
     * @return MeterBinder that registers the gauges
     */
    @Bean
    public MeterBinder voiceRelayExecutorMetrics() {
        return registry -> {
            executors.forEach((name, taskExecutor) -> bind(registry, name, taskExecutor.getThreadPoolExecutor()));
            LOG.info("Thread pool metrics registered for pools {}: voicerelay.pool.* available via /actuator/metrics",
                    executors.keySet());
        };
    }

    private static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Tags tags = Tags.of("pool", pool);
        Gauge.builder("voicerelay.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .tags(tags)
                .description("Current number of threads in the pool")
                .register(registry);
        Gauge.builder("voicerelay.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .tags(tags)
                .description("Number of threads actively executing tasks")
                .register(registry);
        Gauge.builder("voicerelay.pool.queued", executor, e -> e.getQueue().size())
                .tags(tags)
                .description("Number of tasks waiting in the queue")
                .register(registry);
        Gauge.builder("voicerelay.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .tags(tags)
                .description("Cumulative count of completed tasks")
                .register(registry);
        Gauge.builder("voicerelay.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                .tags(tags)
                .description("Configured maximum pool size")
                .register(registry);
    }

    /**
     * Logs thread pool health summary every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        executors.forEach((name, taskExecutor) -> {
            ThreadPoolExecutor executor = taskExecutor.getThreadPoolExecutor();
            LOG.info("{} thread pool health: size={}/{}, active={}, queued={}, completed={}",
                    name,
                    executor.getPoolSize(),
                    executor.getMaximumPoolSize(),
                    executor.getActiveCount(),
                    executor.getQueue().size(),
                    executor.getCompletedTaskCount()
            );
        });
    }
}
