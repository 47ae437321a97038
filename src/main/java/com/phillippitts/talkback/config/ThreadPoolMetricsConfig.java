package com.phillippitts.talkback.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the turn and call pools via Micrometer as {@code turn.pool.*} and {@code call.pool.*}
 * ({@code size}, {@code active}, {@code queued}, {@code completed}, {@code max.size}).
 *
 * <p>Additionally logs a health summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ThreadPoolTaskExecutor turnExecutor;
    private final ThreadPoolTaskExecutor callExecutor;

    public ThreadPoolMetricsConfig(@Qualifier("turnExecutor") ThreadPoolTaskExecutor turnExecutor,
                                   @Qualifier("callExecutor") ThreadPoolTaskExecutor callExecutor) {
        this.turnExecutor = turnExecutor;
        this.callExecutor = callExecutor;
    }

    @Bean
    public MeterBinder turnPoolMetrics() {
        return registry -> {
            bind(registry, "turn.pool", turnExecutor.getThreadPoolExecutor());
            bind(registry, "call.pool", callExecutor.getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: turn.pool.*, call.pool.*");
        };
    }

    private static void bind(MeterRegistry registry, String prefix, ThreadPoolExecutor executor) {
        Gauge.builder(prefix + ".size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .register(registry);
        Gauge.builder(prefix + ".active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .register(registry);
        Gauge.builder(prefix + ".queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .register(registry);
        Gauge.builder(prefix + ".completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .register(registry);
        Gauge.builder(prefix + ".max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                .description("Configured maximum pool size")
                .register(registry);
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        log("Turn", turnExecutor.getThreadPoolExecutor());
        log("Call", callExecutor.getThreadPoolExecutor());
    }

    private static void log(String name, ThreadPoolExecutor executor) {
        LOG.info("{} Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                name,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
