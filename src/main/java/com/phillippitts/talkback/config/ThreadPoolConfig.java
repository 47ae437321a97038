package com.phillippitts.talkback.config;

import com.phillippitts.talkback.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for turn processing.
 *
 * <p>Two pools keep the layers apart:
 * <ul>
 *   <li>{@code turnExecutor}: one task per active turn, pulling the turn to its end</li>
 *   <li>{@code callExecutor}: blocking collaborator starts (transcription, generation,
 *       synthesis) raced against the turn's cancellation token</li>
 * </ul>
 *
 * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A saturated pool fails the
 * affected turn instead of running collaborator calls on a transport or turn thread.
 *
 * <p>MDC propagation: the Log4j2 ThreadContext of the submitting thread is copied to the
 * worker so session and turn ids stay on async log lines.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Pool that drives turns, configured via {@code threadpool.turn.*}.
     */
    @Bean(name = "turnExecutor")
    public ThreadPoolTaskExecutor turnExecutor() {
        return createExecutor(threadPoolProperties.getTurn());
    }

    /**
     * Pool for cancellable collaborator calls, configured via {@code threadpool.call.*}.
     */
    @Bean(name = "callExecutor")
    public ThreadPoolTaskExecutor callExecutor() {
        return createExecutor(threadPoolProperties.getCall());
    }

    private static ThreadPoolTaskExecutor createExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

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
