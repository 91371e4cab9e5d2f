package com.phillippitts.voicelink.config;

import com.phillippitts.voicelink.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for the API server.
 *
 * <p>Two bounded pools are created from {@link ThreadPoolProperties}:
 * <ul>
 *   <li>{@code connectionExecutor} - one task per accepted socket (read, route, respond)</li>
 *   <li>{@code inferenceExecutor} - audio decoding, engine inference, diarization and model loads</li>
 * </ul>
 *
 * <p>Both use {@link ThreadPoolExecutor.AbortPolicy}. A rejected connection is answered with 503 by
 * the listener and a rejected transcription becomes a {@code SERVER_BUSY} error; running the task on
 * the caller would stall the accept loop or the state owner thread.
 *
 * <p>MDC propagation: Log4j2 ThreadContext (connectionId, method, path) is copied from the
 * submitting thread to the worker thread.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    @Bean(name = "connectionExecutor")
    public ThreadPoolTaskExecutor connectionExecutor() {
        return buildExecutor(threadPoolProperties.getConnection());
    }

    @Bean(name = "inferenceExecutor")
    public ThreadPoolTaskExecutor inferenceExecutor() {
        return buildExecutor(threadPoolProperties.getInference());
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitting thread's ThreadContext into the worker for the duration of the task.
     */
    static final class MdcTaskDecorator implements TaskDecorator {

        @Override
        public Runnable decorate(Runnable runnable) {
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
        }
    }
}
