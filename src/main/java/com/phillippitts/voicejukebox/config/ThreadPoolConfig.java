package com.phillippitts.voicejukebox.config;

import com.phillippitts.voicejukebox.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools used by resolution and queue population.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on the number of backends and expected load.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the pool that runs one search task per enabled backend.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.search.*} properties:
     * <ul>
     *   <li>Core pool: default 4 - one thread per typical backend</li>
     *   <li>Max pool: default 8 - handles overlapping intents</li>
     *   <li>Queue: default 50 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}
     * The request thread must never run a search itself, since that would escape the resolver's
     * timeout. When the pool and queue are full, the backend is reported as failed for that query.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread to preserve request correlation IDs in async logs.
     *
     * @return Configured executor for backend searches
     */
    @Bean(name = "searchExecutor")
    public ThreadPoolTaskExecutor searchExecutor() {
        ThreadPoolTaskExecutor executor = build(threadPoolProperties.getSearch(),
                new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    /**
     * Creates the pool that runs background populator jobs.
     *
     * <p>At most one populator is live at a time; the extra threads absorb a cancelled job that is
     * still unwinding from a slow backend call while its replacement starts.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}
     * A populator must never run on the request thread, so a full pool fails the submission
     * and the supervisor reports it.
     *
     * @return Configured executor for populator jobs
     */
    @Bean(name = "populatorExecutor")
    public ThreadPoolTaskExecutor populatorExecutor() {
        ThreadPoolTaskExecutor executor = build(threadPoolProperties.getPopulator(),
                new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        return executor;
    }

    /**
     * Copies the submitting thread's ThreadContext onto the worker for the duration of the task.
     *
     * @return decorator restoring the worker's previous context afterwards
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
