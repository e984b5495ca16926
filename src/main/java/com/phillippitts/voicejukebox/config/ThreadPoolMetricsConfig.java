package com.phillippitts.voicejukebox.config;

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

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pool metrics exposure via Micrometer.
 *
 * <p>Exposes, for both the {@code search} and {@code populator} pools:
 * <ul>
 *   <li>{pool}.pool.size - Current number of threads in the pool</li>
 *   <li>{pool}.pool.active - Number of actively executing tasks</li>
 *   <li>{pool}.pool.queued - Number of tasks waiting in the queue</li>
 *   <li>{pool}.pool.completed - Cumulative count of completed tasks</li>
 * </ul>
 *
 * <p>These metrics are available via:
 * <ul>
 *   <li>HTTP: {@code GET /actuator/metrics/jukebox.search.pool.active}</li>
 *   <li>Prometheus: {@code jukebox_search_pool_active}</li>
 * </ul>
 *
 * <p>Additionally logs a health summary every 5 minutes for operational visibility.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> searchExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> populatorExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("searchExecutor") ObjectProvider<ThreadPoolTaskExecutor> searchExecutorProvider,
            @Qualifier("populatorExecutor") ObjectProvider<ThreadPoolTaskExecutor> populatorExecutorProvider) {
        this.searchExecutorProvider = searchExecutorProvider;
        this.populatorExecutorProvider = populatorExecutorProvider;
    }

    /**
     * Binds executor thread pool metrics to Micrometer registry.
     *
     * @return MeterBinder that registers custom metrics
     */
    @Bean
    public MeterBinder executorMetrics() {
        return registry -> {
            bind(registry, "jukebox.search", searchExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "jukebox.populator", populatorExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: jukebox.search.pool.*, jukebox.populator.pool.*");
        };
    }

    private static void bind(MeterRegistry registry, String prefix, ThreadPoolExecutor executor) {
        Gauge.builder(prefix + ".pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .register(registry);

        Gauge.builder(prefix + ".pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .register(registry);

        Gauge.builder(prefix + ".pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .register(registry);

        Gauge.builder(prefix + ".pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .register(registry);
    }

    /**
     * Logs thread pool health summary every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        log("Search", searchExecutorProvider.getObject().getThreadPoolExecutor());
        log("Populator", populatorExecutorProvider.getObject().getThreadPoolExecutor());
    }

    private static void log(String name, ThreadPoolExecutor executor) {
        LOG.info("{} Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                name,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()
        );
    }
}
