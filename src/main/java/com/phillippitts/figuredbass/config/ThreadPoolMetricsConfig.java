package com.phillippitts.figuredbass.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes realizer thread pool gauges via Micrometer:
 * <ul>
 *   <li>realizer.pool.size - current number of threads</li>
 *   <li>realizer.pool.active - threads running generation tasks</li>
 *   <li>realizer.pool.queued - tasks waiting in the queue</li>
 *   <li>realizer.pool.completed - cumulative completed tasks</li>
 * </ul>
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> realizerExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("realizerExecutor") ObjectProvider<ThreadPoolTaskExecutor> realizerExecutorProvider) {
        this.realizerExecutorProvider = realizerExecutorProvider;
    }

    /**
     * Binds realizer executor metrics to the Micrometer registry.
     *
     * @return MeterBinder that registers the pool gauges
     */
    @Bean
    public MeterBinder realizerExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = realizerExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("realizer.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the realizer pool")
                    .register(registry);

            Gauge.builder("realizer.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively generating slots or movements")
                    .register(registry);

            Gauge.builder("realizer.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of generation tasks waiting in the queue")
                    .register(registry);

            Gauge.builder("realizer.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed generation tasks")
                    .register(registry);

            LOG.info("Realizer thread pool metrics registered: realizer.pool.*");
        };
    }
}
