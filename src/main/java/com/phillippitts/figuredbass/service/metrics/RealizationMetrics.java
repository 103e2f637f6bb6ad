package com.phillippitts.figuredbass.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for figured-bass realization.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Chain build latency</li>
 *   <li>Realizations generated and surviving pruning</li>
 *   <li>Successful and failed builds, failures tagged by reason</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class RealizationMetrics {

    private static final String METRIC_PREFIX = "figuredbass.realization";

    private final MeterRegistry registry;

    public RealizationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long one phase of a request took.
     *
     * @param phase         build, count, enumerate or sample
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String phase, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by a realization phase")
                .tag("phase", phase)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Adds to the realization counters of a built chain.
     *
     * @param generated realizations generated over all slots
     * @param surviving realizations left after pruning
     */
    public void recordRealizations(long generated, long surviving) {
        Counter.builder(METRIC_PREFIX + ".possibilities")
                .description("Number of realizations generated")
                .tag("stage", "generated")
                .register(registry)
                .increment(generated);
        Counter.builder(METRIC_PREFIX + ".possibilities")
                .description("Number of realizations generated")
                .tag("stage", "surviving")
                .register(registry)
                .increment(surviving);
    }

    public void incrementSuccess() {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of chains built")
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter.
     *
     * @param reason invalid_input, slot_infeasible, chain_infeasible, limit_exceeded or error
     */
    public void incrementFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed chain builds")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
