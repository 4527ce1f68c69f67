package com.foreman.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for autonomous feature execution.
 */
@Service
public class ForemanMetrics {

    private final MeterRegistry registry;

    public ForemanMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long a feature execution took.
     *
     * @param outcome "succeeded", "needs_approval", "failed" or "cancelled"
     */
    public void recordFeatureExecution(String outcome, long ms) {
        Timer.builder("foreman.feature.duration")
                .description("Feature pipeline execution time")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordDispatch(boolean success) {
        Counter.builder("foreman.scheduler.dispatches")
                .description("Features dispatched by auto loops")
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    /**
     * Records an auto loop paused by the consecutive-failure circuit breaker.
     *
     * @param errorType wire value of the error that triggered the pause
     */
    public void recordBreakerPause(String errorType) {
        Counter.builder("foreman.scheduler.breaker_pauses")
                .description("Auto loops paused after repeated failures")
                .tag("error_type", errorType)
                .register(registry)
                .increment();
    }

    public void recordIdle() {
        Counter.builder("foreman.scheduler.idle")
                .description("Scheduler ticks that found no eligible work")
                .register(registry)
                .increment();
    }

    public void recordRecoveredFeatures(int count) {
        Counter.builder("foreman.recovery.resumed_features")
                .description("Interrupted features re-enqueued after restart")
                .register(registry)
                .increment(count);
    }

    /**
     * Registers a gauge over the number of currently running features.
     */
    public void registerRunningFeaturesGauge(Supplier<Number> runningCount) {
        Gauge.builder("foreman.features.running", runningCount)
                .description("Features currently registered as running")
                .register(registry);
    }
}
