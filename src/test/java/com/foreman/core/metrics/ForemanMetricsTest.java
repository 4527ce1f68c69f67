package com.foreman.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ForemanMetricsTest {

    private SimpleMeterRegistry registry;
    private ForemanMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ForemanMetrics(registry);
    }

    @Test
    @DisplayName("recordFeatureExecution records a timer per outcome")
    void recordFeatureExecution() {
        metrics.recordFeatureExecution("succeeded", 1200);
        metrics.recordFeatureExecution("succeeded", 800);
        metrics.recordFeatureExecution("failed", 50);

        var succeeded = registry.find("foreman.feature.duration").tag("outcome", "succeeded").timer();
        var failed = registry.find("foreman.feature.duration").tag("outcome", "failed").timer();
        assertNotNull(succeeded);
        assertNotNull(failed);
        assertEquals(2, succeeded.count());
        assertEquals(1, failed.count());
    }

    @Test
    @DisplayName("recordDispatch counts by success tag")
    void recordDispatch() {
        metrics.recordDispatch(true);
        metrics.recordDispatch(true);
        metrics.recordDispatch(false);

        assertEquals(2.0, registry.find("foreman.scheduler.dispatches").tag("success", "true").counter().count());
        assertEquals(1.0, registry.find("foreman.scheduler.dispatches").tag("success", "false").counter().count());
    }

    @Test
    @DisplayName("recordBreakerPause tags the error type")
    void recordBreakerPause() {
        metrics.recordBreakerPause("quota_exhausted");
        var counter = registry.find("foreman.scheduler.breaker_pauses").tag("error_type", "quota_exhausted").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordIdle and recordRecoveredFeatures increment counters")
    void idleAndRecovery() {
        metrics.recordIdle();
        metrics.recordRecoveredFeatures(3);
        assertEquals(1.0, registry.find("foreman.scheduler.idle").counter().count());
        assertEquals(3.0, registry.find("foreman.recovery.resumed_features").counter().count());
    }

    @Test
    @DisplayName("running features gauge follows the supplier")
    void runningGauge() {
        var running = new AtomicInteger(2);
        metrics.registerRunningFeaturesGauge(running::get);
        assertEquals(2.0, registry.find("foreman.features.running").gauge().value());
        running.set(5);
        assertEquals(5.0, registry.find("foreman.features.running").gauge().value());
    }
}
