package com.framesmith.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for Framesmith generation jobs.
 */
@Service
public class FramesmithMetrics {

    private final MeterRegistry registry;

    public FramesmithMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a single oracle call.
     *
     * @param outcome "success", "transient", "rejected", "parse_error" or "timeout"
     */
    public void recordOracleCall(String outcome, long ms) {
        Counter.builder("framesmith.oracle.calls")
                .description("Code oracle calls by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder("framesmith.oracle.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordScreenResult(String status) {
        Counter.builder("framesmith.screens.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRegistryCollision() {
        Counter.builder("framesmith.registry.collisions")
                .description("Component registrations rejected by first-writer-wins")
                .register(registry)
                .increment();
    }

    public void recordJobResult(String status, String mode) {
        Counter.builder("framesmith.jobs.total")
                .tag("status", status)
                .tag("mode", mode)
                .register(registry)
                .increment();
    }

    public void recordJobCost(long costUnits) {
        DistributionSummary.builder("framesmith.job.cost_units")
                .description("Oracle usage units consumed per job")
                .register(registry)
                .record(costUnits);
    }

    public void recordScreenCount(int screens) {
        DistributionSummary.builder("framesmith.job.screens")
                .description("Screens extracted per job")
                .register(registry)
                .record(screens);
    }
}
