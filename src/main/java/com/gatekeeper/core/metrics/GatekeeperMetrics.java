package com.gatekeeper.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for gate decisions, the validation cache and tool runs.
 */
@Service
public class GatekeeperMetrics {

    private final MeterRegistry registry;

    public GatekeeperMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDecision(String gate, boolean approved, long ms) {
        Counter.builder("gatekeeper.gate.decisions")
                .tag("gate", gate)
                .tag("result", approved ? "approved" : "blocked")
                .register(registry)
                .increment();
        Timer.builder("gatekeeper.gate.duration")
                .tag("gate", gate)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordInternalFault(String gate) {
        Counter.builder("gatekeeper.gate.internal_faults")
                .description("Gate evaluations that failed internally and resolved fail-open")
                .tag("gate", gate)
                .register(registry)
                .increment();
    }

    public void recordCacheLookup(boolean hit) {
        Counter.builder("gatekeeper.cache.lookups")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordToolRun(String tool, String status, long ms) {
        Timer.builder("gatekeeper.tool.duration")
                .tag("tool", tool)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param category rule id of the matched classifier category
     */
    public void recordClassifierMatch(String category) {
        Counter.builder("gatekeeper.classifier.matches")
                .tag("category", category)
                .register(registry)
                .increment();
    }
}
