package com.presentos.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for message routing.
 */
@Service
public class RouterMetrics {

    private final MeterRegistry registry;

    public RouterMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome "ok", "unavailable" or "malformed"
     */
    public void recordClassification(long ms, String outcome) {
        Timer.builder("presentos.classification.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordIntent(String intent) {
        Counter.builder("presentos.intents.total")
                .tag("intent", intent)
                .register(registry)
                .increment();
    }

    public void recordForward(String handler, int status, long ms) {
        Timer.builder("presentos.forward.duration")
                .description("Downstream handler call latency")
                .tag("handler", handler)
                .tag("outcome", status >= 200 && status < 300 ? "success" : "error")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPatch(String field, boolean success) {
        Counter.builder("presentos.patches.total")
                .description("Best-effort task store patches")
                .tag("field", field)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordOutcome(String status) {
        Counter.builder("presentos.outcomes.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
