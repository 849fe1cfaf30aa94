package com.hagglehub.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig() {
        this(new SimpleMeterRegistry());
    }

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter webhooksReceived() {
        return Counter.builder("hagglehub.webhook.received").register(registry);
    }

    public Counter matches(String strategy) {
        return Counter.builder("hagglehub.match")
                .tag("strategy", strategy)
                .register(registry);
    }

    public Counter dispositions(String kind, String reason) {
        return Counter.builder("hagglehub.disposition")
                .tag("kind", kind)
                .tag("reason", reason)
                .register(registry);
    }

    public Counter dispatches(String status) {
        return Counter.builder("hagglehub.dispatch")
                .tag("status", status)
                .register(registry);
    }

    public Timer resolutionLatency() {
        return Timer.builder("hagglehub.resolution.latency").register(registry);
    }
}
