package com.hermes.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class HermesMetrics {

    private final MeterRegistry registry;

    public HermesMetrics() {
        this(new SimpleMeterRegistry());
    }

    public HermesMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter sessionsCreated() {
        return Counter.builder("hermes.sessions.created").register(registry);
    }

    public Counter claimsWon() {
        return Counter.builder("hermes.claims.won").register(registry);
    }

    public Counter claimsContended() {
        return Counter.builder("hermes.claims.contended").register(registry);
    }

    public Counter claimsReleased() {
        return Counter.builder("hermes.claims.released").register(registry);
    }

    public Counter commandsSent() {
        return Counter.builder("hermes.commands.sent").register(registry);
    }

    public Counter responsesCorrelated() {
        return Counter.builder("hermes.responses.correlated").register(registry);
    }
}
