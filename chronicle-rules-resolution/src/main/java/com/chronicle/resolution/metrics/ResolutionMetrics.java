package com.chronicle.resolution.metrics;

import com.chronicle.model.EntityType;
import com.chronicle.resolution.EffectExecutionResult;
import com.chronicle.resolution.ResolutionPhase;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Records effect and resolution metrics:
 * <ul>
 *   <li>{@code chronicle.effect.executions} counter, tags {@code phase} (pre, onResolve, post), {@code outcome}</li>
 *   <li>{@code chronicle.resolution} timer, tags {@code entityType}, {@code resolved}</li>
 * </ul>
 * Without an injected registry a shared {@link SimpleMeterRegistry} is created on first use (lock-free CAS)
 * and reused. Recording failures are logged and never reach the caller.
 */
public final class ResolutionMetrics {

    private static final Logger log = LoggerFactory.getLogger(ResolutionMetrics.class);
    private static final AtomicReference<MeterRegistry> DEFAULT_REGISTRY = new AtomicReference<>();

    public static final String EFFECT_EXECUTIONS = "chronicle.effect.executions";
    public static final String RESOLUTION_TIMER = "chronicle.resolution";

    private final MeterRegistry registry;

    public ResolutionMetrics() {
        this(null);
    }

    public ResolutionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    private static MeterRegistry defaultRegistry() {
        MeterRegistry existing = DEFAULT_REGISTRY.get();
        if (existing != null) {
            return existing;
        }
        MeterRegistry created = new SimpleMeterRegistry();
        if (DEFAULT_REGISTRY.compareAndSet(null, created)) {
            return created;
        }
        return DEFAULT_REGISTRY.get();
    }

    public MeterRegistry getRegistry() {
        return registry != null ? registry : defaultRegistry();
    }

    public void recordEffect(EffectExecutionResult result) {
        try {
            getRegistry().counter(EFFECT_EXECUTIONS,
                    "phase", ResolutionPhase.of(result.phase()).key(),
                    "outcome", result.outcome()
            ).increment();
        } catch (RuntimeException e) {
            log.warn("Metrics recordEffect failed | effectId={} | error={}", result.effectId(), e.getMessage());
        }
    }

    public void recordResolution(EntityType entityType, boolean resolved, long durationNanos) {
        try {
            Timer.builder(RESOLUTION_TIMER)
                    .tag("entityType", entityType != null ? entityType.name() : "unknown")
                    .tag("resolved", String.valueOf(resolved))
                    .register(getRegistry())
                    .record(durationNanos, TimeUnit.NANOSECONDS);
        } catch (RuntimeException e) {
            log.warn("Metrics recordResolution failed | entityType={} | error={}", entityType, e.getMessage());
        }
    }
}
