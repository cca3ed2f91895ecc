package com.example.access.observability.metrics;

import com.example.access.common.util.StringSanitizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics of the access policy engine.
 * Tag values are bounded (no user or resource IDs) to keep cardinality low.
 */
@Component
public class AccessMetrics {

    private final MeterRegistry registry;

    private final Counter decisionAllowed;
    private final Counter decisionDenied;
    private final Counter cacheHit;
    private final Counter cacheMiss;
    private final Counter policySkipped;
    private final Timer evaluationTimer;

    public AccessMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.decisionAllowed = Counter.builder("abac.decision")
                .tag("result", "allowed")
                .description("ABAC decisions that allowed access")
                .register(registry);

        this.decisionDenied = Counter.builder("abac.decision")
                .tag("result", "denied")
                .description("ABAC decisions that denied access")
                .register(registry);

        this.cacheHit = Counter.builder("abac.cache")
                .tag("result", "hit")
                .description("ABAC decision cache hits")
                .register(registry);

        this.cacheMiss = Counter.builder("abac.cache")
                .tag("result", "miss")
                .description("ABAC decision cache misses")
                .register(registry);

        this.policySkipped = Counter.builder("abac.policy.skipped")
                .description("Policies skipped as malformed or failing during evaluation")
                .register(registry);

        this.evaluationTimer = Timer.builder("abac.evaluation")
                .description("Policy evaluation duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordDecision(boolean allowed, @Nullable String resourceType, @Nullable String action) {
        if (allowed) {
            decisionAllowed.increment();
        } else {
            decisionDenied.increment();
        }

        registry.counter("abac.decision.detailed",
                Tags.of("result", allowed ? "allowed" : "denied",
                        "resource_type", StringSanitizer.forTag(resourceType),
                        "action", StringSanitizer.forTag(action)))
                .increment();
    }

    public void recordEvaluation(long evaluationTimeMs, int skippedPolicies) {
        evaluationTimer.record(evaluationTimeMs, TimeUnit.MILLISECONDS);
        if (skippedPolicies > 0) {
            policySkipped.increment(skippedPolicies);
        }
    }

    public void recordCacheHit() {
        cacheHit.increment();
    }

    public void recordCacheMiss() {
        cacheMiss.increment();
    }

    public void recordFieldDenied(@Nullable String resourceType, @NonNull String mode, int fields) {
        if (fields <= 0) {
            return;
        }
        registry.counter("abac.field.denied",
                Tags.of("resource_type", StringSanitizer.forTag(resourceType), "mode", mode))
                .increment(fields);
    }
}
