package com.example.access.authz.abac.service;

import com.example.access.authz.abac.engine.PolicyEvaluator;
import com.example.access.authz.abac.model.AttributeCondition;
import com.example.access.authz.abac.model.Policy;
import com.example.access.authz.abac.model.PolicyEvaluationContext;
import com.example.access.authz.abac.model.PolicyEvaluationResult;
import com.example.access.authz.abac.store.PolicySnapshot;
import com.example.access.config.properties.AccessPolicyProperties;
import com.example.access.observability.metrics.AccessMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Caches evaluation results per (policy snapshot version, request).
 *
 * <p>The key is a SHA-256 digest of the snapshot version and a canonical form of the
 * context in which map entries and role/group lists are sorted and the correlation ID is
 * left out. The timestamp is truncated to the minute, the resolution of time windows, unless
 * a policy of the snapshot compares {@code env.timestamp} in a condition. Such snapshots
 * key on the exact instant.
 * Publishing a new snapshot changes the version and so never serves results computed
 * against older policies.
 */
@Slf4j
@Service
public class CachedPolicyEvaluator {

    private static final String CACHE_NAME = "abac:decisions";
    private static final Pattern TIMESTAMP_PATH =
            Pattern.compile("^\\s*(?:\\$\\{\\s*)?(?:env|environment)\\.timestamp\\s*}?\\s*$");
    private static final Pattern TIMESTAMP_PLACEHOLDER =
            Pattern.compile("\\$\\{\\s*(?:env|environment)\\.timestamp\\s*}");

    private final PolicyEvaluator policyEvaluator;
    private final AccessMetrics metrics;
    private final ObjectMapper canonicalMapper;
    private final boolean enabled;
    private final Cache<String, PolicyEvaluationResult> cache;
    private volatile TimestampPrecision timestampPrecision = new TimestampPrecision(null, false);

    public CachedPolicyEvaluator(
            PolicyEvaluator policyEvaluator,
            AccessMetrics metrics,
            ObjectMapper objectMapper,
            AccessPolicyProperties properties) {

        this.policyEvaluator = policyEvaluator;
        this.metrics = metrics;
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

        AccessPolicyProperties.CacheProperties cacheProperties = properties.cache();
        this.enabled = cacheProperties.enabled();
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheProperties.ttl())
                .maximumSize(cacheProperties.maxEntries())
                .build();

        log.info("Policy evaluation cache {} (ttl={}, max-entries={})",
                enabled ? "enabled" : "disabled", cacheProperties.ttl(), cacheProperties.maxEntries());
    }

    /**
     * Evaluate the snapshot against the request, serving a cached result when one exists.
     */
    @NonNull
    public Mono<PolicyEvaluationResult> evaluate(@NonNull PolicySnapshot snapshot,
                                                 @NonNull PolicyEvaluationContext context) {
        return Mono.fromCallable(() -> evaluateNow(snapshot, context));
    }

    PolicyEvaluationResult evaluateNow(PolicySnapshot snapshot, PolicyEvaluationContext context) {
        if (!enabled) {
            return evaluateUncached(snapshot, context);
        }
        Optional<String> key = cacheKey(snapshot.version(), context, needsExactTimestamp(snapshot));
        if (key.isEmpty()) {
            return evaluateUncached(snapshot, context);
        }

        PolicyEvaluationResult cached = cache.getIfPresent(key.get());
        if (cached != null) {
            log.debug("Cache hit for key: {}:{}", CACHE_NAME, key.get());
            metrics.recordCacheHit();
            return cached;
        }

        metrics.recordCacheMiss();
        PolicyEvaluationResult result = evaluateUncached(snapshot, context);
        log.debug("Cache miss for key: {}:{}, caching result", CACHE_NAME, key.get());
        cache.put(key.get(), result);
        return result;
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.info("Policy evaluation cache cleared");
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    private PolicyEvaluationResult evaluateUncached(PolicySnapshot snapshot, PolicyEvaluationContext context) {
        PolicyEvaluationResult result = policyEvaluator.evaluate(snapshot.policies(), context);
        metrics.recordEvaluation(result.evaluationTimeMs(), result.warnings().size());
        return result;
    }

    /**
     * Empty when the context cannot be serialized, in which case the request is evaluated
     * without caching.
     */
    Optional<String> cacheKey(long version, PolicyEvaluationContext context) {
        return cacheKey(version, context, false);
    }

    Optional<String> cacheKey(long version, PolicyEvaluationContext context, boolean exactTimestamp) {
        try {
            Map<String, Object> canonical = new LinkedHashMap<>();
            canonical.put("version", version);
            canonical.put("context", canonicalContext(context, exactTimestamp));
            byte[] json = canonicalMapper.writeValueAsBytes(canonical);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            return Optional.of(HexFormat.of().formatHex(digest));
        } catch (JsonProcessingException e) {
            log.warn("Context not cacheable, evaluating directly: {}", e.getOriginalMessage());
            return Optional.empty();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private boolean needsExactTimestamp(PolicySnapshot snapshot) {
        TimestampPrecision current = timestampPrecision;
        if (current.snapshot() != snapshot) {
            current = new TimestampPrecision(snapshot, referencesTimestamp(snapshot.policies()));
            timestampPrecision = current;
            if (current.exact()) {
                log.debug("Snapshot version {} conditions on env.timestamp, keying on the exact instant",
                        snapshot.version());
            }
        }
        return current.exact();
    }

    /**
     * True when a custom or resource attribute condition reads {@code env.timestamp}, either
     * as its attribute path or through a placeholder in its value.
     */
    static boolean referencesTimestamp(Collection<Policy> policies) {
        return policies.stream()
                .filter(Objects::nonNull)
                .flatMap(policy -> Stream.concat(
                        policy.conditions().customConditions().stream(),
                        policy.resources().attributes().stream()))
                .filter(Objects::nonNull)
                .anyMatch(CachedPolicyEvaluator::readsTimestamp);
    }

    private static boolean readsTimestamp(AttributeCondition condition) {
        return (condition.attribute() != null && TIMESTAMP_PATH.matcher(condition.attribute()).matches())
                || valueReadsTimestamp(condition.value());
    }

    private static boolean valueReadsTimestamp(Object value) {
        if (value instanceof String text) {
            return TIMESTAMP_PLACEHOLDER.matcher(text).find();
        }
        if (value instanceof Collection<?> values) {
            return values.stream().anyMatch(CachedPolicyEvaluator::valueReadsTimestamp);
        }
        return false;
    }

    private static Map<String, Object> canonicalContext(PolicyEvaluationContext context, boolean exactTimestamp) {
        Map<String, Object> subject = new TreeMap<>();
        subject.put("id", context.subject().id());
        subject.put("roles", sorted(context.subject().roles()));
        subject.put("groups", sorted(context.subject().groups()));
        subject.put("attributes", context.subject().attributes());

        Map<String, Object> resource = new TreeMap<>();
        resource.put("type", context.resource().type());
        resource.put("id", context.resource().id());
        resource.put("attributes", context.resource().attributes());

        PolicyEvaluationContext.Environment env = context.environment();
        Map<String, Object> environment = new TreeMap<>();
        if (env.timestamp() == null) {
            environment.put("timestamp", null);
        } else {
            environment.put("timestamp", exactTimestamp
                    ? env.timestamp().toString()
                    : env.timestamp().truncatedTo(ChronoUnit.MINUTES).toString());
        }
        environment.put("ipAddress", env.ipAddress());
        environment.put("location", env.location());
        Map<String, Object> envAttributes = new TreeMap<>(env.attributes());
        envAttributes.remove(PolicyEvaluationContext.Environment.CORRELATION_ID);
        environment.put("attributes", envAttributes);

        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("subject", subject);
        canonical.put("resource", resource);
        canonical.put("action", context.action());
        canonical.put("environment", environment);
        canonical.put("organizationId", context.organizationId());
        return canonical;
    }

    private static List<String> sorted(List<String> values) {
        return values.stream().sorted().toList();
    }

    private record TimestampPrecision(PolicySnapshot snapshot, boolean exact) {
    }
}
