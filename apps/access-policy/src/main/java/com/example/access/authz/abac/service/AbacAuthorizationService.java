package com.example.access.authz.abac.service;

import com.example.access.authz.abac.engine.PolicyEvaluator;
import com.example.access.authz.abac.field.FieldFilter;
import com.example.access.authz.abac.field.FieldPermissionResolver;
import com.example.access.authz.abac.model.EffectiveFieldPermissions;
import com.example.access.authz.abac.model.FieldPermission;
import com.example.access.authz.abac.model.Policy;
import com.example.access.authz.abac.model.PolicyEvaluationContext;
import com.example.access.authz.abac.model.PolicyEvaluationResult;
import com.example.access.authz.abac.model.PolicyTrace;
import com.example.access.authz.abac.store.PolicyStore;
import com.example.access.authz.audit.AuthzAuditService;
import com.example.access.config.properties.AccessPolicyProperties;
import com.example.access.exception.AccessDeniedException;
import com.example.access.observability.metrics.AccessMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * ABAC authorization service.
 * Evaluates requests against the current policy snapshot (cached) or a caller-supplied
 * policy list, records metrics and audit events, and applies field permissions.
 */
@Slf4j
@Service
public class AbacAuthorizationService {

    private final PolicyStore policyStore;
    private final PolicyEvaluator policyEvaluator;
    private final CachedPolicyEvaluator cachedEvaluator;
    private final FieldPermissionResolver fieldPermissionResolver;
    private final FieldFilter fieldFilter;
    private final AccessMetrics metrics;
    private final Map<String, FieldPermission> baseFieldPermissions;

    @Nullable
    private final AuthzAuditService auditService;

    public AbacAuthorizationService(
            PolicyStore policyStore,
            PolicyEvaluator policyEvaluator,
            CachedPolicyEvaluator cachedEvaluator,
            FieldPermissionResolver fieldPermissionResolver,
            FieldFilter fieldFilter,
            AccessMetrics metrics,
            AccessPolicyProperties properties,
            @Nullable AuthzAuditService auditService) {
        this.policyStore = policyStore;
        this.policyEvaluator = policyEvaluator;
        this.cachedEvaluator = cachedEvaluator;
        this.fieldPermissionResolver = fieldPermissionResolver;
        this.fieldFilter = fieldFilter;
        this.metrics = metrics;
        this.baseFieldPermissions = properties.fieldPermissions().base();
        this.auditService = auditService;
    }

    /**
     * Evaluate the request against the current policy snapshot.
     *
     * @param context the request
     * @return Mono emitting the evaluation result
     */
    public Mono<PolicyEvaluationResult> authorize(PolicyEvaluationContext context) {
        return cachedEvaluator.evaluate(policyStore.snapshot(), context)
                .doOnNext(result -> recordDecision(context, result));
    }

    /**
     * Evaluate the request against a caller-supplied policy list. Not cached.
     */
    public Mono<PolicyEvaluationResult> authorize(List<Policy> policies, PolicyEvaluationContext context) {
        return Mono.fromCallable(() -> policyEvaluator.evaluate(policies, context))
                .doOnNext(result -> {
                    metrics.recordEvaluation(result.evaluationTimeMs(), result.warnings().size());
                    recordDecision(context, result);
                });
    }

    /**
     * Evaluate several requests, emitting results in request order.
     */
    public Flux<PolicyEvaluationResult> authorizeAll(List<PolicyEvaluationContext> contexts) {
        return Flux.fromIterable(contexts).concatMap(this::authorize);
    }

    /**
     * Check if access is allowed (convenience method).
     */
    public Mono<Boolean> isAllowed(PolicyEvaluationContext context) {
        return authorize(context).map(PolicyEvaluationResult::allowed);
    }

    /**
     * Evaluate the request, signalling {@link AccessDeniedException} when it is denied.
     */
    public Mono<PolicyEvaluationResult> requireAllowed(PolicyEvaluationContext context) {
        return authorize(context).flatMap(result -> result.allowed()
                ? Mono.just(result)
                : Mono.error(new AccessDeniedException(context.action(), context.resource().type(), result)));
    }

    /**
     * Effective field permissions for an evaluated request.
     */
    public EffectiveFieldPermissions resolveFields(PolicyEvaluationContext context, PolicyEvaluationResult result) {
        return fieldPermissionResolver.resolveFieldPermissions(context.resource().type(), baseFieldPermissions, result);
    }

    /**
     * Remove the fields the caller may not read from a response payload. Removed fields are
     * audited and counted.
     */
    public Map<String, Object> filterReadable(PolicyEvaluationContext context,
                                              PolicyEvaluationResult result,
                                              Map<String, Object> payload) {
        EffectiveFieldPermissions permissions = resolveFields(context, result);
        List<String> removed = fieldFilter.unreadableFields(payload, permissions);
        recordFieldDenial(context, AuthzAuditService.FIELD_MODE_READ, removed);
        return fieldFilter.filterReadable(payload, permissions);
    }

    /**
     * Fields of an incoming payload the caller may not write. Rejected fields are audited
     * and counted.
     */
    public List<String> checkWritable(PolicyEvaluationContext context,
                                      PolicyEvaluationResult result,
                                      Map<String, Object> payload) {
        EffectiveFieldPermissions permissions = resolveFields(context, result);
        List<String> rejected = fieldFilter.checkWritable(payload, permissions);
        recordFieldDenial(context, AuthzAuditService.FIELD_MODE_WRITE, rejected);
        return rejected;
    }

    /**
     * Explain whether a stored policy applies to the request. Empty when no policy has the ID.
     */
    public Mono<PolicyTrace> explain(String policyId, PolicyEvaluationContext context) {
        return Mono.justOrEmpty(policyStore.snapshot().findById(policyId))
                .map(policy -> policyEvaluator.explain(policy, context))
                .doOnNext(trace -> log.debug("Policy {} trace: applicable={}, failed={}",
                        policyId, trace.applicable(), trace.failedConditions()));
    }

    private void recordDecision(PolicyEvaluationContext context, PolicyEvaluationResult result) {
        metrics.recordDecision(result.allowed(), context.resource().type(), context.action());
        if (!result.warnings().isEmpty()) {
            log.warn("Evaluation completed with {} skipped policies: {}", result.warnings().size(), result.warnings());
        }
        if (auditService != null) {
            auditService.logDecision(context, result, correlationId(context));
        }
    }

    private void recordFieldDenial(PolicyEvaluationContext context, String mode, List<String> fields) {
        if (fields.isEmpty()) {
            return;
        }
        metrics.recordFieldDenied(context.resource().type(), mode, fields.size());
        if (auditService != null) {
            auditService.logFieldDenial(context, mode, fields, correlationId(context));
        }
    }

    @Nullable
    private static String correlationId(PolicyEvaluationContext context) {
        Object value = context.environment().attributes().get(PolicyEvaluationContext.Environment.CORRELATION_ID);
        return value != null ? value.toString() : null;
    }
}
