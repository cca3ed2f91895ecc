package com.example.access.authz.abac.engine;

import com.example.access.authz.abac.model.Policy;
import com.example.access.authz.abac.model.PolicyEvaluationContext;
import com.example.access.authz.abac.model.PolicyEvaluationResult;
import com.example.access.authz.abac.model.PolicyTrace;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * ABAC decision engine - evaluates a policy set against one request.
 *
 * <p>Combining algorithm: priority first, deny-overrides within a priority tier.
 * <ol>
 *   <li>Malformed and inactive policies are skipped.</li>
 *   <li>Candidates are policies whose subject, resource, action and organization match and
 *       whose conditions all hold.</li>
 *   <li>No candidate: default deny.</li>
 *   <li>Candidates are ordered by priority, highest first; ties keep input order.</li>
 *   <li>The highest-priority tier decides: any DENY in it denies, otherwise allow.</li>
 * </ol>
 *
 * <p>The evaluator holds no mutable state and performs no I/O. It never throws: a policy
 * that fails to evaluate is skipped and reported in {@link PolicyEvaluationResult#warnings()}.
 */
@Slf4j
public final class PolicyEvaluator {

    private static final Comparator<Policy> BY_PRIORITY_DESC =
            Comparator.comparingInt(Policy::priority).reversed();

    private final PolicyMatcher matcher;
    private final ConditionEvaluator conditionEvaluator;

    public PolicyEvaluator(PolicyMatcher matcher, ConditionEvaluator conditionEvaluator) {
        this.matcher = matcher;
        this.conditionEvaluator = conditionEvaluator;
    }

    /**
     * Evaluate all policies and return the access decision.
     *
     * @param policies policy snapshot, in store order
     * @param context  the request
     * @return decision with the policies and reasons behind it
     */
    public PolicyEvaluationResult evaluate(List<Policy> policies, PolicyEvaluationContext context) {
        long started = System.nanoTime();
        List<String> warnings = new ArrayList<>();
        if (context == null) {
            warnings.add("evaluation context is missing");
            return PolicyEvaluationResult.defaultDeny(warnings, elapsedMs(started));
        }
        List<Policy> source = policies != null ? policies : List.of();

        log.debug("Evaluating access: subject={}, resource={}/{}, action={}, org={}, policies={}",
                context.subject().id(), context.resource().type(), context.resource().id(),
                context.action(), context.organizationId(), source.size());

        List<Policy> applicable = new ArrayList<>();
        for (Policy policy : source) {
            Optional<String> problem = PolicyValidator.problem(policy);
            if (problem.isPresent()) {
                log.warn("Skipping malformed policy: {}", problem.get());
                warnings.add("skipped: " + problem.get());
                continue;
            }
            try {
                if (matcher.isCandidate(policy, context)
                        && conditionEvaluator.conditionsHold(policy.conditions(), context)) {
                    applicable.add(policy);
                }
            } catch (RuntimeException e) {
                log.warn("Policy {} failed to evaluate, skipping: {}", policy.id(), e.toString());
                warnings.add("failed: policy " + policy.id() + ": " + e.getMessage());
            }
        }

        if (applicable.isEmpty()) {
            log.debug("No applicable policy: subject={}, resource={}, action={}",
                    context.subject().id(), context.resource().type(), context.action());
            return PolicyEvaluationResult.defaultDeny(warnings, elapsedMs(started));
        }

        // List.sort is stable, so equal priorities keep store order
        applicable.sort(BY_PRIORITY_DESC);
        int topPriority = applicable.get(0).priority();
        List<Policy> topTier = applicable.stream()
                .filter(p -> p.priority() == topPriority)
                .toList();
        List<Policy> denies = topTier.stream().filter(Policy::isDeny).toList();
        boolean allowed = denies.isEmpty();
        List<Policy> deciding = allowed ? topTier : denies;

        List<String> reasons = deciding.stream()
                .map(p -> reason(p, context))
                .toList();

        log.debug("Access {} at priority {} by {}", allowed ? "allowed" : "denied", topPriority,
                deciding.stream().map(Policy::id).toList());

        return new PolicyEvaluationResult(allowed, applicable, allowed ? List.of() : denies, reasons,
                warnings, elapsedMs(started));
    }

    /**
     * Explain whether a single policy applies to a request. Every step is computed, so the
     * trace shows all reasons a policy does not apply rather than the first one.
     */
    public PolicyTrace explain(Policy policy, PolicyEvaluationContext context) {
        Optional<String> problem = PolicyValidator.problem(policy);
        if (problem.isPresent()) {
            return PolicyTrace.malformed(policy != null ? policy.id() : null, problem.get());
        }
        if (context == null) {
            return PolicyTrace.malformed(policy.id(), "evaluation context is missing");
        }
        try {
            return new PolicyTrace(
                    policy.id(),
                    null,
                    policy.active(),
                    matcher.organizationMatches(policy, context.organizationId()),
                    matcher.subjectMatches(policy.subjects(), context.subject()),
                    matcher.resourceMatches(policy.resources(), context),
                    matcher.actionMatches(policy.actions(), context.action()),
                    conditionEvaluator.failedConditions(policy.conditions(), context));
        } catch (RuntimeException e) {
            log.warn("Policy {} failed to evaluate: {}", policy.id(), e.toString());
            return PolicyTrace.malformed(policy.id(), "evaluation failed: " + e.getMessage());
        }
    }

    static String reason(Policy policy, PolicyEvaluationContext context) {
        return "Policy '" + policy.displayName() + "' (priority " + policy.priority() + ") "
                + policy.effect().verb() + " action '" + context.action()
                + "' on '" + context.resource().type() + "'";
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
