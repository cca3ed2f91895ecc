package com.example.access.authz.abac.service;

import com.example.access.authz.abac.model.Policy;
import com.example.access.authz.abac.model.PolicyEvaluationContext;
import com.example.access.authz.abac.model.PolicyEvaluationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Authorization that falls back to the policies of ancestor organizations.
 *
 * <p>The request is evaluated at its own organization first. If that level neither allows
 * nor explicitly denies, each ancestor is tried, nearest first, until one does. Ancestor
 * evaluations see {@code env.isInheritedPolicy = true} and
 * {@code env.originalOrganizationId}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HierarchicalAuthorizationService {

    public static final String INHERITED_POLICY_ATTRIBUTE = "isInheritedPolicy";
    public static final String ORIGINAL_ORGANIZATION_ATTRIBUTE = "originalOrganizationId";
    public static final String CROSS_ORGANIZATION_ATTRIBUTE = "isCrossOrganizationAccess";
    public static final String TARGET_ORGANIZATION_ATTRIBUTE = "targetOrganizationId";
    public static final String SOURCE_ORGANIZATION_ATTRIBUTE = "sourceOrganizationId";
    static final String NO_MATCH_IN_HIERARCHY = "No matching policies found in organization hierarchy";

    private final AbacAuthorizationService authorizationService;
    private final OrganizationHierarchy organizationHierarchy;

    public Mono<PolicyEvaluationResult> authorize(PolicyEvaluationContext context) {
        String organizationId = context.organizationId();
        return authorizationService.authorize(context).flatMap(direct -> {
            if (direct.allowed() || direct.hasExplicitDeny() || organizationId == null) {
                return Mono.just(direct);
            }
            return organizationHierarchy.ancestorsOf(organizationId)
                    .filter(ancestor -> !ancestor.equals(organizationId))
                    .concatMap(ancestor -> authorizationService.authorize(inheritedContext(context, ancestor))
                            .map(result -> new LevelResult(ancestor, result)))
                    .filter(level -> level.result().allowed() || level.result().hasExplicitDeny())
                    .next()
                    .map(level -> {
                        log.debug("Decision inherited from organization {} for org {}", level.organizationId(),
                                organizationId);
                        String verb = level.result().allowed() ? "Allowed" : "Denied";
                        return level.result().withReason(
                                verb + " by inherited policy from organization: " + level.organizationId());
                    })
                    .defaultIfEmpty(new PolicyEvaluationResult(false, List.of(), List.of(),
                            List.of(NO_MATCH_IN_HIERARCHY), direct.warnings(), direct.evaluationTimeMs()));
        });
    }

    /**
     * Access by a member of the context organization to a resource owned by another
     * organization. Both organizations, each with its hierarchy, must allow it.
     */
    public Mono<PolicyEvaluationResult> authorizeCrossOrganization(PolicyEvaluationContext context,
                                                                   String targetOrganizationId) {
        PolicyEvaluationContext crossContext = crossOrganizationContext(context, targetOrganizationId);

        return authorize(crossContext).flatMap(source -> {
            if (!source.allowed()) {
                return Mono.just(source.withReason("Cross-organization access denied by source organization"));
            }
            PolicyEvaluationContext targetContext = targetContext(crossContext, context.organizationId(),
                    targetOrganizationId);
            return authorize(targetContext).map(target -> {
                if (!target.allowed()) {
                    return target.withReason("Cross-organization access denied by target organization");
                }
                List<Policy> matched = new ArrayList<>(source.matchedPolicies());
                matched.addAll(target.matchedPolicies());
                List<String> reasons = new ArrayList<>();
                reasons.add("Cross-organization access allowed by both organizations");
                reasons.addAll(source.reasons());
                reasons.addAll(target.reasons());
                List<String> warnings = new ArrayList<>(source.warnings());
                warnings.addAll(target.warnings());
                return new PolicyEvaluationResult(true, matched, List.of(), reasons, warnings,
                        source.evaluationTimeMs() + target.evaluationTimeMs());
            });
        });
    }

    static PolicyEvaluationContext inheritedContext(PolicyEvaluationContext context, String ancestorId) {
        Map<String, Object> inherited = new LinkedHashMap<>();
        inherited.put(INHERITED_POLICY_ATTRIBUTE, Boolean.TRUE);
        inherited.put(ORIGINAL_ORGANIZATION_ATTRIBUTE, context.organizationId());
        return context.withOrganization(ancestorId).withEnvironmentAttributes(inherited);
    }

    private static PolicyEvaluationContext crossOrganizationContext(PolicyEvaluationContext context,
                                                                    String targetOrganizationId) {
        Map<String, Object> resourceAttributes = new LinkedHashMap<>(context.resource().attributes());
        resourceAttributes.put(TARGET_ORGANIZATION_ATTRIBUTE, targetOrganizationId);
        PolicyEvaluationContext.Resource resource = new PolicyEvaluationContext.Resource(
                context.resource().type(), context.resource().id(), resourceAttributes);
        return new PolicyEvaluationContext(context.subject(), resource, context.action(),
                context.environment(), context.organizationId())
                .withEnvironmentAttributes(Map.of(CROSS_ORGANIZATION_ATTRIBUTE, Boolean.TRUE));
    }

    private static PolicyEvaluationContext targetContext(PolicyEvaluationContext crossContext,
                                                         String sourceOrganizationId,
                                                         String targetOrganizationId) {
        Map<String, Object> subjectAttributes = new LinkedHashMap<>(crossContext.subject().attributes());
        subjectAttributes.put(SOURCE_ORGANIZATION_ATTRIBUTE, sourceOrganizationId);
        PolicyEvaluationContext.Subject subject = new PolicyEvaluationContext.Subject(
                crossContext.subject().id(), crossContext.subject().roles(), crossContext.subject().groups(),
                subjectAttributes);
        return new PolicyEvaluationContext(subject, crossContext.resource(), crossContext.action(),
                crossContext.environment(), targetOrganizationId);
    }

    private record LevelResult(String organizationId, PolicyEvaluationResult result) {}
}
