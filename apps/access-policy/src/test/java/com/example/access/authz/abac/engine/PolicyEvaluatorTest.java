package com.example.access.authz.abac.engine;

import com.example.access.authz.abac.model.AttributeCondition;
import com.example.access.authz.abac.model.ConditionOperator;
import com.example.access.authz.abac.model.Policy;
import com.example.access.authz.abac.model.PolicyEffect;
import com.example.access.authz.abac.model.PolicyEvaluationContext;
import com.example.access.authz.abac.model.PolicyEvaluationResult;
import com.example.access.authz.abac.model.PolicyResources;
import com.example.access.authz.abac.model.PolicyTrace;
import com.example.access.authz.abac.model.TimeWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.access.util.EvaluationContextTestBuilder.aContext;
import static com.example.access.util.PolicyTestBuilder.aDenyPolicy;
import static com.example.access.util.PolicyTestBuilder.aPolicy;
import static com.example.access.util.PolicyTestBuilder.anAllowPolicy;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PolicyEvaluator")
class PolicyEvaluatorTest {

    private PolicyEvaluator evaluator;

    @BeforeEach
    void setUp() {
        ConditionEvaluator conditions = new ConditionEvaluator();
        evaluator = new PolicyEvaluator(new PolicyMatcher(conditions, MatchingOptions.defaults()), conditions);
    }

    @Nested
    @DisplayName("Decision")
    class Decision {

        @Test
        @DisplayName("should deny with 'no matching policy' when policy set is empty")
        void shouldDenyWhenNoPolicies() {
            PolicyEvaluationResult result = evaluator.evaluate(List.of(), aContext().build());

            assertThat(result.allowed()).isFalse();
            assertThat(result.matchedPolicies()).isEmpty();
            assertThat(result.deniedPolicies()).isEmpty();
            assertThat(result.reasons()).containsExactly("no matching policy");
        }

        @Test
        @DisplayName("should deny by default when no policy matches the action")
        void shouldDenyWhenNothingMatches() {
            Policy policy = anAllowPolicy("p1").withActions("write").build();

            PolicyEvaluationResult result = evaluator.evaluate(List.of(policy), aContext().withAction("read").build());

            assertThat(result.allowed()).isFalse();
            assertThat(result.reasons()).containsExactly(PolicyEvaluationResult.NO_MATCHING_POLICY);
        }

        @Test
        @DisplayName("should allow when a matching allow policy exists")
        void shouldAllowWhenAllowPolicyMatches() {
            Policy policy = anAllowPolicy("p1").withName("Readers").withPriority(50).build();

            PolicyEvaluationResult result = evaluator.evaluate(List.of(policy), aContext().build());

            assertThat(result.allowed()).isTrue();
            assertThat(result.matchedPolicies()).containsExactly(policy);
            assertThat(result.deniedPolicies()).isEmpty();
            assertThat(result.reasons()).containsExactly("Policy 'Readers' (priority 50) allows action 'read' on 'document'");
        }

        @Test
        @DisplayName("should deny when allow and deny tie at the top priority")
        void shouldDenyOnTieAtEqualPriority() {
            Policy allow = anAllowPolicy("allow").withPriority(100).build();
            Policy deny = aDenyPolicy("deny").withPriority(100).build();

            PolicyEvaluationResult result = evaluator.evaluate(List.of(allow, deny), aContext().build());

            assertThat(result.allowed()).isFalse();
            assertThat(result.deniedPolicies()).containsExactly(deny);
            assertThat(result.matchedPolicies()).containsExactly(allow, deny);
            assertThat(result.reasons()).containsExactly("Policy 'deny' (priority 100) denies action 'read' on 'document'");
        }

        @Test
        @DisplayName("should let a higher-priority allow override a lower-priority deny")
        void shouldPreferHigherPriority() {
            Policy allow = anAllowPolicy("allow").withPriority(200).build();
            Policy deny = aDenyPolicy("deny").withPriority(100).build();

            PolicyEvaluationResult result = evaluator.evaluate(List.of(deny, allow), aContext().build());

            assertThat(result.allowed()).isTrue();
            assertThat(result.deniedPolicies()).isEmpty();
            assertThat(result.matchedPolicies()).containsExactly(allow, deny);
        }

        @Test
        @DisplayName("should let a higher-priority deny override a lower-priority allow")
        void shouldDenyWhenDenyHasHigherPriority() {
            Policy allow = anAllowPolicy("allow").withPriority(10).build();
            Policy deny = aDenyPolicy("deny").withPriority(500).build();

            PolicyEvaluationResult result = evaluator.evaluate(List.of(allow, deny), aContext().build());

            assertThat(result.allowed()).isFalse();
            assertThat(result.deniedPolicies()).containsExactly(deny);
        }

        @Test
        @DisplayName("should keep input order among policies of equal priority")
        void shouldKeepStableOrderForTies() {
            Policy first = anAllowPolicy("first").build();
            Policy second = anAllowPolicy("second").build();

            PolicyEvaluationResult result = evaluator.evaluate(List.of(first, second), aContext().build());

            assertThat(result.matchedPolicies()).containsExactly(first, second);
            assertThat(result.reasons()).hasSize(2);
        }

        @Test
        @DisplayName("should return equal results for repeated evaluation")
        void shouldBeDeterministic() {
            List<Policy> policies = List.of(
                    anAllowPolicy("a").withPriority(100).build(),
                    aDenyPolicy("b").withPriority(100).withActions("delete").build(),
                    anAllowPolicy("c").withPriority(300).forRoles("admin").build());
            PolicyEvaluationContext context = aContext().withRoles("viewer").build();

            PolicyEvaluationResult first = evaluator.evaluate(policies, context);
            PolicyEvaluationResult second = evaluator.evaluate(policies, context);

            assertThat(second.allowed()).isEqualTo(first.allowed());
            assertThat(second.matchedPolicies()).isEqualTo(first.matchedPolicies());
            assertThat(second.deniedPolicies()).isEqualTo(first.deniedPolicies());
            assertThat(second.reasons()).isEqualTo(first.reasons());
        }

        @Test
        @DisplayName("should deny with a warning when the context is missing")
        void shouldDenyWithoutContext() {
            PolicyEvaluationResult result = evaluator.evaluate(List.of(anAllowPolicy("p").build()), null);

            assertThat(result.allowed()).isFalse();
            assertThat(result.warnings()).isNotEmpty();
        }
    }

    @Nested
    @DisplayName("Matching")
    class Matching {

        @Test
        @DisplayName("should match any action with the '*' wildcard")
        void shouldMatchWildcardAction() {
            Policy policy = anAllowPolicy("all").withActions("*").build();

            assertThat(evaluator.evaluate(List.of(policy), aContext().withAction("delete").build()).allowed()).isTrue();
            assertThat(evaluator.evaluate(List.of(policy), aContext().withAction("export").build()).allowed()).isTrue();
        }

        @Test
        @DisplayName("should match when any of the subject's roles is listed")
        void shouldMatchAnyRole() {
            Policy policy = anAllowPolicy("editors").forRoles("editor").build();
            PolicyEvaluationContext context = aContext().withRoles("viewer", "editor").build();

            assertThat(evaluator.evaluate(List.of(policy), context).allowed()).isTrue();
        }

        @Test
        @DisplayName("should not match a subject without a listed role")
        void shouldNotMatchWithoutRole() {
            Policy policy = anAllowPolicy("editors").forRoles("editor").build();

            assertThat(evaluator.evaluate(List.of(policy), aContext().withRoles("viewer").build()).allowed()).isFalse();
        }

        @Test
        @DisplayName("should ignore policies of another organization")
        void shouldScopeToOrganization() {
            Policy policy = anAllowPolicy("org-a").inOrganization("A").build();

            assertThat(evaluator.evaluate(List.of(policy), aContext().inOrganization("B").build()).allowed()).isFalse();
            assertThat(evaluator.evaluate(List.of(policy), aContext().inOrganization("A").build()).allowed()).isTrue();
        }

        @Test
        @DisplayName("should apply system-wide policies to every organization")
        void shouldApplySystemPolicyEverywhere() {
            Policy policy = anAllowPolicy("system").build();

            assertThat(evaluator.evaluate(List.of(policy), aContext().inOrganization("B").build()).allowed()).isTrue();
        }

        @Test
        @DisplayName("should ignore inactive policies")
        void shouldIgnoreInactivePolicies() {
            Policy deny = aDenyPolicy("inactive-deny").withPriority(999).inactive().build();
            Policy allow = anAllowPolicy("allow").build();

            PolicyEvaluationResult result = evaluator.evaluate(List.of(deny, allow), aContext().build());

            assertThat(result.allowed()).isTrue();
            assertThat(result.matchedPolicies()).containsExactly(allow);
        }

        @Test
        @DisplayName("should resolve placeholders against the subject")
        void shouldResolvePlaceholder() {
            Policy policy = anAllowPolicy("owner")
                    .withCustomConditions(AttributeCondition.string("resource.ownerId", ConditionOperator.EQUALS, "${subject.id}"))
                    .build();

            PolicyEvaluationContext owner = aContext().withSubjectId("u1").withResourceAttribute("ownerId", "u1").build();
            PolicyEvaluationContext other = aContext().withSubjectId("u1").withResourceAttribute("ownerId", "u2").build();

            assertThat(evaluator.evaluate(List.of(policy), owner).allowed()).isTrue();
            assertThat(evaluator.evaluate(List.of(policy), other).allowed()).isFalse();
        }
    }

    @Nested
    @DisplayName("Conditions")
    class Conditions {

        @Test
        @DisplayName("should apply an overnight window at 23:00 and 05:00 but not at 12:00")
        void shouldApplyOvernightWindow() {
            Policy policy = anAllowPolicy("night").withTimeWindow(TimeWindow.between("22:00", "06:00")).build();

            assertThat(evaluator.evaluate(List.of(policy), aContext().at("2024-01-10T23:00:00Z").build()).allowed()).isTrue();
            assertThat(evaluator.evaluate(List.of(policy), aContext().at("2024-01-10T05:00:00Z").build()).allowed()).isTrue();
            assertThat(evaluator.evaluate(List.of(policy), aContext().at("2024-01-10T12:00:00Z").build()).allowed()).isFalse();
        }

        @Test
        @DisplayName("should not let a deny with failing conditions take part in the decision")
        void shouldIgnoreDenyWhoseConditionsFail() {
            Policy deny = aDenyPolicy("off-hours").withPriority(500)
                    .withTimeWindow(TimeWindow.between("22:00", "06:00"))
                    .build();
            Policy allow = anAllowPolicy("allow").build();

            PolicyEvaluationResult result = evaluator.evaluate(List.of(deny, allow), aContext().build());

            assertThat(result.allowed()).isTrue();
        }
    }

    @Nested
    @DisplayName("Malformed policies")
    class MalformedPolicies {

        @Test
        @DisplayName("should skip a policy without actions and report a warning")
        void shouldSkipPolicyWithoutActions() {
            Policy broken = aDenyPolicy("no-actions").withActions().withPriority(999).build();
            Policy allow = anAllowPolicy("allow").build();

            PolicyEvaluationResult result = evaluator.evaluate(List.of(broken, allow), aContext().build());

            assertThat(result.allowed()).isTrue();
            assertThat(result.warnings()).hasSize(1);
            assertThat(result.warnings().get(0)).contains("no-actions");
        }

        @Test
        @DisplayName("should skip a policy without any resource constraint and report a warning")
        void shouldSkipPolicyWithoutResources() {
            Policy policy = anAllowPolicy("no-resources").withResources(PolicyResources.none()).withActions("*").build();

            PolicyEvaluationResult result = evaluator.evaluate(List.of(policy), aContext().build());

            assertThat(result.allowed()).isFalse();
            assertThat(result.warnings()).containsExactly("skipped: policy no-resources has no resource constraint");
        }

        @Test
        @DisplayName("should skip a policy without effect")
        void shouldSkipPolicyWithoutEffect() {
            Policy broken = aPolicy().withId("no-effect").withEffect(null).build();

            PolicyEvaluationResult result = evaluator.evaluate(List.of(broken), aContext().build());

            assertThat(result.allowed()).isFalse();
            assertThat(result.warnings()).hasSize(1);
        }

        @Test
        @DisplayName("should treat a condition with unknown operator as false without affecting other policies")
        void shouldFailClosedOnUnknownOperator() {
            Policy bad = aDenyPolicy("bad-op").withPriority(900)
                    .withCustomConditions(new AttributeCondition("subject.id", "resembles", "x", "string"))
                    .build();
            Policy allow = anAllowPolicy("allow").build();

            PolicyEvaluationResult result = evaluator.evaluate(List.of(bad, allow), aContext().build());

            assertThat(result.allowed()).isTrue();
            assertThat(result.matchedPolicies()).containsExactly(allow);
        }
    }

    @Nested
    @DisplayName("explain")
    class Explain {

        @Test
        @DisplayName("should report every failed step of a non-applicable policy")
        void shouldReportAllFailures() {
            Policy policy = anAllowPolicy("p")
                    .forRoles("admin")
                    .withActions("delete")
                    .withCustomConditions(
                            AttributeCondition.string("subject.department", ConditionOperator.EQUALS, "finance"),
                            AttributeCondition.number("resource.size", ConditionOperator.LESS_THAN, 10))
                    .build();
            PolicyEvaluationContext context = aContext()
                    .withRoles("viewer")
                    .withSubjectAttribute("department", "sales")
                    .withResourceAttribute("size", 50)
                    .build();

            PolicyTrace trace = evaluator.explain(policy, context);

            assertThat(trace.applicable()).isFalse();
            assertThat(trace.subjectMatched()).isFalse();
            assertThat(trace.actionMatched()).isFalse();
            assertThat(trace.resourceMatched()).isTrue();
            assertThat(trace.organizationMatched()).isTrue();
            assertThat(trace.failedConditions()).hasSize(2);
        }

        @Test
        @DisplayName("should mark an applicable policy as such")
        void shouldReportApplicable() {
            PolicyTrace trace = evaluator.explain(anAllowPolicy("p").build(), aContext().build());

            assertThat(trace.applicable()).isTrue();
            assertThat(trace.problem()).isNull();
        }

        @Test
        @DisplayName("should report the problem of a malformed policy")
        void shouldReportMalformed() {
            Policy broken = aPolicy().withId("x").withEffect(PolicyEffect.ALLOW).withActions().build();

            PolicyTrace trace = evaluator.explain(broken, aContext().build());

            assertThat(trace.applicable()).isFalse();
            assertThat(trace.problem()).contains("no actions");
        }
    }
}
