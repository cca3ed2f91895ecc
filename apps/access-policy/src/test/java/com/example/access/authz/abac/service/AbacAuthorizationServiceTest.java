package com.example.access.authz.abac.service;

import com.example.access.authz.abac.engine.ConditionEvaluator;
import com.example.access.authz.abac.engine.MatchingOptions;
import com.example.access.authz.abac.engine.PolicyEvaluator;
import com.example.access.authz.abac.engine.PolicyMatcher;
import com.example.access.authz.abac.field.FieldDefaultMode;
import com.example.access.authz.abac.field.FieldFilter;
import com.example.access.authz.abac.field.FieldPermissionResolver;
import com.example.access.authz.abac.field.ResourceFieldCatalog;
import com.example.access.authz.abac.model.FieldPermission;
import com.example.access.authz.abac.model.Policy;
import com.example.access.authz.abac.model.PolicyEvaluationContext;
import com.example.access.authz.abac.model.PolicyEvaluationResult;
import com.example.access.authz.abac.store.InMemoryPolicyStore;
import com.example.access.authz.audit.AuthzAuditService;
import com.example.access.config.properties.AccessPolicyProperties;
import com.example.access.exception.AccessDeniedException;
import com.example.access.observability.metrics.AccessMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.access.util.EvaluationContextTestBuilder.aContext;
import static com.example.access.util.PolicyTestBuilder.aDenyPolicy;
import static com.example.access.util.PolicyTestBuilder.anAllowPolicy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("AbacAuthorizationService")
class AbacAuthorizationServiceTest {

    @Mock
    private AuthzAuditService auditService;

    private SimpleMeterRegistry registry;
    private InMemoryPolicyStore store;
    private AbacAuthorizationService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        store = new InMemoryPolicyStore(List.of(
                anAllowPolicy("read-customers")
                        .onTypes("Customer")
                        .withActions("read", "update")
                        .forRoles("agent")
                        .withFieldPermission("Customer",
                                FieldPermission.of(List.of("name", "email"), List.of("email"), List.of("ssn")))
                        .build(),
                aDenyPolicy("no-deletes").onTypes("Customer").withActions("delete").build()));
        service = newService(auditService);
    }

    private AbacAuthorizationService newService(AuthzAuditService audit) {
        ConditionEvaluator conditionEvaluator = new ConditionEvaluator();
        PolicyEvaluator evaluator = new PolicyEvaluator(
                new PolicyMatcher(conditionEvaluator, MatchingOptions.defaults()), conditionEvaluator);
        AccessPolicyProperties properties = new AccessPolicyProperties(null, null, null, null, null, null);
        AccessMetrics metrics = new AccessMetrics(registry);
        CachedPolicyEvaluator cached = new CachedPolicyEvaluator(evaluator, metrics, new ObjectMapper(), properties);
        FieldPermissionResolver resolver = new FieldPermissionResolver(
                new ResourceFieldCatalog(Map.of("Customer", List.of("name", "email", "ssn", "notes"))),
                FieldDefaultMode.OPEN);
        return new AbacAuthorizationService(store, evaluator, cached, resolver, new FieldFilter(), metrics,
                properties, audit);
    }

    private static PolicyEvaluationContext agentContext(String action) {
        return aContext()
                .withRoles("agent")
                .withResource("Customer", "cust-1")
                .withAction(action)
                .withEnvironmentAttribute("correlationId", "corr-1")
                .build();
    }

    @Nested
    @DisplayName("decisions")
    class Decisions {

        @Test
        @DisplayName("should allow and audit with the request correlation ID")
        void shouldAllowAndAudit() {
            PolicyEvaluationContext context = agentContext("read");

            StepVerifier.create(service.authorize(context))
                    .assertNext(result -> assertThat(result.allowed()).isTrue())
                    .verifyComplete();

            verify(auditService).logDecision(eq(context), any(PolicyEvaluationResult.class), eq("corr-1"));
            assertThat(registry.counter("abac.decision", "result", "allowed").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should signal AccessDeniedException from requireAllowed when denied")
        void shouldSignalDenial() {
            StepVerifier.create(service.requireAllowed(agentContext("delete")))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(AccessDeniedException.class);
                        assertThat(((AccessDeniedException) error).getReasons())
                                .anyMatch(reason -> reason.contains("no-deletes"));
                    })
                    .verify();
        }

        @Test
        @DisplayName("should evaluate a caller-supplied policy list")
        void shouldEvaluateSuppliedPolicies() {
            PolicyEvaluationContext context = aContext().withAction("archive").build();

            StepVerifier.create(service.authorize(
                            List.of(anAllowPolicy("archive-docs").withActions("archive").build()), context))
                    .assertNext(result -> assertThat(result.matchedPolicies())
                            .extracting(Policy::id)
                            .containsExactly("archive-docs"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should emit batch results in request order")
        void shouldKeepBatchOrder() {
            StepVerifier.create(service.authorizeAll(List.of(
                            agentContext("read"), agentContext("delete"), agentContext("update"))))
                    .assertNext(result -> assertThat(result.allowed()).isTrue())
                    .assertNext(result -> assertThat(result.allowed()).isFalse())
                    .assertNext(result -> assertThat(result.allowed()).isTrue())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should work without an audit service")
        void shouldWorkWithoutAudit() {
            AbacAuthorizationService unaudited = newService(null);

            StepVerifier.create(unaudited.isAllowed(agentContext("read")))
                    .expectNext(true)
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("field permissions")
    class FieldPermissions {

        private Map<String, Object> customer() {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("name", "Ada");
            payload.put("email", "ada@example.com");
            payload.put("ssn", "123-45-6789");
            return payload;
        }

        @Test
        @DisplayName("should remove unreadable fields and audit them")
        void shouldFilterReadable() {
            PolicyEvaluationContext context = agentContext("read");
            PolicyEvaluationResult result = service.authorize(context).block();

            Map<String, Object> filtered = service.filterReadable(context, result, customer());

            assertThat(filtered).containsOnlyKeys("name", "email");
            verify(auditService).logFieldDenial(context, AuthzAuditService.FIELD_MODE_READ, List.of("ssn"), "corr-1");
            assertThat(registry.counter("abac.field.denied", "resource_type", "customer", "mode", "read").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should report fields that may not be written")
        void shouldCheckWritable() {
            PolicyEvaluationContext context = agentContext("update");
            PolicyEvaluationResult result = service.authorize(context).block();

            List<String> rejected = service.checkWritable(context, result, customer());

            assertThat(rejected).containsExactly("name", "ssn");
            verify(auditService).logFieldDenial(context, AuthzAuditService.FIELD_MODE_WRITE, List.of("name", "ssn"),
                    "corr-1");
        }

        @Test
        @DisplayName("should not audit when every field is readable")
        void shouldNotAuditWhenNothingRemoved() {
            PolicyEvaluationContext context = agentContext("read");
            PolicyEvaluationResult result = service.authorize(context).block();

            service.filterReadable(context, result, Map.of("name", "Ada"));

            verify(auditService, never()).logFieldDenial(any(), any(), any(), any());
        }
    }

    @Nested
    @DisplayName("explain")
    class Explain {

        @Test
        @DisplayName("should trace a stored policy against the request")
        void shouldTraceStoredPolicy() {
            StepVerifier.create(service.explain("read-customers", agentContext("delete")))
                    .assertNext(trace -> {
                        assertThat(trace.subjectMatched()).isTrue();
                        assertThat(trace.actionMatched()).isFalse();
                        assertThat(trace.applicable()).isFalse();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should be empty for an unknown policy")
        void shouldBeEmptyForUnknownPolicy() {
            StepVerifier.create(service.explain("missing", agentContext("read")))
                    .verifyComplete();
        }
    }
}
