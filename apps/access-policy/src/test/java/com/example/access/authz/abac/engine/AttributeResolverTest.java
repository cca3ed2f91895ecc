package com.example.access.authz.abac.engine;

import com.example.access.authz.abac.model.PolicyEvaluationContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.example.access.util.EvaluationContextTestBuilder.aContext;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AttributeResolver")
class AttributeResolverTest {

    private final AttributeResolver resolver = new AttributeResolver();

    private final PolicyEvaluationContext context = aContext()
            .withSubjectId("u1")
            .withRoles("editor")
            .withSubjectAttribute("department", "finance")
            .withSubjectAttribute("address", Map.of("city", "Berlin"))
            .withResource("invoice", "inv-9")
            .withResourceAttribute("amount", 250)
            .fromIp("10.0.0.7")
            .withEnvironmentAttribute("channel", "web")
            .inOrganization("org-7")
            .build();

    @Test
    @DisplayName("should resolve built-in attributes")
    void shouldResolveBuiltIns() {
        assertThat(resolver.resolve("subject.id", context)).contains("u1");
        assertThat(resolver.resolve("subject.roles", context)).contains(List.of("editor"));
        assertThat(resolver.resolve("resource.type", context)).contains("invoice");
        assertThat(resolver.resolve("resource.id", context)).contains("inv-9");
        assertThat(resolver.resolve("env.ipAddress", context)).contains("10.0.0.7");
        assertThat(resolver.resolve("env.time", context)).contains("12:00");
        assertThat(resolver.resolve("env.dayOfWeek", context)).contains(3);
        assertThat(resolver.resolve("organizationId", context)).contains("org-7");
    }

    @Test
    @DisplayName("should resolve custom attributes, nested paths and the environment alias")
    void shouldResolveAttributes() {
        assertThat(resolver.resolve("subject.department", context)).contains("finance");
        assertThat(resolver.resolve("subject.attributes.department", context)).contains("finance");
        assertThat(resolver.resolve("subject.address.city", context)).contains("Berlin");
        assertThat(resolver.resolve("resource.amount", context)).contains(250);
        assertThat(resolver.resolve("environment.channel", context)).contains("web");
    }

    @Test
    @DisplayName("should be empty for unknown roots and absent attributes")
    void shouldBeEmptyWhenUnresolvable() {
        assertThat(resolver.resolve("user.id", context)).isEmpty();
        assertThat(resolver.resolve("subject.salary", context)).isEmpty();
        assertThat(resolver.resolve("subject", context)).isEmpty();
    }

    @Test
    @DisplayName("should substitute placeholders in text and lists")
    void shouldResolvePlaceholders() {
        assertThat(resolver.resolvePlaceholders("${resource.amount}", context)).contains(250);
        assertThat(resolver.resolvePlaceholders("dept-${subject.department}", context)).contains("dept-finance");
        assertThat(resolver.resolvePlaceholders(List.of("${subject.id}", "admin"), context))
                .contains(List.of("u1", "admin"));
        assertThat(resolver.resolvePlaceholders("plain", context)).contains("plain");
    }

    @Test
    @DisplayName("should be empty when a placeholder cannot be resolved")
    void shouldRejectUnresolvablePlaceholder() {
        assertThat(resolver.resolvePlaceholders("${subject.unknown}", context)).isEmpty();
        assertThat(resolver.resolvePlaceholders("x-${env.missing}", context)).isEmpty();
    }
}
