package com.example.access.authz.abac.config;

import com.example.access.authz.abac.model.AttributeCondition;
import com.example.access.authz.abac.model.AttributeType;
import com.example.access.authz.abac.model.ConditionOperator;
import com.example.access.authz.abac.model.FieldPermission;
import com.example.access.authz.abac.model.Policy;
import com.example.access.authz.abac.model.PolicyConditions;
import com.example.access.authz.abac.model.PolicyEffect;
import com.example.access.authz.abac.model.PolicyResources;
import com.example.access.authz.abac.model.PolicyScope;
import com.example.access.authz.abac.model.PolicySubjects;
import com.example.access.authz.abac.model.TimeWindow;
import com.example.access.exception.PolicyConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for seed ABAC policies.
 * Loaded from the {@code abac.policies} list in application.yml.
 *
 * <p>Condition values are bound as text and converted according to the condition type,
 * so {@code type: number, value: "5"} compares numerically.
 */
@ConfigurationProperties(prefix = "abac")
public record AbacPolicyProperties(List<PolicyDefinition> policies) {

    public AbacPolicyProperties {
        if (policies == null) {
            policies = List.of();
        }
    }

    public List<Policy> toPolicies() {
        return policies.stream().map(PolicyDefinition::toPolicy).toList();
    }

    public record PolicyDefinition(
            String id,
            String name,
            String description,
            String effect,
            String scope,
            Integer priority,
            String organizationId,
            Boolean active,
            SubjectsDefinition subjects,
            ResourcesDefinition resources,
            List<String> actions,
            ConditionsDefinition conditions,
            Map<String, FieldPermission> fieldPermissions
    ) {
        public PolicyDefinition {
            if (priority == null) priority = Policy.DEFAULT_PRIORITY;
            if (active == null) active = Boolean.TRUE;
            if (actions == null) actions = List.of();
            if (fieldPermissions == null) fieldPermissions = Map.of();
        }

        /**
         * @throws PolicyConfigurationException when the definition cannot describe a policy
         */
        public Policy toPolicy() {
            if (id == null || id.isBlank()) {
                throw new PolicyConfigurationException(String.valueOf(name), "id is required");
            }
            PolicyEffect parsedEffect = PolicyEffect.fromValue(effect)
                    .orElseThrow(() -> new PolicyConfigurationException(id, "unknown effect '" + effect + "'"));
            if (actions.isEmpty()) {
                throw new PolicyConfigurationException(id, "at least one action is required");
            }
            PolicyScope parsedScope = null;
            if (scope != null) {
                parsedScope = PolicyScope.fromValue(scope)
                        .orElseThrow(() -> new PolicyConfigurationException(id, "unknown scope '" + scope + "'"));
                if (parsedScope == PolicyScope.ORGANIZATION && organizationId == null) {
                    throw new PolicyConfigurationException(id, "organization scope requires an organizationId");
                }
            }

            return Policy.builder()
                    .id(id)
                    .name(name != null ? name : id)
                    .description(description)
                    .effect(parsedEffect)
                    .scope(parsedScope)
                    .priority(priority)
                    .organizationId(organizationId)
                    .active(active)
                    .version(1)
                    .subjects(subjects != null ? subjects.toSubjects() : PolicySubjects.any())
                    .resources(resources != null ? resources.toResources(id) : PolicyResources.none())
                    .actions(actions)
                    .conditions(conditions != null ? conditions.toConditions(id) : PolicyConditions.none())
                    .fieldPermissions(fieldPermissions)
                    .build();
        }
    }

    public record SubjectsDefinition(
            List<String> users,
            List<String> groups,
            List<String> roles,
            Map<String, String> attributes
    ) {
        PolicySubjects toSubjects() {
            Map<String, Object> required = new LinkedHashMap<>();
            if (attributes != null) {
                required.putAll(attributes);
            }
            return new PolicySubjects(users, groups, roles, required);
        }
    }

    public record ResourcesDefinition(
            List<String> types,
            List<String> ids,
            List<ConditionDefinition> attributes
    ) {
        PolicyResources toResources(String policyId) {
            List<AttributeCondition> conditions = attributes == null ? List.of() : attributes.stream()
                    .map(c -> c.toCondition(policyId))
                    .toList();
            return new PolicyResources(types, ids, conditions);
        }
    }

    public record ConditionsDefinition(
            TimeWindow timeWindow,
            List<String> ipAddresses,
            List<String> locations,
            List<ConditionDefinition> custom
    ) {
        PolicyConditions toConditions(String policyId) {
            List<AttributeCondition> customConditions = custom == null ? List.of() : custom.stream()
                    .map(c -> c.toCondition(policyId))
                    .toList();
            return new PolicyConditions(timeWindow, ipAddresses, locations, customConditions);
        }
    }

    /**
     * One attribute condition. {@code values} is used for list operands (in, not_in, between,
     * contains_any), {@code value} otherwise.
     */
    public record ConditionDefinition(
            String attribute,
            String operator,
            String type,
            String value,
            List<String> values
    ) {
        AttributeCondition toCondition(String policyId) {
            if (attribute == null || attribute.isBlank()) {
                throw new PolicyConfigurationException(policyId, "condition without attribute");
            }
            ConditionOperator op = ConditionOperator.fromCode(operator)
                    .orElseThrow(() -> new PolicyConfigurationException(policyId,
                            "unknown operator '" + operator + "' on " + attribute));
            AttributeType attributeType = type == null ? AttributeType.STRING : AttributeType.fromCode(type)
                    .orElseThrow(() -> new PolicyConfigurationException(policyId,
                            "unknown type '" + type + "' on " + attribute));
            if (!attributeType.supports(op)) {
                throw new PolicyConfigurationException(policyId,
                        "operator " + op.code() + " is not valid for type " + attributeType.code());
            }

            Object operand;
            if (op == ConditionOperator.EXISTS) {
                operand = value == null || Boolean.parseBoolean(value);
            } else if (values != null && !values.isEmpty()) {
                operand = values.stream().map(v -> convert(policyId, attributeType, v)).toList();
            } else {
                operand = convert(policyId, attributeType, value);
            }
            return AttributeCondition.of(attribute, op, operand, attributeType);
        }

        private Object convert(String policyId, AttributeType attributeType, String raw) {
            if (raw == null) {
                throw new PolicyConfigurationException(policyId, "condition on " + attribute + " has no value");
            }
            if (raw.contains("${")) {
                return raw;
            }
            return switch (attributeType) {
                case NUMBER -> {
                    try {
                        yield new BigDecimal(raw.trim());
                    } catch (NumberFormatException e) {
                        throw new PolicyConfigurationException(policyId,
                                "'" + raw + "' is not a number on " + attribute, e);
                    }
                }
                case BOOLEAN -> Boolean.parseBoolean(raw.trim());
                default -> raw;
            };
        }
    }
}
