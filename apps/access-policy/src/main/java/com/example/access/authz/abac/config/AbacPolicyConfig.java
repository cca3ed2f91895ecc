package com.example.access.authz.abac.config;

import com.example.access.authz.abac.engine.ConditionEvaluator;
import com.example.access.authz.abac.engine.MatchingOptions;
import com.example.access.authz.abac.engine.PolicyEvaluator;
import com.example.access.authz.abac.engine.PolicyMatcher;
import com.example.access.authz.abac.field.FieldFilter;
import com.example.access.authz.abac.field.FieldPermissionResolver;
import com.example.access.authz.abac.field.ResourceFieldCatalog;
import com.example.access.authz.abac.model.Policy;
import com.example.access.authz.abac.service.OrganizationHierarchy;
import com.example.access.authz.abac.store.InMemoryPolicyStore;
import com.example.access.authz.abac.store.PolicyStore;
import com.example.access.config.properties.AccessPolicyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the policy engine and seeds the policy store from YAML configuration.
 * Invalid seed definitions fail startup.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({AbacPolicyProperties.class, AccessPolicyProperties.class})
public class AbacPolicyConfig {

    @Bean
    public ResourceFieldCatalog resourceFieldCatalog(AccessPolicyProperties properties) {
        ResourceFieldCatalog catalog = new ResourceFieldCatalog(properties.resourceFields());
        log.info("Resource field catalog loaded for types {}", catalog.knownTypes());
        return catalog;
    }

    @Bean
    public ConditionEvaluator conditionEvaluator() {
        return new ConditionEvaluator();
    }

    @Bean
    public PolicyMatcher policyMatcher(ConditionEvaluator conditionEvaluator,
                                       ResourceFieldCatalog catalog,
                                       AccessPolicyProperties properties) {
        MatchingOptions options = new MatchingOptions(
                properties.matching().resourceTypeWildcard(), catalog.knownTypes());
        return new PolicyMatcher(conditionEvaluator, options);
    }

    @Bean
    public PolicyEvaluator policyEvaluator(PolicyMatcher policyMatcher, ConditionEvaluator conditionEvaluator) {
        return new PolicyEvaluator(policyMatcher, conditionEvaluator);
    }

    @Bean
    public FieldPermissionResolver fieldPermissionResolver(ResourceFieldCatalog catalog,
                                                           AccessPolicyProperties properties) {
        return new FieldPermissionResolver(catalog, properties.fieldPermissions().defaultMode());
    }

    @Bean
    public FieldFilter fieldFilter() {
        return new FieldFilter();
    }

    @Bean
    @ConditionalOnMissingBean(PolicyStore.class)
    public PolicyStore policyStore(AbacPolicyProperties properties) {
        List<Policy> policies = properties.toPolicies();

        log.info("Loaded {} ABAC policies from configuration", policies.size());
        policies.forEach(p -> log.debug("  - {} ({} priority={}, org={}): {}",
                p.id(), p.effect(), p.priority(), p.organizationId(), p.description()));

        return new InMemoryPolicyStore(policies);
    }

    @Bean
    @ConditionalOnMissingBean(OrganizationHierarchy.class)
    public OrganizationHierarchy organizationHierarchy(AccessPolicyProperties properties) {
        return OrganizationHierarchy.fromParents(properties.organizationParents());
    }
}
