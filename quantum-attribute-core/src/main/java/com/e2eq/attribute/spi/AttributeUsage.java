package com.e2eq.attribute.spi;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What the dependency oracle knows about one attribute.
 */
public record AttributeUsage(String attributeId,
                             @JsonProperty("isUsedInPolicies") boolean usedInPolicies,
                             List<PolicyReference> policies) {

    public AttributeUsage {
        policies = policies == null ? List.of() : List.copyOf(policies);
    }

    public static AttributeUsage unused(String attributeId) {
        return new AttributeUsage(attributeId, false, List.of());
    }

    public static AttributeUsage usedBy(String attributeId, List<PolicyReference> policies) {
        return new AttributeUsage(attributeId, true, policies);
    }

    @JsonProperty("policyCount")
    public int policyCount() {
        return policies.size();
    }
}
