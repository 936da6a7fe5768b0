package com.e2eq.attribute.resource.dto;

import com.e2eq.attribute.model.AttributeDefinition;
import com.e2eq.attribute.spi.AttributeUsage;
import com.e2eq.attribute.spi.PolicyReference;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * An attribute definition as the console shows it: the stored fields plus the policies that
 * currently reference it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class AttributeView {
    @JsonUnwrapped
    private AttributeDefinition attribute;
    private int policyCount;
    private List<PolicyReference> usedInPolicies;

    public static AttributeView of(AttributeDefinition attribute, AttributeUsage usage) {
        return new AttributeView(attribute, usage.policyCount(), usage.policies());
    }
}
