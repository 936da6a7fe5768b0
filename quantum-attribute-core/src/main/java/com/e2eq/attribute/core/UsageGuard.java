package com.e2eq.attribute.core;

import com.e2eq.attribute.exceptions.UsageLookupException;
import com.e2eq.attribute.spi.AttributeUsage;
import com.e2eq.attribute.spi.PolicyUsageOracle;
import com.e2eq.attribute.value.DataType;
import io.quarkus.logging.Log;

/**
 * Asks the policy dependency oracle whether an attribute is referenced and turns the answer into an
 * {@link EditPolicy}. Answers are never cached: every mutating decision asks again.
 */
public class UsageGuard {

    private final PolicyUsageOracle oracle;

    public UsageGuard(PolicyUsageOracle oracle) {
        this.oracle = oracle;
    }

    public boolean isInUse(String attributeId) {
        return getUsage(attributeId).usedInPolicies();
    }

    public AttributeUsage getUsage(String attributeId) {
        AttributeUsage usage;
        try {
            usage = oracle.usage(attributeId);
        } catch (UsageLookupException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UsageLookupException(attributeId, e);
        }
        if (usage == null) {
            throw new UsageLookupException(attributeId, new IllegalStateException("oracle returned no answer"));
        }
        if (Log.isDebugEnabled()) {
            Log.debugf("Attribute %s is %s", attributeId,
                    usage.usedInPolicies() ? "used in " + usage.policyCount() + " policies" : "not used in any policy");
        }
        return usage;
    }

    /**
     * Pure: the same inputs always give the same policy.
     */
    public static EditPolicy deriveEditPolicy(DataType dataType, boolean inUse) {
        if (!inUse) {
            return EditPolicy.FULL;
        }
        return dataType != null && dataType.isComposite() ? EditPolicy.APPEND_ONLY : EditPolicy.LOCKED;
    }
}
