package com.e2eq.attribute.spi;

/**
 * Answers whether any policy references an attribute. Owned by the policy subsystem; this module
 * only reads it and never caches the answer.
 */
public interface PolicyUsageOracle {

    /**
     * @throws com.e2eq.attribute.exceptions.UsageLookupException when the answer cannot be obtained
     */
    AttributeUsage usage(String attributeId);
}
