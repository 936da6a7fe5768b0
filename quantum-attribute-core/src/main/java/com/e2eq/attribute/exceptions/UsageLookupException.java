package com.e2eq.attribute.exceptions;

/**
 * The policy dependency oracle failed or could not be reached.
 */
public class UsageLookupException extends AttributeAdminException {
    private static final long serialVersionUID = 1L;

    public UsageLookupException(String attributeId, Throwable cause) {
        super(ErrorCode.INTERNAL_ERROR, "Could not determine policy usage of attribute " + attributeId, cause);
    }
}
