package com.e2eq.attribute.exceptions;

/**
 * The persistence store failed or could not be reached.
 */
public class AttributeStoreException extends AttributeAdminException {
    private static final long serialVersionUID = 1L;

    public AttributeStoreException(String message, Throwable cause) {
        super(ErrorCode.INTERNAL_ERROR, message, cause);
    }
}
