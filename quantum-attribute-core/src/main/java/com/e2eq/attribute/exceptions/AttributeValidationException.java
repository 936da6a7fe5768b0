package com.e2eq.attribute.exceptions;

import java.util.List;

/**
 * A required field is missing or a field is malformed.
 */
public class AttributeValidationException extends AttributeAdminException {
    private static final long serialVersionUID = 1L;

    public AttributeValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message, List.of());
    }

    public AttributeValidationException(String message, List<String> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
