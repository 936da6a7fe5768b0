package com.e2eq.attribute.exceptions;

import java.util.List;

public class AttributeForbiddenException extends AttributeAdminException {
    private static final long serialVersionUID = 1L;

    public AttributeForbiddenException(String message) {
        super(ErrorCode.FORBIDDEN, message, List.of());
    }
}
