package com.e2eq.attribute.exceptions;

import java.util.List;

public class AttributeNotFoundException extends AttributeAdminException {
    private static final long serialVersionUID = 1L;

    private final String attributeId;

    public AttributeNotFoundException(String attributeId) {
        super(ErrorCode.NOT_FOUND, "Attribute not found: " + attributeId, List.of());
        this.attributeId = attributeId;
    }

    public String getAttributeId() {
        return attributeId;
    }
}
