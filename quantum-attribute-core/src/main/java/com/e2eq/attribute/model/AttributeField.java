package com.e2eq.attribute.model;

/**
 * The editable parts of an attribute definition. {@code name} and {@code id} are never editable
 * and so have no entry here.
 */
public enum AttributeField {
    DISPLAY_NAME("displayName"),
    DESCRIPTION("description"),
    CATEGORIES("categories"),
    DATA_TYPE("dataType"),
    IS_REQUIRED("isRequired"),
    IS_MULTI_VALUE("isMultiValue"),
    DEFAULT_VALUE("defaultValue"),
    CONSTRAINTS("constraints"),
    ENUM_VALUES("constraints.enumValues"),
    TAGS("metadata.tags"),
    ACTIVE("active");

    private final String path;

    AttributeField(String path) {
        this.path = path;
    }

    public String path() {
        return path;
    }
}
