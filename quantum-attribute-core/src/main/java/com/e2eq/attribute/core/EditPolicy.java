package com.e2eq.attribute.core;

import com.e2eq.attribute.model.AttributeField;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which parts of an attribute definition may still change, given whether policies reference it.
 */
public enum EditPolicy {
    /** not referenced: everything but id and name is editable */
    FULL(EnumSet.allOf(AttributeField.class)),
    /** referenced composite attribute: the description, and permitted values may only be added */
    APPEND_ONLY(EnumSet.of(AttributeField.DESCRIPTION, AttributeField.ENUM_VALUES)),
    /** referenced scalar attribute: only the description */
    LOCKED(EnumSet.of(AttributeField.DESCRIPTION));

    private final Set<AttributeField> editable;

    EditPolicy(Set<AttributeField> editable) {
        this.editable = editable;
    }

    public boolean permits(AttributeField field) {
        return editable.contains(field);
    }

    public Set<AttributeField> editableFields() {
        return EnumSet.copyOf(editable);
    }
}
