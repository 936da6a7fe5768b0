package com.e2eq.attribute.constraint;

public enum ConstraintKind {
    MIN_LENGTH,
    MAX_LENGTH,
    MIN_VALUE,
    MAX_VALUE,
    PATTERN,
    FORMAT,
    ENUMERATION,
    /** an in-use composite attribute may only gain permitted values */
    APPEND_ONLY,
    /** the field is not editable under the attribute's current edit policy */
    EDIT_POLICY;

    /**
     * Violations caused by the attribute being referenced by policies rather than by the value itself.
     */
    public boolean isUsageRule() {
        return this == APPEND_ONLY || this == EDIT_POLICY;
    }
}
