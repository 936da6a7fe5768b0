package com.e2eq.attribute.exceptions;

import com.e2eq.attribute.constraint.ValueConstraintViolation;

import java.util.List;

/**
 * A value set breaks a structural constraint, or an edit breaks the rules that apply while the
 * attribute is referenced by policies.
 */
public class ValueConstraintException extends AttributeAdminException {
    private static final long serialVersionUID = 1L;

    private final transient ValueConstraintViolation violation;

    public ValueConstraintException(ValueConstraintViolation violation) {
        this(violation, List.of(violation.detail()));
    }

    public ValueConstraintException(ValueConstraintViolation violation, List<String> details) {
        super(ErrorCode.CONSTRAINT_VIOLATION, violation.detail(), details);
        this.violation = violation;
    }

    public ValueConstraintViolation getViolation() {
        return violation;
    }
}
