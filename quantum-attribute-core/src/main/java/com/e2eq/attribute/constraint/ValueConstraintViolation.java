package com.e2eq.attribute.constraint;

import com.e2eq.attribute.value.TypedValue;

public record ValueConstraintViolation(ConstraintKind which, String detail, TypedValue offendingValue) {

    public static ValueConstraintViolation of(ConstraintKind which, String detail) {
        return new ValueConstraintViolation(which, detail, null);
    }
}
