package com.e2eq.attribute.core;

import com.e2eq.attribute.value.TypedValue;

import java.util.List;

/**
 * Outcome of checking one candidate value against an attribute definition.
 *
 * @param normalizedValue the value coerced to the attribute's type, or the default when none was given
 */
public record ValueValidationReport(boolean valid, List<String> errors, TypedValue normalizedValue) {

    public ValueValidationReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValueValidationReport valid(TypedValue normalizedValue) {
        return new ValueValidationReport(true, List.of(), normalizedValue);
    }

    public static ValueValidationReport invalid(List<String> errors) {
        return new ValueValidationReport(false, errors, null);
    }
}
