package com.e2eq.attribute.constraint;

import com.e2eq.attribute.value.TypedValue;
import com.e2eq.attribute.value.TypedValues;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks typed values against structural constraints. Checks run in a fixed order (length,
 * numeric range, pattern, format, enumeration membership) and stop at the first violation.
 * Never throws for invalid input.
 */
public class ConstraintValidator {

    public ValidationResult validate(List<TypedValue> values, AttributeConstraints constraints) {
        if (values == null || values.isEmpty() || constraints == null) {
            return ValidationResult.ok();
        }

        ValidationResult result = checkLength(values, constraints);
        if (!result.isValid()) {
            return result;
        }
        result = checkNumericRange(values, constraints);
        if (!result.isValid()) {
            return result;
        }
        result = checkPattern(values, constraints);
        if (!result.isValid()) {
            return result;
        }
        result = checkFormat(values, constraints);
        if (!result.isValid()) {
            return result;
        }
        return checkMembership(values, constraints);
    }

    private ValidationResult checkLength(List<TypedValue> values, AttributeConstraints c) {
        if (c.getMinLength() == null && c.getMaxLength() == null) {
            return ValidationResult.ok();
        }
        for (TypedValue v : values) {
            Integer length = lengthOf(v);
            if (length == null) {
                continue;
            }
            if (c.getMinLength() != null && length < c.getMinLength()) {
                return ValidationResult.violation(new ValueConstraintViolation(ConstraintKind.MIN_LENGTH,
                        String.format("%s must have a length of at least %d", TypedValues.describe(v), c.getMinLength()), v));
            }
            if (c.getMaxLength() != null && length > c.getMaxLength()) {
                return ValidationResult.violation(new ValueConstraintViolation(ConstraintKind.MAX_LENGTH,
                        String.format("%s cannot exceed a length of %d", TypedValues.describe(v), c.getMaxLength()), v));
            }
        }
        return ValidationResult.ok();
    }

    private ValidationResult checkNumericRange(List<TypedValue> values, AttributeConstraints c) {
        if (!c.hasNumericBounds()) {
            return ValidationResult.ok();
        }
        for (TypedValue v : values) {
            if (!(v instanceof TypedValue.Num)) {
                continue;
            }
            double n = ((TypedValue.Num) v).value();
            if (c.getMinValue() != null && n < c.getMinValue()) {
                return ValidationResult.violation(new ValueConstraintViolation(ConstraintKind.MIN_VALUE,
                        String.format("%s must be at least %s", TypedValues.describe(v), TypedValues.formatNumber(c.getMinValue())), v));
            }
            if (c.getMaxValue() != null && n > c.getMaxValue()) {
                return ValidationResult.violation(new ValueConstraintViolation(ConstraintKind.MAX_VALUE,
                        String.format("%s cannot exceed %s", TypedValues.describe(v), TypedValues.formatNumber(c.getMaxValue())), v));
            }
        }
        return ValidationResult.ok();
    }

    private ValidationResult checkPattern(List<TypedValue> values, AttributeConstraints c) {
        if (c.getPattern() == null || c.getPattern().isEmpty()) {
            return ValidationResult.ok();
        }
        Pattern pattern;
        try {
            pattern = Pattern.compile(c.getPattern());
        } catch (PatternSyntaxException e) {
            return ValidationResult.violation(ValueConstraintViolation.of(ConstraintKind.PATTERN,
                    "Pattern '" + c.getPattern() + "' is not a valid regular expression"));
        }
        for (TypedValue v : values) {
            if (v instanceof TypedValue.Str && !pattern.matcher(((TypedValue.Str) v).value()).find()) {
                return ValidationResult.violation(new ValueConstraintViolation(ConstraintKind.PATTERN,
                        String.format("%s does not match the required pattern %s", TypedValues.describe(v), c.getPattern()), v));
            }
        }
        return ValidationResult.ok();
    }

    private ValidationResult checkFormat(List<TypedValue> values, AttributeConstraints c) {
        if (c.getFormat() == null) {
            return ValidationResult.ok();
        }
        for (TypedValue v : values) {
            if (v instanceof TypedValue.Str && !c.getFormat().matches(((TypedValue.Str) v).value())) {
                return ValidationResult.violation(new ValueConstraintViolation(ConstraintKind.FORMAT,
                        String.format("%s must be a valid %s", TypedValues.describe(v), c.getFormat().wireName()), v));
            }
        }
        return ValidationResult.ok();
    }

    private ValidationResult checkMembership(List<TypedValue> values, AttributeConstraints c) {
        if (!c.hasEnumeration()) {
            return ValidationResult.ok();
        }
        Set<TypedValue> closed = new HashSet<>(c.getEnumValues());
        for (TypedValue v : values) {
            if (closed.contains(v)) {
                continue;
            }
            // an array value of an array attribute is permitted when each element is
            if (v instanceof TypedValue.Arr && closed.containsAll(((TypedValue.Arr) v).items())) {
                continue;
            }
            return ValidationResult.violation(new ValueConstraintViolation(ConstraintKind.ENUMERATION,
                    String.format("%s is not one of the permitted values", TypedValues.describe(v)), v));
        }
        return ValidationResult.ok();
    }

    private static Integer lengthOf(TypedValue v) {
        if (v instanceof TypedValue.Str) {
            return ((TypedValue.Str) v).value().length();
        }
        if (v instanceof TypedValue.Arr) {
            return ((TypedValue.Arr) v).items().size();
        }
        if (v instanceof TypedValue.Obj) {
            return ((TypedValue.Obj) v).fields().size();
        }
        return null;
    }
}
