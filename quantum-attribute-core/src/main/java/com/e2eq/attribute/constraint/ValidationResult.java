package com.e2eq.attribute.constraint;

import java.util.Objects;
import java.util.Optional;

public final class ValidationResult {

    private static final ValidationResult OK = new ValidationResult(null);

    private final ValueConstraintViolation violation;

    private ValidationResult(ValueConstraintViolation violation) {
        this.violation = violation;
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult violation(ValueConstraintViolation violation) {
        return new ValidationResult(Objects.requireNonNull(violation, "violation"));
    }

    public boolean isValid() {
        return violation == null;
    }

    public Optional<ValueConstraintViolation> violation() {
        return Optional.ofNullable(violation);
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult{ok}" : "ValidationResult{" + violation + "}";
    }
}
