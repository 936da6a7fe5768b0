package com.e2eq.attribute.constraint;

import com.e2eq.attribute.value.DataType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks that a constraint bag makes sense for a data type before any value is looked at.
 * Returns every problem found; an empty list means the bag is acceptable.
 */
public class ConstraintShapeValidator {

    public List<String> validate(DataType dataType, AttributeConstraints constraints) {
        List<String> errors = new ArrayList<>();
        if (constraints == null || dataType == null) {
            return errors;
        }

        switch (dataType) {
            case STRING:
                if (constraints.hasNumericBounds()) {
                    errors.add("String type cannot have numeric value constraints");
                }
                break;
            case NUMBER:
                if (constraints.hasStringBounds()) {
                    errors.add("Number type cannot have string constraints");
                }
                break;
            case BOOLEAN:
                if (constraints.hasAnyBound()) {
                    errors.add("Boolean type can only have enum constraints");
                }
                break;
            default:
                break;
        }

        if (constraints.getMinLength() != null && constraints.getMinLength() < 0) {
            errors.add("Min length cannot be negative");
        }
        if (constraints.getMaxLength() != null && constraints.getMaxLength() < 0) {
            errors.add("Max length cannot be negative");
        }
        if (constraints.getMinLength() != null && constraints.getMaxLength() != null
                && constraints.getMinLength() > constraints.getMaxLength()) {
            errors.add("Min length cannot be greater than max length");
        }
        if (constraints.getMinValue() != null && constraints.getMaxValue() != null
                && constraints.getMinValue() > constraints.getMaxValue()) {
            errors.add("Min value cannot be greater than max value");
        }
        if (constraints.getPattern() != null && !constraints.getPattern().isEmpty()) {
            try {
                Pattern.compile(constraints.getPattern());
            } catch (PatternSyntaxException e) {
                errors.add("Pattern is not a valid regular expression: " + e.getDescription());
            }
        }
        return errors;
    }
}
