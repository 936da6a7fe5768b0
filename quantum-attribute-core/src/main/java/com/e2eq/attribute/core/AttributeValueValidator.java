package com.e2eq.attribute.core;

import com.e2eq.attribute.constraint.ConstraintValidator;
import com.e2eq.attribute.constraint.ValidationResult;
import com.e2eq.attribute.model.AttributeDefinition;
import com.e2eq.attribute.value.DataType;
import com.e2eq.attribute.value.ParseResult;
import com.e2eq.attribute.value.TypedValue;
import com.e2eq.attribute.value.TypedValues;
import com.e2eq.attribute.value.ValueParser;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a concrete value, as a subject or resource would carry it, against an attribute definition:
 * required-ness, type, bounds and the permitted value set. Multi-value attributes take a JSON array
 * whose elements are checked one by one.
 */
public class AttributeValueValidator {

    private final ValueParser parser;
    private final ConstraintValidator constraintValidator;

    public AttributeValueValidator(ValueParser parser, ConstraintValidator constraintValidator) {
        this.parser = parser;
        this.constraintValidator = constraintValidator;
    }

    public ValueValidationReport validate(AttributeDefinition definition, JsonNode value) {
        if (isEmpty(value)) {
            if (definition.isRequired()) {
                return ValueValidationReport.invalid(List.of("Value for " + definition.getDisplayName() + " is required"));
            }
            return ValueValidationReport.valid(definition.getDefaultValue());
        }

        DataType dataType = definition.getDataType();
        List<JsonNode> elements = new ArrayList<>();
        boolean multi = definition.isMultiValue() && value.isArray() && dataType != DataType.ARRAY;
        if (multi) {
            value.forEach(elements::add);
        } else {
            elements.add(value);
        }

        List<String> errors = new ArrayList<>();
        List<TypedValue> values = new ArrayList<>();
        for (JsonNode element : elements) {
            TypedValue coerced = coerce(element, dataType);
            if (coerced == null) {
                errors.add(typeError(dataType, element));
            } else {
                values.add(coerced);
            }
        }
        if (!errors.isEmpty()) {
            return ValueValidationReport.invalid(errors);
        }

        ValidationResult result = constraintValidator.validate(values, definition.getConstraints());
        if (!result.isValid()) {
            return ValueValidationReport.invalid(List.of(result.violation().get().detail()));
        }
        return ValueValidationReport.valid(multi ? new TypedValue.Arr(values) : values.get(0));
    }

    private TypedValue coerce(JsonNode node, DataType dataType) {
        switch (dataType) {
            case STRING:
                return node.isTextual() ? TypedValue.of(node.textValue()) : null;
            case BOOLEAN:
                if (node.isBoolean()) {
                    return TypedValue.of(node.booleanValue());
                }
                if (node.isNumber()) {
                    return TypedValue.of(node.asInt() == 1);
                }
                if (node.isTextual()) {
                    String s = node.textValue().trim();
                    return TypedValue.of("true".equalsIgnoreCase(s) || "1".equals(s));
                }
                return null;
            case ARRAY:
                return node.isArray() ? structured(node) : null;
            case OBJECT:
                return node.isObject() ? structured(node) : null;
            default:
                ParseResult result = parser.parseSingle(node, dataType);
                return result.isOk() ? result.values().get(0) : null;
        }
    }

    private static TypedValue structured(JsonNode node) {
        try {
            return TypedValues.fromJson(node);
        } catch (IllegalArgumentException e) {
            // nested nulls have no typed form
            return null;
        }
    }

    private static String typeError(DataType dataType, JsonNode element) {
        switch (dataType) {
            case STRING:
                return "Value must be a string";
            case NUMBER:
                return "Value must be a valid number: " + element;
            case DATE:
                return "Value must be a valid date: " + element;
            case ARRAY:
                return "Value must be an array";
            case OBJECT:
                return "Value must be an object";
            default:
                return "Value must be a boolean";
        }
    }

    private static boolean isEmpty(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode()
                || (value.isTextual() && value.textValue().isEmpty());
    }
}
