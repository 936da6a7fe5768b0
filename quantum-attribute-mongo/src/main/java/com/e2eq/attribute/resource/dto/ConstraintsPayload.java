package com.e2eq.attribute.resource.dto;

import com.e2eq.attribute.constraint.AttributeConstraints;
import com.e2eq.attribute.constraint.ValueFormat;
import com.e2eq.attribute.exceptions.AttributeValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Constraint bag as clients send it. {@code enumValues} stays raw JSON until the value parser has
 * read it for the attribute's data type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class ConstraintsPayload {
    private Integer minLength;
    private Integer maxLength;
    private Double minValue;
    private Double maxValue;
    private String pattern;
    private String format;
    private JsonNode enumValues;

    public boolean hasBounds() {
        return minLength != null || maxLength != null || minValue != null || maxValue != null
                || (pattern != null && !pattern.isBlank()) || (format != null && !format.isBlank());
    }

    public AttributeConstraints toBounds() {
        ValueFormat valueFormat;
        try {
            valueFormat = ValueFormat.fromWire(format);
        } catch (IllegalArgumentException e) {
            throw new AttributeValidationException(e.getMessage());
        }
        return AttributeConstraints.builder()
                .minLength(minLength)
                .maxLength(maxLength)
                .minValue(minValue)
                .maxValue(maxValue)
                .pattern(pattern == null || pattern.isBlank() ? null : pattern)
                .format(valueFormat)
                .build();
    }
}
