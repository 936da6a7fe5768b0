package com.e2eq.attribute.constraint;

import com.e2eq.attribute.value.TypedValue;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Type shaped constraint bag of an attribute definition. {@code enumValues} is the closed set of
 * permitted values, in insertion order and without repeats.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttributeConstraints {
    private Integer minLength;
    private Integer maxLength;
    private Double minValue;
    private Double maxValue;
    private String pattern;
    private ValueFormat format;
    @Builder.Default
    private List<TypedValue> enumValues = new ArrayList<>();

    public static AttributeConstraints empty() {
        return AttributeConstraints.builder().build();
    }

    /**
     * Same bounds, no enumeration. Used when the permitted values themselves are being checked.
     */
    public AttributeConstraints boundsOnly() {
        return toBuilder().enumValues(new ArrayList<>()).build();
    }

    /**
     * Bounds set in {@code patch} replace these; bounds it leaves {@code null} are kept. The
     * result carries no enumeration.
     */
    public AttributeConstraints withBoundsFrom(AttributeConstraints patch) {
        if (patch == null) {
            return boundsOnly();
        }
        return AttributeConstraints.builder()
                .minLength(patch.minLength != null ? patch.minLength : minLength)
                .maxLength(patch.maxLength != null ? patch.maxLength : maxLength)
                .minValue(patch.minValue != null ? patch.minValue : minValue)
                .maxValue(patch.maxValue != null ? patch.maxValue : maxValue)
                .pattern(patch.pattern != null ? patch.pattern : pattern)
                .format(patch.format != null ? patch.format : format)
                .build();
    }

    public boolean hasEnumeration() {
        return enumValues != null && !enumValues.isEmpty();
    }

    public boolean hasStringBounds() {
        return minLength != null || maxLength != null || pattern != null;
    }

    public boolean hasNumericBounds() {
        return minValue != null || maxValue != null;
    }

    public boolean hasAnyBound() {
        return hasStringBounds() || hasNumericBounds() || format != null;
    }
}
