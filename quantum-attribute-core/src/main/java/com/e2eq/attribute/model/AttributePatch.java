package com.e2eq.attribute.model;

import com.e2eq.attribute.constraint.AttributeConstraints;
import com.e2eq.attribute.value.DataType;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

/**
 * A partial update. A {@code null} field means "leave unchanged"; a field equal to the stored value
 * is not a change either, so clients may send back the whole definition.
 * <p>
 * Supplying {@code permittedValues} or {@code enumValues} replaces the permitted value set as a
 * whole; under an append-only edit policy the new set has to contain every existing value.
 * Bounds in {@code constraints} are merged one by one: a {@code null} bound keeps the stored one.
 * </p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AttributePatch {
    private String name;
    private String displayName;
    private String description;
    private Set<AttributeCategory> categories;
    private DataType dataType;
    private Boolean required;
    private Boolean multiValue;
    private JsonNode defaultValue;
    private String permittedValues;
    private JsonNode enumValues;
    private AttributeConstraints constraints;
    private List<String> tags;
    private Boolean active;
    /** when set, the update is refused unless the stored revision still equals it */
    private Long expectedRevision;
    private String modifiedBy;

    public boolean carriesValues() {
        return permittedValues != null || (enumValues != null && !enumValues.isNull());
    }
}
