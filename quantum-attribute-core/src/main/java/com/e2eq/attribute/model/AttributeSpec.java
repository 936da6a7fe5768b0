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
 * What a caller supplies to create an attribute definition. Permitted values come either as text
 * ({@code permittedValues}, read by the value parser for {@code dataType}) or as an already
 * structured JSON list ({@code enumValues}); text wins when both are present.
 * The bounds in {@code constraints} are used, any enumeration in it is ignored.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AttributeSpec {
    private String name;
    private String displayName;
    private String description;
    private Set<AttributeCategory> categories;
    private DataType dataType;
    private boolean required;
    private boolean multiValue;
    private JsonNode defaultValue;
    private String permittedValues;
    private JsonNode enumValues;
    private AttributeConstraints constraints;
    private List<String> tags;
    private String externalId;
    @Builder.Default
    private boolean custom = true;
    private String createdBy;
}
