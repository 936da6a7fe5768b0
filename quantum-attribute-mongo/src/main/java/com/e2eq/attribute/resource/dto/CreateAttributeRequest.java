package com.e2eq.attribute.resource.dto;

import com.e2eq.attribute.model.AttributeCategory;
import com.e2eq.attribute.model.AttributeSpec;
import com.e2eq.attribute.value.DataType;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.quarkus.runtime.annotations.RegisterForReflection;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

/**
 * Body of {@code POST /attributes}. Permitted values may come as text ({@code permittedValues}),
 * as a JSON list ({@code enumValues}) or inside {@code constraints.enumValues}, in that order of
 * preference.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class CreateAttributeRequest {
    private String name;
    private String displayName;
    private String description;
    private Set<AttributeCategory> categories;
    private DataType dataType;
    @JsonProperty("isRequired")
    private boolean required;
    @JsonProperty("isMultiValue")
    private boolean multiValue;
    private JsonNode defaultValue;
    private String permittedValues;
    private JsonNode enumValues;
    private ConstraintsPayload constraints;
    @Size(max = 50, message = "at most 50 tags are allowed")
    private List<String> tags;
    private String externalId;

    public AttributeSpec toSpec(String createdBy) {
        JsonNode values = enumValues;
        if (values == null && constraints != null) {
            values = constraints.getEnumValues();
        }
        return AttributeSpec.builder()
                .name(name)
                .displayName(displayName)
                .description(description)
                .categories(categories)
                .dataType(dataType)
                .required(required)
                .multiValue(multiValue)
                .defaultValue(defaultValue)
                .permittedValues(permittedValues)
                .enumValues(values)
                .constraints(constraints == null ? null : constraints.toBounds())
                .tags(tags)
                .externalId(externalId)
                .createdBy(createdBy)
                .build();
    }
}
