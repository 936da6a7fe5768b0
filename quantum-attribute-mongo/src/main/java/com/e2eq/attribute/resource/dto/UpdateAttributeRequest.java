package com.e2eq.attribute.resource.dto;

import com.e2eq.attribute.model.AttributeCategory;
import com.e2eq.attribute.model.AttributePatch;
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
 * Body of {@code PUT /attributes/{id}}. Absent fields are left unchanged. {@code revision}, when
 * sent, must still be the stored one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class UpdateAttributeRequest {
    private String name;
    private String displayName;
    private String description;
    private Set<AttributeCategory> categories;
    private DataType dataType;
    @JsonProperty("isRequired")
    private Boolean required;
    @JsonProperty("isMultiValue")
    private Boolean multiValue;
    private JsonNode defaultValue;
    private String permittedValues;
    private JsonNode enumValues;
    private ConstraintsPayload constraints;
    @Size(max = 50, message = "at most 50 tags are allowed")
    private List<String> tags;
    private Boolean active;
    private Long revision;

    public AttributePatch toPatch(String modifiedBy) {
        JsonNode values = enumValues;
        if (values == null && constraints != null) {
            values = constraints.getEnumValues();
        }
        return AttributePatch.builder()
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
                .constraints(constraints == null || !constraints.hasBounds() ? null : constraints.toBounds())
                .tags(tags)
                .active(active)
                .expectedRevision(revision)
                .modifiedBy(modifiedBy)
                .build();
    }
}
