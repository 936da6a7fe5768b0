package com.e2eq.attribute.model;

import com.e2eq.attribute.constraint.AttributeConstraints;
import com.e2eq.attribute.value.DataType;
import com.e2eq.attribute.value.TypedValue;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A named, typed fact usable by access-control policies, together with its closed set of
 * permitted values.
 * <p>
 * {@code revision} is the optimistic concurrency token: stores only accept a write that names
 * the revision they currently hold, and bump it on success.
 * </p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttributeDefinition {
    private String id;
    private String name;
    private String displayName;
    private String description;
    @Builder.Default
    private Set<AttributeCategory> categories = new LinkedHashSet<>();
    private DataType dataType;
    @JsonProperty("isRequired")
    private boolean required;
    @JsonProperty("isMultiValue")
    private boolean multiValue;
    private TypedValue defaultValue;
    @Builder.Default
    private AttributeConstraints constraints = AttributeConstraints.empty();
    @Builder.Default
    private AttributeMetadata metadata = AttributeMetadata.builder().build();
    @Builder.Default
    private boolean active = true;
    private Date createdAt;
    private Date updatedAt;
    private long revision;

    @JsonIgnore
    public List<TypedValue> getEnumValues() {
        if (constraints == null || constraints.getEnumValues() == null) {
            return new ArrayList<>();
        }
        return constraints.getEnumValues();
    }

    @JsonIgnore
    public boolean isSystem() {
        return metadata != null && metadata.isSystem();
    }
}
