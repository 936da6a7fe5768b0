package com.e2eq.attribute.resource.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class BulkUpdateRequest {
    @NotEmpty(message = "Attribute IDs array is required")
    private List<String> attributeIds;

    @Valid
    @NotNull(message = "Updates object is required")
    private UpdateAttributeRequest updates;
}
