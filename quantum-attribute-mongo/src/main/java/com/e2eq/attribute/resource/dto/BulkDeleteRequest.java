package com.e2eq.attribute.resource.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class BulkDeleteRequest {
    @NotEmpty(message = "Attribute IDs array is required")
    private List<String> attributeIds;
}
