package com.e2eq.attribute.resource.dto;

import com.e2eq.attribute.value.DataType;
import io.quarkus.runtime.annotations.RegisterForReflection;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /attributes/parse}: reads permitted-value text without storing anything.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class ParsePreviewRequest {
    @NotNull(message = "dataType is required")
    private DataType dataType;
    @Size(max = 100000)
    private String text;
}
