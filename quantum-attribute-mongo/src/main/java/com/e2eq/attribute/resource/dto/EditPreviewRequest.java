package com.e2eq.attribute.resource.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Candidate edits applied to a fresh edit session. {@code valuesText} replaces the permitted
 * values, {@code appendText} adds to them; both are read for the attribute's data type.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class EditPreviewRequest {
    private String valuesText;
    private String appendText;
    private String description;
}
