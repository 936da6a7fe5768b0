package com.e2eq.attribute.resource.dto;

import com.e2eq.attribute.value.DataType;
import com.e2eq.attribute.value.TypedValue;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * @param formatted the values written back in the canonical text form for {@code dataType}
 */
@RegisterForReflection
public record ParsePreviewResponse(DataType dataType, List<TypedValue> values, int count, String formatted) {
}
