package com.e2eq.attribute.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttributeMetadata {
    public static final String DEFAULT_VERSION = "1.0.0";

    private String createdBy;
    private String lastModifiedBy;
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    @JsonProperty("isSystem")
    private boolean system;
    @Builder.Default
    @JsonProperty("isCustom")
    private boolean custom = true;
    @Builder.Default
    private String version = DEFAULT_VERSION;
    private String externalId;
}
