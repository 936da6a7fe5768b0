package com.e2eq.attribute.model.persistent;

import dev.morphia.annotations.Entity;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@EqualsAndHashCode
@RegisterForReflection
@Entity(useDiscriminator = false)
public class MetadataDocument {
    protected String createdBy;
    protected String lastModifiedBy;
    protected List<String> tags = new ArrayList<>();
    protected boolean system;
    protected boolean custom = true;
    // schema version of the definition, not the concurrency token
    protected String version;
    protected String externalId;
}
