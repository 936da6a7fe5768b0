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
public class ConstraintsDocument {
    protected Integer minLength;
    protected Integer maxLength;
    protected Double minValue;
    protected Double maxValue;
    protected String pattern;
    protected String format;
    protected List<Object> enumValues = new ArrayList<>();
}
