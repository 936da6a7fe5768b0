package com.e2eq.attribute.model.persistent;

import dev.morphia.annotations.Entity;
import dev.morphia.annotations.Field;
import dev.morphia.annotations.Id;
import dev.morphia.annotations.Index;
import dev.morphia.annotations.IndexOptions;
import dev.morphia.annotations.Indexes;
import dev.morphia.annotations.Version;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Stored form of an attribute definition. Categories and data type are kept as their wire names,
 * permitted values as plain BSON values (see {@link com.e2eq.attribute.value.TypedValues#toPlain}).
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode
@RegisterForReflection
@Entity(value = AttributeDocument.COLLECTION, useDiscriminator = false)
@Indexes({
    @Index(options = @IndexOptions(name = "idx_attribute_name_unique", unique = true),
           fields = {@Field("name")}),
    @Index(options = @IndexOptions(name = "idx_attribute_category_active"),
           fields = {@Field("categories"), @Field("active")}),
    @Index(options = @IndexOptions(name = "idx_attribute_datatype"),
           fields = {@Field("dataType")})
})
public class AttributeDocument {
    public static final String COLLECTION = "attributes";

    @Id
    protected ObjectId id;

    protected String name;
    protected String displayName;
    protected String description;
    protected List<String> categories = new ArrayList<>();
    protected String dataType;
    protected boolean required;
    protected boolean multiValue;
    protected Object defaultValue;
    protected ConstraintsDocument constraints;
    protected MetadataDocument metadata;
    protected boolean active = true;
    protected Date createdAt;
    protected Date updatedAt;

    @Version
    protected Long version;
}
