package com.e2eq.attribute.mongo;

import com.e2eq.attribute.constraint.AttributeConstraints;
import com.e2eq.attribute.constraint.ValueFormat;
import com.e2eq.attribute.exceptions.AttributeStoreException;
import com.e2eq.attribute.model.AttributeCategory;
import com.e2eq.attribute.model.AttributeDefinition;
import com.e2eq.attribute.model.AttributeMetadata;
import com.e2eq.attribute.model.persistent.AttributeDocument;
import com.e2eq.attribute.model.persistent.ConstraintsDocument;
import com.e2eq.attribute.model.persistent.MetadataDocument;
import com.e2eq.attribute.value.DataType;
import com.e2eq.attribute.value.TypedValue;
import com.e2eq.attribute.value.TypedValues;
import org.bson.types.ObjectId;

import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Converts between {@link AttributeDefinition} and its Morphia document. The definition's
 * {@code revision} is the document's {@code @Version}.
 */
public final class AttributeDocumentMapper {

    private AttributeDocumentMapper() {
    }

    /**
     * @return empty when {@code id} is not a valid ObjectId; such ids can never be stored
     */
    public static Optional<ObjectId> parseId(String id) {
        if (id == null || !ObjectId.isValid(id)) {
            return Optional.empty();
        }
        return Optional.of(new ObjectId(id));
    }

    public static AttributeDocument toDocument(AttributeDefinition definition) {
        AttributeDocument doc = new AttributeDocument();
        doc.setId(parseId(definition.getId()).orElse(null));
        doc.setName(definition.getName());
        doc.setDisplayName(definition.getDisplayName());
        doc.setDescription(definition.getDescription());
        List<String> categories = new ArrayList<>();
        if (definition.getCategories() != null) {
            definition.getCategories().forEach(c -> categories.add(c.wireName()));
        }
        doc.setCategories(categories);
        doc.setDataType(definition.getDataType() == null ? null : definition.getDataType().wireName());
        doc.setRequired(definition.isRequired());
        doc.setMultiValue(definition.isMultiValue());
        doc.setDefaultValue(definition.getDefaultValue() == null ? null : TypedValues.toPlain(definition.getDefaultValue()));
        doc.setConstraints(toDocument(definition.getConstraints()));
        doc.setMetadata(toDocument(definition.getMetadata()));
        doc.setActive(definition.isActive());
        doc.setCreatedAt(definition.getCreatedAt());
        doc.setUpdatedAt(definition.getUpdatedAt());
        doc.setVersion(definition.getRevision() > 0 ? definition.getRevision() : null);
        return doc;
    }

    public static AttributeDefinition toDefinition(AttributeDocument doc) {
        try {
            DataType dataType = DataType.fromWire(doc.getDataType());
            Set<AttributeCategory> categories = new LinkedHashSet<>();
            if (doc.getCategories() != null) {
                doc.getCategories().forEach(c -> categories.add(AttributeCategory.fromWire(c)));
            }
            return AttributeDefinition.builder()
                    .id(doc.getId() == null ? null : doc.getId().toHexString())
                    .name(doc.getName())
                    .displayName(doc.getDisplayName())
                    .description(doc.getDescription())
                    .categories(categories)
                    .dataType(dataType)
                    .required(doc.isRequired())
                    .multiValue(doc.isMultiValue())
                    .defaultValue(doc.getDefaultValue() == null ? null : TypedValues.fromPlain(doc.getDefaultValue(), dataType))
                    .constraints(toConstraints(doc.getConstraints(), dataType))
                    .metadata(toMetadata(doc.getMetadata()))
                    .active(doc.isActive())
                    .createdAt(doc.getCreatedAt())
                    .updatedAt(doc.getUpdatedAt())
                    .revision(doc.getVersion() == null ? 0L : doc.getVersion())
                    .build();
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new AttributeStoreException("Stored attribute " + doc.getId() + " cannot be read: " + e.getMessage(), e);
        }
    }

    static ConstraintsDocument toDocument(AttributeConstraints constraints) {
        ConstraintsDocument doc = new ConstraintsDocument();
        if (constraints == null) {
            return doc;
        }
        doc.setMinLength(constraints.getMinLength());
        doc.setMaxLength(constraints.getMaxLength());
        doc.setMinValue(constraints.getMinValue());
        doc.setMaxValue(constraints.getMaxValue());
        doc.setPattern(constraints.getPattern());
        doc.setFormat(constraints.getFormat() == null ? null : constraints.getFormat().wireName());
        List<Object> values = new ArrayList<>();
        if (constraints.getEnumValues() != null) {
            constraints.getEnumValues().forEach(v -> values.add(TypedValues.toPlain(v)));
        }
        doc.setEnumValues(values);
        return doc;
    }

    static AttributeConstraints toConstraints(ConstraintsDocument doc, DataType dataType) {
        if (doc == null) {
            return AttributeConstraints.empty();
        }
        List<TypedValue> values = new ArrayList<>();
        if (doc.getEnumValues() != null) {
            doc.getEnumValues().forEach(v -> values.add(TypedValues.fromPlain(v, dataType)));
        }
        return AttributeConstraints.builder()
                .minLength(doc.getMinLength())
                .maxLength(doc.getMaxLength())
                .minValue(doc.getMinValue())
                .maxValue(doc.getMaxValue())
                .pattern(doc.getPattern())
                .format(ValueFormat.fromWire(doc.getFormat()))
                .enumValues(values)
                .build();
    }

    static MetadataDocument toDocument(AttributeMetadata metadata) {
        MetadataDocument doc = new MetadataDocument();
        if (metadata == null) {
            doc.setVersion(AttributeMetadata.DEFAULT_VERSION);
            return doc;
        }
        doc.setCreatedBy(metadata.getCreatedBy());
        doc.setLastModifiedBy(metadata.getLastModifiedBy());
        doc.setTags(metadata.getTags() == null ? new ArrayList<>() : new ArrayList<>(metadata.getTags()));
        doc.setSystem(metadata.isSystem());
        doc.setCustom(metadata.isCustom());
        doc.setVersion(metadata.getVersion());
        doc.setExternalId(metadata.getExternalId());
        return doc;
    }

    static AttributeMetadata toMetadata(MetadataDocument doc) {
        if (doc == null) {
            return AttributeMetadata.builder().build();
        }
        return AttributeMetadata.builder()
                .createdBy(doc.getCreatedBy())
                .lastModifiedBy(doc.getLastModifiedBy())
                .tags(doc.getTags() == null ? new ArrayList<>() : new ArrayList<>(doc.getTags()))
                .system(doc.isSystem())
                .custom(doc.isCustom())
                .version(doc.getVersion() == null ? AttributeMetadata.DEFAULT_VERSION : doc.getVersion())
                .externalId(doc.getExternalId())
                .build();
    }
}
