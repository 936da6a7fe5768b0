package com.e2eq.attribute.core;

import com.e2eq.attribute.constraint.AttributeConstraints;
import com.e2eq.attribute.model.AttributeDefinition;
import com.e2eq.attribute.value.DataType;
import com.e2eq.attribute.value.TypedValues;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a set of attribute definitions as one JSON Schema object, one property per attribute,
 * so clients can validate subject or resource documents before sending them.
 */
public class AttributeSchemaBuilder {

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public ObjectNode build(Collection<AttributeDefinition> attributes) {
        ObjectNode schema = nodes.objectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        ArrayNode required = schema.putArray("required");

        List<AttributeDefinition> ordered = attributes.stream()
                .sorted(Comparator.comparing(AttributeDefinition::getName))
                .collect(Collectors.toList());
        for (AttributeDefinition attribute : ordered) {
            ObjectNode property = propertyOf(attribute);
            if (attribute.isMultiValue()) {
                ObjectNode wrapper = nodes.objectNode();
                wrapper.put("type", "array");
                wrapper.set("items", property);
                describe(wrapper, attribute);
                properties.set(attribute.getName(), wrapper);
            } else {
                properties.set(attribute.getName(), property);
            }
            if (attribute.isRequired()) {
                required.add(attribute.getName());
            }
        }
        return schema;
    }

    private ObjectNode propertyOf(AttributeDefinition attribute) {
        ObjectNode property = nodes.objectNode();
        property.put("type", jsonType(attribute.getDataType()));
        describe(property, attribute);

        AttributeConstraints c = attribute.getConstraints();
        if (c.getMinLength() != null) property.put("minLength", c.getMinLength());
        if (c.getMaxLength() != null) property.put("maxLength", c.getMaxLength());
        if (c.getMinValue() != null) property.put("minimum", c.getMinValue());
        if (c.getMaxValue() != null) property.put("maximum", c.getMaxValue());
        if (c.getPattern() != null) property.put("pattern", c.getPattern());
        if (c.getFormat() != null) {
            property.put("format", c.getFormat().wireName());
        } else if (attribute.getDataType() == DataType.DATE) {
            property.put("format", "date");
        }
        if (c.hasEnumeration()) {
            property.set("enum", TypedValues.toJsonArray(c.getEnumValues()));
        }
        if (attribute.getDefaultValue() != null) {
            property.set("default", TypedValues.toJson(attribute.getDefaultValue()));
        }
        return property;
    }

    private static void describe(ObjectNode node, AttributeDefinition attribute) {
        node.put("title", attribute.getDisplayName());
        if (attribute.getDescription() != null) {
            node.put("description", attribute.getDescription());
        }
    }

    static String jsonType(DataType dataType) {
        switch (dataType) {
            case NUMBER:
                return "number";
            case BOOLEAN:
                return "boolean";
            case ARRAY:
                return "array";
            case OBJECT:
                return "object";
            default:
                return "string";
        }
    }
}
