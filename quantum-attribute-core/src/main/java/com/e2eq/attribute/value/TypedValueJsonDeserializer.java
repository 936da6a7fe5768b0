package com.e2eq.attribute.value;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Reads the natural JSON form back. Without a declared type a date arrives as a string.
 */
public class TypedValueJsonDeserializer extends StdDeserializer<TypedValue> {

    public TypedValueJsonDeserializer() {
        super(TypedValue.class);
    }

    @Override
    public TypedValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.readValueAsTree();
        try {
            return TypedValues.fromJson(node);
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, "Cannot read typed value: " + e.getMessage(), e);
        }
    }
}
