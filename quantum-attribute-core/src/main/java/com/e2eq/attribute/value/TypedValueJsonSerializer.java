package com.e2eq.attribute.value;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

public class TypedValueJsonSerializer extends StdSerializer<TypedValue> {

    public TypedValueJsonSerializer() {
        super(TypedValue.class);
    }

    @Override
    public void serialize(TypedValue value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeTree(TypedValues.toJson(value));
    }
}
