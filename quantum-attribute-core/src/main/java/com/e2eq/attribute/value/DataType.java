package com.e2eq.attribute.value;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The declared type of an attribute definition. Also used as the kind tag of a {@link TypedValue}.
 */
public enum DataType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    DATE("date"),
    ARRAY("array"),
    OBJECT("object");

    private final String wireName;

    DataType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Composite types are the ones whose permitted values may only grow once the attribute is in use.
     */
    public boolean isComposite() {
        return this == ARRAY || this == OBJECT;
    }

    public boolean isScalar() {
        return !isComposite();
    }

    @JsonCreator
    public static DataType fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DataType t : values()) {
            if (t.wireName.equals(normalized)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown data type '" + value + "'. Valid data types: string, number, boolean, date, array, object");
    }
}
