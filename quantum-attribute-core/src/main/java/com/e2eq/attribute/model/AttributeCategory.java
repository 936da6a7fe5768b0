package com.e2eq.attribute.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AttributeCategory {
    SUBJECT("subject"),
    RESOURCE("resource");

    private final String wireName;

    AttributeCategory(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static AttributeCategory fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AttributeCategory c : values()) {
            if (c.wireName.equals(normalized)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Invalid category '" + value + "'. Valid categories: subject, resource");
    }
}
