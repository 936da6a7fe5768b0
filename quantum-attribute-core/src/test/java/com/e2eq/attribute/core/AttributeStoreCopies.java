package com.e2eq.attribute.core;

import com.e2eq.attribute.model.AttributeDefinition;

import java.util.ArrayList;
import java.util.LinkedHashSet;

/**
 * Deep enough copies that tests cannot mutate what the test double holds.
 */
final class AttributeStoreCopies {

    private AttributeStoreCopies() {
    }

    static AttributeDefinition copy(AttributeDefinition d) {
        return d.toBuilder()
                .categories(new LinkedHashSet<>(d.getCategories()))
                .constraints(d.getConstraints().toBuilder().enumValues(new ArrayList<>(d.getEnumValues())).build())
                .metadata(d.getMetadata().toBuilder().tags(new ArrayList<>(d.getMetadata().getTags())).build())
                .build();
    }
}
