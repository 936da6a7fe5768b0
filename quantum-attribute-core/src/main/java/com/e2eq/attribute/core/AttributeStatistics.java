package com.e2eq.attribute.core;

import com.e2eq.attribute.model.AttributeCategory;
import com.e2eq.attribute.model.AttributeDefinition;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts over the attribute catalogue. The overview covers every definition; the category and data
 * type breakdowns cover active ones only.
 */
public record AttributeStatistics(Overview overview,
                                  Map<String, CategoryCount> byCategory,
                                  Map<String, Long> byDataType) {

    public record Overview(long total, long active, long required, long custom, long system) {
    }

    public record CategoryCount(long count, long required) {
    }

    public static AttributeStatistics compute(Collection<AttributeDefinition> attributes) {
        long total = 0;
        long active = 0;
        long required = 0;
        long custom = 0;
        long system = 0;
        Map<String, long[]> categories = new LinkedHashMap<>();
        Map<String, Long> dataTypes = new LinkedHashMap<>();

        for (AttributeDefinition a : attributes) {
            total++;
            if (a.isRequired()) required++;
            if (a.getMetadata() != null && a.getMetadata().isCustom()) custom++;
            if (a.isSystem()) system++;
            if (!a.isActive()) {
                continue;
            }
            active++;
            for (AttributeCategory category : a.getCategories()) {
                long[] counts = categories.computeIfAbsent(category.wireName(), k -> new long[2]);
                counts[0]++;
                if (a.isRequired()) counts[1]++;
            }
            if (a.getDataType() != null) {
                dataTypes.merge(a.getDataType().wireName(), 1L, Long::sum);
            }
        }

        Map<String, CategoryCount> byCategory = new LinkedHashMap<>();
        categories.forEach((k, v) -> byCategory.put(k, new CategoryCount(v[0], v[1])));
        return new AttributeStatistics(new Overview(total, active, required, custom, system), byCategory, dataTypes);
    }
}
