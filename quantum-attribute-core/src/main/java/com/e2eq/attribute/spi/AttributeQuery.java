package com.e2eq.attribute.spi;

import com.e2eq.attribute.model.AttributeCategory;
import com.e2eq.attribute.value.DataType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Filter, sort and page of an attribute listing. {@code null} filters are not applied.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AttributeQuery {
    public static final Set<String> SORTABLE_FIELDS = Set.of("name", "displayName", "dataType", "createdAt", "updatedAt");

    private String search;
    private Set<AttributeCategory> categories;
    private DataType dataType;
    private Boolean required;
    private Boolean active;
    private Boolean system;
    private Boolean custom;
    @Builder.Default
    private int page = 1;
    @Builder.Default
    private int limit = 10;
    @Builder.Default
    private String sortBy = "createdAt";
    @Builder.Default
    private boolean ascending = false;

    public int offset() {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(0L, (long) (page - 1) * limit));
    }

    /**
     * Clamps page and limit into range and falls back to the default sort for unknown fields.
     * The page is capped so that its offset still fits an int.
     */
    public AttributeQuery normalized(int maxLimit) {
        AttributeQuery q = toBuilder().build();
        q.limit = Math.min(maxLimit, Math.max(1, limit));
        q.page = Math.min(Math.max(1, page), Integer.MAX_VALUE / q.limit);
        if (sortBy == null || !SORTABLE_FIELDS.contains(sortBy)) {
            q.sortBy = "createdAt";
        }
        if (search != null && search.isBlank()) {
            q.search = null;
        }
        return q;
    }
}
