package com.e2eq.attribute.spi;

import java.util.List;

public record AttributePage<T>(List<T> items, int page, int limit, long total) {

    public AttributePage {
        items = List.copyOf(items);
    }

    public int pages() {
        return limit <= 0 ? 0 : (int) ((total + limit - 1) / limit);
    }

    public boolean hasNext() {
        return page < pages();
    }

    public boolean hasPrev() {
        return page > 1;
    }
}
