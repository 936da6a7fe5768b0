package com.e2eq.attribute.rest.models;

import com.e2eq.attribute.spi.AttributePage;
import io.quarkus.runtime.annotations.RegisterForReflection;

@RegisterForReflection
public record PaginationInfo(int page, int limit, long total, int pages, boolean hasNext, boolean hasPrev) {

    public static PaginationInfo of(AttributePage<?> page) {
        return new PaginationInfo(page.page(), page.limit(), page.total(), page.pages(), page.hasNext(), page.hasPrev());
    }
}
