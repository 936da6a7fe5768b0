package com.e2eq.attribute.core;

/**
 * One item of a bulk operation that failed for a reason not covered by a dedicated list.
 */
public record FailedItem(String id, String reason) {
}
