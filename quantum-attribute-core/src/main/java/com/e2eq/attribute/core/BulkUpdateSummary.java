package com.e2eq.attribute.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-item outcome of a bulk update. Every requested id lands in exactly one list; an update that
 * changed nothing still counts as updated.
 */
public record BulkUpdateSummary(List<String> updated,
                                List<FailedItem> failedInUse,
                                List<String> failedNotFound,
                                List<FailedItem> failedOther) {

    public BulkUpdateSummary {
        updated = List.copyOf(updated);
        failedInUse = List.copyOf(failedInUse);
        failedNotFound = List.copyOf(failedNotFound);
        failedOther = List.copyOf(failedOther);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int requested() {
        return updated.size() + failedCount();
    }

    public int failedCount() {
        return failedInUse.size() + failedNotFound.size() + failedOther.size();
    }

    @JsonIgnore
    public boolean isCompleteSuccess() {
        return failedCount() == 0;
    }

    public Optional<FailureClass> dominantFailure() {
        if (!failedInUse.isEmpty()) {
            return Optional.of(FailureClass.CONFLICT);
        }
        if (!failedNotFound.isEmpty()) {
            return Optional.of(FailureClass.NOT_FOUND);
        }
        if (!failedOther.isEmpty()) {
            return Optional.of(FailureClass.OTHER);
        }
        return Optional.empty();
    }

    public String message() {
        if (isCompleteSuccess()) {
            return String.format("%d %s updated successfully", updated.size(), plural(updated.size()));
        }
        List<String> reasons = new ArrayList<>();
        if (!failedInUse.isEmpty()) {
            reasons.add(failedInUse.size() + " " + plural(failedInUse.size()) + " locked by policy usage");
        }
        if (!failedNotFound.isEmpty()) {
            reasons.add(failedNotFound.size() + " " + plural(failedNotFound.size()) + " not found");
        }
        if (!failedOther.isEmpty()) {
            reasons.add(failedOther.size() + " " + plural(failedOther.size()) + " could not be updated");
        }
        return String.format("Updated %d of %d %s; %s", updated.size(), requested(), plural(requested()),
                String.join("; ", reasons));
    }

    private static String plural(int n) {
        return n == 1 ? "attribute" : "attributes";
    }

    public static final class Builder {
        private final List<String> updated = new ArrayList<>();
        private final List<FailedItem> failedInUse = new ArrayList<>();
        private final List<String> failedNotFound = new ArrayList<>();
        private final List<FailedItem> failedOther = new ArrayList<>();

        public Builder updated(String id) {
            updated.add(id);
            return this;
        }

        public Builder failedInUse(String id, String reason) {
            failedInUse.add(new FailedItem(id, reason));
            return this;
        }

        public Builder failedNotFound(String id) {
            failedNotFound.add(id);
            return this;
        }

        public Builder failedOther(String id, String reason) {
            failedOther.add(new FailedItem(id, reason));
            return this;
        }

        public BulkUpdateSummary build() {
            return new BulkUpdateSummary(updated, failedInUse, failedNotFound, failedOther);
        }
    }
}
