package com.e2eq.attribute.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-item outcome of a bulk delete. Every requested id lands in exactly one list.
 */
public record BulkDeleteSummary(List<String> deleted,
                                List<String> failedSystem,
                                List<String> failedInUse,
                                List<String> failedNotFound,
                                List<FailedItem> failedOther) {

    public BulkDeleteSummary {
        deleted = List.copyOf(deleted);
        failedSystem = List.copyOf(failedSystem);
        failedInUse = List.copyOf(failedInUse);
        failedNotFound = List.copyOf(failedNotFound);
        failedOther = List.copyOf(failedOther);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int requested() {
        return deleted.size() + failedCount();
    }

    public int failedCount() {
        return failedSystem.size() + failedInUse.size() + failedNotFound.size() + failedOther.size();
    }

    @JsonIgnore
    public boolean isCompleteSuccess() {
        return failedCount() == 0;
    }

    public Optional<FailureClass> dominantFailure() {
        if (!failedSystem.isEmpty()) {
            return Optional.of(FailureClass.FORBIDDEN);
        }
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
            return String.format("Successfully deleted %d %s", deleted.size(), plural(deleted.size()));
        }
        List<String> reasons = new ArrayList<>();
        if (!failedSystem.isEmpty()) {
            reasons.add(failedSystem.size() + " system " + plural(failedSystem.size()) + " cannot be deleted");
        }
        if (!failedInUse.isEmpty()) {
            reasons.add(failedInUse.size() + " " + plural(failedInUse.size()) + " used in policies");
        }
        if (!failedNotFound.isEmpty()) {
            reasons.add(failedNotFound.size() + " " + plural(failedNotFound.size()) + " not found");
        }
        if (!failedOther.isEmpty()) {
            reasons.add(failedOther.size() + " " + plural(failedOther.size()) + " could not be deleted");
        }
        return String.format("Deleted %d of %d %s; %s", deleted.size(), requested(), plural(requested()),
                String.join("; ", reasons));
    }

    private static String plural(int n) {
        return n == 1 ? "attribute" : "attributes";
    }

    /**
     * Not thread safe; filled by the coordinator after all items are settled.
     */
    public static final class Builder {
        private final List<String> deleted = new ArrayList<>();
        private final List<String> failedSystem = new ArrayList<>();
        private final List<String> failedInUse = new ArrayList<>();
        private final List<String> failedNotFound = new ArrayList<>();
        private final List<FailedItem> failedOther = new ArrayList<>();

        public Builder deleted(String id) {
            deleted.add(id);
            return this;
        }

        public Builder failedSystem(String id) {
            failedSystem.add(id);
            return this;
        }

        public Builder failedInUse(String id) {
            failedInUse.add(id);
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

        public BulkDeleteSummary build() {
            return new BulkDeleteSummary(deleted, failedSystem, failedInUse, failedNotFound, failedOther);
        }
    }
}
