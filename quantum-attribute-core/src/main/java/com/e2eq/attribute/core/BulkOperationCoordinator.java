package com.e2eq.attribute.core;

import com.e2eq.attribute.exceptions.AttributeAdminException;
import com.e2eq.attribute.exceptions.AttributeConflictException;
import com.e2eq.attribute.exceptions.AttributeForbiddenException;
import com.e2eq.attribute.exceptions.AttributeNotFoundException;
import com.e2eq.attribute.exceptions.AttributeStoreException;
import com.e2eq.attribute.exceptions.AttributeValidationException;
import com.e2eq.attribute.exceptions.UsageLookupException;
import com.e2eq.attribute.exceptions.ValueConstraintException;
import com.e2eq.attribute.model.AttributeDefinition;
import com.e2eq.attribute.model.AttributePatch;
import com.e2eq.attribute.spi.AttributeStore;
import io.quarkus.logging.Log;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Runs a delete or an update over many attribute ids with partial-success semantics: every id is
 * handled on its own, so one failure never stops the rest. Deletion ids that pass vetting are
 * removed in one revision-checked {@link AttributeStore#deleteMany} call.
 * <p>
 * Only a run in which every item failed for infrastructure reasons is reported by throwing; domain
 * refusals always come back in the summary.
 * </p>
 */
public class BulkOperationCoordinator {

    private final AttributeRepository repository;
    private final AttributeStore store;
    private final Executor executor;

    public BulkOperationCoordinator(AttributeRepository repository, AttributeStore store) {
        this(repository, store, Runnable::run);
    }

    /**
     * @param executor runs the per-item checks; a direct executor keeps them on the caller thread
     */
    public BulkOperationCoordinator(AttributeRepository repository, AttributeStore store, Executor executor) {
        this.repository = repository;
        this.store = store;
        this.executor = executor;
    }

    public BulkDeleteSummary bulkDelete(List<String> ids) {
        List<String> distinct = distinctIds(ids);

        Map<String, CompletableFuture<AttributeDefinition>> checks = new LinkedHashMap<>();
        for (String id : distinct) {
            checks.put(id, CompletableFuture.supplyAsync(() -> repository.vetDeletion(id), executor));
        }

        BulkDeleteSummary.Builder summary = BulkDeleteSummary.builder();
        Map<String, Long> vetted = new LinkedHashMap<>();
        List<RuntimeException> infrastructureFailures = new ArrayList<>();

        for (Map.Entry<String, CompletableFuture<AttributeDefinition>> check : checks.entrySet()) {
            String id = check.getKey();
            try {
                AttributeDefinition definition = check.getValue().join();
                vetted.put(id, definition.getRevision());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                classify(summary, id, cause, infrastructureFailures);
            }
        }

        if (!vetted.isEmpty()) {
            try {
                Set<String> removed = store.deleteMany(vetted);
                for (String id : vetted.keySet()) {
                    if (removed.contains(id)) {
                        summary.deleted(id);
                    } else {
                        summary.failedOther(id, "Attribute was modified concurrently; reload and retry");
                    }
                }
            } catch (RuntimeException e) {
                Log.warnf(e, "Bulk delete of %d vetted attributes failed", vetted.size());
                for (String id : vetted.keySet()) {
                    summary.failedOther(id, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
                    infrastructureFailures.add(e);
                }
            }
        }

        BulkDeleteSummary result = summary.build();
        if (!infrastructureFailures.isEmpty() && infrastructureFailures.size() == distinct.size()) {
            Log.errorf("Bulk delete of %d attributes failed entirely", distinct.size());
            throw infrastructureFailures.get(0);
        }
        Log.infof("Bulk delete: %d deleted, %d system, %d in use, %d not found, %d other",
                result.deleted().size(), result.failedSystem().size(), result.failedInUse().size(),
                result.failedNotFound().size(), result.failedOther().size());
        return result;
    }

    /**
     * Applies one patch to each id through {@link AttributeRepository#update}, so the edit rules of a
     * referenced attribute are enforced per item. The patch may not rename and may not carry an
     * expected revision, since neither means anything across several attributes.
     */
    public BulkUpdateSummary bulkUpdate(List<String> ids, AttributePatch patch) {
        List<String> distinct = distinctIds(ids);
        if (patch == null) {
            throw new AttributeValidationException("Updates object is required");
        }
        if (patch.getName() != null) {
            throw new AttributeValidationException("Attribute name cannot be changed in a bulk update", List.of("name"));
        }
        if (patch.getExpectedRevision() != null) {
            throw new AttributeValidationException("A revision cannot be checked in a bulk update", List.of("revision"));
        }

        Map<String, CompletableFuture<AttributeDefinition>> updates = new LinkedHashMap<>();
        for (String id : distinct) {
            updates.put(id, CompletableFuture.supplyAsync(() -> repository.update(id, patch), executor));
        }

        BulkUpdateSummary.Builder summary = BulkUpdateSummary.builder();
        List<RuntimeException> infrastructureFailures = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<AttributeDefinition>> update : updates.entrySet()) {
            String id = update.getKey();
            try {
                update.getValue().join();
                summary.updated(id);
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (cause instanceof ValueConstraintException
                        && ((ValueConstraintException) cause).getViolation().which().isUsageRule()) {
                    summary.failedInUse(id, cause.getMessage());
                } else if (cause instanceof AttributeNotFoundException) {
                    summary.failedNotFound(id);
                } else {
                    summary.failedOther(id, reasonOf(cause));
                    if (isInfrastructure(cause)) {
                        Log.warnf(cause, "Bulk update could not update attribute %s", id);
                        infrastructureFailures.add(asRuntime(cause, id));
                    }
                }
            }
        }

        BulkUpdateSummary result = summary.build();
        if (!infrastructureFailures.isEmpty() && infrastructureFailures.size() == distinct.size()) {
            Log.errorf("Bulk update of %d attributes failed entirely", distinct.size());
            throw infrastructureFailures.get(0);
        }
        Log.infof("Bulk update: %d updated, %d in use, %d not found, %d other",
                result.updated().size(), result.failedInUse().size(), result.failedNotFound().size(),
                result.failedOther().size());
        return result;
    }

    private static List<String> distinctIds(List<String> ids) {
        List<String> distinct = ids == null ? List.of() : ids.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .collect(Collectors.toList());
        if (distinct.isEmpty()) {
            throw new AttributeValidationException("Attribute IDs array is required");
        }
        return distinct;
    }

    private static String reasonOf(Throwable failure) {
        return failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
    }

    private static RuntimeException asRuntime(Throwable failure, String id) {
        return failure instanceof RuntimeException
                ? (RuntimeException) failure
                : new AttributeStoreException("Bulk operation failed for " + id, failure);
    }

    private static void classify(BulkDeleteSummary.Builder summary, String id, Throwable failure,
                                 List<RuntimeException> infrastructureFailures) {
        if (failure instanceof AttributeForbiddenException) {
            summary.failedSystem(id);
        } else if (failure instanceof AttributeConflictException
                && ((AttributeConflictException) failure).getReason() == AttributeConflictException.Reason.IN_USE) {
            summary.failedInUse(id);
        } else if (failure instanceof AttributeNotFoundException) {
            summary.failedNotFound(id);
        } else {
            summary.failedOther(id, reasonOf(failure));
            if (isInfrastructure(failure)) {
                Log.warnf(failure, "Bulk delete could not check attribute %s", id);
                infrastructureFailures.add(asRuntime(failure, id));
            }
        }
    }

    private static boolean isInfrastructure(Throwable failure) {
        return failure instanceof AttributeStoreException
                || failure instanceof UsageLookupException
                || !(failure instanceof AttributeAdminException);
    }
}
