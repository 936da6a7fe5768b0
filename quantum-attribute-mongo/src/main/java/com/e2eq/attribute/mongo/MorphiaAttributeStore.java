package com.e2eq.attribute.mongo;

import com.e2eq.attribute.exceptions.AttributeConflictException;
import com.e2eq.attribute.exceptions.AttributeNotFoundException;
import com.e2eq.attribute.exceptions.AttributeStoreException;
import com.e2eq.attribute.model.AttributeCategory;
import com.e2eq.attribute.model.AttributeDefinition;
import com.e2eq.attribute.model.persistent.AttributeDocument;
import com.e2eq.attribute.spi.AttributePage;
import com.e2eq.attribute.spi.AttributeQuery;
import com.e2eq.attribute.spi.AttributeStore;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.model.BulkWriteOptions;
import com.mongodb.client.model.DeleteOneModel;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.WriteModel;
import dev.morphia.Datastore;
import dev.morphia.VersionMismatchException;
import dev.morphia.query.FindOptions;
import dev.morphia.query.Query;
import dev.morphia.query.Sort;
import dev.morphia.query.filters.Filter;
import dev.morphia.query.filters.Filters;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.bson.Document;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Morphia backed {@link AttributeStore}. Revision checks ride on the document's {@code @Version}:
 * updates go through {@code save} with the caller's revision, deletes filter on it.
 */
@ApplicationScoped
public class MorphiaAttributeStore implements AttributeStore {

    private static final Pattern REGEX_SPECIALS = Pattern.compile("[.*+?^${}()|\\[\\]\\\\]");

    @Inject
    Datastore datastore;

    @Override
    public Optional<AttributeDefinition> findById(String id) {
        Optional<ObjectId> oid = AttributeDocumentMapper.parseId(id);
        if (oid.isEmpty()) {
            return Optional.empty();
        }
        try {
            AttributeDocument doc = datastore.find(AttributeDocument.class)
                    .filter(Filters.eq("_id", oid.get()))
                    .first();
            return Optional.ofNullable(doc).map(AttributeDocumentMapper::toDefinition);
        } catch (MongoException e) {
            throw new AttributeStoreException("Failed to load attribute " + id, e);
        }
    }

    @Override
    public Optional<AttributeDefinition> findByName(String name) {
        try {
            AttributeDocument doc = datastore.find(AttributeDocument.class)
                    .filter(Filters.eq("name", name))
                    .first();
            return Optional.ofNullable(doc).map(AttributeDocumentMapper::toDefinition);
        } catch (MongoException e) {
            throw new AttributeStoreException("Failed to load attribute named " + name, e);
        }
    }

    @Override
    public AttributeDefinition insert(AttributeDefinition definition) {
        AttributeDocument doc = AttributeDocumentMapper.toDocument(definition);
        doc.setId(null);
        doc.setVersion(null);
        try {
            datastore.insert(doc);
        } catch (MongoWriteException e) {
            throw translateWriteError(e, definition.getName());
        } catch (MongoException e) {
            throw new AttributeStoreException("Failed to insert attribute " + definition.getName(), e);
        }
        Log.debugf("Inserted attribute %s with id %s", doc.getName(), doc.getId());
        return AttributeDocumentMapper.toDefinition(doc);
    }

    @Override
    public AttributeDefinition update(AttributeDefinition definition, long expectedRevision) {
        Optional<ObjectId> oid = AttributeDocumentMapper.parseId(definition.getId());
        if (oid.isEmpty()) {
            throw new AttributeNotFoundException(definition.getId());
        }
        AttributeDocument doc = AttributeDocumentMapper.toDocument(definition);
        doc.setVersion(expectedRevision);
        try {
            datastore.save(doc);
        } catch (VersionMismatchException e) {
            throw missingOrStale(definition.getId(), oid.get(), expectedRevision);
        } catch (MongoWriteException e) {
            throw translateWriteError(e, definition.getName());
        } catch (MongoException e) {
            throw new AttributeStoreException("Failed to update attribute " + definition.getId(), e);
        }
        return AttributeDocumentMapper.toDefinition(doc);
    }

    @Override
    public void delete(String id, long expectedRevision) {
        ObjectId oid = AttributeDocumentMapper.parseId(id).orElseThrow(() -> new AttributeNotFoundException(id));
        long deleted;
        try {
            deleted = datastore.find(AttributeDocument.class)
                    .filter(Filters.eq("_id", oid))
                    .filter(Filters.eq("version", expectedRevision))
                    .delete()
                    .getDeletedCount();
        } catch (MongoException e) {
            throw new AttributeStoreException("Failed to delete attribute " + id, e);
        }
        if (deleted == 0) {
            throw missingOrStale(id, oid, expectedRevision);
        }
    }

    @Override
    public Set<String> deleteMany(Map<String, Long> expectedRevisions) {
        if (expectedRevisions.isEmpty()) {
            return Set.of();
        }
        Map<ObjectId, String> requested = new LinkedHashMap<>();
        List<WriteModel<Document>> ops = new ArrayList<>(expectedRevisions.size());
        expectedRevisions.forEach((id, revision) -> AttributeDocumentMapper.parseId(id).ifPresent(oid -> {
            requested.put(oid, id);
            ops.add(new DeleteOneModel<>(new Document("_id", oid).append("version", revision)));
        }));
        if (ops.isEmpty()) {
            return Set.of();
        }
        try {
            var collection = datastore.getDatabase().getCollection(AttributeDocument.COLLECTION);
            collection.bulkWrite(ops, new BulkWriteOptions().ordered(false));
            Set<ObjectId> remaining = new LinkedHashSet<>();
            for (Document d : collection.find(com.mongodb.client.model.Filters.in("_id", requested.keySet()))
                    .projection(Projections.include("_id"))) {
                remaining.add(d.getObjectId("_id"));
            }
            return requested.entrySet().stream()
                    .filter(e -> !remaining.contains(e.getKey()))
                    .map(Map.Entry::getValue)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        } catch (MongoException e) {
            throw new AttributeStoreException("Bulk delete of " + ops.size() + " attributes failed", e);
        }
    }

    @Override
    public AttributePage<AttributeDefinition> list(AttributeQuery query) {
        try {
            Query<AttributeDocument> q = datastore.find(AttributeDocument.class);
            List<Filter> filters = filtersFor(query);
            if (!filters.isEmpty()) {
                q.filter(filters.toArray(new Filter[0]));
            }
            long total = q.count();
            FindOptions options = new FindOptions()
                    .sort(query.isAscending() ? Sort.ascending(query.getSortBy()) : Sort.descending(query.getSortBy()))
                    .skip(query.offset())
                    .limit(query.getLimit());
            List<AttributeDefinition> items = q.iterator(options).toList().stream()
                    .map(AttributeDocumentMapper::toDefinition)
                    .collect(Collectors.toList());
            return new AttributePage<>(items, query.getPage(), query.getLimit(), total);
        } catch (MongoException e) {
            throw new AttributeStoreException("Failed to list attributes", e);
        }
    }

    @Override
    public List<AttributeDefinition> findAll() {
        try {
            return datastore.find(AttributeDocument.class)
                    .iterator(new FindOptions().sort(Sort.ascending("name")))
                    .toList().stream()
                    .map(AttributeDocumentMapper::toDefinition)
                    .collect(Collectors.toList());
        } catch (MongoException e) {
            throw new AttributeStoreException("Failed to load attributes", e);
        }
    }

    static List<Filter> filtersFor(AttributeQuery query) {
        List<Filter> filters = new ArrayList<>();
        if (query.getSearch() != null && !query.getSearch().isBlank()) {
            String pattern = escapeRegex(query.getSearch().trim());
            filters.add(Filters.or(
                    Filters.regex("name", pattern).caseInsensitive(),
                    Filters.regex("displayName", pattern).caseInsensitive(),
                    Filters.regex("description", pattern).caseInsensitive()));
        }
        if (query.getCategories() != null && !query.getCategories().isEmpty()) {
            filters.add(Filters.in("categories", query.getCategories().stream()
                    .map(AttributeCategory::wireName)
                    .collect(Collectors.toList())));
        }
        if (query.getDataType() != null) {
            filters.add(Filters.eq("dataType", query.getDataType().wireName()));
        }
        if (query.getRequired() != null) {
            filters.add(Filters.eq("required", query.getRequired()));
        }
        if (query.getActive() != null) {
            filters.add(Filters.eq("active", query.getActive()));
        }
        if (query.getSystem() != null) {
            filters.add(Filters.eq("metadata.system", query.getSystem()));
        }
        if (query.getCustom() != null) {
            filters.add(Filters.eq("metadata.custom", query.getCustom()));
        }
        return filters;
    }

    /**
     * Search text is matched literally.
     */
    static String escapeRegex(String text) {
        return REGEX_SPECIALS.matcher(text).replaceAll("\\\\$0");
    }

    private AttributeConflictException missingOrStale(String id, ObjectId oid, long expectedRevision) {
        boolean exists;
        try {
            exists = datastore.find(AttributeDocument.class).filter(Filters.eq("_id", oid)).count() > 0;
        } catch (MongoException e) {
            throw new AttributeStoreException("Failed to load attribute " + id, e);
        }
        if (!exists) {
            throw new AttributeNotFoundException(id);
        }
        return AttributeConflictException.staleRevision(id, expectedRevision);
    }

    private static RuntimeException translateWriteError(MongoWriteException e, String name) {
        if (ErrorCategory.fromErrorCode(e.getCode()) == ErrorCategory.DUPLICATE_KEY) {
            return new AttributeConflictException(AttributeConflictException.Reason.DUPLICATE_NAME,
                    String.format("Attribute with name '%s' already exists", name));
        }
        return new AttributeStoreException("Write of attribute " + name + " failed", e);
    }
}
