package com.e2eq.attribute.spi;

import com.e2eq.attribute.model.AttributeDefinition;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keyed persistence of attribute definitions. Implementations can be backed by Mongo (Morphia),
 * in-memory maps, or others.
 * <p>
 * Writes are revision checked: {@link #update} and {@link #delete} only succeed while the stored
 * revision equals the one the caller read, and throw
 * {@link com.e2eq.attribute.exceptions.AttributeConflictException} otherwise. Infrastructure failures
 * surface as {@link com.e2eq.attribute.exceptions.AttributeStoreException}.
 * </p>
 */
public interface AttributeStore {

    Optional<AttributeDefinition> findById(String id);

    Optional<AttributeDefinition> findByName(String name);

    /**
     * Assigns the id and the first revision.
     *
     * @throws com.e2eq.attribute.exceptions.AttributeConflictException when the name is already taken
     */
    AttributeDefinition insert(AttributeDefinition definition);

    /**
     * @return the stored definition with its new revision
     */
    AttributeDefinition update(AttributeDefinition definition, long expectedRevision);

    /**
     * @throws com.e2eq.attribute.exceptions.AttributeNotFoundException when nothing is stored under the id
     */
    void delete(String id, long expectedRevision);

    /**
     * Deletes every entry whose stored revision still matches.
     *
     * @param expectedRevisions id to the revision the caller vetted
     * @return the ids actually deleted
     */
    Set<String> deleteMany(Map<String, Long> expectedRevisions);

    AttributePage<AttributeDefinition> list(AttributeQuery query);

    List<AttributeDefinition> findAll();
}
