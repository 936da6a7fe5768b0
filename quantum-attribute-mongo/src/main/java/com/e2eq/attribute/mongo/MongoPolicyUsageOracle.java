package com.e2eq.attribute.mongo;

import com.e2eq.attribute.exceptions.UsageLookupException;
import com.e2eq.attribute.model.persistent.AttributeDocument;
import com.e2eq.attribute.spi.AttributeUsage;
import com.e2eq.attribute.spi.PolicyReference;
import com.e2eq.attribute.spi.PolicyUsageOracle;
import com.mongodb.MongoException;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Projections;
import dev.morphia.Datastore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the policy subsystem's collection directly. Policies reference attributes by name, in rule
 * subjects and objects, in rule and policy conditions, and in additional resources.
 */
@ApplicationScoped
public class MongoPolicyUsageOracle implements PolicyUsageOracle {

    static final List<String> REFERENCE_PATHS = List.of(
            "rules.subject.attributes.name",
            "rules.object.attributes.name",
            "rules.conditions.field",
            "conditions.field",
            "additionalResources.attributes.name");

    @Inject
    Datastore datastore;

    @ConfigProperty(name = "quantum.attributes.policies.collection", defaultValue = "policies")
    String policiesCollection;

    @Override
    public AttributeUsage usage(String attributeId) {
        Optional<ObjectId> oid = AttributeDocumentMapper.parseId(attributeId);
        if (oid.isEmpty()) {
            return AttributeUsage.unused(attributeId);
        }
        try {
            Document attribute = datastore.getDatabase().getCollection(AttributeDocument.COLLECTION)
                    .find(Filters.eq("_id", oid.get()))
                    .projection(Projections.include("name"))
                    .first();
            if (attribute == null || attribute.getString("name") == null) {
                return AttributeUsage.unused(attributeId);
            }

            List<PolicyReference> policies = new ArrayList<>();
            for (Document policy : datastore.getDatabase().getCollection(policiesCollection)
                    .find(referencesTo(attribute.getString("name")))
                    .projection(Projections.include("_id", "id", "name", "displayName"))) {
                policies.add(toReference(policy));
            }
            return policies.isEmpty()
                    ? AttributeUsage.unused(attributeId)
                    : AttributeUsage.usedBy(attributeId, policies);
        } catch (MongoException e) {
            throw new UsageLookupException(attributeId, e);
        }
    }

    static Bson referencesTo(String attributeName) {
        List<Bson> clauses = new ArrayList<>(REFERENCE_PATHS.size());
        for (String path : REFERENCE_PATHS) {
            clauses.add(Filters.eq(path, attributeName));
        }
        return Filters.or(clauses);
    }

    static PolicyReference toReference(Document policy) {
        Object rawId = policy.get("id") != null ? policy.get("id") : policy.get("_id");
        String id = rawId == null ? null : rawId.toString();
        String name = policy.getString("name");
        String displayName = policy.getString("displayName");
        return new PolicyReference(id, name, displayName == null ? name : displayName);
    }
}
