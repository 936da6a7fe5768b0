package com.e2eq.attribute.mongo;

import com.e2eq.attribute.model.persistent.AttributeDocument;
import com.mongodb.client.MongoClient;
import dev.morphia.Datastore;
import dev.morphia.Morphia;
import io.quarkus.arc.DefaultBean;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.ConfigProvider;

/**
 * Builds the Morphia datastore for the attribute collection on the Quarkus managed Mongo client.
 */
@ApplicationScoped
public class AttributeDatastoreProducer {

    @Produces
    @DefaultBean
    @Singleton
    public Datastore attributeDatastore(MongoClient mongoClient) {
        String database = ConfigProvider.getConfig()
                .getOptionalValue("quantum.attributes.database", String.class)
                .orElse("attribute-admin");
        Log.infof("Creating Morphia datastore for attribute database: %s", database);

        Datastore datastore = Morphia.createDatastore(mongoClient, database);
        datastore.getMapper().map(AttributeDocument.class);
        datastore.ensureIndexes();
        return datastore;
    }
}
