package com.e2eq.attribute.mongo;

import com.e2eq.attribute.core.AttributeRepository;
import com.e2eq.attribute.exceptions.AttributeAdminException;
import com.e2eq.attribute.model.AttributeSpec;
import com.e2eq.attribute.spi.AttributeStore;
import com.e2eq.attribute.util.ExceptionLoggingUtils;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.logging.Log;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Creates the built-in, delete-protected attributes listed in {@code seed/system-attributes.json}
 * when {@code quantum.attributes.seed.enabled} is set. Attributes whose name already exists are
 * left alone, so restarts are harmless.
 */
@ApplicationScoped
public class SystemAttributeSeeder {

    static final String SEED_RESOURCE = "/seed/system-attributes.json";

    @Inject
    AttributeRepository repository;

    @Inject
    AttributeStore store;

    @Inject
    ObjectMapper objectMapper;

    @ConfigProperty(name = "quantum.attributes.seed.enabled", defaultValue = "false")
    boolean seedEnabled;

    void onStart(@Observes StartupEvent event) {
        if (!seedEnabled) {
            Log.debug("System attribute seeding disabled");
            return;
        }
        int created = seed(loadSeedSpecs(objectMapper, SEED_RESOURCE));
        Log.infof("System attribute seeding complete: %d created", created);
    }

    int seed(List<AttributeSpec> specs) {
        int created = 0;
        for (AttributeSpec spec : specs) {
            if (store.findByName(spec.getName()).isPresent()) {
                Log.debugf("System attribute %s already present", spec.getName());
                continue;
            }
            try {
                repository.createSystemAttribute(spec.toBuilder().createdBy("system").build());
                created++;
            } catch (AttributeAdminException e) {
                ExceptionLoggingUtils.logWarn(e, "Skipping system attribute %s", spec.getName());
            }
        }
        return created;
    }

    static List<AttributeSpec> loadSeedSpecs(ObjectMapper mapper, String resource) {
        try (InputStream in = SystemAttributeSeeder.class.getResourceAsStream(resource)) {
            if (in == null) {
                Log.warnf("Seed resource %s not found", resource);
                return List.of();
            }
            return mapper.readValue(in, new TypeReference<List<AttributeSpec>>() { });
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read seed resource " + resource, e);
        }
    }
}
