package com.e2eq.attribute.mongo;

import com.e2eq.attribute.constraint.ConstraintShapeValidator;
import com.e2eq.attribute.constraint.ConstraintValidator;
import com.e2eq.attribute.core.AttributeLimits;
import com.e2eq.attribute.core.AttributeRepository;
import com.e2eq.attribute.core.AttributeSchemaBuilder;
import com.e2eq.attribute.core.AttributeValueValidator;
import com.e2eq.attribute.core.BulkOperationCoordinator;
import com.e2eq.attribute.core.UsageGuard;
import com.e2eq.attribute.spi.AttributeStore;
import com.e2eq.attribute.spi.PolicyUsageOracle;
import com.e2eq.attribute.value.ValueFormatter;
import com.e2eq.attribute.value.ValueParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.arc.DefaultBean;
import io.quarkus.logging.Log;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.regex.Pattern;

/**
 * Wires the container-free core classes into CDI. Every producer is a {@link DefaultBean}, so an
 * application can replace any of them.
 */
@ApplicationScoped
public class AttributeCoreProducers {

    @Inject
    ObjectMapper objectMapper;

    private ExecutorService bulkExecutor;

    @Produces
    @DefaultBean
    @Singleton
    public ValueParser valueParser() {
        return new ValueParser(objectMapper);
    }

    @Produces
    @DefaultBean
    @Singleton
    public ValueFormatter valueFormatter() {
        return new ValueFormatter();
    }

    @Produces
    @DefaultBean
    @Singleton
    public ConstraintValidator constraintValidator() {
        return new ConstraintValidator();
    }

    @Produces
    @DefaultBean
    @Singleton
    public ConstraintShapeValidator constraintShapeValidator() {
        return new ConstraintShapeValidator();
    }

    @Produces
    @DefaultBean
    @Singleton
    public AttributeLimits attributeLimits() {
        Config config = ConfigProvider.getConfig();
        AttributeLimits defaults = AttributeLimits.defaults();
        int nameMax = config.getOptionalValue("quantum.attributes.name.max-length", Integer.class)
                .orElse(defaults.nameMaxLength());
        int descriptionMax = config.getOptionalValue("quantum.attributes.description.max-length", Integer.class)
                .orElse(defaults.descriptionMaxLength());
        String namePattern = config.getOptionalValue("quantum.attributes.name.pattern", String.class)
                .orElse(AttributeLimits.DEFAULT_NAME_PATTERN);
        int pageMax = config.getOptionalValue("quantum.attributes.page.max-limit", Integer.class)
                .orElse(defaults.pageMaxLimit());
        return new AttributeLimits(nameMax, descriptionMax, Pattern.compile(namePattern), pageMax);
    }

    @Produces
    @DefaultBean
    @Singleton
    public UsageGuard usageGuard(PolicyUsageOracle oracle) {
        return new UsageGuard(oracle);
    }

    @Produces
    @DefaultBean
    @Singleton
    public AttributeRepository attributeRepository(AttributeStore store, UsageGuard usageGuard, ValueParser parser,
                                                   ValueFormatter formatter, ConstraintValidator constraintValidator,
                                                   ConstraintShapeValidator shapeValidator, AttributeLimits limits) {
        return new AttributeRepository(store, usageGuard, parser, formatter, constraintValidator, shapeValidator, limits);
    }

    @Produces
    @DefaultBean
    @Singleton
    public BulkOperationCoordinator bulkOperationCoordinator(AttributeRepository repository, AttributeStore store) {
        int parallelism = ConfigProvider.getConfig()
                .getOptionalValue("quantum.attributes.bulk.parallelism", Integer.class)
                .orElse(1);
        if (parallelism <= 1) {
            return new BulkOperationCoordinator(repository, store);
        }
        Log.infof("Bulk attribute operations run with parallelism %d", parallelism);
        bulkExecutor = Executors.newFixedThreadPool(parallelism);
        return new BulkOperationCoordinator(repository, store, bulkExecutor);
    }

    @Produces
    @DefaultBean
    @Singleton
    public AttributeValueValidator attributeValueValidator(ValueParser parser, ConstraintValidator constraintValidator) {
        return new AttributeValueValidator(parser, constraintValidator);
    }

    @Produces
    @DefaultBean
    @Singleton
    public AttributeSchemaBuilder attributeSchemaBuilder() {
        return new AttributeSchemaBuilder();
    }

    @PreDestroy
    void shutdown() {
        if (bulkExecutor != null) {
            bulkExecutor.shutdown();
        }
    }
}
