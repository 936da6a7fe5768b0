package com.e2eq.attribute.resource;

import com.e2eq.attribute.core.AttributeRepository;
import com.e2eq.attribute.core.AttributeSchemaBuilder;
import com.e2eq.attribute.core.AttributeStatistics;
import com.e2eq.attribute.core.AttributeValueValidator;
import com.e2eq.attribute.core.BulkDeleteSummary;
import com.e2eq.attribute.core.BulkOperationCoordinator;
import com.e2eq.attribute.core.BulkUpdateSummary;
import com.e2eq.attribute.core.EditSession;
import com.e2eq.attribute.core.UsageGuard;
import com.e2eq.attribute.core.ValueValidationReport;
import com.e2eq.attribute.exceptions.AttributeNotFoundException;
import com.e2eq.attribute.exceptions.AttributeValidationException;
import com.e2eq.attribute.exceptions.ValueParseException;
import com.e2eq.attribute.model.AttributeCategory;
import com.e2eq.attribute.model.AttributeDefinition;
import com.e2eq.attribute.resource.dto.AttributeView;
import com.e2eq.attribute.resource.dto.BulkDeleteRequest;
import com.e2eq.attribute.resource.dto.BulkUpdateRequest;
import com.e2eq.attribute.resource.dto.CreateAttributeRequest;
import com.e2eq.attribute.resource.dto.EditPreviewRequest;
import com.e2eq.attribute.resource.dto.EditSessionView;
import com.e2eq.attribute.resource.dto.ParsePreviewRequest;
import com.e2eq.attribute.resource.dto.ParsePreviewResponse;
import com.e2eq.attribute.resource.dto.UpdateAttributeRequest;
import com.e2eq.attribute.resource.dto.ValidateValueRequest;
import com.e2eq.attribute.rest.models.ApiResponse;
import com.e2eq.attribute.rest.models.PaginationInfo;
import com.e2eq.attribute.spi.AttributePage;
import com.e2eq.attribute.spi.AttributeQuery;
import com.e2eq.attribute.spi.AttributeUsage;
import com.e2eq.attribute.value.DataType;
import com.e2eq.attribute.value.ParseResult;
import com.e2eq.attribute.value.ValueFormatter;
import com.e2eq.attribute.value.ValueParser;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Attribute administration API. Domain errors propagate to
 * {@link com.e2eq.attribute.rest.exceptions.AttributeAdminExceptionMapper}.
 */
@Path("/attributes")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AttributeResource {

    @Inject
    AttributeRepository repository;

    @Inject
    BulkOperationCoordinator bulkCoordinator;

    @Inject
    UsageGuard usageGuard;

    @Inject
    AttributeValueValidator valueValidator;

    @Inject
    AttributeSchemaBuilder schemaBuilder;

    @Inject
    ValueParser parser;

    @Inject
    ValueFormatter formatter;

    @GET
    public ApiResponse<List<AttributeView>> list(@QueryParam("page") @DefaultValue("1") int page,
                                                 @QueryParam("limit") @DefaultValue("10") int limit,
                                                 @QueryParam("search") String search,
                                                 @QueryParam("categories") List<String> categories,
                                                 @QueryParam("dataType") String dataType,
                                                 @QueryParam("isRequired") Boolean required,
                                                 @QueryParam("active") Boolean active,
                                                 @QueryParam("isSystem") Boolean system,
                                                 @QueryParam("isCustom") Boolean custom,
                                                 @QueryParam("sortBy") @DefaultValue("createdAt") String sortBy,
                                                 @QueryParam("sortOrder") @DefaultValue("desc") String sortOrder) {
        AttributeQuery query = AttributeQuery.builder()
                .search(search)
                .categories(parseCategories(categories))
                .dataType(dataType == null || dataType.isBlank() ? null : parseDataType(dataType))
                .required(required)
                .active(active)
                .system(system)
                .custom(custom)
                .page(page)
                .limit(limit)
                .sortBy(sortBy)
                .ascending("asc".equalsIgnoreCase(sortOrder))
                .build();
        AttributePage<AttributeDefinition> result = repository.list(query);
        List<AttributeView> views = result.items().stream()
                .map(a -> AttributeView.of(a, usageGuard.getUsage(a.getId())))
                .collect(Collectors.toList());
        return ApiResponse.page(views, PaginationInfo.of(result));
    }

    @GET
    @Path("/stats")
    public ApiResponse<AttributeStatistics> stats() {
        return ApiResponse.ok(AttributeStatistics.compute(repository.findAll()));
    }

    @GET
    @Path("/category/{category}")
    public ApiResponse<List<AttributeDefinition>> byCategory(@PathParam("category") String category,
                                                             @QueryParam("page") @DefaultValue("1") int page,
                                                             @QueryParam("limit") @DefaultValue("10") int limit) {
        AttributePage<AttributeDefinition> result = repository.listByCategory(parseCategory(category), page, limit);
        return ApiResponse.page(result.items(), PaginationInfo.of(result));
    }

    @GET
    @Path("/schema/{category}")
    public ApiResponse<ObjectNode> schema(@PathParam("category") String category) {
        return ApiResponse.ok(schemaBuilder.build(repository.findActiveByCategory(parseCategory(category))));
    }

    @GET
    @Path("/{id}")
    public ApiResponse<AttributeView> get(@PathParam("id") String id) {
        AttributeDefinition attribute = repository.findById(id);
        return ApiResponse.ok(AttributeView.of(attribute, usageGuard.getUsage(attribute.getId())));
    }

    @GET
    @Path("/{id}/usage")
    public ApiResponse<AttributeUsage> usage(@PathParam("id") String id) {
        return ApiResponse.ok(repository.getUsage(id));
    }

    @POST
    public Response create(@Valid @NotNull CreateAttributeRequest request) {
        AttributeDefinition created = repository.create(request.toSpec(null));
        Log.infof("Attribute created through API: %s (%s)", created.getName(), created.getId());
        return Response.status(Response.Status.CREATED)
                .entity(ApiResponse.ok(created, "Attribute created successfully"))
                .build();
    }

    @PUT
    @Path("/{id}")
    public ApiResponse<AttributeDefinition> update(@PathParam("id") String id,
                                                   @Valid @NotNull UpdateAttributeRequest request) {
        AttributeDefinition updated = repository.update(id, request.toPatch(null));
        return ApiResponse.ok(updated, "Attribute updated successfully");
    }

    @DELETE
    @Path("/{id}")
    public ApiResponse<Void> delete(@PathParam("id") String id) {
        repository.delete(id);
        return ApiResponse.ok(null, "Attribute deleted successfully");
    }

    @POST
    @Path("/{id}/validate")
    public ApiResponse<ValueValidationReport> validate(@PathParam("id") String id, ValidateValueRequest request) {
        AttributeDefinition attribute = repository.findById(id);
        if (!attribute.isActive()) {
            throw new AttributeNotFoundException(id);
        }
        return ApiResponse.ok(valueValidator.validate(attribute, request == null ? null : request.getValue()));
    }

    @POST
    @Path("/parse")
    public ApiResponse<ParsePreviewResponse> parse(@Valid @NotNull ParsePreviewRequest request) {
        ParseResult result = parser.parse(request.getText(), request.getDataType());
        if (!result.isOk()) {
            throw new ValueParseException(result.error());
        }
        return ApiResponse.ok(new ParsePreviewResponse(request.getDataType(), result.values(), result.values().size(),
                formatter.format(result.values(), request.getDataType())));
    }

    @DELETE
    @Path("/bulk/delete")
    public ApiResponse<BulkDeleteSummary> bulkDelete(@Valid @NotNull BulkDeleteRequest request) {
        BulkDeleteSummary summary = bulkCoordinator.bulkDelete(request.getAttributeIds());
        return ApiResponse.ok(summary, summary.message());
    }

    @POST
    @Path("/bulk/delete")
    public ApiResponse<BulkDeleteSummary> bulkDeleteByPost(@Valid @NotNull BulkDeleteRequest request) {
        return bulkDelete(request);
    }

    @PUT
    @Path("/bulk/update")
    public ApiResponse<BulkUpdateSummary> bulkUpdate(@Valid @NotNull BulkUpdateRequest request) {
        BulkUpdateSummary summary = bulkCoordinator.bulkUpdate(request.getAttributeIds(),
                request.getUpdates().toPatch(null));
        return ApiResponse.ok(summary, summary.message());
    }

    @GET
    @Path("/{id}/edit-session")
    public ApiResponse<EditSessionView> openEditSession(@PathParam("id") String id) {
        return ApiResponse.ok(EditSessionView.of(repository.openEditSession(id)));
    }

    @POST
    @Path("/{id}/edit-session/preview")
    public ApiResponse<EditSessionView> previewEdit(@PathParam("id") String id, EditPreviewRequest request) {
        EditSession session = repository.openEditSession(id);
        if (request != null) {
            if (request.getValuesText() != null) {
                session = session.withValuesText(request.getValuesText(), parser);
            }
            if (request.getAppendText() != null) {
                session = session.withAppendedValues(request.getAppendText(), parser);
            }
            if (request.getDescription() != null) {
                session = session.withDescription(request.getDescription());
            }
        }
        return ApiResponse.ok(EditSessionView.of(session));
    }

    static AttributeCategory parseCategory(String value) {
        if (value == null || value.isBlank()) {
            throw new AttributeValidationException("Category parameter is required");
        }
        try {
            return AttributeCategory.fromWire(value);
        } catch (IllegalArgumentException e) {
            throw new AttributeValidationException(e.getMessage());
        }
    }

    /**
     * Accepts repeated parameters as well as comma separated lists.
     */
    static Set<AttributeCategory> parseCategories(List<String> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        Set<AttributeCategory> categories = values.stream()
                .flatMap(v -> Arrays.stream(v.split(",")))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(AttributeResource::parseCategory)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return categories.isEmpty() ? null : categories;
    }

    static DataType parseDataType(String value) {
        try {
            return DataType.fromWire(value);
        } catch (IllegalArgumentException e) {
            throw new AttributeValidationException(e.getMessage());
        }
    }
}
