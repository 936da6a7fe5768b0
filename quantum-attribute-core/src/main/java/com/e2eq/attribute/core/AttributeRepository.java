package com.e2eq.attribute.core;

import com.e2eq.attribute.constraint.AttributeConstraints;
import com.e2eq.attribute.constraint.ConstraintKind;
import com.e2eq.attribute.constraint.ConstraintShapeValidator;
import com.e2eq.attribute.constraint.ConstraintValidator;
import com.e2eq.attribute.constraint.ValidationResult;
import com.e2eq.attribute.constraint.ValueConstraintViolation;
import com.e2eq.attribute.exceptions.AttributeConflictException;
import com.e2eq.attribute.exceptions.AttributeForbiddenException;
import com.e2eq.attribute.exceptions.AttributeNotFoundException;
import com.e2eq.attribute.exceptions.AttributeValidationException;
import com.e2eq.attribute.exceptions.ValueConstraintException;
import com.e2eq.attribute.exceptions.ValueParseException;
import com.e2eq.attribute.model.AttributeCategory;
import com.e2eq.attribute.model.AttributeDefinition;
import com.e2eq.attribute.model.AttributeField;
import com.e2eq.attribute.model.AttributeMetadata;
import com.e2eq.attribute.model.AttributePatch;
import com.e2eq.attribute.model.AttributeSpec;
import com.e2eq.attribute.spi.AttributePage;
import com.e2eq.attribute.spi.AttributeQuery;
import com.e2eq.attribute.spi.AttributeStore;
import com.e2eq.attribute.spi.AttributeUsage;
import com.e2eq.attribute.value.DataType;
import com.e2eq.attribute.value.ParseResult;
import com.e2eq.attribute.value.TypedValue;
import com.e2eq.attribute.value.TypedValues;
import com.e2eq.attribute.value.ValueFormatter;
import com.e2eq.attribute.value.ValueParser;
import com.fasterxml.jackson.databind.JsonNode;
import io.quarkus.logging.Log;

import java.util.ArrayList;
import java.util.Date;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Owns the lifecycle of attribute definitions: create, update and delete, with name uniqueness,
 * system protection and the edit rules that apply once policies reference an attribute.
 * <p>
 * Every guarded mutation reads the record, asks the {@link UsageGuard} and then writes with the
 * revision it read. A concurrent change in between makes the write fail with
 * {@link AttributeConflictException.Reason#STALE_REVISION}; the caller reloads and retries.
 * </p>
 */
public class AttributeRepository {

    private static final String ANONYMOUS = "anonymous";

    private final AttributeStore store;
    private final UsageGuard usageGuard;
    private final ValueParser parser;
    private final ValueFormatter formatter;
    private final ConstraintValidator constraintValidator;
    private final ConstraintShapeValidator shapeValidator;
    private final AttributeLimits limits;

    public AttributeRepository(AttributeStore store,
                               UsageGuard usageGuard,
                               ValueParser parser,
                               ValueFormatter formatter,
                               ConstraintValidator constraintValidator,
                               ConstraintShapeValidator shapeValidator,
                               AttributeLimits limits) {
        this.store = store;
        this.usageGuard = usageGuard;
        this.parser = parser;
        this.formatter = formatter;
        this.constraintValidator = constraintValidator;
        this.shapeValidator = shapeValidator;
        this.limits = limits;
    }

    // ------------------------------------------------------------------ reads

    public AttributeDefinition findById(String id) {
        if (id == null || id.isBlank()) {
            throw new AttributeValidationException("Attribute id is required");
        }
        return store.findById(id.trim()).orElseThrow(() -> new AttributeNotFoundException(id));
    }

    public AttributePage<AttributeDefinition> list(AttributeQuery query) {
        AttributeQuery q = query == null ? AttributeQuery.builder().build() : query;
        return store.list(q.normalized(limits.pageMaxLimit()));
    }

    public AttributePage<AttributeDefinition> listByCategory(AttributeCategory category, int page, int limit) {
        if (category == null) {
            throw new AttributeValidationException("Category parameter is required");
        }
        return list(AttributeQuery.builder()
                .categories(Set.of(category))
                .active(true)
                .page(page)
                .limit(limit)
                .build());
    }

    public List<AttributeDefinition> findActiveByCategory(AttributeCategory category) {
        if (category == null) {
            throw new AttributeValidationException("Category parameter is required");
        }
        return store.findAll().stream()
                .filter(AttributeDefinition::isActive)
                .filter(a -> a.getCategories() != null && a.getCategories().contains(category))
                .collect(Collectors.toList());
    }

    public List<AttributeDefinition> findAll() {
        return store.findAll();
    }

    public AttributeUsage getUsage(String id) {
        AttributeDefinition definition = findById(id);
        return usageGuard.getUsage(definition.getId());
    }

    public EditSession openEditSession(String id) {
        AttributeDefinition definition = findById(id);
        return EditSession.open(definition, usageGuard.getUsage(definition.getId()), formatter);
    }

    // ----------------------------------------------------------------- create

    public AttributeDefinition create(AttributeSpec spec) {
        return insertNew(spec, false);
    }

    /**
     * Creates a protected built-in attribute. Only for trusted seeding paths, never for client input.
     */
    public AttributeDefinition createSystemAttribute(AttributeSpec spec) {
        return insertNew(spec, true);
    }

    private AttributeDefinition insertNew(AttributeSpec spec, boolean system) {
        if (spec == null) {
            throw new AttributeValidationException("Attribute specification is required");
        }
        String name = trimToNull(spec.getName());
        String displayName = trimToNull(spec.getDisplayName());
        String description = trimToNull(spec.getDescription());

        List<String> missing = new ArrayList<>();
        if (name == null) missing.add("name");
        if (displayName == null) missing.add("displayName");
        if (spec.getCategories() == null || spec.getCategories().isEmpty()) missing.add("categories");
        if (spec.getDataType() == null) missing.add("dataType");
        if (!missing.isEmpty()) {
            throw new AttributeValidationException("Missing required fields: " + String.join(", ", missing), missing);
        }

        DataType dataType = spec.getDataType();
        AttributeConstraints bounds = spec.getConstraints() == null
                ? AttributeConstraints.empty() : spec.getConstraints().boundsOnly();

        List<String> errors = new ArrayList<>();
        checkName(name, errors);
        checkDisplayName(displayName, errors);
        checkDescription(description, errors);
        errors.addAll(shapeValidator.validate(dataType, bounds));
        if (!errors.isEmpty()) {
            throw new AttributeValidationException(errors.get(0), errors);
        }

        List<TypedValue> values = readValues(spec.getPermittedValues(), spec.getEnumValues(), dataType);
        requireValid(values, bounds);
        AttributeConstraints constraints = bounds.toBuilder().enumValues(new ArrayList<>(values)).build();
        TypedValue defaultValue = readDefault(spec.getDefaultValue(), dataType, constraints);

        if (store.findByName(name).isPresent()) {
            throw new AttributeConflictException(AttributeConflictException.Reason.DUPLICATE_NAME,
                    "Attribute with name '" + name + "' already exists");
        }

        String createdBy = spec.getCreatedBy() == null ? ANONYMOUS : spec.getCreatedBy();
        Date now = new Date();
        AttributeDefinition definition = AttributeDefinition.builder()
                .name(name)
                .displayName(displayName)
                .description(description)
                .categories(new LinkedHashSet<>(spec.getCategories()))
                .dataType(dataType)
                .required(spec.isRequired())
                .multiValue(spec.isMultiValue())
                .defaultValue(defaultValue)
                .constraints(constraints)
                .metadata(AttributeMetadata.builder()
                        .createdBy(createdBy)
                        .lastModifiedBy(createdBy)
                        .tags(spec.getTags() == null ? new ArrayList<>() : new ArrayList<>(spec.getTags()))
                        .system(system)
                        .custom(!system && spec.isCustom())
                        .externalId(trimToNull(spec.getExternalId()))
                        .build())
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();

        AttributeDefinition saved = store.insert(definition);
        Log.infof("Attribute created: %s (%s, %s, %d permitted values) by %s",
                saved.getName(), saved.getId(), dataType.wireName(), values.size(), createdBy);
        return saved;
    }

    // ----------------------------------------------------------------- update

    public AttributeDefinition update(String id, AttributePatch patch) {
        if (patch == null) {
            throw new AttributeValidationException("Update body is required");
        }
        AttributeDefinition current = findById(id);
        if (patch.getExpectedRevision() != null && patch.getExpectedRevision() != current.getRevision()) {
            throw AttributeConflictException.staleRevision(current.getId(), patch.getExpectedRevision());
        }
        if (patch.getName() != null && !patch.getName().trim().equals(current.getName())) {
            throw new AttributeValidationException("Attribute name cannot be changed", List.of("name"));
        }

        AttributeUsage usage = usageGuard.getUsage(current.getId());
        EditPolicy policy = UsageGuard.deriveEditPolicy(current.getDataType(), usage.usedInPolicies());

        AttributeDefinition candidate = copyOf(current);
        Set<AttributeField> changed = EnumSet.noneOf(AttributeField.class);

        if (patch.getDisplayName() != null) {
            String displayName = trimToNull(patch.getDisplayName());
            if (!Objects.equals(displayName, current.getDisplayName())) {
                candidate.setDisplayName(displayName);
                changed.add(AttributeField.DISPLAY_NAME);
            }
        }
        if (patch.getDescription() != null) {
            String description = trimToNull(patch.getDescription());
            if (!Objects.equals(description, trimToNull(current.getDescription()))) {
                candidate.setDescription(description);
                changed.add(AttributeField.DESCRIPTION);
            }
        }
        if (patch.getCategories() != null && !patch.getCategories().equals(current.getCategories())) {
            candidate.setCategories(new LinkedHashSet<>(patch.getCategories()));
            changed.add(AttributeField.CATEGORIES);
        }
        if (patch.getDataType() != null && patch.getDataType() != current.getDataType()) {
            candidate.setDataType(patch.getDataType());
            changed.add(AttributeField.DATA_TYPE);
        }
        if (patch.getRequired() != null && patch.getRequired() != current.isRequired()) {
            candidate.setRequired(patch.getRequired());
            changed.add(AttributeField.IS_REQUIRED);
        }
        if (patch.getMultiValue() != null && patch.getMultiValue() != current.isMultiValue()) {
            candidate.setMultiValue(patch.getMultiValue());
            changed.add(AttributeField.IS_MULTI_VALUE);
        }
        if (patch.getActive() != null && patch.getActive() != current.isActive()) {
            candidate.setActive(patch.getActive());
            changed.add(AttributeField.ACTIVE);
        }
        if (patch.getTags() != null && !patch.getTags().equals(current.getMetadata().getTags())) {
            candidate.getMetadata().setTags(new ArrayList<>(patch.getTags()));
            changed.add(AttributeField.TAGS);
        }

        AttributeConstraints bounds = current.getConstraints().boundsOnly();
        if (patch.getConstraints() != null) {
            AttributeConstraints patchedBounds = bounds.withBoundsFrom(patch.getConstraints());
            if (!patchedBounds.equals(bounds)) {
                bounds = patchedBounds;
                changed.add(AttributeField.CONSTRAINTS);
            }
        }

        DataType effectiveType = candidate.getDataType();
        List<TypedValue> submitted = null;
        if (patch.carriesValues()) {
            submitted = readValues(patch.getPermittedValues(), patch.getEnumValues(), effectiveType);
        } else if (changed.contains(AttributeField.DATA_TYPE) && !current.getEnumValues().isEmpty()) {
            submitted = reinterpret(current.getEnumValues(), current.getDataType(), effectiveType);
        }
        if (submitted != null && !sameMembers(submitted, current.getEnumValues())) {
            changed.add(AttributeField.ENUM_VALUES);
        }

        TypedValue patchedDefault = current.getDefaultValue();
        if (patch.getDefaultValue() != null) {
            patchedDefault = readSingle(patch.getDefaultValue(), effectiveType);
            if (!Objects.equals(patchedDefault, current.getDefaultValue())) {
                changed.add(AttributeField.DEFAULT_VALUE);
            }
        }

        requirePermitted(current, usage, policy, changed);

        if (changed.isEmpty()) {
            Log.debugf("Update of attribute %s carried no changes", current.getId());
            return current;
        }

        List<TypedValue> finalValues = current.getEnumValues();
        if (changed.contains(AttributeField.ENUM_VALUES)) {
            finalValues = policy == EditPolicy.APPEND_ONLY
                    ? mergeAppendOnly(current, usage, submitted)
                    : submitted;
        }

        if (changed.contains(AttributeField.CONSTRAINTS) || changed.contains(AttributeField.DATA_TYPE)) {
            List<String> shapeErrors = shapeValidator.validate(effectiveType, bounds);
            if (!shapeErrors.isEmpty()) {
                throw new AttributeValidationException(shapeErrors.get(0), shapeErrors);
            }
        }
        List<String> errors = new ArrayList<>();
        if (changed.contains(AttributeField.DISPLAY_NAME)) {
            checkDisplayName(candidate.getDisplayName(), errors);
        }
        if (changed.contains(AttributeField.DESCRIPTION)) {
            checkDescription(candidate.getDescription(), errors);
        }
        if (changed.contains(AttributeField.CATEGORIES) && candidate.getCategories().isEmpty()) {
            errors.add("At least one category must be selected");
        }
        if (!errors.isEmpty()) {
            throw new AttributeValidationException(errors.get(0), errors);
        }

        requireValid(finalValues, bounds);
        AttributeConstraints constraints = bounds.toBuilder().enumValues(new ArrayList<>(finalValues)).build();
        candidate.setConstraints(constraints);

        if (patchedDefault != null) {
            if (changed.contains(AttributeField.DATA_TYPE) && !changed.contains(AttributeField.DEFAULT_VALUE)) {
                patchedDefault = reinterpretDefault(current, effectiveType);
            }
            if (patchedDefault != null) {
                requireValid(List.of(patchedDefault), constraints);
            }
        }
        candidate.setDefaultValue(patchedDefault);

        String modifiedBy = patch.getModifiedBy() == null ? ANONYMOUS : patch.getModifiedBy();
        candidate.getMetadata().setLastModifiedBy(modifiedBy);
        candidate.setUpdatedAt(new Date());

        AttributeDefinition saved = store.update(candidate, current.getRevision());
        Log.infof("Attribute updated: %s (%s) fields %s under %s policy by %s",
                saved.getName(), saved.getId(), changed, policy, modifiedBy);
        return saved;
    }

    private void requirePermitted(AttributeDefinition current, AttributeUsage usage, EditPolicy policy,
                                  Set<AttributeField> changed) {
        List<String> forbidden = changed.stream()
                .filter(f -> !policy.permits(f))
                .map(AttributeField::path)
                .collect(Collectors.toList());
        if (forbidden.isEmpty()) {
            return;
        }
        String editable = policy.editableFields().stream().map(AttributeField::path).collect(Collectors.joining(", "));
        String message = String.format("Attribute \"%s\" is used in %s; only %s can be changed (attempted: %s)",
                current.getDisplayName(), describePolicies(usage), editable, String.join(", ", forbidden));
        throw new ValueConstraintException(ValueConstraintViolation.of(ConstraintKind.EDIT_POLICY, message), forbidden);
    }

    private List<TypedValue> mergeAppendOnly(AttributeDefinition current, AttributeUsage usage, List<TypedValue> submitted) {
        Set<TypedValue> submittedMembers = new HashSet<>(submitted);
        List<TypedValue> removed = current.getEnumValues().stream()
                .filter(v -> !submittedMembers.contains(v))
                .collect(Collectors.toList());
        if (!removed.isEmpty()) {
            List<String> details = removed.stream().map(TypedValues::describe).collect(Collectors.toList());
            String message = String.format("Attribute \"%s\" is used in %s; existing permitted values cannot be removed or changed: %s",
                    current.getDisplayName(), describePolicies(usage), String.join(", ", details));
            throw new ValueConstraintException(
                    new ValueConstraintViolation(ConstraintKind.APPEND_ONLY, message, removed.get(0)), details);
        }
        LinkedHashSet<TypedValue> merged = new LinkedHashSet<>(current.getEnumValues());
        merged.addAll(submitted);
        return List.copyOf(merged);
    }

    // ----------------------------------------------------------------- delete

    public void delete(String id) {
        AttributeDefinition definition = vetDeletion(id);
        store.delete(definition.getId(), definition.getRevision());
        Log.infof("Attribute deleted: %s (%s)", definition.getName(), definition.getId());
    }

    /**
     * Runs the delete checks without deleting: system protection first, then policy usage.
     *
     * @return the definition as read, whose revision the delete must be made against
     */
    public AttributeDefinition vetDeletion(String id) {
        AttributeDefinition definition = findById(id);
        if (definition.isSystem()) {
            throw new AttributeForbiddenException("Cannot delete system attribute \"" + definition.getDisplayName() + "\"");
        }
        AttributeUsage usage = usageGuard.getUsage(definition.getId());
        if (usage.usedInPolicies()) {
            List<String> policyNames = usage.policies().stream()
                    .map(p -> p.displayName() != null ? p.displayName() : p.name())
                    .filter(Objects::nonNull)
                    .collect(Collectors.toList());
            throw new AttributeConflictException(AttributeConflictException.Reason.IN_USE,
                    String.format("Unable to delete \"%s\" - This attribute is currently being used in %s",
                            definition.getDisplayName(), describePolicies(usage)),
                    policyNames);
        }
        return definition;
    }

    // ---------------------------------------------------------------- helpers

    private List<TypedValue> readValues(String text, JsonNode json, DataType dataType) {
        ParseResult result = text != null ? parser.parse(text, dataType) : parser.parseJson(json, dataType);
        if (!result.isOk()) {
            throw new ValueParseException(result.error());
        }
        return TypedValues.distinct(result.values());
    }

    private TypedValue readSingle(JsonNode node, DataType dataType) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        ParseResult result = parser.parseSingle(node, dataType);
        if (!result.isOk()) {
            throw new ValueParseException(result.error());
        }
        return result.values().get(0);
    }

    private TypedValue readDefault(JsonNode node, DataType dataType, AttributeConstraints constraints) {
        TypedValue value = readSingle(node, dataType);
        if (value != null) {
            requireValid(List.of(value), constraints);
        }
        return value;
    }

    private void requireValid(List<TypedValue> values, AttributeConstraints constraints) {
        ValidationResult result = constraintValidator.validate(values, constraints);
        if (!result.isValid()) {
            throw new ValueConstraintException(result.violation().get());
        }
    }

    private List<TypedValue> reinterpret(List<TypedValue> values, DataType from, DataType to) {
        ParseResult result = parser.parse(formatter.format(values, from), to);
        if (!result.isOk()) {
            throw new AttributeValidationException(
                    "Existing permitted values cannot be read as " + to.wireName() + "; supply new permitted values",
                    List.of(result.error().message()));
        }
        return TypedValues.distinct(result.values());
    }

    private TypedValue reinterpretDefault(AttributeDefinition current, DataType to) {
        List<TypedValue> converted;
        try {
            converted = reinterpret(List.of(current.getDefaultValue()), current.getDataType(), to);
        } catch (AttributeValidationException e) {
            throw new AttributeValidationException(
                    "Existing default value cannot be read as " + to.wireName() + "; supply a new default value",
                    e.getDetails());
        }
        return converted.isEmpty() ? null : converted.get(0);
    }

    private void checkName(String name, List<String> errors) {
        if (name.length() > limits.nameMaxLength()) {
            errors.add("Name cannot exceed " + limits.nameMaxLength() + " characters");
        }
        if (!limits.namePattern().matcher(name).matches()) {
            errors.add("Name '" + name + "' must start with a letter and contain only letters, digits, '_', '.' or '-'");
        }
    }

    private void checkDisplayName(String displayName, List<String> errors) {
        if (displayName == null) {
            errors.add("Display name is required");
        } else if (displayName.length() > limits.nameMaxLength()) {
            errors.add("Display name cannot exceed " + limits.nameMaxLength() + " characters");
        }
    }

    private void checkDescription(String description, List<String> errors) {
        if (description != null && description.length() > limits.descriptionMaxLength()) {
            errors.add("Description cannot exceed " + limits.descriptionMaxLength() + " characters");
        }
    }

    private static String describePolicies(AttributeUsage usage) {
        int count = usage.policyCount();
        if (count == 0) {
            return "one or more policies";
        }
        return count + (count == 1 ? " policy" : " policies");
    }

    private static boolean sameMembers(List<TypedValue> a, List<TypedValue> b) {
        return new HashSet<>(a).equals(new HashSet<>(b));
    }

    private static AttributeDefinition copyOf(AttributeDefinition source) {
        AttributeMetadata metadata = source.getMetadata() == null
                ? AttributeMetadata.builder().build()
                : source.getMetadata().toBuilder().tags(new ArrayList<>(source.getMetadata().getTags())).build();
        return source.toBuilder()
                .categories(new LinkedHashSet<>(source.getCategories()))
                .constraints(source.getConstraints().toBuilder().enumValues(new ArrayList<>(source.getEnumValues())).build())
                .metadata(metadata)
                .build();
    }

    private static String trimToNull(String s) {
        if (s == null) {
            return null;
        }
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
