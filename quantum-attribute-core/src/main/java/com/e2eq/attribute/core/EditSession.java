package com.e2eq.attribute.core;

import com.e2eq.attribute.model.AttributeDefinition;
import com.e2eq.attribute.model.AttributeField;
import com.e2eq.attribute.model.AttributePatch;
import com.e2eq.attribute.spi.AttributeUsage;
import com.e2eq.attribute.value.ParseError;
import com.e2eq.attribute.value.ParseResult;
import com.e2eq.attribute.value.TypedValue;
import com.e2eq.attribute.value.TypedValues;
import com.e2eq.attribute.value.ValueFormatter;
import com.e2eq.attribute.value.ValueParser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Server-side state of one definition being edited: the definition as loaded, its usage, the edit
 * policy that follows, and the candidate permitted values typed so far.
 * <p>
 * Immutable. Every change returns a new session, so a stale one can be dropped without cleanup.
 * Nothing is written until {@link #toPatch(String)} goes through {@link AttributeRepository#update}.
 * </p>
 */
public final class EditSession {

    private final AttributeDefinition definition;
    private final AttributeUsage usage;
    private final EditPolicy policy;
    private final String valuesText;
    private final List<TypedValue> candidateValues;
    private final ParseError parseError;
    private final String description;

    private EditSession(AttributeDefinition definition, AttributeUsage usage, EditPolicy policy, String valuesText,
                        List<TypedValue> candidateValues, ParseError parseError, String description) {
        this.definition = definition;
        this.usage = usage;
        this.policy = policy;
        this.valuesText = valuesText;
        this.candidateValues = List.copyOf(candidateValues);
        this.parseError = parseError;
        this.description = description;
    }

    public static EditSession open(AttributeDefinition definition, AttributeUsage usage, ValueFormatter formatter) {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(usage, "usage");
        EditPolicy policy = UsageGuard.deriveEditPolicy(definition.getDataType(), usage.usedInPolicies());
        List<TypedValue> values = definition.getEnumValues();
        return new EditSession(definition, usage, policy, formatter.format(values, definition.getDataType()),
                values, null, definition.getDescription());
    }

    /**
     * Replaces the candidate values with what {@code text} parses to. On a parse error the previous
     * candidates are kept and the error is recorded.
     */
    public EditSession withValuesText(String text, ValueParser parser) {
        ParseResult result = parser.parse(text, definition.getDataType());
        if (!result.isOk()) {
            return new EditSession(definition, usage, policy, text, candidateValues, result.error(), description);
        }
        return new EditSession(definition, usage, policy, text, TypedValues.distinct(result.values()), null, description);
    }

    /**
     * Adds what {@code text} parses to after the current candidates, ignoring duplicates.
     */
    public EditSession withAppendedValues(String text, ValueParser parser) {
        ParseResult result = parser.parse(text, definition.getDataType());
        if (!result.isOk()) {
            return new EditSession(definition, usage, policy, valuesText, candidateValues, result.error(), description);
        }
        LinkedHashSet<TypedValue> merged = new LinkedHashSet<>(candidateValues);
        merged.addAll(result.values());
        return new EditSession(definition, usage, policy, valuesText, new ArrayList<>(merged), null, description);
    }

    public EditSession withDescription(String newDescription) {
        return new EditSession(definition, usage, policy, valuesText, candidateValues, parseError, newDescription);
    }

    public boolean canEdit(AttributeField field) {
        return policy.permits(field);
    }

    public List<TypedValue> addedValues() {
        Set<TypedValue> existing = new HashSet<>(definition.getEnumValues());
        return candidateValues.stream().filter(v -> !existing.contains(v)).collect(Collectors.toList());
    }

    public List<TypedValue> removedValues() {
        Set<TypedValue> candidates = new HashSet<>(candidateValues);
        return definition.getEnumValues().stream().filter(v -> !candidates.contains(v)).collect(Collectors.toList());
    }

    public boolean valuesChanged() {
        return !addedValues().isEmpty() || !removedValues().isEmpty();
    }

    /**
     * Whether submitting now could pass the edit policy. The repository checks again on submit.
     */
    public boolean isAcceptable() {
        if (parseError != null) {
            return false;
        }
        switch (policy) {
            case APPEND_ONLY:
                return removedValues().isEmpty();
            case LOCKED:
                return !valuesChanged();
            default:
                return true;
        }
    }

    /**
     * Builds the update carrying only what this session changed, pinned to the revision it was
     * opened on.
     */
    public AttributePatch toPatch(String modifiedBy) {
        if (parseError != null) {
            throw new IllegalStateException("Cannot submit while permitted values do not parse: " + parseError.message());
        }
        AttributePatch.AttributePatchBuilder patch = AttributePatch.builder()
                .expectedRevision(definition.getRevision())
                .modifiedBy(modifiedBy);
        if (valuesChanged()) {
            patch.enumValues(TypedValues.toJsonArray(candidateValues));
        }
        if (!Objects.equals(description, definition.getDescription())) {
            patch.description(description == null ? "" : description);
        }
        return patch.build();
    }

    public AttributeDefinition definition() {
        return definition;
    }

    public AttributeUsage usage() {
        return usage;
    }

    public EditPolicy policy() {
        return policy;
    }

    public String valuesText() {
        return valuesText;
    }

    public List<TypedValue> candidateValues() {
        return candidateValues;
    }

    public ParseError parseError() {
        return parseError;
    }

    public String description() {
        return description;
    }
}
