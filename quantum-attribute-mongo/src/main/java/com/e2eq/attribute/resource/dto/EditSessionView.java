package com.e2eq.attribute.resource.dto;

import com.e2eq.attribute.core.EditPolicy;
import com.e2eq.attribute.core.EditSession;
import com.e2eq.attribute.model.AttributeField;
import com.e2eq.attribute.spi.PolicyReference;
import com.e2eq.attribute.value.ParseError;
import com.e2eq.attribute.value.TypedValue;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;
import java.util.Set;

/**
 * What the console needs to render an edit form: which fields are open, the current values as
 * text, and after a preview the difference to the stored values.
 */
@RegisterForReflection
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EditSessionView(String attributeId,
                              long revision,
                              EditPolicy editPolicy,
                              Set<AttributeField> editableFields,
                              List<PolicyReference> usedInPolicies,
                              String valuesText,
                              List<TypedValue> candidateValues,
                              List<TypedValue> addedValues,
                              List<TypedValue> removedValues,
                              String description,
                              boolean acceptable,
                              ParseError parseError) {

    public static EditSessionView of(EditSession session) {
        return new EditSessionView(
                session.definition().getId(),
                session.definition().getRevision(),
                session.policy(),
                session.policy().editableFields(),
                session.usage().policies(),
                session.valuesText(),
                session.candidateValues(),
                session.addedValues(),
                session.removedValues(),
                session.description(),
                session.isAcceptable(),
                session.parseError());
    }
}
