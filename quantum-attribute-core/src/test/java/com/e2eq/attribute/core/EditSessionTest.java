package com.e2eq.attribute.core;

import com.e2eq.attribute.constraint.AttributeConstraints;
import com.e2eq.attribute.model.AttributeCategory;
import com.e2eq.attribute.model.AttributeDefinition;
import com.e2eq.attribute.model.AttributeField;
import com.e2eq.attribute.model.AttributePatch;
import com.e2eq.attribute.spi.AttributeUsage;
import com.e2eq.attribute.spi.PolicyReference;
import com.e2eq.attribute.value.DataType;
import com.e2eq.attribute.value.TypedValue;
import com.e2eq.attribute.value.ValueFormatter;
import com.e2eq.attribute.value.ValueParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EditSessionTest {

    private final ValueParser parser = new ValueParser();
    private final ValueFormatter formatter = new ValueFormatter();

    private static AttributeDefinition definition(DataType type, TypedValue... values) {
        return AttributeDefinition.builder()
                .id("attr-1")
                .name("scopes")
                .displayName("Scopes")
                .description("OAuth scopes")
                .categories(new LinkedHashSet<>(List.of(AttributeCategory.SUBJECT)))
                .dataType(type)
                .constraints(AttributeConstraints.builder().enumValues(new ArrayList<>(List.of(values))).build())
                .revision(4L)
                .build();
    }

    private static AttributeUsage used() {
        return AttributeUsage.usedBy("attr-1", List.of(new PolicyReference("p1", "readers", "Readers")));
    }

    @Test
    void testOpenShowsCurrentValuesAsText() {
        EditSession session = EditSession.open(definition(DataType.NUMBER, TypedValue.of(1), TypedValue.of(2.5)),
                AttributeUsage.unused("attr-1"), formatter);
        assertEquals("1, 2.5", session.valuesText());
        assertEquals(EditPolicy.FULL, session.policy());
        assertTrue(session.canEdit(AttributeField.DATA_TYPE));
        assertFalse(session.valuesChanged());
    }

    @Test
    void testAppendOnlySessionTracksAddedAndRemoved() {
        EditSession opened = EditSession.open(definition(DataType.ARRAY, TypedValue.of("read")), used(), formatter);
        assertEquals(EditPolicy.APPEND_ONLY, opened.policy());

        EditSession grown = opened.withAppendedValues("[\"write\"]", parser);
        assertEquals(List.of(TypedValue.of("write")), grown.addedValues());
        assertTrue(grown.isAcceptable());
        assertEquals(1, opened.candidateValues().size());

        EditSession replaced = grown.withValuesText("[\"write\"]", parser);
        assertEquals(List.of(TypedValue.of("read")), replaced.removedValues());
        assertFalse(replaced.isAcceptable());
    }

    @Test
    void testParseErrorKeepsPreviousCandidates() {
        EditSession opened = EditSession.open(definition(DataType.NUMBER, TypedValue.of(1)),
                AttributeUsage.unused("attr-1"), formatter);
        EditSession bad = opened.withValuesText("1, x", parser);

        assertNotNull(bad.parseError());
        assertEquals("x", bad.parseError().offendingToken());
        assertEquals(opened.candidateValues(), bad.candidateValues());
        assertFalse(bad.isAcceptable());
        assertThrows(IllegalStateException.class, () -> bad.toPatch("me"));
    }

    @Test
    void testLockedSessionOnlyAcceptsDescription() {
        EditSession opened = EditSession.open(definition(DataType.STRING, TypedValue.of("a")), used(), formatter);
        assertEquals(EditPolicy.LOCKED, opened.policy());
        assertFalse(opened.withValuesText("a, b", parser).isAcceptable());

        AttributePatch patch = opened.withDescription("Granted scopes").toPatch("me");
        assertEquals("Granted scopes", patch.getDescription());
        assertNull(patch.getEnumValues());
        assertEquals(4L, patch.getExpectedRevision());
    }

    @Test
    void testPatchCarriesValuesOnlyWhenChanged() {
        EditSession opened = EditSession.open(definition(DataType.STRING, TypedValue.of("a")),
                AttributeUsage.unused("attr-1"), formatter);
        assertNull(opened.toPatch("me").getEnumValues());

        AttributePatch patch = opened.withValuesText("a, b", parser).toPatch("me");
        assertEquals("[\"a\",\"b\"]", patch.getEnumValues().toString());
        assertNull(patch.getDescription());
        assertEquals("me", patch.getModifiedBy());
    }
}
