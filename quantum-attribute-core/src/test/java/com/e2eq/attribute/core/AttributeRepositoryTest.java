package com.e2eq.attribute.core;

import com.e2eq.attribute.constraint.AttributeConstraints;
import com.e2eq.attribute.constraint.ConstraintKind;
import com.e2eq.attribute.constraint.ConstraintShapeValidator;
import com.e2eq.attribute.constraint.ConstraintValidator;
import com.e2eq.attribute.exceptions.AttributeConflictException;
import com.e2eq.attribute.exceptions.AttributeForbiddenException;
import com.e2eq.attribute.exceptions.AttributeNotFoundException;
import com.e2eq.attribute.exceptions.AttributeValidationException;
import com.e2eq.attribute.exceptions.UsageLookupException;
import com.e2eq.attribute.exceptions.ValueConstraintException;
import com.e2eq.attribute.exceptions.ValueParseException;
import com.e2eq.attribute.model.AttributeCategory;
import com.e2eq.attribute.model.AttributeDefinition;
import com.e2eq.attribute.model.AttributePatch;
import com.e2eq.attribute.model.AttributeSpec;
import com.e2eq.attribute.spi.AttributeUsage;
import com.e2eq.attribute.value.DataType;
import com.e2eq.attribute.value.TypedValue;
import com.e2eq.attribute.value.ValueFormatter;
import com.e2eq.attribute.value.ValueParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AttributeRepositoryTest {

    private InMemoryAttributeStoreTestDouble store;
    private FixedUsageOracleTestDouble oracle;
    private AttributeRepository repository;

    @BeforeEach
    void setUp() {
        store = new InMemoryAttributeStoreTestDouble();
        oracle = new FixedUsageOracleTestDouble();
        repository = newRepository(new UsageGuard(oracle));
    }

    private AttributeRepository newRepository(UsageGuard guard) {
        return new AttributeRepository(store, guard, new ValueParser(), new ValueFormatter(),
                new ConstraintValidator(), new ConstraintShapeValidator(), AttributeLimits.defaults());
    }

    private static AttributeSpec.AttributeSpecBuilder spec(String name, DataType type, String values) {
        return AttributeSpec.builder()
                .name(name)
                .displayName(name.substring(0, 1).toUpperCase() + name.substring(1))
                .categories(Set.of(AttributeCategory.SUBJECT))
                .dataType(type)
                .permittedValues(values)
                .createdBy("tester");
    }

    @Test
    void testCreateStoresParsedValues() {
        AttributeDefinition role = repository.create(spec("role", DataType.STRING, "admin,user,guest").build());

        assertNotNull(role.getId());
        assertEquals(1L, role.getRevision());
        assertFalse(role.isSystem());
        assertTrue(role.isActive());
        assertEquals(List.of(TypedValue.of("admin"), TypedValue.of("user"), TypedValue.of("guest")), role.getEnumValues());
        assertEquals("tester", role.getMetadata().getCreatedBy());
    }

    @Test
    void testCreateDropsRepeatedValues() {
        AttributeDefinition level = repository.create(spec("level", DataType.NUMBER, "1, 2, 2, 1, 3").build());
        assertEquals(List.of(TypedValue.of(1), TypedValue.of(2), TypedValue.of(3)), level.getEnumValues());
    }

    @Test
    void testCreateTreatsNegativeZeroAsZero() {
        AttributeDefinition offset = repository.create(spec("offset", DataType.NUMBER, "0, -0, 1").build());
        assertEquals(List.of(TypedValue.of(0), TypedValue.of(1)), offset.getEnumValues());
    }

    @Test
    void testCreateReportsMissingFields() {
        AttributeValidationException ex = assertThrows(AttributeValidationException.class,
                () -> repository.create(AttributeSpec.builder().displayName("No name").build()));
        assertTrue(ex.getMessage().startsWith("Missing required fields"));
        assertEquals(List.of("name", "categories", "dataType"), ex.getDetails());
    }

    @Test
    void testCreateRejectsUnparseableValues() {
        ValueParseException ex = assertThrows(ValueParseException.class,
                () -> repository.create(spec("score", DataType.NUMBER, "1, 2, abc").build()));
        assertEquals("abc", ex.getParseError().offendingToken());
        assertEquals(3, ex.getParseError().position());
        assertEquals(0, store.getWriteCount());
    }

    @Test
    void testCreateRejectsValuesOutsideBounds() {
        AttributeSpec s = spec("score", DataType.NUMBER, "5, 20")
                .constraints(AttributeConstraints.builder().maxValue(10.0).build())
                .build();
        ValueConstraintException ex = assertThrows(ValueConstraintException.class, () -> repository.create(s));
        assertEquals(ConstraintKind.MAX_VALUE, ex.getViolation().which());
    }

    @Test
    void testCreateRejectsMismatchedConstraintShape() {
        AttributeSpec s = spec("team", DataType.STRING, "red")
                .constraints(AttributeConstraints.builder().minValue(1.0).build())
                .build();
        AttributeValidationException ex = assertThrows(AttributeValidationException.class, () -> repository.create(s));
        assertTrue(ex.getDetails().contains("String type cannot have numeric value constraints"));
    }

    @Test
    void testCreateRejectsDefaultOutsidePermittedValues() {
        AttributeSpec s = spec("role", DataType.STRING, "admin,user")
                .defaultValue(TextNode.valueOf("root"))
                .build();
        ValueConstraintException ex = assertThrows(ValueConstraintException.class, () -> repository.create(s));
        assertEquals(ConstraintKind.ENUMERATION, ex.getViolation().which());
    }

    @Test
    void testCreateRejectsDuplicateName() {
        repository.create(spec("role", DataType.STRING, "admin").build());
        AttributeConflictException ex = assertThrows(AttributeConflictException.class,
                () -> repository.create(spec("role", DataType.STRING, "user").build()));
        assertEquals(AttributeConflictException.Reason.DUPLICATE_NAME, ex.getReason());
    }

    @Test
    void testCreateRejectsBadName() {
        AttributeValidationException ex = assertThrows(AttributeValidationException.class,
                () -> repository.create(spec("9lives", DataType.STRING, "x").build()));
        assertTrue(ex.getMessage().contains("must start with a letter"));
    }

    @Test
    void testSystemAttributeIsNotCustom() {
        AttributeDefinition def = repository.createSystemAttribute(spec("tenant", DataType.STRING, "").build());
        assertTrue(def.isSystem());
        assertFalse(def.getMetadata().isCustom());
    }

    @Test
    void testAppendOnlyAcceptsSupersetAndRejectsRemoval() {
        AttributeDefinition tags = repository.create(spec("tags", DataType.ARRAY, "[1,2]").build());
        oracle.markUsed(tags.getId(), "Admins only");

        AttributeDefinition grown = repository.update(tags.getId(),
                AttributePatch.builder().permittedValues("[1,2,3]").build());
        assertEquals(List.of(TypedValue.of(1), TypedValue.of(2), TypedValue.of(3)), grown.getEnumValues());

        ValueConstraintException ex = assertThrows(ValueConstraintException.class,
                () -> repository.update(tags.getId(), AttributePatch.builder().permittedValues("[1,3]").build()));
        assertEquals(ConstraintKind.APPEND_ONLY, ex.getViolation().which());
        assertEquals(TypedValue.of(2), ex.getViolation().offendingValue());
        assertEquals(grown.getEnumValues(), repository.findById(tags.getId()).getEnumValues());
    }

    @Test
    void testAppendOnlyAcceptsValuesWithBoundlessConstraints() throws Exception {
        AttributeDefinition tags = repository.create(spec("tags", DataType.ARRAY, "[\"a\",\"b\"]")
                .constraints(AttributeConstraints.builder().maxLength(10).build())
                .build());
        oracle.markUsed(tags.getId(), "P1");

        AttributeDefinition grown = repository.update(tags.getId(), AttributePatch.builder()
                .constraints(AttributeConstraints.builder().build())
                .enumValues(new ObjectMapper().readTree("[\"a\",\"b\",\"c\"]"))
                .build());

        assertEquals(List.of(TypedValue.of("a"), TypedValue.of("b"), TypedValue.of("c")), grown.getEnumValues());
        assertEquals(Integer.valueOf(10), grown.getConstraints().getMaxLength());
    }

    @Test
    void testConstraintPatchKeepsBoundsItDoesNotName() {
        AttributeDefinition code = repository.create(spec("code", DataType.STRING, "alpha,beta")
                .constraints(AttributeConstraints.builder().maxLength(10).pattern("^[a-z]+$").build())
                .build());

        AttributeDefinition updated = repository.update(code.getId(), AttributePatch.builder()
                .constraints(AttributeConstraints.builder().minLength(2).build())
                .build());

        assertEquals(Integer.valueOf(2), updated.getConstraints().getMinLength());
        assertEquals(Integer.valueOf(10), updated.getConstraints().getMaxLength());
        assertEquals("^[a-z]+$", updated.getConstraints().getPattern());
        assertEquals(code.getEnumValues(), updated.getEnumValues());

        AttributeDefinition same = repository.update(code.getId(), AttributePatch.builder()
                .constraints(AttributeConstraints.builder().build())
                .build());
        assertEquals(updated.getRevision(), same.getRevision());
    }

    @Test
    void testAppendOnlyRejectsOtherFields() {
        AttributeDefinition tags = repository.create(spec("tags", DataType.ARRAY, "[\"a\"]").build());
        oracle.markUsed(tags.getId(), "P1");

        ValueConstraintException ex = assertThrows(ValueConstraintException.class,
                () -> repository.update(tags.getId(), AttributePatch.builder().displayName("Labels").build()));
        assertEquals(ConstraintKind.EDIT_POLICY, ex.getViolation().which());
        assertEquals(List.of("displayName"), ex.getDetails());
    }

    @Test
    void testLockedOnlyAllowsDescription() {
        AttributeDefinition role = repository.create(spec("role", DataType.STRING, "admin,user").build());
        oracle.markUsed(role.getId(), "P1", "P2");

        ValueConstraintException ex = assertThrows(ValueConstraintException.class,
                () -> repository.update(role.getId(), AttributePatch.builder().permittedValues("admin,user,guest").build()));
        assertEquals(ConstraintKind.EDIT_POLICY, ex.getViolation().which());
        assertTrue(ex.getMessage().contains("2 policies"));

        AttributeDefinition updated = repository.update(role.getId(),
                AttributePatch.builder().description("Who the user is").modifiedBy("editor").build());
        assertEquals("Who the user is", updated.getDescription());
        assertEquals("editor", updated.getMetadata().getLastModifiedBy());
        assertEquals(2L, updated.getRevision());
    }

    @Test
    void testLockedAcceptsUnchangedFieldsSentBack() {
        AttributeDefinition role = repository.create(spec("role", DataType.STRING, "admin,user").build());
        oracle.markUsed(role.getId(), "P1");

        AttributeDefinition updated = repository.update(role.getId(), AttributePatch.builder()
                .displayName(role.getDisplayName())
                .dataType(DataType.STRING)
                .permittedValues("user, admin")
                .description("changed")
                .build());
        assertEquals("changed", updated.getDescription());
    }

    @Test
    void testUpdateWithoutChangesDoesNotWrite() {
        AttributeDefinition role = repository.create(spec("role", DataType.STRING, "admin").build());
        int writes = store.getWriteCount();

        AttributeDefinition same = repository.update(role.getId(),
                AttributePatch.builder().displayName(role.getDisplayName()).build());
        assertEquals(role.getRevision(), same.getRevision());
        assertEquals(writes, store.getWriteCount());
    }

    @Test
    void testUpdateRejectsRename() {
        AttributeDefinition role = repository.create(spec("role", DataType.STRING, "admin").build());
        assertThrows(AttributeValidationException.class,
                () -> repository.update(role.getId(), AttributePatch.builder().name("position").build()));
    }

    @Test
    void testUpdateRejectsStaleExpectedRevision() {
        AttributeDefinition role = repository.create(spec("role", DataType.STRING, "admin").build());
        AttributeConflictException ex = assertThrows(AttributeConflictException.class,
                () -> repository.update(role.getId(), AttributePatch.builder().description("x").expectedRevision(7L).build()));
        assertEquals(AttributeConflictException.Reason.STALE_REVISION, ex.getReason());
    }

    @Test
    void testConcurrentWriteBetweenCheckAndWriteIsRefused() {
        AttributeDefinition role = repository.create(spec("role", DataType.STRING, "admin").build());
        // another writer changes the record while the guard is consulted
        AttributeRepository racing = newRepository(new UsageGuard(id -> {
            store.touch(id);
            return AttributeUsage.unused(id);
        }));

        AttributeConflictException ex = assertThrows(AttributeConflictException.class,
                () -> racing.update(role.getId(), AttributePatch.builder().description("x").build()));
        assertEquals(AttributeConflictException.Reason.STALE_REVISION, ex.getReason());

        assertThrows(AttributeConflictException.class, () -> racing.delete(role.getId()));
        assertTrue(store.findById(role.getId()).isPresent());
    }

    @Test
    void testDataTypeChangeRereadsExistingValues() {
        AttributeDefinition level = repository.create(spec("level", DataType.STRING, "1, 2").build());
        AttributeDefinition updated = repository.update(level.getId(),
                AttributePatch.builder().dataType(DataType.NUMBER).build());
        assertEquals(DataType.NUMBER, updated.getDataType());
        assertEquals(List.of(TypedValue.of(1), TypedValue.of(2)), updated.getEnumValues());
    }

    @Test
    void testDataTypeChangeFailsWhenValuesDoNotConvert() {
        AttributeDefinition role = repository.create(spec("role", DataType.STRING, "admin").build());
        assertThrows(AttributeValidationException.class,
                () -> repository.update(role.getId(), AttributePatch.builder().dataType(DataType.NUMBER).build()));
    }

    @Test
    void testOracleFailureBlocksUpdate() {
        AttributeDefinition role = repository.create(spec("role", DataType.STRING, "admin").build());
        oracle.failWith(new IllegalStateException("policy service down"));
        int writes = store.getWriteCount();

        assertThrows(UsageLookupException.class,
                () -> repository.update(role.getId(), AttributePatch.builder().description("x").build()));
        assertEquals(writes, store.getWriteCount());
    }

    @Test
    void testDeleteChecksSystemBeforeUsage() {
        AttributeDefinition tenant = repository.createSystemAttribute(spec("tenant", DataType.STRING, "").build());
        int calls = oracle.getCallCount();

        assertThrows(AttributeForbiddenException.class, () -> repository.delete(tenant.getId()));
        assertEquals(calls, oracle.getCallCount());
        assertTrue(store.findById(tenant.getId()).isPresent());
    }

    @Test
    void testDeleteRefusedWhileInUse() {
        AttributeDefinition role = repository.create(spec("role", DataType.STRING, "admin").build());
        oracle.markUsed(role.getId(), "Admins", "Auditors");

        AttributeConflictException ex = assertThrows(AttributeConflictException.class, () -> repository.delete(role.getId()));
        assertEquals(AttributeConflictException.Reason.IN_USE, ex.getReason());
        assertEquals("Unable to delete \"Role\" - This attribute is currently being used in 2 policies", ex.getMessage());
        assertEquals(List.of("Admins", "Auditors"), ex.getDetails());
    }

    @Test
    void testDeleteRemovesUnusedAttribute() {
        AttributeDefinition role = repository.create(spec("role", DataType.STRING, "admin").build());
        repository.delete(role.getId());
        assertThrows(AttributeNotFoundException.class, () -> repository.findById(role.getId()));
    }

    @Test
    void testGetUsageOfMissingAttribute() {
        assertThrows(AttributeNotFoundException.class, () -> repository.getUsage("nope"));
    }

    @Test
    void testEnumValuesAsJsonAreReadByType() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        AttributeDefinition since = repository.create(spec("since", DataType.DATE, null)
                .enumValues(mapper.readTree("[\"2024-01-31\", \"2024-02-01T10:00:00Z\"]"))
                .build());
        assertEquals(2, since.getEnumValues().size());
        assertEquals(DataType.DATE, since.getEnumValues().get(1).kind());
    }
}
