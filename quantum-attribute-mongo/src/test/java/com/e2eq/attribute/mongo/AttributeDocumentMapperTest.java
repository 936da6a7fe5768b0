package com.e2eq.attribute.mongo;

import com.e2eq.attribute.constraint.AttributeConstraints;
import com.e2eq.attribute.constraint.ValueFormat;
import com.e2eq.attribute.exceptions.AttributeStoreException;
import com.e2eq.attribute.model.AttributeCategory;
import com.e2eq.attribute.model.AttributeDefinition;
import com.e2eq.attribute.model.AttributeMetadata;
import com.e2eq.attribute.model.persistent.AttributeDocument;
import com.e2eq.attribute.model.persistent.ConstraintsDocument;
import com.e2eq.attribute.value.DataType;
import com.e2eq.attribute.value.TypedValue;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AttributeDocumentMapperTest {

    private static final String ID = new ObjectId().toHexString();

    private static AttributeDefinition holidays() {
        return AttributeDefinition.builder()
                .id(ID)
                .name("holiday")
                .displayName("Holiday")
                .categories(new LinkedHashSet<>(List.of(AttributeCategory.RESOURCE, AttributeCategory.SUBJECT)))
                .dataType(DataType.DATE)
                .defaultValue(new TypedValue.Dt(LocalDate.of(2024, 12, 25)))
                .constraints(AttributeConstraints.builder()
                        .enumValues(new ArrayList<>(List.of(
                                new TypedValue.Dt(LocalDate.of(2024, 1, 1)),
                                new TypedValue.Dt(LocalDate.of(2024, 12, 25)))))
                        .build())
                .metadata(AttributeMetadata.builder()
                        .createdBy("alice")
                        .tags(new ArrayList<>(List.of("calendar")))
                        .system(true)
                        .custom(false)
                        .build())
                .createdAt(new Date(0))
                .revision(4)
                .build();
    }

    @Test
    void testDocumentUsesWireNamesAndPlainValues() {
        AttributeDocument doc = AttributeDocumentMapper.toDocument(holidays());

        assertEquals(new ObjectId(ID), doc.getId());
        assertEquals(List.of("resource", "subject"), doc.getCategories());
        assertEquals("date", doc.getDataType());
        assertEquals("2024-12-25", doc.getDefaultValue());
        assertEquals(List.of("2024-01-01", "2024-12-25"), doc.getConstraints().getEnumValues());
        assertTrue(doc.getMetadata().isSystem());
        assertFalse(doc.getMetadata().isCustom());
        assertEquals(4L, doc.getVersion());
    }

    @Test
    void testDefinitionSurvivesStorage() {
        AttributeDefinition original = holidays();

        AttributeDefinition restored = AttributeDocumentMapper.toDefinition(AttributeDocumentMapper.toDocument(original));

        assertEquals(original.getId(), restored.getId());
        assertEquals(original.getCategories(), restored.getCategories());
        assertEquals(original.getEnumValues(), restored.getEnumValues());
        assertEquals(original.getDefaultValue(), restored.getDefaultValue());
        assertEquals(original.getMetadata().getTags(), restored.getMetadata().getTags());
        assertTrue(restored.isSystem());
        assertEquals(4L, restored.getRevision());
    }

    @Test
    void testUnsavedDefinitionHasNoVersion() {
        AttributeDefinition fresh = holidays().toBuilder().id(null).revision(0).build();

        AttributeDocument doc = AttributeDocumentMapper.toDocument(fresh);

        assertNull(doc.getId());
        assertNull(doc.getVersion());
    }

    @Test
    void testNestedDocumentsReadBackAsObjects() {
        AttributeDocument doc = new AttributeDocument();
        doc.setId(new ObjectId(ID));
        doc.setName("location");
        doc.setDataType("object");
        ConstraintsDocument constraints = new ConstraintsDocument();
        constraints.setEnumValues(new ArrayList<>(List.of(new Document("city", "Paris").append("floor", 3.0))));
        constraints.setFormat("email");
        doc.setConstraints(constraints);

        AttributeDefinition definition = AttributeDocumentMapper.toDefinition(doc);

        TypedValue expected = new TypedValue.Obj(Map.of("city", TypedValue.of("Paris"), "floor", TypedValue.of(3.0)));
        assertEquals(List.of(expected), definition.getEnumValues());
        assertEquals(ValueFormat.EMAIL, definition.getConstraints().getFormat());
        assertEquals(AttributeMetadata.DEFAULT_VERSION, definition.getMetadata().getVersion());
        assertEquals(0L, definition.getRevision());
    }

    @Test
    void testUnreadableDocumentIsAStoreFailure() {
        AttributeDocument doc = new AttributeDocument();
        doc.setId(new ObjectId(ID));
        doc.setName("broken");
        doc.setDataType("date");
        doc.setDefaultValue("not a date");

        assertThrows(AttributeStoreException.class, () -> AttributeDocumentMapper.toDefinition(doc));
    }

    @Test
    void testParseId() {
        assertTrue(AttributeDocumentMapper.parseId(ID).isPresent());
        assertTrue(AttributeDocumentMapper.parseId("attr_department").isEmpty());
        assertTrue(AttributeDocumentMapper.parseId(null).isEmpty());
    }
}
