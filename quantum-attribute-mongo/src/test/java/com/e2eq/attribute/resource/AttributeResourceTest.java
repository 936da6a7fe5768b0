package com.e2eq.attribute.resource;

import com.e2eq.attribute.exceptions.AttributeValidationException;
import com.e2eq.attribute.model.AttributeCategory;
import com.e2eq.attribute.value.DataType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AttributeResourceTest {

    @Test
    void testCategoriesAcceptRepeatedAndCommaSeparatedValues() {
        assertEquals(Set.of(AttributeCategory.SUBJECT, AttributeCategory.RESOURCE),
                AttributeResource.parseCategories(List.of("subject, resource")));
        assertEquals(Set.of(AttributeCategory.SUBJECT, AttributeCategory.RESOURCE),
                AttributeResource.parseCategories(List.of("Subject", "resource")));
    }

    @Test
    void testNoCategoriesMeansNoFilter() {
        assertNull(AttributeResource.parseCategories(null));
        assertNull(AttributeResource.parseCategories(List.of(" , ")));
    }

    @Test
    void testUnknownCategoryIsRejected() {
        AttributeValidationException ex = assertThrows(AttributeValidationException.class,
                () -> AttributeResource.parseCategory("environment"));
        assertTrue(ex.getMessage().contains("environment"));
        assertThrows(AttributeValidationException.class, () -> AttributeResource.parseCategory(" "));
    }

    @Test
    void testDataTypeParsing() {
        assertEquals(DataType.BOOLEAN, AttributeResource.parseDataType("boolean"));
        assertThrows(AttributeValidationException.class, () -> AttributeResource.parseDataType("decimal"));
    }
}
