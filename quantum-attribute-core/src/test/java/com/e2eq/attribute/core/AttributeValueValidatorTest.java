package com.e2eq.attribute.core;

import com.e2eq.attribute.constraint.AttributeConstraints;
import com.e2eq.attribute.constraint.ConstraintValidator;
import com.e2eq.attribute.constraint.ValueFormat;
import com.e2eq.attribute.model.AttributeDefinition;
import com.e2eq.attribute.value.DataType;
import com.e2eq.attribute.value.TypedValue;
import com.e2eq.attribute.value.ValueParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AttributeValueValidatorTest {

    private final AttributeValueValidator validator = new AttributeValueValidator(new ValueParser(), new ConstraintValidator());
    private final ObjectMapper mapper = new ObjectMapper();

    private static AttributeDefinition.AttributeDefinitionBuilder attribute(DataType type) {
        return AttributeDefinition.builder().name("x").displayName("X").dataType(type);
    }

    @Test
    void testRequiredValueMissing() {
        ValueValidationReport report = validator.validate(attribute(DataType.STRING).required(true).build(), NullNode.getInstance());
        assertFalse(report.valid());
        assertEquals(List.of("Value for X is required"), report.errors());
    }

    @Test
    void testMissingOptionalValueFallsBackToDefault() {
        AttributeDefinition def = attribute(DataType.STRING).defaultValue(TypedValue.of("guest")).build();
        ValueValidationReport report = validator.validate(def, TextNode.valueOf(""));
        assertTrue(report.valid());
        assertEquals(TypedValue.of("guest"), report.normalizedValue());
    }

    @Test
    void testNumberFromTextAndBounds() {
        AttributeDefinition def = attribute(DataType.NUMBER)
                .constraints(AttributeConstraints.builder().minValue(0.0).maxValue(10.0).build())
                .build();
        ValueValidationReport ok = validator.validate(def, TextNode.valueOf("7"));
        assertTrue(ok.valid());
        assertEquals(TypedValue.of(7), ok.normalizedValue());

        ValueValidationReport tooBig = validator.validate(def, DoubleNode.valueOf(11));
        assertFalse(tooBig.valid());
        assertTrue(tooBig.errors().get(0).contains("cannot exceed 10"));

        assertFalse(validator.validate(def, TextNode.valueOf("seven")).valid());
    }

    @Test
    void testEmailFormat() {
        AttributeDefinition def = attribute(DataType.STRING)
                .constraints(AttributeConstraints.builder().format(ValueFormat.EMAIL).build())
                .build();
        assertTrue(validator.validate(def, TextNode.valueOf("a@b.io")).valid());
        assertFalse(validator.validate(def, TextNode.valueOf("not-an-email")).valid());
    }

    @Test
    void testBooleanIsLenient() {
        AttributeDefinition def = attribute(DataType.BOOLEAN).build();
        assertEquals(TypedValue.of(true), validator.validate(def, TextNode.valueOf("1")).normalizedValue());
        assertEquals(TypedValue.of(false), validator.validate(def, BooleanNode.FALSE).normalizedValue());
    }

    @Test
    void testMultiValueChecksEachElement() throws Exception {
        AttributeDefinition def = attribute(DataType.STRING)
                .multiValue(true)
                .constraints(AttributeConstraints.builder()
                        .enumValues(new ArrayList<>(List.of(TypedValue.of("red"), TypedValue.of("blue"))))
                        .build())
                .build();

        ValueValidationReport ok = validator.validate(def, mapper.readTree("[\"red\",\"blue\"]"));
        assertTrue(ok.valid());
        assertEquals(DataType.ARRAY, ok.normalizedValue().kind());

        ValueValidationReport bad = validator.validate(def, mapper.readTree("[\"red\",\"green\"]"));
        assertFalse(bad.valid());

        ValueValidationReport wrongType = validator.validate(def, mapper.readTree("[\"red\", 3]"));
        assertEquals(List.of("Value must be a string"), wrongType.errors());
    }

    @Test
    void testObjectValue() throws Exception {
        AttributeDefinition def = attribute(DataType.OBJECT).build();
        assertTrue(validator.validate(def, mapper.readTree("{\"a\":1}")).valid());
        assertEquals(List.of("Value must be an object"), validator.validate(def, mapper.readTree("[1]")).errors());
    }
}
