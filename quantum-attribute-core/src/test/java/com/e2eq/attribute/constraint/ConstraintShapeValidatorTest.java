package com.e2eq.attribute.constraint;

import com.e2eq.attribute.value.DataType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConstraintShapeValidatorTest {

    private final ConstraintShapeValidator validator = new ConstraintShapeValidator();

    @Test
    void testBoundsMustFitType() {
        assertEquals(List.of("String type cannot have numeric value constraints"),
                validator.validate(DataType.STRING, AttributeConstraints.builder().maxValue(3.0).build()));
        assertEquals(List.of("Number type cannot have string constraints"),
                validator.validate(DataType.NUMBER, AttributeConstraints.builder().pattern("\\d+").build()));
        assertEquals(List.of("Boolean type can only have enum constraints"),
                validator.validate(DataType.BOOLEAN, AttributeConstraints.builder().format(ValueFormat.EMAIL).build()));
        assertTrue(validator.validate(DataType.ARRAY, AttributeConstraints.builder().maxLength(5).build()).isEmpty());
    }

    @Test
    void testRangesAreOrdered() {
        List<String> errors = validator.validate(DataType.STRING,
                AttributeConstraints.builder().minLength(5).maxLength(2).build());
        assertEquals(List.of("Min length cannot be greater than max length"), errors);

        assertTrue(validator.validate(DataType.NUMBER, AttributeConstraints.builder().minValue(9.0).maxValue(1.0).build())
                .contains("Min value cannot be greater than max value"));
        assertTrue(validator.validate(DataType.STRING, AttributeConstraints.builder().minLength(-1).build())
                .contains("Min length cannot be negative"));
    }

    @Test
    void testInvalidPattern() {
        List<String> errors = validator.validate(DataType.STRING, AttributeConstraints.builder().pattern("[").build());
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("Pattern is not a valid regular expression"));
    }
}
