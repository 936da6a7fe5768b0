package com.e2eq.attribute.constraint;

import com.e2eq.attribute.value.TypedValue;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConstraintValidatorTest {

    private final ConstraintValidator validator = new ConstraintValidator();

    private static ConstraintKind kindOf(ValidationResult result) {
        return result.violation().map(ValueConstraintViolation::which).orElse(null);
    }

    @Test
    void testEmptyInputsAreValid() {
        assertTrue(validator.validate(List.of(), AttributeConstraints.builder().minLength(3).build()).isValid());
        assertTrue(validator.validate(List.of(TypedValue.of("a")), null).isValid());
    }

    @Test
    void testStringLength() {
        AttributeConstraints c = AttributeConstraints.builder().minLength(2).maxLength(4).build();
        assertTrue(validator.validate(List.of(TypedValue.of("ab"), TypedValue.of("abcd")), c).isValid());

        ValidationResult tooShort = validator.validate(List.of(TypedValue.of("ab"), TypedValue.of("a")), c);
        assertEquals(ConstraintKind.MIN_LENGTH, kindOf(tooShort));
        assertEquals(TypedValue.of("a"), tooShort.violation().get().offendingValue());

        assertEquals(ConstraintKind.MAX_LENGTH, kindOf(validator.validate(List.of(TypedValue.of("abcde")), c)));
    }

    @Test
    void testLengthAppliesToCollections() {
        AttributeConstraints c = AttributeConstraints.builder().maxLength(1).build();
        TypedValue pair = new TypedValue.Arr(List.of(TypedValue.of(1), TypedValue.of(2)));
        assertEquals(ConstraintKind.MAX_LENGTH, kindOf(validator.validate(List.of(pair), c)));

        TypedValue obj = new TypedValue.Obj(Map.of("a", TypedValue.of(1)));
        assertTrue(validator.validate(List.of(obj), c).isValid());
    }

    @Test
    void testNumericRange() {
        AttributeConstraints c = AttributeConstraints.builder().minValue(0.0).maxValue(100.0).build();
        assertTrue(validator.validate(List.of(TypedValue.of(0), TypedValue.of(100)), c).isValid());
        assertEquals(ConstraintKind.MIN_VALUE, kindOf(validator.validate(List.of(TypedValue.of(-1)), c)));

        ValidationResult over = validator.validate(List.of(TypedValue.of(100.5)), c);
        assertEquals(ConstraintKind.MAX_VALUE, kindOf(over));
        assertEquals("100.5 cannot exceed 100", over.violation().get().detail());
    }

    @Test
    void testUnanchoredPatternSearchesWithinValue() {
        AttributeConstraints c = AttributeConstraints.builder().pattern("[0-9]{3}").build();
        assertTrue(validator.validate(List.of(TypedValue.of("room-101")), c).isValid());
        assertEquals(ConstraintKind.PATTERN, kindOf(validator.validate(List.of(TypedValue.of("room-10")), c)));
    }

    @Test
    void testPattern() {
        AttributeConstraints c = AttributeConstraints.builder().pattern("^[a-z]+$").build();
        assertTrue(validator.validate(List.of(TypedValue.of("abc")), c).isValid());
        assertEquals(ConstraintKind.PATTERN, kindOf(validator.validate(List.of(TypedValue.of("Abc")), c)));

        AttributeConstraints broken = AttributeConstraints.builder().pattern("([a-z").build();
        assertEquals(ConstraintKind.PATTERN, kindOf(validator.validate(List.of(TypedValue.of("abc")), broken)));
    }

    @Test
    void testFormats() {
        assertTrue(validator.validate(List.of(TypedValue.of("https://example.com/x")),
                AttributeConstraints.builder().format(ValueFormat.URL).build()).isValid());
        assertEquals(ConstraintKind.FORMAT, kindOf(validator.validate(List.of(TypedValue.of("example")),
                AttributeConstraints.builder().format(ValueFormat.URL).build())));
        assertTrue(validator.validate(List.of(TypedValue.of("10.0.0.1")),
                AttributeConstraints.builder().format(ValueFormat.IPV4).build()).isValid());
        assertEquals(ConstraintKind.FORMAT, kindOf(validator.validate(List.of(TypedValue.of("300.1.1.1")),
                AttributeConstraints.builder().format(ValueFormat.IPV4).build())));
    }

    @Test
    void testMembership() {
        AttributeConstraints c = AttributeConstraints.builder()
                .enumValues(new ArrayList<>(List.of(TypedValue.of("red"), TypedValue.of("blue"))))
                .build();
        assertTrue(validator.validate(List.of(TypedValue.of("blue")), c).isValid());
        assertTrue(validator.validate(List.of(new TypedValue.Arr(List.of(TypedValue.of("red"), TypedValue.of("blue")))), c).isValid());
        assertEquals(ConstraintKind.ENUMERATION, kindOf(validator.validate(List.of(TypedValue.of("green")), c)));
    }

    @Test
    void testChecksRunInOrder() {
        AttributeConstraints c = AttributeConstraints.builder()
                .maxLength(3)
                .pattern("^x")
                .enumValues(new ArrayList<>(List.of(TypedValue.of("xy"))))
                .build();
        assertEquals(ConstraintKind.MAX_LENGTH, kindOf(validator.validate(List.of(TypedValue.of("abcd")), c)));
        assertEquals(ConstraintKind.PATTERN, kindOf(validator.validate(List.of(TypedValue.of("abc")), c)));
        assertEquals(ConstraintKind.ENUMERATION, kindOf(validator.validate(List.of(TypedValue.of("xz")), c)));
    }
}
