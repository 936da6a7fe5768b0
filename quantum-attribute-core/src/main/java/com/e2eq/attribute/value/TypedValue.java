package com.e2eq.attribute.value;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A permitted value of an attribute. Exactly one of six shapes; callers that need to
 * handle every shape go through {@link #accept(Visitor)} so a missing case is a compile error.
 */
@JsonSerialize(using = TypedValueJsonSerializer.class)
@JsonDeserialize(using = TypedValueJsonDeserializer.class)
public interface TypedValue {

    DataType kind();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitString(Str value);
        R visitNumber(Num value);
        R visitBoolean(Bool value);
        R visitDate(Dt value);
        R visitArray(Arr value);
        R visitObject(Obj value);
    }

    static Str of(String value) {
        return new Str(value);
    }

    static Num of(double value) {
        return new Num(value);
    }

    static Bool of(boolean value) {
        return new Bool(value);
    }

    static Dt of(LocalDate value) {
        return new Dt(value);
    }

    record Str(String value) implements TypedValue {
        public Str {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public DataType kind() {
            return DataType.STRING;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    record Num(double value) implements TypedValue {
        public Num {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Numeric values must be finite: " + value);
            }
            // -0.0 and 0.0 are one permitted value
            if (value == 0.0) {
                value = 0.0;
            }
        }

        @Override
        public DataType kind() {
            return DataType.NUMBER;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    record Bool(boolean value) implements TypedValue {
        @Override
        public DataType kind() {
            return DataType.BOOLEAN;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolean(this);
        }
    }

    record Dt(LocalDate value) implements TypedValue {
        public Dt {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public DataType kind() {
            return DataType.DATE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDate(this);
        }
    }

    record Arr(List<TypedValue> items) implements TypedValue {
        public Arr {
            items = List.copyOf(items);
        }

        @Override
        public DataType kind() {
            return DataType.ARRAY;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArray(this);
        }
    }

    record Obj(Map<String, TypedValue> fields) implements TypedValue {
        public Obj {
            // keep the caller's key order for formatting, equality stays order-insensitive
            Map<String, TypedValue> copy = new LinkedHashMap<>();
            fields.forEach((k, v) -> copy.put(Objects.requireNonNull(k, "key"), Objects.requireNonNull(v, "value of " + k)));
            fields = Collections.unmodifiableMap(copy);
        }

        @Override
        public DataType kind() {
            return DataType.OBJECT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitObject(this);
        }
    }
}
