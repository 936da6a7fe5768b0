package com.e2eq.attribute.value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes typed values back into the text form {@link ValueParser} reads, so that an existing
 * value set can be shown for editing. Strings containing commas have no text form.
 */
public class ValueFormatter {

    public String format(List<TypedValue> values, DataType dataType) {
        if (values == null || values.isEmpty()) {
            return "";
        }
        switch (dataType) {
            case STRING:
            case NUMBER:
            case BOOLEAN:
            case DATE:
                return values.stream().map(this::scalarText).collect(Collectors.joining(", "));
            case ARRAY:
                return TypedValues.toJsonArray(values).toString();
            case OBJECT:
                return values.stream().map(v -> TypedValues.toJson(v).toString()).collect(Collectors.joining("\n"));
            default:
                throw new IllegalStateException("Unhandled data type " + dataType);
        }
    }

    private String scalarText(TypedValue value) {
        return value.accept(new TypedValue.Visitor<String>() {
            @Override
            public String visitString(TypedValue.Str v) {
                return v.value();
            }

            @Override
            public String visitNumber(TypedValue.Num v) {
                return TypedValues.formatNumber(v.value());
            }

            @Override
            public String visitBoolean(TypedValue.Bool v) {
                return Boolean.toString(v.value());
            }

            @Override
            public String visitDate(TypedValue.Dt v) {
                return v.value().toString();
            }

            @Override
            public String visitArray(TypedValue.Arr v) {
                return TypedValues.toJson(v).toString();
            }

            @Override
            public String visitObject(TypedValue.Obj v) {
                return TypedValues.toJson(v).toString();
            }
        });
    }
}
