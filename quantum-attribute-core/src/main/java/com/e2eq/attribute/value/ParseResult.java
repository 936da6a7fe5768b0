package com.e2eq.attribute.value;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link ValueParser}: either the parsed values in input order or a single {@link ParseError}.
 */
public final class ParseResult {

    private final List<TypedValue> values;
    private final ParseError error;

    private ParseResult(List<TypedValue> values, ParseError error) {
        this.values = values;
        this.error = error;
    }

    public static ParseResult ok(List<TypedValue> values) {
        return new ParseResult(List.copyOf(values), null);
    }

    public static ParseResult failure(ParseError error) {
        return new ParseResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    /**
     * @throws IllegalStateException when the parse failed
     */
    public List<TypedValue> values() {
        if (error != null) {
            throw new IllegalStateException("Parse failed: " + error.message());
        }
        return values;
    }

    public ParseError error() {
        return error;
    }

    @Override
    public String toString() {
        return isOk() ? "ParseResult{values=" + values + "}" : "ParseResult{error=" + error + "}";
    }
}
