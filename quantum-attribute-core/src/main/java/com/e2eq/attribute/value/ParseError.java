package com.e2eq.attribute.value;

/**
 * Why a permitted-value text could not be read. {@code position} is 1-based and counts
 * comma separated tokens for scalar types, input lines for array and object types.
 */
public record ParseError(String offendingToken, String reason, int position, Unit unit) {

    public enum Unit {
        TOKEN,
        LINE
    }

    public static ParseError atToken(String token, int position, String reason) {
        return new ParseError(token, reason, position, Unit.TOKEN);
    }

    public static ParseError atLine(String line, int lineNumber, String reason) {
        return new ParseError(line, reason, lineNumber, Unit.LINE);
    }

    public String message() {
        return String.format("%s '%s' at %s %d", reason, offendingToken,
                unit == Unit.LINE ? "line" : "token", position);
    }
}
