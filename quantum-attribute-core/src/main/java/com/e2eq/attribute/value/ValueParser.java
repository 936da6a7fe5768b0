package com.e2eq.attribute.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads user supplied permitted-value text into typed values for a declared {@link DataType}.
 * <p>
 * Scalar types take a comma separated list. Array takes one JSON array literal, or one JSON
 * array literal per line whose elements are flattened. Object takes one JSON object literal per
 * line. Parsing is all or nothing: the first bad token or line fails the whole input.
 * </p>
 * Never throws for bad input; failures come back as {@link ParseResult#failure(ParseError)}.
 */
public class ValueParser {

    private final ObjectReader jsonReader;

    public ValueParser() {
        this(new ObjectMapper());
    }

    public ValueParser(ObjectMapper objectMapper) {
        this.jsonReader = objectMapper.readerFor(JsonNode.class)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ParseResult parse(String raw, DataType dataType) {
        if (dataType == null) {
            return ParseResult.failure(ParseError.atToken(String.valueOf(raw), 1, "No data type declared for"));
        }
        if (raw == null || raw.isBlank()) {
            return ParseResult.ok(List.of());
        }
        switch (dataType) {
            case STRING:
            case NUMBER:
            case BOOLEAN:
            case DATE:
                return parseScalars(raw, dataType);
            case ARRAY:
                return parseArrays(raw);
            case OBJECT:
                return parseObjects(raw);
            default:
                throw new IllegalStateException("Unhandled data type " + dataType);
        }
    }

    /**
     * Type-directed reading of an already structured JSON list of permitted values, as sent by
     * clients that do not use the text form. For Array the elements of nested arrays are not
     * flattened; each list element is one permitted element.
     */
    public ParseResult parseJson(JsonNode values, DataType dataType) {
        if (values == null || values.isNull() || values.isMissingNode()) {
            return ParseResult.ok(List.of());
        }
        if (!values.isArray()) {
            return ParseResult.failure(ParseError.atToken(values.toString(), 1, "Expected a JSON list of values, got"));
        }
        List<TypedValue> out = new ArrayList<>(values.size());
        int position = 0;
        for (JsonNode node : values) {
            position++;
            ParseResult single = parseSingle(node, dataType, position);
            if (!single.isOk()) {
                return single;
            }
            out.addAll(single.values());
        }
        return ParseResult.ok(out);
    }

    /**
     * Reads one value of the declared type, e.g. a default value or a value submitted for validation.
     */
    public ParseResult parseSingle(JsonNode node, DataType dataType) {
        return parseSingle(node, dataType, 1);
    }

    private ParseResult parseSingle(JsonNode node, DataType dataType, int position) {
        String token = node == null ? "null" : (node.isTextual() ? node.textValue() : node.toString());
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ParseResult.failure(ParseError.atToken(token, position, "Null is not a permitted value"));
        }
        switch (dataType) {
            case STRING:
                if (!node.isTextual()) {
                    return ParseResult.failure(ParseError.atToken(token, position, "Expected a string"));
                }
                return ParseResult.ok(List.of(new TypedValue.Str(node.textValue())));
            case NUMBER:
                if (node.isNumber()) {
                    return convert(node, token, position);
                }
                return node.isTextual() ? parseScalar(node.textValue().trim(), DataType.NUMBER, position)
                        : ParseResult.failure(ParseError.atToken(token, position, "Invalid number"));
            case BOOLEAN:
                if (node.isBoolean()) {
                    return ParseResult.ok(List.of(new TypedValue.Bool(node.booleanValue())));
                }
                return node.isTextual() ? parseScalar(node.textValue().trim(), DataType.BOOLEAN, position)
                        : ParseResult.failure(ParseError.atToken(token, position, "Invalid boolean"));
            case DATE:
                if (!node.isTextual()) {
                    return ParseResult.failure(ParseError.atToken(token, position, "Invalid date"));
                }
                return parseScalar(node.textValue().trim(), DataType.DATE, position);
            case ARRAY:
                return convert(node, token, position);
            case OBJECT:
                if (!node.isObject()) {
                    return ParseResult.failure(ParseError.atToken(token, position, "Expected a JSON object"));
                }
                return convert(node, token, position);
            default:
                throw new IllegalStateException("Unhandled data type " + dataType);
        }
    }

    private ParseResult convert(JsonNode node, String token, int position) {
        try {
            return ParseResult.ok(List.of(TypedValues.fromJson(node)));
        } catch (IllegalArgumentException e) {
            return ParseResult.failure(ParseError.atToken(token, position, capitalize(e.getMessage())));
        }
    }

    private ParseResult parseScalars(String raw, DataType dataType) {
        String[] tokens = raw.split(",", -1);
        List<TypedValue> out = new ArrayList<>(tokens.length);
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i].trim();
            if (token.isEmpty()) {
                continue;
            }
            ParseResult one = parseScalar(token, dataType, i + 1);
            if (!one.isOk()) {
                return one;
            }
            out.addAll(one.values());
        }
        return ParseResult.ok(out);
    }

    private ParseResult parseScalar(String token, DataType dataType, int position) {
        switch (dataType) {
            case STRING:
                return ParseResult.ok(List.of(new TypedValue.Str(token)));
            case NUMBER:
                return parseNumber(token, position);
            case BOOLEAN:
                String lower = token.toLowerCase(Locale.ROOT);
                if ("true".equals(lower)) {
                    return ParseResult.ok(List.of(new TypedValue.Bool(true)));
                }
                if ("false".equals(lower)) {
                    return ParseResult.ok(List.of(new TypedValue.Bool(false)));
                }
                return ParseResult.failure(ParseError.atToken(token, position, "Invalid boolean (expected true or false)"));
            case DATE:
                LocalDate date = parseDate(token);
                if (date == null) {
                    return ParseResult.failure(ParseError.atToken(token, position, "Invalid date (expected yyyy-MM-dd)"));
                }
                return ParseResult.ok(List.of(new TypedValue.Dt(date)));
            default:
                throw new IllegalStateException(dataType + " is not a scalar type");
        }
    }

    private ParseResult parseNumber(String token, int position) {
        try {
            double d = new BigDecimal(token).doubleValue();
            if (!Double.isFinite(d)) {
                return ParseResult.failure(ParseError.atToken(token, position, "Number out of range"));
            }
            return ParseResult.ok(List.of(new TypedValue.Num(d)));
        } catch (NumberFormatException e) {
            return ParseResult.failure(ParseError.atToken(token, position, "Invalid number"));
        }
    }

    static LocalDate parseDate(String token) {
        try {
            return LocalDate.parse(token);
        } catch (DateTimeParseException ignored) {
            // not a plain calendar date, try the date-time forms
        }
        try {
            return OffsetDateTime.parse(token).toLocalDate();
        } catch (DateTimeParseException ignored) {
            // no offset, try a local date-time
        }
        try {
            return LocalDateTime.parse(token).toLocalDate();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private ParseResult parseArrays(String raw) {
        JsonNode whole = readJson(raw.trim());
        if (whole != null && whole.isArray()) {
            return flatten(whole, raw.trim(), 1);
        }

        List<TypedValue> out = new ArrayList<>();
        String[] lines = raw.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            JsonNode node = readJson(line);
            if (node == null) {
                return ParseResult.failure(ParseError.atLine(line, i + 1, "Invalid JSON"));
            }
            if (!node.isArray()) {
                return ParseResult.failure(ParseError.atLine(line, i + 1, "Expected a JSON array"));
            }
            ParseResult lineResult = flatten(node, line, i + 1);
            if (!lineResult.isOk()) {
                return lineResult;
            }
            out.addAll(lineResult.values());
        }
        return ParseResult.ok(out);
    }

    private ParseResult flatten(JsonNode array, String line, int lineNumber) {
        List<TypedValue> out = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            try {
                out.add(TypedValues.fromJson(element));
            } catch (IllegalArgumentException e) {
                return ParseResult.failure(ParseError.atLine(line, lineNumber, capitalize(e.getMessage())));
            }
        }
        return ParseResult.ok(out);
    }

    private ParseResult parseObjects(String raw) {
        JsonNode whole = readJson(raw.trim());
        if (whole != null && whole.isObject()) {
            return objectValue(whole, raw.trim(), 1);
        }

        List<TypedValue> out = new ArrayList<>();
        String[] lines = raw.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            JsonNode node = readJson(line);
            if (node == null) {
                return ParseResult.failure(ParseError.atLine(line, i + 1, "Invalid JSON"));
            }
            if (node.isArray()) {
                return ParseResult.failure(ParseError.atLine(line, i + 1, "Expected a JSON object but found an array"));
            }
            if (!node.isObject()) {
                return ParseResult.failure(ParseError.atLine(line, i + 1, "Expected a JSON object"));
            }
            ParseResult lineResult = objectValue(node, line, i + 1);
            if (!lineResult.isOk()) {
                return lineResult;
            }
            out.addAll(lineResult.values());
        }
        return ParseResult.ok(out);
    }

    private ParseResult objectValue(JsonNode node, String line, int lineNumber) {
        try {
            return ParseResult.ok(List.of(TypedValues.fromJson(node)));
        } catch (IllegalArgumentException e) {
            return ParseResult.failure(ParseError.atLine(line, lineNumber, capitalize(e.getMessage())));
        }
    }

    private JsonNode readJson(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            return jsonReader.readValue(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String capitalize(String s) {
        if (s == null || s.isEmpty()) {
            return "Invalid value";
        }
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
