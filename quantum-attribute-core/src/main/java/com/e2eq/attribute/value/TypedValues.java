package com.e2eq.attribute.value;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Conversions between {@link TypedValue} and the JSON tree / plain Java forms used at the edges.
 */
public final class TypedValues {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private TypedValues() {
    }

    public static JsonNode toJson(TypedValue value) {
        return value.accept(new TypedValue.Visitor<JsonNode>() {
            @Override
            public JsonNode visitString(TypedValue.Str v) {
                return NODES.textNode(v.value());
            }

            @Override
            public JsonNode visitNumber(TypedValue.Num v) {
                double d = v.value();
                if (isIntegral(d)) {
                    return NODES.numberNode((long) d);
                }
                return NODES.numberNode(d);
            }

            @Override
            public JsonNode visitBoolean(TypedValue.Bool v) {
                return NODES.booleanNode(v.value());
            }

            @Override
            public JsonNode visitDate(TypedValue.Dt v) {
                return NODES.textNode(v.value().toString());
            }

            @Override
            public JsonNode visitArray(TypedValue.Arr v) {
                ArrayNode array = NODES.arrayNode();
                v.items().forEach(item -> array.add(toJson(item)));
                return array;
            }

            @Override
            public JsonNode visitObject(TypedValue.Obj v) {
                ObjectNode object = NODES.objectNode();
                v.fields().forEach((k, item) -> object.set(k, toJson(item)));
                return object;
            }
        });
    }

    public static ArrayNode toJsonArray(Collection<? extends TypedValue> values) {
        ArrayNode array = NODES.arrayNode();
        values.forEach(v -> array.add(toJson(v)));
        return array;
    }

    /**
     * Converts a JSON node by its natural shape. Dates have no JSON form and come back as strings.
     *
     * @throws IllegalArgumentException for null or missing nodes, or non-finite numbers
     */
    public static TypedValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IllegalArgumentException("null values are not permitted");
        }
        if (node.isTextual()) {
            return new TypedValue.Str(node.textValue());
        }
        if (node.isNumber()) {
            double d = node.doubleValue();
            if (!Double.isFinite(d)) {
                throw new IllegalArgumentException("number out of range: " + node.asText());
            }
            return new TypedValue.Num(d);
        }
        if (node.isBoolean()) {
            return new TypedValue.Bool(node.booleanValue());
        }
        if (node.isArray()) {
            List<TypedValue> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(fromJson(item));
            }
            return new TypedValue.Arr(items);
        }
        if (node.isObject()) {
            Map<String, TypedValue> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                fields.put(e.getKey(), fromJson(e.getValue()));
            }
            return new TypedValue.Obj(fields);
        }
        throw new IllegalArgumentException("unsupported JSON value: " + node.getNodeType());
    }

    /**
     * Plain form for document storage and JSON-schema output: String, Double, Boolean,
     * ISO date String, List and Map.
     */
    public static Object toPlain(TypedValue value) {
        return value.accept(new TypedValue.Visitor<Object>() {
            @Override
            public Object visitString(TypedValue.Str v) {
                return v.value();
            }

            @Override
            public Object visitNumber(TypedValue.Num v) {
                return v.value();
            }

            @Override
            public Object visitBoolean(TypedValue.Bool v) {
                return v.value();
            }

            @Override
            public Object visitDate(TypedValue.Dt v) {
                return v.value().toString();
            }

            @Override
            public Object visitArray(TypedValue.Arr v) {
                List<Object> items = new ArrayList<>();
                v.items().forEach(item -> items.add(toPlain(item)));
                return items;
            }

            @Override
            public Object visitObject(TypedValue.Obj v) {
                Map<String, Object> fields = new LinkedHashMap<>();
                v.fields().forEach((k, item) -> fields.put(k, toPlain(item)));
                return fields;
            }
        });
    }

    /**
     * Inverse of {@link #toPlain(TypedValue)}. The declared type decides how strings are read:
     * for {@link DataType#DATE} they are calendar dates.
     */
    @SuppressWarnings("unchecked")
    public static TypedValue fromPlain(Object plain, DataType declared) {
        if (plain == null) {
            throw new IllegalArgumentException("null values are not permitted");
        }
        if (plain instanceof String) {
            String s = (String) plain;
            return declared == DataType.DATE ? new TypedValue.Dt(LocalDate.parse(s)) : new TypedValue.Str(s);
        }
        if (plain instanceof Date) {
            return new TypedValue.Dt(((Date) plain).toInstant().atZone(ZoneOffset.UTC).toLocalDate());
        }
        if (plain instanceof Number) {
            return new TypedValue.Num(((Number) plain).doubleValue());
        }
        if (plain instanceof Boolean) {
            return new TypedValue.Bool((Boolean) plain);
        }
        if (plain instanceof List) {
            List<TypedValue> items = new ArrayList<>();
            for (Object item : (List<Object>) plain) {
                items.add(fromPlain(item, null));
            }
            return new TypedValue.Arr(items);
        }
        if (plain instanceof Map) {
            Map<String, TypedValue> fields = new LinkedHashMap<>();
            ((Map<String, Object>) plain).forEach((k, v) -> fields.put(k, fromPlain(v, null)));
            return new TypedValue.Obj(fields);
        }
        throw new IllegalArgumentException("unsupported stored value type: " + plain.getClass().getName());
    }

    /**
     * Removes repeated values keeping the first occurrence of each.
     */
    public static List<TypedValue> distinct(Collection<? extends TypedValue> values) {
        return List.copyOf(new LinkedHashSet<>(values));
    }

    /**
     * Renders a number the way a user would type it: no trailing ".0" for integral values.
     */
    public static String formatNumber(double d) {
        if (isIntegral(d)) {
            return Long.toString((long) d);
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    /**
     * Human readable rendering used in messages.
     */
    public static String describe(TypedValue value) {
        return value.accept(new TypedValue.Visitor<String>() {
            @Override
            public String visitString(TypedValue.Str v) {
                return "\"" + v.value() + "\"";
            }

            @Override
            public String visitNumber(TypedValue.Num v) {
                return formatNumber(v.value());
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
                return toJson(v).toString();
            }

            @Override
            public String visitObject(TypedValue.Obj v) {
                return toJson(v).toString();
            }
        });
    }

    static boolean isIntegral(double d) {
        return d == Math.rint(d) && Math.abs(d) < 9.007199254740992E15;
    }
}
