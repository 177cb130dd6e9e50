package com.biai.explorer.model.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Value carried by a leaf filter, kept as the parsed JSON node so that an absent
 * value, an explicit {@code null}, numbers and strings stay distinguishable.
 */
public record FilterValue(JsonNode node) {

    private static final FilterValue ABSENT = new FilterValue(MissingNode.getInstance());

    public FilterValue {
        node = node == null ? MissingNode.getInstance() : node;
    }

    public static FilterValue absent() {
        return ABSENT;
    }

    public static FilterValue ofNull() {
        return new FilterValue(NullNode.getInstance());
    }

    public static FilterValue of(String value) {
        return value == null ? ofNull() : new FilterValue(JsonNodeFactory.instance.textNode(value));
    }

    public static FilterValue of(Number value) {
        if (value == null) {
            return ofNull();
        }
        JsonNodeFactory f = JsonNodeFactory.instance;
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return new FilterValue(f.numberNode(value.longValue()));
        }
        return new FilterValue(f.numberNode(value.doubleValue()));
    }

    public boolean isAbsent() {
        return node.isMissingNode();
    }

    public boolean isNull() {
        return node.isNull();
    }

    public boolean isString() {
        return node.isTextual();
    }

    public boolean isNumber() {
        return node.isNumber();
    }

    public boolean isList() {
        return node.isArray();
    }

    public String asString() {
        return node.textValue();
    }

    /**
     * Scalar as a plain Java object: String, Number, Boolean or null.
     */
    public Object scalar() {
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return null;
    }

    /**
     * Elements of a list value; a scalar is treated as a single-element list.
     */
    public List<FilterValue> elements() {
        List<FilterValue> result = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(child -> result.add(new FilterValue(child)));
        } else if (!node.isMissingNode()) {
            result.add(this);
        }
        return result;
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
