package com.biai.explorer.model.query;

import com.biai.explorer.model.enums.FilterOperator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the explorer's filter JSON into the {@link Filter} tree.
 *
 * A JSON array is an implicit AND of its elements. Objects with an {@code and} or
 * {@code or} array, or a {@code not} object, are logical nodes (checked in that
 * order); anything else is a leaf. Unknown operators are kept as {@code null} so
 * the leaf compiles to nothing.
 */
public class FilterDeserializer extends StdDeserializer<Filter> {

    public FilterDeserializer() {
        super(Filter.class);
    }

    @Override
    public Filter deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        return fromNode(node);
    }

    public static Filter fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }

        if (node.isArray()) {
            return new Filter.And(children(node));
        }

        String tableName = text(node, "tableName");

        if (node.path("and").isArray()) {
            return new Filter.And(children(node.get("and")), tableName);
        }
        if (node.path("or").isArray()) {
            return new Filter.Or(children(node.get("or")), tableName);
        }
        if (node.path("not").isObject()) {
            return new Filter.Not(fromNode(node.get("not")), tableName);
        }

        FilterOperator operator = FilterOperator.lookup(text(node, "operator")).orElse(null);

        return new Filter.Condition(
            text(node, "column"),
            operator,
            new FilterValue(node.path("value")),
            tableName,
            text(node, "temporal_reference_column"),
            text(node, "temporal_reference_table")
        );
    }

    private static List<Filter> children(JsonNode array) {
        List<Filter> result = new ArrayList<>();
        for (JsonNode child : array) {
            Filter filter = fromNode(child);
            if (filter != null) {
                result.add(filter);
            }
        }
        return result;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.textValue() : null;
    }
}
