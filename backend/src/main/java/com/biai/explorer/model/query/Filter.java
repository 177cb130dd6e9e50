package com.biai.explorer.model.query;

import com.biai.explorer.model.enums.FilterOperator;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.List;

/**
 * Filter expression tree: a leaf {@link Condition} or one of the logical nodes
 * {@link And}, {@link Or}, {@link Not}.
 */
@JsonDeserialize(using = FilterDeserializer.class)
public sealed interface Filter permits Filter.Condition, Filter.And, Filter.Or, Filter.Not {

    <R> R accept(Visitor<R> visitor);

    /**
     * Table named by the filter, looking through a NOT wrapper.
     */
    String targetTable();

    interface Visitor<R> {
        R visitCondition(Condition condition);

        R visitAnd(And and);

        R visitOr(Or or);

        R visitNot(Not not);
    }

    record And(List<Filter> filters, String tableName) implements Filter {
        public And {
            filters = filters == null ? List.of() : List.copyOf(filters);
        }

        public And(List<Filter> filters) {
            this(filters, null);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnd(this);
        }

        @Override
        public String targetTable() {
            return tableName;
        }
    }

    record Or(List<Filter> filters, String tableName) implements Filter {
        public Or {
            filters = filters == null ? List.of() : List.copyOf(filters);
        }

        public Or(List<Filter> filters) {
            this(filters, null);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOr(this);
        }

        @Override
        public String targetTable() {
            return tableName;
        }
    }

    record Not(Filter filter, String tableName) implements Filter {
        public Not(Filter filter) {
            this(filter, null);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNot(this);
        }

        @Override
        public String targetTable() {
            if (tableName != null) {
                return tableName;
            }
            return filter != null ? filter.targetTable() : null;
        }
    }

    record Condition(
        String column,
        FilterOperator operator,
        FilterValue value,
        String tableName,
        String temporalReferenceColumn,
        String temporalReferenceTable
    ) implements Filter {

        public Condition {
            value = value == null ? FilterValue.absent() : value;
        }

        public boolean isComplete() {
            return column != null && !column.isBlank() && operator != null;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCondition(this);
        }

        @Override
        public String targetTable() {
            return tableName;
        }
    }
}
