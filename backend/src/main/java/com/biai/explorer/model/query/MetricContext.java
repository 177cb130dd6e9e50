package com.biai.explorer.model.query;

import com.biai.explorer.model.enums.MetricType;

import java.util.List;
import java.util.Optional;

/**
 * How an aggregation counts, derived per query.
 *
 * Row counting has no joins and aggregates with {@code count()}/{@code countIf}.
 * Parent counting left-joins the ancestor chain from the aggregated table to the
 * target table and aggregates with {@code uniq}/{@code uniqIf} over the target's
 * referenced key.
 */
public record MetricContext(
    MetricType type,
    String parentTable,
    String parentColumn,
    List<MetricJoin> joins,
    List<MetricPathSegment> pathSegments,
    AliasTable aliases,
    String ancestorExpression
) {

    public MetricContext {
        joins = joins == null ? List.of() : List.copyOf(joins);
        pathSegments = pathSegments == null ? List.of() : List.copyOf(pathSegments);
    }

    public static MetricContext rows(String baseTable) {
        return new MetricContext(MetricType.ROWS, null, null, List.of(), List.of(), new AliasTable(baseTable), null);
    }

    public boolean isParent() {
        return type == MetricType.PARENT;
    }

    /**
     * Unconditional metric aggregate.
     */
    public String aggregate() {
        return aggregate(null);
    }

    /**
     * Metric aggregate restricted to rows matching {@code condition} ({@code null}
     * for no restriction).
     */
    public String aggregate(String condition) {
        if (isParent()) {
            return condition == null
                ? "uniq(" + ancestorExpression + ")"
                : "uniqIf(" + ancestorExpression + ", " + condition + ")";
        }
        return condition == null ? "count()" : "countIf(" + condition + ")";
    }

    /**
     * FROM clause body: the aggregated table as {@code base_table} followed by the
     * ancestor joins.
     */
    public String fromClause(String qualifiedBaseTable) {
        StringBuilder from = new StringBuilder(qualifiedBaseTable).append(" AS ").append(AliasTable.BASE_ALIAS);
        for (MetricJoin join : joins) {
            from.append("\nANY LEFT JOIN ").append(join.table())
                .append(" AS ").append(join.alias())
                .append(" ON ").append(join.onCondition());
        }
        return from.toString();
    }

    public Optional<String> aliasFor(String table) {
        return aliases.aliasFor(table);
    }

    /**
     * Foreign key of the aggregated table that starts the ancestor chain.
     */
    public Optional<String> firstForeignKey() {
        return joins.isEmpty() ? Optional.empty() : Optional.of(joins.get(0).foreignKey());
    }
}
