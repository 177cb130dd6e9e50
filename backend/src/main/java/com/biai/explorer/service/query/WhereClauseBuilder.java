package com.biai.explorer.service.query;

import com.biai.explorer.model.query.AliasTable;
import com.biai.explorer.model.query.Filter;
import com.biai.explorer.model.query.MetricContext;
import com.biai.explorer.model.query.TableMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.biai.explorer.service.query.SqlSanitizer.escapeIdentifier;

/**
 * Assembles the filter part of an aggregation WHERE clause.
 *
 * Top-level filters are routed by the table they name:
 * <ul>
 *   <li>the aggregated table (or none): compiled against {@code base_table}, after
 *       dropping leaves on unknown columns</li>
 *   <li>a joined ancestor under parent counting: compiled against its join alias</li>
 *   <li>any other table: a membership subquery along the relationship path</li>
 * </ul>
 * Under parent counting a negated local filter excludes every parent with at least
 * one matching child, instead of excluding rows one by one.
 *
 * The result is either empty or {@code AND (...)}, ready to follow {@code WHERE 1=1}.
 */
@Slf4j
@Component
public class WhereClauseBuilder {

    private final FilterCompiler filterCompiler;
    private final FilterPruner filterPruner;
    private final CrossTableSubqueryBuilder crossTableSubqueryBuilder;

    public WhereClauseBuilder(FilterCompiler filterCompiler, FilterPruner filterPruner,
                              CrossTableSubqueryBuilder crossTableSubqueryBuilder) {
        this.filterCompiler = filterCompiler;
        this.filterPruner = filterPruner;
        this.crossTableSubqueryBuilder = crossTableSubqueryBuilder;
    }

    public String build(Filter filters, TableMetadata table, RelationshipGraph graph, MetricContext metric) {
        if (filters == null) {
            return "";
        }

        List<Filter> localFilters = new ArrayList<>();
        List<String> aliasConditions = new ArrayList<>();
        List<String> subqueryConditions = new ArrayList<>();

        for (Filter filter : topLevel(filters)) {
            String targetTable = filter.targetTable();
            Optional<String> alias = metric.aliasFor(targetTable);
            boolean crossTable = alias.isEmpty() && targetTable != null && !targetTable.equals(table.tableName());
            boolean local = alias.map(AliasTable.BASE_ALIAS::equals).orElse(!crossTable);

            if (filter instanceof Filter.Not not && metric.isParent() && local) {
                parentExclusion(not, table, graph, metric).ifPresent(subqueryConditions::add);
            } else if (alias.isPresent() && !local) {
                ancestorCondition(filter, targetTable, alias.get(), graph).ifPresent(aliasConditions::add);
            } else if (crossTable) {
                crossTableSubqueryBuilder.build(table.tableName(), filter, graph).ifPresent(subqueryConditions::add);
            } else {
                filterPruner.prune(filter, table).ifPresent(localFilters::add);
            }
        }

        List<String> conditions = new ArrayList<>();
        if (!localFilters.isEmpty()) {
            Filter tree = localFilters.size() == 1 ? localFilters.get(0) : new Filter.And(localFilters);
            filterCompiler.compile(tree, AliasTable.BASE_ALIAS).ifPresent(conditions::add);
        }
        conditions.addAll(aliasConditions);
        conditions.addAll(subqueryConditions);

        if (conditions.isEmpty()) {
            return "";
        }
        return "AND (" + String.join(" AND ", conditions) + ")";
    }

    /**
     * A top-level AND without its own table is a plain list of filters.
     */
    private List<Filter> topLevel(Filter filters) {
        if (filters instanceof Filter.And and && and.tableName() == null) {
            return and.filters();
        }
        return List.of(filters);
    }

    private Optional<String> ancestorCondition(Filter filter, String tableName, String alias, RelationshipGraph graph) {
        Optional<TableMetadata> ancestor = graph.table(tableName);
        if (ancestor.isEmpty()) {
            log.warn("Dropping filter on unknown table {}", tableName);
            return Optional.empty();
        }
        return filterPruner.prune(filter, ancestor.get())
            .flatMap(pruned -> filterCompiler.compile(pruned, alias));
    }

    /**
     * {@code base_table.fk NOT IN (SELECT fk FROM child WHERE positive)}: a parent is
     * excluded as soon as one of its children matches the negated condition.
     */
    private Optional<String> parentExclusion(Filter.Not not, TableMetadata table, RelationshipGraph graph,
                                             MetricContext metric) {
        Optional<String> foreignKey = metric.firstForeignKey();
        if (foreignKey.isEmpty()) {
            return Optional.empty();
        }

        Optional<String> condition = filterPruner.prune(not.filter(), table)
            .flatMap(positive -> filterCompiler.compile(positive, null));
        if (condition.isEmpty()) {
            return Optional.empty();
        }

        String fk = escapeIdentifier(foreignKey.get());
        return Optional.of(AliasTable.BASE_ALIAS + "." + fk + " NOT IN (SELECT " + fk
            + " FROM " + graph.qualifiedStorageName(table) + " WHERE " + condition.get() + ")");
    }
}
