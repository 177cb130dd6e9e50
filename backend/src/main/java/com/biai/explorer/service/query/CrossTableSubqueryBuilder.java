package com.biai.explorer.service.query;

import com.biai.explorer.model.query.AliasTable;
import com.biai.explorer.model.query.Filter;
import com.biai.explorer.model.query.PathStep;
import com.biai.explorer.model.query.TableMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

import static com.biai.explorer.service.query.SqlSanitizer.escapeIdentifier;

/**
 * Cross-Table Subquery Builder
 *
 * Turns a filter on another table into a membership condition on the aggregated
 * table, nesting one {@code IN (SELECT ...)} per hop of the shortest relationship
 * path. A filter that cannot be placed (unknown table, no path, nothing left after
 * column checks) is dropped with a warning.
 *
 * <pre>
 * base_table.`patient_id` IN (
 *     SELECT `patient_id` FROM `biai`.`patients` WHERE `sex` = 'F')
 * </pre>
 */
@Slf4j
@Component
public class CrossTableSubqueryBuilder {

    private final FilterCompiler filterCompiler;
    private final FilterPruner filterPruner;

    public CrossTableSubqueryBuilder(FilterCompiler filterCompiler, FilterPruner filterPruner) {
        this.filterCompiler = filterCompiler;
        this.filterPruner = filterPruner;
    }

    /**
     * @param currentTable logical name of the aggregated table
     * @param filter filter whose target table differs from {@code currentTable};
     *               a top-level NOT turns the membership into an exclusion
     */
    public Optional<String> build(String currentTable, Filter filter, RelationshipGraph graph) {
        boolean negated = filter instanceof Filter.Not;
        Filter positive = negated ? ((Filter.Not) filter).filter() : filter;
        if (positive == null) {
            return Optional.empty();
        }

        String targetTable = filter.targetTable();
        if (targetTable == null || targetTable.equals(currentTable)) {
            return Optional.empty();
        }

        Optional<TableMetadata> target = graph.table(targetTable);
        if (target.isEmpty()) {
            log.warn("Dropping filter on unknown table {}", targetTable);
            return Optional.empty();
        }

        Optional<List<PathStep>> path = graph.findPath(currentTable, targetTable);
        if (path.isEmpty()) {
            log.warn("Dropping filter on {}: no relationship path from {}", targetTable, currentTable);
            return Optional.empty();
        }

        Optional<String> condition = filterPruner.prune(positive, target.get())
            .flatMap(pruned -> filterCompiler.compile(pruned, null));
        if (condition.isEmpty()) {
            return Optional.empty();
        }

        List<PathStep> steps = path.get();
        String subquery = nest(steps, condition.get(), graph);

        String linkColumn = AliasTable.BASE_ALIAS + "." + escapeIdentifier(steps.get(0).fromColumn());
        if (negated) {
            return Optional.of("(" + linkColumn + " NOT IN (" + subquery + ") OR " + linkColumn + " IS NULL)");
        }
        return Optional.of(linkColumn + " IN (" + subquery + ")");
    }

    /**
     * Build the subquery chain from the filter's table back to the first hop.
     */
    private String nest(List<PathStep> steps, String condition, RelationshipGraph graph) {
        PathStep last = steps.get(steps.size() - 1);
        String subquery = "SELECT " + escapeIdentifier(last.toColumn())
            + " FROM " + storageName(last.to(), graph)
            + " WHERE " + condition;

        for (int i = steps.size() - 2; i >= 0; i--) {
            PathStep step = steps.get(i);
            PathStep next = steps.get(i + 1);
            subquery = "SELECT " + escapeIdentifier(step.toColumn())
                + " FROM " + storageName(step.to(), graph)
                + " WHERE " + escapeIdentifier(next.fromColumn()) + " IN (" + subquery + ")";
        }
        return subquery;
    }

    private String storageName(String tableName, RelationshipGraph graph) {
        TableMetadata table = graph.table(tableName)
            .orElseThrow(() -> new IllegalStateException("Path references unknown table " + tableName));
        return graph.qualifiedStorageName(table);
    }
}
