package com.biai.explorer.service.query;

import com.biai.explorer.exception.InvalidQueryException;
import com.biai.explorer.exception.RelationshipResolutionException;
import com.biai.explorer.model.enums.EdgeDirection;
import com.biai.explorer.model.enums.MetricType;
import com.biai.explorer.model.query.AliasTable;
import com.biai.explorer.model.query.CountBy;
import com.biai.explorer.model.query.MetricContext;
import com.biai.explorer.model.query.MetricJoin;
import com.biai.explorer.model.query.MetricPathSegment;
import com.biai.explorer.model.query.PathStep;
import com.biai.explorer.model.query.TableMetadata;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.biai.explorer.service.query.SqlSanitizer.escapeIdentifier;

/**
 * Resolves the counting semantics of a request.
 *
 * Parent counting walks the shortest path from the aggregated table to the target
 * table and left-joins every hop. Only forward hops (towards tables the current
 * table references) are accepted, so each aggregated row has at most one ancestor.
 */
@Component
public class MetricContextResolver {

    public MetricContext resolve(String baseTable, CountBy countBy, RelationshipGraph graph) {
        if (countBy == null || countBy.mode() != MetricType.PARENT) {
            return MetricContext.rows(baseTable);
        }

        String targetTable = countBy.targetTable();
        if (targetTable == null || targetTable.isBlank()) {
            throw new InvalidQueryException("countBy target_table is required");
        }
        List<PathStep> path = graph.findPath(baseTable, targetTable)
            .orElseThrow(() -> new RelationshipResolutionException(
                "No relationship from " + baseTable + " to " + targetTable));

        for (PathStep step : path) {
            if (step.direction() != EdgeDirection.FORWARD) {
                throw new RelationshipResolutionException("countBy supports only parent (forward) relationships");
            }
        }

        AliasTable aliases = new AliasTable(baseTable);
        List<MetricJoin> joins = new ArrayList<>();
        List<MetricPathSegment> segments = new ArrayList<>();
        String fromAlias = AliasTable.BASE_ALIAS;

        for (PathStep step : path) {
            TableMetadata table = graph.table(step.to())
                .orElseThrow(() -> new RelationshipResolutionException("Unknown table in countBy path: " + step.to()));
            String joinAlias = aliases.register(step.to());
            String onCondition = fromAlias + "." + escapeIdentifier(step.foreignKey())
                + " = " + joinAlias + "." + escapeIdentifier(step.referencedColumn());

            joins.add(new MetricJoin(joinAlias, graph.qualifiedStorageName(table), step.foreignKey(), onCondition));
            segments.add(new MetricPathSegment(step.from(), step.foreignKey(), step.to(), step.referencedColumn()));
            fromAlias = joinAlias;
        }

        PathStep last = path.get(path.size() - 1);
        String ancestorExpression = fromAlias + "." + escapeIdentifier(last.referencedColumn());

        return new MetricContext(MetricType.PARENT, targetTable, last.referencedColumn(), joins, segments, aliases,
            ancestorExpression);
    }
}
