package com.biai.explorer.service.query;

import com.biai.explorer.model.enums.EdgeDirection;
import com.biai.explorer.model.query.PathStep;
import com.biai.explorer.model.query.Relationship;
import com.biai.explorer.model.query.TableMetadata;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory relationship graph of one dataset, built once per request.
 *
 * Every declared relationship is a forward edge from the owning table to the
 * referenced table, and a backward edge from the referenced table to the owner.
 * The graph may hold parallel edges and cycles.
 */
public class RelationshipGraph {

    private final String defaultDatabase;
    private final Map<String, TableMetadata> tables = new LinkedHashMap<>();
    private final Map<String, List<PathStep>> outgoing = new LinkedHashMap<>();
    private final Map<String, List<PathStep>> incoming = new LinkedHashMap<>();

    public RelationshipGraph(Collection<TableMetadata> allTables, String defaultDatabase) {
        this.defaultDatabase = defaultDatabase;
        for (TableMetadata table : allTables) {
            tables.putIfAbsent(table.tableName(), table);
        }

        for (TableMetadata table : allTables) {
            for (Relationship rel : table.relationships()) {
                outgoing.computeIfAbsent(table.tableName(), k -> new ArrayList<>())
                    .add(new PathStep(table.tableName(), rel.referencedTable(),
                        rel.foreignKey(), rel.referencedColumn(), EdgeDirection.FORWARD));

                // A table referencing itself is reachable through its forward edge only
                if (!table.tableName().equals(rel.referencedTable())) {
                    incoming.computeIfAbsent(rel.referencedTable(), k -> new ArrayList<>())
                        .add(new PathStep(rel.referencedTable(), table.tableName(),
                            rel.foreignKey(), rel.referencedColumn(), EdgeDirection.BACKWARD));
                }
            }
        }
    }

    public Optional<TableMetadata> table(String tableName) {
        return Optional.ofNullable(tables.get(tableName));
    }

    /**
     * Escaped, database-qualified storage name of a table.
     */
    public String qualifiedStorageName(TableMetadata table) {
        return SqlSanitizer.qualifyStorageName(table.storageName(), defaultDatabase);
    }

    /**
     * Shortest relationship path (fewest hops) between two tables.
     *
     * Breadth-first from {@code fromTable}; at each table the forward edges are
     * expanded before the backward ones, and a table is never enqueued twice.
     *
     * @return the hops from {@code fromTable} to {@code toTable}, or empty when the
     *         tables are the same or not connected
     */
    public Optional<List<PathStep>> findPath(String fromTable, String toTable) {
        if (fromTable == null || toTable == null || fromTable.equals(toTable)) {
            return Optional.empty();
        }

        Deque<Visit> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        queue.add(new Visit(fromTable, List.of()));
        visited.add(fromTable);

        while (!queue.isEmpty()) {
            Visit current = queue.poll();
            if (!tables.containsKey(current.table())) {
                continue;
            }

            for (PathStep edge : edgesFrom(current.table())) {
                String next = edge.to();
                if (visited.contains(next)) {
                    continue;
                }

                List<PathStep> path = new ArrayList<>(current.path());
                path.add(edge);

                if (next.equals(toTable)) {
                    return Optional.of(List.copyOf(path));
                }

                visited.add(next);
                queue.add(new Visit(next, path));
            }
        }

        return Optional.empty();
    }

    private List<PathStep> edgesFrom(String table) {
        List<PathStep> edges = new ArrayList<>(outgoing.getOrDefault(table, List.of()));
        edges.addAll(incoming.getOrDefault(table, List.of()));
        return edges;
    }

    private record Visit(String table, List<PathStep> path) {}
}
