package com.biai.explorer.model.query;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SQL aliases of one aggregation query: the aggregated table is always
 * {@code base_table}, joined ancestors are {@code ancestor_0}, {@code ancestor_1}, ...
 * in join order. A table can hold at most one alias.
 */
public class AliasTable {

    public static final String BASE_ALIAS = "base_table";
    private static final String ANCESTOR_PREFIX = "ancestor_";

    private final String baseTable;
    private final List<String> ancestors = new ArrayList<>();
    private final Map<String, Integer> indexByTable = new HashMap<>();

    public AliasTable(String baseTable) {
        this.baseTable = baseTable;
    }

    /**
     * Assign the next ancestor alias to {@code table}.
     *
     * @throws IllegalStateException if the table already has an alias
     */
    public String register(String table) {
        if (table.equals(baseTable) || indexByTable.containsKey(table)) {
            throw new IllegalStateException("Alias already assigned for table " + table);
        }
        int index = ancestors.size();
        ancestors.add(table);
        indexByTable.put(table, index);
        return ancestorAlias(index);
    }

    public Optional<String> aliasFor(String table) {
        if (table == null) {
            return Optional.empty();
        }
        if (table.equals(baseTable)) {
            return Optional.of(BASE_ALIAS);
        }
        Integer index = indexByTable.get(table);
        return index == null ? Optional.empty() : Optional.of(ancestorAlias(index));
    }

    /**
     * Table name to alias, base table first, ancestors in join order.
     */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(baseTable, BASE_ALIAS);
        for (int i = 0; i < ancestors.size(); i++) {
            map.put(ancestors.get(i), ancestorAlias(i));
        }
        return map;
    }

    public static String ancestorAlias(int index) {
        return ANCESTOR_PREFIX + index;
    }
}
