package com.biai.explorer.service;

import java.util.List;

/**
 * Read-only access to the analytics store.
 */
public interface AnalyticsQueryExecutor {

    /**
     * Run a SELECT and map every result row onto {@code rowType} by column name.
     *
     * @throws IllegalArgumentException if {@code sql} is not a read-only query
     */
    <T> List<T> query(String sql, Class<T> rowType);
}
