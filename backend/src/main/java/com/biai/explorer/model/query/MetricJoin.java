package com.biai.explorer.model.query;

/**
 * Left join to an ancestor table used by parent counting.
 *
 * @param alias SQL alias of the joined table ({@code ancestor_N})
 * @param table escaped, qualified storage name
 * @param foreignKey column on the joining side of the hop
 * @param onCondition join condition
 */
public record MetricJoin(String alias, String table, String foreignKey, String onCondition) {}
