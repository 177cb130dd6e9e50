package com.biai.explorer.model.query;

import com.biai.explorer.exception.InvalidQueryException;
import com.biai.explorer.model.enums.MetricType;

/**
 * Counting configuration of an aggregation request.
 * {@code rows} counts rows; {@code parent} counts distinct rows of {@code targetTable}.
 */
public record CountBy(MetricType mode, String targetTable) {

    private static final CountBy ROWS = new CountBy(MetricType.ROWS, null);

    public static CountBy rows() {
        return ROWS;
    }

    public static CountBy parent(String targetTable) {
        return new CountBy(MetricType.PARENT, targetTable);
    }

    /**
     * Parse the {@code countBy} request parameter: {@code rows} or
     * {@code parent:<table_name>}. A missing parameter means row counting.
     */
    public static CountBy fromQueryParameter(String raw) {
        if (raw == null || raw.isBlank()) {
            return rows();
        }
        String trimmed = raw.trim();
        if (MetricType.ROWS.getValue().equalsIgnoreCase(trimmed)) {
            return rows();
        }

        String prefix = MetricType.PARENT.getValue() + ":";
        if (trimmed.regionMatches(true, 0, prefix, 0, prefix.length())) {
            String target = trimmed.substring(prefix.length()).trim();
            if (target.isEmpty()) {
                throw new InvalidQueryException("countBy target_table is required");
            }
            return parent(target);
        }

        throw new InvalidQueryException("Invalid countBy parameter: '" + trimmed + "'");
    }
}
