package com.biai.explorer.service.query;

import com.biai.explorer.model.query.MetricContext;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import static com.biai.explorer.service.query.SqlSanitizer.numericLiteral;

/**
 * Aggregation SQL Template Service
 *
 * ClickHouse statements behind the column statistics and survival curves. Every
 * template takes an {@link AggregationQuery}: the FROM body (aggregated table plus
 * ancestor joins), the WHERE suffix ({@code ""} or {@code AND (...)}) and the metric
 * context whose aggregate is used for every count.
 *
 * Column references passed in must already be alias-qualified and escaped.
 */
@Service
public class AggregationSqlTemplateService {

    static final List<String> EVENT_TOKENS = List.of(
        "1", "true", "t", "yes", "y", "dead", "deceased", "death", "died", "event", "progressed", "progression",
        "relapse");

    static final List<String> CENSOR_TOKENS = List.of(
        "0", "false", "f", "no", "n", "alive", "living", "censored", "censor", "none", "ongoing");

    // ========================================================================
    // Totals
    // ========================================================================

    public String filteredCountQuery(AggregationQuery query) {
        return String.format("""
            SELECT %s AS filtered_count
            FROM %s
            WHERE 1=1 %s""", query.metric().aggregate(), query.from(), query.where());
    }

    public String basicStatsQuery(AggregationQuery query, String column) {
        return String.format("""
            SELECT
              %s AS null_count,
              uniq(%s) AS unique_count
            FROM %s
            WHERE 1=1 %s""",
            query.metric().aggregate("isNull(" + column + ")"), column, query.from(), query.where());
    }

    // ========================================================================
    // Categorical
    // ========================================================================

    /**
     * Buckets values after trimming; null and blank share the empty bucket and
     * {@code n/a} in any case is one bucket.
     */
    public String categoriesQuery(AggregationQuery query, String column, long total, int limit) {
        String trimmed = "trimBoth(toString(" + column + "))";
        String isEmpty = "isNull(" + column + ") OR lengthUTF8(" + trimmed + ") = 0";
        String isNotAvailable = "lowerUTF8(" + trimmed + ") = 'n/a'";
        String aggregate = query.metric().aggregate();

        return String.format("""
            SELECT
              multiIf(
                %2$s, '',
                %3$s, 'N/A',
                %1$s
              ) AS value,
              multiIf(
                %2$s, '(Empty)',
                %3$s, '(N/A)',
                %1$s
              ) AS display_value,
              %4$s AS count,
              if(%5$d = 0, 0, %4$s * 100.0 / %5$d) AS percentage
            FROM %6$s
            WHERE 1=1
              %7$s
            GROUP BY value, display_value
            ORDER BY count DESC
            LIMIT %8$d""",
            trimmed, isEmpty, isNotAvailable, aggregate, total, query.from(), query.where(), limit);
    }

    // ========================================================================
    // Numeric
    // ========================================================================

    public String numericStatsQuery(AggregationQuery query, String column) {
        return String.format("""
            SELECT
              min(%1$s) AS min,
              max(%1$s) AS max,
              avg(%1$s) AS mean,
              median(%1$s) AS median,
              stddevPop(%1$s) AS stddev,
              quantile(0.25)(%1$s) AS q25,
              quantile(0.75)(%1$s) AS q75
            FROM %2$s
            WHERE %1$s IS NOT NULL
              %3$s""", column, query.from(), query.where());
    }

    public String minMaxQuery(AggregationQuery query, String column) {
        return String.format("""
            SELECT
              min(%1$s) AS min_val,
              max(%1$s) AS max_val
            FROM %2$s
            WHERE %1$s IS NOT NULL
              %3$s""", column, query.from(), query.where());
    }

    /**
     * Equal-width bins over [min, max]. The maximum value lands in the last bin
     * instead of opening a bin of its own.
     */
    public String histogramQuery(AggregationQuery query, String column, BigDecimal min, BigDecimal binWidth,
                                 int bins) {
        String binIndex = String.format("least(toInt64(floor((%s - %s) / %s)), %d)",
            column, numericLiteral(min), numericLiteral(binWidth), bins - 1);

        return String.format("""
            SELECT
              %s AS bin_index,
              %s AS count
            FROM %s
            WHERE %s IS NOT NULL
              %s
            GROUP BY bin_index
            ORDER BY bin_index""", binIndex, query.metric().aggregate(), query.from(), column, query.where());
    }

    // ========================================================================
    // Survival
    // ========================================================================

    /**
     * Events and censorings per distinct time. A status of integer 0 or 1 is the
     * event flag itself, anything else is classified by keywords; rows with an
     * unclassifiable status or without a time are left out.
     */
    public String survivalQuery(AggregationQuery query, String timeColumn, String statusColumn) {
        String time = "toFloat64(" + timeColumn + ")";
        String event = eventFlagExpression(statusColumn);

        return String.format("""
            SELECT
              time_val,
              sum(event_flag) AS events,
              count() - sum(event_flag) AS censored
            FROM (
              SELECT
                %1$s AS time_val,
                %2$s AS event_flag
              FROM %3$s
              WHERE 1=1 %4$s
                AND %1$s IS NOT NULL
                AND %2$s IS NOT NULL
            )
            GROUP BY time_val
            ORDER BY time_val""", time, event, query.from(), query.where());
    }

    String eventFlagExpression(String statusColumn) {
        String numeric = "toInt64OrNull(toString(" + statusColumn + "))";
        String status = "lowerUTF8(trimBoth(toString(" + statusColumn + ")))";

        return String.format("""
            multiIf(
                  %1$s IN (0, 1), %1$s,
                  %2$s IN (%3$s), 1,
                  startsWith(%2$s, '1') OR startsWith(%2$s, 'event') OR position(%2$s, 'deceased') > 0 \
            OR position(%2$s, 'death') > 0 OR position(%2$s, 'dead') > 0, 1,
                  %2$s IN (%4$s), 0,
                  startsWith(%2$s, '0') OR position(%2$s, 'alive') > 0 OR position(%2$s, 'living') > 0 \
            OR position(%2$s, 'censor') > 0, 0,
                  NULL
                )""", numeric, status, tokenList(EVENT_TOKENS), tokenList(CENSOR_TOKENS));
    }

    private static String tokenList(List<String> tokens) {
        return tokens.stream().map(SqlSanitizer::quoteString).collect(Collectors.joining(","));
    }

    // ========================================================================
    // Query inputs and result rows
    // ========================================================================

    public record AggregationQuery(String from, String where, MetricContext metric) {}

    public record CountRow(@JsonProperty("filtered_count") Long filteredCount) {}

    public record BasicStatsRow(
        @JsonProperty("null_count") Long nullCount,
        @JsonProperty("unique_count") Long uniqueCount
    ) {}

    public record MinMaxRow(
        @JsonProperty("min_val") Double minVal,
        @JsonProperty("max_val") Double maxVal
    ) {}

    public record HistogramRow(
        @JsonProperty("bin_index") long binIndex,
        long count
    ) {}

    public record SurvivalRow(
        @JsonProperty("time_val") double timeVal,
        long events,
        long censored
    ) {}
}
