package com.biai.explorer.dto.response;

import com.biai.explorer.model.enums.MetricType;
import com.biai.explorer.model.query.MetricPathSegment;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.util.List;

/**
 * Statistics of one column under the current filters and counting mode.
 * {@code categories} is set for categorical-like columns, {@code numericStats} and
 * {@code histogram} for numeric ones. A column whose queries failed carries
 * {@code error} and no statistics.
 */
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ColumnAggregation(
    String columnName,
    String displayType,
    String normalizedDisplayType,
    Long totalRows,
    Long nullCount,
    Long uniqueCount,
    List<CategoryCount> categories,
    NumericStats numericStats,
    List<HistogramBin> histogram,
    MetricType metricType,
    String metricParentTable,
    String metricParentColumn,
    List<MetricPathSegment> metricPath,
    String error
) {}
