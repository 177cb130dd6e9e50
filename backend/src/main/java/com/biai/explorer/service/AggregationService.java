package com.biai.explorer.service;

import com.biai.explorer.config.AggregationProperties;
import com.biai.explorer.dto.response.CategoryCount;
import com.biai.explorer.dto.response.ColumnAggregation;
import com.biai.explorer.dto.response.HistogramBin;
import com.biai.explorer.dto.response.NumericStats;
import com.biai.explorer.dto.response.SurvivalCurvePoint;
import com.biai.explorer.model.enums.DisplayType;
import com.biai.explorer.model.enums.MetricType;
import com.biai.explorer.model.query.AliasTable;
import com.biai.explorer.model.query.ColumnMetadata;
import com.biai.explorer.model.query.CountBy;
import com.biai.explorer.model.query.Filter;
import com.biai.explorer.model.query.MetricContext;
import com.biai.explorer.model.query.TableMetadata;
import com.biai.explorer.service.query.AggregationSqlTemplateService;
import com.biai.explorer.service.query.AggregationSqlTemplateService.AggregationQuery;
import com.biai.explorer.service.query.AggregationSqlTemplateService.BasicStatsRow;
import com.biai.explorer.service.query.AggregationSqlTemplateService.CountRow;
import com.biai.explorer.service.query.AggregationSqlTemplateService.HistogramRow;
import com.biai.explorer.service.query.AggregationSqlTemplateService.MinMaxRow;
import com.biai.explorer.service.query.AggregationSqlTemplateService.SurvivalRow;
import com.biai.explorer.service.query.KaplanMeierEstimator;
import com.biai.explorer.service.query.MetricContextResolver;
import com.biai.explorer.service.query.RelationshipGraph;
import com.biai.explorer.service.query.WhereClauseBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

import static com.biai.explorer.service.query.SqlSanitizer.ensureFiniteNumber;
import static com.biai.explorer.service.query.SqlSanitizer.ensurePositiveInteger;
import static com.biai.explorer.service.query.SqlSanitizer.escapeIdentifier;
import static com.biai.explorer.service.query.SqlSanitizer.validateIdentifier;

/**
 * Aggregation Service
 *
 * Computes explorer statistics for the columns of a dataset table under a filter
 * tree and a counting mode. Shared setup (table metadata, relationship graph,
 * metric context, WHERE clause, filtered total) is done once per request; the
 * columns of a table are then aggregated concurrently.
 */
@Slf4j
@Service
public class AggregationService {

    private final DatasetMetadataProvider metadataProvider;
    private final AnalyticsQueryExecutor queryExecutor;
    private final MetricContextResolver metricContextResolver;
    private final WhereClauseBuilder whereClauseBuilder;
    private final AggregationSqlTemplateService sqlTemplates;
    private final AggregationProperties properties;
    private final Executor aggregationExecutor;

    public AggregationService(
            DatasetMetadataProvider metadataProvider,
            AnalyticsQueryExecutor queryExecutor,
            MetricContextResolver metricContextResolver,
            WhereClauseBuilder whereClauseBuilder,
            AggregationSqlTemplateService sqlTemplates,
            AggregationProperties properties,
            @Qualifier("aggregationExecutor") Executor aggregationExecutor) {
        this.metadataProvider = metadataProvider;
        this.queryExecutor = queryExecutor;
        this.metricContextResolver = metricContextResolver;
        this.whereClauseBuilder = whereClauseBuilder;
        this.sqlTemplates = sqlTemplates;
        this.properties = properties;
        this.aggregationExecutor = aggregationExecutor;
    }

    // ========================================================================
    // Public API
    // ========================================================================

    /**
     * Statistics of one column.
     *
     * @param displayType display type to aggregate as; when {@code null} the
     *                    column's stored display type is used
     */
    public ColumnAggregation getColumnAggregation(String datasetId, String tableId, String column,
                                                  String displayType, Filter filters, CountBy countBy) {
        AggregationScope scope = prepare(datasetId, tableId, filters, countBy, true);
        String effectiveDisplayType = displayType != null && !displayType.isBlank()
            ? displayType
            : storedDisplayType(datasetId, tableId, column);
        return aggregateColumn(scope, column, effectiveDisplayType);
    }

    /**
     * Statistics of every visible column, in catalog order. A column whose queries
     * fail is returned with an {@code error} and no statistics; the other columns
     * are unaffected.
     */
    public List<ColumnAggregation> getTableAggregations(String datasetId, String tableId, Filter filters,
                                                        CountBy countBy) {
        AggregationScope scope = prepare(datasetId, tableId, filters, countBy, true);
        List<ColumnMetadata> columns = metadataProvider.visibleColumns(datasetId, tableId);
        log.info("Aggregating {} columns of table {} (metric: {})",
            columns.size(), scope.table().tableName(), scope.metric().type().getValue());

        List<CompletableFuture<ColumnAggregation>> futures = columns.stream()
            .map(column -> submitColumn(scope, column))
            .collect(Collectors.toList());

        List<ColumnAggregation> aggregations = futures.stream()
            .map(CompletableFuture::join)
            .collect(Collectors.toList());

        long failed = aggregations.stream().filter(a -> a.error() != null).count();
        log.info("Aggregated table {}: {} columns, {} failed", scope.table().tableName(), aggregations.size(), failed);
        return aggregations;
    }

    /**
     * Kaplan-Meier curve from a time column and an event status column.
     */
    public List<SurvivalCurvePoint> getSurvivalCurve(String datasetId, String tableId, String timeColumn,
                                                     String statusColumn, Filter filters, CountBy countBy) {
        AggregationScope scope = prepare(datasetId, tableId, filters, countBy, false);
        String time = columnRef(scope, timeColumn);
        String status = columnRef(scope, statusColumn);

        List<SurvivalRow> rows = queryExecutor.query(
            sqlTemplates.survivalQuery(scope.query(), time, status), SurvivalRow.class);

        List<KaplanMeierEstimator.TimeGroup> groups = rows.stream()
            .map(row -> new KaplanMeierEstimator.TimeGroup(row.timeVal(), row.events(), row.censored()))
            .collect(Collectors.toList());
        return KaplanMeierEstimator.estimate(groups);
    }

    // ========================================================================
    // Shared setup
    // ========================================================================

    private AggregationScope prepare(String datasetId, String tableId, Filter filters, CountBy countBy,
                                     boolean withTotal) {
        TableMetadata table = metadataProvider.findTable(datasetId, tableId);

        boolean parentCounting = countBy != null && countBy.mode() == MetricType.PARENT;
        Collection<TableMetadata> tables = filters != null || parentCounting
            ? metadataProvider.loadTables(datasetId)
            : List.of(table);
        RelationshipGraph graph = new RelationshipGraph(tables, properties.getDefaultDatabase());

        MetricContext metric = metricContextResolver.resolve(table.tableName(), countBy, graph);
        String where = whereClauseBuilder.build(filters, table, graph, metric);
        String from = metric.fromClause(graph.qualifiedStorageName(table));
        AggregationQuery query = new AggregationQuery(from, where, metric);

        long total = table.rowCount();
        if (withTotal && (metric.isParent() || !where.isEmpty())) {
            total = first(queryExecutor.query(sqlTemplates.filteredCountQuery(query), CountRow.class))
                .map(CountRow::filteredCount)
                .orElse(0L);
        }
        return new AggregationScope(table, query, total);
    }

    private String storedDisplayType(String datasetId, String tableId, String column) {
        return metadataProvider.visibleColumns(datasetId, tableId).stream()
            .filter(c -> c.columnName().equals(column))
            .map(ColumnMetadata::displayType)
            .findFirst()
            .orElse(DisplayType.CATEGORICAL.getValue());
    }

    // ========================================================================
    // Column statistics
    // ========================================================================

    /**
     * Schedules one column on the fan-out pool. A saturated pool runs the column on
     * the request thread instead.
     */
    private CompletableFuture<ColumnAggregation> submitColumn(AggregationScope scope, ColumnMetadata column) {
        try {
            return CompletableFuture.supplyAsync(() -> aggregateColumnIsolated(scope, column), aggregationExecutor);
        } catch (RejectedExecutionException e) {
            log.debug("Aggregation pool saturated, aggregating column {} inline", column.columnName());
            return CompletableFuture.completedFuture(aggregateColumnIsolated(scope, column));
        }
    }

    private ColumnAggregation aggregateColumnIsolated(AggregationScope scope, ColumnMetadata column) {
        try {
            return aggregateColumn(scope, column.columnName(), column.displayType());
        } catch (RuntimeException e) {
            log.warn("Aggregation failed for column {}.{}: {}",
                scope.table().tableName(), column.columnName(), e.getMessage());
            return baseAggregation(scope, column.columnName(), column.displayType())
                .error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                .build();
        }
    }

    private ColumnAggregation aggregateColumn(AggregationScope scope, String column, String displayType) {
        String col = columnRef(scope, column);
        Optional<DisplayType> normalized = DisplayType.lookup(displayType).map(DisplayType::normalized);

        BasicStatsRow basicStats = first(queryExecutor.query(
            sqlTemplates.basicStatsQuery(scope.query(), col), BasicStatsRow.class))
            .orElse(new BasicStatsRow(0L, 0L));

        ColumnAggregation.ColumnAggregationBuilder aggregation = baseAggregation(scope, column.trim(), displayType)
            .normalizedDisplayType(normalized.map(DisplayType::getValue).orElse(displayType))
            .totalRows(scope.total())
            .nullCount(valueOrZero(basicStats.nullCount()))
            .uniqueCount(valueOrZero(basicStats.uniqueCount()));

        if (normalized.isPresent() && normalized.get().hasCategories()) {
            int limit = normalized.get() == DisplayType.GEOGRAPHIC
                ? properties.getGeographicCategoryLimit()
                : properties.getCategoryLimit();
            aggregation.categories(categories(scope, col, limit));
        } else if (normalized.isPresent() && normalized.get() == DisplayType.NUMERIC) {
            aggregation.numericStats(numericStats(scope, col));
            aggregation.histogram(histogram(scope, col));
        }

        return aggregation.build();
    }

    private ColumnAggregation.ColumnAggregationBuilder baseAggregation(AggregationScope scope, String column,
                                                                       String displayType) {
        MetricContext metric = scope.metric();
        return ColumnAggregation.builder()
            .columnName(column)
            .displayType(displayType)
            .metricType(metric.type())
            .metricParentTable(metric.parentTable())
            .metricParentColumn(metric.parentColumn())
            .metricPath(metric.isParent() ? metric.pathSegments() : null);
    }

    private List<CategoryCount> categories(AggregationScope scope, String col, int configuredLimit) {
        int limit = ensurePositiveInteger(configuredLimit, "category limit");
        return queryExecutor.query(
            sqlTemplates.categoriesQuery(scope.query(), col, scope.total(), limit), CategoryCount.class);
    }

    private NumericStats numericStats(AggregationScope scope, String col) {
        return first(queryExecutor.query(sqlTemplates.numericStatsQuery(scope.query(), col), NumericStats.class))
            .orElse(null);
    }

    /**
     * Equal-width histogram over the observed range. When every value is the same
     * there is a single bin holding the whole total.
     */
    private List<HistogramBin> histogram(AggregationScope scope, String col) {
        Optional<MinMaxRow> range = first(queryExecutor.query(
            sqlTemplates.minMaxQuery(scope.query(), col), MinMaxRow.class));
        if (range.isEmpty() || range.get().minVal() == null || range.get().maxVal() == null) {
            return List.of();
        }

        double minValue = range.get().minVal();
        double maxValue = range.get().maxVal();
        if (minValue == maxValue) {
            return List.of(new HistogramBin(minValue, maxValue, scope.total(), 100.0));
        }

        int bins = ensurePositiveInteger(properties.getHistogramBins(), "histogram bin count");
        if (bins == 0) {
            return List.of();
        }

        BigDecimal min = ensureFiniteNumber(minValue, "histogram");
        BigDecimal max = ensureFiniteNumber(maxValue, "histogram");
        BigDecimal binWidth = max.subtract(min).divide(BigDecimal.valueOf(bins), MathContext.DECIMAL64);

        List<HistogramRow> rows = queryExecutor.query(
            sqlTemplates.histogramQuery(scope.query(), col, min, binWidth, bins), HistogramRow.class);

        List<HistogramBin> histogram = new ArrayList<>(rows.size());
        for (HistogramRow row : rows) {
            long index = row.binIndex();
            double start = min.add(binWidth.multiply(BigDecimal.valueOf(index))).doubleValue();
            double end = index >= bins - 1
                ? maxValue
                : min.add(binWidth.multiply(BigDecimal.valueOf(index + 1))).doubleValue();
            histogram.add(new HistogramBin(start, end, row.count(), percentage(row.count(), scope.total())));
        }
        return histogram;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private String columnRef(AggregationScope scope, String column) {
        String name = validateIdentifier(column, scope.table().columns(), "column");
        return AliasTable.BASE_ALIAS + "." + escapeIdentifier(name);
    }

    private static double percentage(long count, long total) {
        return total > 0 ? count * 100.0 / total : 0.0;
    }

    private static long valueOrZero(Long value) {
        return value == null ? 0L : value;
    }

    private static <T> Optional<T> first(List<T> rows) {
        return rows == null || rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    private record AggregationScope(TableMetadata table, AggregationQuery query, long total) {

        MetricContext metric() {
            return query.metric();
        }
    }
}
