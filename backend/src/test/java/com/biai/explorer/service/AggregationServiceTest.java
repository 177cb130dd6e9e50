package com.biai.explorer.service;

import com.biai.explorer.config.AggregationProperties;
import com.biai.explorer.dto.response.CategoryCount;
import com.biai.explorer.dto.response.ColumnAggregation;
import com.biai.explorer.dto.response.HistogramBin;
import com.biai.explorer.dto.response.NumericStats;
import com.biai.explorer.dto.response.SurvivalCurvePoint;
import com.biai.explorer.exception.InvalidIdentifierException;
import com.biai.explorer.model.enums.FilterOperator;
import com.biai.explorer.model.enums.MetricType;
import com.biai.explorer.model.query.ColumnMetadata;
import com.biai.explorer.model.query.CountBy;
import com.biai.explorer.model.query.Filter;
import com.biai.explorer.model.query.FilterValue;
import com.biai.explorer.model.query.MetricPathSegment;
import com.biai.explorer.service.query.AggregationSqlTemplateService;
import com.biai.explorer.service.query.AggregationSqlTemplateService.BasicStatsRow;
import com.biai.explorer.service.query.AggregationSqlTemplateService.CountRow;
import com.biai.explorer.service.query.AggregationSqlTemplateService.HistogramRow;
import com.biai.explorer.service.query.AggregationSqlTemplateService.MinMaxRow;
import com.biai.explorer.service.query.AggregationSqlTemplateService.SurvivalRow;
import com.biai.explorer.service.query.CrossTableSubqueryBuilder;
import com.biai.explorer.service.query.FilterCompiler;
import com.biai.explorer.service.query.FilterPruner;
import com.biai.explorer.service.query.MetricContextResolver;
import com.biai.explorer.service.query.QueryFixtures;
import com.biai.explorer.service.query.WhereClauseBuilder;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AggregationServiceTest {

    private DatasetMetadataProvider metadataProvider;
    private AnalyticsQueryExecutor queryExecutor;
    private AggregationService service;

    @BeforeEach
    void setUp() {
        metadataProvider = mock(DatasetMetadataProvider.class);
        queryExecutor = mock(AnalyticsQueryExecutor.class);

        FilterCompiler compiler = new FilterCompiler();
        FilterPruner pruner = new FilterPruner();
        WhereClauseBuilder whereClauseBuilder =
            new WhereClauseBuilder(compiler, pruner, new CrossTableSubqueryBuilder(compiler, pruner));

        service = new AggregationService(
            metadataProvider,
            queryExecutor,
            new MetricContextResolver(),
            whereClauseBuilder,
            new AggregationSqlTemplateService(),
            new AggregationProperties(),
            Runnable::run);

        when(metadataProvider.findTable("ds", "t_patients")).thenReturn(QueryFixtures.PATIENTS);
        when(metadataProvider.findTable("ds", "t_samples")).thenReturn(QueryFixtures.SAMPLES);
        when(metadataProvider.loadTables("ds")).thenReturn(
            List.of(QueryFixtures.PATIENTS, QueryFixtures.SAMPLES, QueryFixtures.MUTATIONS));
        when(queryExecutor.query(anyString(), eq(BasicStatsRow.class)))
            .thenReturn(List.of(new BasicStatsRow(2L, 40L)));
    }

    @Test
    void numericColumnGetsStatsAndHistogram() {
        NumericStats stats = new NumericStats(20.0, 80.0, 51.2, 50.0, 12.1, 41.0, 63.0);
        when(queryExecutor.query(anyString(), eq(NumericStats.class))).thenReturn(List.of(stats));
        when(queryExecutor.query(anyString(), eq(MinMaxRow.class))).thenReturn(List.of(new MinMaxRow(20.0, 80.0)));
        when(queryExecutor.query(anyString(), eq(HistogramRow.class)))
            .thenReturn(List.of(new HistogramRow(0, 10), new HistogramRow(19, 5)));

        ColumnAggregation aggregation =
            service.getColumnAggregation("ds", "t_patients", "age", "survival_time", null, CountBy.rows());

        assertThat(aggregation.displayType()).isEqualTo("survival_time");
        assertThat(aggregation.normalizedDisplayType()).isEqualTo("numeric");
        assertThat(aggregation.totalRows()).isEqualTo(100L);
        assertThat(aggregation.nullCount()).isEqualTo(2L);
        assertThat(aggregation.uniqueCount()).isEqualTo(40L);
        assertThat(aggregation.numericStats()).isEqualTo(stats);
        assertThat(aggregation.categories()).isNull();
        assertThat(aggregation.metricType()).isEqualTo(MetricType.ROWS);

        List<HistogramBin> histogram = aggregation.histogram();
        assertThat(histogram).hasSize(2);
        assertThat(histogram.get(0).binStart()).isCloseTo(20.0, within(1e-9));
        assertThat(histogram.get(0).binEnd()).isCloseTo(23.0, within(1e-9));
        assertThat(histogram.get(0).percentage()).isCloseTo(10.0, within(1e-9));
        assertThat(histogram.get(1).binStart()).isCloseTo(77.0, within(1e-9));
        assertThat(histogram.get(1).binEnd()).isEqualTo(80.0);

        verify(queryExecutor).query(
            argThat(sql -> sql.contains("least(toInt64(floor((base_table.`age` - 20) / 3)), 19)")),
            eq(HistogramRow.class));
        verify(queryExecutor, never()).query(anyString(), eq(CountRow.class));
        verify(metadataProvider, never()).loadTables(anyString());
    }

    @Test
    void identicalValuesGiveSingleFullBin() {
        when(queryExecutor.query(anyString(), eq(NumericStats.class)))
            .thenReturn(List.of(new NumericStats(5.0, 5.0, 5.0, 5.0, 0.0, 5.0, 5.0)));
        when(queryExecutor.query(anyString(), eq(MinMaxRow.class))).thenReturn(List.of(new MinMaxRow(5.0, 5.0)));

        ColumnAggregation aggregation =
            service.getColumnAggregation("ds", "t_patients", "age", "numeric", null, CountBy.rows());

        assertThat(aggregation.histogram()).containsExactly(new HistogramBin(5.0, 5.0, 100L, 100.0));
        verify(queryExecutor, never()).query(anyString(), eq(HistogramRow.class));
    }

    @Test
    void filteredCategoricalColumnUsesFilteredTotal() {
        when(queryExecutor.query(anyString(), eq(CountRow.class))).thenReturn(List.of(new CountRow(42L)));
        List<CategoryCount> categories = List.of(
            new CategoryCount("F", "F", 30L, 71.4),
            new CategoryCount("", "(Empty)", 12L, 28.6));
        when(queryExecutor.query(anyString(), eq(CategoryCount.class))).thenReturn(categories);

        Filter filter = new Filter.Condition("age", FilterOperator.GT, FilterValue.of(40), null, null, null);
        ColumnAggregation aggregation =
            service.getColumnAggregation("ds", "t_patients", "sex", "categorical", filter, null);

        assertThat(aggregation.totalRows()).isEqualTo(42L);
        assertThat(aggregation.categories()).isEqualTo(categories);
        assertThat(aggregation.numericStats()).isNull();

        verify(queryExecutor).query(
            argThat(sql -> sql.contains("countIf(isNull(base_table.`sex`))") && sql.contains("base_table.`age` > 40")),
            eq(BasicStatsRow.class));
        verify(queryExecutor).query(
            argThat(sql -> sql.contains("if(42 = 0, 0, count() * 100.0 / 42)") && sql.contains("LIMIT 50")),
            eq(CategoryCount.class));
    }

    @Test
    void geographicColumnsUseLargerLimit() {
        when(queryExecutor.query(anyString(), eq(CategoryCount.class))).thenReturn(List.of());

        service.getColumnAggregation("ds", "t_patients", "sex", "geographic", null, null);

        verify(queryExecutor).query(argThat(sql -> sql.contains("LIMIT 100")), eq(CategoryCount.class));
    }

    @Test
    void parentCountingAlwaysCountsDistinctParents() {
        when(queryExecutor.query(anyString(), eq(CountRow.class))).thenReturn(List.of(new CountRow(80L)));
        when(queryExecutor.query(anyString(), eq(CategoryCount.class))).thenReturn(List.of());

        ColumnAggregation aggregation = service.getColumnAggregation(
            "ds", "t_samples", "sample_type", "categorical", null, CountBy.parent("patients"));

        assertThat(aggregation.totalRows()).isEqualTo(80L);
        assertThat(aggregation.metricType()).isEqualTo(MetricType.PARENT);
        assertThat(aggregation.metricParentTable()).isEqualTo("patients");
        assertThat(aggregation.metricParentColumn()).isEqualTo("patient_id");
        assertThat(aggregation.metricPath()).containsExactly(
            new MetricPathSegment("samples", "patient_id", "patients", "patient_id"));

        verify(queryExecutor).query(
            argThat(sql -> sql.contains("SELECT uniq(ancestor_0.`patient_id`) AS filtered_count")
                && sql.contains("ANY LEFT JOIN `biai`.`patients_x` AS ancestor_0")),
            eq(CountRow.class));
    }

    @Test
    void unknownColumnIsRejectedBeforeQuerying() {
        assertThatThrownBy(() ->
            service.getColumnAggregation("ds", "t_patients", "age`; DROP", "numeric", null, null))
            .isInstanceOf(InvalidIdentifierException.class);

        verify(queryExecutor, never()).query(anyString(), eq(BasicStatsRow.class));
    }

    @Test
    void unknownTablePropagatesNotFound() {
        when(metadataProvider.findTable("ds", "missing")).thenThrow(new EntityNotFoundException("Table not found: missing"));

        assertThatThrownBy(() -> service.getTableAggregations("ds", "missing", null, null))
            .isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    void storedDisplayTypeIsUsedWhenNoneRequested() {
        when(metadataProvider.visibleColumns("ds", "t_patients"))
            .thenReturn(List.of(new ColumnMetadata("sex", "categorical")));
        when(queryExecutor.query(anyString(), eq(CategoryCount.class))).thenReturn(List.of());

        ColumnAggregation aggregation = service.getColumnAggregation("ds", "t_patients", "sex", null, null, null);

        assertThat(aggregation.displayType()).isEqualTo("categorical");
        assertThat(aggregation.categories()).isEmpty();
    }

    @Test
    void failingColumnDoesNotAffectSiblings() {
        when(metadataProvider.visibleColumns("ds", "t_patients")).thenReturn(List.of(
            new ColumnMetadata("age", "numeric"),
            new ColumnMetadata("sex", "categorical"),
            new ColumnMetadata("notes", "text")));
        when(queryExecutor.query(argThat(sql -> sql != null && sql.contains("min(base_table.`age`) AS min,")),
            eq(NumericStats.class)))
            .thenThrow(new DataAccessResourceFailureException("Code: 241. Memory limit exceeded"));
        when(queryExecutor.query(anyString(), eq(CategoryCount.class)))
            .thenReturn(List.of(new CategoryCount("M", "M", 60L, 60.0)));

        List<ColumnAggregation> aggregations = service.getTableAggregations("ds", "t_patients", null, null);

        assertThat(aggregations).extracting(ColumnAggregation::columnName).containsExactly("age", "sex", "notes");

        ColumnAggregation failed = aggregations.get(0);
        assertThat(failed.error()).isEqualTo("Code: 241. Memory limit exceeded");
        assertThat(failed.numericStats()).isNull();
        assertThat(failed.totalRows()).isNull();

        assertThat(aggregations.get(1).error()).isNull();
        assertThat(aggregations.get(1).categories()).hasSize(1);

        ColumnAggregation unknownType = aggregations.get(2);
        assertThat(unknownType.error()).isNull();
        assertThat(unknownType.nullCount()).isEqualTo(2L);
        assertThat(unknownType.categories()).isNull();
        assertThat(unknownType.histogram()).isNull();
    }

    @Test
    void saturatedPoolStillAggregatesEveryColumn() {
        ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(1);
        pool.setMaxPoolSize(1);
        pool.setQueueCapacity(1);
        pool.initialize();
        try {
            AggregationService pooled = new AggregationService(
                metadataProvider,
                queryExecutor,
                new MetricContextResolver(),
                new WhereClauseBuilder(new FilterCompiler(), new FilterPruner(),
                    new CrossTableSubqueryBuilder(new FilterCompiler(), new FilterPruner())),
                new AggregationSqlTemplateService(),
                new AggregationProperties(),
                pool);

            List<ColumnMetadata> columns = IntStream.range(0, 20)
                .mapToObj(i -> new ColumnMetadata(i % 2 == 0 ? "sex" : "os_status", "text"))
                .collect(Collectors.toList());
            when(metadataProvider.visibleColumns("ds", "t_patients")).thenReturn(columns);
            when(queryExecutor.query(anyString(), eq(BasicStatsRow.class))).thenAnswer(invocation -> {
                Thread.sleep(50);
                return List.of(new BasicStatsRow(1L, 3L));
            });

            List<ColumnAggregation> aggregations = pooled.getTableAggregations("ds", "t_patients", null, null);

            assertThat(aggregations).hasSize(20);
            assertThat(aggregations).extracting(ColumnAggregation::error).containsOnlyNulls();
            assertThat(aggregations).extracting(ColumnAggregation::uniqueCount).containsOnly(3L);
        } finally {
            pool.shutdown();
        }
    }

    @Test
    void survivalCurveFromGroupedRows() {
        when(queryExecutor.query(anyString(), eq(SurvivalRow.class))).thenReturn(List.of(
            new SurvivalRow(1.0, 1, 0),
            new SurvivalRow(2.0, 0, 1),
            new SurvivalRow(3.0, 1, 0)));

        List<SurvivalCurvePoint> curve =
            service.getSurvivalCurve("ds", "t_patients", "os_months", "os_status", null, null);

        assertThat(curve).extracting(SurvivalCurvePoint::time).containsExactly(1.0, 2.0, 3.0);
        assertThat(curve.get(0).atRisk()).isEqualTo(3L);
        assertThat(curve.get(1).survival()).isCloseTo(2.0 / 3.0, within(1e-12));

        verify(queryExecutor).query(
            argThat(sql -> sql.contains("toFloat64(base_table.`os_months`) AS time_val")
                && sql.contains("toInt64OrNull(toString(base_table.`os_status`))")),
            eq(SurvivalRow.class));
        verify(queryExecutor, never()).query(anyString(), eq(CountRow.class));
    }

    @Test
    void survivalColumnsAreValidated() {
        assertThatThrownBy(() ->
            service.getSurvivalCurve("ds", "t_patients", "os_months", "status) OR 1=1", null, null))
            .isInstanceOf(InvalidIdentifierException.class);
    }
}
