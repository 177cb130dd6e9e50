package com.biai.explorer.model.query;

import com.biai.explorer.model.enums.FilterOperator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FilterDeserializerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private Filter read(String json) throws Exception {
        return objectMapper.readValue(json, Filter.class);
    }

    @Test
    void readsLeafCondition() throws Exception {
        Filter filter = read("""
            {"column": "age", "operator": "gte", "value": 65, "tableName": "patients"}
            """);

        assertThat(filter).isInstanceOf(Filter.Condition.class);
        Filter.Condition condition = (Filter.Condition) filter;
        assertThat(condition.column()).isEqualTo("age");
        assertThat(condition.operator()).isEqualTo(FilterOperator.GTE);
        assertThat(condition.value().isNumber()).isTrue();
        assertThat(condition.targetTable()).isEqualTo("patients");
    }

    @Test
    void topLevelArrayIsImplicitAnd() throws Exception {
        Filter filter = read("""
            [{"column": "sex", "operator": "eq", "value": "F"},
             {"column": "age", "operator": "gt", "value": 40}]
            """);

        assertThat(filter).isInstanceOf(Filter.And.class);
        assertThat(((Filter.And) filter).filters()).hasSize(2);
        assertThat(filter.targetTable()).isNull();
    }

    @Test
    void readsNestedLogicalNodes() throws Exception {
        Filter filter = read("""
            {"not": {"or": [
                {"column": "stage", "operator": "in", "value": ["I", "II"]},
                {"column": "stage", "operator": "eq", "value": null}
              ], "tableName": "samples"}}
            """);

        assertThat(filter).isInstanceOf(Filter.Not.class);
        Filter inner = ((Filter.Not) filter).filter();
        assertThat(inner).isInstanceOf(Filter.Or.class);
        assertThat(filter.targetTable()).isEqualTo("samples");

        Filter.Condition nullCheck = (Filter.Condition) ((Filter.Or) inner).filters().get(1);
        assertThat(nullCheck.value().isNull()).isTrue();
        assertThat(nullCheck.value().isAbsent()).isFalse();
    }

    @Test
    void readsTemporalFields() throws Exception {
        Filter.Condition condition = (Filter.Condition) read("""
            {"column": "diagnosis_date", "operator": "temporal_before",
             "temporal_reference_column": "treatment_date", "temporal_window_days": 30}
            """);

        assertThat(condition.operator()).isEqualTo(FilterOperator.TEMPORAL_BEFORE);
        assertThat(condition.temporalReferenceColumn()).isEqualTo("treatment_date");
        assertThat(condition.value().isAbsent()).isTrue();
    }

    @Test
    void unknownOperatorLeavesIncompleteLeaf() throws Exception {
        Filter.Condition condition = (Filter.Condition) read("""
            {"column": "age", "operator": "like", "value": "%x%"}
            """);

        assertThat(condition.operator()).isNull();
        assertThat(condition.isComplete()).isFalse();
    }
}
