package com.biai.explorer.service.query;

import com.biai.explorer.model.query.Filter;
import org.junit.jupiter.api.Test;

import static com.biai.explorer.service.query.FilterCompilerTest.filter;
import static org.assertj.core.api.Assertions.assertThat;

class CrossTableSubqueryBuilderTest {

    private final CrossTableSubqueryBuilder builder =
        new CrossTableSubqueryBuilder(new FilterCompiler(), new FilterPruner());
    private final RelationshipGraph graph = QueryFixtures.graph();

    @Test
    void parentTableFilterBecomesMembership() {
        Filter onPatients = filter("{\"column\":\"sex\",\"operator\":\"eq\",\"value\":\"F\",\"tableName\":\"patients\"}");

        assertThat(builder.build("samples", onPatients, graph)).contains(
            "base_table.`patient_id` IN (SELECT `patient_id` FROM `biai`.`patients_x` WHERE `sex` = 'F')");
    }

    @Test
    void childTableFilterFollowsBackwardEdge() {
        Filter onSamples = filter(
            "{\"column\":\"sample_type\",\"operator\":\"eq\",\"value\":\"Primary\",\"tableName\":\"samples\"}");

        assertThat(builder.build("patients", onSamples, graph)).contains(
            "base_table.`patient_id` IN (SELECT `patient_id` FROM `biai`.`samples_x` WHERE `sample_type` = 'Primary')");
    }

    @Test
    void multiHopFilterNestsOneSubqueryPerHop() {
        Filter onMutations = filter("{\"column\":\"gene\",\"operator\":\"in\",\"value\":[\"TP53\"],\"tableName\":\"mutations\"}");

        assertThat(builder.build("patients", onMutations, graph)).contains(
            "base_table.`patient_id` IN (SELECT `patient_id` FROM `biai`.`samples_x` WHERE `sample_id` IN "
                + "(SELECT `sample_id` FROM `other_db`.`mutations_x` WHERE `gene` IN ('TP53')))");
    }

    @Test
    void negatedFilterKeepsRowsWithoutRelation() {
        Filter notOnPatients = filter(
            "{\"not\":{\"column\":\"radiation_therapy\",\"operator\":\"eq\",\"value\":\"Yes\",\"tableName\":\"patients\"}}");

        assertThat(builder.build("samples", notOnPatients, graph)).contains(
            "(base_table.`patient_id` NOT IN (SELECT `patient_id` FROM `biai`.`patients_x` "
                + "WHERE `radiation_therapy` = 'Yes') OR base_table.`patient_id` IS NULL)");
    }

    @Test
    void logicalGroupOnTargetTableIsCompiledWhole() {
        Filter group = filter("{\"or\":[{\"column\":\"sex\",\"operator\":\"eq\",\"value\":\"F\"},"
            + "{\"column\":\"age\",\"operator\":\"gt\",\"value\":70}],\"tableName\":\"patients\"}");

        assertThat(builder.build("samples", group, graph)).contains(
            "base_table.`patient_id` IN (SELECT `patient_id` FROM `biai`.`patients_x` "
                + "WHERE (`sex` = 'F' OR `age` > 70))");
    }

    @Test
    void unknownTableIsDropped() {
        Filter onDrugs = filter("{\"column\":\"name\",\"operator\":\"eq\",\"value\":\"x\",\"tableName\":\"drugs\"}");

        assertThat(builder.build("samples", onDrugs, graph)).isEmpty();
    }

    @Test
    void unknownColumnOnTargetIsDropped() {
        Filter unknownColumn = filter("{\"column\":\"gene\",\"operator\":\"eq\",\"value\":\"x\",\"tableName\":\"patients\"}");

        assertThat(builder.build("samples", unknownColumn, graph)).isEmpty();
    }

    @Test
    void filterOnCurrentTableIsNotCrossTable() {
        Filter local = filter("{\"column\":\"stage\",\"operator\":\"eq\",\"value\":\"I\",\"tableName\":\"samples\"}");

        assertThat(builder.build("samples", local, graph)).isEmpty();
    }
}
