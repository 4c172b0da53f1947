package com.ulbaudit.audit.statistics;

import static com.ulbaudit.audit.support.Fixtures.entity;
import static com.ulbaudit.audit.support.Fixtures.row;
import static com.ulbaudit.audit.support.Fixtures.rule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ulbaudit.audit.data.DataProviderUnavailableException;
import com.ulbaudit.audit.data.InMemoryAuditDataProvider;
import com.ulbaudit.audit.model.AuditEntity;
import com.ulbaudit.audit.model.Finding;
import com.ulbaudit.audit.model.OutlierMethod;
import com.ulbaudit.audit.model.PartitionRow;
import com.ulbaudit.audit.model.PeerGrouping;
import com.ulbaudit.audit.model.RuleDefinition;
import com.ulbaudit.audit.model.RuleEvaluation;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PeerOutlierEvaluatorTest {

    private InMemoryAuditDataProvider dataProvider;
    private PeerOutlierEvaluator evaluator;

    @BeforeEach
    void setUp() {
        dataProvider = new InMemoryAuditDataProvider();
        GradeClassifier gradeClassifier = new GradeClassifier();
        evaluator = new PeerOutlierEvaluator(
                dataProvider,
                new MetricCollector(dataProvider),
                new PeerGrouper(dataProvider, gradeClassifier),
                new BoundsCalculator(),
                new OutlierEvaluator(),
                new FindingBuilder()
        );
    }

    private void load(String[] districts, double[] values) {
        List<AuditEntity> entities = new ArrayList<>();
        List<PartitionRow> rows = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            String id = Integer.toString(i + 1);
            entities.add(entity(id, "Town " + id, districts[i], 10_000d * (i + 1)));
            rows.add(row(id, "metric", Double.toString(values[i])));
        }
        dataProvider.replaceEntities(entities);
        dataProvider.savePartition("p1", rows);
    }

    @Test
    void flagsTheSingleDistantValueStatewide() {
        load(new String[]{"A", "A", "A", "B", "B", "B"}, new double[]{10, 10, 10, 10, 10, 1000});

        RuleEvaluation evaluation = evaluator.evaluate(rule("STAT_C").build());

        assertThat(evaluation.status()).isEqualTo(RuleEvaluation.Status.EVALUATED);
        assertThat(evaluation.cohortsEvaluated()).isEqualTo(1);
        assertThat(evaluation.findings()).hasSize(1);
        Finding finding = evaluation.findings().get(0);
        assertThat(finding.entityId()).isEqualTo("6");
        assertThat(finding.entityName()).isEqualTo("Town 6");
        assertThat(finding.cohortName()).isEqualTo("statewide");
        assertThat(finding.cohortSize()).isEqualTo(6);
        assertThat(finding.bounds().lower()).isEqualTo(10d);
        assertThat(finding.bounds().upper()).isEqualTo(10d);
    }

    @Test
    void undersizedDistrictCohortIsSkippedUnderEitherMethod() {
        load(new String[]{"Tiny", "Tiny"}, new double[]{1, 500});

        for (OutlierMethod method : OutlierMethod.values()) {
            RuleEvaluation evaluation = evaluator.evaluate(
                    rule("STAT_D").grouping(PeerGrouping.district()).method(method, null).build());

            assertThat(evaluation.status()).isEqualTo(RuleEvaluation.Status.SKIPPED);
            assertThat(evaluation.findings()).isEmpty();
            assertThat(evaluation.cohortsSkipped()).isEqualTo(1);
            assertThat(evaluation.reason()).contains("minimum sample size of " + method.minimumSampleSize());
        }
    }

    @Test
    void smallCohortsAreSkippedWhileLargerOnesAreEvaluated() {
        load(new String[]{"Tiny", "Tiny", "Big", "Big", "Big", "Big", "Big"},
                new double[]{1, 9999, 10, 11, 12, 13, 500});

        RuleEvaluation evaluation = evaluator.evaluate(rule("STAT_MIX").grouping(PeerGrouping.district()).build());

        assertThat(evaluation.status()).isEqualTo(RuleEvaluation.Status.EVALUATED);
        assertThat(evaluation.cohortsEvaluated()).isEqualTo(1);
        assertThat(evaluation.cohortsSkipped()).isEqualTo(1);
        assertThat(evaluation.findings()).extracting(Finding::entityId).containsExactly("7");
    }

    @Test
    void populationExcludedEntitiesAreNeverFlagged() {
        load(new String[]{"A", "A", "A", "A", "A", "A"}, new double[]{5, 5, 5, 5, 5, 9999});

        // populations run 10k..60k, so entity 6 at 60k falls outside the band
        RuleEvaluation evaluation = evaluator.evaluate(rule("STAT_POP")
                .grouping(PeerGrouping.population(10_000d, 50_000d)).build());

        assertThat(evaluation.status()).isEqualTo(RuleEvaluation.Status.EVALUATED);
        assertThat(evaluation.findings()).isEmpty();
    }

    @Test
    void undefinedMetricsAreCountedAndLeftOut() {
        load(new String[]{"A", "A", "A", "A"}, new double[]{1, 2, 3, 4});
        List<PartitionRow> rows = new ArrayList<>(List.of(
                row("1", "metric", "1"), row("2", "metric", "2"), row("3", "metric", "3"), row("4", "metric", "")));
        dataProvider.savePartition("p1", rows);

        RuleEvaluation evaluation = evaluator.evaluate(rule("STAT_U").build());

        assertThat(evaluation.status()).isEqualTo(RuleEvaluation.Status.SKIPPED);
        assertThat(evaluation.undefinedMetrics()).isEqualTo(1);
    }

    @Test
    void notANumberCellsDoNotHideTheOutlier() {
        String[] values = {"10", "11", "10", "12", "11", "10", "1000", "NaN", "Infinity"};
        List<AuditEntity> entities = new ArrayList<>();
        List<PartitionRow> rows = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            String id = Integer.toString(i + 1);
            entities.add(entity(id, "Town " + id, "A", 10_000d));
            rows.add(row(id, "metric", values[i]));
        }
        dataProvider.replaceEntities(entities);
        dataProvider.savePartition("p1", rows);

        RuleEvaluation evaluation = evaluator.evaluate(rule("STAT_NAN").method(OutlierMethod.Z_SCORE, 2.0).build());

        assertThat(evaluation.status()).isEqualTo(RuleEvaluation.Status.EVALUATED);
        assertThat(evaluation.undefinedMetrics()).isEqualTo(2);
        assertThat(evaluation.findings()).extracting(Finding::entityId).containsExactly("7");
        Finding finding = evaluation.findings().get(0);
        assertThat(finding.cohortSize()).isEqualTo(7);
        assertThat(finding.bounds().upper()).isFinite().isLessThan(1000d);
    }

    @Test
    void noMatchingEntitiesSkipsTheRule() {
        load(new String[]{"A", "A", "A", "A"}, new double[]{1, 2, 3, 4});

        RuleEvaluation evaluation = evaluator.evaluate(rule("STAT_NONE").columns("absent").build());

        assertThat(evaluation.status()).isEqualTo(RuleEvaluation.Status.SKIPPED);
        assertThat(evaluation.reason()).contains("no entity with a defined metric");
        assertThat(evaluation.undefinedMetrics()).isEqualTo(4);
    }

    @Test
    void invalidConfigurationSkipsTheRuleWithReason() {
        load(new String[]{"A", "A", "A", "A"}, new double[]{1, 2, 3, 4});
        RuleDefinition inverted = rule("STAT_BAD").grouping(PeerGrouping.population(100d, 1d)).build();
        RuleDefinition noMethod = rule("STAT_NO_METHOD").method(null, null).build();
        RuleDefinition negative = rule("STAT_NEG").method(OutlierMethod.IQR, -2.0).build();

        assertThat(evaluator.evaluate(inverted).status()).isEqualTo(RuleEvaluation.Status.INVALID_CONFIGURATION);
        assertThat(evaluator.evaluate(noMethod).reason()).contains("outlier method");
        assertThat(evaluator.evaluate(negative).status()).isEqualTo(RuleEvaluation.Status.INVALID_CONFIGURATION);
    }

    @Test
    void unavailableDataProviderEscapesTaggedWithRule() {
        assertThatThrownBy(() -> evaluator.evaluate(rule("STAT_X").build()))
                .isInstanceOf(DataProviderUnavailableException.class)
                .hasMessageContaining("STAT_X")
                .extracting("ruleId")
                .isEqualTo("STAT_X");
    }

    @Test
    void evaluationIsRepeatable() {
        load(new String[]{"A", "A", "A", "A", "A"}, new double[]{1, 2, 3, 4, 100});
        RuleDefinition rule = rule("STAT_R").method(OutlierMethod.Z_SCORE, 1.5).build();

        RuleEvaluation first = evaluator.evaluate(rule);
        RuleEvaluation second = evaluator.evaluate(rule);

        assertThat(second).isEqualTo(first);
        assertThat(first.findings()).extracting(Finding::entityId).containsExactly("5");
    }
}
