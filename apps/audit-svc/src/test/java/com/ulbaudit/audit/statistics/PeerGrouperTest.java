package com.ulbaudit.audit.statistics;

import static com.ulbaudit.audit.support.Fixtures.entity;
import static com.ulbaudit.audit.support.Fixtures.rule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ulbaudit.audit.data.InMemoryAuditDataProvider;
import com.ulbaudit.audit.model.Cohort;
import com.ulbaudit.audit.model.MetricValue;
import com.ulbaudit.audit.model.PeerGrouping;
import com.ulbaudit.audit.rules.InvalidRuleConfigurationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PeerGrouperTest {

    private PeerGrouper grouper;
    private Map<String, MetricValue> metrics;

    @BeforeEach
    void setUp() {
        InMemoryAuditDataProvider dataProvider = new InMemoryAuditDataProvider();
        dataProvider.replaceEntities(List.of(
                entity("1", "Salem Municipal Corporation", "Salem", 50_000d),
                entity("2", "Attur Municipality Grade II", "Salem", 120_000d),
                entity("3", "Hosur Selection Grade Municipality", "Krishnagiri", 200_000d),
                entity("4", "Small Town", null, 49_999d),
                entity("5", "Big City Corporation", "Chennai", 200_001d),
                entity("6", "Unknown Size", "Chennai", null),
                entity("7", "Undefined Metric Town", "Salem", 100_000d)
        ));
        grouper = new PeerGrouper(dataProvider, new GradeClassifier());
        metrics = new LinkedHashMap<>();
        for (String id : List.of("1", "2", "3", "4", "5", "6")) {
            metrics.put(id, MetricValue.of(Double.parseDouble(id)));
        }
        metrics.put("7", MetricValue.undefined("missing"));
    }

    @Test
    void populationCohortIsInclusiveAndExcludesEveryoneElse() {
        Map<String, Cohort> cohorts = grouper.group(
                rule("R").grouping(PeerGrouping.population(50_000d, 200_000d)).build(), metrics);

        assertThat(cohorts).containsOnlyKeys("pop_50k-200k");
        assertThat(cohorts.get("pop_50k-200k").memberIds()).containsExactly("1", "2", "3");
    }

    @Test
    void populationGroupingNeedsOrderedBounds() {
        assertThatThrownBy(() -> grouper.group(
                rule("R").grouping(PeerGrouping.population(200_000d, 50_000d)).build(), metrics))
                .isInstanceOf(InvalidRuleConfigurationException.class)
                .hasMessageContaining("exceeds");
        assertThatThrownBy(() -> grouper.group(
                rule("R").grouping(PeerGrouping.population(null, 50_000d)).build(), metrics))
                .isInstanceOf(InvalidRuleConfigurationException.class);
    }

    @Test
    void emptyPopulationBandYieldsNoCohort() {
        assertThat(grouper.group(rule("R").grouping(PeerGrouping.population(1d, 2d)).build(), metrics)).isEmpty();
    }

    @Test
    void districtGroupingDropsEntitiesWithoutDistrict() {
        Map<String, Cohort> cohorts = grouper.group(rule("R").grouping(PeerGrouping.district()).build(), metrics);

        assertThat(cohorts).containsOnlyKeys("Salem", "Krishnagiri", "Chennai");
        assertThat(cohorts.get("Salem").memberIds()).containsExactly("1", "2");
        assertThat(cohorts.get("Chennai").memberIds()).containsExactly("5", "6");
        assertThat(cohorts.values()).flatExtracting(Cohort::memberIds).doesNotContain("4", "7");
    }

    @Test
    void gradeGroupingUsesClassifiedNames() {
        Map<String, Cohort> cohorts = grouper.group(rule("R").grouping(PeerGrouping.grade()).build(), metrics);

        assertThat(cohorts).containsOnlyKeys("Municipal Corporation", "Grade II", "Selection Grade",
                GradeClassifier.UNCLASSIFIED);
        assertThat(cohorts.get("Municipal Corporation").memberIds()).containsExactly("1", "5");
        assertThat(cohorts.get(GradeClassifier.UNCLASSIFIED).memberIds()).containsExactly("4", "6");
    }

    @Test
    void statewideGroupingIsOneCohortOfDefinedMetrics() {
        Map<String, Cohort> cohorts = grouper.group(rule("R").grouping(PeerGrouping.statewide()).build(), metrics);

        assertThat(cohorts).containsOnlyKeys(PeerGrouper.STATEWIDE_COHORT);
        assertThat(cohorts.get(PeerGrouper.STATEWIDE_COHORT).memberIds()).containsExactly("1", "2", "3", "4", "5", "6");
    }

    @Test
    void cohortsAreDisjoint() {
        Map<String, Cohort> cohorts = grouper.group(rule("R").grouping(PeerGrouping.district()).build(), metrics);

        List<String> members = cohorts.values().stream().flatMap(cohort -> cohort.memberIds().stream()).toList();
        assertThat(members).doesNotHaveDuplicates();
    }

    @Test
    void missingGroupingIsInvalidConfiguration() {
        assertThatThrownBy(() -> grouper.group(rule("R").grouping(null).build(), metrics))
                .isInstanceOf(InvalidRuleConfigurationException.class);
    }

    @Test
    void populationCohortNameUsesThousands() {
        assertThat(PeerGrouper.populationCohortName(10_000d, 49_999d)).isEqualTo("pop_10k-49k");
    }
}
