package com.ulbaudit.audit.statistics;

import com.ulbaudit.audit.data.AuditDataProvider;
import com.ulbaudit.audit.model.AuditEntity;
import com.ulbaudit.audit.model.Cohort;
import com.ulbaudit.audit.model.MetricValue;
import com.ulbaudit.audit.model.PeerGrouping;
import com.ulbaudit.audit.model.RuleDefinition;
import com.ulbaudit.audit.rules.InvalidRuleConfigurationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Partitions entities with a defined metric into disjoint cohorts. Entities lacking the attribute
 * the grouping needs are left out rather than put in a default cohort.
 */
@Component
public class PeerGrouper {

    static final String STATEWIDE_COHORT = "statewide";

    private final AuditDataProvider dataProvider;
    private final GradeClassifier gradeClassifier;

    public PeerGrouper(AuditDataProvider dataProvider, GradeClassifier gradeClassifier) {
        this.dataProvider = dataProvider;
        this.gradeClassifier = gradeClassifier;
    }

    public Map<String, Cohort> group(RuleDefinition rule, Map<String, MetricValue> metrics) {
        PeerGrouping grouping = rule.peerGrouping();
        if (grouping == null || grouping.mode() == null) {
            throw new InvalidRuleConfigurationException("peer grouping is not configured");
        }
        List<String> candidates = metrics.entrySet().stream()
                .filter(entry -> entry.getValue() != null && entry.getValue().isDefined())
                .map(Map.Entry::getKey)
                .toList();
        return switch (grouping.mode()) {
            case POPULATION -> byPopulation(grouping, candidates);
            case DISTRICT -> byAttribute(candidates, AuditEntity::district);
            case GRADE -> byAttribute(candidates, entity -> Optional.of(gradeClassifier.extractGrade(entity.name())));
            case STATEWIDE -> candidates.isEmpty()
                    ? Map.of()
                    : Map.of(STATEWIDE_COHORT, new Cohort(STATEWIDE_COHORT, candidates));
        };
    }

    private Map<String, Cohort> byPopulation(PeerGrouping grouping, List<String> candidates) {
        Double min = grouping.populationMin();
        Double max = grouping.populationMax();
        if (min == null || max == null) {
            throw new InvalidRuleConfigurationException("population grouping needs both peer_population_min and peer_population_max");
        }
        if (min > max) {
            throw new InvalidRuleConfigurationException("peer_population_min " + min + " exceeds peer_population_max " + max);
        }
        List<String> members = new ArrayList<>();
        for (String entityId : candidates) {
            Optional<Double> population = dataProvider.findEntity(entityId).flatMap(AuditEntity::population);
            if (population.isPresent() && population.get() >= min && population.get() <= max) {
                members.add(entityId);
            }
        }
        if (members.isEmpty()) {
            return Map.of();
        }
        String name = populationCohortName(min, max);
        return Map.of(name, new Cohort(name, members));
    }

    private Map<String, Cohort> byAttribute(List<String> candidates, Function<AuditEntity, Optional<String>> attribute) {
        Map<String, List<String>> members = new LinkedHashMap<>();
        for (String entityId : candidates) {
            dataProvider.findEntity(entityId)
                    .flatMap(attribute)
                    .ifPresent(key -> members.computeIfAbsent(key, k -> new ArrayList<>()).add(entityId));
        }
        Map<String, Cohort> cohorts = new LinkedHashMap<>();
        members.forEach((name, ids) -> cohorts.put(name, new Cohort(name, ids)));
        return cohorts;
    }

    static String populationCohortName(double min, double max) {
        return "pop_" + (long) (min / 1000) + "k-" + (long) (max / 1000) + "k";
    }
}
