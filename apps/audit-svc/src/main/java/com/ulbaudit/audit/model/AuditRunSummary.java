package com.ulbaudit.audit.model;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.LinkedHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Merged outcome of one audit run. Every attempted rule is accounted for either as a rule that
 * was evaluated or as a skipped rule with its reason.
 */
public record AuditRunSummary(
        int rulesAttempted,
        int rulesWithFindings,
        List<SkippedRule> skippedRules,
        int totalFindings,
        Map<Severity, Long> findingsBySeverity,
        List<RuleEvaluation> evaluations
) {

    public record SkippedRule(String ruleId, RuleEvaluation.Status status, String reason) {
    }

    public static AuditRunSummary from(List<RuleEvaluation> evaluations) {
        List<SkippedRule> skipped = evaluations.stream()
                .filter(evaluation -> evaluation.status() != RuleEvaluation.Status.EVALUATED)
                .map(evaluation -> new SkippedRule(evaluation.ruleId(), evaluation.status(), evaluation.reason()))
                .toList();
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        Arrays.stream(Severity.values()).forEach(severity -> bySeverity.put(severity, 0L));
        Stream.concat(
                        evaluations.stream().flatMap(evaluation -> evaluation.findings().stream()).map(Finding::severity),
                        evaluations.stream().flatMap(evaluation -> evaluation.checkFindings().stream()).map(CheckFinding::severity))
                .forEach(severity -> bySeverity.merge(severity, 1L, Long::sum));
        int total = evaluations.stream().mapToInt(RuleEvaluation::findingCount).sum();
        int withFindings = (int) evaluations.stream().filter(RuleEvaluation::hasFindings).count();
        return new AuditRunSummary(
                evaluations.size(),
                withFindings,
                skipped,
                total,
                bySeverity,
                List.copyOf(evaluations)
        );
    }

    public List<Finding> findings() {
        return evaluations.stream()
                .flatMap(evaluation -> evaluation.findings().stream())
                .toList();
    }

    public List<CheckFinding> checkFindings() {
        return evaluations.stream()
                .flatMap(evaluation -> evaluation.checkFindings().stream())
                .toList();
    }

    public Map<String, List<Finding>> findingsByEntity() {
        return findings().stream()
                .collect(Collectors.groupingBy(Finding::entityId, LinkedHashMap::new, Collectors.toList()));
    }
}
