package com.ulbaudit.audit.model;

import java.util.List;

/**
 * Outcome of one rule. Statistical rules fill {@code findings} and count cohorts; validation
 * checks fill {@code checkFindings} and report the entities they could not apply to as
 * {@code undefinedMetrics}.
 */
public record RuleEvaluation(
        String ruleId,
        Status status,
        List<Finding> findings,
        List<CheckFinding> checkFindings,
        int cohortsEvaluated,
        int cohortsSkipped,
        int undefinedMetrics,
        String reason
) {

    public enum Status {
        EVALUATED,
        SKIPPED,
        INVALID_CONFIGURATION,
        FAILED
    }

    public RuleEvaluation {
        findings = findings == null ? List.of() : List.copyOf(findings);
        checkFindings = checkFindings == null ? List.of() : List.copyOf(checkFindings);
    }

    public static RuleEvaluation evaluated(String ruleId, List<Finding> findings, int cohortsEvaluated, int cohortsSkipped, int undefinedMetrics) {
        return new RuleEvaluation(ruleId, Status.EVALUATED, findings, List.of(), cohortsEvaluated, cohortsSkipped, undefinedMetrics, null);
    }

    public static RuleEvaluation checked(String ruleId, List<CheckFinding> checkFindings, int notApplicable) {
        return new RuleEvaluation(ruleId, Status.EVALUATED, List.of(), checkFindings, 0, 0, notApplicable, null);
    }

    public static RuleEvaluation skipped(String ruleId, int cohortsSkipped, int undefinedMetrics, String reason) {
        return new RuleEvaluation(ruleId, Status.SKIPPED, List.of(), List.of(), 0, cohortsSkipped, undefinedMetrics, reason);
    }

    public static RuleEvaluation invalidConfiguration(String ruleId, String reason) {
        return new RuleEvaluation(ruleId, Status.INVALID_CONFIGURATION, List.of(), List.of(), 0, 0, 0, reason);
    }

    public static RuleEvaluation failed(String ruleId, String reason) {
        return new RuleEvaluation(ruleId, Status.FAILED, List.of(), List.of(), 0, 0, 0, reason);
    }

    public boolean hasFindings() {
        return !findings.isEmpty() || !checkFindings.isEmpty();
    }

    public int findingCount() {
        return findings.size() + checkFindings.size();
    }
}
