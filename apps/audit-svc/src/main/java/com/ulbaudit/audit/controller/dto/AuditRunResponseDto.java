package com.ulbaudit.audit.controller.dto;

import java.util.List;
import java.util.Map;

public record AuditRunResponseDto(
        int rulesAttempted,
        int rulesWithFindings,
        int totalFindings,
        Map<String, Long> findingsBySeverity,
        List<SkippedRule> skippedRules,
        List<RuleEvaluationResponseDto> rules
) {
    public record SkippedRule(String ruleId, String status, String reason) {
    }
}
