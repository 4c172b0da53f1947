package com.ulbaudit.audit.controller.dto;

import java.util.List;

public record RuleEvaluationResponseDto(
        String ruleId,
        String status,
        String reason,
        int cohortsEvaluated,
        int cohortsSkipped,
        int undefinedMetrics,
        List<FindingResponseDto> findings,
        List<CheckFindingResponseDto> checkFindings
) {
}
