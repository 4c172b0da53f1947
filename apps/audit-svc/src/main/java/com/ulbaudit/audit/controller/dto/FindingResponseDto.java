package com.ulbaudit.audit.controller.dto;

import java.math.BigDecimal;

public record FindingResponseDto(
        String ruleId,
        String entityId,
        String entityName,
        String district,
        String severity,
        String method,
        BigDecimal parameter,
        BigDecimal value,
        String crossedBound,
        BigDecimal lowerBound,
        BigDecimal upperBound,
        Statistics statistics,
        String cohort,
        int cohortSize,
        String narrative
) {
    public record Statistics(BigDecimal q1, BigDecimal q3, BigDecimal iqr, BigDecimal mean, BigDecimal standardDeviation, BigDecimal zScore) {
    }
}
