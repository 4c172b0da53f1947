package com.ulbaudit.audit.controller.dto;

import java.math.BigDecimal;

public record CheckFindingResponseDto(
        String ruleId,
        String entityId,
        String entityName,
        String district,
        String part,
        String severity,
        String checkType,
        String description,
        BigDecimal value,
        String detail,
        boolean evaluationError
) {
}
