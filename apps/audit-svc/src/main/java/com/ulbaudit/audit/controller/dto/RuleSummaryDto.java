package com.ulbaudit.audit.controller.dto;

public record RuleSummaryDto(
        String ruleId,
        String description,
        String validationType,
        String severity,
        String method,
        Double parameter,
        String peerGrouping,
        String expectation,
        String primaryTable,
        String referenceTable
) {
}
