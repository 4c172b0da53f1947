package com.ulbaudit.audit.model;

import java.util.Optional;

/**
 * Result of a failed validation check for one entity. An evaluation error means the check
 * could not be computed for the entity; the detail then names the cause.
 */
public record CheckFinding(
        String ruleId,
        String entityId,
        String entityName,
        Optional<String> district,
        String part,
        Severity severity,
        CheckKind kind,
        String description,
        String detail,
        Optional<Double> value,
        boolean evaluationError
) {
}
