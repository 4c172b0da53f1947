package com.ulbaudit.audit.model;

import java.util.Optional;

public record Finding(
        String ruleId,
        String entityId,
        String entityName,
        Optional<String> district,
        String part,
        Severity severity,
        String description,
        double value,
        Bounds bounds,
        BoundSide side,
        Optional<Double> zScore,
        String cohortName,
        int cohortSize,
        String narrative
) {

    public OutlierMethod method() {
        return bounds.method();
    }

    public double crossedBound() {
        return bounds.boundFor(side);
    }
}
