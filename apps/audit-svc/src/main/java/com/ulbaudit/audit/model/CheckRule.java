package com.ulbaudit.audit.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A per-entity validation check from the rule catalog.
 *
 * @param operator  comparison of a threshold check, or of the two sides of a consistency or
 *                  cross-table check
 * @param threshold expected value; set for threshold checks only
 */
public record CheckRule(
        String id,
        String description,
        String part,
        Severity severity,
        CheckKind kind,
        CalculationKind calculationKind,
        List<String> columns,
        String primaryPartition,
        String referencePartition,
        ComparisonOperator operator,
        Threshold threshold,
        Integer timePeriodYears
) implements MetricFormula {

    public CheckRule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("rule id must be provided");
        }
        if (kind == null) {
            throw new IllegalArgumentException("check kind must be provided");
        }
        if (kind == CheckKind.THRESHOLD && threshold == null) {
            throw new IllegalArgumentException("threshold checks need a threshold");
        }
        operator = operator != null ? operator : threshold != null ? threshold.operator() : ComparisonOperator.EQUAL;
        columns = columns == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(columns));
        severity = severity == null ? Severity.MEDIUM : severity;
        calculationKind = calculationKind == null ? CalculationKind.DIRECT : calculationKind;
    }

    public boolean hasReference() {
        return referencePartition != null && !referencePartition.isBlank();
    }

    @Override
    public Optional<String> column(int index) {
        if (index < 0 || index >= columns.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(columns.get(index)).map(String::trim).filter(value -> !value.isEmpty());
    }
}
