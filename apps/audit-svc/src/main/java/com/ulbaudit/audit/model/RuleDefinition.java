package com.ulbaudit.audit.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One statistical check. Fields other than the id may be missing; evaluation skips rules whose
 * method, grouping or inputs are incomplete instead of failing.
 *
 * @param columns column references in sheet order (column_1..column_4); a reference may be a
 *                comma-separated list of columns to add up, or a numeric constant
 */
public record RuleDefinition(
        String id,
        String description,
        String part,
        Severity severity,
        CalculationKind calculationKind,
        List<String> columns,
        String primaryPartition,
        String referencePartition,
        PeerGrouping peerGrouping,
        OutlierMethod method,
        Double sensitivity,
        String narrativeTemplate,
        String statisticalContext,
        Integer timePeriodYears
) implements MetricFormula {

    public RuleDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("rule id must be provided");
        }
        columns = columns == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(columns));
        severity = severity == null ? Severity.MEDIUM : severity;
    }

    public boolean isMultiPart() {
        return referencePartition != null && !referencePartition.isBlank();
    }

    /**
     * Zero-based column reference, empty when the rule does not configure it.
     */
    public Optional<String> column(int index) {
        if (index < 0 || index >= columns.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(columns.get(index)).map(String::trim).filter(value -> !value.isEmpty());
    }

    public double sensitivityOrDefault() {
        if (sensitivity != null) {
            return sensitivity;
        }
        return method != null ? method.defaultParameter() : Double.NaN;
    }
}
