package com.ulbaudit.audit.model;

import java.util.Optional;

/**
 * What a metric is computed from: a calculation over up to four column references.
 */
public interface MetricFormula {

    CalculationKind calculationKind();

    /**
     * Zero-based column reference, empty when not configured.
     */
    Optional<String> column(int index);

    Integer timePeriodYears();
}
