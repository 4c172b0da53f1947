package com.ulbaudit.audit.model;

/**
 * Per-entity metric for one rule. Undefined values carry the reason they could not be computed
 * and never take part in cohort statistics.
 */
public record MetricValue(Double value, String missingReason) {

    public static MetricValue of(double value) {
        return new MetricValue(value, null);
    }

    public static MetricValue undefined(String reason) {
        return new MetricValue(null, reason == null ? "undefined" : reason);
    }

    public boolean isDefined() {
        return value != null;
    }

    public double asDouble() {
        if (value == null) {
            throw new IllegalStateException("metric is undefined: " + missingReason);
        }
        return value;
    }
}
