package com.ulbaudit.audit.model;

import java.util.Optional;

/**
 * Either computed bounds or the record of a cohort too small for its method.
 */
public record BoundsResult(Bounds computed, OutlierMethod method, int sampleSize) {

    public static BoundsResult of(Bounds bounds) {
        return new BoundsResult(bounds, bounds.method(), bounds.sampleSize());
    }

    public static BoundsResult insufficient(OutlierMethod method, int sampleSize) {
        return new BoundsResult(null, method, sampleSize);
    }

    public boolean isSufficient() {
        return computed != null;
    }

    public Optional<Bounds> bounds() {
        return Optional.ofNullable(computed);
    }

    public int requiredSampleSize() {
        return method.minimumSampleSize();
    }
}
