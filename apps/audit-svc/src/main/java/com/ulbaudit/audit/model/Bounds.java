package com.ulbaudit.audit.model;

import java.util.Optional;

/**
 * Outlier bounds of one cohort. IQR bounds carry the quartiles, Z-score bounds carry mean and
 * sample standard deviation; the fields of the other method are null.
 */
public record Bounds(
        OutlierMethod method,
        double parameter,
        int sampleSize,
        double lower,
        double upper,
        Double q1,
        Double q3,
        Double iqr,
        Double mean,
        Double standardDeviation
) {

    public static Bounds iqr(double multiplier, int sampleSize, double q1, double q3) {
        double iqr = q3 - q1;
        return new Bounds(OutlierMethod.IQR, multiplier, sampleSize,
                q1 - multiplier * iqr, q3 + multiplier * iqr,
                q1, q3, iqr, null, null);
    }

    public static Bounds zScore(double limit, int sampleSize, double mean, double standardDeviation) {
        return new Bounds(OutlierMethod.Z_SCORE, limit, sampleSize,
                mean - limit * standardDeviation, mean + limit * standardDeviation,
                null, null, null, mean, standardDeviation);
    }

    /**
     * Boundary values are in bounds.
     */
    public Optional<BoundSide> crossedBy(double value) {
        if (value < lower) {
            return Optional.of(BoundSide.BELOW_LOWER);
        }
        if (value > upper) {
            return Optional.of(BoundSide.ABOVE_UPPER);
        }
        return Optional.empty();
    }

    public double boundFor(BoundSide side) {
        return side == BoundSide.BELOW_LOWER ? lower : upper;
    }

    public Optional<Double> zScoreOf(double value) {
        if (method != OutlierMethod.Z_SCORE || standardDeviation == null || standardDeviation == 0d) {
            return Optional.empty();
        }
        return Optional.of((value - mean) / standardDeviation);
    }
}
