package com.ulbaudit.audit.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum OutlierMethod {
    IQR("outlier_iqr", 4, 1.5d),
    Z_SCORE("outlier_zscore", 3, 2.0d);

    private final String validationType;
    private final int minimumSampleSize;
    private final double defaultParameter;

    OutlierMethod(String validationType, int minimumSampleSize, double defaultParameter) {
        this.validationType = validationType;
        this.minimumSampleSize = minimumSampleSize;
        this.defaultParameter = defaultParameter;
    }

    public String validationType() {
        return validationType;
    }

    public int minimumSampleSize() {
        return minimumSampleSize;
    }

    public double defaultParameter() {
        return defaultParameter;
    }

    public static Optional<OutlierMethod> fromValidationType(String validationType) {
        if (validationType == null) {
            return Optional.empty();
        }
        String normalized = validationType.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(method -> method.validationType.equals(normalized))
                .findFirst();
    }

    public static boolean isStatistical(String validationType) {
        return validationType != null && validationType.trim().toLowerCase(Locale.ROOT).startsWith("outlier_");
    }
}
