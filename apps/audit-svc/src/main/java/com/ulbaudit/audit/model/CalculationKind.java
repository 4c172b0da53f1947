package com.ulbaudit.audit.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum CalculationKind {
    DIRECT("none", "direct"),
    RATIO("ratio"),
    PERCENTAGE("percentage", "percentage_of"),
    SUM("sum"),
    DIFFERENCE("difference"),
    GROWTH_RATE("growth_rate"),
    CAGR("cagr");

    private final Set<String> keys;

    CalculationKind(String... keys) {
        this.keys = Set.of(keys);
    }

    /**
     * Resolves a rule-sheet key. A missing key means the first column is read as is.
     */
    public static Optional<CalculationKind> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.of(DIRECT);
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.keys.contains(normalized))
                .findFirst();
    }
}
