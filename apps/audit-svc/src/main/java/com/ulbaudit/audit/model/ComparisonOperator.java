package com.ulbaudit.audit.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum ComparisonOperator {
    GREATER(">", "gt"),
    LESS("<", "lt"),
    GREATER_OR_EQUAL(">=", "gte"),
    LESS_OR_EQUAL("<=", "lte"),
    EQUAL("==", "=", "eq"),
    NOT_EQUAL("!=", "neq"),
    BETWEEN("between");

    private static final double RELATIVE_TOLERANCE = 0.01;
    private static final double MINIMUM_TOLERANCE = 0.01;

    private final String symbol;
    private final Set<String> keys;

    ComparisonOperator(String symbol, String... aliases) {
        this.symbol = symbol;
        this.keys = aliasesWith(symbol, aliases);
    }

    private static Set<String> aliasesWith(String symbol, String... aliases) {
        String[] all = Arrays.copyOf(aliases, aliases.length + 1);
        all[aliases.length] = symbol;
        return Set.of(all);
    }

    public String symbol() {
        return symbol;
    }

    public static Optional<ComparisonOperator> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(operator -> operator.keys.contains(normalized))
                .findFirst();
    }

    /**
     * Whether {@code value <operator> reference} holds. Equality allows 1% of the reference,
     * and never less than 0.01.
     */
    public boolean holds(double value, double reference) {
        return switch (this) {
            case GREATER -> value > reference;
            case LESS -> value < reference;
            case GREATER_OR_EQUAL -> value >= reference;
            case LESS_OR_EQUAL -> value <= reference;
            case EQUAL -> Math.abs(value - reference) <= tolerance(reference);
            case NOT_EQUAL -> Math.abs(value - reference) > tolerance(reference);
            case BETWEEN -> throw new IllegalStateException("between compares against two bounds");
        };
    }

    /**
     * Text for a failed comparison, e.g. {@code 3.00 not > 5.0} or {@code 3.00 != 5.0}.
     */
    public String violation(String value, String reference) {
        return switch (this) {
            case EQUAL -> value + " != " + reference;
            case NOT_EQUAL -> value + " == " + reference;
            default -> value + " not " + symbol + " " + reference;
        };
    }

    static double tolerance(double reference) {
        return Math.max(Math.abs(reference) * RELATIVE_TOLERANCE, MINIMUM_TOLERANCE);
    }
}
