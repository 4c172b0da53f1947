package com.ulbaudit.audit.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Expected value of a threshold check. {@code upper} is set only for {@link ComparisonOperator#BETWEEN},
 * whose range is inclusive at both ends.
 */
public record Threshold(ComparisonOperator operator, double value, Double upper) {

    public Threshold {
        if (operator == null) {
            throw new IllegalArgumentException("operator must be provided");
        }
        if (!Double.isFinite(value) || (upper != null && !Double.isFinite(upper))) {
            throw new IllegalArgumentException("threshold must be a finite number");
        }
        if (operator == ComparisonOperator.BETWEEN) {
            if (upper == null || upper < value) {
                throw new IllegalArgumentException("between needs lower|upper with lower <= upper");
            }
        } else if (upper != null) {
            throw new IllegalArgumentException("only between takes an upper bound");
        }
    }

    public static Threshold of(ComparisonOperator operator, double value) {
        return new Threshold(operator, value, null);
    }

    public static Threshold between(double lower, double upper) {
        return new Threshold(ComparisonOperator.BETWEEN, lower, upper);
    }

    /**
     * Describes how {@code actual} misses the threshold, empty when it meets it.
     */
    public Optional<String> violation(double actual) {
        String shown = String.format(Locale.ROOT, "%.2f", actual);
        if (operator == ComparisonOperator.BETWEEN) {
            return value <= actual && actual <= upper
                    ? Optional.empty()
                    : Optional.of(shown + " not in range [" + value + ", " + upper + "]");
        }
        return operator.holds(actual, value)
                ? Optional.empty()
                : Optional.of(operator.violation(shown, Double.toString(value)));
    }

    public String describe() {
        return operator == ComparisonOperator.BETWEEN
                ? "between " + value + " and " + upper
                : operator.symbol() + " " + value;
    }
}
