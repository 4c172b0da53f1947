package com.ulbaudit.audit.statistics;

import com.ulbaudit.audit.model.Bounds;
import com.ulbaudit.audit.model.BoundsResult;
import com.ulbaudit.audit.model.OutlierMethod;
import com.ulbaudit.audit.rules.InvalidRuleConfigurationException;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class BoundsCalculator {

    public BoundsResult bounds(List<Double> values, OutlierMethod method, double parameter) {
        if (method == null) {
            throw new InvalidRuleConfigurationException("outlier method is not configured");
        }
        if (Double.isNaN(parameter) || Double.isInfinite(parameter) || parameter < 0) {
            throw new InvalidRuleConfigurationException("sensitivity parameter must be a non-negative number, got " + parameter);
        }
        if (values.size() < method.minimumSampleSize()) {
            return BoundsResult.insufficient(method, values.size());
        }
        List<Double> sorted = values.stream().sorted().toList();
        return switch (method) {
            case IQR -> BoundsResult.of(Bounds.iqr(parameter, sorted.size(), percentile(sorted, 25), percentile(sorted, 75)));
            case Z_SCORE -> BoundsResult.of(zScore(sorted, parameter));
        };
    }

    /**
     * Sample standard deviation (N-1 divisor). Identical values give a zero deviation and bounds
     * collapsed onto that value.
     */
    private Bounds zScore(List<Double> sorted, double limit) {
        DoubleSummaryStatistics stats = sorted.stream().mapToDouble(Double::doubleValue).summaryStatistics();
        if (stats.getMin() == stats.getMax()) {
            return Bounds.zScore(limit, sorted.size(), stats.getMin(), 0d);
        }
        double mean = stats.getAverage();
        double sumOfSquares = sorted.stream()
                .mapToDouble(value -> Math.pow(value - mean, 2))
                .sum();
        double stdDev = Math.sqrt(sumOfSquares / (sorted.size() - 1));
        return Bounds.zScore(limit, sorted.size(), mean, stdDev);
    }

    /**
     * Linear interpolation between closest ranks, index = p/100 * (n-1).
     */
    static double percentile(List<Double> sortedValues, double percentile) {
        if (sortedValues.isEmpty()) {
            return 0d;
        }
        double index = percentile / 100.0 * (sortedValues.size() - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper || sortedValues.get(lower).equals(sortedValues.get(upper))) {
            return sortedValues.get(lower);
        }
        double weight = index - lower;
        return sortedValues.get(lower) * (1 - weight) + sortedValues.get(upper) * weight;
    }
}
