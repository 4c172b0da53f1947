package com.ulbaudit.audit.statistics;

import com.ulbaudit.audit.data.AuditDataProvider;
import com.ulbaudit.audit.model.CalculationKind;
import com.ulbaudit.audit.model.MetricFormula;
import com.ulbaudit.audit.model.MetricValue;
import com.ulbaudit.audit.model.PartitionRow;
import com.ulbaudit.audit.model.RuleDefinition;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Computes the scalar a statistical rule compares across peers. Data faults never raise: they
 * yield an undefined {@link MetricValue} naming the cause.
 */
@Component
public class MetricCollector {

    public static final String DIVISION_BY_ZERO = "division by zero";
    public static final String NON_NUMERIC = "non-numeric";

    private static final int MAX_SUM_COLUMNS = 4;

    private final AuditDataProvider dataProvider;

    public MetricCollector(AuditDataProvider dataProvider) {
        this.dataProvider = dataProvider;
    }

    public Map<String, MetricValue> collect(RuleDefinition rule, List<String> entityIds) {
        Map<String, MetricValue> metrics = new LinkedHashMap<>();
        for (String entityId : entityIds) {
            metrics.put(entityId, collectFor(rule, entityId));
        }
        return metrics;
    }

    MetricValue collectFor(RuleDefinition rule, String entityId) {
        List<PartitionRow> primary = dataProvider.findRows(rule.primaryPartition(), entityId);
        if (primary.isEmpty()) {
            return MetricValue.undefined("no rows in partition " + rule.primaryPartition());
        }
        List<List<PartitionRow>> rows = List.of(primary);
        if (rule.isMultiPart()) {
            List<PartitionRow> reference = dataProvider.findRows(rule.referencePartition(), entityId);
            if (reference.isEmpty()) {
                return MetricValue.undefined("join failed: no rows in partition " + rule.referencePartition());
            }
            rows = List.of(primary, reference);
        }
        return compute(rule, rows);
    }

    /**
     * Computes a metric over row sources searched in order. A defined result is always finite.
     */
    public MetricValue compute(MetricFormula formula, List<List<PartitionRow>> sources) {
        CalculationKind kind = formula.calculationKind() == null ? CalculationKind.DIRECT : formula.calculationKind();
        MetricValue value = switch (kind) {
            case DIRECT -> resolve(formula, 0, sources);
            case RATIO -> divide(formula, sources, 1d);
            case PERCENTAGE -> divide(formula, sources, 100d);
            case SUM -> sum(formula, sources);
            case DIFFERENCE -> difference(formula, sources);
            case GROWTH_RATE -> growthRate(formula, sources);
            case CAGR -> cagr(formula, sources);
        };
        if (value.isDefined() && !Double.isFinite(value.asDouble())) {
            return MetricValue.undefined("result is not a finite number");
        }
        return value;
    }

    /**
     * Resolves one column reference (constant, column or comma-separated columns) against row sources.
     */
    public MetricValue resolveColumn(String reference, List<List<PartitionRow>> sources) {
        if (reference == null || reference.isBlank()) {
            return MetricValue.undefined("column is not configured");
        }
        MetricValue value = ColumnReference.resolve(reference, sources);
        if (value.isDefined() && !Double.isFinite(value.asDouble())) {
            return MetricValue.undefined("result is not a finite number");
        }
        return value;
    }

    private MetricValue divide(MetricFormula formula, List<List<PartitionRow>> rows, double scale) {
        MetricValue numerator = resolve(formula, 0, rows);
        if (!numerator.isDefined()) {
            return MetricValue.undefined("numerator: " + numerator.missingReason());
        }
        MetricValue denominator = resolve(formula, 1, rows);
        if (!denominator.isDefined()) {
            return MetricValue.undefined("denominator: " + denominator.missingReason());
        }
        if (denominator.asDouble() == 0d) {
            return MetricValue.undefined(DIVISION_BY_ZERO);
        }
        return MetricValue.of(numerator.asDouble() / denominator.asDouble() * scale);
    }

    private MetricValue sum(MetricFormula formula, List<List<PartitionRow>> rows) {
        double total = 0d;
        int used = 0;
        for (int index = 0; index < MAX_SUM_COLUMNS; index++) {
            if (formula.column(index).isEmpty()) {
                continue;
            }
            MetricValue value = resolve(formula, index, rows);
            if (!value.isDefined()) {
                return MetricValue.undefined("column_" + (index + 1) + ": " + value.missingReason());
            }
            total += value.asDouble();
            used++;
        }
        return used == 0 ? MetricValue.undefined("no columns specified for sum") : MetricValue.of(total);
    }

    private MetricValue difference(MetricFormula formula, List<List<PartitionRow>> rows) {
        MetricValue first = resolve(formula, 0, rows);
        if (!first.isDefined()) {
            return MetricValue.undefined("first value: " + first.missingReason());
        }
        MetricValue second = resolve(formula, 1, rows);
        if (!second.isDefined()) {
            return MetricValue.undefined("second value: " + second.missingReason());
        }
        return MetricValue.of(first.asDouble() - second.asDouble());
    }

    private MetricValue growthRate(MetricFormula formula, List<List<PartitionRow>> rows) {
        MetricValue finalValue = resolve(formula, 0, rows);
        MetricValue initialValue = resolve(formula, 1, rows);
        if (!finalValue.isDefined() || !initialValue.isDefined()) {
            return MetricValue.undefined("growth inputs missing");
        }
        if (initialValue.asDouble() == 0d) {
            return MetricValue.undefined(DIVISION_BY_ZERO + ": initial value is zero");
        }
        return MetricValue.of((finalValue.asDouble() - initialValue.asDouble()) / initialValue.asDouble() * 100d);
    }

    private MetricValue cagr(MetricFormula formula, List<List<PartitionRow>> rows) {
        MetricValue finalValue = resolve(formula, 0, rows);
        MetricValue initialValue = resolve(formula, 1, rows);
        if (!finalValue.isDefined() || !initialValue.isDefined()) {
            return MetricValue.undefined("growth inputs missing");
        }
        if (finalValue.asDouble() <= 0d || initialValue.asDouble() <= 0d) {
            return MetricValue.undefined("values must be positive for CAGR");
        }
        int years = formula.timePeriodYears() == null || formula.timePeriodYears() <= 0 ? 14 : formula.timePeriodYears();
        return MetricValue.of((Math.pow(finalValue.asDouble() / initialValue.asDouble(), 1d / years) - 1d) * 100d);
    }

    private MetricValue resolve(MetricFormula formula, int index, List<List<PartitionRow>> rows) {
        return formula.column(index)
                .map(reference -> ColumnReference.resolve(reference, rows))
                .orElseGet(() -> MetricValue.undefined("column_" + (index + 1) + " is not configured"));
    }

    /**
     * Resolution of a single column reference against an entity's rows. A reference is a numeric
     * constant, a column name, or a comma-separated list of column names that are added up.
     * Sources are searched in order and the first partition holding the column wins; cells of one
     * column over several rows are summed and blank cells are skipped.
     */
    static final class ColumnReference {

        private ColumnReference() {
        }

        static MetricValue resolve(String reference, List<List<PartitionRow>> sources) {
            String trimmed = reference.trim();
            try {
                double constant = Double.parseDouble(trimmed);
                if (Double.isFinite(constant)) {
                    return MetricValue.of(constant);
                }
            } catch (NumberFormatException ignored) {
                // not a constant, read it as column names
            }
            if (!trimmed.contains(",")) {
                return column(trimmed, sources);
            }
            double total = 0d;
            List<String> missing = new ArrayList<>();
            for (String name : trimmed.split(",")) {
                MetricValue value = column(name.trim(), sources);
                if (!value.isDefined()) {
                    if (value.missingReason().contains(NON_NUMERIC)) {
                        return value;
                    }
                    missing.add(name.trim());
                    continue;
                }
                total += value.asDouble();
            }
            if (!missing.isEmpty()) {
                return MetricValue.undefined("missing columns: " + String.join(", ", missing));
            }
            return MetricValue.of(total);
        }

        private static MetricValue column(String name, List<List<PartitionRow>> sources) {
            for (List<PartitionRow> rows : sources) {
                if (rows.stream().anyMatch(row -> row.hasColumn(name))) {
                    return sumColumn(name, rows);
                }
            }
            return MetricValue.undefined("column '" + name + "' not found");
        }

        private static MetricValue sumColumn(String name, List<PartitionRow> rows) {
            boolean anyValue = false;
            double total = 0d;
            for (PartitionRow row : rows) {
                String cell = row.cell(name).orElse(null);
                if (cell == null) {
                    continue;
                }
                double parsed;
                try {
                    parsed = Double.parseDouble(cell.replace(",", ""));
                } catch (NumberFormatException ex) {
                    return MetricValue.undefined("column '" + name + "' contains " + NON_NUMERIC + " data");
                }
                // NaN and Infinity literals count as blank cells
                if (Double.isFinite(parsed)) {
                    total += parsed;
                    anyValue = true;
                }
            }
            return anyValue ? MetricValue.of(total) : MetricValue.undefined("column '" + name + "' has only null values");
        }
    }
}
