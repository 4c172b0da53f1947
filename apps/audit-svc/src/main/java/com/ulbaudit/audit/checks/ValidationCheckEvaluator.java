package com.ulbaudit.audit.checks;

import com.ulbaudit.audit.data.AuditDataProvider;
import com.ulbaudit.audit.data.DataProviderUnavailableException;
import com.ulbaudit.audit.model.AuditEntity;
import com.ulbaudit.audit.model.CalculationKind;
import com.ulbaudit.audit.model.CheckFinding;
import com.ulbaudit.audit.model.CheckRule;
import com.ulbaudit.audit.model.MetricValue;
import com.ulbaudit.audit.model.PartitionRow;
import com.ulbaudit.audit.model.RuleEvaluation;
import com.ulbaudit.audit.model.Severity;
import com.ulbaudit.audit.statistics.MetricCollector;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Evaluates one validation check against every entity on its own: threshold, consistency,
 * completeness and cross-table comparisons. Division by zero makes a check not applicable to an
 * entity and non-numeric cells skip it; other data faults become error findings.
 */
@Service
public class ValidationCheckEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ValidationCheckEvaluator.class);
    private static final LocalDate SPREADSHEET_EPOCH = LocalDate.of(1899, 12, 30);
    private static final double SERIAL_DATE_MIN = 30000d;
    private static final double SERIAL_DATE_MAX = 60000d;

    private final AuditDataProvider dataProvider;
    private final MetricCollector metricCollector;

    public ValidationCheckEvaluator(AuditDataProvider dataProvider, MetricCollector metricCollector) {
        this.dataProvider = dataProvider;
        this.metricCollector = metricCollector;
    }

    public RuleEvaluation evaluate(CheckRule rule) {
        try {
            return evaluateChecked(rule);
        } catch (DataProviderUnavailableException ex) {
            throw ex.forRule(rule.id());
        }
    }

    private RuleEvaluation evaluateChecked(CheckRule rule) {
        List<CheckFinding> findings = new ArrayList<>();
        int checked = 0;
        int notApplicable = 0;
        int nonNumeric = 0;
        int errors = 0;
        for (String entityId : dataProvider.getAllEntityIds()) {
            List<PartitionRow> primary = dataProvider.findRows(rule.primaryPartition(), entityId);
            if (primary.isEmpty()) {
                notApplicable++;
                continue;
            }
            Outcome outcome = switch (rule.kind()) {
                case THRESHOLD -> threshold(rule, entityId, primary);
                case CONSISTENCY -> consistency(rule, primary);
                case COMPLETENESS -> completeness(rule, primary);
                case CROSS_TABLE -> crossTable(rule, entityId, primary);
            };
            switch (outcome.state()) {
                case NOT_APPLICABLE -> notApplicable++;
                case NON_NUMERIC -> {
                    nonNumeric++;
                    notApplicable++;
                }
                case PASSED -> checked++;
                case VIOLATED, ERROR -> {
                    checked++;
                    if (outcome.state() == State.ERROR) {
                        errors++;
                    }
                    findings.add(finding(rule, entityId, outcome));
                }
            }
        }

        if (nonNumeric > 0) {
            log.warn("Check {}: skipped {} entities with non-numeric data", rule.id(), nonNumeric);
        }
        if (checked == 0) {
            String reason = "no entity could be checked against partition " + rule.primaryPartition();
            log.warn("Check {} skipped: {} (notApplicable={})", rule.id(), reason, notApplicable);
            return RuleEvaluation.skipped(rule.id(), 0, notApplicable, reason);
        }
        log.info("Check {} evaluated: kind={} entities={} notApplicable={} findings={} errors={}",
                rule.id(), rule.kind(), checked, notApplicable, findings.size(), errors);
        return RuleEvaluation.checked(rule.id(), findings, notApplicable);
    }

    private Outcome threshold(CheckRule rule, String entityId, List<PartitionRow> primary) {
        MetricValue value;
        String source;
        if (rule.calculationKind() == CalculationKind.DIRECT) {
            value = metricCollector.resolveColumn(rule.column(0).orElse(null), List.of(primary));
            source = "column " + rule.column(0).orElse("column_1");
        } else {
            value = metricCollector.compute(rule, List.of(primary));
            source = rule.calculationKind().name().toLowerCase(Locale.ROOT) + " calculation";
            if (!value.isDefined() && rule.hasReference()) {
                // second operand may live in the reference partition
                List<PartitionRow> reference = dataProvider.findRows(rule.referencePartition(), entityId);
                if (!reference.isEmpty()) {
                    value = metricCollector.compute(rule, List.of(primary, reference));
                }
            }
        }
        Optional<Outcome> unusable = unusable("Unable to evaluate", value);
        if (unusable.isPresent()) {
            return unusable.get();
        }
        double actual = normalizeYear(rule, value.asDouble());
        return rule.threshold().violation(actual)
                .map(detail -> Outcome.violated(source + ": " + detail, actual))
                .orElseGet(Outcome::passed);
    }

    private Outcome consistency(CheckRule rule, List<PartitionRow> primary) {
        List<List<PartitionRow>> sources = List.of(primary);
        MetricValue first = metricCollector.resolveColumn(rule.column(0).orElse(null), sources);
        Optional<Outcome> unusable = unusable("Column 1", first);
        if (unusable.isPresent()) {
            return unusable.get();
        }
        MetricValue second = metricCollector.resolveColumn(rule.column(1).orElse(null), sources);
        unusable = unusable("Column 2", second);
        if (unusable.isPresent()) {
            return unusable.get();
        }
        double expected = second.asDouble();
        if (rule.calculationKind() == CalculationKind.DIFFERENCE && rule.column(2).isPresent()) {
            MetricValue subtrahend = metricCollector.resolveColumn(rule.column(2).get(), sources);
            unusable = unusable("Column 3", subtrahend);
            if (unusable.isPresent()) {
                return unusable.get();
            }
            expected -= subtrahend.asDouble();
        }
        double actual = first.asDouble();
        if (rule.operator().holds(actual, expected)) {
            return Outcome.passed();
        }
        return Outcome.violated("Consistency: " + rule.operator().violation(format(actual), format(expected)), actual);
    }

    private Outcome completeness(CheckRule rule, List<PartitionRow> primary) {
        List<String> missing = new ArrayList<>();
        for (String column : rule.column(0).orElse("").split(",")) {
            String name = column.trim();
            if (!name.isEmpty() && !isPresent(name, primary)) {
                missing.add(name);
            }
        }
        return missing.isEmpty() ? Outcome.passed() : Outcome.violated("Missing/zero: " + String.join(", ", missing), null);
    }

    private Outcome crossTable(CheckRule rule, String entityId, List<PartitionRow> primary) {
        List<PartitionRow> reference = dataProvider.findRows(rule.referencePartition(), entityId);
        if (reference.isEmpty()) {
            return Outcome.notApplicable();
        }
        String primaryColumn = rule.column(0).orElse(null);
        String referenceColumn = rule.column(1).orElse(null);
        MetricValue first = metricCollector.resolveColumn(primaryColumn, List.of(primary));
        Optional<Outcome> unusable = unusable("Primary", first);
        if (unusable.isPresent()) {
            return unusable.get();
        }
        MetricValue second = metricCollector.resolveColumn(referenceColumn, List.of(reference));
        unusable = unusable("Reference", second);
        if (unusable.isPresent()) {
            return unusable.get();
        }
        if (rule.operator().holds(first.asDouble(), second.asDouble())) {
            return Outcome.passed();
        }
        return Outcome.violated(String.format(Locale.ROOT,
                "Cross-table mismatch: primary column '%s' = %s, reference column '%s' = %s",
                primaryColumn, format(first.asDouble()), referenceColumn, format(second.asDouble())), first.asDouble());
    }

    /**
     * A column counts as present when some row carries a non-zero value or any non-numeric text.
     */
    private boolean isPresent(String column, List<PartitionRow> rows) {
        for (PartitionRow row : rows) {
            Optional<String> cell = row.cell(column);
            if (cell.isEmpty()) {
                continue;
            }
            try {
                double parsed = Double.parseDouble(cell.get().replace(",", ""));
                if (Double.isFinite(parsed) && parsed != 0d) {
                    return true;
                }
            } catch (NumberFormatException ex) {
                return true;
            }
        }
        return false;
    }

    private Optional<Outcome> unusable(String label, MetricValue value) {
        if (value.isDefined()) {
            return Optional.empty();
        }
        String reason = value.missingReason();
        if (reason.contains(MetricCollector.DIVISION_BY_ZERO)) {
            return Optional.of(Outcome.notApplicable());
        }
        if (reason.contains(MetricCollector.NON_NUMERIC)) {
            return Optional.of(Outcome.nonNumeric());
        }
        return Optional.of(Outcome.error(label + ": " + reason));
    }

    /**
     * Year columns exported as spreadsheet serial dates are compared as calendar years.
     */
    private double normalizeYear(CheckRule rule, double value) {
        boolean yearColumn = rule.column(0).map(column -> column.toLowerCase(Locale.ROOT).contains("year")).orElse(false)
                || (rule.description() != null && rule.description().toLowerCase(Locale.ROOT).contains("year"));
        if (!yearColumn || value < SERIAL_DATE_MIN || value > SERIAL_DATE_MAX) {
            return value;
        }
        return SPREADSHEET_EPOCH.plusDays((long) value).getYear();
    }

    private CheckFinding finding(CheckRule rule, String entityId, Outcome outcome) {
        Optional<AuditEntity> entity = dataProvider.findEntity(entityId);
        boolean error = outcome.state() == State.ERROR;
        return new CheckFinding(
                rule.id(),
                entityId,
                entity.map(AuditEntity::displayName).orElse("ID" + entityId),
                entity.flatMap(AuditEntity::district),
                rule.part(),
                error ? Severity.MEDIUM : rule.severity(),
                rule.kind(),
                rule.description(),
                outcome.detail(),
                Optional.ofNullable(outcome.value()),
                error
        );
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private enum State {
        PASSED,
        VIOLATED,
        ERROR,
        NOT_APPLICABLE,
        NON_NUMERIC
    }

    private record Outcome(State state, String detail, Double value) {

        static Outcome passed() {
            return new Outcome(State.PASSED, null, null);
        }

        static Outcome violated(String detail, Double value) {
            return new Outcome(State.VIOLATED, detail, value);
        }

        static Outcome error(String detail) {
            return new Outcome(State.ERROR, detail, null);
        }

        static Outcome notApplicable() {
            return new Outcome(State.NOT_APPLICABLE, null, null);
        }

        static Outcome nonNumeric() {
            return new Outcome(State.NON_NUMERIC, null, null);
        }
    }
}
