package com.ulbaudit.audit.support;

import com.ulbaudit.audit.config.AuditProperties;
import com.ulbaudit.audit.model.AuditEntity;
import com.ulbaudit.audit.model.CalculationKind;
import com.ulbaudit.audit.model.CheckKind;
import com.ulbaudit.audit.model.CheckRule;
import com.ulbaudit.audit.model.ComparisonOperator;
import com.ulbaudit.audit.model.OutlierMethod;
import com.ulbaudit.audit.model.PartitionRow;
import com.ulbaudit.audit.model.PeerGrouping;
import com.ulbaudit.audit.model.RuleDefinition;
import com.ulbaudit.audit.model.Severity;
import com.ulbaudit.audit.model.Threshold;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class Fixtures {

    public static final String PROFILE = "p1";

    private Fixtures() {
    }

    public static AuditProperties properties() {
        return new AuditProperties(
                new AuditProperties.Data(null, PROFILE, "mp_id", "municipality_name", "district_name", "population"),
                new AuditProperties.Rules("classpath:rules/audit-rules.json"),
                null,
                null
        );
    }

    public static AuditEntity entity(String id, String name, String district, Double population) {
        return new AuditEntity(id, name, Optional.ofNullable(district), Optional.ofNullable(population));
    }

    /**
     * Row from alternating column/value pairs.
     */
    public static PartitionRow row(String entityId, String... columnsAndValues) {
        Map<String, String> cells = new LinkedHashMap<>();
        for (int i = 0; i + 1 < columnsAndValues.length; i += 2) {
            cells.put(columnsAndValues[i], columnsAndValues[i + 1]);
        }
        return new PartitionRow(entityId, cells);
    }

    public static RuleBuilder rule(String id) {
        return new RuleBuilder(id);
    }

    /**
     * Threshold check {@code metric > 0} on the profile partition unless configured otherwise.
     */
    public static CheckBuilder check(String id) {
        return new CheckBuilder(id);
    }

    public static final class CheckBuilder {
        private final String id;
        private CheckKind kind = CheckKind.THRESHOLD;
        private CalculationKind calculation = CalculationKind.DIRECT;
        private List<String> columns = List.of("metric");
        private String primary = PROFILE;
        private String reference;
        private ComparisonOperator operator;
        private Threshold threshold = Threshold.of(ComparisonOperator.GREATER, 0d);
        private String description;
        private Severity severity = Severity.HIGH;

        private CheckBuilder(String id) {
            this.id = id;
        }

        public CheckBuilder kind(CheckKind kind) {
            this.kind = kind;
            if (kind != CheckKind.THRESHOLD) {
                this.threshold = null;
            }
            return this;
        }

        public CheckBuilder calculation(CalculationKind calculation) {
            this.calculation = calculation;
            return this;
        }

        public CheckBuilder columns(String... columns) {
            this.columns = Arrays.asList(columns);
            return this;
        }

        public CheckBuilder primary(String primary) {
            this.primary = primary;
            return this;
        }

        public CheckBuilder reference(String reference) {
            this.reference = reference;
            return this;
        }

        public CheckBuilder operator(ComparisonOperator operator) {
            this.operator = operator;
            return this;
        }

        public CheckBuilder threshold(Threshold threshold) {
            this.threshold = threshold;
            this.operator = threshold.operator();
            return this;
        }

        public CheckBuilder description(String description) {
            this.description = description;
            return this;
        }

        public CheckBuilder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public CheckRule build() {
            return new CheckRule(id, description == null ? "check " + id : description, "1", severity, kind, calculation,
                    columns, primary, reference, operator, threshold, 14);
        }
    }

    public static final class RuleBuilder {
        private final String id;
        private CalculationKind kind = CalculationKind.DIRECT;
        private List<String> columns = List.of("metric");
        private String primary = PROFILE;
        private String reference;
        private PeerGrouping grouping = PeerGrouping.statewide();
        private OutlierMethod method = OutlierMethod.IQR;
        private Double sensitivity;
        private String narrative;
        private String context;
        private Severity severity = Severity.MEDIUM;

        private RuleBuilder(String id) {
            this.id = id;
        }

        public RuleBuilder kind(CalculationKind kind) {
            this.kind = kind;
            return this;
        }

        public RuleBuilder columns(String... columns) {
            this.columns = Arrays.asList(columns);
            return this;
        }

        public RuleBuilder primary(String primary) {
            this.primary = primary;
            return this;
        }

        public RuleBuilder reference(String reference) {
            this.reference = reference;
            return this;
        }

        public RuleBuilder grouping(PeerGrouping grouping) {
            this.grouping = grouping;
            return this;
        }

        public RuleBuilder method(OutlierMethod method, Double sensitivity) {
            this.method = method;
            this.sensitivity = sensitivity;
            return this;
        }

        public RuleBuilder narrative(String narrative) {
            this.narrative = narrative;
            return this;
        }

        public RuleBuilder context(String context) {
            this.context = context;
            return this;
        }

        public RuleBuilder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public RuleDefinition build() {
            return new RuleDefinition(id, "check " + id, "1", severity, kind, columns, primary, reference,
                    grouping, method, sensitivity, narrative, context, 14);
        }
    }
}
