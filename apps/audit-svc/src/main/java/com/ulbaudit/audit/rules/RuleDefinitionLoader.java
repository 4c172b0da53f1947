package com.ulbaudit.audit.rules;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ulbaudit.audit.config.AuditProperties;
import com.ulbaudit.audit.model.CalculationKind;
import com.ulbaudit.audit.model.CheckKind;
import com.ulbaudit.audit.model.CheckRule;
import com.ulbaudit.audit.model.ComparisonOperator;
import com.ulbaudit.audit.model.OutlierMethod;
import com.ulbaudit.audit.model.PeerGrouping;
import com.ulbaudit.audit.model.RuleDefinition;
import com.ulbaudit.audit.model.Severity;
import com.ulbaudit.audit.model.Threshold;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns exported rule rows into {@link RuleDefinition}s and {@link CheckRule}s. String keys for
 * method, grouping, calculation and operator are resolved here, once per rule.
 */
@Component
public class RuleDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleDefinitionLoader.class);
    private static final int DEFAULT_CAGR_YEARS = 14;

    public record RuleLoadFailure(String ruleId, String reason) {
    }

    public record LoadedRules(List<RuleDefinition> rules, List<CheckRule> checks, List<RuleLoadFailure> failures) {

        public static LoadedRules empty() {
            return new LoadedRules(List.of(), List.of(), List.of());
        }
    }

    private final ObjectMapper objectMapper;
    private final AuditProperties.Statistics defaults;

    public RuleDefinitionLoader(ObjectMapper objectMapper, AuditProperties properties) {
        this.objectMapper = objectMapper;
        this.defaults = properties.statistics();
    }

    public LoadedRules load(InputStream json) throws IOException {
        List<RuleDocument> documents = objectMapper.readValue(json, new TypeReference<List<RuleDocument>>() {
        });
        return fromDocuments(documents);
    }

    public LoadedRules fromDocuments(List<RuleDocument> documents) {
        List<RuleDefinition> rules = new ArrayList<>();
        List<CheckRule> checks = new ArrayList<>();
        List<RuleLoadFailure> failures = new ArrayList<>();
        int disabled = 0;
        for (RuleDocument document : documents) {
            if (!document.enabledFlag()) {
                disabled++;
                continue;
            }
            String ruleId = document.checkpointId() == null ? "<unnamed>" : document.checkpointId().trim();
            try {
                if (OutlierMethod.isStatistical(document.validationType())) {
                    rules.add(toDefinition(document));
                } else {
                    checks.add(toCheck(document));
                }
            } catch (InvalidRuleConfigurationException | IllegalArgumentException ex) {
                log.error("Rule {} rejected: {}", ruleId, ex.getMessage());
                failures.add(new RuleLoadFailure(ruleId, ex.getMessage()));
            }
        }
        log.info("Rule catalog: {} statistical rules, {} validation checks, {} rejected, {} disabled",
                rules.size(), checks.size(), failures.size(), disabled);
        return new LoadedRules(List.copyOf(rules), List.copyOf(checks), List.copyOf(failures));
    }

    public RuleDefinition toDefinition(RuleDocument document) {
        OutlierMethod method = OutlierMethod.fromValidationType(document.validationType())
                .orElseThrow(() -> new InvalidRuleConfigurationException(
                        "unknown outlier method '" + document.validationType() + "'"));
        PeerGrouping.Mode mode = PeerGrouping.Mode.fromKey(document.peerGroupBy())
                .orElseThrow(() -> new InvalidRuleConfigurationException(
                        "unknown peer grouping '" + document.peerGroupBy() + "'"));
        CalculationKind kind = CalculationKind.fromKey(document.calculationType())
                .orElseThrow(() -> new InvalidRuleConfigurationException(
                        "unknown calculation type '" + document.calculationType() + "'"));
        return new RuleDefinition(
                document.checkpointId() == null ? null : document.checkpointId().trim(),
                document.description(),
                document.part(),
                Severity.fromLabel(document.severity()),
                kind,
                Arrays.asList(document.column1(), document.column2(), document.column3(), document.column4()),
                tableName(document.primaryTable()),
                document.multiPartFlag() ? tableName(document.referenceTable()) : null,
                new PeerGrouping(mode, document.peerPopulationMin(), document.peerPopulationMax()),
                method,
                sensitivity(method, document),
                document.narrative(),
                document.statisticalContext(),
                years(document.timePeriod())
        );
    }

    public CheckRule toCheck(RuleDocument document) {
        CheckKind kind = CheckKind.fromValidationType(document.validationType())
                .orElseThrow(() -> new InvalidRuleConfigurationException(
                        "unknown validation type '" + document.validationType() + "'"));
        CalculationKind calculation = CalculationKind.fromKey(document.calculationType())
                .orElseThrow(() -> new InvalidRuleConfigurationException(
                        "unknown calculation type '" + document.calculationType() + "'"));
        Optional<ComparisonOperator> configured = Optional.ofNullable(document.operator())
                .filter(key -> !key.isBlank())
                .map(key -> ComparisonOperator.fromKey(key)
                        .orElseThrow(() -> new InvalidRuleConfigurationException("unknown operator '" + key + "'")));
        ComparisonOperator operator;
        Threshold threshold = null;
        if (kind == CheckKind.THRESHOLD) {
            operator = configured.orElseThrow(() -> new InvalidRuleConfigurationException("operator is not configured"));
            threshold = threshold(operator, document.threshold());
        } else {
            operator = configured.orElse(ComparisonOperator.EQUAL);
            if (operator == ComparisonOperator.BETWEEN) {
                throw new InvalidRuleConfigurationException("operator 'between' applies to threshold checks only");
            }
        }
        if (tableName(document.primaryTable()) == null) {
            throw new InvalidRuleConfigurationException("primary table is not configured");
        }
        if (document.column1() == null || document.column1().isBlank()) {
            throw new InvalidRuleConfigurationException("column_1 is not configured");
        }
        String reference = tableName(document.referenceTable());
        if (kind == CheckKind.CROSS_TABLE && reference == null) {
            throw new InvalidRuleConfigurationException("cross_table check needs a reference_table");
        }
        return new CheckRule(
                document.checkpointId() == null ? null : document.checkpointId().trim(),
                document.description(),
                document.part(),
                Severity.fromLabel(document.severity()),
                kind,
                calculation,
                Arrays.asList(document.column1(), document.column2(), document.column3(), document.column4()),
                tableName(document.primaryTable()),
                kind == CheckKind.CROSS_TABLE || document.multiPartFlag() ? reference : null,
                operator,
                threshold,
                years(document.timePeriod())
        );
    }

    private Threshold threshold(ComparisonOperator operator, String configured) {
        if (configured == null || configured.isBlank()) {
            throw new InvalidRuleConfigurationException("threshold is not configured");
        }
        try {
            if (operator == ComparisonOperator.BETWEEN) {
                String[] bounds = configured.split("\\|");
                if (bounds.length != 2) {
                    throw new InvalidRuleConfigurationException("between threshold must read lower|upper, got '" + configured + "'");
                }
                return Threshold.between(Double.parseDouble(bounds[0].trim()), Double.parseDouble(bounds[1].trim()));
            }
            return Threshold.of(operator, Double.parseDouble(configured.trim()));
        } catch (NumberFormatException ex) {
            throw new InvalidRuleConfigurationException("threshold '" + configured + "' is not a number");
        }
    }

    /**
     * Workbook tables are named after export files ({@code mp_270126_p1_1_1_2}); partitions drop the prefix.
     */
    static String tableName(String table) {
        if (table == null || table.isBlank()) {
            return null;
        }
        String trimmed = table.trim();
        if (trimmed.startsWith("mp_")) {
            String[] parts = trimmed.split("_");
            if (parts.length > 2) {
                return String.join("_", Arrays.copyOfRange(parts, 2, parts.length));
            }
        }
        return trimmed;
    }

    private double sensitivity(OutlierMethod method, RuleDocument document) {
        Double configured = method == OutlierMethod.IQR ? document.iqrMultiplier() : document.stddevLimit();
        if (configured != null) {
            return configured;
        }
        return method == OutlierMethod.IQR ? defaults.defaultIqrMultiplier() : defaults.defaultZScoreLimit();
    }

    private Integer years(String timePeriod) {
        if (timePeriod == null || timePeriod.isBlank()) {
            return DEFAULT_CAGR_YEARS;
        }
        String digits = timePeriod.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            return DEFAULT_CAGR_YEARS;
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException ex) {
            return DEFAULT_CAGR_YEARS;
        }
    }
}
