package com.ulbaudit.audit.statistics;

import com.ulbaudit.audit.model.AuditEntity;
import com.ulbaudit.audit.model.Bounds;
import com.ulbaudit.audit.model.Finding;
import com.ulbaudit.audit.model.OutlierFlag;
import com.ulbaudit.audit.model.OutlierMethod;
import com.ulbaudit.audit.model.RuleDefinition;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Packages a flag into a {@link Finding} whose narrative carries every number needed to re-derive
 * the flag: method, parameter, quartiles or mean/deviation, cohort and its size.
 */
@Component
public class FindingBuilder {

    static final String DEFAULT_TEMPLATE =
            "The calculated value for {entity} is {value}, which is {direction} than the expected bound of {bound} for {cohort}.";

    public Finding build(RuleDefinition rule, OutlierFlag flag, int cohortSize, AuditEntity entity) {
        Bounds bounds = flag.bounds();
        double crossed = bounds.boundFor(flag.side());
        String entityName = entity != null ? entity.displayName() : "ID" + flag.entityId();
        Optional<Double> zScore = bounds.zScoreOf(flag.value());

        String template = rule.narrativeTemplate() == null || rule.narrativeTemplate().isBlank()
                ? DEFAULT_TEMPLATE
                : rule.narrativeTemplate();
        Map<String, String> placeholders = Map.of(
                "{entity}", entityName,
                "{value}", format(flag.value()),
                "{bound}", format(crossed),
                "{position}", flag.side().position(),
                "{direction}", flag.side().direction(),
                "{cohort}", flag.cohortName(),
                "{n}", Integer.toString(cohortSize)
        );
        String headline = template;
        for (Map.Entry<String, String> placeholder : placeholders.entrySet()) {
            headline = headline.replace(placeholder.getKey(), placeholder.getValue());
        }

        StringBuilder narrative = new StringBuilder(headline)
                .append(' ')
                .append(detail(flag, crossed, cohortSize, zScore));
        if (rule.statisticalContext() != null && !rule.statisticalContext().isBlank()) {
            narrative.append(" | Context: ").append(rule.statisticalContext().trim());
        }

        return new Finding(
                rule.id(),
                flag.entityId(),
                entityName,
                entity != null ? entity.district() : Optional.empty(),
                rule.part(),
                rule.severity(),
                rule.description(),
                flag.value(),
                bounds,
                flag.side(),
                zScore,
                flag.cohortName(),
                cohortSize,
                narrative.toString()
        );
    }

    private String detail(OutlierFlag flag, double crossed, int cohortSize, Optional<Double> zScore) {
        Bounds bounds = flag.bounds();
        StringBuilder detail = new StringBuilder()
                .append("Value ").append(format(flag.value()))
                .append(" is ").append(flag.side().position())
                .append(' ').append(format(crossed))
                .append(" (");
        if (bounds.method() == OutlierMethod.IQR) {
            detail.append("IQR method, multiplier=").append(bounds.parameter())
                    .append(", Q1=").append(format(bounds.q1()))
                    .append(", Q3=").append(format(bounds.q3()))
                    .append(", IQR=").append(format(bounds.iqr()));
        } else {
            detail.append("Z-score method, z=").append(format(zScore.orElse(0d)))
                    .append(", limit=").append(bounds.parameter())
                    .append(", mean=").append(format(bounds.mean()))
                    .append(", std=").append(format(bounds.standardDeviation()));
        }
        return detail.append(", peer group: ").append(flag.cohortName())
                .append(", N=").append(cohortSize)
                .append(')')
                .toString();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
