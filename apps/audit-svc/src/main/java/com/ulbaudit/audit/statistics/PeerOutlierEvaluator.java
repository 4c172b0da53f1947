package com.ulbaudit.audit.statistics;

import com.ulbaudit.audit.data.AuditDataProvider;
import com.ulbaudit.audit.data.DataProviderUnavailableException;
import com.ulbaudit.audit.model.Bounds;
import com.ulbaudit.audit.model.BoundsResult;
import com.ulbaudit.audit.model.Cohort;
import com.ulbaudit.audit.model.Finding;
import com.ulbaudit.audit.model.MetricValue;
import com.ulbaudit.audit.model.OutlierFlag;
import com.ulbaudit.audit.model.RuleDefinition;
import com.ulbaudit.audit.model.RuleEvaluation;
import com.ulbaudit.audit.rules.InvalidRuleConfigurationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Evaluates one statistical rule: collect metrics, group peers, bound each cohort, flag and build
 * findings. Faults degrade to an empty contribution; only an unavailable data provider escapes,
 * tagged with the rule being evaluated.
 */
@Service
public class PeerOutlierEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PeerOutlierEvaluator.class);

    private final AuditDataProvider dataProvider;
    private final MetricCollector metricCollector;
    private final PeerGrouper peerGrouper;
    private final BoundsCalculator boundsCalculator;
    private final OutlierEvaluator outlierEvaluator;
    private final FindingBuilder findingBuilder;

    public PeerOutlierEvaluator(
            AuditDataProvider dataProvider,
            MetricCollector metricCollector,
            PeerGrouper peerGrouper,
            BoundsCalculator boundsCalculator,
            OutlierEvaluator outlierEvaluator,
            FindingBuilder findingBuilder
    ) {
        this.dataProvider = dataProvider;
        this.metricCollector = metricCollector;
        this.peerGrouper = peerGrouper;
        this.boundsCalculator = boundsCalculator;
        this.outlierEvaluator = outlierEvaluator;
        this.findingBuilder = findingBuilder;
    }

    public RuleEvaluation evaluate(RuleDefinition rule) {
        try {
            return evaluateChecked(rule);
        } catch (InvalidRuleConfigurationException ex) {
            log.error("Rule {} skipped: invalid configuration: {}", rule.id(), ex.getMessage());
            return RuleEvaluation.invalidConfiguration(rule.id(), ex.getMessage());
        } catch (DataProviderUnavailableException ex) {
            throw ex.forRule(rule.id());
        }
    }

    private RuleEvaluation evaluateChecked(RuleDefinition rule) {
        requireComplete(rule);
        double parameter = rule.sensitivityOrDefault();

        Map<String, MetricValue> metrics = metricCollector.collect(rule, dataProvider.getAllEntityIds());
        int undefined = (int) metrics.values().stream().filter(metric -> !metric.isDefined()).count();

        Map<String, Cohort> cohorts = peerGrouper.group(rule, metrics);

        List<Finding> findings = new ArrayList<>();
        List<String> insufficient = new ArrayList<>();
        int evaluated = 0;
        for (Cohort cohort : cohorts.values()) {
            List<Double> values = cohort.memberIds().stream()
                    .map(metrics::get)
                    .map(MetricValue::asDouble)
                    .toList();
            BoundsResult result = boundsCalculator.bounds(values, rule.method(), parameter);
            if (!result.isSufficient()) {
                insufficient.add(cohort.name() + "(n=" + result.sampleSize() + ")");
                continue;
            }
            evaluated++;
            Bounds bounds = result.computed();
            for (OutlierFlag flag : outlierEvaluator.evaluate(cohort, bounds, metrics)) {
                findings.add(findingBuilder.build(rule, flag, cohort.size(),
                        dataProvider.findEntity(flag.entityId()).orElse(null)));
            }
        }

        if (!insufficient.isEmpty()) {
            log.warn("Rule {}: {} cohorts below minimum size {} for {}: {}",
                    rule.id(), insufficient.size(), rule.method().minimumSampleSize(), rule.method(), insufficient);
        }
        if (evaluated == 0) {
            String reason = cohorts.isEmpty()
                    ? "no entity with a defined metric matched the peer grouping"
                    : "no cohort reached the minimum sample size of " + rule.method().minimumSampleSize();
            log.warn("Rule {} skipped: {} (undefinedMetrics={})", rule.id(), reason, undefined);
            return RuleEvaluation.skipped(rule.id(), insufficient.size(), undefined, reason);
        }
        log.info("Rule {} evaluated: method={} grouping={} cohorts={} skippedCohorts={} undefinedMetrics={} findings={}",
                rule.id(), rule.method(), rule.peerGrouping().mode(), evaluated, insufficient.size(), undefined, findings.size());
        return RuleEvaluation.evaluated(rule.id(), findings, evaluated, insufficient.size(), undefined);
    }

    private void requireComplete(RuleDefinition rule) {
        if (rule.method() == null) {
            throw new InvalidRuleConfigurationException("outlier method is not configured");
        }
        if (rule.peerGrouping() == null || rule.peerGrouping().mode() == null) {
            throw new InvalidRuleConfigurationException("peer grouping is not configured");
        }
        if (rule.primaryPartition() == null || rule.primaryPartition().isBlank()) {
            throw new InvalidRuleConfigurationException("primary table is not configured");
        }
        if (rule.column(0).isEmpty()) {
            throw new InvalidRuleConfigurationException("column_1 is not configured");
        }
    }
}
