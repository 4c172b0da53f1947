package com.ulbaudit.audit.service;

import com.ulbaudit.audit.checks.ValidationCheckEvaluator;
import com.ulbaudit.audit.config.AuditProperties;
import com.ulbaudit.audit.data.DataProviderUnavailableException;
import com.ulbaudit.audit.model.AuditRunSummary;
import com.ulbaudit.audit.model.CheckRule;
import com.ulbaudit.audit.model.RuleDefinition;
import com.ulbaudit.audit.model.RuleEvaluation;
import com.ulbaudit.audit.model.Severity;
import com.ulbaudit.audit.rules.RuleCatalog;
import com.ulbaudit.audit.rules.RuleNotFoundException;
import com.ulbaudit.audit.statistics.PeerOutlierEvaluator;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AuditRunService {

    private static final Logger log = LoggerFactory.getLogger(AuditRunService.class);

    private final RuleCatalog ruleCatalog;
    private final PeerOutlierEvaluator evaluator;
    private final ValidationCheckEvaluator checkEvaluator;
    private final int parallelism;

    public AuditRunService(
            RuleCatalog ruleCatalog,
            PeerOutlierEvaluator evaluator,
            ValidationCheckEvaluator checkEvaluator,
            AuditProperties properties
    ) {
        this.ruleCatalog = ruleCatalog;
        this.evaluator = evaluator;
        this.checkEvaluator = checkEvaluator;
        this.parallelism = properties.run().parallelism();
    }

    /**
     * Evaluates every catalogued rule, validation checks first and statistical rules after them.
     * Rules rejected at load time are reported as invalid configuration; results keep catalog
     * order whatever the completion order.
     */
    public AuditRunSummary runAll() {
        List<CheckRule> checks = ruleCatalog.checks();
        List<RuleDefinition> rules = ruleCatalog.rules();
        log.info("Audit run starting: checks={} rules={} rejectedAtLoad={} parallelism={}",
                checks.size(), rules.size(), ruleCatalog.failures().size(), parallelism);

        List<RuleTask> tasks = new ArrayList<>(checks.size() + rules.size());
        checks.forEach(check -> tasks.add(new RuleTask(check.id(), () -> checkEvaluator.evaluate(check))));
        rules.forEach(rule -> tasks.add(new RuleTask(rule.id(), () -> evaluator.evaluate(rule))));

        List<RuleEvaluation> evaluations = new ArrayList<>();
        ruleCatalog.failures().forEach(failure ->
                evaluations.add(RuleEvaluation.invalidConfiguration(failure.ruleId(), failure.reason())));
        evaluations.addAll(parallelism > 1 && tasks.size() > 1 ? evaluateConcurrently(tasks) : evaluateSequentially(tasks));

        AuditRunSummary summary = AuditRunSummary.from(evaluations);
        log.info("Audit run complete: attempted={} withFindings={} skipped={} findings={}",
                summary.rulesAttempted(), summary.rulesWithFindings(), summary.skippedRules().size(), summary.totalFindings());
        for (Severity severity : Severity.values()) {
            long count = summary.findingsBySeverity().getOrDefault(severity, 0L);
            if (count > 0) {
                log.info("  {}: {}", severity.label(), count);
            }
        }
        summary.skippedRules().forEach(skipped ->
                log.info("  skipped rule={} status={} reason={}", skipped.ruleId(), skipped.status(), skipped.reason()));
        return summary;
    }

    /**
     * Evaluates a single statistical rule or validation check. An unavailable data provider
     * propagates to the caller.
     */
    public RuleEvaluation runRule(String ruleId) {
        Optional<RuleDefinition> rule = ruleCatalog.find(ruleId);
        if (rule.isPresent()) {
            return evaluator.evaluate(rule.get());
        }
        CheckRule check = ruleCatalog.findCheck(ruleId).orElseThrow(() -> new RuleNotFoundException(ruleId));
        return checkEvaluator.evaluate(check);
    }

    private List<RuleEvaluation> evaluateSequentially(List<RuleTask> tasks) {
        List<RuleEvaluation> evaluations = new ArrayList<>(tasks.size());
        for (RuleTask task : tasks) {
            evaluations.add(evaluateSafely(task));
        }
        return evaluations;
    }

    private List<RuleEvaluation> evaluateConcurrently(List<RuleTask> tasks) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, tasks.size()));
        try {
            List<Future<RuleEvaluation>> futures = new ArrayList<>(tasks.size());
            for (RuleTask task : tasks) {
                futures.add(executor.submit(() -> evaluateSafely(task)));
            }
            List<RuleEvaluation> evaluations = new ArrayList<>(tasks.size());
            for (int i = 0; i < futures.size(); i++) {
                evaluations.add(await(futures.get(i), tasks.get(i)));
            }
            return evaluations;
        } finally {
            executor.shutdownNow();
        }
    }

    private RuleEvaluation await(Future<RuleEvaluation> future, RuleTask task) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Audit run interrupted while evaluating rule " + task.ruleId(), ex);
        } catch (ExecutionException ex) {
            log.error("Rule {} failed", task.ruleId(), ex.getCause());
            return RuleEvaluation.failed(task.ruleId(), String.valueOf(ex.getCause().getMessage()));
        }
    }

    private RuleEvaluation evaluateSafely(RuleTask task) {
        try {
            return task.evaluation().get();
        } catch (DataProviderUnavailableException ex) {
            log.error("Rule {} failed: data provider unavailable: {}", task.ruleId(), ex.getMessage());
            return RuleEvaluation.failed(task.ruleId(), ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Rule {} failed unexpectedly", task.ruleId(), ex);
            return RuleEvaluation.failed(task.ruleId(), "unexpected error: " + ex.getMessage());
        }
    }

    private record RuleTask(String ruleId, Supplier<RuleEvaluation> evaluation) {
    }
}
