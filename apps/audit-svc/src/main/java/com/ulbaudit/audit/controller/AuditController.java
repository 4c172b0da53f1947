package com.ulbaudit.audit.controller;

import com.ulbaudit.audit.controller.dto.AuditRunResponseDto;
import com.ulbaudit.audit.controller.dto.CheckFindingResponseDto;
import com.ulbaudit.audit.controller.dto.FindingResponseDto;
import com.ulbaudit.audit.controller.dto.RuleEvaluationResponseDto;
import com.ulbaudit.audit.controller.dto.RuleSummaryDto;
import com.ulbaudit.audit.model.AuditRunSummary;
import com.ulbaudit.audit.model.Bounds;
import com.ulbaudit.audit.model.CheckFinding;
import com.ulbaudit.audit.model.CheckKind;
import com.ulbaudit.audit.model.CheckRule;
import com.ulbaudit.audit.model.Finding;
import com.ulbaudit.audit.model.RuleDefinition;
import com.ulbaudit.audit.model.RuleEvaluation;
import com.ulbaudit.audit.rules.RuleCatalog;
import com.ulbaudit.audit.service.AuditRunService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/audit")
public class AuditController {

    private final AuditRunService auditRunService;
    private final RuleCatalog ruleCatalog;

    public AuditController(AuditRunService auditRunService, RuleCatalog ruleCatalog) {
        this.auditRunService = auditRunService;
        this.ruleCatalog = ruleCatalog;
    }

    @GetMapping("/rules")
    public ResponseEntity<List<RuleSummaryDto>> listRules() {
        List<RuleSummaryDto> rules = Stream.concat(
                        ruleCatalog.rules().stream().map(this::mapRule),
                        ruleCatalog.checks().stream().map(this::mapCheck))
                .toList();
        return ResponseEntity.ok(rules);
    }

    @PostMapping("/runs")
    public ResponseEntity<AuditRunResponseDto> run() {
        return ResponseEntity.ok(map(auditRunService.runAll()));
    }

    @PostMapping("/rules/{ruleId}/evaluations")
    public ResponseEntity<RuleEvaluationResponseDto> evaluateRule(@PathVariable("ruleId") String ruleId) {
        return ResponseEntity.ok(map(auditRunService.runRule(ruleId)));
    }

    private RuleSummaryDto mapRule(RuleDefinition rule) {
        return new RuleSummaryDto(
                rule.id(),
                rule.description(),
                rule.method() != null ? rule.method().validationType() : null,
                rule.severity().label(),
                rule.method() != null ? rule.method().name() : null,
                rule.method() != null ? rule.sensitivityOrDefault() : null,
                rule.peerGrouping() != null ? rule.peerGrouping().mode().name() : null,
                null,
                rule.primaryPartition(),
                rule.referencePartition()
        );
    }

    private RuleSummaryDto mapCheck(CheckRule check) {
        String expectation = check.threshold() != null ? check.threshold().describe() : check.operator().symbol();
        return new RuleSummaryDto(
                check.id(),
                check.description(),
                check.kind().validationType(),
                check.severity().label(),
                null,
                null,
                null,
                check.kind() == CheckKind.COMPLETENESS ? null : expectation,
                check.primaryPartition(),
                check.referencePartition()
        );
    }

    private AuditRunResponseDto map(AuditRunSummary summary) {
        Map<String, Long> bySeverity = new LinkedHashMap<>();
        summary.findingsBySeverity().forEach((severity, count) -> bySeverity.put(severity.label(), count));
        return new AuditRunResponseDto(
                summary.rulesAttempted(),
                summary.rulesWithFindings(),
                summary.totalFindings(),
                bySeverity,
                summary.skippedRules().stream()
                        .map(skipped -> new AuditRunResponseDto.SkippedRule(skipped.ruleId(), skipped.status().name(), skipped.reason()))
                        .toList(),
                summary.evaluations().stream().map(this::map).toList()
        );
    }

    private RuleEvaluationResponseDto map(RuleEvaluation evaluation) {
        return new RuleEvaluationResponseDto(
                evaluation.ruleId(),
                evaluation.status().name(),
                evaluation.reason(),
                evaluation.cohortsEvaluated(),
                evaluation.cohortsSkipped(),
                evaluation.undefinedMetrics(),
                evaluation.findings().stream().map(this::map).toList(),
                evaluation.checkFindings().stream().map(this::map).toList()
        );
    }

    private CheckFindingResponseDto map(CheckFinding finding) {
        return new CheckFindingResponseDto(
                finding.ruleId(),
                finding.entityId(),
                finding.entityName(),
                finding.district().orElse(null),
                finding.part(),
                finding.severity().label(),
                finding.kind().validationType(),
                finding.description(),
                finding.value().map(AuditController::decimal).orElse(null),
                finding.detail(),
                finding.evaluationError()
        );
    }

    private FindingResponseDto map(Finding finding) {
        Bounds bounds = finding.bounds();
        return new FindingResponseDto(
                finding.ruleId(),
                finding.entityId(),
                finding.entityName(),
                finding.district().orElse(null),
                finding.severity().label(),
                finding.method().name(),
                decimal(bounds.parameter()),
                decimal(finding.value()),
                finding.side().name(),
                decimal(bounds.lower()),
                decimal(bounds.upper()),
                new FindingResponseDto.Statistics(
                        decimal(bounds.q1()),
                        decimal(bounds.q3()),
                        decimal(bounds.iqr()),
                        decimal(bounds.mean()),
                        decimal(bounds.standardDeviation()),
                        finding.zScore().map(AuditController::decimal).orElse(null)
                ),
                finding.cohortName(),
                finding.cohortSize(),
                finding.narrative()
        );
    }

    private static BigDecimal decimal(Double value) {
        if (value == null) {
            return null;
        }
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP);
    }
}
