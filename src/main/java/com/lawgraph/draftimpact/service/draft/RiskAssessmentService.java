package com.lawgraph.draftimpact.service.draft;

import com.lawgraph.draftimpact.config.DraftAnalysisConfig;
import com.lawgraph.draftimpact.dto.finding.ConflictSummary;
import com.lawgraph.draftimpact.dto.finding.Severity;
import com.lawgraph.draftimpact.dto.finding.TemporalFinding;
import com.lawgraph.draftimpact.dto.report.DraftImpactReport;
import com.lawgraph.draftimpact.dto.report.RiskAssessment;
import com.lawgraph.draftimpact.dto.report.RiskLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Rates a report LOW, MEDIUM or HIGH.
 *
 * HIGH on the first of: any conflict error, too many broken references, too many affected
 * provisions. MEDIUM collects every warning-level signal into the justification.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RiskAssessmentService {

    private final DraftAnalysisConfig config;

    public RiskAssessment assess(DraftImpactReport report) {
        if (report == null) {
            return new RiskAssessment(RiskLevel.LOW, "no analysis data available");
        }

        ConflictSummary conflicts = report.getConflicts() == null ? null : report.getConflicts().getSummary();
        if (conflicts != null && conflicts.getErrors() > 0) {
            return new RiskAssessment(RiskLevel.HIGH,
                    String.format("%d conflict error(s) detected", conflicts.getErrors()));
        }

        int broken = report.getImpact() == null ? 0 : report.getImpact().getBrokenCrossRefs().size();
        if (broken > config.getBrokenReferenceHighThreshold()) {
            return new RiskAssessment(RiskLevel.HIGH, String.format("%d broken cross-references (>%d)",
                    broken, config.getBrokenReferenceHighThreshold()));
        }

        int affected = report.getImpact() == null ? 0 : report.getImpact().getTotalProvisionsAffected();
        if (affected > config.getAffectedProvisionsHighThreshold()) {
            return new RiskAssessment(RiskLevel.HIGH, String.format("%d provisions affected (>%d)",
                    affected, config.getAffectedProvisionsHighThreshold()));
        }

        List<String> reasons = new ArrayList<>();
        if (conflicts != null && conflicts.getWarnings() > 0) {
            reasons.add(String.format("%d conflict warning(s)", conflicts.getWarnings()));
        }
        if (broken > 0) {
            reasons.add(String.format("%d broken cross-reference(s)", broken));
        }
        long temporalIssues = report.getTemporalFindings() == null ? 0 : report.getTemporalFindings().stream()
                .map(TemporalFinding::getSeverity)
                .filter(severity -> severity != Severity.INFO)
                .count();
        if (temporalIssues > 0) {
            reasons.add(String.format("%d temporal issue(s)", temporalIssues));
        }

        if (!reasons.isEmpty()) {
            return new RiskAssessment(RiskLevel.MEDIUM, String.join("; ", reasons));
        }
        return new RiskAssessment(RiskLevel.LOW, "no significant issues detected");
    }
}
