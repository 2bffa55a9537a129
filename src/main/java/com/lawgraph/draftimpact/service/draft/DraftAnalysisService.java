package com.lawgraph.draftimpact.service.draft;

import com.lawgraph.draftimpact.config.DraftAnalysisConfig;
import com.lawgraph.draftimpact.dto.diff.DiffEntry;
import com.lawgraph.draftimpact.dto.diff.DraftDiff;
import com.lawgraph.draftimpact.dto.draft.DraftBill;
import com.lawgraph.draftimpact.dto.finding.ConflictReport;
import com.lawgraph.draftimpact.dto.impact.DraftImpactResult;
import com.lawgraph.draftimpact.dto.report.DraftImpactReport;
import com.lawgraph.draftimpact.dto.report.ExecutiveSummary;
import com.lawgraph.draftimpact.dto.report.ReportOptions;
import com.lawgraph.draftimpact.dto.report.RiskAssessment;
import com.lawgraph.draftimpact.repository.DraftLibrary;
import com.lawgraph.draftimpact.repository.DraftLibraryOpener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Runs the full analysis pipeline for a bill and assembles a {@link DraftImpactReport}.
 *
 * The diff is required; impact, conflicts, temporal analysis and the overlay are optional
 * stages whose failures are logged and recorded in the report's warnings.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DraftAnalysisService {

    private final DraftLibraryOpener libraryOpener;
    private final AmendmentRecognizer recognizer;
    private final DraftDiffService diffService;
    private final DraftImpactService impactService;
    private final ConflictDetectionService conflictDetectionService;
    private final TemporalConsistencyAnalyzer temporalAnalyzer;
    private final ScenarioOverlayService overlayService;
    private final RiskAssessmentService riskAssessmentService;
    private final DraftAnalysisConfig config;

    public DraftImpactReport generateReport(DraftBill bill, String libraryPath, ReportOptions options) {
        if (bill == null) {
            throw new IllegalArgumentException("bill is null");
        }
        ReportOptions opts = options == null ? ReportOptions.defaults() : options;
        log.info("========================================");
        log.info("Generating impact report for {}", bill.toDisplayString());
        log.info("========================================");

        DraftLibrary library = libraryOpener.open(libraryPath);
        DraftImpactReport report = DraftImpactReport.builder()
                .bill(bill)
                .generatedAt(Instant.now())
                .build();

        if (bill.getStatistics().getAmendmentCount() == 0) {
            recognizer.annotateBill(bill);
        }

        DraftDiff diff;
        try {
            diff = diffService.computeDiff(bill, library);
        } catch (RuntimeException e) {
            log.error("Diff computation failed for {}: {}", bill.getBillNumber(), e.getMessage(), e);
            report.getWarnings().add("diff computation failed: " + e.getMessage());
            report.setExecutiveSummary(summarize(report, null));
            applyRisk(report);
            return report;
        }
        if (opts.isIncludeDiff()) {
            report.setDiff(diff);
        }

        if (opts.isIncludeImpact()) {
            int depth = opts.getImpactDepth() < 1 ? config.getImpactDepth() : opts.getImpactDepth();
            try {
                report.setImpact(impactService.analyzeImpact(diff, library, depth));
            } catch (RuntimeException e) {
                recordStageFailure(report, "impact analysis", e);
            }
        }

        if (opts.isIncludeConflicts()) {
            try {
                report.setConflicts(conflictDetectionService.detectConflicts(diff, library));
            } catch (RuntimeException e) {
                recordStageFailure(report, "conflict detection", e);
            }
        }

        if (opts.isIncludeTemporal()) {
            try {
                report.setTemporalFindings(temporalAnalyzer.analyze(diff, library));
            } catch (RuntimeException e) {
                recordStageFailure(report, "temporal analysis", e);
            }
        }

        if (opts.isIncludeOverlay()) {
            try {
                report.setOverlay(overlayService.applyOverlay(diff, library));
            } catch (RuntimeException e) {
                recordStageFailure(report, "scenario overlay", e);
            }
        }

        report.setExecutiveSummary(summarize(report, diff));
        applyRisk(report);

        log.info("Report for {} complete: risk {} ({}), {} warnings", bill.getBillNumber(),
                report.getRiskLevel(), report.getExecutiveSummary().getRiskJustification(),
                report.getWarnings().size());
        return report;
    }

    ExecutiveSummary summarize(DraftImpactReport report, DraftDiff diff) {
        DraftBill bill = report.getBill();
        String title = bill.getShortTitle() == null || bill.getShortTitle().isEmpty()
                ? bill.getTitle() : bill.getShortTitle();

        ExecutiveSummary summary = ExecutiveSummary.builder()
                .billTitle(title)
                .billNumber(bill.getBillNumber())
                .amendmentCount(bill.getStatistics().getAmendmentCount())
                .build();

        if (diff != null) {
            summary.setProvisionsModified(diff.getModified().size());
            summary.setProvisionsRepealed(diff.getRemoved().size());
            summary.setProvisionsAdded(diff.getAdded().size());
            summary.setTitlesAffected(titlesAffected(diff));
        }

        DraftImpactResult impact = report.getImpact();
        if (impact != null) {
            summary.setTotalProvisionsAffected(impact.getTotalProvisionsAffected());
            summary.setBrokenCrossRefs(impact.getBrokenCrossRefs().size());
            summary.setObligationsAdded(impact.getObligationChanges().getAdded().size());
            summary.setObligationsRemoved(impact.getObligationChanges().getRemoved().size());
            summary.setRightsAdded(impact.getRightsChanges().getAdded().size());
            summary.setRightsRemoved(impact.getRightsChanges().getRemoved().size());
        }

        ConflictReport conflicts = report.getConflicts();
        if (conflicts != null) {
            summary.setConflictErrors(conflicts.getSummary().getErrors());
            summary.setConflictWarnings(conflicts.getSummary().getWarnings());
        }
        return summary;
    }

    static List<Integer> titlesAffected(DraftDiff diff) {
        TreeSet<Integer> titles = new TreeSet<>();
        for (DiffEntry entry : diff.allEntries()) {
            if (entry.getAmendment() == null) {
                continue;
            }
            String title = entry.getAmendment().getTargetTitle();
            if (title == null || title.isEmpty()) {
                continue;
            }
            try {
                titles.add(Integer.parseInt(leadingDigits(title)));
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric title '{}'", title);
            }
        }
        return new ArrayList<>(titles);
    }

    private static String leadingDigits(String text) {
        int end = 0;
        while (end < text.length() && Character.isDigit(text.charAt(end))) {
            end++;
        }
        return text.substring(0, end);
    }

    private void applyRisk(DraftImpactReport report) {
        RiskAssessment risk = riskAssessmentService.assess(report);
        report.setRiskLevel(risk.getLevel());
        report.getExecutiveSummary().setRiskLevel(risk.getLevel());
        report.getExecutiveSummary().setRiskJustification(risk.getJustification());
    }

    private void recordStageFailure(DraftImpactReport report, String stage, RuntimeException e) {
        log.warn("{} failed: {}", stage, e.getMessage(), e);
        report.getWarnings().add(stage + " failed: " + e.getMessage());
    }
}
