package com.riskcompass.scoring.gap;

import com.riskcompass.scoring.engine.QuestionScore;
import com.riskcompass.scoring.engine.ScoreResult;
import com.riskcompass.scoring.engine.SectionScore;
import com.riskcompass.scoring.entitlement.EntitlementGate;
import com.riskcompass.scoring.template.NormalizedQuestion;
import com.riskcompass.scoring.template.NormalizedSection;
import com.riskcompass.scoring.template.NormalizedTemplate;
import com.riskcompass.scoring.vendor.VendorCatalog;
import com.riskcompass.scoring.vendor.VendorProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Produces the gap analysis for an assessment. Gated organizations get the restricted
 * placeholder list instead of the real one.
 */
public class GapAnalysisGenerator {

    private static final Logger log = LoggerFactory.getLogger(GapAnalysisGenerator.class);

    private final EntitlementGate entitlementGate;
    private final GapPrioritizer prioritizer;
    private final VendorCatalog vendorCatalog;
    private final double threshold;

    /**
     * @param threshold question scores strictly below this value (0-100) become gaps
     */
    public GapAnalysisGenerator(EntitlementGate entitlementGate, GapPrioritizer prioritizer,
                                VendorCatalog vendorCatalog, double threshold) {
        if (threshold < 0 || threshold > 100) {
            throw new IllegalArgumentException("Gap threshold must be between 0 and 100");
        }
        this.entitlementGate = entitlementGate;
        this.prioritizer = prioritizer;
        this.vendorCatalog = vendorCatalog;
        this.threshold = threshold;
    }

    public List<Gap> generate(String organizationId, String assessmentId,
                              NormalizedTemplate template, ScoreResult scoreResult) {
        if (!entitlementGate.shouldGenerateRealAnalysis(organizationId)) {
            return generateMockedGapAnalysis(assessmentId);
        }
        return generateRealGapAnalysis(assessmentId, template, scoreResult);
    }

    public List<Gap> generateMockedGapAnalysis(String assessmentId) {
        if (assessmentId == null || assessmentId.isBlank()) {
            throw new IllegalArgumentException("Assessment ID cannot be null or blank");
        }
        List<Gap> gaps = MockedGapAnalysis.forAssessment(assessmentId);
        log.debug("Generated {} restricted gaps for assessment {}", gaps.size(), assessmentId);
        return gaps;
    }

    /**
     * One gap per question scoring below the threshold, highest priority first.
     * Ties keep template order.
     */
    public List<Gap> generateRealGapAnalysis(String assessmentId, NormalizedTemplate template,
                                             ScoreResult scoreResult) {
        Map<String, SectionScore> sectionScores = new HashMap<>();
        for (SectionScore s : scoreResult.sectionBreakdown()) {
            sectionScores.put(s.sectionId(), s);
        }
        List<VendorProfile> vendors = vendorCatalog.approvedVendors();

        List<Gap> gaps = new ArrayList<>();
        for (NormalizedSection section : template.sections()) {
            SectionScore sectionScore = sectionScores.get(section.id());
            if (sectionScore == null) {
                log.warn("Score result for assessment {} has no section {}", assessmentId, section.id());
                continue;
            }
            Map<String, QuestionScore> questionScores = new HashMap<>();
            for (QuestionScore q : sectionScore.questions()) {
                questionScores.put(q.questionId(), q);
            }

            for (NormalizedQuestion question : section.questions()) {
                QuestionScore qs = questionScores.get(question.id());
                double finalScore = qs != null ? qs.finalScore() : 0.0;
                if (finalScore >= threshold) {
                    continue;
                }
                gaps.add(toGap(assessmentId, section, question, qs, finalScore, vendors));
            }
        }

        gaps.sort(Comparator.comparing(Gap::priorityScore, Comparator.reverseOrder()));
        log.debug("Found {} gaps below {} for assessment {}", gaps.size(), threshold, assessmentId);
        return gaps;
    }

    private Gap toGap(String assessmentId, NormalizedSection section, NormalizedQuestion question,
                      QuestionScore qs, double finalScore, List<VendorProfile> vendors) {
        boolean foundational = question.definition().isFoundational();
        GapPrioritization p = prioritizer.prioritize(finalScore, foundational, section.weight());
        String category = section.category() != null ? section.category() : section.title();

        List<String> suggested = vendors.stream()
                .filter(v -> v.covers(category))
                .map(VendorProfile::name)
                .sorted()
                .toList();

        String title = question.definition().text() != null ? question.definition().text() : question.id();
        return new Gap(
                "gap-" + assessmentId + "-" + question.id(),
                assessmentId,
                question.id(),
                category,
                title,
                describe(qs, finalScore),
                p.severity(),
                p.priority(),
                p.priorityScore(),
                p.cost(),
                p.effort(),
                suggested,
                false);
    }

    private String describe(QuestionScore qs, double finalScore) {
        if (qs == null || !qs.answered()) {
            return "No answer provided. Scored 0 against a target of " + format(threshold) + ".";
        }
        StringBuilder text = new StringBuilder()
                .append("Scored ").append(format(finalScore))
                .append(" against a target of ").append(format(threshold)).append('.');
        if (qs.multiplier() < 1.0) {
            text.append(" Evidence is ").append(qs.tier())
                    .append("; uploading supporting documents would raise the weighting.");
        }
        if (qs.note() != null) {
            text.append(" Answer could not be evaluated: ").append(qs.note()).append('.');
        }
        return text.toString();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
