package com.riskcompass.scoring.gap;

import java.util.ArrayList;
import java.util.List;

/**
 * Placeholder gap list for gated callers. In-memory only; it reveals the shape of an analysis
 * but none of its content.
 */
final class MockedGapAnalysis {

    static final String CATEGORY = "HIDDEN_ANALYSIS";
    static final String REDACTED_DESCRIPTION =
            "Detailed gap analysis available on Premium plans. [UNLOCK PREMIUM TO SEE DETAILS]";

    private static final String[] TITLES = {
            "Risk Area 1",
            "Compliance Gap 2",
            "Control Weakness 3",
            "Process Deficiency 4",
            "Documentation Gap 5"
    };
    private static final Severity[] SEVERITY_CYCLE = {Severity.HIGH, Severity.MEDIUM, Severity.LOW};

    private MockedGapAnalysis() {
    }

    /**
     * Between 3 and 5 gaps; the count depends only on the assessment id.
     */
    static List<Gap> forAssessment(String assessmentId) {
        int count = 3 + Math.floorMod(assessmentId.hashCode(), 3);
        List<Gap> gaps = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            gaps.add(new Gap(
                    "mock-gap-" + assessmentId + "-" + (i + 1),
                    assessmentId,
                    null,
                    CATEGORY,
                    TITLES[i],
                    REDACTED_DESCRIPTION,
                    SEVERITY_CYCLE[i % SEVERITY_CYCLE.length],
                    Priority.MEDIUM_TERM,
                    null,
                    null,
                    null,
                    List.of(),
                    true));
        }
        return gaps;
    }
}
