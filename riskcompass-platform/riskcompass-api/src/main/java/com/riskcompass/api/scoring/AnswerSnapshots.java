package com.riskcompass.api.scoring;

import com.riskcompass.core.domain.AssessmentAnswer;
import com.riskcompass.scoring.engine.AnswerSnapshot;
import com.riskcompass.scoring.rule.AnswerValue;

/**
 * Maps stored answers to engine snapshots.
 */
final class AnswerSnapshots {

    private AnswerSnapshots() {
    }

    static AnswerSnapshot from(AssessmentAnswer answer) {
        return new AnswerSnapshot(
                answer.getQuestionId().toString(),
                valueOf(answer),
                answer.getEvidenceTier(),
                answer.getSourceDocumentId(),
                answer.getConfidence());
    }

    /**
     * @return null when no value column is set
     */
    static AnswerValue valueOf(AssessmentAnswer answer) {
        if (answer.getSelectedOptions() != null) {
            return AnswerValue.choices(answer.getSelectedOptions());
        }
        if (answer.getNumericValue() != null) {
            return AnswerValue.numeric(answer.getNumericValue());
        }
        if (answer.getBooleanValue() != null) {
            return AnswerValue.yesNo(answer.getBooleanValue());
        }
        if (answer.getTextValue() != null) {
            return AnswerValue.text(answer.getTextValue());
        }
        return null;
    }
}
