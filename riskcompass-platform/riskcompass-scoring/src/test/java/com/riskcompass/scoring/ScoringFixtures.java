package com.riskcompass.scoring;

import com.riskcompass.scoring.evidence.EvidenceTier;
import com.riskcompass.scoring.engine.AnswerSnapshot;
import com.riskcompass.scoring.rule.AnswerValue;
import com.riskcompass.scoring.rule.MappingRule;
import com.riskcompass.scoring.rule.ScoringRule;
import com.riskcompass.scoring.template.QuestionDefinition;
import com.riskcompass.scoring.template.QuestionType;
import com.riskcompass.scoring.template.SectionDefinition;
import com.riskcompass.scoring.template.TemplateDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared builders for scoring tests.
 */
public final class ScoringFixtures {

    /** Rating 0-5 mapped linearly to 0-100. */
    public static final ScoringRule RATING_RULE = new MappingRule(
            Map.of("0", 0.0, "1", 1.0, "2", 2.0, "3", 3.0, "4", 4.0, "5", 5.0), 5.0);

    public static final ScoringRule YES_NO_RULE = new MappingRule(Map.of("Yes", 5.0, "No", 0.0), 5.0);

    private ScoringFixtures() {
    }

    public static QuestionDefinition rating(String id, double weight) {
        return new QuestionDefinition(id, "Question " + id, QuestionType.RATING, weight, false, true, RATING_RULE);
    }

    public static QuestionDefinition yesNo(String id, double weight, boolean foundational) {
        return new QuestionDefinition(id, "Question " + id, QuestionType.YES_NO, weight, foundational, true,
                YES_NO_RULE);
    }

    /**
     * Single section of weight 1.0 holding {@code count} equally weighted rating questions q1..qN.
     */
    public static TemplateDefinition ratingTemplate(int count) {
        List<QuestionDefinition> questions = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            questions.add(rating("q" + i, 1.0));
        }
        return new TemplateDefinition("tpl-1", "Baseline", 1,
                List.of(new SectionDefinition("s1", "Governance", "governance", 1.0, questions)));
    }

    public static AnswerSnapshot ratingAnswer(String questionId, int rating, EvidenceTier tier) {
        return AnswerSnapshot.of(questionId, AnswerValue.numeric(rating), tier);
    }
}
