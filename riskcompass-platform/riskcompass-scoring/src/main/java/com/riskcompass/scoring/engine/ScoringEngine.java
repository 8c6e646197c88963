package com.riskcompass.scoring.engine;

import com.riskcompass.scoring.evidence.EvidenceTierPolicy;
import com.riskcompass.scoring.rule.RuleEvaluationException;
import com.riskcompass.scoring.rule.ScoringRule;
import com.riskcompass.scoring.template.NormalizedQuestion;
import com.riskcompass.scoring.template.NormalizedSection;
import com.riskcompass.scoring.template.NormalizedTemplate;
import com.riskcompass.scoring.template.QuestionDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Evidence-weighted scoring.
 *
 * <pre>
 *   questionScore = rawScore(rule, answer) * multiplier(tier)
 *   sectionScore  = sum(normalizedWeight * questionScore)
 *   overallScore  = sum(sectionWeight * sectionScore)
 * </pre>
 *
 * Unanswered questions score 0 but keep their weight. A rule that cannot evaluate an answer
 * scores 0 and is logged; answer data never makes scoring fail.
 * Stateless and thread-safe.
 */
public class ScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    private final EvidenceTierPolicy tierPolicy;

    public ScoringEngine(EvidenceTierPolicy tierPolicy) {
        if (tierPolicy == null) {
            throw new IllegalArgumentException("Evidence tier policy cannot be null");
        }
        this.tierPolicy = tierPolicy;
    }

    public ScoreResult score(Collection<AnswerSnapshot> answers, NormalizedTemplate template) {
        Map<String, AnswerSnapshot> byQuestion = indexAnswers(answers, template.id());

        List<SectionScore> sections = new ArrayList<>(template.sections().size());
        EvidenceDistribution distribution = EvidenceDistribution.EMPTY;
        int unansweredRequired = 0;
        double overall = 0.0;

        for (NormalizedSection section : template.sections()) {
            List<QuestionScore> questionScores = new ArrayList<>(section.questions().size());
            double sectionScore = 0.0;

            for (NormalizedQuestion question : section.questions()) {
                AnswerSnapshot answer = byQuestion.get(question.id());
                QuestionScore qs;
                if (answer == null || !answer.isAnswered()) {
                    qs = QuestionScore.unanswered(question.id(), question.normalizedWeight(),
                            question.definition().isFoundational());
                    if (question.definition().required()) {
                        unansweredRequired++;
                    }
                } else {
                    qs = scoreAnswer(question, answer);
                    distribution = distribution.plus(answer.tier());
                }
                questionScores.add(qs);
                sectionScore += question.normalizedWeight() * qs.finalScore();
            }

            sectionScore = clamp(sectionScore);
            sections.add(new SectionScore(section.id(), section.title(), section.category(),
                    section.weight(), sectionScore, questionScores));
            overall += section.weight() * sectionScore;
        }

        double overallScore = round2(clamp(overall));
        log.debug("Scored template {} v{}: overall={}, answered={}, unansweredRequired={}",
                template.id(), template.version(), overallScore, distribution.total(), unansweredRequired);
        return new ScoreResult(overallScore, sections, distribution, unansweredRequired);
    }

    private QuestionScore scoreAnswer(NormalizedQuestion question, AnswerSnapshot answer) {
        QuestionDefinition definition = question.definition();
        double multiplier = tierPolicy.multiplierFor(answer.tier());
        double raw = 0.0;
        String note = null;

        ScoringRule rule = definition.scoringRule();
        if (rule == null) {
            note = "no scoring rule";
            log.warn("Question {} has no usable scoring rule, scoring 0", definition.id());
        } else {
            try {
                raw = ScoringRule.clamp(rule.evaluate(answer.value()));
            } catch (RuleEvaluationException e) {
                note = e.getMessage();
                log.warn("Could not evaluate answer for question {}: {}", definition.id(), e.getMessage());
            }
        }

        return new QuestionScore(definition.id(), question.normalizedWeight(), true,
                definition.isFoundational(), raw, answer.tier(), multiplier, raw * multiplier, note);
    }

    private Map<String, AnswerSnapshot> indexAnswers(Collection<AnswerSnapshot> answers, String templateId) {
        Map<String, AnswerSnapshot> byQuestion = new HashMap<>();
        if (answers == null) {
            return byQuestion;
        }
        for (AnswerSnapshot answer : answers) {
            AnswerSnapshot previous = byQuestion.putIfAbsent(answer.questionId(), answer);
            if (previous != null) {
                log.warn("Duplicate answer for question {} in template {}; keeping the first",
                        answer.questionId(), templateId);
            }
        }
        return byQuestion;
    }

    private static double clamp(double score) {
        return ScoringRule.clamp(score);
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
