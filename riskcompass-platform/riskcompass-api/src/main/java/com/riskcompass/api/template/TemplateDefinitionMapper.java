package com.riskcompass.api.template;

import com.riskcompass.core.domain.AssessmentTemplate;
import com.riskcompass.core.domain.TemplateQuestion;
import com.riskcompass.core.domain.TemplateSection;
import com.riskcompass.scoring.rule.ScoringRule;
import com.riskcompass.scoring.rule.ScoringRules;
import com.riskcompass.scoring.template.QuestionDefinition;
import com.riskcompass.scoring.template.SectionDefinition;
import com.riskcompass.scoring.template.TemplateDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts a persisted template into the engine's immutable definition.
 *
 * A stored rule blob that cannot be parsed leaves the question without a rule; the engine
 * then scores it 0 and records why.
 */
@Component
public class TemplateDefinitionMapper {

    private static final Logger log = LoggerFactory.getLogger(TemplateDefinitionMapper.class);

    public TemplateDefinition toDefinition(AssessmentTemplate template) {
        List<SectionDefinition> sections = new ArrayList<>(template.getSections().size());
        for (TemplateSection section : template.getSections()) {
            List<QuestionDefinition> questions = new ArrayList<>(section.getQuestions().size());
            for (TemplateQuestion question : section.getQuestions()) {
                questions.add(toDefinition(question));
            }
            sections.add(new SectionDefinition(
                    section.getId().toString(),
                    section.getTitle(),
                    section.getCategory(),
                    section.getWeight(),
                    questions));
        }
        return new TemplateDefinition(template.getId().toString(), template.getName(), template.getVersion(), sections);
    }

    private QuestionDefinition toDefinition(TemplateQuestion question) {
        return new QuestionDefinition(
                question.getId().toString(),
                question.getText(),
                question.getType(),
                question.getRawWeight(),
                question.isFoundational(),
                question.isRequired(),
                parseRule(question));
    }

    private ScoringRule parseRule(TemplateQuestion question) {
        Map<String, Object> blob = question.getScoringRules();
        if (blob == null || blob.isEmpty()) {
            return null;
        }
        try {
            return ScoringRules.parse(blob);
        } catch (IllegalArgumentException e) {
            log.warn("Malformed scoring rule on question {}: {}", question.getId(), e.getMessage());
            return null;
        }
    }
}
