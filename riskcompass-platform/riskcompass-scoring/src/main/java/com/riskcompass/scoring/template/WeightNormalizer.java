package com.riskcompass.scoring.template;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates section weights and turns author-facing question weights into fractions.
 * Pure function of its input.
 */
public final class WeightNormalizer {

    public static final double TOLERANCE = 0.001;

    /**
     * Validates section weights, then divides every question's raw weight by the sum of raw
     * weights in its section. A section whose raw weights sum to zero gets equal weights.
     *
     * @throws TemplateConfigurationException if a section weight is negative or NaN, or section
     *         weights are off by more than {@link #TOLERANCE}
     */
    public NormalizedTemplate normalize(TemplateDefinition template) {
        validate(template);

        List<NormalizedSection> sections = new ArrayList<>(template.sections().size());
        for (SectionDefinition section : template.sections()) {
            sections.add(normalizeSection(section));
        }
        return new NormalizedTemplate(template.id(), template.name(), template.version(), sections);
    }

    /**
     * Checks only the section-level invariant: every weight non-negative, weights summing to 1.0.
     */
    public void validate(TemplateDefinition template) {
        double sum = template.sections().stream().mapToDouble(SectionDefinition::weight).sum();
        for (SectionDefinition section : template.sections()) {
            if (Double.isNaN(section.weight()) || section.weight() < 0) {
                throw TemplateConfigurationException.invalidSectionWeight(
                        template.id(), section.id(), section.weight(), sum);
            }
        }
        double delta = sum - 1.0;
        if (Double.isNaN(sum) || Math.abs(delta) > TOLERANCE) {
            throw new TemplateConfigurationException(template.id(), sum, delta);
        }
    }

    private NormalizedSection normalizeSection(SectionDefinition section) {
        List<QuestionDefinition> questions = section.questions();
        double rawSum = questions.stream().mapToDouble(QuestionDefinition::effectiveRawWeight).sum();

        List<NormalizedQuestion> normalized = new ArrayList<>(questions.size());
        for (QuestionDefinition question : questions) {
            double weight = rawSum > 0
                    ? question.effectiveRawWeight() / rawSum
                    : 1.0 / questions.size();
            normalized.add(new NormalizedQuestion(question, weight));
        }
        return new NormalizedSection(section.id(), section.title(), section.category(),
                section.weight(), normalized);
    }
}
