package com.riskcompass.scoring.template;

import java.util.Locale;

/**
 * Template-authoring defect: a section weight is negative or not a number, or section weights
 * do not sum to 1.0.
 * Must be raised when a template is validated, never while scoring a live assessment.
 */
public class TemplateConfigurationException extends RuntimeException {

    private final String templateId;
    private final double actualSum;
    private final double delta;

    public TemplateConfigurationException(String templateId, double actualSum, double delta) {
        this(String.format(Locale.ROOT,
                "Section weights of template %s sum to %.6f (delta %+.6f from 1.0, tolerance %.3f)",
                templateId, actualSum, delta, WeightNormalizer.TOLERANCE), templateId, actualSum, delta);
    }

    private TemplateConfigurationException(String message, String templateId, double actualSum, double delta) {
        super(message);
        this.templateId = templateId;
        this.actualSum = actualSum;
        this.delta = delta;
    }

    /**
     * A single section weight below zero or NaN; {@code actualSum} still reports the section total.
     */
    public static TemplateConfigurationException invalidSectionWeight(
            String templateId, String sectionId, double weight, double actualSum) {
        return new TemplateConfigurationException(
                String.format(Locale.ROOT, "Section %s of template %s has invalid weight %s",
                        sectionId, templateId, weight),
                templateId, actualSum, actualSum - 1.0);
    }

    public String getTemplateId() { return templateId; }
    public double getActualSum() { return actualSum; }
    public double getDelta() { return delta; }
}
