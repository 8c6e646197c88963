package com.riskcompass.scoring.template;

public record NormalizedQuestion(QuestionDefinition definition, double normalizedWeight) {

    public String id() {
        return definition.id();
    }
}
