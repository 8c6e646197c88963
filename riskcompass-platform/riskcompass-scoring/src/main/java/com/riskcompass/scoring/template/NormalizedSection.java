package com.riskcompass.scoring.template;

import java.util.List;

public record NormalizedSection(
        String id,
        String title,
        String category,
        double weight,
        List<NormalizedQuestion> questions
) {

    public NormalizedSection {
        if (Double.isNaN(weight) || weight < 0) {
            throw new IllegalArgumentException("Section weight must be non-negative: " + weight);
        }
        questions = List.copyOf(questions);
    }

    public double questionWeightSum() {
        return questions.stream().mapToDouble(NormalizedQuestion::normalizedWeight).sum();
    }
}
