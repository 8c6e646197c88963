package com.riskcompass.scoring.rule;

/**
 * A scoring rule could not evaluate an answer value, e.g. an option no longer in the template.
 */
public class RuleEvaluationException extends Exception {

    public RuleEvaluationException(String message) {
        super(message);
    }
}
