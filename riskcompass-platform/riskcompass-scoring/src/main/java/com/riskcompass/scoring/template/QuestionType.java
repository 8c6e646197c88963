package com.riskcompass.scoring.template;

public enum QuestionType {
    SINGLE_SELECT,
    MULTI_SELECT,
    FREE_TEXT,
    RATING,
    YES_NO
}
