package com.riskcompass.scoring.rule;

import java.util.List;
import java.util.Locale;

/**
 * Value of an answer as captured from the respondent or from document extraction.
 */
public sealed interface AnswerValue
        permits AnswerValue.Text, AnswerValue.Choices, AnswerValue.Numeric, AnswerValue.YesNo {

    /**
     * Keys used to look the value up in option tables.
     */
    List<String> optionKeys();

    /**
     * Plain-text rendering used by keyword heuristics.
     */
    String asText();

    static AnswerValue text(String text) { return new Text(text); }
    static AnswerValue choices(List<String> options) { return new Choices(options); }
    static AnswerValue numeric(double number) { return new Numeric(number); }
    static AnswerValue yesNo(boolean yes) { return new YesNo(yes); }

    record Text(String text) implements AnswerValue {
        public Text {
            text = text == null ? "" : text;
        }

        @Override
        public List<String> optionKeys() {
            return text.isBlank() ? List.of() : List.of(text.trim());
        }

        @Override
        public String asText() { return text; }
    }

    record Choices(List<String> options) implements AnswerValue {
        public Choices {
            options = options == null ? List.of() : List.copyOf(options);
        }

        @Override
        public List<String> optionKeys() { return options; }

        @Override
        public String asText() { return String.join(", ", options); }
    }

    record Numeric(double number) implements AnswerValue {
        @Override
        public List<String> optionKeys() {
            if (number == Math.rint(number) && !Double.isInfinite(number)) {
                return List.of(Long.toString((long) number));
            }
            return List.of(String.format(Locale.ROOT, "%s", number));
        }

        @Override
        public String asText() { return optionKeys().get(0); }
    }

    record YesNo(boolean yes) implements AnswerValue {
        @Override
        public List<String> optionKeys() { return List.of(yes ? "Yes" : "No"); }

        @Override
        public String asText() { return yes ? "Yes" : "No"; }
    }
}
