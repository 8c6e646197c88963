package com.riskcompass.scoring.rule;

import java.util.List;
import java.util.Map;

/**
 * Scores a multi-select answer by how many options were ticked.
 * Penalty options do not count towards the total and subtract their points instead.
 */
public record CountBucketRule(List<Bucket> buckets, Map<String, Double> penalties, double scale)
        implements ScoringRule {

    public CountBucketRule {
        if (buckets == null || buckets.isEmpty()) {
            throw new IllegalArgumentException("Count rule needs at least one bucket");
        }
        if (!(scale > 0)) {
            throw new IllegalArgumentException("Scale must be positive");
        }
        buckets = List.copyOf(buckets);
        penalties = penalties == null ? Map.of() : Map.copyOf(penalties);
    }

    @Override
    public double evaluate(AnswerValue value) throws RuleEvaluationException {
        int count = 0;
        double penalty = 0.0;
        for (String option : value.optionKeys()) {
            Double p = penalties.get(option);
            if (p != null) {
                penalty += p;
            } else {
                count++;
            }
        }

        double points = count == 0 ? 0.0 : bucketFor(count).points();
        double bounded = Math.max(0.0, Math.min(scale, points + penalty));
        return ScoringRule.clamp(bounded / scale * MAX_SCORE);
    }

    private Bucket bucketFor(int count) throws RuleEvaluationException {
        for (Bucket bucket : buckets) {
            if (bucket.contains(count)) {
                return bucket;
            }
        }
        throw new RuleEvaluationException("No bucket covers a selection count of " + count);
    }

    /**
     * Inclusive count range; {@code max} null means open-ended ("7+").
     */
    public record Bucket(int min, Integer max, double points) {

        public Bucket {
            if (min < 0 || (max != null && max < min)) {
                throw new IllegalArgumentException("Invalid bucket range " + min + "-" + max);
            }
        }

        public boolean contains(int count) {
            return count >= min && (max == null || count <= max);
        }

        /**
         * Parses "1-2", "7+" or "3".
         */
        public static Bucket parse(String range, double points) {
            String r = range.trim();
            if (r.endsWith("+")) {
                return new Bucket(Integer.parseInt(r.substring(0, r.length() - 1).trim()), null, points);
            }
            int dash = r.indexOf('-');
            if (dash > 0) {
                return new Bucket(Integer.parseInt(r.substring(0, dash).trim()),
                        Integer.parseInt(r.substring(dash + 1).trim()), points);
            }
            int exact = Integer.parseInt(r);
            return new Bucket(exact, exact, points);
        }
    }
}
