package com.riskcompass.scoring.rule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses the JSON rule blob stored on a question into a {@link ScoringRule}.
 *
 * <p>Recognised shapes:
 * <pre>
 *   {"scale": 5, "mapping": {"Yes": 5, "No": 0}}
 *   {"scale": 5, "countBased": true, "penalties": {"None": -3}, "ranges": {"1-2": 2, "7+": 5}}
 *   {"type": "keyword", "keywords": ["encryption"], "negativeKeywords": ["none"]}
 * </pre>
 * An explicit {@code type} of mapping, count or keyword wins over shape detection.
 */
public final class ScoringRules {

    static final double DEFAULT_SCALE = 5.0;

    private ScoringRules() {
    }

    /**
     * @throws IllegalArgumentException if the blob is empty or does not match any known shape
     */
    public static ScoringRule parse(Map<String, Object> blob) {
        if (blob == null || blob.isEmpty()) {
            throw new IllegalArgumentException("Scoring rule is empty");
        }
        String type = detectType(blob);
        double scale = blob.containsKey("scale") ? toDouble(blob.get("scale"), "scale") : DEFAULT_SCALE;

        switch (type) {
            case "mapping":
                return new MappingRule(toPoints(blob.get("mapping"), "mapping"), scale);
            case "count":
                return new CountBucketRule(toBuckets(blob.get("ranges")),
                        blob.containsKey("penalties") ? toPoints(blob.get("penalties"), "penalties") : Map.of(),
                        scale);
            case "keyword":
                return new KeywordRule(toStrings(blob.get("keywords")), toStrings(blob.get("negativeKeywords")));
            default:
                throw new IllegalArgumentException("Unknown scoring rule type: " + type);
        }
    }

    private static String detectType(Map<String, Object> blob) {
        Object explicit = blob.get("type");
        if (explicit instanceof String s && !s.isBlank()) {
            return s.trim().toLowerCase(Locale.ROOT);
        }
        if (Boolean.TRUE.equals(blob.get("countBased")) || blob.containsKey("ranges")) {
            return "count";
        }
        if (blob.containsKey("mapping")) {
            return "mapping";
        }
        if (blob.containsKey("keywords") || blob.containsKey("negativeKeywords")) {
            return "keyword";
        }
        throw new IllegalArgumentException("Unrecognised scoring rule shape: " + blob.keySet());
    }

    private static Map<String, Double> toPoints(Object raw, String field) {
        if (!(raw instanceof Map<?, ?> map) || map.isEmpty()) {
            throw new IllegalArgumentException("'" + field + "' must be a non-empty object");
        }
        Map<String, Double> points = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            points.put(String.valueOf(entry.getKey()), toDouble(entry.getValue(), field + "." + entry.getKey()));
        }
        return points;
    }

    private static List<CountBucketRule.Bucket> toBuckets(Object raw) {
        Map<String, Double> ranges = toPoints(raw, "ranges");
        List<CountBucketRule.Bucket> buckets = new ArrayList<>();
        for (Map.Entry<String, Double> entry : ranges.entrySet()) {
            try {
                buckets.add(CountBucketRule.Bucket.parse(entry.getKey(), entry.getValue()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed range '" + entry.getKey() + "'", e);
            }
        }
        return buckets;
    }

    private static List<String> toStrings(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof Collection<?> values)) {
            throw new IllegalArgumentException("Keyword lists must be arrays");
        }
        return values.stream().map(String::valueOf).toList();
    }

    private static double toDouble(Object raw, String field) {
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("'" + field + "' is not a number: " + s, e);
            }
        }
        throw new IllegalArgumentException("'" + field + "' is not a number");
    }
}
