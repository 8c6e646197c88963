package com.riskcompass.scoring.strategy;

import com.riskcompass.scoring.entitlement.EntitlementGate;
import com.riskcompass.scoring.gap.CostRange;
import com.riskcompass.scoring.gap.Gap;
import com.riskcompass.scoring.vendor.VendorCatalog;
import com.riskcompass.scoring.vendor.VendorProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Groups gaps into the three roadmap timeframes with effort, cost and vendor roll-ups.
 * Restricted gaps keep their shape but lose their content and never drive vendor coverage.
 */
public class StrategyMatrixBuilder {

    private static final Logger log = LoggerFactory.getLogger(StrategyMatrixBuilder.class);

    public static final String REDACTED = "[DETAILS HIDDEN]";
    public static final String UPGRADE_SUMMARY = "Upgrade to Premium to see personalized strategy recommendations";
    static final String NO_GAPS = "No gaps";
    static final String NOT_ESTIMATED = "Not estimated";

    private final EntitlementGate entitlementGate;
    private final VendorCatalog vendorCatalog;
    private final int topVendorLimit;

    public StrategyMatrixBuilder(EntitlementGate entitlementGate, VendorCatalog vendorCatalog, int topVendorLimit) {
        if (topVendorLimit < 0) {
            throw new IllegalArgumentException("Top vendor limit cannot be negative");
        }
        this.entitlementGate = entitlementGate;
        this.vendorCatalog = vendorCatalog;
        this.topVendorLimit = topVendorLimit;
    }

    /**
     * Builds the matrix for the organization, redacting everything when the organization is gated.
     */
    public StrategyMatrix buildMatrix(String organizationId, String assessmentId, List<Gap> gaps) {
        boolean gated = !entitlementGate.shouldGenerateRealAnalysis(organizationId);
        return build(assessmentId, gaps, gated);
    }

    public StrategyMatrix buildMatrix(List<Gap> gaps) {
        return build(null, gaps, false);
    }

    private StrategyMatrix build(String assessmentId, List<Gap> gaps, boolean gated) {
        Map<Timeline, List<Gap>> grouped = new EnumMap<>(Timeline.class);
        for (Timeline t : Timeline.values()) {
            grouped.put(t, new ArrayList<>());
        }
        List<Gap> input = gaps == null ? List.of() : gaps;
        for (Gap gap : input) {
            grouped.get(Timeline.forPriority(gap.priority())).add(gap);
        }

        List<VendorProfile> vendors = gated ? List.of() : vendorCatalog.approvedVendors();
        List<TimelineBucket> buckets = new ArrayList<>(Timeline.values().length);
        for (Timeline t : Timeline.values()) {
            buckets.add(bucket(t, grouped.get(t), vendors, gated));
        }

        boolean restricted = gated || input.stream().anyMatch(Gap::restricted);
        String summary = restricted ? UPGRADE_SUMMARY : summarize(buckets);
        log.debug("Built strategy matrix for assessment {}: {} gaps, restricted={}",
                assessmentId, input.size(), restricted);
        return new StrategyMatrix(assessmentId, restricted, summary, buckets);
    }

    private TimelineBucket bucket(Timeline timeline, List<Gap> gaps, List<VendorProfile> vendors, boolean gated) {
        if (gaps.isEmpty()) {
            return new TimelineBucket(timeline, 0, EffortDistribution.NONE, NO_GAPS,
                    List.of(), List.of(), EmptyState.NO_GAPS);
        }

        int small = 0;
        int medium = 0;
        int large = 0;
        List<BucketItem> items = new ArrayList<>(gaps.size());
        for (Gap gap : gaps) {
            if (gap.estimatedEffort() != null) {
                switch (gap.estimatedEffort()) {
                    case SMALL -> small++;
                    case MEDIUM -> medium++;
                    case LARGE -> large++;
                }
            }
            boolean redact = gated || gap.restricted();
            items.add(new BucketItem(gap.id(), gap.title(), gap.severity(),
                    redact ? REDACTED : gap.description()));
        }

        return new TimelineBucket(timeline, gaps.size(), new EffortDistribution(small, medium, large),
                costRange(gaps), topVendors(gaps, vendors), items, null);
    }

    /**
     * Sums the cost bands of the gaps that carry one, e.g. "€20K-€100K", or "€260K+" when a
     * band is open-ended.
     */
    String costRange(List<Gap> gaps) {
        if (gaps.isEmpty()) {
            return NO_GAPS;
        }
        int low = 0;
        int high = 0;
        boolean openEnded = false;
        boolean any = false;
        for (Gap gap : gaps) {
            CostRange cost = gap.estimatedCost();
            if (cost == null) {
                continue;
            }
            any = true;
            low += cost.lowK();
            if (cost.isOpenEnded()) {
                openEnded = true;
            } else {
                high += cost.highK();
            }
        }
        if (!any) {
            return NOT_ESTIMATED;
        }
        return openEnded ? "€" + low + "K+" : "€" + low + "K-€" + high + "K";
    }

    private List<VendorRecommendation> topVendors(List<Gap> gaps, List<VendorProfile> vendors) {
        List<VendorRecommendation> ranked = new ArrayList<>();
        for (VendorProfile vendor : vendors) {
            List<String> covered = gaps.stream()
                    .filter(g -> !g.restricted() && vendor.covers(g.category()))
                    .map(Gap::id)
                    .toList();
            if (!covered.isEmpty()) {
                ranked.add(new VendorRecommendation(vendor.id(), vendor.name(), covered.size(), covered));
            }
        }
        return ranked.stream()
                .sorted(Comparator.comparingInt(VendorRecommendation::gapsCovered).reversed()
                        .thenComparing(VendorRecommendation::name))
                .limit(topVendorLimit)
                .toList();
    }

    private String summarize(List<TimelineBucket> buckets) {
        int total = buckets.stream().mapToInt(TimelineBucket::gapCount).sum();
        if (total == 0) {
            return "No remediation required. All requirements met.";
        }
        return total + " gaps to address: "
                + buckets.get(0).gapCount() + " in " + Timeline.IMMEDIATE.label() + ", "
                + buckets.get(1).gapCount() + " in " + Timeline.MID_TERM.label() + ", "
                + buckets.get(2).gapCount() + " in " + Timeline.LONG_TERM.label() + ".";
    }
}
