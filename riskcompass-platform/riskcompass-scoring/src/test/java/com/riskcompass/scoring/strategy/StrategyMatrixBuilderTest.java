package com.riskcompass.scoring.strategy;

import com.riskcompass.scoring.entitlement.EntitlementGate;
import com.riskcompass.scoring.entitlement.SubscriptionPlan;
import com.riskcompass.scoring.gap.CostRange;
import com.riskcompass.scoring.gap.EffortSize;
import com.riskcompass.scoring.gap.Gap;
import com.riskcompass.scoring.gap.GapAnalysisGenerator;
import com.riskcompass.scoring.gap.GapPrioritizer;
import com.riskcompass.scoring.gap.Priority;
import com.riskcompass.scoring.gap.Severity;
import com.riskcompass.scoring.vendor.VendorProfile;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class StrategyMatrixBuilderTest {

    private final EntitlementGate gate = new EntitlementGate(orgId ->
            "org-enterprise".equals(orgId) ? Optional.of(SubscriptionPlan.ENTERPRISE) : Optional.of(SubscriptionPlan.FREE));

    private final List<VendorProfile> vendors = List.of(
            new VendorProfile("v1", "Beta Security", Set.of("access-control", "logging")),
            new VendorProfile("v2", "Alpha Audit", Set.of("access-control")),
            new VendorProfile("v3", "Gamma Logs", Set.of("logging")),
            new VendorProfile("v4", "Delta Backup", Set.of("backup")));

    private final StrategyMatrixBuilder builder = new StrategyMatrixBuilder(gate, () -> vendors, 3);

    @Test
    void alwaysProducesThreeBucketsInTimelineOrder() {
        StrategyMatrix matrix = builder.buildMatrix(List.of());

        assertThat(matrix.buckets()).extracting(TimelineBucket::timeframe)
                .containsExactly("0-6 months", "6-18 months", "18+ months");
        assertThat(matrix.buckets()).allSatisfy(b -> {
            assertThat(b.gapCount()).isZero();
            assertThat(b.estimatedCostRange()).isEqualTo("No gaps");
            assertThat(b.emptyState()).isEqualTo(EmptyState.NO_GAPS);
        });
        assertThat(matrix.restricted()).isFalse();
    }

    @Test
    void immediateBucketIsExplicitlyEmptyWhenNoGapIsUrgent() {
        StrategyMatrix matrix = builder.buildMatrix(List.of(
                gap("g1", "logging", Priority.SHORT_TERM, CostRange.RANGE_10K_50K, EffortSize.MEDIUM),
                gap("g2", "backup", Priority.LONG_TERM, CostRange.UNDER_10K, EffortSize.SMALL)));

        TimelineBucket immediate = matrix.bucket(Timeline.IMMEDIATE);
        assertThat(immediate.isEmpty()).isTrue();
        assertThat(immediate.items()).isEmpty();
        assertThat(immediate.emptyState().title()).isEqualTo("No gaps in this timeframe");
        assertThat(immediate.emptyState().message()).isEqualTo("All requirements met");
    }

    @Test
    void shortAndMediumTermShareTheMiddleBucket() {
        StrategyMatrix matrix = builder.buildMatrix(List.of(
                gap("g1", "logging", Priority.SHORT_TERM, CostRange.RANGE_10K_50K, EffortSize.MEDIUM),
                gap("g2", "logging", Priority.MEDIUM_TERM, CostRange.UNDER_10K, EffortSize.SMALL),
                gap("g3", "backup", Priority.IMMEDIATE, CostRange.RANGE_50K_100K, EffortSize.LARGE)));

        TimelineBucket mid = matrix.bucket(Timeline.MID_TERM);
        assertThat(mid.gapCount()).isEqualTo(2);
        assertThat(mid.effortDistribution()).isEqualTo(new EffortDistribution(1, 1, 0));
        assertThat(mid.estimatedCostRange()).isEqualTo("€10K-€60K");
        assertThat(mid.emptyState()).isNull();
        assertThat(matrix.bucket(Timeline.IMMEDIATE).gapCount()).isEqualTo(1);
        assertThat(matrix.totalGaps()).isEqualTo(3);
        assertThat(matrix.summary()).startsWith("3 gaps to address");
    }

    @Test
    void openEndedCostIsFormattedWithPlus() {
        StrategyMatrix matrix = builder.buildMatrix(List.of(
                gap("g1", "logging", Priority.IMMEDIATE, CostRange.OVER_250K, EffortSize.LARGE),
                gap("g2", "logging", Priority.IMMEDIATE, CostRange.UNDER_10K, EffortSize.SMALL)));

        assertThat(matrix.bucket(Timeline.IMMEDIATE).estimatedCostRange()).isEqualTo("€250K+");
    }

    @Test
    void vendorsAreRankedByCoverageThenName() {
        StrategyMatrix matrix = builder.buildMatrix(List.of(
                gap("g1", "access-control", Priority.IMMEDIATE, null, null),
                gap("g2", "logging", Priority.IMMEDIATE, null, null),
                gap("g3", "access-control", Priority.IMMEDIATE, null, null),
                gap("g4", "backup", Priority.IMMEDIATE, null, null)));

        TimelineBucket immediate = matrix.bucket(Timeline.IMMEDIATE);
        assertThat(immediate.topVendors()).extracting(VendorRecommendation::name)
                .containsExactly("Beta Security", "Alpha Audit", "Delta Backup");
        assertThat(immediate.topVendors().get(0).gapsCovered()).isEqualTo(3);
        assertThat(immediate.topVendors().get(0).coveredGapIds()).containsExactly("g1", "g2", "g3");
        assertThat(immediate.estimatedCostRange()).isEqualTo("Not estimated");
    }

    @Test
    void gatedOrganizationGetsRedactedMatrix() {
        List<Gap> gaps = List.of(
                gap("g1", "access-control", Priority.IMMEDIATE, CostRange.UNDER_10K, EffortSize.SMALL));

        StrategyMatrix matrix = builder.buildMatrix("org-free", "a-1", gaps);

        assertThat(matrix.restricted()).isTrue();
        assertThat(matrix.summary()).isEqualTo(StrategyMatrixBuilder.UPGRADE_SUMMARY);
        assertThat(matrix.assessmentId()).isEqualTo("a-1");
        TimelineBucket immediate = matrix.bucket(Timeline.IMMEDIATE);
        assertThat(immediate.items()).extracting(BucketItem::description).containsOnly("[DETAILS HIDDEN]");
        assertThat(immediate.topVendors()).isEmpty();
    }

    @Test
    void entitledOrganizationSeesDetails() {
        StrategyMatrix matrix = builder.buildMatrix("org-enterprise", "a-1", List.of(
                gap("g1", "access-control", Priority.IMMEDIATE, CostRange.UNDER_10K, EffortSize.SMALL)));

        assertThat(matrix.restricted()).isFalse();
        assertThat(matrix.bucket(Timeline.IMMEDIATE).items().get(0).description()).isEqualTo("Details of g1");
        assertThat(matrix.bucket(Timeline.IMMEDIATE).topVendors()).isNotEmpty();
    }

    @Test
    void mockedGapsDegradeTheMatrix() {
        GapAnalysisGenerator generator = new GapAnalysisGenerator(gate, new GapPrioritizer(), () -> vendors, 70.0);
        List<Gap> mocked = generator.generateMockedGapAnalysis("a-7");

        StrategyMatrix matrix = builder.buildMatrix(mocked);

        assertThat(matrix.restricted()).isTrue();
        assertThat(matrix.bucket(Timeline.IMMEDIATE).isEmpty()).isTrue();
        TimelineBucket mid = matrix.bucket(Timeline.MID_TERM);
        assertThat(mid.gapCount()).isEqualTo(mocked.size());
        assertThat(mid.items()).extracting(BucketItem::description).containsOnly(StrategyMatrixBuilder.REDACTED);
        assertThat(mid.topVendors()).isEmpty();
        assertThat(mid.estimatedCostRange()).isEqualTo("Not estimated");
    }

    private static Gap gap(String id, String category, Priority priority, CostRange cost, EffortSize effort) {
        return new Gap(id, "a-1", "q-" + id, category, "Title " + id, "Details of " + id, Severity.HIGH,
                priority, 5, cost, effort, List.of(), false);
    }
}
