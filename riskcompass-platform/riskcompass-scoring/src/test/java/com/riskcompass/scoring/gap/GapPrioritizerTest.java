package com.riskcompass.scoring.gap;

import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class GapPrioritizerTest {

    private final GapPrioritizer prioritizer = new GapPrioritizer();

    @Property(tries = 200)
    void priorityScoreStaysBetweenOneAndTen(@ForAll @DoubleRange(min = 0, max = 100) double score,
                                            @ForAll boolean foundational,
                                            @ForAll @DoubleRange(min = 0, max = 1) double sectionWeight) {
        GapPrioritization p = prioritizer.prioritize(score, foundational, sectionWeight);

        assertThat(p.priorityScore()).isBetween(1, 10);
        assertThat(p.severity()).isNotNull();
        assertThat(p.cost()).isNotNull();
    }

    @Test
    void unansweredFoundationalQuestionInHeavySectionIsMostUrgent() {
        GapPrioritization p = prioritizer.prioritize(0.0, true, 0.3);

        assertThat(p.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(p.priorityScore()).isEqualTo(10);
        assertThat(p.priority()).isEqualTo(Priority.IMMEDIATE);
        assertThat(p.effort()).isEqualTo(EffortSize.LARGE);
        assertThat(p.cost()).isEqualTo(CostRange.OVER_250K);
    }

    @Test
    void middlingAnswerInMediumSectionIsShortTerm() {
        GapPrioritization p = prioritizer.prioritize(50.0, false, 0.2);

        assertThat(p.severity()).isEqualTo(Severity.MEDIUM);
        assertThat(p.priorityScore()).isEqualTo(6);
        assertThat(p.priority()).isEqualTo(Priority.SHORT_TERM);
        assertThat(p.effort()).isEqualTo(EffortSize.MEDIUM);
        assertThat(p.cost()).isEqualTo(CostRange.RANGE_10K_50K);
    }

    @Test
    void minorGapInLightSectionIsSmallAndCheap() {
        GapPrioritization p = prioritizer.prioritize(60.0, false, 0.1);

        assertThat(p.severity()).isEqualTo(Severity.MEDIUM);
        assertThat(p.priorityScore()).isEqualTo(5);
        assertThat(p.priority()).isEqualTo(Priority.MEDIUM_TERM);
        assertThat(p.effort()).isEqualTo(EffortSize.SMALL);
        assertThat(p.cost()).isEqualTo(CostRange.UNDER_10K);
    }
}
