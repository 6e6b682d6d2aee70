package com.example.interval_optimizer.selector;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InclusionScorerTest {

    @Test
    void pureCostRewardsFreeIntervalsWithSingleUnit() {
        assertThat(InclusionScorer.gain(TradeOff.of(0.0), 0)).isEqualTo(1L);
    }

    @Test
    void pureCostPenalisesCostlyIntervalsThroughBlend() {
        assertThat(InclusionScorer.gain(TradeOff.of(0.0), 3)).isEqualTo(-3000L);
    }

    @Test
    void pureCountIgnoresCost() {
        assertThat(InclusionScorer.gain(TradeOff.of(1.0), 7)).isEqualTo(1L);
        assertThat(InclusionScorer.gain(TradeOff.of(1.0), 0)).isEqualTo(1L);
    }

    @Test
    void blendSubtractsWeightedCost() {
        TradeOff half = TradeOff.of(0.5);
        assertThat(InclusionScorer.gain(half, 0)).isEqualTo(500L);
        assertThat(InclusionScorer.gain(half, 1)).isEqualTo(0L);
        assertThat(InclusionScorer.gain(half, 2)).isEqualTo(-500L);
        assertThat(InclusionScorer.gain(TradeOff.of(0.25), 1)).isEqualTo(-500L);
    }

    @Test
    void negativeCostPenaltyIsClampedAtZero() {
        assertThat(InclusionScorer.gain(TradeOff.of(0.5), -2)).isEqualTo(500L);
    }

    @Test
    void outOfRangeTradeOffExtrapolates() {
        assertThat(InclusionScorer.gain(TradeOff.of(1.5), 2)).isEqualTo(1500L);
        assertThat(InclusionScorer.gain(TradeOff.of(-0.5), 1)).isEqualTo(-2000L);
    }

    @Test
    void scaledTradeOffTruncatesTowardZero() {
        assertThat(TradeOff.of(0.0019).scaled()).isEqualTo(1L);
        assertThat(TradeOff.of(-0.0019).scaled()).isEqualTo(-1L);
        assertThat(TradeOff.of(0.75).scaled()).isEqualTo(750L);
    }

    @Test
    void rejectsNonFiniteTradeOff() {
        assertThatThrownBy(() -> TradeOff.of(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TradeOff.of(Double.POSITIVE_INFINITY)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsTradeOffWhoseScaledValueExceedsLongRange() {
        assertThatThrownBy(() -> TradeOff.of(1e300)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TradeOff.of(-1e17)).isInstanceOf(IllegalArgumentException.class);
        assertThat(TradeOff.of(1e15).scaled()).isEqualTo(1_000_000_000_000_000_000L);
    }

    @Test
    void weightedCostOverflowIsRejected() {
        assertThatThrownBy(() -> InclusionScorer.gain(TradeOff.of(-1e15), Integer.MAX_VALUE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("overflows");
    }
}
