package com.example.interval_optimizer.selector;

/**
 * Integer score gained by adding one interval on top of its compatible prefix.
 */
public final class InclusionScorer {

    private InclusionScorer() {
    }

    /**
     * Computes the gain of including an interval with the given cost.
     * <ul>
     *     <li>pure cost mode and a free interval: {@code +1}</li>
     *     <li>pure count mode: {@code +1}, cost ignored</li>
     *     <li>otherwise: {@code scaled - max(0, (SCALE - scaled) * cost)}</li>
     * </ul>
     * In pure cost mode a costly interval falls through to the blend, which leaves a
     * penalty of {@code SCALE * cost}.
     *
     * @param tradeOff trade-off of the current run.
     * @param cost     cost of the candidate interval.
     * @return score delta, possibly negative.
     * @throws IllegalArgumentException when the delta does not fit in a {@code long}.
     */
    public static long gain(TradeOff tradeOff, int cost) {
        if (tradeOff.isPureCost() && cost == 0) {
            return 1L;
        }
        if (tradeOff.isPureCount()) {
            return 1L;
        }
        long scaled = tradeOff.scaled();
        try {
            long penalty = Math.multiplyExact(Math.subtractExact(TradeOff.SCALE, scaled), (long) cost);
            return Math.subtractExact(scaled, Math.max(0L, penalty));
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                    "score of interval with cost " + cost + " overflows at trade-off " + tradeOff.value(), e);
        }
    }
}
