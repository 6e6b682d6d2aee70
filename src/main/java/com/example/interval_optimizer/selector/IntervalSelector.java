package com.example.interval_optimizer.selector;

import java.util.List;

/**
 * Picks a non-overlapping subset of intervals under a count/cost trade-off.
 */
public interface IntervalSelector {
    /**
     * Selects the best non-overlapping subset.
     *
     * @param intervals candidate intervals in any order; the list itself is left untouched.
     * @param tradeOff  blend between count ({@code 1}) and cost ({@code 0}).
     * @return selected intervals ordered by end time, with their score.
     */
    Selection select(List<Interval> intervals, TradeOff tradeOff);
}
