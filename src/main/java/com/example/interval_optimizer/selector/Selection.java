package com.example.interval_optimizer.selector;

import java.util.List;

/**
 * Outcome of one optimisation run.
 *
 * @param selected  chosen intervals ordered by end time.
 * @param score     reported score: the count in pure count mode, otherwise {@code rawScore / SCALE}.
 * @param rawScore  accumulated integer score of the last table row.
 * @param tradeOff  trade-off the run used.
 */
public record Selection(List<Interval> selected, double score, long rawScore, TradeOff tradeOff) {

    public Selection {
        selected = List.copyOf(selected);
    }

    public static Selection empty(TradeOff tradeOff) {
        return new Selection(List.of(), 0.0, 0L, tradeOff);
    }

    public int count() {
        return selected.size();
    }

    public long totalCost() {
        long total = 0;
        for (Interval interval : selected) {
            total += interval.cost();
        }
        return total;
    }
}
