package com.example.interval_optimizer.dto;

import com.example.interval_optimizer.selector.Interval;
import com.example.interval_optimizer.selector.Selection;

import java.util.List;

/**
 * Response payload for an optimisation run.
 *
 * @param selected  selected intervals ordered by end time.
 * @param score     final score (count in pure count mode).
 * @param totalCost summed cost of the selected intervals.
 * @param count     number of selected intervals.
 * @param tradeOff  trade-off the run used.
 */
public record OptimizationResult(List<Interval> selected, double score, long totalCost, int count, double tradeOff) {

    public static OptimizationResult from(Selection selection) {
        return new OptimizationResult(selection.selected(), selection.score(), selection.totalCost(),
                selection.count(), selection.tradeOff().value());
    }

    public boolean pureCount() {
        return tradeOff == 1.0;
    }
}
