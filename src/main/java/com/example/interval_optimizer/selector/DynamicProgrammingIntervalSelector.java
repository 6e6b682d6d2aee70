package com.example.interval_optimizer.selector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Weighted interval scheduling over intervals sorted by end time.
 * Row {@code i} of the table holds the best score over the first {@code i} sorted intervals; each row is
 * derived from row {@code i - 1} (skip) or from the row right after the predecessor (take).
 * Ties keep the skip branch.
 */
@Component
public class DynamicProgrammingIntervalSelector implements IntervalSelector {
    private static final Logger LOGGER = LoggerFactory.getLogger(DynamicProgrammingIntervalSelector.class);
    private static final int EXCLUDED = -1;

    @Override
    public Selection select(List<Interval> intervals, TradeOff tradeOff) {
        List<Interval> sorted = new ArrayList<>(intervals.size());
        for (Interval interval : intervals) {
            if (interval == null) {
                LOGGER.trace("selector skip null interval");
                continue;
            }
            sorted.add(interval);
        }
        if (sorted.isEmpty()) {
            LOGGER.debug("DynamicProgrammingIntervalSelector intervals=0 tradeOff={}", tradeOff.value());
            return Selection.empty(tradeOff);
        }
        // List.sort is stable: equal ends keep their input order
        sorted.sort(Comparator.comparingInt(Interval::end));

        int n = sorted.size();
        long[] best = new long[n + 1];
        int[] takenFrom = new int[n + 1];
        takenFrom[0] = EXCLUDED;

        for (int i = 1; i <= n; i++) {
            Interval current = sorted.get(i - 1);
            long skip = best[i - 1];
            int base = PredecessorFinder.find(sorted, i - 1) + 1;
            long take = takeScore(best[base], tradeOff, current, i);
            if (take > skip) {
                best[i] = take;
                takenFrom[i] = base;
            } else {
                best[i] = skip;
                takenFrom[i] = EXCLUDED;
            }
            LOGGER.trace("selector row={} interval={} skip={} take={} base={}", i, current, skip, take, base);
        }

        List<Interval> selected = backtrack(sorted, takenFrom);
        long raw = best[n];
        double score = tradeOff.isPureCount() ? selected.size() : raw / (double) TradeOff.SCALE;
        LOGGER.debug("DynamicProgrammingIntervalSelector intervals={} selected={} tradeOff={} raw={}",
                n, selected.size(), tradeOff.value(), raw);
        return new Selection(selected, score, raw, tradeOff);
    }

    private static long takeScore(long baseScore, TradeOff tradeOff, Interval current, int row) {
        try {
            return Math.addExact(baseScore, InclusionScorer.gain(tradeOff, current.cost()));
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("accumulated score overflows at row " + row
                    + " for trade-off " + tradeOff.value(), e);
        }
    }

    private static List<Interval> backtrack(List<Interval> sorted, int[] takenFrom) {
        List<Interval> selected = new ArrayList<>();
        int row = sorted.size();
        while (row > 0) {
            if (takenFrom[row] == EXCLUDED) {
                row--;
            } else {
                selected.add(sorted.get(row - 1));
                row = takenFrom[row];
            }
        }
        Collections.reverse(selected);
        return selected;
    }
}
