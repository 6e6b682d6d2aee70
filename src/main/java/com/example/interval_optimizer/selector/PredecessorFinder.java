package com.example.interval_optimizer.selector;

import java.util.List;

/**
 * Binary search for the latest interval that ends before a given interval starts.
 */
public final class PredecessorFinder {

    /** Returned when no earlier interval finishes before the current one starts. */
    public static final int NONE = -1;

    private PredecessorFinder() {
    }

    /**
     * Finds the largest index {@code j < currentIndex} with {@code sorted[j].end < sorted[currentIndex].start}.
     *
     * @param sorted       intervals ordered by ascending end.
     * @param currentIndex index of the interval whose predecessor is wanted.
     * @return predecessor index, or {@link #NONE}.
     */
    public static int find(List<Interval> sorted, int currentIndex) {
        Interval current = sorted.get(currentIndex);
        int low = 0;
        int high = currentIndex - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (sorted.get(mid).endsBefore(current)) {
                // mid + 1 <= currentIndex, so the probe stays in bounds
                if (sorted.get(mid + 1).endsBefore(current)) {
                    low = mid + 1;
                } else {
                    return mid;
                }
            } else {
                high = mid - 1;
            }
        }
        return NONE;
    }
}
