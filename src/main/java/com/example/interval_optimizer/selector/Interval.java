package com.example.interval_optimizer.selector;

/**
 * Time span with a selection cost.
 *
 * @param start start time (inclusive).
 * @param end   end time; callers are expected to keep {@code start <= end}.
 * @param cost  cost paid when the interval is selected.
 */
public record Interval(int start, int end, int cost) {

    /**
     * Whether this interval finishes strictly before {@code other} starts.
     *
     * @param other interval that would follow this one.
     * @return {@code true} when both may be selected together in this order.
     */
    public boolean endsBefore(Interval other) {
        return end < other.start;
    }

    @Override
    public String toString() {
        return "(" + start + ", " + end + ", " + cost + ")";
    }
}
