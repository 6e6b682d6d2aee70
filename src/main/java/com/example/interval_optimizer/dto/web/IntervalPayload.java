package com.example.interval_optimizer.dto.web;

import com.example.interval_optimizer.selector.Interval;
import jakarta.validation.constraints.NotNull;

public record IntervalPayload(@NotNull Integer start,
                              @NotNull Integer end,
                              @NotNull Integer cost) {

    public Interval toInterval() {
        return new Interval(start, end, cost);
    }
}
