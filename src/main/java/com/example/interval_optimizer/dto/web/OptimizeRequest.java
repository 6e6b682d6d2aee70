package com.example.interval_optimizer.dto.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * @param intervals candidate intervals.
 * @param tradeOff  optional trade-off; the configured default applies when absent.
 */
public record OptimizeRequest(@NotNull @Valid List<@NotNull IntervalPayload> intervals, Double tradeOff) {
}
