package com.example.interval_optimizer.service;

import com.example.interval_optimizer.config.OptimizerProperties;
import com.example.interval_optimizer.dto.OptimizationResult;
import com.example.interval_optimizer.selector.Interval;
import com.example.interval_optimizer.selector.IntervalSelector;
import com.example.interval_optimizer.selector.Selection;
import com.example.interval_optimizer.selector.TradeOff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads intervals, runs the selector and summarises the outcome.
 */
@Service
public class OptimizationService {
    private static final Logger log = LoggerFactory.getLogger(OptimizationService.class);

    private final IntervalSelector selector;
    private final IntervalSource source;
    private final OptimizerProperties properties;

    public OptimizationService(IntervalSelector selector, IntervalSource source, OptimizerProperties properties) {
        this.selector = selector;
        this.source = source;
        this.properties = properties;
    }

    /**
     * Optimises an in-memory interval collection.
     *
     * @param intervals candidate intervals; never reordered.
     * @param tradeOff  trade-off, or {@code null} for the configured default.
     * @return summarised result.
     * @throws IllegalArgumentException when the trade-off is not a finite number.
     */
    public OptimizationResult optimize(List<Interval> intervals, @Nullable Double tradeOff) {
        TradeOff effective = TradeOff.of(tradeOff != null ? tradeOff : properties.getDefaultTradeOff());
        long started = System.currentTimeMillis();
        Selection selection = selector.select(intervals, effective);
        log.info("Optimized intervals={} tradeOff={} selected={} score={} tookMs={}",
                intervals.size(), effective.value(), selection.count(), selection.score(),
                System.currentTimeMillis() - started);
        return OptimizationResult.from(selection);
    }

    public List<Interval> load(Path path) {
        return source.read(path);
    }

    public OptimizationResult optimizeCsv(InputStream in, String sourceName, @Nullable Double tradeOff) {
        return optimize(source.read(in, sourceName), tradeOff);
    }
}
