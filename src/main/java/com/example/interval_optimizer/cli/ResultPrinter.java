package com.example.interval_optimizer.cli;

import com.example.interval_optimizer.dto.OptimizationResult;
import com.example.interval_optimizer.selector.Interval;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.math.BigDecimal;

/**
 * Writes an optimisation result as plain text, one interval per line.
 */
@Component
public class ResultPrinter {

    public void print(OptimizationResult result, PrintStream out) {
        out.println();
        out.println("Optimal set of intervals:");
        for (Interval interval : result.selected()) {
            out.println(interval);
        }
        out.println();
        out.println("Maximum Score: " + formatScore(result));
        out.println();
        out.println("Total Cost Score: " + result.totalCost());
        out.println();
        out.println("Count Intervals: " + result.count());
    }

    static String formatScore(OptimizationResult result) {
        if (result.pureCount()) {
            return Long.toString((long) result.score());
        }
        // plain decimal with at least one fractional digit: 10000000.0, 0.002
        String plain = BigDecimal.valueOf(result.score()).stripTrailingZeros().toPlainString();
        return plain.contains(".") ? plain : plain + ".0";
    }
}
