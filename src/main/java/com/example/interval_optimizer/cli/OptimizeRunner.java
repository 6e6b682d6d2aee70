package com.example.interval_optimizer.cli;

import com.example.interval_optimizer.config.OptimizerProperties;
import com.example.interval_optimizer.dto.OptimizationResult;
import com.example.interval_optimizer.selector.Interval;
import com.example.interval_optimizer.service.OptimizationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line driver: reads the configured CSV, obtains a trade-off and prints the selection.
 * Enabled by the {@code cli} profile, which also turns off the web server.
 */
@Component
@ConditionalOnProperty(prefix = "optimizer.cli", name = "enabled", havingValue = "true")
public class OptimizeRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(OptimizeRunner.class);
    static final String PROMPT = "Enter the trade-off parameter (0 to 1): ";

    private final OptimizationService optimizationService;
    private final OptimizerProperties properties;
    private final ResultPrinter printer;
    private final InputStream in;
    private final PrintStream out;

    @Autowired
    public OptimizeRunner(OptimizationService optimizationService, OptimizerProperties properties, ResultPrinter printer) {
        this(optimizationService, properties, printer, System.in, System.out);
    }

    OptimizeRunner(OptimizationService optimizationService, OptimizerProperties properties, ResultPrinter printer,
                   InputStream in, PrintStream out) {
        this.optimizationService = optimizationService;
        this.properties = properties;
        this.printer = printer;
        this.in = in;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        Path input = Path.of(properties.getCli().getInput());
        log.info("Optimizing intervals from {}", input.toAbsolutePath());
        List<Interval> intervals = optimizationService.load(input);
        double tradeOff = resolveTradeOff();
        OptimizationResult result = optimizationService.optimize(intervals, tradeOff);
        printer.print(result, out);
    }

    private double resolveTradeOff() throws IOException {
        Double configured = properties.getCli().getTradeOff();
        if (configured != null) {
            return configured;
        }
        out.print(PROMPT);
        out.flush();
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line = reader.readLine();
        if (line == null || line.isBlank()) {
            throw new IllegalArgumentException("No trade-off parameter given");
        }
        try {
            return Double.parseDouble(line.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Trade-off parameter is not a number: '" + line.trim() + "'", e);
        }
    }
}
