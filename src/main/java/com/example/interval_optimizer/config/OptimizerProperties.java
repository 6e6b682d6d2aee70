package com.example.interval_optimizer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Trade-off defaults and command line driver settings.
 */
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerProperties {

    private double defaultTradeOff = 0.5;

    private Cli cli = new Cli();

    public double getDefaultTradeOff() {
        return defaultTradeOff;
    }

    public void setDefaultTradeOff(double defaultTradeOff) {
        this.defaultTradeOff = defaultTradeOff;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static class Cli {
        private boolean enabled = false;
        private String input = "intervals.csv";
        /** Prompted on standard input when unset. */
        private Double tradeOff;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getInput() {
            return input;
        }

        public void setInput(String input) {
            this.input = input;
        }

        public Double getTradeOff() {
            return tradeOff;
        }

        public void setTradeOff(Double tradeOff) {
            this.tradeOff = tradeOff;
        }
    }
}
