package com.example.interval_optimizer.selector;

/**
 * Blend weight between maximising the selected count ({@code 1}) and minimising cost ({@code 0}).
 * Values outside {@code [0, 1]} are accepted and extrapolate the blend.
 *
 * @param value raw trade-off value.
 */
public record TradeOff(double value) {

    /** Factor that moves the trade-off into integer arithmetic. */
    public static final long SCALE = 1000L;

    /** Scaled values must stay strictly below 2^63 in magnitude. */
    private static final double SCALED_LIMIT = 0x1p63;

    public TradeOff {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("trade-off must be a finite number, got " + value);
        }
        if (Math.abs(value * SCALE) >= SCALED_LIMIT) {
            throw new IllegalArgumentException("trade-off " + value + " is too large to scale by " + SCALE);
        }
    }

    public static TradeOff of(double value) {
        return new TradeOff(value);
    }

    /**
     * Trade-off multiplied by {@link #SCALE}, truncated toward zero.
     *
     * @return scaled integer trade-off.
     */
    public long scaled() {
        return (long) (value * SCALE);
    }

    public boolean isPureCost() {
        return value == 0.0;
    }

    public boolean isPureCount() {
        return value == 1.0;
    }
}
