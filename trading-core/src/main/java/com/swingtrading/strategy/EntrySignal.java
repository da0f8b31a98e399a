package com.swingtrading.strategy;

/**
 * Entry decision for one instrument on one bar. Strength is in [0, 1].
 */
public record EntrySignal(boolean signal, double strength) {
    private static final EntrySignal NONE = new EntrySignal(false, 0.0);

    public EntrySignal {
        if (Double.isNaN(strength) || strength < 0.0 || strength > 1.0) {
            throw new IllegalArgumentException("Signal strength must be in [0, 1]: " + strength);
        }
    }

    public static EntrySignal none() {
        return NONE;
    }

    public static EntrySignal of(double rawStrength) {
        double clamped = Double.isNaN(rawStrength) ? 0.0 : Math.max(0.0, Math.min(1.0, rawStrength));
        return new EntrySignal(true, clamped);
    }
}
