package com.retail.herd.simulation;

public enum LoadPattern {
    /** Constant rate for the whole run. */
    BACKGROUND,
    /** Constant rate, then a burst at {@code baseRate * multiplier}. */
    SPIKE,
    /** Slow start, ramp up to {@code baseRate * multiplier}, then a slightly lower plateau. */
    GRADUAL,
    /** Constant rate, then traffic falls to {@code baseRate / multiplier}. */
    COLLAPSE
}
