package com.example.rota.breaks;

/**
 * How scheduled breaks are counted when forecasting labour.
 */
public enum BreakCalculationMode {
    /** Each shift keeps its own scheduled break. */
    PER_SHIFT,
    /** A staff member's shifts on one day are summed and the tier for the day's total applies once. */
    PER_DAY
}
