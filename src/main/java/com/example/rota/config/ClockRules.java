package com.example.rota.config;

import com.example.rota.breaks.BreakCalculationMode;
import com.example.rota.breaks.BreakTier;

import java.util.List;

/**
 * Immutable snapshot of the rules a time entry transition is evaluated against.
 */
public record ClockRules(int clockInWindowMinutes,
                         int lateGraceMinutes,
                         int clockOutGraceMinutes,
                         boolean enforceMandatedBreak,
                         List<BreakTier> defaultBreakTiers,
                         BreakCalculationMode breakCalculationMode) {

    public ClockRules {
        defaultBreakTiers = defaultBreakTiers == null ? List.of() : List.copyOf(defaultBreakTiers);
        if (breakCalculationMode == null) {
            breakCalculationMode = BreakCalculationMode.PER_SHIFT;
        }
    }
}
