package com.example.rota.breaks;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * Centralized break-tier evaluation so scheduling, clock-out and manual entries stay consistent.
 */
public final class BreakRules {

    private BreakRules() {
    }

    /**
     * Returns the mandated unpaid break for a worked duration.
     * The tier with the largest threshold not above {@code hours} wins; the lower bound is inclusive.
     */
    public static int mandatedMinutes(double hours, List<BreakTier> tiers) {
        if (tiers == null || tiers.isEmpty() || hours <= 0) {
            return 0;
        }
        return tiers.stream()
                .filter(t -> t.minHours() <= hours)
                .max(Comparator.comparingDouble(BreakTier::minHours)
                        .thenComparingInt(BreakTier::breakMinutes))
                .map(BreakTier::breakMinutes)
                .orElse(0);
    }

    public static int mandatedMinutes(LocalDateTime start, LocalDateTime end, List<BreakTier> tiers) {
        return mandatedMinutes(hoursBetween(start, end), tiers);
    }

    /**
     * Location tiers win when configured, otherwise the organization default applies.
     */
    public static List<BreakTier> effectiveTiers(List<BreakTier> locationTiers, List<BreakTier> organizationDefault) {
        if (locationTiers != null && !locationTiers.isEmpty()) {
            return locationTiers;
        }
        return organizationDefault == null ? List.of() : organizationDefault;
    }

    /**
     * Net worked hours, floored at zero.
     */
    public static double netHours(LocalDateTime clockIn, LocalDateTime clockOut, int breakMinutes) {
        if (clockIn == null || clockOut == null) {
            return 0;
        }
        long minutes = Duration.between(clockIn, clockOut).toMinutes() - Math.max(0, breakMinutes);
        return Math.max(0, minutes) / 60.0;
    }

    private static double hoursBetween(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null) {
            return 0;
        }
        return Duration.between(start, end).toMinutes() / 60.0;
    }
}
