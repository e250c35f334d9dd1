package com.example.rota.timeentry;

import java.time.LocalDateTime;

/**
 * Classifies a clock-in against the scheduled start. Both boundaries are allowed:
 * EARLY is strictly before {@code start - window}, LATE strictly after {@code start + lateGrace}.
 */
public final class ClockInPolicy {

    private ClockInPolicy() {
    }

    public static ClockInFlag evaluate(LocalDateTime clockIn, LocalDateTime scheduledStart,
                                       int windowMinutes, int lateGraceMinutes) {
        if (clockIn == null || scheduledStart == null) {
            return ClockInFlag.NONE;
        }
        if (clockIn.isBefore(scheduledStart.minusMinutes(windowMinutes))) {
            return ClockInFlag.EARLY;
        }
        if (clockIn.isAfter(scheduledStart.plusMinutes(lateGraceMinutes))) {
            return ClockInFlag.LATE;
        }
        return ClockInFlag.NONE;
    }

    /**
     * Whether a clock-out lands after the shift end plus grace.
     */
    public static boolean isLateClockOut(LocalDateTime clockOut, LocalDateTime scheduledEnd, int graceMinutes) {
        return clockOut != null && scheduledEnd != null && clockOut.isAfter(scheduledEnd.plusMinutes(graceMinutes));
    }
}
