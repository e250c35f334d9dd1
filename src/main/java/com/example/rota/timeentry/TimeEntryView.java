package com.example.rota.timeentry;

import com.example.rota.breaks.BreakRules;

import java.time.LocalDateTime;

public record TimeEntryView(Long id,
                            Long staffId,
                            String staffName,
                            Long shiftId,
                            LocalDateTime clockIn,
                            LocalDateTime clockOut,
                            LocalDateTime breakStartedAt,
                            int breakMinutes,
                            int mandatedBreakMinutes,
                            TimeEntryState state,
                            ApprovalStatus approvalStatus,
                            ClockInFlag clockInFlag,
                            boolean flagCleared,
                            Double latitude,
                            Double longitude,
                            Double distanceMetres,
                            boolean outsideGeofence,
                            boolean lateClockOut,
                            boolean missedClockOut,
                            boolean manual,
                            String notes,
                            Double netHours) {

    public static TimeEntryView of(TimeEntry entry, boolean enforceMandatedBreak) {
        Double net = entry.getClockOut() == null ? null
                : BreakRules.netHours(entry.getClockIn(), entry.getClockOut(), entry.deductibleBreakMinutes(enforceMandatedBreak));
        return new TimeEntryView(
                entry.getId(),
                entry.getStaff().getId(),
                entry.getStaff().getName(),
                entry.getShift() != null ? entry.getShift().getId() : null,
                entry.getClockIn(),
                entry.getClockOut(),
                entry.getBreakStartedAt(),
                entry.getBreakMinutes(),
                entry.getMandatedBreakMinutes(),
                entry.getState(),
                entry.getApprovalStatus(),
                entry.getClockInFlag(),
                Boolean.TRUE.equals(entry.getFlagCleared()),
                entry.getLatitude(),
                entry.getLongitude(),
                entry.getDistanceMetres(),
                Boolean.TRUE.equals(entry.getOutsideGeofence()),
                Boolean.TRUE.equals(entry.getLateClockOut()),
                Boolean.TRUE.equals(entry.getMissedClockOut()),
                Boolean.TRUE.equals(entry.getManual()),
                entry.getNotes(),
                net);
    }
}
