package com.example.rota.notification;

public enum NotificationType {
    CLOCK_IN_FLAGGED,
    CLOCK_IN_APPROVED,
    CLOCK_IN_REJECTED,
    MISSED_CLOCK_OUT,
    TIMESHEET_APPROVED,
    TIMESHEET_REJECTED,
    TIMESHEET_EDITED,
    MANUAL_TIME_ENTRY,
    SHIFT_ASSIGNED,
    SHIFT_PICKUP,
    SWAP_REQUEST,
    DROP_REQUEST,
    REQUEST_APPROVED,
    REQUEST_REJECTED
}
