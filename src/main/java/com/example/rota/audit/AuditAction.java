package com.example.rota.audit;

public enum AuditAction {
    TIME_ENTRY_CLOCK_IN,
    TIME_ENTRY_CLOCK_OUT,
    TIME_ENTRY_CREATED,
    TIME_ENTRY_UPDATED,
    TIME_ENTRY_APPROVED,
    TIME_ENTRY_REJECTED,
    CLOCK_IN_FLAG_CLEARED,
    CLOCK_IN_REJECTED,
    MISSED_CLOCK_OUT_FLAGGED,
    STAFF_LOCATIONS_UPDATED,
    SHIFT_CREATED,
    SHIFT_UPDATED,
    SHIFT_ASSIGNED,
    SHIFT_ARCHIVED,
    SHIFT_DELETED,
    SWAP_REQUEST_CREATED,
    SWAP_REQUEST_APPROVED,
    SWAP_REQUEST_REJECTED,
    SWAP_REQUEST_CANCELLED
}
