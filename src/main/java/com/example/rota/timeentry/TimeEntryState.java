package com.example.rota.timeentry;

public enum TimeEntryState {
    ACTIVE,
    ON_BREAK,
    CLOSED;

    public boolean isOpen() {
        return this != CLOSED;
    }
}
