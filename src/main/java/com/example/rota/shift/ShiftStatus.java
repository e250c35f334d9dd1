package com.example.rota.shift;

public enum ShiftStatus {
    OPEN,
    ASSIGNED,
    CONFIRMED
}
