package com.example.rota.timeentry;

public enum ClockInFlag {
    NONE,
    EARLY,
    LATE
}
