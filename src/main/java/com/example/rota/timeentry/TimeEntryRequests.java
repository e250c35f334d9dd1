package com.example.rota.timeentry;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Payloads accepted by the time entry endpoints.
 */
public final class TimeEntryRequests {

    private TimeEntryRequests() {
    }

    public record ClockIn(Long shiftId, Double latitude, Double longitude) {
    }

    public record ManualEntry(
            @NotNull(message = "Staff is required") Long staffId,
            @NotNull(message = "Date is required") LocalDate date,
            @NotNull(message = "Clock-in time is required") LocalTime clockIn,
            @NotNull(message = "Clock-out time is required") LocalTime clockOut,
            @Min(value = 0, message = "Break minutes must not be negative") Integer breakMinutes,
            Long shiftId,
            @Size(max = 500) String notes) {
    }

    public record Correction(
            LocalDateTime clockIn,
            LocalDateTime clockOut,
            @Min(value = 0, message = "Break minutes must not be negative") Integer breakMinutes,
            @Size(max = 500) String notes) {
    }
}
