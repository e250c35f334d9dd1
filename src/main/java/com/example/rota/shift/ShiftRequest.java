package com.example.rota.shift;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Create and update payload. On update, null fields keep their current value.
 */
public record ShiftRequest(LocalDate date,
                           LocalTime startTime,
                           LocalTime endTime,
                           String title,
                           Long categoryId,
                           Long locationId,
                           Long assigneeId,
                           Integer breakMinutes,
                           List<SegmentRequest> segments) {

    public record SegmentRequest(LocalTime startTime, LocalTime endTime, Long categoryId) {
    }
}
