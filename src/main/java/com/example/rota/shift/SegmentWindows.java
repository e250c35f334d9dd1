package com.example.rota.shift;

import com.example.rota.exception.ValidationException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Comparator;
import java.util.List;

/**
 * Time-window helpers for shifts and their segments.
 */
public final class SegmentWindows {

    private SegmentWindows() {
    }

    /**
     * Builds a window on {@code date}; an end at or before the start rolls into the next day.
     */
    public static LocalDateTime[] window(LocalDate date, LocalTime start, LocalTime end) {
        LocalDateTime from = date.atTime(start);
        LocalDateTime to = date.atTime(end);
        if (!to.isAfter(from)) {
            to = to.plusDays(1);
        }
        return new LocalDateTime[]{from, to};
    }

    /**
     * Places a segment's wall-clock times inside the shift window. Times before the shift start
     * are read as belonging to the following day, which is how overnight segments are entered.
     */
    public static LocalDateTime[] place(LocalDateTime shiftStart, LocalTime start, LocalTime end) {
        LocalDateTime from = shiftStart.toLocalDate().atTime(start);
        if (from.isBefore(shiftStart)) {
            from = from.plusDays(1);
        }
        LocalDateTime to = from.toLocalDate().atTime(end);
        if (!to.isAfter(from)) {
            to = to.plusDays(1);
        }
        return new LocalDateTime[]{from, to};
    }

    /**
     * Rejects segments that leave [start, end) or overlap one another.
     */
    public static void validate(LocalDateTime shiftStart, LocalDateTime shiftEnd, List<ShiftSegment> segments) {
        List<ShiftSegment> sorted = segments.stream()
                .sorted(Comparator.comparing(ShiftSegment::getStartAt))
                .toList();
        ShiftSegment previous = null;
        for (ShiftSegment segment : sorted) {
            if (!segment.getEndAt().isAfter(segment.getStartAt())) {
                throw new ValidationException("Segment must end after it starts", "segments", segment.getStartAt());
            }
            if (segment.getStartAt().isBefore(shiftStart) || segment.getEndAt().isAfter(shiftEnd)) {
                throw new ValidationException("Segment must lie within the shift", "segments", segment.getStartAt());
            }
            if (previous != null && segment.getStartAt().isBefore(previous.getEndAt())) {
                throw new ValidationException("Segments must not overlap", "segments", segment.getStartAt());
            }
            previous = segment;
        }
    }

    public static long overlapMinutes(LocalDateTime aStart, LocalDateTime aEnd, LocalDateTime bStart, LocalDateTime bEnd) {
        LocalDateTime from = aStart.isAfter(bStart) ? aStart : bStart;
        LocalDateTime to = aEnd.isBefore(bEnd) ? aEnd : bEnd;
        return to.isAfter(from) ? java.time.Duration.between(from, to).toMinutes() : 0;
    }
}
