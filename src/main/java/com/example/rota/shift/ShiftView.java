package com.example.rota.shift;

import java.time.LocalDateTime;
import java.util.List;

public record ShiftView(Long id,
                        String title,
                        LocalDateTime startAt,
                        LocalDateTime endAt,
                        Integer scheduledBreakMinutes,
                        Long locationId,
                        String locationName,
                        Long categoryId,
                        String categoryName,
                        Long assigneeId,
                        String assigneeName,
                        ShiftStatus status,
                        boolean archived,
                        Long version,
                        List<SegmentView> segments,
                        Boolean noStatedAvailability) {

    public record SegmentView(Long id, LocalDateTime startAt, LocalDateTime endAt, Long categoryId, String categoryName) {
    }

    public static ShiftView of(Shift shift) {
        return of(shift, null);
    }

    public static ShiftView of(Shift shift, Boolean noStatedAvailability) {
        List<SegmentView> segments = shift.getSegments().stream()
                .map(s -> new SegmentView(s.getId(), s.getStartAt(), s.getEndAt(),
                        s.getCategory().getId(), s.getCategory().getName()))
                .toList();
        return new ShiftView(
                shift.getId(),
                shift.getTitle(),
                shift.getStartAt(),
                shift.getEndAt(),
                shift.getScheduledBreakMinutes(),
                shift.getLocation() != null ? shift.getLocation().getId() : null,
                shift.getLocation() != null ? shift.getLocation().getName() : null,
                shift.getCategory() != null ? shift.getCategory().getId() : null,
                shift.getCategory() != null ? shift.getCategory().getName() : null,
                shift.getAssignee() != null ? shift.getAssignee().getId() : null,
                shift.getAssignee() != null ? shift.getAssignee().getName() : null,
                shift.getStatus(),
                Boolean.TRUE.equals(shift.getArchived()),
                shift.getVersion(),
                segments,
                noStatedAvailability);
    }
}
