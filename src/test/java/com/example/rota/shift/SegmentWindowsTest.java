package com.example.rota.shift;

import com.example.rota.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SegmentWindowsTest {

    private static final LocalDateTime START = LocalDateTime.of(2025, 3, 10, 22, 0);
    private static final LocalDateTime END = START.plusHours(8);

    @Test
    void endAtOrBeforeStartRollsIntoNextDay() {
        LocalDateTime[] window = SegmentWindows.window(LocalDate.of(2025, 3, 10), LocalTime.of(22, 0), LocalTime.of(6, 0));
        assertThat(window[0]).isEqualTo(START);
        assertThat(window[1]).isEqualTo(LocalDateTime.of(2025, 3, 11, 6, 0));
    }

    @Test
    void segmentTimesBeforeShiftStartBelongToTheNextDay() {
        LocalDateTime[] placed = SegmentWindows.place(START, LocalTime.of(1, 0), LocalTime.of(3, 0));
        assertThat(placed[0]).isEqualTo(LocalDateTime.of(2025, 3, 11, 1, 0));
        assertThat(placed[1]).isEqualTo(LocalDateTime.of(2025, 3, 11, 3, 0));
    }

    @Test
    void adjacentSegmentsAreAccepted() {
        List<ShiftSegment> segments = List.of(
                new ShiftSegment(START, START.plusHours(2), null),
                new ShiftSegment(START.plusHours(2), START.plusHours(4), null));
        assertThatCode(() -> SegmentWindows.validate(START, END, segments)).doesNotThrowAnyException();
    }

    @Test
    void overlappingSegmentsAreRejected() {
        List<ShiftSegment> segments = List.of(
                new ShiftSegment(START.plusHours(2), START.plusHours(4), null),
                new ShiftSegment(START, START.plusHours(3), null));
        assertThatThrownBy(() -> SegmentWindows.validate(START, END, segments))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("overlap");
    }

    @Test
    void segmentOutsideShiftIsRejected() {
        List<ShiftSegment> segments = List.of(new ShiftSegment(END.minusHours(1), END.plusMinutes(1), null));
        assertThatThrownBy(() -> SegmentWindows.validate(START, END, segments))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("within");
    }

    @Test
    void overlapMinutesOfDisjointWindowsIsZero() {
        assertThat(SegmentWindows.overlapMinutes(START, START.plusHours(1), START.plusHours(2), END)).isZero();
        assertThat(SegmentWindows.overlapMinutes(START, START.plusHours(3), START.plusHours(2), END)).isEqualTo(60);
    }
}
