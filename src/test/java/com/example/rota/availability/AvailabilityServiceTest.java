package com.example.rota.availability;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AvailabilityServiceTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 3, 10);

    @Test
    void weeklySlotCoversOverlappingShift() {
        List<Availability> slots = List.of(weekly(DayOfWeek.MONDAY, 8, 12));

        assertThat(AvailabilityService.covers(slots, MONDAY.atTime(11, 0), MONDAY.atTime(19, 0))).isTrue();
        assertThat(AvailabilityService.covers(slots, MONDAY.atTime(12, 0), MONDAY.atTime(19, 0))).isFalse();
        assertThat(AvailabilityService.covers(slots, MONDAY.plusDays(1).atTime(9, 0), MONDAY.plusDays(1).atTime(17, 0))).isFalse();
    }

    @Test
    void overnightShiftIsCoveredBySlotOnEitherDay() {
        List<Availability> tuesdayMorning = List.of(weekly(DayOfWeek.TUESDAY, 0, 4));
        LocalDateTime start = MONDAY.atTime(22, 0);

        assertThat(AvailabilityService.covers(tuesdayMorning, start, start.plusHours(8))).isTrue();
    }

    @Test
    void datedSlotAppliesOnlyOnThatDate() {
        Availability dated = new Availability(1L, 7L, null, MONDAY, LocalTime.of(9, 0), LocalTime.of(17, 0), null);

        assertThat(AvailabilityService.covers(List.of(dated), MONDAY.atTime(9, 0), MONDAY.atTime(17, 0))).isTrue();
        assertThat(AvailabilityService.covers(List.of(dated), MONDAY.plusWeeks(1).atTime(9, 0), MONDAY.plusWeeks(1).atTime(17, 0))).isFalse();
    }

    @Test
    void noSlotsMeansNoStatedAvailability() {
        assertThat(AvailabilityService.covers(List.of(), MONDAY.atTime(9, 0), MONDAY.atTime(17, 0))).isFalse();
        assertThat(AvailabilityService.covers(null, MONDAY.atTime(9, 0), MONDAY.atTime(17, 0))).isFalse();
    }

    private static Availability weekly(DayOfWeek day, int fromHour, int toHour) {
        return new Availability(1L, 7L, day, null, LocalTime.of(fromHour, 0), LocalTime.of(toHour, 0), null);
    }
}
