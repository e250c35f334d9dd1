package com.example.rota.availability;

import com.example.rota.auth.AccessPolicy;
import com.example.rota.auth.Caller;
import com.example.rota.exception.NotFoundException;
import com.example.rota.exception.ValidationException;
import com.example.rota.shift.SegmentWindows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@Transactional
public class AvailabilityService {

    private static final Logger logger = LoggerFactory.getLogger(AvailabilityService.class);

    private final AvailabilityRepository repository;
    private final AccessPolicy accessPolicy;

    public AvailabilityService(AvailabilityRepository repository, AccessPolicy accessPolicy) {
        this.repository = repository;
        this.accessPolicy = accessPolicy;
    }

    public Availability add(Caller caller, AvailabilityRequest request) {
        if ((request.dayOfWeek() == null) == (request.date() == null)) {
            throw new ValidationException("Give either a day of week or a date", "dayOfWeek", request.dayOfWeek());
        }
        if (request.startTime() == null || request.endTime() == null) {
            throw new ValidationException("Start and end time are required", "startTime", request.startTime());
        }
        Availability saved = repository.save(new Availability(caller.organizationId(), caller.staffId(),
                request.dayOfWeek(), request.date(), request.startTime(), request.endTime(), request.notes()));
        logger.info("Availability added: id={}, staff={}", saved.getId(), caller.staffId());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Availability> listOwn(Caller caller) {
        return repository.findByStaffIdOrderByDayOfWeekAscDateAscStartTimeAsc(caller.staffId());
    }

    @Transactional(readOnly = true)
    public List<Availability> listOrganization(Caller caller) {
        accessPolicy.requireManager(caller);
        return repository.findByOrganizationIdOrderByStaffIdAsc(caller.organizationId());
    }

    public void delete(Caller caller, Long id) {
        Availability slot = repository.findById(id).orElseThrow(() -> new NotFoundException("Availability", id));
        accessPolicy.requireSameOrganization(caller, slot.getOrganizationId(), "Availability", id);
        accessPolicy.requireSelfOrManager(caller, slot.getStaffId());
        repository.delete(slot);
    }

    @Transactional(readOnly = true)
    public Map<Long, List<Availability>> slotsByStaff(Collection<Long> staffIds) {
        if (staffIds.isEmpty()) {
            return Map.of();
        }
        return repository.findByStaffIdIn(staffIds).stream()
                .collect(Collectors.groupingBy(Availability::getStaffId));
    }

    /**
     * True when any slot overlaps the shift window on a day the shift touches.
     */
    public static boolean covers(List<Availability> slots, LocalDateTime shiftStart, LocalDateTime shiftEnd) {
        if (slots == null || slots.isEmpty()) {
            return false;
        }
        LocalDate day = shiftStart.toLocalDate();
        LocalDate lastDay = shiftEnd.minusNanos(1).toLocalDate();
        while (!day.isAfter(lastDay)) {
            for (Availability slot : slots) {
                if (!slot.appliesOn(day)) {
                    continue;
                }
                LocalDateTime[] window = SegmentWindows.window(day, slot.getStartTime(), slot.getEndTime());
                if (SegmentWindows.overlapMinutes(window[0], window[1], shiftStart, shiftEnd) > 0) {
                    return true;
                }
            }
            day = day.plusDays(1);
        }
        return false;
    }

    public record AvailabilityRequest(DayOfWeek dayOfWeek,
                                      LocalDate date,
                                      LocalTime startTime,
                                      LocalTime endTime,
                                      String notes) {
    }
}
