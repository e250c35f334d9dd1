package com.example.rota.shift;

import com.example.rota.audit.AuditAction;
import com.example.rota.audit.AuditTrail;
import com.example.rota.auth.AccessPolicy;
import com.example.rota.auth.Caller;
import com.example.rota.availability.Availability;
import com.example.rota.availability.AvailabilityService;
import com.example.rota.breaks.BreakRules;
import com.example.rota.breaks.BreakTier;
import com.example.rota.category.ShiftCategory;
import com.example.rota.category.ShiftCategoryService;
import com.example.rota.config.RuleSettingsService;
import com.example.rota.exception.AuthorizationException;
import com.example.rota.exception.ConflictException;
import com.example.rota.exception.NotFoundException;
import com.example.rota.exception.ValidationException;
import com.example.rota.location.Location;
import com.example.rota.location.LocationService;
import com.example.rota.notification.NotificationType;
import com.example.rota.notification.Notifier;
import com.example.rota.staff.Staff;
import com.example.rota.staff.StaffRepository;
import com.example.rota.swap.SwapRequestRepository;
import com.example.rota.timeentry.TimeEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@Transactional
public class ShiftService {

    private static final Logger logger = LoggerFactory.getLogger(ShiftService.class);
    private static final String ENTITY = "Shift";

    private final ShiftRepository shiftRepository;
    private final ShiftTemplateRepository templateRepository;
    private final StaffRepository staffRepository;
    private final TimeEntryRepository timeEntryRepository;
    private final SwapRequestRepository swapRequestRepository;
    private final LocationService locationService;
    private final ShiftCategoryService categoryService;
    private final AvailabilityService availabilityService;
    private final RuleSettingsService ruleSettingsService;
    private final AccessPolicy accessPolicy;
    private final AuditTrail auditTrail;
    private final Notifier notifier;
    private final Clock clock;

    public ShiftService(ShiftRepository shiftRepository,
                        ShiftTemplateRepository templateRepository,
                        StaffRepository staffRepository,
                        TimeEntryRepository timeEntryRepository,
                        SwapRequestRepository swapRequestRepository,
                        LocationService locationService,
                        ShiftCategoryService categoryService,
                        AvailabilityService availabilityService,
                        RuleSettingsService ruleSettingsService,
                        AccessPolicy accessPolicy,
                        AuditTrail auditTrail,
                        Notifier notifier,
                        Clock clock) {
        this.shiftRepository = shiftRepository;
        this.templateRepository = templateRepository;
        this.staffRepository = staffRepository;
        this.timeEntryRepository = timeEntryRepository;
        this.swapRequestRepository = swapRequestRepository;
        this.locationService = locationService;
        this.categoryService = categoryService;
        this.availabilityService = availabilityService;
        this.ruleSettingsService = ruleSettingsService;
        this.accessPolicy = accessPolicy;
        this.auditTrail = auditTrail;
        this.notifier = notifier;
        this.clock = clock;
    }

    public ShiftView createShift(Caller caller, ShiftRequest request) {
        accessPolicy.requireManager(caller);
        if (request.date() == null || request.startTime() == null || request.endTime() == null) {
            throw new ValidationException("Date, start time and end time are required", "date", request.date());
        }
        if (request.title() == null || request.title().isBlank()) {
            throw new ValidationException("Title is required", "title", request.title());
        }
        LocalDateTime[] window = SegmentWindows.window(request.date(), request.startTime(), request.endTime());
        Shift shift = new Shift(caller.organizationId(), request.title().trim(), window[0], window[1]);
        shift.setLocation(resolveLocation(caller, request.locationId()));
        shift.setCategory(categoryService.resolve(caller, request.categoryId()));
        shift.setScheduledBreakMinutes(breakMinutes(caller, shift, request.breakMinutes()));
        if (request.segments() != null) {
            shift.replaceSegments(buildSegments(caller, shift, request.segments()));
        }
        Staff assignee = resolveStaff(caller, request.assigneeId());
        shift.assignTo(assignee);

        Shift saved = shiftRepository.save(shift);
        auditTrail.record(caller, AuditAction.SHIFT_CREATED, ENTITY, saved.getId(), saved.getTitle());
        if (assignee != null) {
            notifyAssigned(saved, assignee);
        }
        logger.info("Shift created: id={}, start={}, end={}, assignee={}",
                saved.getId(), saved.getStartAt(), saved.getEndAt(), request.assigneeId());
        return ShiftView.of(saved);
    }

    public ShiftView createFromTemplate(Caller caller, Long templateId, LocalDate date, Long assigneeId) {
        accessPolicy.requireManager(caller);
        if (date == null) {
            throw new ValidationException("Date is required", "date", null);
        }
        ShiftTemplate template = templateRepository.findById(templateId)
                .orElseThrow(() -> new NotFoundException("Template", templateId));
        accessPolicy.requireSameOrganization(caller, template.getOrganizationId(), "Template", templateId);
        if (!Boolean.TRUE.equals(template.getActive())) {
            throw new ValidationException("Template is inactive", "templateId", templateId);
        }
        ShiftRequest request = new ShiftRequest(date, template.getStartTime(), template.getEndTime(), template.getName(),
                template.getCategory() != null ? template.getCategory().getId() : null,
                template.getLocation() != null ? template.getLocation().getId() : null,
                assigneeId, null, null);
        return createShift(caller, request);
    }

    public ShiftView updateShift(Caller caller, Long id, ShiftRequest request) {
        accessPolicy.requireManager(caller);
        Shift shift = load(caller, id);
        requireNotArchived(shift);

        LocalDate date = request.date() != null ? request.date() : shift.getStartAt().toLocalDate();
        LocalTime start = request.startTime() != null ? request.startTime() : shift.getStartAt().toLocalTime();
        LocalTime end = request.endTime() != null ? request.endTime() : shift.getEndAt().toLocalTime();
        LocalDateTime[] window = SegmentWindows.window(date, start, end);
        boolean windowChanged = !window[0].equals(shift.getStartAt()) || !window[1].equals(shift.getEndAt());
        if (request.segments() == null && windowChanged) {
            SegmentWindows.validate(window[0], window[1], shift.getSegments());
        }

        if (request.title() != null) {
            if (request.title().isBlank()) {
                throw new ValidationException("Title is required", "title", request.title());
            }
            shift.setTitle(request.title().trim());
        }
        Long previousLocationId = shift.getLocation() != null ? shift.getLocation().getId() : null;
        if (request.locationId() != null) {
            shift.setLocation(resolveLocation(caller, request.locationId()));
        }
        boolean locationChanged = request.locationId() != null && !request.locationId().equals(previousLocationId);
        if (request.categoryId() != null) {
            shift.setCategory(categoryService.get(caller, request.categoryId()));
        }
        shift.setStartAt(window[0]);
        shift.setEndAt(window[1]);
        if (request.segments() != null) {
            shift.replaceSegments(buildSegments(caller, shift, request.segments()));
        }
        if (request.breakMinutes() != null || windowChanged || locationChanged) {
            // without an explicit value the break follows the tiers for the new window
            shift.setScheduledBreakMinutes(breakMinutes(caller, shift, request.breakMinutes()));
        }

        auditTrail.record(caller, AuditAction.SHIFT_UPDATED, ENTITY, shift.getId(),
                windowChanged ? "window " + shift.getStartAt() + " - " + shift.getEndAt() : "details");
        logger.info("Shift updated: id={}", shift.getId());
        return ShiftView.of(shift);
    }

    public ShiftView replaceSegments(Caller caller, Long id, List<ShiftRequest.SegmentRequest> segments) {
        accessPolicy.requireManager(caller);
        Shift shift = load(caller, id);
        requireNotArchived(shift);
        shift.replaceSegments(buildSegments(caller, shift, segments == null ? List.of() : segments));
        auditTrail.record(caller, AuditAction.SHIFT_UPDATED, ENTITY, id, shift.getSegments().size() + " segments");
        return ShiftView.of(shift);
    }

    public ShiftView assign(Caller caller, Long id, Long staffId) {
        accessPolicy.requireManager(caller);
        Shift shift = lock(caller, id);
        requireNotArchived(shift);
        Staff staff = resolveStaff(caller, staffId);
        shift.assignTo(staff);
        auditTrail.record(caller, AuditAction.SHIFT_ASSIGNED, ENTITY, id,
                staff == null ? "unassigned" : "assigned to " + staff.getId());
        if (staff != null) {
            notifyAssigned(shift, staff);
        }
        logger.info("Shift {} assigned to {}", id, staffId);
        return ShiftView.of(shift);
    }

    public ShiftView confirm(Caller caller, Long id) {
        accessPolicy.requireManager(caller);
        Shift shift = lock(caller, id);
        requireNotArchived(shift);
        if (shift.getAssignee() == null) {
            throw new ValidationException("Only an assigned shift can be confirmed", "shiftId", id);
        }
        shift.setStatus(ShiftStatus.CONFIRMED);
        auditTrail.record(caller, AuditAction.SHIFT_UPDATED, ENTITY, id, "confirmed");
        return ShiftView.of(shift);
    }

    /**
     * Staff claim of an open shift.
     */
    public ShiftView pickUp(Caller caller, Long id) {
        Shift shift = lock(caller, id);
        requireNotArchived(shift);
        if (shift.getAssignee() != null) {
            throw new ConflictException("SHIFT_TAKEN", "This shift is no longer open");
        }
        if (visibleTo(caller, List.of(shift)).isEmpty()) {
            throw new AuthorizationException("This shift is at a location you are not assigned to");
        }
        Staff staff = staffRepository.findById(caller.staffId())
                .orElseThrow(() -> new NotFoundException("Staff", caller.staffId()));
        shift.assignTo(staff);
        auditTrail.record(caller, AuditAction.SHIFT_ASSIGNED, ENTITY, id, "picked up by " + staff.getId());
        notifier.toManagers(caller.organizationId(), NotificationType.SHIFT_PICKUP, "Open shift picked up",
                staff.getName() + " picked up " + shift.getTitle() + " on " + shift.getStartAt().toLocalDate(),
                link(shift));
        logger.info("Shift {} picked up by staff {}", id, staff.getId());
        return ShiftView.of(shift);
    }

    /**
     * Hard-deletes an unreferenced shift; a shift with logged time or exchange history is archived instead.
     *
     * @return true when the shift was archived rather than deleted
     */
    public boolean deleteShift(Caller caller, Long id) {
        accessPolicy.requireManager(caller);
        Shift shift = lock(caller, id);
        if (timeEntryRepository.existsByShift_Id(id) || swapRequestRepository.existsByShift_Id(id)) {
            shift.setArchived(true);
            auditTrail.record(caller, AuditAction.SHIFT_ARCHIVED, ENTITY, id, shift.getTitle());
            logger.info("Shift {} archived, it has logged time or requests", id);
            return true;
        }
        shiftRepository.delete(shift);
        auditTrail.record(caller, AuditAction.SHIFT_DELETED, ENTITY, id, shift.getTitle());
        logger.info("Shift {} deleted", id);
        return false;
    }

    @Transactional(readOnly = true)
    public ShiftView get(Caller caller, Long id) {
        return ShiftView.of(load(caller, id));
    }

    /**
     * Shifts starting within [from, to] (whole days), each assigned one annotated with whether the
     * assignee stated availability for it.
     */
    @Transactional(readOnly = true)
    public List<ShiftView> listSchedule(Caller caller, LocalDate from, LocalDate to, Long locationId) {
        if (from == null || to == null || to.isBefore(from)) {
            throw new ValidationException("A valid date range is required", "from", from);
        }
        List<Shift> shifts = shiftRepository.findSchedule(caller.organizationId(), from.atStartOfDay(),
                to.plusDays(1).atStartOfDay());
        if (locationId != null) {
            shifts = shifts.stream()
                    .filter(s -> s.getLocation() != null && locationId.equals(s.getLocation().getId()))
                    .toList();
        }
        shifts = visibleTo(caller, shifts);
        Set<Long> staffIds = shifts.stream()
                .map(Shift::getAssignee)
                .filter(Objects::nonNull)
                .map(Staff::getId)
                .collect(Collectors.toSet());
        Map<Long, List<Availability>> slots = availabilityService.slotsByStaff(staffIds);

        List<ShiftView> views = new ArrayList<>(shifts.size());
        for (Shift shift : shifts) {
            Boolean noAvailability = null;
            if (shift.getAssignee() != null) {
                noAvailability = !AvailabilityService.covers(slots.get(shift.getAssignee().getId()),
                        shift.getStartAt(), shift.getEndAt());
            }
            views.add(ShiftView.of(shift, noAvailability));
        }
        return views;
    }

    @Transactional(readOnly = true)
    public List<ShiftView> listOpenShifts(Caller caller) {
        return visibleTo(caller, shiftRepository.findOpenFrom(caller.organizationId(), LocalDateTime.now(clock))).stream()
                .map(ShiftView::of)
                .toList();
    }

    /**
     * Staff assigned to locations see shifts at those locations plus their own; managers see everything.
     */
    private List<Shift> visibleTo(Caller caller, List<Shift> shifts) {
        if (caller.isManager()) {
            return shifts;
        }
        Set<Long> allowed = locationService.assignedLocationIds(caller.staffId());
        if (allowed.isEmpty()) {
            return shifts;
        }
        return shifts.stream()
                .filter(s -> s.isAssignedTo(caller.staffId())
                        || (s.getLocation() != null && allowed.contains(s.getLocation().getId())))
                .toList();
    }

    private Shift load(Caller caller, Long id) {
        Shift shift = shiftRepository.findById(id).orElseThrow(() -> new NotFoundException(ENTITY, id));
        accessPolicy.requireSameOrganization(caller, shift.getOrganizationId(), ENTITY, id);
        return shift;
    }

    private Shift lock(Caller caller, Long id) {
        Shift shift = shiftRepository.findByIdForUpdate(id).orElseThrow(() -> new NotFoundException(ENTITY, id));
        accessPolicy.requireSameOrganization(caller, shift.getOrganizationId(), ENTITY, id);
        return shift;
    }

    private void requireNotArchived(Shift shift) {
        if (Boolean.TRUE.equals(shift.getArchived())) {
            throw new ConflictException("SHIFT_ARCHIVED", "Shift is archived");
        }
    }

    private Location resolveLocation(Caller caller, Long locationId) {
        return locationId == null ? null : locationService.get(caller, locationId);
    }

    private Staff resolveStaff(Caller caller, Long staffId) {
        if (staffId == null) {
            return null;
        }
        Staff staff = staffRepository.findById(staffId).orElseThrow(() -> new NotFoundException("Staff", staffId));
        accessPolicy.requireSameOrganization(caller, staff.getOrganizationId(), "Staff", staffId);
        if (!Boolean.TRUE.equals(staff.getActive())) {
            throw new ValidationException("Staff member is inactive", "assigneeId", staffId);
        }
        return staff;
    }

    private int breakMinutes(Caller caller, Shift shift, Integer requested) {
        if (requested != null) {
            if (requested < 0) {
                throw new ValidationException("Break minutes must not be negative", "breakMinutes", requested);
            }
            return requested;
        }
        List<BreakTier> tiers = BreakRules.effectiveTiers(
                shift.getLocation() != null ? shift.getLocation().getBreakTiers() : null,
                ruleSettingsService.rulesFor(caller.organizationId()).defaultBreakTiers());
        return BreakRules.mandatedMinutes(shift.getStartAt(), shift.getEndAt(), tiers);
    }

    private List<ShiftSegment> buildSegments(Caller caller, Shift shift, List<ShiftRequest.SegmentRequest> requests) {
        List<ShiftSegment> segments = new ArrayList<>(requests.size());
        for (ShiftRequest.SegmentRequest request : requests) {
            if (request.startTime() == null || request.endTime() == null || request.categoryId() == null) {
                throw new ValidationException("Segments need start, end and category", "segments", request);
            }
            ShiftCategory category = categoryService.get(caller, request.categoryId());
            LocalDateTime[] window = SegmentWindows.place(shift.getStartAt(), request.startTime(), request.endTime());
            segments.add(new ShiftSegment(window[0], window[1], category));
        }
        SegmentWindows.validate(shift.getStartAt(), shift.getEndAt(), segments);
        return segments;
    }

    private void notifyAssigned(Shift shift, Staff staff) {
        notifier.toStaff(staff.getId(), NotificationType.SHIFT_ASSIGNED, "New shift",
                "You have been assigned " + shift.getTitle() + " on " + shift.getStartAt().toLocalDate(), link(shift));
    }

    private static String link(Shift shift) {
        return "/shifts/" + shift.getId();
    }
}
