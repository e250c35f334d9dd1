package com.example.rota.timeentry;

import com.example.rota.audit.AuditAction;
import com.example.rota.audit.AuditTrail;
import com.example.rota.auth.AccessPolicy;
import com.example.rota.auth.Caller;
import com.example.rota.breaks.BreakRules;
import com.example.rota.breaks.BreakTier;
import com.example.rota.config.ClockRules;
import com.example.rota.config.RuleSettingsService;
import com.example.rota.exception.AuthorizationException;
import com.example.rota.exception.ConflictException;
import com.example.rota.exception.NotFoundException;
import com.example.rota.exception.ValidationException;
import com.example.rota.geofence.GeofenceCheck;
import com.example.rota.geofence.GeofenceValidator;
import com.example.rota.location.Location;
import com.example.rota.notification.NotificationType;
import com.example.rota.notification.Notifier;
import com.example.rota.shift.SegmentWindows;
import com.example.rota.shift.Shift;
import com.example.rota.shift.ShiftRepository;
import com.example.rota.staff.Staff;
import com.example.rota.staff.StaffRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Clock-in/out lifecycle of time entries plus the manager review operations.
 * Every clock transition of a staff member runs under a row lock on that staff record.
 */
@Service
@Transactional
public class TimeEntryService {

    private static final Logger logger = LoggerFactory.getLogger(TimeEntryService.class);
    private static final String ENTITY = "TimeEntry";

    private final TimeEntryRepository entryRepository;
    private final StaffRepository staffRepository;
    private final ShiftRepository shiftRepository;
    private final RuleSettingsService ruleSettingsService;
    private final AccessPolicy accessPolicy;
    private final AuditTrail auditTrail;
    private final Notifier notifier;
    private final Clock clock;

    public TimeEntryService(TimeEntryRepository entryRepository,
                            StaffRepository staffRepository,
                            ShiftRepository shiftRepository,
                            RuleSettingsService ruleSettingsService,
                            AccessPolicy accessPolicy,
                            AuditTrail auditTrail,
                            Notifier notifier,
                            Clock clock) {
        this.entryRepository = entryRepository;
        this.staffRepository = staffRepository;
        this.shiftRepository = shiftRepository;
        this.ruleSettingsService = ruleSettingsService;
        this.accessPolicy = accessPolicy;
        this.auditTrail = auditTrail;
        this.notifier = notifier;
        this.clock = clock;
    }

    public TimeEntryView clockIn(Caller caller, TimeEntryRequests.ClockIn request) {
        Staff staff = lockStaff(caller.staffId());
        if (entryRepository.findByActiveStaffId(staff.getId()).isPresent()) {
            logger.warn("Clock-in rejected, staff {} already has an open entry", staff.getId());
            throw new ConflictException("ALREADY_CLOCKED_IN", "You are already clocked in");
        }
        LocalDateTime now = now();
        ClockRules rules = ruleSettingsService.rulesFor(caller.organizationId());
        Shift shift = request != null && request.shiftId() != null
                ? requireOwnShift(caller, request.shiftId())
                : scheduledShiftFor(staff.getId(), now).orElse(null);

        TimeEntry entry = new TimeEntry(staff, shift, now);
        Double latitude = request != null ? request.latitude() : null;
        Double longitude = request != null ? request.longitude() : null;
        entry.setPosition(latitude, longitude);

        Location location = shift != null ? shift.getLocation() : null;
        GeofenceCheck check = location == null
                ? GeofenceCheck.unchecked(null)
                : GeofenceValidator.check(latitude, longitude, location.getLatitude(), location.getLongitude(),
                location.getClockInRadiusMetres());
        entry.setDistanceMetres(check.distanceMetres());
        entry.setOutsideGeofence(!check.allowed());

        if (shift != null) {
            entry.setClockInFlag(ClockInPolicy.evaluate(now, shift.getStartAt(),
                    rules.clockInWindowMinutes(), rules.lateGraceMinutes()));
        }

        TimeEntry saved = entryRepository.saveAndFlush(entry);
        auditTrail.record(caller, AuditAction.TIME_ENTRY_CLOCK_IN, ENTITY, saved.getId(),
                "flag=" + saved.getClockInFlag() + ", outsideGeofence=" + saved.getOutsideGeofence());

        if (saved.isFlagged() || Boolean.TRUE.equals(saved.getOutsideGeofence())) {
            logger.warn("Flagged clock-in: entry={}, staff={}, flag={}, distance={}",
                    saved.getId(), staff.getId(), saved.getClockInFlag(), saved.getDistanceMetres());
            notifier.toManagers(caller.organizationId(), NotificationType.CLOCK_IN_FLAGGED, "Clock-in needs review",
                    describeFlag(staff, saved), link(saved));
        }
        logger.info("Clock-in: entry={}, staff={}, shift={}", saved.getId(), staff.getId(),
                shift != null ? shift.getId() : null);
        return view(saved, rules);
    }

    public TimeEntryView startBreak(Caller caller, Long entryId) {
        lockStaff(caller.staffId());
        TimeEntry entry = ownEntry(caller, entryId);
        switch (entry.getState()) {
            case ON_BREAK -> throw new ValidationException("ALREADY_ON_BREAK", "You are already on a break");
            case CLOSED -> throw new ValidationException("ENTRY_CLOSED", "This time entry is already closed");
            default -> entry.startBreak(now());
        }
        logger.info("Break started: entry={}", entryId);
        return view(entry);
    }

    public TimeEntryView endBreak(Caller caller, Long entryId) {
        lockStaff(caller.staffId());
        TimeEntry entry = ownEntry(caller, entryId);
        if (entry.getState() != TimeEntryState.ON_BREAK) {
            throw new ValidationException("NOT_ON_BREAK", "You are not on a break");
        }
        long seconds = Duration.between(entry.getBreakStartedAt(), now()).getSeconds();
        int elapsed = (int) Math.round(Math.max(0, seconds) / 60.0);
        entry.endBreak(elapsed);
        logger.info("Break ended: entry={}, minutes={}, total={}", entryId, elapsed, entry.getBreakMinutes());
        return view(entry);
    }

    public TimeEntryView clockOut(Caller caller, Long entryId) {
        lockStaff(caller.staffId());
        TimeEntry entry = ownEntry(caller, entryId);
        switch (entry.getState()) {
            case ON_BREAK -> throw new ValidationException("ON_BREAK", "End your break before clocking out");
            case CLOSED -> throw new ValidationException("ENTRY_CLOSED", "You have already clocked out");
            default -> { }
        }
        ClockRules rules = ruleSettingsService.rulesFor(entry.getOrganizationId());
        LocalDateTime now = now();
        entry.close(now);
        entry.setMandatedBreakMinutes(BreakRules.mandatedMinutes(entry.getClockIn(), now, tiersFor(entry.getShift(), rules)));
        if (entry.getShift() != null) {
            entry.setLateClockOut(ClockInPolicy.isLateClockOut(now, entry.getShift().getEndAt(),
                    rules.clockOutGraceMinutes()));
        }
        auditTrail.record(caller, AuditAction.TIME_ENTRY_CLOCK_OUT, ENTITY, entryId,
                "break=" + entry.getBreakMinutes() + ", mandated=" + entry.getMandatedBreakMinutes());
        logger.info("Clock-out: entry={}, break={}, mandated={}, lateClockOut={}",
                entryId, entry.getBreakMinutes(), entry.getMandatedBreakMinutes(), entry.getLateClockOut());
        return view(entry, rules);
    }

    public TimeEntryView approve(Caller caller, Long entryId) {
        return review(caller, entryId, ApprovalStatus.APPROVED);
    }

    public TimeEntryView reject(Caller caller, Long entryId) {
        return review(caller, entryId, ApprovalStatus.REJECTED);
    }

    private TimeEntryView review(Caller caller, Long entryId, ApprovalStatus target) {
        accessPolicy.requireManager(caller);
        TimeEntry entry = loadLocked(caller, entryId);
        if (entry.getState() != TimeEntryState.CLOSED) {
            throw new ValidationException("ENTRY_OPEN", "Only closed entries can be reviewed");
        }
        AuditAction action = target == ApprovalStatus.APPROVED
                ? AuditAction.TIME_ENTRY_APPROVED : AuditAction.TIME_ENTRY_REJECTED;
        if (entry.getApprovalStatus() == target) {
            auditTrail.record(caller, action, ENTITY, entryId, "unchanged");
            return view(entry);
        }
        entry.markReviewed(target, caller.staffId(), now());
        auditTrail.record(caller, action, ENTITY, entryId, target.name());
        boolean approved = target == ApprovalStatus.APPROVED;
        notifier.toStaff(entry.getStaff().getId(),
                approved ? NotificationType.TIMESHEET_APPROVED : NotificationType.TIMESHEET_REJECTED,
                approved ? "Timesheet approved" : "Timesheet rejected",
                "Your time entry for " + entry.getClockIn().toLocalDate() + " was " + target.name().toLowerCase(),
                link(entry));
        logger.info("Time entry {} {} by {}", entryId, target, caller.staffId());
        return view(entry);
    }

    public TimeEntryView clearClockInFlag(Caller caller, Long entryId) {
        accessPolicy.requireManager(caller);
        TimeEntry entry = loadLocked(caller, entryId);
        if (!entry.isFlagged() && !Boolean.TRUE.equals(entry.getOutsideGeofence())) {
            throw new ValidationException("NOT_FLAGGED", "This clock-in has no flag to clear");
        }
        if (Boolean.TRUE.equals(entry.getFlagCleared())) {
            return view(entry);
        }
        entry.clearFlag(caller.staffId(), now());
        auditTrail.record(caller, AuditAction.CLOCK_IN_FLAG_CLEARED, ENTITY, entryId, entry.getClockInFlag().name());
        notifier.toStaff(entry.getStaff().getId(), NotificationType.CLOCK_IN_APPROVED, "Clock-in approved",
                "Your clock-in on " + entry.getClockIn().toLocalDate() + " was approved", link(entry));
        logger.info("Clock-in flag cleared: entry={}, by={}", entryId, caller.staffId());
        return view(entry);
    }

    public TimeEntryView rejectClockIn(Caller caller, Long entryId) {
        accessPolicy.requireManager(caller);
        TimeEntry entry = loadLocked(caller, entryId);
        if (entry.getState().isOpen()) {
            LocalDateTime now = now();
            entry.close(now);
            ClockRules rules = ruleSettingsService.rulesFor(entry.getOrganizationId());
            entry.setMandatedBreakMinutes(BreakRules.mandatedMinutes(entry.getClockIn(), now, tiersFor(entry.getShift(), rules)));
        }
        entry.markReviewed(ApprovalStatus.REJECTED, caller.staffId(), now());
        auditTrail.record(caller, AuditAction.CLOCK_IN_REJECTED, ENTITY, entryId, entry.getClockInFlag().name());
        notifier.toStaff(entry.getStaff().getId(), NotificationType.CLOCK_IN_REJECTED, "Clock-in rejected",
                "Your clock-in on " + entry.getClockIn().toLocalDate() + " was rejected", link(entry));
        logger.info("Clock-in rejected: entry={}, by={}", entryId, caller.staffId());
        return view(entry);
    }

    public TimeEntryView createManualEntry(Caller caller, TimeEntryRequests.ManualEntry request) {
        accessPolicy.requireManager(caller);
        Staff staff = staffRepository.findById(request.staffId())
                .orElseThrow(() -> new NotFoundException("Staff", request.staffId()));
        accessPolicy.requireSameOrganization(caller, staff.getOrganizationId(), "Staff", request.staffId());
        Shift shift = null;
        if (request.shiftId() != null) {
            shift = shiftRepository.findById(request.shiftId())
                    .orElseThrow(() -> new NotFoundException("Shift", request.shiftId()));
            accessPolicy.requireSameOrganization(caller, shift.getOrganizationId(), "Shift", request.shiftId());
        }
        ClockRules rules = ruleSettingsService.rulesFor(caller.organizationId());
        LocalDateTime[] window = SegmentWindows.window(request.date(), request.clockIn(), request.clockOut());
        int mandated = BreakRules.mandatedMinutes(window[0], window[1], tiersFor(shift, rules));
        int breakMinutes = request.breakMinutes() != null ? request.breakMinutes() : mandated;

        TimeEntry entry = TimeEntry.manual(staff, shift, window[0], window[1], breakMinutes);
        entry.setMandatedBreakMinutes(mandated);
        entry.setNotes(request.notes());
        TimeEntry saved = entryRepository.save(entry);

        auditTrail.record(caller, AuditAction.TIME_ENTRY_CREATED, ENTITY, saved.getId(),
                "manual " + window[0] + " - " + window[1]);
        notifier.toStaff(staff.getId(), NotificationType.MANUAL_TIME_ENTRY, "Time entry added",
                "A manager added a time entry for " + request.date(), link(saved));
        logger.info("Manual entry created: id={}, staff={}, by={}", saved.getId(), staff.getId(), caller.staffId());
        return view(saved, rules);
    }

    /**
     * Manager correction of a closed entry; the only mutation allowed once an entry is approved.
     */
    public TimeEntryView correct(Caller caller, Long entryId, TimeEntryRequests.Correction request) {
        accessPolicy.requireManager(caller);
        TimeEntry entry = loadLocked(caller, entryId);
        if (entry.getState() != TimeEntryState.CLOSED) {
            throw new ValidationException("ENTRY_OPEN", "Only closed entries can be corrected");
        }
        LocalDateTime clockIn = request.clockIn() != null ? request.clockIn() : entry.getClockIn();
        LocalDateTime clockOut = request.clockOut() != null ? request.clockOut() : entry.getClockOut();
        if (!clockOut.isAfter(clockIn)) {
            throw new ValidationException("Clock-out must be after clock-in", "clockOut", clockOut);
        }
        StringBuilder detail = new StringBuilder();
        if (!clockIn.equals(entry.getClockIn()) || !clockOut.equals(entry.getClockOut())) {
            detail.append("window ").append(entry.getClockIn()).append(" - ").append(entry.getClockOut())
                    .append(" -> ").append(clockIn).append(" - ").append(clockOut).append("; ");
        }
        entry.setClockIn(clockIn);
        entry.setClockOut(clockOut);
        if (request.breakMinutes() != null) {
            if (request.breakMinutes() < 0) {
                throw new ValidationException("Break minutes must not be negative", "breakMinutes", request.breakMinutes());
            }
            detail.append("break ").append(entry.getBreakMinutes()).append(" -> ").append(request.breakMinutes()).append("; ");
            entry.setBreakMinutes(request.breakMinutes());
        }
        if (request.notes() != null) {
            entry.setNotes(request.notes());
        }
        ClockRules rules = ruleSettingsService.rulesFor(entry.getOrganizationId());
        entry.setMandatedBreakMinutes(BreakRules.mandatedMinutes(clockIn, clockOut, tiersFor(entry.getShift(), rules)));

        auditTrail.record(caller, AuditAction.TIME_ENTRY_UPDATED, ENTITY, entryId, detail.toString().trim());
        notifier.toStaff(entry.getStaff().getId(), NotificationType.TIMESHEET_EDITED, "Timesheet edited",
                "A manager corrected your time entry for " + clockIn.toLocalDate(), link(entry));
        logger.info("Time entry {} corrected by {}", entryId, caller.staffId());
        return view(entry, rules);
    }

    /**
     * Flags every entry of the caller's organization that is still open from a previous day.
     * Flagged entries stay open; managers are told once per entry.
     */
    public List<TimeEntryView> flagMissedClockOuts(Caller caller) {
        accessPolicy.requireManager(caller);
        LocalDateTime cutoff = now().toLocalDate().atStartOfDay();
        List<TimeEntryView> flagged = new ArrayList<>();
        for (Long entryId : entryRepository.findUnflaggedOpenBefore(caller.organizationId(), cutoff)) {
            TimeEntry entry = loadLocked(caller, entryId);
            if (!entry.getState().isOpen() || Boolean.TRUE.equals(entry.getMissedClockOut())) {
                continue;
            }
            entry.markMissedClockOut();
            LocalDateTime clockIn = entry.getClockIn();
            auditTrail.record(caller, AuditAction.MISSED_CLOCK_OUT_FLAGGED, ENTITY, entryId, "clockIn=" + clockIn);
            notifier.toManagers(entry.getOrganizationId(), NotificationType.MISSED_CLOCK_OUT, "Missed clock-out",
                    entry.getStaff().getName() + " forgot to clock out. Clocked in " + clockIn.toLocalDate()
                            + " at " + clockIn.toLocalTime().truncatedTo(ChronoUnit.MINUTES) + ".",
                    link(entry));
            flagged.add(view(entry));
        }
        logger.info("Missed clock-outs flagged: organization={}, count={}", caller.organizationId(), flagged.size());
        return flagged;
    }

    @Transactional(readOnly = true)
    public Optional<TimeEntryView> currentEntry(Caller caller) {
        return entryRepository.findByActiveStaffId(caller.staffId()).map(this::view);
    }

    /**
     * Entries whose clock-in falls within [from, to] (whole days). Staff only see their own entries.
     */
    @Transactional(readOnly = true)
    public List<TimeEntryView> list(Caller caller, Long staffId, LocalDate from, LocalDate to) {
        if (from == null || to == null || to.isBefore(from)) {
            throw new ValidationException("A valid date range is required", "from", from);
        }
        LocalDateTime start = from.atStartOfDay();
        LocalDateTime end = to.plusDays(1).atStartOfDay();
        ClockRules rules = ruleSettingsService.rulesFor(caller.organizationId());
        List<TimeEntry> entries;
        if (!caller.isManager()) {
            if (staffId != null && !staffId.equals(caller.staffId())) {
                throw new AuthorizationException("You can only view your own time entries");
            }
            entries = entryRepository.findByStaffInRange(caller.staffId(), start, end);
        } else if (staffId != null) {
            Staff staff = staffRepository.findById(staffId).orElseThrow(() -> new NotFoundException("Staff", staffId));
            accessPolicy.requireSameOrganization(caller, staff.getOrganizationId(), "Staff", staffId);
            entries = entryRepository.findByStaffInRange(staffId, start, end);
        } else {
            entries = entryRepository.findByOrganizationInRange(caller.organizationId(), start, end);
        }
        return entries.stream().map(e -> view(e, rules)).toList();
    }

    private Staff lockStaff(Long staffId) {
        return staffRepository.findByIdForUpdate(staffId).orElseThrow(() -> new NotFoundException("Staff", staffId));
    }

    /**
     * Locks the owning staff row before reading the entry, so manager edits serialize with clock transitions.
     */
    private TimeEntry loadLocked(Caller caller, Long entryId) {
        Long staffId = entryRepository.findStaffIdById(entryId).orElseThrow(() -> new NotFoundException(ENTITY, entryId));
        lockStaff(staffId);
        return load(caller, entryId);
    }

    private TimeEntry load(Caller caller, Long entryId) {
        TimeEntry entry = entryRepository.findById(entryId).orElseThrow(() -> new NotFoundException(ENTITY, entryId));
        accessPolicy.requireSameOrganization(caller, entry.getOrganizationId(), ENTITY, entryId);
        return entry;
    }

    private TimeEntry ownEntry(Caller caller, Long entryId) {
        TimeEntry entry = load(caller, entryId);
        accessPolicy.requireSelf(caller, entry.getStaff().getId());
        return entry;
    }

    private Shift requireOwnShift(Caller caller, Long shiftId) {
        Shift shift = shiftRepository.findById(shiftId).orElseThrow(() -> new NotFoundException("Shift", shiftId));
        accessPolicy.requireSameOrganization(caller, shift.getOrganizationId(), "Shift", shiftId);
        if (Boolean.TRUE.equals(shift.getArchived())) {
            throw new NotFoundException("Shift", shiftId);
        }
        if (!shift.isAssignedTo(caller.staffId())) {
            throw new AuthorizationException("This shift is not assigned to you");
        }
        return shift;
    }

    /**
     * Today's shift in progress, else the one starting nearest to now.
     */
    private Optional<Shift> scheduledShiftFor(Long staffId, LocalDateTime now) {
        LocalDateTime dayStart = now.toLocalDate().atStartOfDay();
        List<Shift> shifts = shiftRepository.findAssignedOverlapping(staffId, dayStart, dayStart.plusDays(1));
        Optional<Shift> inProgress = shifts.stream()
                .filter(s -> !s.getStartAt().isAfter(now) && s.getEndAt().isAfter(now))
                .findFirst();
        if (inProgress.isPresent()) {
            return inProgress;
        }
        return shifts.stream()
                .min(Comparator.comparingLong(s -> Math.abs(Duration.between(now, s.getStartAt()).toMinutes())));
    }

    private List<BreakTier> tiersFor(Shift shift, ClockRules rules) {
        List<BreakTier> locationTiers = shift != null && shift.getLocation() != null
                ? shift.getLocation().getBreakTiers() : null;
        return BreakRules.effectiveTiers(locationTiers, rules.defaultBreakTiers());
    }

    private String describeFlag(Staff staff, TimeEntry entry) {
        StringBuilder sb = new StringBuilder(staff.getName()).append(" clocked in at ").append(entry.getClockIn());
        if (entry.isFlagged()) {
            sb.append(" (").append(entry.getClockInFlag().name().toLowerCase()).append(")");
        }
        if (Boolean.TRUE.equals(entry.getOutsideGeofence())) {
            sb.append(String.format(" %.0fm from site", entry.getDistanceMetres()));
        }
        return sb.toString();
    }

    private TimeEntryView view(TimeEntry entry) {
        return view(entry, ruleSettingsService.rulesFor(entry.getOrganizationId()));
    }

    private TimeEntryView view(TimeEntry entry, ClockRules rules) {
        return TimeEntryView.of(entry, rules.enforceMandatedBreak());
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static String link(TimeEntry entry) {
        return "/time-entries/" + entry.getId();
    }
}
