package com.example.rota.shift;

import com.example.rota.auth.Caller;
import com.example.rota.availability.AvailabilityService;
import com.example.rota.category.ShiftCategory;
import com.example.rota.exception.AuthorizationException;
import com.example.rota.exception.ConflictException;
import com.example.rota.exception.ValidationException;
import com.example.rota.location.Location;
import com.example.rota.location.LocationService;
import com.example.rota.notification.Notification;
import com.example.rota.notification.NotificationType;
import com.example.rota.staff.Staff;
import com.example.rota.staff.StaffRole;
import com.example.rota.support.RotaFixtures;
import com.example.rota.support.RotaTestConfig;
import com.example.rota.support.SettableClock;
import com.example.rota.timeentry.TimeEntryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

import static com.example.rota.support.PublishedNotifications.sentTo;
import static com.example.rota.support.RotaFixtures.caller;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(RotaTestConfig.class)
@Transactional
@RecordApplicationEvents
class ShiftServiceTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 3, 10);

    @Autowired
    private ShiftService shiftService;

    @Autowired
    private ShiftTemplateService templateService;

    @Autowired
    private AvailabilityService availabilityService;

    @Autowired
    private TimeEntryService timeEntryService;

    @Autowired
    private ShiftRepository shiftRepository;

    @Autowired
    private LocationService locationService;

    @Autowired
    private ApplicationEvents events;

    @Autowired
    private SettableClock clock;

    @Autowired
    private RotaFixtures fixtures;

    private Staff manager;
    private Staff employee;
    private Caller managerCaller;
    private ShiftCategory floor;
    private ShiftCategory bar;

    @BeforeEach
    void setUp() {
        clock.set(MONDAY.atTime(7, 0));
        manager = fixtures.staff("Mo", StaffRole.MANAGER);
        employee = fixtures.staff("Ana", StaffRole.EMPLOYEE);
        managerCaller = caller(manager);
        floor = fixtures.category("Floor", "11.50");
        bar = fixtures.category("Bar", "13.00");
    }

    @Test
    void overnightShiftRollsForwardAndGetsTierBreak() {
        ShiftView shift = shiftService.createShift(managerCaller, request(LocalTime.of(22, 0), LocalTime.of(6, 0), null, null));

        assertThat(shift.startAt()).isEqualTo(MONDAY.atTime(22, 0));
        assertThat(shift.endAt()).isEqualTo(MONDAY.plusDays(1).atTime(6, 0));
        assertThat(shift.scheduledBreakMinutes()).isEqualTo(60);
        assertThat(shift.status()).isEqualTo(ShiftStatus.OPEN);
    }

    @Test
    void assigneeMakesShiftAssignedAndIsNotified() {
        ShiftView shift = shiftService.createShift(managerCaller, request(LocalTime.of(9, 0), LocalTime.of(14, 0), employee.getId(), null));

        assertThat(shift.status()).isEqualTo(ShiftStatus.ASSIGNED);
        assertThat(shift.scheduledBreakMinutes()).isEqualTo(15);
        assertThat(sentTo(events, employee.getId()))
                .extracting(Notification::type)
                .containsExactly(NotificationType.SHIFT_ASSIGNED);
    }

    @Test
    void staffCannotCreateShifts() {
        assertThatThrownBy(() -> shiftService.createShift(caller(employee), request(LocalTime.of(9, 0), LocalTime.of(17, 0), null, null)))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    void overlappingSegmentsAreRejectedAtWrite() {
        List<ShiftRequest.SegmentRequest> segments = List.of(
                new ShiftRequest.SegmentRequest(LocalTime.of(10, 0), LocalTime.of(12, 0), bar.getId()),
                new ShiftRequest.SegmentRequest(LocalTime.of(11, 0), LocalTime.of(13, 0), bar.getId()));

        assertThatThrownBy(() -> shiftService.createShift(managerCaller, request(LocalTime.of(9, 0), LocalTime.of(17, 0), null, segments)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void editThatNoLongerContainsSegmentsIsRejected() {
        ShiftView shift = shiftService.createShift(managerCaller, request(LocalTime.of(9, 0), LocalTime.of(17, 0), null,
                List.of(new ShiftRequest.SegmentRequest(LocalTime.of(15, 0), LocalTime.of(17, 0), bar.getId()))));

        ShiftRequest shorter = new ShiftRequest(null, null, LocalTime.of(14, 0), null, null, null, null, null, null);
        assertThatThrownBy(() -> shiftService.updateShift(managerCaller, shift.id(), shorter))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("within");

        ShiftRequest later = new ShiftRequest(null, null, LocalTime.of(18, 0), "Late floor", null, null, null, null, null);
        ShiftView updated = shiftService.updateShift(managerCaller, shift.id(), later);
        assertThat(updated.endAt()).isEqualTo(MONDAY.atTime(18, 0));
        assertThat(updated.segments()).hasSize(1);
    }

    @Test
    void windowEditRecomputesBreakUnlessOneIsGiven() {
        ShiftView shift = shiftService.createShift(managerCaller, request(LocalTime.of(9, 0), LocalTime.of(17, 0), null, null));
        assertThat(shift.scheduledBreakMinutes()).isEqualTo(60);

        ShiftView shorter = shiftService.updateShift(managerCaller, shift.id(),
                new ShiftRequest(null, null, LocalTime.of(14, 30), null, null, null, null, null, null));
        assertThat(shorter.scheduledBreakMinutes()).isEqualTo(15);

        ShiftView explicit = shiftService.updateShift(managerCaller, shift.id(),
                new ShiftRequest(null, null, LocalTime.of(17, 0), null, null, null, null, 45, null));
        assertThat(explicit.scheduledBreakMinutes()).isEqualTo(45);

        ShiftView renamed = shiftService.updateShift(managerCaller, shift.id(),
                new ShiftRequest(null, null, null, "Early floor", null, null, null, null, null));
        assertThat(renamed.scheduledBreakMinutes()).isEqualTo(45);
    }

    @Test
    void replacingSegmentsSupersedesOldOnes() {
        ShiftView shift = shiftService.createShift(managerCaller, request(LocalTime.of(9, 0), LocalTime.of(17, 0), null, null));

        ShiftView withSegments = shiftService.replaceSegments(managerCaller, shift.id(), List.of(
                new ShiftRequest.SegmentRequest(LocalTime.of(9, 0), LocalTime.of(12, 0), bar.getId()),
                new ShiftRequest.SegmentRequest(LocalTime.of(12, 0), LocalTime.of(13, 0), floor.getId())));

        assertThat(withSegments.segments()).extracting(ShiftView.SegmentView::categoryName).containsExactly("Bar", "Floor");
    }

    @Test
    void deleteArchivesWhenTimeWasLogged() {
        ShiftView logged = shiftService.createShift(managerCaller, request(LocalTime.of(9, 0), LocalTime.of(17, 0), employee.getId(), null));
        ShiftView untouched = shiftService.createShift(managerCaller, request(LocalTime.of(18, 0), LocalTime.of(22, 0), null, null));
        clock.set(MONDAY.atTime(9, 0));
        timeEntryService.clockIn(caller(employee), null);

        assertThat(shiftService.deleteShift(managerCaller, logged.id())).isTrue();
        assertThat(shiftService.deleteShift(managerCaller, untouched.id())).isFalse();

        assertThat(shiftRepository.findById(logged.id()).orElseThrow().getArchived()).isTrue();
        assertThat(shiftRepository.findById(untouched.id())).isEmpty();
        assertThat(shiftService.listSchedule(managerCaller, MONDAY, MONDAY, null)).isEmpty();
    }

    @Test
    void assignNullReopensShift() {
        ShiftView shift = shiftService.createShift(managerCaller, request(LocalTime.of(9, 0), LocalTime.of(17, 0), employee.getId(), null));

        ShiftView reopened = shiftService.assign(managerCaller, shift.id(), null);

        assertThat(reopened.status()).isEqualTo(ShiftStatus.OPEN);
        assertThat(reopened.assigneeId()).isNull();
    }

    @Test
    void pickUpClaimsOpenShiftOnce() {
        ShiftView open = shiftService.createShift(managerCaller, request(LocalTime.of(9, 0), LocalTime.of(17, 0), null, null));
        Staff other = fixtures.staff("Bo", StaffRole.EMPLOYEE);

        ShiftView claimed = shiftService.pickUp(caller(employee), open.id());

        assertThat(claimed.assigneeId()).isEqualTo(employee.getId());
        assertThat(sentTo(events, manager.getId()))
                .extracting(Notification::type)
                .contains(NotificationType.SHIFT_PICKUP);
        assertThatThrownBy(() -> shiftService.pickUp(caller(other), open.id()))
                .isInstanceOf(ConflictException.class);
        assertThat(shiftService.listOpenShifts(caller(other))).isEmpty();
    }

    @Test
    void scheduleFlagsAssigneesWithoutStatedAvailability() {
        Staff available = fixtures.staff("Cy", StaffRole.EMPLOYEE);
        availabilityService.add(caller(available), new AvailabilityService.AvailabilityRequest(
                DayOfWeek.MONDAY, null, LocalTime.of(8, 0), LocalTime.of(12, 0), null));
        ShiftView covered = shiftService.createShift(managerCaller, request(LocalTime.of(9, 0), LocalTime.of(17, 0), available.getId(), null));
        ShiftView uncovered = shiftService.createShift(managerCaller, request(LocalTime.of(10, 0), LocalTime.of(16, 0), employee.getId(), null));
        ShiftView open = shiftService.createShift(managerCaller, request(LocalTime.of(12, 0), LocalTime.of(20, 0), null, null));

        List<ShiftView> schedule = shiftService.listSchedule(caller(employee), MONDAY, MONDAY.plusDays(6), null);

        assertThat(schedule).extracting(ShiftView::id).containsExactly(covered.id(), uncovered.id(), open.id());
        assertThat(schedule.get(0).noStatedAvailability()).isFalse();
        assertThat(schedule.get(1).noStatedAvailability()).isTrue();
        assertThat(schedule.get(2).noStatedAvailability()).isNull();
    }

    @Test
    void staffAssignedToLocationsOnlySeeShiftsThere() {
        Staff admin = fixtures.staff("Ada", StaffRole.ADMIN);
        Staff bo = fixtures.staff("Bo", StaffRole.EMPLOYEE);
        Location harbour = fixtures.location("Harbour", null, null, 100);
        Location station = fixtures.location("Station", null, null, 100);
        ShiftView atHarbour = shiftService.createShift(managerCaller, placed(LocalTime.of(8, 0), harbour, null));
        ShiftView atStation = shiftService.createShift(managerCaller, placed(LocalTime.of(9, 0), station, null));
        ShiftView unplaced = shiftService.createShift(managerCaller, placed(LocalTime.of(10, 0), null, null));
        ShiftView own = shiftService.createShift(managerCaller, placed(LocalTime.of(11, 0), station, employee.getId()));
        locationService.assignStaffLocations(caller(admin), employee.getId(), List.of(harbour.getId()));

        assertThat(shiftService.listSchedule(caller(employee), MONDAY, MONDAY, null))
                .extracting(ShiftView::id)
                .containsExactly(atHarbour.id(), own.id());
        assertThat(shiftService.listOpenShifts(caller(employee)))
                .extracting(ShiftView::id)
                .containsExactly(atHarbour.id());
        assertThat(shiftService.listOpenShifts(caller(bo)))
                .extracting(ShiftView::id)
                .containsExactly(atHarbour.id(), atStation.id(), unplaced.id());
        assertThat(shiftService.listSchedule(managerCaller, MONDAY, MONDAY, null)).hasSize(4);
        assertThatThrownBy(() -> shiftService.pickUp(caller(employee), atStation.id()))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    void templateCopiesWindowAndCategory() {
        ShiftTemplateService.TemplateView template = templateService.create(managerCaller, new ShiftTemplateService.TemplateRequest(
                "Close", LocalTime.of(18, 0), LocalTime.of(1, 0), bar.getId(), null, true));

        ShiftView shift = shiftService.createFromTemplate(managerCaller, template.id(), MONDAY, employee.getId());

        assertThat(shift.title()).isEqualTo("Close");
        assertThat(shift.endAt()).isEqualTo(LocalDateTime.of(2025, 3, 11, 1, 0));
        assertThat(shift.categoryId()).isEqualTo(bar.getId());
        assertThat(shift.assigneeId()).isEqualTo(employee.getId());
    }

    private ShiftRequest placed(LocalTime start, Location location, Long assigneeId) {
        return new ShiftRequest(MONDAY, start, start.plusHours(4), "Floor", floor.getId(),
                location != null ? location.getId() : null, assigneeId, null, null);
    }

    private ShiftRequest request(LocalTime start, LocalTime end, Long assigneeId, List<ShiftRequest.SegmentRequest> segments) {
        return new ShiftRequest(MONDAY, start, end, "Floor", floor.getId(), null, assigneeId, null, segments);
    }
}
