package com.example.rota.payroll;

import com.example.rota.category.ShiftCategory;
import com.example.rota.exception.AuthorizationException;
import com.example.rota.exception.ValidationException;
import com.example.rota.location.Location;
import com.example.rota.shift.Shift;
import com.example.rota.shift.ShiftRepository;
import com.example.rota.shift.ShiftSegment;
import com.example.rota.staff.PayType;
import com.example.rota.staff.Staff;
import com.example.rota.staff.StaffCategoryRate;
import com.example.rota.staff.StaffCategoryRateRepository;
import com.example.rota.staff.StaffRole;
import com.example.rota.support.RotaFixtures;
import com.example.rota.support.RotaTestConfig;
import com.example.rota.timeentry.ApprovalStatus;
import com.example.rota.timeentry.TimeEntry;
import com.example.rota.timeentry.TimeEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static com.example.rota.support.RotaFixtures.caller;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(RotaTestConfig.class)
@Transactional
class PayrollCostServiceTest {

    private static final LocalDate DAY = LocalDate.of(2025, 3, 10);

    @Autowired
    private PayrollCostService payrollCostService;

    @Autowired
    private PayPeriodService payPeriodService;

    @Autowired
    private TimeEntryRepository timeEntryRepository;

    @Autowired
    private ShiftRepository shiftRepository;

    @Autowired
    private StaffCategoryRateRepository rateRepository;

    @Autowired
    private RotaFixtures fixtures;

    private Staff manager;
    private Staff admin;
    private ShiftCategory floor;

    @BeforeEach
    void setUp() {
        manager = fixtures.staff("Mo", StaffRole.MANAGER);
        admin = fixtures.staff("Ada", StaffRole.ADMIN);
        floor = fixtures.category("Floor", "10.00");
    }

    @Test
    void hourlyDayIsPricedAtShiftCategoryRate() {
        Staff ana = fixtures.hourly("Ana", "8.00");
        Shift shift = fixtures.shift(DAY.atTime(9, 0), DAY.atTime(17, 0), ana, null, floor);
        approved(ana, shift, DAY.atTime(9, 0), DAY.atTime(17, 0), 60);

        CostReport report = payrollCostService.staffCosts(caller(manager), "2025-03", null, null);

        assertThat(report.label()).isEqualTo("2025-03");
        assertThat(report.staff()).hasSize(1);
        CostReport.StaffCost row = report.staff().get(0);
        assertThat(row.hours()).isEqualTo(7.0);
        assertThat(row.gross()).isEqualByComparingTo("70.00");
        assertThat(row.holidayAccrual()).isEqualByComparingTo("8.45");
        assertThat(row.employerContribution()).isEqualByComparingTo("0.00");
        assertThat(row.total()).isEqualByComparingTo("78.45");
        assertThat(report.totals().total()).isEqualByComparingTo("78.45");
        assertThat(report.variance().comparable()).isFalse();
        assertThat(report.variance().percentage()).isEqualByComparingTo("0");
    }

    @Test
    void segmentMinutesUseSegmentRateAndOverridesWin() {
        ShiftCategory bar = fixtures.category("Bar", "20.00");
        Staff ana = fixtures.hourly("Ana", "8.00");
        Shift shift = fixtures.shift(DAY.atTime(9, 0), DAY.atTime(17, 0), ana, null, floor);
        shift.replaceSegments(List.of(new ShiftSegment(DAY.atTime(13, 0), DAY.atTime(15, 0), bar)));
        shiftRepository.save(shift);
        approved(ana, shift, DAY.atTime(9, 0), DAY.atTime(17, 0), 60);

        CostReport segmented = payrollCostService.staffCosts(caller(manager), "2025-03", null, null);
        assertThat(segmented.staff().get(0).gross()).isEqualByComparingTo("87.50");

        rateRepository.save(new StaffCategoryRate(ana, floor, new BigDecimal("12.00")));
        CostReport overridden = payrollCostService.staffCosts(caller(manager), "2025-03", null, null);
        assertThat(overridden.staff().get(0).gross()).isEqualByComparingTo("98.00");
    }

    @Test
    void pendingEntriesAreNotCosted() {
        Staff ana = fixtures.hourly("Ana", "10.00");
        TimeEntry pending = TimeEntry.manual(ana, null, DAY.atTime(9, 0), DAY.atTime(17, 0), 60);
        timeEntryRepository.save(pending);

        CostReport report = payrollCostService.staffCosts(caller(manager), "2025-03", null, null);

        assertThat(report.staff()).isEmpty();
        assertThat(report.totals().total()).isEqualByComparingTo("0");
    }

    @Test
    void salariedStaffCostTheirSalaryEvenWithoutHours() {
        fixtures.salaried("Sam", "3000.00");

        CostReport report = payrollCostService.staffCosts(caller(manager), "2025-03", null, null);

        CostReport.StaffCost row = report.staff().get(0);
        assertThat(row.payType()).isEqualTo(PayType.SALARIED);
        assertThat(row.gross()).isEqualByComparingTo("3000.00");
        assertThat(row.holidayAccrual()).isEqualByComparingTo("0");
        assertThat(row.employerContribution()).isEqualByComparingTo("309.35");
        assertThat(row.total()).isEqualByComparingTo("3309.35");
        assertThat(report.locations()).extracting(CostReport.LocationCost::locationId).containsExactly((Long) null);
        // same salary in February
        assertThat(report.variance().comparable()).isTrue();
        assertThat(report.variance().amount()).isEqualByComparingTo("0");
    }

    @Test
    void locationsSplitCostsAndFilterShowsTheSlice() {
        Location harbour = fixtures.location("Harbour", null, null, 100);
        Staff ana = fixtures.hourly("Ana", "10.00");
        Shift atHarbour = fixtures.shift(DAY.atTime(9, 0), DAY.atTime(17, 0), ana, harbour, floor);
        approved(ana, atHarbour, DAY.atTime(9, 0), DAY.atTime(17, 0), 60);
        approved(ana, null, DAY.plusDays(1).atTime(9, 0), DAY.plusDays(1).atTime(17, 0), 60);

        CostReport all = payrollCostService.staffCosts(caller(manager), "2025-03", null, null);
        assertThat(all.staff().get(0).gross()).isEqualByComparingTo("140.00");
        assertThat(all.locations()).extracting(CostReport.LocationCost::locationName).containsExactly("Harbour", "Unassigned");
        assertThat(all.locations().get(0).total()).isEqualByComparingTo("78.45");

        CostReport filtered = payrollCostService.staffCosts(caller(manager), "2025-03", null, harbour.getId());
        assertThat(filtered.staff()).hasSize(1);
        assertThat(filtered.staff().get(0).hours()).isEqualTo(7.0);
        assertThat(filtered.staff().get(0).gross()).isEqualByComparingTo("70.00");
        assertThat(filtered.locations()).hasSize(1);
    }

    @Test
    void managersSeeEmployeesOnlyAdminsSeeEveryone() {
        Staff otherManager = fixtures.staff("Max", StaffRole.MANAGER);
        otherManager.setDefaultHourlyRate(new BigDecimal("10.00"));
        Staff ana = fixtures.hourly("Ana", "10.00");
        approved(otherManager, null, DAY.atTime(9, 0), DAY.atTime(17, 0), 60);
        approved(ana, null, DAY.atTime(9, 0), DAY.atTime(17, 0), 60);

        assertThat(payrollCostService.staffCosts(caller(manager), "2025-03", null, null).staff())
                .extracting(CostReport.StaffCost::name).containsExactly("Ana");
        assertThat(payrollCostService.staffCosts(caller(admin), "2025-03", null, null).staff())
                .extracting(CostReport.StaffCost::name).containsExactly("Ana", "Max");
    }

    @Test
    void staffCannotViewCosts() {
        Staff ana = fixtures.hourly("Ana", "10.00");

        assertThatThrownBy(() -> payrollCostService.staffCosts(caller(ana), "2025-03", null, null))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    void windowMustBeExactlyOneOfMonthOrPeriod() {
        assertThatThrownBy(() -> payrollCostService.staffCosts(caller(manager), "March", null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> payrollCostService.staffCosts(caller(manager), null, null, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void payPeriodProRatesSalary() {
        fixtures.salaried("Sam", "3000.00");
        PayPeriod period = payPeriodService.register(caller(manager), new PayPeriodService.PayPeriodRequest(
                "Fortnight 6", LocalDate.of(2025, 3, 3), LocalDate.of(2025, 3, 16), LocalDate.of(2025, 3, 21)));

        CostReport report = payrollCostService.staffCosts(caller(manager), null, period.getId(), null);

        assertThat(report.label()).isEqualTo("Fortnight 6");
        assertThat(report.staff().get(0).gross()).isEqualByComparingTo("1380.82");
    }

    private void approved(Staff staff, Shift shift, LocalDateTime in, LocalDateTime out, int breakMinutes) {
        TimeEntry entry = TimeEntry.manual(staff, shift, in, out, breakMinutes);
        entry.markReviewed(ApprovalStatus.APPROVED, manager.getId(), out.plusHours(1));
        timeEntryRepository.save(entry);
    }
}
