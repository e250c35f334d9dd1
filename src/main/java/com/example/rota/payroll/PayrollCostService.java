package com.example.rota.payroll;

import com.example.rota.auth.AccessPolicy;
import com.example.rota.auth.Caller;
import com.example.rota.breaks.BreakRules;
import com.example.rota.category.ShiftCategory;
import com.example.rota.config.RuleSettingsService;
import com.example.rota.exception.AuthorizationException;
import com.example.rota.exception.ValidationException;
import com.example.rota.shift.SegmentWindows;
import com.example.rota.shift.Shift;
import com.example.rota.shift.ShiftSegment;
import com.example.rota.staff.PayType;
import com.example.rota.staff.Staff;
import com.example.rota.staff.StaffCategoryRate;
import com.example.rota.staff.StaffCategoryRateRepository;
import com.example.rota.staff.StaffRepository;
import com.example.rota.staff.StaffRole;
import com.example.rota.timeentry.TimeEntry;
import com.example.rota.timeentry.TimeEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Staff cost report, recomputed from approved time entries and salaries on every call.
 */
@Service
@Transactional(readOnly = true)
public class PayrollCostService {

    private static final Logger logger = LoggerFactory.getLogger(PayrollCostService.class);
    private static final String UNASSIGNED = "Unassigned";

    private final TimeEntryRepository entryRepository;
    private final StaffRepository staffRepository;
    private final StaffCategoryRateRepository rateRepository;
    private final PayPeriodService payPeriodService;
    private final RuleSettingsService ruleSettingsService;
    private final PayrollCalculator calculator;
    private final AccessPolicy accessPolicy;

    public PayrollCostService(TimeEntryRepository entryRepository,
                              StaffRepository staffRepository,
                              StaffCategoryRateRepository rateRepository,
                              PayPeriodService payPeriodService,
                              RuleSettingsService ruleSettingsService,
                              PayrollCalculator calculator,
                              AccessPolicy accessPolicy) {
        this.entryRepository = entryRepository;
        this.staffRepository = staffRepository;
        this.rateRepository = rateRepository;
        this.payPeriodService = payPeriodService;
        this.ruleSettingsService = ruleSettingsService;
        this.calculator = calculator;
        this.accessPolicy = accessPolicy;
    }

    public CostReport staffCosts(Caller caller, String month, Long payPeriodId, Long locationId) {
        if (!caller.isManager()) {
            throw new AuthorizationException("Only managers can view staff costs");
        }
        PayWindow window = resolveWindow(caller, month, payPeriodId);
        Computation current = compute(caller, window, locationId);
        Computation previous = compute(caller, window.previous(), locationId);
        CostReport.Variance variance = variance(window.previous().label(), current.totals.total(), previous.totals.total());
        logger.info("Staff costs {} for organization {}: total={}, staff={}",
                window.label(), caller.organizationId(), current.totals.total(), current.staff.size());
        return new CostReport(window.label(), window.start(), window.end(), locationId,
                current.staff, current.locations, current.totals, variance);
    }

    PayWindow resolveWindow(Caller caller, String month, Long payPeriodId) {
        if ((month == null || month.isBlank()) == (payPeriodId == null)) {
            throw new ValidationException("Give either a month (YYYY-MM) or a pay period", "month", month);
        }
        if (payPeriodId != null) {
            return PayWindow.ofPeriod(payPeriodService.get(caller, payPeriodId));
        }
        try {
            return PayWindow.ofMonth(YearMonth.parse(month.trim()));
        } catch (DateTimeParseException e) {
            throw new ValidationException("Month must be formatted as YYYY-MM", "month", month);
        }
    }

    static CostReport.Variance variance(String previousLabel, BigDecimal current, BigDecimal previous) {
        BigDecimal amount = current.subtract(previous);
        if (previous.signum() == 0) {
            return new CostReport.Variance(previousLabel, previous, amount, BigDecimal.ZERO.setScale(2), false);
        }
        BigDecimal percentage = amount.multiply(BigDecimal.valueOf(100))
                .divide(previous, 2, RoundingMode.HALF_UP);
        return new CostReport.Variance(previousLabel, previous, amount, percentage, true);
    }

    private Computation compute(Caller caller, PayWindow window, Long locationFilter) {
        boolean enforceMandated = ruleSettingsService.rulesFor(caller.organizationId()).enforceMandatedBreak();
        List<TimeEntry> entries = entryRepository.findApprovedInRange(caller.organizationId(), window.from(), window.toExclusive())
                .stream()
                .filter(e -> visible(caller, e.getStaff()))
                .toList();

        Map<Long, StaffCosts> byStaff = new LinkedHashMap<>();
        for (Staff staff : staffRepository.findByOrganizationIdOrderByNameAsc(caller.organizationId())) {
            if (visible(caller, staff) && staff.getPayType() == PayType.SALARIED && Boolean.TRUE.equals(staff.getActive())) {
                byStaff.put(staff.getId(), new StaffCosts(staff));
            }
        }
        Set<Long> staffIds = entries.stream().map(e -> e.getStaff().getId()).collect(Collectors.toSet());
        Map<String, BigDecimal> overrides = new HashMap<>();
        if (!staffIds.isEmpty()) {
            for (StaffCategoryRate rate : rateRepository.findByStaffIdIn(staffIds)) {
                overrides.put(rateKey(rate.getStaff().getId(), rate.getCategory().getId()), rate.getHourlyRate());
            }
        }

        for (TimeEntry entry : entries) {
            StaffCosts costs = byStaff.computeIfAbsent(entry.getStaff().getId(), id -> new StaffCosts(entry.getStaff()));
            double hours = BreakRules.netHours(entry.getClockIn(), entry.getClockOut(),
                    entry.deductibleBreakMinutes(enforceMandated));
            Shift shift = entry.getShift();
            Long locationId = shift != null && shift.getLocation() != null ? shift.getLocation().getId() : null;
            String locationName = locationId != null ? shift.getLocation().getName() : UNASSIGNED;
            BigDecimal pay = costs.staff.getPayType() == PayType.SALARIED ? BigDecimal.ZERO
                    : wages(entry, hours, overrides);
            costs.add(locationId, locationName, hours, pay);
        }

        List<CostReport.StaffCost> staffRows = new ArrayList<>();
        Map<Long, LocationAccumulator> locations = new LinkedHashMap<>();
        for (StaffCosts costs : byStaff.values()) {
            costs.finish(window, calculator);
            for (Map.Entry<Long, LocationAccumulator> slice : costs.slices().entrySet()) {
                locations.computeIfAbsent(slice.getKey(), k -> new LocationAccumulator(slice.getValue().name))
                        .merge(slice.getValue());
            }
            StaffCostsView view = locationFilter == null ? costs.whole() : costs.slice(locationFilter);
            if (view != null) {
                staffRows.add(view.toRow(costs.staff));
            }
        }
        staffRows.sort(Comparator.comparing(CostReport.StaffCost::name, String.CASE_INSENSITIVE_ORDER));

        List<CostReport.LocationCost> locationRows = locations.entrySet().stream()
                .filter(e -> locationFilter == null || locationFilter.equals(e.getKey()))
                .map(e -> e.getValue().toRow(e.getKey()))
                .sorted(Comparator.comparing((CostReport.LocationCost l) -> l.locationId() == null)
                        .thenComparing(CostReport.LocationCost::locationName, String.CASE_INSENSITIVE_ORDER))
                .toList();

        return new Computation(staffRows, locationRows, totals(staffRows));
    }

    /**
     * Wages for one entry. Minutes covered by a segment are paid at the segment category's rate,
     * the rest at the shift category's rate or, failing that, the staff default. Minutes are scaled
     * from the gross span to net hours.
     */
    private BigDecimal wages(TimeEntry entry, double netHours, Map<String, BigDecimal> overrides) {
        Staff staff = entry.getStaff();
        long grossMinutes = Duration.between(entry.getClockIn(), entry.getClockOut()).toMinutes();
        if (grossMinutes <= 0 || netHours <= 0) {
            return BigDecimal.ZERO;
        }
        Shift shift = entry.getShift();
        BigDecimal baseRate = shift != null && shift.getCategory() != null
                ? rateFor(staff, shift.getCategory(), overrides)
                : nullToZero(staff.getDefaultHourlyRate());

        BigDecimal weightedMinutes = BigDecimal.ZERO;
        long covered = 0;
        if (shift != null) {
            for (ShiftSegment segment : shift.getSegments()) {
                long overlap = SegmentWindows.overlapMinutes(entry.getClockIn(), entry.getClockOut(),
                        segment.getStartAt(), segment.getEndAt());
                if (overlap > 0) {
                    covered += overlap;
                    weightedMinutes = weightedMinutes.add(rateFor(staff, segment.getCategory(), overrides)
                            .multiply(BigDecimal.valueOf(overlap)));
                }
            }
        }
        long rest = Math.max(0, grossMinutes - covered);
        weightedMinutes = weightedMinutes.add(baseRate.multiply(BigDecimal.valueOf(rest)));

        BigDecimal netToGross = BigDecimal.valueOf(netHours * 60).divide(BigDecimal.valueOf(grossMinutes), MathContext.DECIMAL64);
        return weightedMinutes.multiply(netToGross).divide(BigDecimal.valueOf(60), MathContext.DECIMAL64);
    }

    private BigDecimal rateFor(Staff staff, ShiftCategory category, Map<String, BigDecimal> overrides) {
        BigDecimal override = overrides.get(rateKey(staff.getId(), category.getId()));
        return override != null ? override : nullToZero(category.getHourlyRate());
    }

    private boolean visible(Caller caller, Staff staff) {
        return caller.isAdmin() || staff.getRole() == StaffRole.EMPLOYEE;
    }

    private static CostReport.Totals totals(List<CostReport.StaffCost> rows) {
        double hours = 0;
        BigDecimal gross = BigDecimal.ZERO;
        BigDecimal holiday = BigDecimal.ZERO;
        BigDecimal employer = BigDecimal.ZERO;
        BigDecimal employee = BigDecimal.ZERO;
        BigDecimal total = BigDecimal.ZERO;
        for (CostReport.StaffCost row : rows) {
            hours += row.hours();
            gross = gross.add(row.gross());
            holiday = holiday.add(row.holidayAccrual());
            employer = employer.add(row.employerContribution());
            employee = employee.add(row.employeeContribution());
            total = total.add(row.total());
        }
        return new CostReport.Totals(round(hours), PayrollCalculator.money(gross), PayrollCalculator.money(holiday),
                PayrollCalculator.money(employer), PayrollCalculator.money(employee), PayrollCalculator.money(total));
    }

    private static String rateKey(Long staffId, Long categoryId) {
        return staffId + ":" + categoryId;
    }

    private static BigDecimal nullToZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private static double round(double hours) {
        return BigDecimal.valueOf(hours).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private record Computation(List<CostReport.StaffCost> staff,
                               List<CostReport.LocationCost> locations,
                               CostReport.Totals totals) {
    }

    private record StaffCostsView(double hours, BigDecimal gross, BigDecimal holiday,
                                  BigDecimal employer, BigDecimal employee) {

        CostReport.StaffCost toRow(Staff staff) {
            BigDecimal g = PayrollCalculator.money(gross);
            BigDecimal h = PayrollCalculator.money(holiday);
            BigDecimal e = PayrollCalculator.money(employer);
            return new CostReport.StaffCost(staff.getId(), staff.getName(), staff.getRole(), staff.getPayType(),
                    round(hours), g, h, e, PayrollCalculator.money(employee), g.add(h).add(e));
        }
    }

    /**
     * Per staff member: hours and wages by location, then contributions on the whole and shares per location.
     */
    private static final class StaffCosts {
        private final Staff staff;
        private final Map<Long, LocationAccumulator> byLocation = new LinkedHashMap<>();
        private StaffCostsView whole;

        StaffCosts(Staff staff) {
            this.staff = staff;
        }

        void add(Long locationId, String locationName, double hours, BigDecimal pay) {
            LocationAccumulator slice = byLocation.computeIfAbsent(locationId, k -> new LocationAccumulator(locationName));
            slice.hours += hours;
            slice.gross = slice.gross.add(pay);
        }

        void finish(PayWindow window, PayrollCalculator calculator) {
            double hours = byLocation.values().stream().mapToDouble(l -> l.hours).sum();
            if (staff.getPayType() == PayType.SALARIED) {
                BigDecimal salary = window.monthly(nullToZero(staff.getMonthlySalary()));
                if (hours <= 0) {
                    byLocation.computeIfAbsent(null, k -> new LocationAccumulator(UNASSIGNED)).gross = salary;
                } else {
                    for (LocationAccumulator slice : byLocation.values()) {
                        slice.gross = salary.multiply(BigDecimal.valueOf(slice.hours / hours), MathContext.DECIMAL64);
                    }
                }
            }
            BigDecimal gross = byLocation.values().stream().map(l -> l.gross).reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal holiday = staff.getPayType() == PayType.SALARIED ? BigDecimal.ZERO : calculator.holidayAccrual(gross);
            BigDecimal employer = calculator.employerContribution(gross, window);
            BigDecimal employee = calculator.employeeContribution(gross, window);
            whole = new StaffCostsView(hours, gross, holiday, employer, employee);

            for (LocationAccumulator slice : byLocation.values()) {
                BigDecimal share = gross.signum() == 0 ? BigDecimal.ZERO
                        : slice.gross.divide(gross, MathContext.DECIMAL64);
                slice.holiday = holiday.multiply(share);
                slice.employer = employer.multiply(share);
                slice.employee = employee.multiply(share);
            }
        }

        StaffCostsView whole() {
            return whole;
        }

        StaffCostsView slice(Long locationId) {
            LocationAccumulator slice = byLocation.get(locationId);
            if (slice == null) {
                return null;
            }
            return new StaffCostsView(slice.hours, slice.gross, slice.holiday, slice.employer, slice.employee);
        }

        Map<Long, LocationAccumulator> slices() {
            return byLocation;
        }
    }

    private static final class LocationAccumulator {
        private final String name;
        private double hours;
        private BigDecimal gross = BigDecimal.ZERO;
        private BigDecimal holiday = BigDecimal.ZERO;
        private BigDecimal employer = BigDecimal.ZERO;
        private BigDecimal employee = BigDecimal.ZERO;

        LocationAccumulator(String name) {
            this.name = name;
        }

        void merge(LocationAccumulator other) {
            hours += other.hours;
            gross = gross.add(other.gross);
            holiday = holiday.add(other.holiday);
            employer = employer.add(other.employer);
            employee = employee.add(other.employee);
        }

        CostReport.LocationCost toRow(Long locationId) {
            BigDecimal g = PayrollCalculator.money(gross);
            BigDecimal h = PayrollCalculator.money(holiday);
            BigDecimal e = PayrollCalculator.money(employer);
            return new CostReport.LocationCost(locationId, name, round(hours), g, h, e, g.add(h).add(e));
        }
    }
}
