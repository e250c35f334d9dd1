package com.example.rota.payroll;

import com.example.rota.auth.Caller;
import com.example.rota.breaks.BreakCalculationMode;
import com.example.rota.breaks.BreakRules;
import com.example.rota.category.ShiftCategory;
import com.example.rota.config.ClockRules;
import com.example.rota.config.RuleSettingsService;
import com.example.rota.exception.AuthorizationException;
import com.example.rota.location.LocationService;
import com.example.rota.location.StaffLocationRepository;
import com.example.rota.shift.SegmentWindows;
import com.example.rota.shift.Shift;
import com.example.rota.shift.ShiftRepository;
import com.example.rota.shift.ShiftSegment;
import com.example.rota.staff.PayType;
import com.example.rota.staff.Staff;
import com.example.rota.staff.StaffCategoryRate;
import com.example.rota.staff.StaffCategoryRateRepository;
import com.example.rota.staff.StaffRepository;
import com.example.rota.staff.StaffRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Weekly labour forecast: contracted hours and cost against the shifts scheduled for the week.
 */
@Service
@Transactional(readOnly = true)
public class LabourForecastService {

    private static final Logger logger = LoggerFactory.getLogger(LabourForecastService.class);
    private static final String OPEN_SHIFTS = "Open shifts";
    private static final BigDecimal MONTHS_PER_WEEK = new BigDecimal("12").divide(new BigDecimal("52"), MathContext.DECIMAL64);

    private final ShiftRepository shiftRepository;
    private final StaffRepository staffRepository;
    private final StaffCategoryRateRepository rateRepository;
    private final StaffLocationRepository staffLocationRepository;
    private final LocationService locationService;
    private final RuleSettingsService ruleSettingsService;
    private final Clock clock;

    public LabourForecastService(ShiftRepository shiftRepository,
                                 StaffRepository staffRepository,
                                 StaffCategoryRateRepository rateRepository,
                                 StaffLocationRepository staffLocationRepository,
                                 LocationService locationService,
                                 RuleSettingsService ruleSettingsService,
                                 Clock clock) {
        this.shiftRepository = shiftRepository;
        this.staffRepository = staffRepository;
        this.rateRepository = rateRepository;
        this.staffLocationRepository = staffLocationRepository;
        this.locationService = locationService;
        this.ruleSettingsService = ruleSettingsService;
        this.clock = clock;
    }

    /**
     * @param weekStart first day of the seven-day window; the current week's Monday when null
     * @param locationId limits shifts to the location and contracted staff to those assigned to it
     */
    public LabourForecast weeklyForecast(Caller caller, LocalDate weekStart, Long locationId) {
        if (!caller.isManager()) {
            throw new AuthorizationException("Only managers can view the labour forecast");
        }
        LocalDate start = weekStart != null ? weekStart
                : LocalDate.now(clock).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        if (locationId != null) {
            locationService.get(caller, locationId);
        }
        ClockRules rules = ruleSettingsService.rulesFor(caller.organizationId());

        LabourForecast.Contracted contracted = contracted(caller, locationId);
        LabourForecast.Scheduled scheduled = scheduled(caller, start, locationId, rules);
        LabourForecast.Variance variance = variance(contracted, scheduled);
        logger.info("Labour forecast week {} for organization {}: contracted={}h, scheduled={}h, mode={}",
                start, caller.organizationId(), contracted.totalHours(), scheduled.totalHours(), rules.breakCalculationMode());
        return new LabourForecast(start, start.plusDays(6), locationId, rules.breakCalculationMode(),
                contracted, scheduled, variance);
    }

    private LabourForecast.Contracted contracted(Caller caller, Long locationId) {
        Set<Long> atLocation = locationId == null ? null
                : new HashSet<>(staffLocationRepository.findStaffIdsByLocationId(locationId));
        List<LabourForecast.ContractedStaff> rows = new ArrayList<>();
        double hours = 0;
        BigDecimal cost = BigDecimal.ZERO;
        for (Staff staff : staffRepository.findByOrganizationIdOrderByNameAsc(caller.organizationId())) {
            Double contractedHours = staff.getContractedHours();
            if (contractedHours == null || contractedHours <= 0
                    || !Boolean.TRUE.equals(staff.getActive()) || !visible(caller, staff)) {
                continue;
            }
            if (atLocation != null && !atLocation.contains(staff.getId())) {
                continue;
            }
            // salaried staff cost a week's share of their salary whatever their hours
            BigDecimal weekly = staff.getPayType() == PayType.SALARIED
                    ? nullToZero(staff.getMonthlySalary()).multiply(MONTHS_PER_WEEK, MathContext.DECIMAL64)
                    : nullToZero(staff.getDefaultHourlyRate()).multiply(BigDecimal.valueOf(contractedHours));
            rows.add(new LabourForecast.ContractedStaff(staff.getId(), staff.getName(), staff.getPayType(),
                    round(contractedHours), PayrollCalculator.money(weekly)));
            hours += contractedHours;
            cost = cost.add(weekly);
        }
        return new LabourForecast.Contracted(round(hours), PayrollCalculator.money(cost), rows.size(), rows);
    }

    private LabourForecast.Scheduled scheduled(Caller caller, LocalDate start, Long locationId, ClockRules rules) {
        List<Shift> shifts = shiftRepository.findSchedule(caller.organizationId(), start.atStartOfDay(),
                        start.plusDays(7).atStartOfDay()).stream()
                .filter(s -> locationId == null || (s.getLocation() != null && locationId.equals(s.getLocation().getId())))
                .filter(s -> s.getAssignee() == null || visible(caller, s.getAssignee()))
                .toList();
        Map<String, BigDecimal> overrides = overrides(shifts);

        Map<Long, Accumulator> byStaff = new LinkedHashMap<>();
        Accumulator open = new Accumulator(null, OPEN_SHIFTS);
        Map<StaffDay, DayTotal> days = new LinkedHashMap<>();
        for (Shift shift : shifts) {
            Staff assignee = shift.getAssignee();
            long gross = Duration.between(shift.getStartAt(), shift.getEndAt()).toMinutes();
            BigDecimal grossCost = grossCost(shift, assignee, gross, overrides);
            if (assignee != null && rules.breakCalculationMode() == BreakCalculationMode.PER_DAY) {
                days.computeIfAbsent(new StaffDay(assignee.getId(), shift.getStartAt().toLocalDate()),
                        k -> new DayTotal(assignee.getName())).add(gross, grossCost);
                continue;
            }
            int breakMinutes = shift.getScheduledBreakMinutes() == null ? 0 : shift.getScheduledBreakMinutes();
            Accumulator target = assignee == null ? open
                    : byStaff.computeIfAbsent(assignee.getId(), id -> new Accumulator(id, assignee.getName()));
            target.add(1, gross, grossCost, breakMinutes);
        }
        // one break per staff member and day, deducted at the day's average rate
        for (Map.Entry<StaffDay, DayTotal> entry : days.entrySet()) {
            DayTotal day = entry.getValue();
            int breakMinutes = BreakRules.mandatedMinutes(day.grossMinutes / 60.0, rules.defaultBreakTiers());
            byStaff.computeIfAbsent(entry.getKey().staffId(), id -> new Accumulator(id, day.name))
                    .add(day.shifts, day.grossMinutes, day.grossCost, breakMinutes);
        }

        List<LabourForecast.ScheduledStaff> rows = byStaff.values().stream()
                .sorted(Comparator.comparing((Accumulator a) -> a.name, String.CASE_INSENSITIVE_ORDER))
                .map(Accumulator::toRow)
                .collect(Collectors.toCollection(ArrayList::new));
        if (open.shiftCount > 0) {
            rows.add(open.toRow());
        }
        long netMinutes = byStaff.values().stream().mapToLong(a -> a.netMinutes).sum() + open.netMinutes;
        BigDecimal cost = byStaff.values().stream().map(a -> a.cost).reduce(open.cost, BigDecimal::add);
        return new LabourForecast.Scheduled(round(netMinutes / 60.0), PayrollCalculator.money(cost), shifts.size(), rows);
    }

    static LabourForecast.Variance variance(LabourForecast.Contracted contracted, LabourForecast.Scheduled scheduled) {
        double hours = round(scheduled.totalHours() - contracted.totalHours());
        BigDecimal cost = scheduled.totalCost().subtract(contracted.totalCost());
        BigDecimal hoursPercent = contracted.totalHours() == 0 ? BigDecimal.ZERO.setScale(2)
                : BigDecimal.valueOf(hours).multiply(BigDecimal.valueOf(100))
                        .divide(BigDecimal.valueOf(contracted.totalHours()), 2, RoundingMode.HALF_UP);
        BigDecimal costPercent = contracted.totalCost().signum() == 0 ? BigDecimal.ZERO.setScale(2)
                : cost.multiply(BigDecimal.valueOf(100)).divide(contracted.totalCost(), 2, RoundingMode.HALF_UP);
        return new LabourForecast.Variance(hours, cost, hoursPercent, costPercent);
    }

    /**
     * Cost of the whole shift span before breaks. Segment minutes are priced at the segment category's
     * rate, the rest at the shift category's rate or the assignee's default. Salaried assignees cost nothing here.
     */
    private BigDecimal grossCost(Shift shift, Staff assignee, long grossMinutes, Map<String, BigDecimal> overrides) {
        if (grossMinutes <= 0 || (assignee != null && assignee.getPayType() == PayType.SALARIED)) {
            return BigDecimal.ZERO;
        }
        BigDecimal baseRate = shift.getCategory() != null ? rateFor(assignee, shift.getCategory(), overrides)
                : assignee != null ? nullToZero(assignee.getDefaultHourlyRate()) : BigDecimal.ZERO;
        BigDecimal weightedMinutes = BigDecimal.ZERO;
        long covered = 0;
        for (ShiftSegment segment : shift.getSegments()) {
            long overlap = SegmentWindows.overlapMinutes(shift.getStartAt(), shift.getEndAt(),
                    segment.getStartAt(), segment.getEndAt());
            if (overlap > 0) {
                covered += overlap;
                weightedMinutes = weightedMinutes.add(rateFor(assignee, segment.getCategory(), overrides)
                        .multiply(BigDecimal.valueOf(overlap)));
            }
        }
        weightedMinutes = weightedMinutes.add(baseRate.multiply(BigDecimal.valueOf(Math.max(0, grossMinutes - covered))));
        return weightedMinutes.divide(BigDecimal.valueOf(60), MathContext.DECIMAL64);
    }

    private Map<String, BigDecimal> overrides(List<Shift> shifts) {
        Set<Long> staffIds = shifts.stream()
                .map(Shift::getAssignee)
                .filter(Objects::nonNull)
                .map(Staff::getId)
                .collect(Collectors.toSet());
        Map<String, BigDecimal> overrides = new HashMap<>();
        if (!staffIds.isEmpty()) {
            for (StaffCategoryRate rate : rateRepository.findByStaffIdIn(staffIds)) {
                overrides.put(rate.getStaff().getId() + ":" + rate.getCategory().getId(), rate.getHourlyRate());
            }
        }
        return overrides;
    }

    private BigDecimal rateFor(Staff staff, ShiftCategory category, Map<String, BigDecimal> overrides) {
        BigDecimal override = staff == null ? null : overrides.get(staff.getId() + ":" + category.getId());
        return override != null ? override : nullToZero(category.getHourlyRate());
    }

    private boolean visible(Caller caller, Staff staff) {
        return caller.isAdmin() || staff.getRole() == StaffRole.EMPLOYEE;
    }

    private static BigDecimal nullToZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private static double round(double hours) {
        return BigDecimal.valueOf(hours).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private record StaffDay(Long staffId, LocalDate day) {
    }

    private static final class DayTotal {
        private final String name;
        private int shifts;
        private long grossMinutes;
        private BigDecimal grossCost = BigDecimal.ZERO;

        DayTotal(String name) {
            this.name = name;
        }

        void add(long gross, BigDecimal costBeforeBreak) {
            shifts++;
            grossMinutes += gross;
            grossCost = grossCost.add(costBeforeBreak);
        }
    }

    private static final class Accumulator {
        private final Long staffId;
        private final String name;
        private int shiftCount;
        private long netMinutes;
        private BigDecimal cost = BigDecimal.ZERO;

        Accumulator(Long staffId, String name) {
            this.staffId = staffId;
            this.name = name;
        }

        /**
         * Work with a break taken out; the cost shrinks in proportion to the minutes left.
         */
        void add(int shifts, long gross, BigDecimal costBeforeBreak, int breakMinutes) {
            shiftCount += shifts;
            long net = Math.max(0, gross - breakMinutes);
            netMinutes += net;
            if (gross > 0) {
                cost = cost.add(costBeforeBreak.multiply(BigDecimal.valueOf(net))
                        .divide(BigDecimal.valueOf(gross), MathContext.DECIMAL64));
            }
        }

        LabourForecast.ScheduledStaff toRow() {
            return new LabourForecast.ScheduledStaff(staffId, name, shiftCount, round(netMinutes / 60.0),
                    PayrollCalculator.money(cost));
        }
    }
}
