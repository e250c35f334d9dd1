package com.example.rota.payroll;

import com.example.rota.breaks.BreakCalculationMode;
import com.example.rota.category.ShiftCategory;
import com.example.rota.config.CacheConfig;
import com.example.rota.config.RuleSettingsService;
import com.example.rota.exception.AuthorizationException;
import com.example.rota.exception.NotFoundException;
import com.example.rota.location.Location;
import com.example.rota.location.LocationRepository;
import com.example.rota.location.LocationService;
import com.example.rota.shift.Shift;
import com.example.rota.shift.ShiftRepository;
import com.example.rota.staff.Staff;
import com.example.rota.staff.StaffRepository;
import com.example.rota.staff.StaffRole;
import com.example.rota.support.RotaFixtures;
import com.example.rota.support.RotaTestConfig;
import com.example.rota.support.SettableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

import static com.example.rota.support.RotaFixtures.caller;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(RotaTestConfig.class)
@Transactional
class LabourForecastServiceTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 3, 10);

    @Autowired
    private LabourForecastService forecastService;

    @Autowired
    private RuleSettingsService ruleSettingsService;

    @Autowired
    private LocationService locationService;

    @Autowired
    private StaffRepository staffRepository;

    @Autowired
    private ShiftRepository shiftRepository;

    @Autowired
    private LocationRepository locationRepository;

    @Autowired
    private CacheManager cacheManager;

    @Autowired
    private SettableClock clock;

    @Autowired
    private RotaFixtures fixtures;

    private Staff manager;
    private Staff ana;
    private Staff bo;
    private Staff sal;

    @BeforeEach
    void setUp() {
        clock.set(MONDAY.plusDays(2).atTime(12, 0));
        manager = fixtures.staff("Mo", StaffRole.MANAGER);
        ana = contracted(fixtures.hourly("Ana", "10.00"), 20.0);
        bo = contracted(fixtures.hourly("Bo", "12.00"), 10.0);
        sal = contracted(fixtures.salaried("Sal", "2600.00"), 40.0);
        ShiftCategory bar = fixtures.category("Bar", "12.00");

        shift(MONDAY.atTime(9, 0), 4, ana, 15, null, null);
        shift(MONDAY.atTime(14, 0), 4, ana, 15, null, null);
        shift(MONDAY.plusDays(1).atTime(9, 0), 8, bo, 60, null, null);
        shift(MONDAY.plusDays(2).atTime(9, 0), 6, null, 30, bar, null);
        shift(MONDAY.plusDays(3).atTime(9, 0), 8, sal, 60, null, null);
        shift(MONDAY.plusDays(7).atTime(9, 0), 8, ana, 60, null, null);
    }

    @AfterEach
    void evictRules() {
        Objects.requireNonNull(cacheManager.getCache(CacheConfig.CLOCK_RULES)).clear();
    }

    @Test
    void perShiftForecastUsesEachShiftsBreak() {
        LabourForecast forecast = forecastService.weeklyForecast(caller(manager), null, null);

        assertThat(forecast.weekStart()).isEqualTo(MONDAY);
        assertThat(forecast.weekEnd()).isEqualTo(MONDAY.plusDays(6));
        assertThat(forecast.breakCalculationMode()).isEqualTo(BreakCalculationMode.PER_SHIFT);

        assertThat(forecast.contracted().totalHours()).isEqualTo(70.0);
        assertThat(forecast.contracted().totalCost()).isEqualByComparingTo("920.00");
        assertThat(forecast.contracted().staffCount()).isEqualTo(3);
        assertThat(forecast.contracted().staff())
                .filteredOn(s -> s.staffId().equals(sal.getId()))
                .singleElement()
                .satisfies(s -> assertThat(s.cost()).isEqualByComparingTo("600.00"));

        assertThat(forecast.scheduled().shiftCount()).isEqualTo(5);
        assertThat(forecast.scheduled().totalHours()).isEqualTo(27.0);
        assertThat(forecast.scheduled().totalCost()).isEqualByComparingTo("225.00");
        assertThat(forecast.scheduled().staff())
                .extracting(LabourForecast.ScheduledStaff::name)
                .containsExactly("Ana", "Bo", "Sal", "Open shifts");
        assertThat(forecast.scheduled().staff().get(0).hours()).isEqualTo(7.5);
        assertThat(forecast.scheduled().staff().get(0).cost()).isEqualByComparingTo("75.00");
        assertThat(forecast.scheduled().staff().get(2).cost()).isEqualByComparingTo("0.00");
        assertThat(forecast.scheduled().staff().get(3).cost()).isEqualByComparingTo("66.00");

        assertThat(forecast.variance().hours()).isEqualTo(-43.0);
        assertThat(forecast.variance().cost()).isEqualByComparingTo("-695.00");
        assertThat(forecast.variance().hoursPercent()).isEqualByComparingTo("-61.43");
        assertThat(forecast.variance().costPercent()).isEqualByComparingTo("-75.54");
    }

    @Test
    void perDayForecastTakesOneBreakForTheDaysTotal() {
        ruleSettingsService.update(caller(manager),
                new RuleSettingsService.RuleSettingsRequest(null, null, null, null, BreakCalculationMode.PER_DAY));

        LabourForecast forecast = forecastService.weeklyForecast(caller(manager), MONDAY, null);

        assertThat(forecast.breakCalculationMode()).isEqualTo(BreakCalculationMode.PER_DAY);
        LabourForecast.ScheduledStaff anaRow = forecast.scheduled().staff().get(0);
        assertThat(anaRow.staffId()).isEqualTo(ana.getId());
        assertThat(anaRow.shiftCount()).isEqualTo(2);
        assertThat(anaRow.hours()).isEqualTo(7.0);
        assertThat(anaRow.cost()).isEqualByComparingTo("70.00");
        assertThat(forecast.scheduled().totalHours()).isEqualTo(26.5);
        assertThat(forecast.scheduled().totalCost()).isEqualByComparingTo("220.00");
    }

    @Test
    void locationFilterNarrowsShiftsAndContractedStaff() {
        Staff admin = fixtures.staff("Ada", StaffRole.ADMIN);
        Location harbour = fixtures.location("Harbour", null, null, 100);
        shift(MONDAY.plusDays(4).atTime(10, 0), 5, bo, 15, null, harbour);
        locationService.assignStaffLocations(caller(admin), bo.getId(), List.of(harbour.getId()));

        LabourForecast forecast = forecastService.weeklyForecast(caller(manager), MONDAY, harbour.getId());

        assertThat(forecast.contracted().staff()).extracting(LabourForecast.ContractedStaff::staffId)
                .containsExactly(bo.getId());
        assertThat(forecast.scheduled().shiftCount()).isEqualTo(1);
        assertThat(forecast.scheduled().totalHours()).isEqualTo(4.75);
        assertThat(forecast.scheduled().totalCost()).isEqualByComparingTo("57.00");
    }

    @Test
    void staffCannotSeeTheForecastAndForeignLocationsAreMissing() {
        Location elsewhere = locationRepository.save(new Location(2L, "Elsewhere"));

        assertThatThrownBy(() -> forecastService.weeklyForecast(caller(ana), MONDAY, null))
                .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> forecastService.weeklyForecast(caller(manager), MONDAY, elsewhere.getId()))
                .isInstanceOf(NotFoundException.class);
    }

    private Staff contracted(Staff staff, double hours) {
        staff.setContractedHours(hours);
        return staffRepository.save(staff);
    }

    private void shift(LocalDateTime start, int hours, Staff assignee, int breakMinutes, ShiftCategory category, Location location) {
        Shift shift = fixtures.shift(start, start.plusHours(hours), assignee, location, category);
        shift.setScheduledBreakMinutes(breakMinutes);
        shiftRepository.save(shift);
    }
}
