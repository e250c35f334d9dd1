package com.example.rota.timeentry;

import com.example.rota.auth.StaffPrincipal;
import com.example.rota.staff.Staff;
import com.example.rota.staff.StaffRole;
import com.example.rota.support.RotaFixtures;
import com.example.rota.support.RotaTestConfig;
import com.example.rota.support.SettableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Import(RotaTestConfig.class)
@Transactional
class TimeEntryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TimeEntryRepository timeEntryRepository;

    @Autowired
    private SettableClock clock;

    @Autowired
    private RotaFixtures fixtures;

    private Staff ana;
    private Staff manager;

    @BeforeEach
    void setUp() {
        clock.set(LocalDateTime.of(2025, 3, 10, 9, 0));
        ana = fixtures.staff("Ana", StaffRole.EMPLOYEE);
        manager = fixtures.staff("Mo", StaffRole.MANAGER);
    }

    @Test
    void clockInTwiceReturnsConflict() throws Exception {
        mockMvc.perform(post("/api/time-entries/clock-in")
                .with(user(StaffPrincipal.of(ana)))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.staffId").value(ana.getId()))
            .andExpect(jsonPath("$.data.state").value("ACTIVE"));

        mockMvc.perform(post("/api/time-entries/clock-in")
                .with(user(StaffPrincipal.of(ana)))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("ALREADY_CLOCKED_IN"));

        assertThat(timeEntryRepository.findByActiveStaffId(ana.getId())).isPresent();
    }

    @Test
    void manualEntryValidatesAndRequiresManager() throws Exception {
        String payload = """
            {
              "staffId": %d,
              "date": "2025-03-09",
              "clockIn": "22:00",
              "clockOut": "06:00"
            }
            """.formatted(ana.getId());

        mockMvc.perform(post("/api/time-entries/manual")
                .with(user(StaffPrincipal.of(ana)))
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("FORBIDDEN"));

        mockMvc.perform(post("/api/time-entries/manual")
                .with(user(StaffPrincipal.of(manager)))
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.data.clockOut").value(startsWith("2025-03-10T06:00")))
            .andExpect(jsonPath("$.data.approvalStatus").value("PENDING"));
    }

    @Test
    void unknownShiftIsNotFound() throws Exception {
        mockMvc.perform(get("/api/shifts/{id}", 987654L)
                .with(user(StaffPrincipal.of(manager))))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void missingQueryParameterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/time-entries").param("to", "2025-03-10")
                .with(user(StaffPrincipal.of(manager))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.details.from").value("required"));
    }

    @Test
    void unmappedPathIsNotFound() throws Exception {
        mockMvc.perform(get("/api/no-such-endpoint")
                .with(user(StaffPrincipal.of(manager))))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void staffCostsAreForManagersOnly() throws Exception {
        mockMvc.perform(get("/api/payroll/staff-costs").param("month", "2025-03")
                .with(user(StaffPrincipal.of(ana))))
            .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/payroll/staff-costs").param("month", "03/2025")
                .with(user(StaffPrincipal.of(manager))))
            .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/payroll/staff-costs").param("month", "2025-03")
                .with(user(StaffPrincipal.of(manager))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.label").value("2025-03"))
            .andExpect(jsonPath("$.data.variance.comparable").value(false));
    }

    @Test
    void weeklyForecastDefaultsToTheCurrentWeek() throws Exception {
        mockMvc.perform(get("/api/payroll/weekly-forecast")
                .with(user(StaffPrincipal.of(ana))))
            .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/payroll/weekly-forecast")
                .with(user(StaffPrincipal.of(manager))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.weekStart").value("2025-03-10"))
            .andExpect(jsonPath("$.data.weekEnd").value("2025-03-16"))
            .andExpect(jsonPath("$.data.breakCalculationMode").value("PER_SHIFT"));
    }

    @Test
    void unknownBreakCalculationModeIsRejected() throws Exception {
        mockMvc.perform(put("/api/settings/rules")
                .with(user(StaffPrincipal.of(manager)))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"breakCalculationMode\": \"PER_WEEK\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void flaggingMissedClockOutsReportsTheCount() throws Exception {
        mockMvc.perform(post("/api/time-entries/clock-in")
                .with(user(StaffPrincipal.of(ana)))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isCreated());
        clock.set(LocalDateTime.of(2025, 3, 11, 8, 0));

        mockMvc.perform(post("/api/time-entries/missed-clock-outs")
                .with(user(StaffPrincipal.of(ana))))
            .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/time-entries/missed-clock-outs")
                .with(user(StaffPrincipal.of(manager))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.message").value(endsWith("missed clock-out(s) flagged")));
    }

    @Test
    void anonymousCallsAreUnauthorized() throws Exception {
        mockMvc.perform(get("/api/time-entries/current"))
            .andExpect(status().isUnauthorized());
    }
}
