package com.example.rota.staff;

import com.example.rota.category.ShiftCategory;
import com.example.rota.exception.AuthorizationException;
import com.example.rota.exception.ConflictException;
import com.example.rota.exception.ValidationException;
import com.example.rota.support.RotaFixtures;
import com.example.rota.support.RotaTestConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

import static com.example.rota.support.RotaFixtures.caller;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(RotaTestConfig.class)
@Transactional
class StaffServiceTest {

    @Autowired
    private StaffService staffService;

    @Autowired
    private StaffRepository staffRepository;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @Autowired
    private RotaFixtures fixtures;

    private Staff manager;
    private Staff admin;

    @BeforeEach
    void setUp() {
        manager = fixtures.staff("Mo", StaffRole.MANAGER);
        admin = fixtures.staff("Ada", StaffRole.ADMIN);
    }

    @Test
    void managerCreatesEmployeeWithHashedPassword() {
        StaffView created = staffService.create(caller(manager), new StaffService.CreateStaffRequest(
                "Ana", " Ana@Example.com ", "correct horse", null, null, new BigDecimal("11.44"), null, 37.5));

        Staff saved = staffRepository.findById(created.id()).orElseThrow();
        assertThat(saved.getRole()).isEqualTo(StaffRole.EMPLOYEE);
        assertThat(saved.getEmail()).isEqualTo("ana@example.com");
        assertThat(passwordEncoder.matches("correct horse", saved.getPasswordHash())).isTrue();
        assertThat(saved.getDefaultHourlyRate()).isEqualByComparingTo("11.44");
        assertThat(saved.getContractedHours()).isEqualTo(37.5);
    }

    @Test
    void onlyAdminsHandOutElevatedRoles() {
        StaffService.CreateStaffRequest supervisor = new StaffService.CreateStaffRequest(
                "Sue", "sue@example.com", "correct horse", StaffRole.MANAGER, null, null, null, null);

        assertThatThrownBy(() -> staffService.create(caller(manager), supervisor))
                .isInstanceOf(AuthorizationException.class);
        assertThat(staffService.create(caller(admin), supervisor).role()).isEqualTo(StaffRole.MANAGER);

        Staff ana = fixtures.staff("Ana", StaffRole.EMPLOYEE);
        StaffService.UpdateStaffRequest promote = new StaffService.UpdateStaffRequest(null, StaffRole.MANAGER, null, null, null, null, null);
        assertThatThrownBy(() -> staffService.update(caller(manager), ana.getId(), promote))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    void emailsAreUnique() {
        staffService.create(caller(manager), new StaffService.CreateStaffRequest(
                "Ana", "ana@example.com", "correct horse", null, null, null, null, null));

        assertThatThrownBy(() -> staffService.create(caller(manager), new StaffService.CreateStaffRequest(
                "Ana Two", "ANA@example.com", "correct horse", null, null, null, null, null)))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void salariedStaffNeedASalary() {
        assertThatThrownBy(() -> staffService.create(caller(manager), new StaffService.CreateStaffRequest(
                "Sam", "sam@example.com", "correct horse", null, PayType.SALARIED, null, null, null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void categoryRateOverrideCanBeSetAndRemoved() {
        Staff ana = fixtures.hourly("Ana", "10.00");
        ShiftCategory bar = fixtures.category("Bar", "12.00");

        assertThat(staffService.setCategoryRate(caller(manager), ana.getId(), bar.getId(), new BigDecimal("14.00")))
                .singleElement()
                .satisfies(rate -> assertThat(rate.hourlyRate()).isEqualByComparingTo("14.00"));
        assertThat(staffService.categoryRates(caller(ana), ana.getId())).hasSize(1);

        assertThat(staffService.setCategoryRate(caller(manager), ana.getId(), bar.getId(), null)).isEmpty();
    }

    @Test
    void staffSeeOnlyThemselves() {
        Staff ana = fixtures.staff("Ana", StaffRole.EMPLOYEE);

        assertThat(staffService.me(caller(ana)).name()).isEqualTo("Ana");
        assertThatThrownBy(() -> staffService.list(caller(ana))).isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> staffService.categoryRates(caller(ana), manager.getId()))
                .isInstanceOf(AuthorizationException.class);
    }
}
