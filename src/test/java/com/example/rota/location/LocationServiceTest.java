package com.example.rota.location;

import com.example.rota.breaks.BreakTier;
import com.example.rota.exception.AuthorizationException;
import com.example.rota.exception.NotFoundException;
import com.example.rota.exception.ValidationException;
import com.example.rota.staff.Staff;
import com.example.rota.staff.StaffRole;
import com.example.rota.support.RotaFixtures;
import com.example.rota.support.RotaTestConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static com.example.rota.support.RotaFixtures.caller;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(RotaTestConfig.class)
@Transactional
class LocationServiceTest {

    @Autowired
    private LocationService locationService;

    @Autowired
    private LocationRepository locationRepository;

    @Autowired
    private RotaFixtures fixtures;

    private Staff manager;

    @BeforeEach
    void setUp() {
        manager = fixtures.staff("Mo", StaffRole.MANAGER);
    }

    @Test
    void createUsesDefaultRadiusAndSortsTiers() {
        Location location = locationService.create(caller(manager), new LocationRequest("Harbour", 51.5, -0.12, null,
                List.of(new BreakTier(8, 45), new BreakTier(5, 20)), null));

        assertThat(location.getClockInRadiusMetres()).isEqualTo(100);
        assertThat(location.getBreakTiers()).extracting(BreakTier::minHours).containsExactly(5.0, 8.0);
    }

    @Test
    void coordinatesComeInPairsAndInRange() {
        assertThatThrownBy(() -> locationService.create(caller(manager), new LocationRequest("Half", 51.5, null, null, null, null)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> locationService.create(caller(manager), new LocationRequest("Far", 95.0, 10.0, null, null, null)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> locationService.create(caller(manager), new LocationRequest("Tight", 51.5, 0.0, 0, null, null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void otherOrganizationsLocationsAreInvisible() {
        Staff outsider = fixtures.staff(2L, "Zed", StaffRole.MANAGER);
        Location location = locationService.create(caller(manager), new LocationRequest("Harbour", null, null, 50, null, null));

        assertThatThrownBy(() -> locationService.get(caller(outsider), location.getId()))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> locationService.create(caller(fixtures.staff("Ana", StaffRole.EMPLOYEE)),
                new LocationRequest("Mine", null, null, null, null, null)))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    void adminReplacesStaffLocationsWholesale() {
        Staff admin = fixtures.staff("Ada", StaffRole.ADMIN);
        Staff ana = fixtures.staff("Ana", StaffRole.EMPLOYEE);
        Location harbour = fixtures.location("Harbour", null, null, 100);
        Location station = fixtures.location("Station", null, null, 100);

        locationService.assignStaffLocations(caller(admin), ana.getId(), List.of(harbour.getId(), station.getId()));
        List<Location> replaced = locationService.assignStaffLocations(caller(admin), ana.getId(), List.of(station.getId()));

        assertThat(replaced).extracting(Location::getName).containsExactly("Station");
        assertThat(locationService.staffLocations(caller(ana), ana.getId())).extracting(Location::getName).containsExactly("Station");
        assertThat(locationService.assignedLocationIds(ana.getId())).containsExactly(station.getId());

        locationService.assignStaffLocations(caller(admin), ana.getId(), List.of());
        assertThat(locationService.assignedLocationIds(ana.getId())).isEmpty();
    }

    @Test
    void onlyAdminsAssignAndOnlyToTheirOwnLocations() {
        Staff admin = fixtures.staff("Ada", StaffRole.ADMIN);
        Staff ana = fixtures.staff("Ana", StaffRole.EMPLOYEE);
        Staff bo = fixtures.staff("Bo", StaffRole.EMPLOYEE);
        Location harbour = fixtures.location("Harbour", null, null, 100);
        Location elsewhere = locationRepository.save(new Location(2L, "Elsewhere"));

        assertThatThrownBy(() -> locationService.assignStaffLocations(caller(manager), ana.getId(), List.of(harbour.getId())))
                .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> locationService.assignStaffLocations(caller(admin), ana.getId(), List.of(elsewhere.getId())))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> locationService.staffLocations(caller(bo), ana.getId()))
                .isInstanceOf(AuthorizationException.class);
        assertThat(locationService.assignedLocationIds(ana.getId())).isEmpty();
    }
}
