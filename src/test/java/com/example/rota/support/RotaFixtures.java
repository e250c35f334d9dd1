package com.example.rota.support;

import com.example.rota.auth.Caller;
import com.example.rota.category.ShiftCategory;
import com.example.rota.category.ShiftCategoryRepository;
import com.example.rota.location.Location;
import com.example.rota.location.LocationRepository;
import com.example.rota.shift.Shift;
import com.example.rota.shift.ShiftRepository;
import com.example.rota.staff.PayType;
import com.example.rota.staff.Staff;
import com.example.rota.staff.StaffRepository;
import com.example.rota.staff.StaffRole;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Builders for the rows most tests need.
 */
public class RotaFixtures {

    public static final Long ORG = 1L;

    private final StaffRepository staffRepository;
    private final ShiftRepository shiftRepository;
    private final LocationRepository locationRepository;
    private final ShiftCategoryRepository categoryRepository;

    public RotaFixtures(StaffRepository staffRepository,
                        ShiftRepository shiftRepository,
                        LocationRepository locationRepository,
                        ShiftCategoryRepository categoryRepository) {
        this.staffRepository = staffRepository;
        this.shiftRepository = shiftRepository;
        this.locationRepository = locationRepository;
        this.categoryRepository = categoryRepository;
    }

    public Staff staff(String name, StaffRole role) {
        return staff(ORG, name, role);
    }

    public Staff staff(Long organizationId, String name, StaffRole role) {
        String email = name.toLowerCase().replace(' ', '.') + "." + UUID.randomUUID() + "@example.com";
        return staffRepository.save(new Staff(organizationId, name, email, "{noop}secret", role));
    }

    public Staff hourly(String name, String rate) {
        Staff staff = staff(name, StaffRole.EMPLOYEE);
        staff.setDefaultHourlyRate(new BigDecimal(rate));
        return staffRepository.save(staff);
    }

    public Staff salaried(String name, String monthlySalary) {
        Staff staff = staff(name, StaffRole.EMPLOYEE);
        staff.setPayType(PayType.SALARIED);
        staff.setMonthlySalary(new BigDecimal(monthlySalary));
        return staffRepository.save(staff);
    }

    public static Caller caller(Staff staff) {
        return new Caller(staff.getId(), staff.getRole(), staff.getOrganizationId());
    }

    public ShiftCategory category(String name, String rate) {
        return categoryRepository.save(new ShiftCategory(ORG, name, new BigDecimal(rate), null));
    }

    public Location location(String name, Double latitude, Double longitude, int radius) {
        Location location = new Location(ORG, name);
        location.setLatitude(latitude);
        location.setLongitude(longitude);
        location.setClockInRadiusMetres(radius);
        return locationRepository.save(location);
    }

    public Shift shift(LocalDateTime start, LocalDateTime end, Staff assignee) {
        return shift(start, end, assignee, null, null);
    }

    public Shift shift(LocalDateTime start, LocalDateTime end, Staff assignee, Location location, ShiftCategory category) {
        Shift shift = new Shift(ORG, "Floor", start, end);
        shift.setLocation(location);
        shift.setCategory(category);
        shift.assignTo(assignee);
        return shiftRepository.save(shift);
    }
}
