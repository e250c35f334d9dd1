package com.example.rota.support;

import com.example.rota.category.ShiftCategoryRepository;
import com.example.rota.location.LocationRepository;
import com.example.rota.shift.ShiftRepository;
import com.example.rota.staff.StaffRepository;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.LocalDateTime;

@TestConfiguration
public class RotaTestConfig {

    @Bean
    @Primary
    public SettableClock testClock() {
        return new SettableClock(LocalDateTime.of(2025, 3, 10, 8, 0));
    }

    @Bean
    public RotaFixtures rotaFixtures(StaffRepository staffRepository,
                                     ShiftRepository shiftRepository,
                                     LocationRepository locationRepository,
                                     ShiftCategoryRepository categoryRepository) {
        return new RotaFixtures(staffRepository, shiftRepository, locationRepository, categoryRepository);
    }
}
