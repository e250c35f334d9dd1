package com.example.rota.payroll;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;

public interface PayPeriodRepository extends JpaRepository<PayPeriod, Long> {

    List<PayPeriod> findByOrganizationIdOrderByStartDateDesc(Long organizationId);

    /** Active periods overlapping [start, end]. */
    List<PayPeriod> findByOrganizationIdAndActiveTrueAndStartDateLessThanEqualAndEndDateGreaterThanEqual(
            Long organizationId, LocalDate end, LocalDate start);
}
