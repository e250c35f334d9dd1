package com.example.rota.payroll;

import com.example.rota.staff.PayType;
import com.example.rota.staff.StaffRole;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record CostReport(String label,
                         LocalDate start,
                         LocalDate end,
                         Long locationId,
                         List<StaffCost> staff,
                         List<LocationCost> locations,
                         Totals totals,
                         Variance variance) {

    public record StaffCost(Long staffId,
                            String name,
                            StaffRole role,
                            PayType payType,
                            double hours,
                            BigDecimal gross,
                            BigDecimal holidayAccrual,
                            BigDecimal employerContribution,
                            BigDecimal employeeContribution,
                            BigDecimal total) {
    }

    /**
     * {@code locationId} is null for the bucket of costs with no location.
     */
    public record LocationCost(Long locationId,
                               String locationName,
                               double hours,
                               BigDecimal gross,
                               BigDecimal holidayAccrual,
                               BigDecimal employerContribution,
                               BigDecimal total) {
    }

    public record Totals(double hours,
                         BigDecimal gross,
                         BigDecimal holidayAccrual,
                         BigDecimal employerContribution,
                         BigDecimal employeeContribution,
                         BigDecimal total) {
    }

    /**
     * {@code comparable} is false when the previous window cost nothing; the percentage is then 0.
     */
    public record Variance(String previousLabel,
                           BigDecimal previousTotal,
                           BigDecimal amount,
                           BigDecimal percentage,
                           boolean comparable) {
    }
}
