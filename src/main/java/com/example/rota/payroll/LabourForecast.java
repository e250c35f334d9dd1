package com.example.rota.payroll;

import com.example.rota.breaks.BreakCalculationMode;
import com.example.rota.staff.PayType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Contracted hours against the published schedule for one week.
 */
public record LabourForecast(LocalDate weekStart,
                             LocalDate weekEnd,
                             Long locationId,
                             BreakCalculationMode breakCalculationMode,
                             Contracted contracted,
                             Scheduled scheduled,
                             Variance variance) {

    public record Contracted(double totalHours,
                             BigDecimal totalCost,
                             int staffCount,
                             List<ContractedStaff> staff) {
    }

    public record ContractedStaff(Long staffId,
                                  String name,
                                  PayType payType,
                                  double hours,
                                  BigDecimal cost) {
    }

    public record Scheduled(double totalHours,
                            BigDecimal totalCost,
                            int shiftCount,
                            List<ScheduledStaff> staff) {
    }

    /**
     * {@code staffId} is null for the row of open shifts.
     */
    public record ScheduledStaff(Long staffId,
                                 String name,
                                 int shiftCount,
                                 double hours,
                                 BigDecimal cost) {
    }

    /**
     * Scheduled minus contracted. Percentages are relative to contracted and 0 when nothing is contracted.
     */
    public record Variance(double hours,
                           BigDecimal cost,
                           BigDecimal hoursPercent,
                           BigDecimal costPercent) {
    }
}
