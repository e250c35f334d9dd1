package com.example.rota.payroll;

import com.example.rota.config.RotaProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Holiday accrual and contribution maths. Thresholds are weekly and scaled to the report window.
 */
@Component
public class PayrollCalculator {

    private final RotaProperties.Payroll rates;

    public PayrollCalculator(RotaProperties properties) {
        this.rates = properties.getPayroll();
    }

    public BigDecimal holidayAccrual(BigDecimal gross) {
        return gross.multiply(rates.getHolidayAccrualRate());
    }

    public BigDecimal employerContribution(BigDecimal gross, PayWindow window) {
        BigDecimal threshold = window.weekly(rates.getEmployerWeeklyThreshold());
        return above(gross, threshold).multiply(rates.getEmployerRate());
    }

    /**
     * Informational only, not part of the employer's total cost.
     */
    public BigDecimal employeeContribution(BigDecimal gross, PayWindow window) {
        BigDecimal lower = window.weekly(rates.getEmployeeWeeklyLowerThreshold());
        BigDecimal upper = window.weekly(rates.getEmployeeWeeklyUpperThreshold());
        BigDecimal main = above(gross.min(upper), lower).multiply(rates.getEmployeeMainRate());
        BigDecimal additional = above(gross, upper).multiply(rates.getEmployeeAdditionalRate());
        return main.add(additional);
    }

    public static BigDecimal money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal above(BigDecimal amount, BigDecimal threshold) {
        return amount.compareTo(threshold) > 0 ? amount.subtract(threshold) : BigDecimal.ZERO;
    }
}
