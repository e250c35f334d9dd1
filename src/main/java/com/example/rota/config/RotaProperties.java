package com.example.rota.config;

import com.example.rota.breaks.BreakCalculationMode;
import com.example.rota.breaks.BreakTier;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Organization-wide defaults. Per-organization overrides live in {@link RuleSettings}.
 */
@ConfigurationProperties(prefix = "rota")
public class RotaProperties {

    private final Clock clock = new Clock();
    private final Payroll payroll = new Payroll();
    private int defaultRadiusMetres = 100;
    private int notificationBufferSize = 200;
    private BreakCalculationMode breakCalculationMode = BreakCalculationMode.PER_SHIFT;
    private List<BreakTier> defaultBreakTiers = new ArrayList<>(List.of(
            new BreakTier(4, 15),
            new BreakTier(6, 30),
            new BreakTier(8, 60)
    ));

    public Clock getClock() {
        return clock;
    }

    public Payroll getPayroll() {
        return payroll;
    }

    public int getDefaultRadiusMetres() {
        return defaultRadiusMetres;
    }

    public void setDefaultRadiusMetres(int defaultRadiusMetres) {
        this.defaultRadiusMetres = defaultRadiusMetres;
    }

    public int getNotificationBufferSize() {
        return notificationBufferSize;
    }

    public void setNotificationBufferSize(int notificationBufferSize) {
        this.notificationBufferSize = notificationBufferSize;
    }

    public BreakCalculationMode getBreakCalculationMode() {
        return breakCalculationMode;
    }

    public void setBreakCalculationMode(BreakCalculationMode breakCalculationMode) {
        this.breakCalculationMode = breakCalculationMode;
    }

    public List<BreakTier> getDefaultBreakTiers() {
        return defaultBreakTiers;
    }

    public void setDefaultBreakTiers(List<BreakTier> defaultBreakTiers) {
        this.defaultBreakTiers = defaultBreakTiers;
    }

    public static class Clock {
        private int clockInWindowMinutes = 15;
        private int lateGraceMinutes = 0;
        private int clockOutGraceMinutes = 15;
        private boolean enforceMandatedBreak = true;

        public int getClockInWindowMinutes() { return clockInWindowMinutes; }
        public void setClockInWindowMinutes(int clockInWindowMinutes) { this.clockInWindowMinutes = clockInWindowMinutes; }
        public int getLateGraceMinutes() { return lateGraceMinutes; }
        public void setLateGraceMinutes(int lateGraceMinutes) { this.lateGraceMinutes = lateGraceMinutes; }
        public int getClockOutGraceMinutes() { return clockOutGraceMinutes; }
        public void setClockOutGraceMinutes(int clockOutGraceMinutes) { this.clockOutGraceMinutes = clockOutGraceMinutes; }
        public boolean isEnforceMandatedBreak() { return enforceMandatedBreak; }
        public void setEnforceMandatedBreak(boolean enforceMandatedBreak) { this.enforceMandatedBreak = enforceMandatedBreak; }
    }

    /**
     * Statutory rates. Thresholds are weekly amounts; the aggregator pro-rates them to the reporting window.
     */
    public static class Payroll {
        private BigDecimal holidayAccrualRate = new BigDecimal("0.1207");
        private BigDecimal employerRate = new BigDecimal("0.138");
        private BigDecimal employerWeeklyThreshold = new BigDecimal("175");
        private BigDecimal employeeMainRate = new BigDecimal("0.08");
        private BigDecimal employeeAdditionalRate = new BigDecimal("0.02");
        private BigDecimal employeeWeeklyLowerThreshold = new BigDecimal("242");
        private BigDecimal employeeWeeklyUpperThreshold = new BigDecimal("967");

        public BigDecimal getHolidayAccrualRate() { return holidayAccrualRate; }
        public void setHolidayAccrualRate(BigDecimal holidayAccrualRate) { this.holidayAccrualRate = holidayAccrualRate; }
        public BigDecimal getEmployerRate() { return employerRate; }
        public void setEmployerRate(BigDecimal employerRate) { this.employerRate = employerRate; }
        public BigDecimal getEmployerWeeklyThreshold() { return employerWeeklyThreshold; }
        public void setEmployerWeeklyThreshold(BigDecimal employerWeeklyThreshold) { this.employerWeeklyThreshold = employerWeeklyThreshold; }
        public BigDecimal getEmployeeMainRate() { return employeeMainRate; }
        public void setEmployeeMainRate(BigDecimal employeeMainRate) { this.employeeMainRate = employeeMainRate; }
        public BigDecimal getEmployeeAdditionalRate() { return employeeAdditionalRate; }
        public void setEmployeeAdditionalRate(BigDecimal employeeAdditionalRate) { this.employeeAdditionalRate = employeeAdditionalRate; }
        public BigDecimal getEmployeeWeeklyLowerThreshold() { return employeeWeeklyLowerThreshold; }
        public void setEmployeeWeeklyLowerThreshold(BigDecimal employeeWeeklyLowerThreshold) { this.employeeWeeklyLowerThreshold = employeeWeeklyLowerThreshold; }
        public BigDecimal getEmployeeWeeklyUpperThreshold() { return employeeWeeklyUpperThreshold; }
        public void setEmployeeWeeklyUpperThreshold(BigDecimal employeeWeeklyUpperThreshold) { this.employeeWeeklyUpperThreshold = employeeWeeklyUpperThreshold; }
    }
}
