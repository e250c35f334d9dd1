package com.example.rota.payroll;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive date range a cost report covers.
 */
public record PayWindow(String label, LocalDate start, LocalDate end, boolean fullMonth) {

    private static final BigDecimal WEEKS_PER_MONTH = new BigDecimal("52").divide(new BigDecimal("12"), MathContext.DECIMAL64);

    public static PayWindow ofMonth(YearMonth month) {
        return new PayWindow(month.toString(), month.atDay(1), month.atEndOfMonth(), true);
    }

    public static PayWindow ofPeriod(PayPeriod period) {
        return new PayWindow(period.getName(), period.getStartDate(), period.getEndDate(), false);
    }

    public long days() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    public LocalDateTime from() {
        return start.atStartOfDay();
    }

    public LocalDateTime toExclusive() {
        return end.plusDays(1).atStartOfDay();
    }

    /**
     * The previous month, or the equally long window right before a pay period.
     */
    public PayWindow previous() {
        if (fullMonth) {
            return ofMonth(YearMonth.from(start).minusMonths(1));
        }
        LocalDate prevEnd = start.minusDays(1);
        return new PayWindow("previous " + label, prevEnd.minusDays(days() - 1), prevEnd, false);
    }

    /**
     * Scales a weekly amount to this window: 52/12 weeks for a month, days/7 otherwise.
     */
    public BigDecimal weekly(BigDecimal weeklyAmount) {
        if (fullMonth) {
            return weeklyAmount.multiply(WEEKS_PER_MONTH, MathContext.DECIMAL64);
        }
        return weeklyAmount.multiply(BigDecimal.valueOf(days())).divide(BigDecimal.valueOf(7), MathContext.DECIMAL64);
    }

    /**
     * Pro-rates a monthly salary: in full for a calendar month, else 12 * days / 365.
     */
    public BigDecimal monthly(BigDecimal monthlyAmount) {
        if (fullMonth) {
            return monthlyAmount;
        }
        return monthlyAmount.multiply(BigDecimal.valueOf(12L * days())).divide(BigDecimal.valueOf(365), MathContext.DECIMAL64);
    }
}
