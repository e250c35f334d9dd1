package com.example.rota.breaks;

/**
 * One row of a break policy: shifts of at least {@code minHours} owe {@code breakMinutes} unpaid.
 */
public record BreakTier(double minHours, int breakMinutes) {
}
