package com.example.zeitpal.leave.engine;

import java.time.LocalDate;

/**
 * @param amount          days carried into the new period (0 once expired)
 * @param daysUntilExpiry whole days from the as-of date to the expiry date, never negative
 * @param expired         whether the as-of date lies after the expiry date
 * @param expiryDate      the expiry date the figures were computed against
 */
public record CarryoverResult(double amount, long daysUntilExpiry, boolean expired, LocalDate expiryDate) {
}
