package com.example.zeitpal.leave.engine;

/**
 * remaining = entitled + carriedOver + adjustment - used - pending.
 * Total over any figures; a negative result signals an over-drawn balance.
 */
public final class BalanceAggregator {

    private BalanceAggregator() {
    }

    public static double remaining(LeaveBalanceSnapshot balance) {
        return balance.entitled()
                + balance.carriedOver()
                + balance.adjustment()
                - balance.used()
                - balance.pending();
    }

    /**
     * Balance excluding requests still awaiting a decision:
     * {@code entitled + carriedOver + adjustment - used}. Year-end carryover is based on
     * this figure so that a pending request rejected after the rollover is not lost.
     */
    public static double settled(LeaveBalanceSnapshot balance) {
        return remaining(balance) + balance.pending();
    }

    /**
     * Whether {@code requestedDays} more can be booked without over-drawing.
     */
    public static boolean covers(LeaveBalanceSnapshot balance, double requestedDays) {
        return remaining(balance) - requestedDays >= 0;
    }
}
