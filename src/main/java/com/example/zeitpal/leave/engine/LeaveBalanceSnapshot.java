package com.example.zeitpal.leave.engine;

/**
 * 残数計算用の残高スナップショット (単位: 勤務日、0.5 刻み)。
 * 残数そのものは保持しない。{@link BalanceAggregator#remaining} で都度算出する。
 */
public record LeaveBalanceSnapshot(double entitled,
                                   double carriedOver,
                                   double adjustment,
                                   double used,
                                   double pending) {

    public static final LeaveBalanceSnapshot EMPTY = new LeaveBalanceSnapshot(0, 0, 0, 0, 0);
}
