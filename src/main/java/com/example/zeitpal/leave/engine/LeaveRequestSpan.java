package com.example.zeitpal.leave.engine;

import com.example.zeitpal.calendar.DateRange;
import com.example.zeitpal.calendar.HalfDayMarker;

/**
 * 日数計算の単位となる申請期間 (期間 + 開始日/終了日の半休区分)。
 */
public record LeaveRequestSpan(DateRange range, HalfDayMarker startHalfDay, HalfDayMarker endHalfDay) {

    public LeaveRequestSpan {
        startHalfDay = HalfDayMarker.orNone(startHalfDay);
        endHalfDay = HalfDayMarker.orNone(endHalfDay);
    }
}
