package com.example.zeitpal.calendar;

/**
 * 半休区分。期間の開始日・終了日それぞれに独立して付与できる。
 */
public enum HalfDayMarker {
    NONE,
    MORNING,
    AFTERNOON;

    public boolean isSet() {
        return this != NONE;
    }

    public static HalfDayMarker orNone(HalfDayMarker marker) {
        return marker == null ? NONE : marker;
    }
}
