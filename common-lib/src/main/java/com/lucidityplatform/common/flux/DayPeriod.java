package com.lucidityplatform.common.flux;

import java.time.Instant;
import java.time.ZoneId;

/** Coarse time-of-day used to pick the day or night variant of a flux profile. */
public enum DayPeriod {
    DAY,
    NIGHT;

    public static final int DAY_START_HOUR = 6;
    public static final int DAY_END_HOUR   = 18;

    public static DayPeriod at(Instant instant, ZoneId zone) {
        int hour = instant.atZone(zone).getHour();
        return hour >= DAY_START_HOUR && hour < DAY_END_HOUR ? DAY : NIGHT;
    }
}
