package com.lucidityplatform.common.flux;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-minute flux for one location key. {@code all} applies when the period-specific
 * value is missing. Any field may be null.
 */
public record FluxProfile(
    @JsonProperty("day")   Double day,
    @JsonProperty("night") Double night,
    @JsonProperty("all")   Double all
) {
    public static FluxProfile constant(double value) {
        return new FluxProfile(null, null, value);
    }

    public static FluxProfile dayNight(double day, double night) {
        return new FluxProfile(day, night, null);
    }

    /** Period value, then {@code all}, then {@code fallback}. */
    public double valueFor(DayPeriod period, double fallback) {
        Double specific = period == DayPeriod.DAY ? day : night;
        if (specific != null) return specific;
        if (all != null)      return all;
        return fallback;
    }
}
