package com.marketalert.common.clock;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Pure stateless check of whether the watched market window is currently active.
 *
 * <p>Active iff the instant, converted to the reference timezone, falls on Monday to
 * Friday and the local hour lies in {@code [openHour, closeHour)}.
 *
 * <p>No holiday, half-day or DST-exception handling. No Spring dependency.
 */
public final class MarketClock {

    private final ZoneId zone;
    private final int openHour;
    private final int closeHour;

    public MarketClock(ZoneId zone, int openHour, int closeHour) {
        if (openHour < 0 || closeHour > 24 || openHour >= closeHour) {
            throw new IllegalArgumentException(
                "invalid market window openHour=" + openHour + " closeHour=" + closeHour);
        }
        this.zone      = zone;
        this.openHour  = openHour;
        this.closeHour = closeHour;
    }

    /** Uses the reference timezone this clock was configured with. */
    public boolean isActive(Instant now) {
        return isActive(now, zone);
    }

    /**
     * @param now  UTC instant to classify
     * @param zone timezone in which weekday and hour are evaluated
     * @return {@code true} inside the weekday trading window
     */
    public boolean isActive(Instant now, ZoneId zone) {
        ZonedDateTime local = now.atZone(zone);
        DayOfWeek day = local.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return false;
        }
        int hour = local.getHour();
        return hour >= openHour && hour < closeHour;
    }

    public ZoneId zone() {
        return zone;
    }

    public int openHour() {
        return openHour;
    }

    public int closeHour() {
        return closeHour;
    }
}
