package com.rebalance.backend.service.reconcile;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Regular trading hours, weekdays 09:30 to 16:00 exchange time. Holidays are not modelled.
 */
public final class MarketClock {

    private static final LocalTime OPEN = LocalTime.of(9, 30);
    private static final LocalTime CLOSE = LocalTime.of(16, 0);

    private MarketClock() {
    }

    public static boolean isOpen(Instant instant, ZoneId zone) {
        ZonedDateTime local = instant.atZone(zone);
        DayOfWeek day = local.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return false;
        }
        LocalTime time = local.toLocalTime();
        return !time.isBefore(OPEN) && time.isBefore(CLOSE);
    }
}
