package com.swingtrading.live;

import com.swingtrading.config.TradingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Session window for the live driver. Weekdays only, start and end inclusive,
 * evaluated in the exchange's time zone.
 */
public final class TradingHoursWindow {
    private static final Logger logger = LoggerFactory.getLogger(TradingHoursWindow.class);

    private final LocalTime start;
    private final LocalTime end;
    private final ZoneId zone;
    private final Clock clock;

    public TradingHoursWindow(TradingConfig config, Clock clock) {
        this(config.getTradingStartTime(), config.getTradingEndTime(), config.getTradingZone(), clock);
    }

    public TradingHoursWindow(LocalTime start, LocalTime end, ZoneId zone, Clock clock) {
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Trading window start must be before end: " + start + " - " + end);
        }
        this.start = start;
        this.end = end;
        this.zone = zone;
        this.clock = clock;

        logger.info("Trading window: {} - {} {} (Monday - Friday)", start, end, zone);
        if (isOpen()) {
            logger.info("Market is currently OPEN, closes at {}", end);
        } else {
            logger.info("Market is currently CLOSED: {}", closedReason(clock.instant()));
        }
    }

    public boolean isOpen() {
        return isOpen(clock.instant());
    }

    public boolean isOpen(Instant instant) {
        ZonedDateTime now = instant.atZone(zone);
        if (isWeekend(now.getDayOfWeek())) {
            return false;
        }
        LocalTime time = now.toLocalTime();
        return !time.isBefore(start) && !time.isAfter(end);
    }

    /**
     * Why the window is closed at {@code instant}, for the waiting log line.
     */
    public String closedReason(Instant instant) {
        ZonedDateTime now = instant.atZone(zone);
        if (isWeekend(now.getDayOfWeek())) {
            return "Weekend";
        }
        if (now.toLocalTime().isBefore(start)) {
            return "Pre-market (opens at " + start + ")";
        }
        return "After-hours (closed at " + end + ")";
    }

    /** Exchange-local date of {@code instant}. */
    public LocalDate tradingDate(Instant instant) {
        return instant.atZone(zone).toLocalDate();
    }

    public ZoneId getZone() {
        return zone;
    }

    private static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
