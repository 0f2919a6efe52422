package me.golemcore.quota.ratelimit;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.quota.domain.model.QuotaWindow;
import me.golemcore.quota.domain.model.ResetInfo;
import me.golemcore.quota.domain.model.ResetMode;
import me.golemcore.quota.domain.model.TimeRange;
import me.golemcore.quota.infrastructure.config.QuotaProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;

/**
 * Resolves quota windows into absolute time ranges and cache TTLs.
 *
 * <p>
 * Window definitions:
 * <ul>
 * <li><b>5h</b> - always rolling: {@code [now - 5h, now]}</li>
 * <li><b>daily</b> - rolling {@code [now - 24h, now]}, or fixed: from the most
 * recent occurrence of the reset time in the configured zone</li>
 * <li><b>weekly</b> - calendar week starting Monday 00:00</li>
 * <li><b>monthly</b> - calendar month starting on day 1 00:00</li>
 * </ul>
 *
 * <p>
 * The end of a resolved range is "now", the upper bound of the ledger query.
 * TTLs run until the window's next natural boundary. All wall-clock arithmetic
 * goes through {@link ZonedDateTime}, so a reset time keeps its local meaning
 * across daylight-saving transitions.
 *
 * <p>
 * The counter tracker and the lease slicer share this single definition.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class TimeWindowResolver {

    public static final String DEFAULT_RESET_TIME = "00:00";

    private static final long MILLIS_PER_SECOND = 1000L;
    private static final int MAX_HOUR = 23;
    private static final int MAX_MINUTE = 59;

    private final Clock clock;
    private final ZoneId zone;

    public TimeWindowResolver(QuotaProperties properties, Clock clock) {
        this.clock = clock;
        this.zone = resolveZone(properties.getTimezone());
    }

    public ZoneId getZone() {
        return zone;
    }

    public TimeRange resolve(QuotaWindow window) {
        return resolve(window, DEFAULT_RESET_TIME, ResetMode.FIXED);
    }

    public TimeRange resolve(QuotaWindow window, String resetTime, ResetMode mode) {
        Instant now = clock.instant();
        return switch (window) {
        case FIVE_HOURS -> new TimeRange(now.minus(window.getRollingDuration()), now);
        case DAILY -> mode == ResetMode.ROLLING
                ? new TimeRange(now.minus(window.getRollingDuration()), now)
                : new TimeRange(lastDailyReset(now, resetTime).toInstant(), now);
        case WEEKLY -> new TimeRange(weekStart(now).toInstant(), now);
        case MONTHLY -> new TimeRange(monthStart(now).toInstant(), now);
        };
    }

    public long ttlSeconds(QuotaWindow window) {
        return ttlSeconds(window, DEFAULT_RESET_TIME, ResetMode.FIXED);
    }

    /**
     * Seconds until the window's natural end; a full window length for rolling
     * windows.
     */
    public long ttlSeconds(QuotaWindow window, String resetTime, ResetMode mode) {
        Instant now = clock.instant();
        return switch (window) {
        case FIVE_HOURS -> window.getRollingDuration().toSeconds();
        case DAILY -> mode == ResetMode.ROLLING
                ? window.getRollingDuration().toSeconds()
                : secondsBetween(now, nextDailyReset(now, resetTime).toInstant());
        case WEEKLY -> secondsBetween(now, weekStart(now).plusWeeks(1).toInstant());
        case MONTHLY -> secondsBetween(now, monthStart(now).plusMonths(1).toInstant());
        };
    }

    public ResetInfo resetInfo(QuotaWindow window, String resetTime, ResetMode mode) {
        Instant now = clock.instant();
        boolean rolling = window == QuotaWindow.FIVE_HOURS
                || (window == QuotaWindow.DAILY && mode == ResetMode.ROLLING);
        if (rolling) {
            return ResetInfo.builder()
                    .type(ResetInfo.ResetType.ROLLING)
                    .period(window.getPeriodDescription())
                    .build();
        }
        return switch (window) {
        case DAILY -> ResetInfo.builder()
                .type(ResetInfo.ResetType.CUSTOM)
                .period(window.getPeriodDescription())
                .resetAt(nextDailyReset(now, resetTime).toInstant())
                .build();
        case WEEKLY -> ResetInfo.builder()
                .type(ResetInfo.ResetType.NATURAL)
                .period(window.getPeriodDescription())
                .resetAt(weekStart(now).plusWeeks(1).toInstant())
                .build();
        default -> ResetInfo.builder()
                .type(ResetInfo.ResetType.NATURAL)
                .period(window.getPeriodDescription())
                .resetAt(monthStart(now).plusMonths(1).toInstant())
                .build();
        };
    }

    /**
     * Next local midnight in the configured zone.
     */
    public Instant nextMidnight() {
        ZonedDateTime local = clock.instant().atZone(zone);
        return local.toLocalDate().plusDays(1).atStartOfDay(zone).toInstant();
    }

    public long secondsUntilMidnight() {
        return secondsBetween(clock.instant(), nextMidnight());
    }

    /**
     * Range for a historical filter given as calendar dates. The end date is
     * inclusive: the range ends at the start of the following day.
     */
    public TimeRange dateRange(LocalDate from, LocalDate to) {
        return new TimeRange(
                from.atStartOfDay(zone).toInstant(),
                to.plusDays(1).atStartOfDay(zone).toInstant());
    }

    /**
     * Normalize an {@code HH:MM} reset time. An out-of-range hour or minute
     * becomes {@code 00}; anything unparseable becomes {@code 00:00}.
     */
    public static String normalizeResetTime(String resetTime) {
        if (resetTime == null) {
            return DEFAULT_RESET_TIME;
        }
        String[] parts = resetTime.trim().split(":");
        if (parts.length != 2) {
            return DEFAULT_RESET_TIME;
        }
        int hour;
        int minute;
        try {
            hour = Integer.parseInt(parts[0]);
            minute = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            return DEFAULT_RESET_TIME;
        }
        if (hour < 0 || hour > MAX_HOUR) {
            hour = 0;
        }
        if (minute < 0 || minute > MAX_MINUTE) {
            minute = 0;
        }
        return String.format("%02d:%02d", hour, minute);
    }

    private ZonedDateTime lastDailyReset(Instant now, String resetTime) {
        ZonedDateTime local = now.atZone(zone);
        LocalTime time = LocalTime.parse(normalizeResetTime(resetTime));
        ZonedDateTime todayReset = ZonedDateTime.of(local.toLocalDate(), time, zone);
        if (todayReset.toInstant().isAfter(now)) {
            return ZonedDateTime.of(local.toLocalDate().minusDays(1), time, zone);
        }
        return todayReset;
    }

    private ZonedDateTime nextDailyReset(Instant now, String resetTime) {
        ZonedDateTime local = now.atZone(zone);
        LocalTime time = LocalTime.parse(normalizeResetTime(resetTime));
        ZonedDateTime todayReset = ZonedDateTime.of(local.toLocalDate(), time, zone);
        if (todayReset.toInstant().isAfter(now)) {
            return todayReset;
        }
        return ZonedDateTime.of(local.toLocalDate().plusDays(1), time, zone);
    }

    private ZonedDateTime weekStart(Instant now) {
        LocalDate monday = now.atZone(zone).toLocalDate()
                .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        return monday.atStartOfDay(zone);
    }

    private ZonedDateTime monthStart(Instant now) {
        LocalDate first = now.atZone(zone).toLocalDate().withDayOfMonth(1);
        return first.atStartOfDay(zone);
    }

    private static long secondsBetween(Instant from, Instant to) {
        long millis = Duration.between(from, to).toMillis();
        return (millis + MILLIS_PER_SECOND - 1) / MILLIS_PER_SECOND;
    }

    private static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            log.warn("[RateLimit] Unknown timezone '{}', falling back to UTC", timezone);
            return ZoneOffset.UTC;
        }
    }
}
