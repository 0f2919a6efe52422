package me.golemcore.quota.ratelimit;

import me.golemcore.quota.domain.model.QuotaWindow;
import me.golemcore.quota.domain.model.ResetInfo;
import me.golemcore.quota.domain.model.ResetMode;
import me.golemcore.quota.domain.model.TimeRange;
import me.golemcore.quota.infrastructure.config.QuotaProperties;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TimeWindowResolverTest {

    private static final String SHANGHAI = "Asia/Shanghai";
    private static final String NEW_YORK = "America/New_York";

    private static TimeWindowResolver resolver(String timezone, String now) {
        QuotaProperties properties = new QuotaProperties();
        properties.setTimezone(timezone);
        return new TimeWindowResolver(properties, Clock.fixed(Instant.parse(now), ZoneOffset.UTC));
    }

    // ===== Rolling windows =====

    @Test
    void fiveHourWindowIsAlwaysRolling() {
        TimeWindowResolver resolver = resolver(SHANGHAI, "2024-01-15T02:00:00Z");

        TimeRange range = resolver.resolve(QuotaWindow.FIVE_HOURS, "08:00", ResetMode.FIXED);

        assertEquals(Instant.parse("2024-01-14T21:00:00Z"), range.startTime());
        assertEquals(Instant.parse("2024-01-15T02:00:00Z"), range.endTime());
        assertEquals(Duration.ofHours(5).toSeconds(), resolver.ttlSeconds(QuotaWindow.FIVE_HOURS));
    }

    @Test
    void rollingDailyWindowCoversTrailing24Hours() {
        TimeWindowResolver resolver = resolver(SHANGHAI, "2024-01-15T02:00:00Z");

        TimeRange range = resolver.resolve(QuotaWindow.DAILY, "08:00", ResetMode.ROLLING);

        assertEquals(Instant.parse("2024-01-14T02:00:00Z"), range.startTime());
        assertEquals(Instant.parse("2024-01-15T02:00:00Z"), range.endTime());
        assertEquals(86_400, resolver.ttlSeconds(QuotaWindow.DAILY, "08:00", ResetMode.ROLLING));
    }

    // ===== Fixed daily =====

    @Test
    void fixedDailyStartsAtTodaysResetWhenAlreadyPassed() {
        TimeWindowResolver resolver = resolver(SHANGHAI, "2024-01-15T02:00:00Z");

        TimeRange range = resolver.resolve(QuotaWindow.DAILY, "08:00", ResetMode.FIXED);

        assertEquals(Instant.parse("2024-01-15T00:00:00Z"), range.startTime());
        assertEquals(22 * 3600, resolver.ttlSeconds(QuotaWindow.DAILY, "08:00", ResetMode.FIXED));
    }

    @Test
    void fixedDailyStartsAtYesterdaysResetBeforeTodaysResetTime() {
        TimeWindowResolver resolver = resolver(SHANGHAI, "2024-01-14T23:30:00Z");

        TimeRange range = resolver.resolve(QuotaWindow.DAILY, "08:00", ResetMode.FIXED);

        assertEquals(Instant.parse("2024-01-14T00:00:00Z"), range.startTime());
        assertEquals(1800, resolver.ttlSeconds(QuotaWindow.DAILY, "08:00", ResetMode.FIXED));
    }

    @Test
    void fixedDailyUsesYesterdaysEveningResetInTheMorning() {
        TimeWindowResolver resolver = resolver(SHANGHAI, "2026-01-02T09:00:00Z");

        TimeRange range = resolver.resolve(QuotaWindow.DAILY, "18:00", ResetMode.FIXED);

        assertEquals(Instant.parse("2026-01-01T10:00:00Z"), range.startTime());
        assertEquals(Instant.parse("2026-01-02T09:00:00Z"), range.endTime());
        assertEquals(3600, resolver.ttlSeconds(QuotaWindow.DAILY, "18:00", ResetMode.FIXED));
    }

    @Test
    void fixedDailyAtExactResetTimeStartsNewWindow() {
        TimeWindowResolver resolver = resolver(SHANGHAI, "2024-01-15T00:00:00Z");

        TimeRange range = resolver.resolve(QuotaWindow.DAILY, "08:00", ResetMode.FIXED);

        assertEquals(Instant.parse("2024-01-15T00:00:00Z"), range.startTime());
        assertEquals(86_400, resolver.ttlSeconds(QuotaWindow.DAILY, "08:00", ResetMode.FIXED));
    }

    @Test
    void fixedDailyFollowsLocalResetTimeInNewYork() {
        TimeWindowResolver resolver = resolver(NEW_YORK, "2024-01-15T14:00:00Z");

        TimeRange range = resolver.resolve(QuotaWindow.DAILY, "08:00", ResetMode.FIXED);

        assertEquals(Instant.parse("2024-01-15T13:00:00Z"), range.startTime());
    }

    @Test
    void fixedDailyTtlAccountsForDaylightSavingTransition() {
        // 2024-03-10 is 23 hours long in New York
        TimeWindowResolver resolver = resolver(NEW_YORK, "2024-03-09T14:00:00Z");

        assertEquals(22 * 3600, resolver.ttlSeconds(QuotaWindow.DAILY, "08:00", ResetMode.FIXED));
    }

    @Test
    void fixedDailyStartAfterDaylightSavingTransitionUsesNewOffset() {
        TimeWindowResolver resolver = resolver(NEW_YORK, "2024-03-10T14:00:00Z");

        TimeRange range = resolver.resolve(QuotaWindow.DAILY, "08:00", ResetMode.FIXED);

        assertEquals(Instant.parse("2024-03-10T12:00:00Z"), range.startTime());
    }

    @Test
    void fixedDailyWithInvalidResetTimeFallsBackToMidnight() {
        TimeWindowResolver resolver = resolver("UTC", "2024-01-15T10:00:00Z");

        TimeRange range = resolver.resolve(QuotaWindow.DAILY, "abc", ResetMode.FIXED);

        assertEquals(Instant.parse("2024-01-15T00:00:00Z"), range.startTime());
    }

    // ===== Natural windows =====

    @Test
    void weeklyWindowStartsOnMondayInZone() {
        TimeWindowResolver resolver = resolver(SHANGHAI, "2024-01-17T00:00:00Z");

        TimeRange range = resolver.resolve(QuotaWindow.WEEKLY);

        assertEquals(Instant.parse("2024-01-14T16:00:00Z"), range.startTime());
        assertEquals(112 * 3600, resolver.ttlSeconds(QuotaWindow.WEEKLY));
    }

    @Test
    void monthlyWindowStartsOnFirstDayInZone() {
        TimeWindowResolver resolver = resolver(SHANGHAI, "2024-01-30T00:00:00Z");

        TimeRange range = resolver.resolve(QuotaWindow.MONTHLY);

        assertEquals(Instant.parse("2023-12-31T16:00:00Z"), range.startTime());
        assertEquals(40 * 3600, resolver.ttlSeconds(QuotaWindow.MONTHLY));
    }

    // ===== Reset info =====

    @Test
    void resetInfoIsRollingForFiveHours() {
        ResetInfo info = resolver("UTC", "2024-01-15T10:00:00Z")
                .resetInfo(QuotaWindow.FIVE_HOURS, null, ResetMode.FIXED);

        assertEquals(ResetInfo.ResetType.ROLLING, info.getType());
        assertEquals("5 hours", info.getPeriod());
        assertNull(info.getResetAt());
    }

    @Test
    void resetInfoIsCustomForFixedDaily() {
        ResetInfo info = resolver(SHANGHAI, "2026-01-02T09:00:00Z")
                .resetInfo(QuotaWindow.DAILY, "18:00", ResetMode.FIXED);

        assertEquals(ResetInfo.ResetType.CUSTOM, info.getType());
        assertEquals(Instant.parse("2026-01-02T10:00:00Z"), info.getResetAt());
    }

    @Test
    void resetInfoIsRollingForRollingDaily() {
        ResetInfo info = resolver("UTC", "2024-01-15T10:00:00Z")
                .resetInfo(QuotaWindow.DAILY, "18:00", ResetMode.ROLLING);

        assertEquals(ResetInfo.ResetType.ROLLING, info.getType());
        assertEquals("24 hours", info.getPeriod());
    }

    @Test
    void resetInfoIsNaturalForWeeklyAndMonthly() {
        TimeWindowResolver resolver = resolver(SHANGHAI, "2024-01-17T00:00:00Z");

        ResetInfo weekly = resolver.resetInfo(QuotaWindow.WEEKLY, null, ResetMode.FIXED);
        ResetInfo monthly = resolver.resetInfo(QuotaWindow.MONTHLY, null, ResetMode.FIXED);

        assertEquals(ResetInfo.ResetType.NATURAL, weekly.getType());
        assertEquals(Instant.parse("2024-01-21T16:00:00Z"), weekly.getResetAt());
        assertEquals(ResetInfo.ResetType.NATURAL, monthly.getType());
        assertEquals(Instant.parse("2024-01-31T16:00:00Z"), monthly.getResetAt());
    }

    // ===== Midnight =====

    @Test
    void secondsUntilMidnightIsFullDayAtMidnight() {
        assertEquals(86_400, resolver("UTC", "2024-01-15T00:00:00Z").secondsUntilMidnight());
    }

    @Test
    void secondsUntilMidnightRoundsUp() {
        assertEquals(31, resolver("UTC", "2024-01-15T23:59:29.500Z").secondsUntilMidnight());
    }

    @Test
    void nextMidnightUsesConfiguredZone() {
        Instant next = resolver(SHANGHAI, "2024-01-15T02:00:00Z").nextMidnight();

        assertEquals(Instant.parse("2024-01-15T16:00:00Z"), next);
    }

    // ===== Date ranges =====

    @Test
    void dateRangeIncludesWholeEndDay() {
        TimeRange range = resolver("UTC", "2024-02-10T00:00:00Z")
                .dateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), range.startTime());
        assertEquals(Instant.parse("2024-02-01T00:00:00Z"), range.endTime());
    }

    @Test
    void dateRangeUsesConfiguredZone() {
        TimeRange range = resolver(SHANGHAI, "2024-02-10T00:00:00Z")
                .dateRange(LocalDate.of(2024, 1, 15), LocalDate.of(2024, 1, 15));

        assertEquals(Instant.parse("2024-01-14T16:00:00Z"), range.startTime());
        assertEquals(Instant.parse("2024-01-15T16:00:00Z"), range.endTime());
    }

    // ===== Configuration =====

    @Test
    void unknownTimezoneFallsBackToUtc() {
        assertEquals(ZoneOffset.UTC, resolver("Mars/Olympus", "2024-01-15T00:00:00Z").getZone());
    }

    @Test
    void normalizesResetTime() {
        assertEquals("00:00", TimeWindowResolver.normalizeResetTime("abc"));
        assertEquals("00:00", TimeWindowResolver.normalizeResetTime(null));
        assertEquals("00:10", TimeWindowResolver.normalizeResetTime("99:10"));
        assertEquals("12:00", TimeWindowResolver.normalizeResetTime("12:70"));
        assertEquals("08:05", TimeWindowResolver.normalizeResetTime("8:5"));
        assertEquals("18:30", TimeWindowResolver.normalizeResetTime("18:30"));
    }
}
