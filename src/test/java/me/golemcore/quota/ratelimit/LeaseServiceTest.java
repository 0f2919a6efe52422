package me.golemcore.quota.ratelimit;

import me.golemcore.quota.domain.model.AdmissionOutcome;
import me.golemcore.quota.domain.model.BudgetLease;
import me.golemcore.quota.domain.model.LeaseDecrementResult;
import me.golemcore.quota.domain.model.QuotaEntityType;
import me.golemcore.quota.domain.model.QuotaSettings;
import me.golemcore.quota.domain.model.QuotaWindow;
import me.golemcore.quota.domain.model.ResetMode;
import me.golemcore.quota.infrastructure.config.QuotaAutoConfiguration;
import me.golemcore.quota.infrastructure.config.QuotaProperties;
import me.golemcore.quota.port.outbound.CostAggregatorPort;
import me.golemcore.quota.port.outbound.QuotaCacheException;
import me.golemcore.quota.port.outbound.QuotaCachePort;
import me.golemcore.quota.port.outbound.QuotaSettingsPort;
import me.golemcore.quota.testsupport.InMemoryQuotaCache;
import me.golemcore.quota.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LeaseServiceTest {

    private static final Instant FIXED_NOW = Instant.parse("2024-01-17T12:00:00Z");
    private static final long KEY_ID = 42L;
    private static final String LEASE_KEY = "lease:key:42:weekly";

    private MutableClock clock;
    private InMemoryQuotaCache cache;
    private CostAggregatorPort costAggregator;
    private QuotaSettingsPort settingsPort;
    private LeaseService leaseService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(FIXED_NOW);
        cache = new InMemoryQuotaCache(clock);
        costAggregator = mock(CostAggregatorPort.class);
        settingsPort = mock(QuotaSettingsPort.class);
        when(settingsPort.getQuotaSettings()).thenReturn(QuotaSettings.builder()
                .refreshIntervalSeconds(10)
                .leasePercentByWindow(Map.of(QuotaWindow.WEEKLY, 0.05))
                .build());
        when(costAggregator.sumCost(eq(QuotaEntityType.KEY), eq(KEY_ID), any(), any())).thenReturn(10.0);

        leaseService = newService(cache);
    }

    private LeaseService newService(QuotaCachePort cachePort) {
        TimeWindowResolver resolver = new TimeWindowResolver(new QuotaProperties(), clock);
        return new LeaseService(cachePort, costAggregator, settingsPort, resolver,
                QuotaAutoConfiguration.objectMapper(), clock);
    }

    private Optional<BudgetLease> weeklyLease(double limit) {
        return leaseService.getCostLease(QuotaEntityType.KEY, KEY_ID, QuotaWindow.WEEKLY, limit, null,
                ResetMode.FIXED);
    }

    private static QuotaCachePort failingCache() {
        return mock(QuotaCachePort.class, invocation -> {
            if ("isAvailable".equals(invocation.getMethod().getName())) {
                return true;
            }
            throw new QuotaCacheException("connection refused");
        });
    }

    // ===== Lease creation =====

    @Test
    void shouldCreateLeaseFromDatabaseOnMiss() {
        BudgetLease lease = weeklyLease(100).orElseThrow();

        assertEquals(5.0, lease.getRemainingBudget(), 1e-9);
        assertEquals(10.0, lease.getCurrentUsage(), 1e-9);
        assertEquals(100.0, lease.getLimitAmount(), 1e-9);
        assertEquals(FIXED_NOW.toEpochMilli(), lease.getSnapshotAtMs());
        assertEquals(10, lease.getTtlSeconds());
        assertTrue(cache.get(LEASE_KEY).isPresent());
        assertEquals(10, cache.ttl(LEASE_KEY));
    }

    @Test
    void shouldQueryLedgerFromStartOfWeek() {
        weeklyLease(100);

        verify(costAggregator).sumCost(QuotaEntityType.KEY, KEY_ID, Instant.parse("2024-01-15T00:00:00Z"),
                FIXED_NOW);
    }

    @Test
    void shouldReuseLeaseWithinRefreshInterval() {
        BudgetLease first = weeklyLease(100).orElseThrow();
        clock.advance(Duration.ofSeconds(9));
        BudgetLease second = weeklyLease(100).orElseThrow();

        assertEquals(first, second);
        verify(costAggregator, times(1)).sumCost(any(), anyLong(), any(), any());
    }

    @Test
    void shouldRefreshExpiredLease() {
        weeklyLease(100);
        clock.advance(Duration.ofSeconds(10));
        when(costAggregator.sumCost(eq(QuotaEntityType.KEY), eq(KEY_ID), any(), any())).thenReturn(99.0);

        BudgetLease lease = weeklyLease(100).orElseThrow();

        assertEquals(1.0, lease.getRemainingBudget(), 1e-9);
        verify(costAggregator, times(2)).sumCost(any(), anyLong(), any(), any());
    }

    @Test
    void shouldRefreshWhenLimitChanges() {
        weeklyLease(100);

        BudgetLease lease = weeklyLease(200).orElseThrow();

        assertEquals(200.0, lease.getLimitAmount(), 1e-9);
        assertEquals(10.0, lease.getRemainingBudget(), 1e-9);
        verify(costAggregator, times(2)).sumCost(any(), anyLong(), any(), any());
    }

    @Test
    void shouldRebuildUnreadableLease() {
        cache.set(LEASE_KEY, "{not json", 10);

        BudgetLease lease = weeklyLease(100).orElseThrow();

        assertEquals(5.0, lease.getRemainingBudget(), 1e-9);
    }

    @Test
    void shouldUseDefaultRefreshIntervalWhenSettingIsInvalid() {
        when(settingsPort.getQuotaSettings()).thenReturn(QuotaSettings.builder().refreshIntervalSeconds(0).build());

        BudgetLease lease = weeklyLease(100).orElseThrow();

        assertEquals(QuotaSettings.DEFAULT_REFRESH_INTERVAL_SECONDS, lease.getTtlSeconds());
        assertEquals(5.0, lease.getRemainingBudget(), 1e-9);
    }

    @Test
    void shouldApplyCapFromSettings() {
        when(settingsPort.getQuotaSettings()).thenReturn(QuotaSettings.builder()
                .refreshIntervalSeconds(10)
                .leaseCapUsd(0.5)
                .build());

        BudgetLease lease = weeklyLease(100).orElseThrow();

        assertEquals(0.5, lease.getRemainingBudget(), 1e-9);
    }

    @Test
    void shouldReplaceCachedLeaseOnExplicitRefresh() {
        weeklyLease(100.0);
        when(costAggregator.sumCost(eq(QuotaEntityType.KEY), eq(KEY_ID), any(), any())).thenReturn(98.0);

        Optional<BudgetLease> refreshed = leaseService.refreshFromDb(QuotaEntityType.KEY, KEY_ID,
                QuotaWindow.WEEKLY, 100.0, null, ResetMode.FIXED);

        assertTrue(refreshed.isPresent());
        assertEquals(2.0, refreshed.get().getRemainingBudget(), 1e-9);
        assertEquals(2.0, weeklyLease(100.0).orElseThrow().getRemainingBudget(), 1e-9);
    }

    @Test
    void shouldResolveFixedDailyRangeFromResetTime() {
        Optional<BudgetLease> lease = leaseService.refreshFromDb(QuotaEntityType.KEY, KEY_ID, QuotaWindow.DAILY,
                100.0, "18:00", ResetMode.FIXED);

        assertEquals("18:00", lease.orElseThrow().getResetTime());
        assertTrue(cache.exists("lease:key:42:daily"));
        verify(costAggregator).sumCost(QuotaEntityType.KEY, KEY_ID, Instant.parse("2024-01-16T18:00:00Z"),
                FIXED_NOW);
    }

    // ===== Decrement =====

    @Test
    void shouldDecrementLease() {
        weeklyLease(100);

        LeaseDecrementResult result = leaseService.decrementLeaseBudget(QuotaEntityType.KEY, KEY_ID,
                QuotaWindow.WEEKLY, 2.0);

        assertEquals(LeaseDecrementResult.Status.DECREMENTED, result.getStatus());
        assertTrue(result.isSuccess());
        assertEquals(3.0, result.getNewRemaining(), 1e-9);
        assertEquals(3.0, weeklyLease(100).orElseThrow().getRemainingBudget(), 1e-9);
    }

    @Test
    void shouldRejectDecrementLargerThanRemaining() {
        weeklyLease(100);

        LeaseDecrementResult result = leaseService.decrementLeaseBudget(QuotaEntityType.KEY, KEY_ID,
                QuotaWindow.WEEKLY, 6.0);

        assertEquals(LeaseDecrementResult.Status.INSUFFICIENT, result.getStatus());
        assertFalse(result.isSuccess());
        assertEquals(0.0, result.getNewRemaining(), 1e-9);
        assertEquals(5.0, weeklyLease(100).orElseThrow().getRemainingBudget(), 1e-9);
    }

    @Test
    void shouldReportMissingLease() {
        LeaseDecrementResult result = leaseService.decrementLeaseBudget(QuotaEntityType.KEY, KEY_ID,
                QuotaWindow.WEEKLY, 1.0);

        assertEquals(LeaseDecrementResult.Status.NOT_FOUND, result.getStatus());
        assertEquals(-1.0, result.getNewRemaining(), 1e-9);
        assertEquals(AdmissionOutcome.Status.UNKNOWN, result.toOutcomeStatus());
    }

    @Test
    void shouldKeepLeaseExpiryOnDecrement() {
        weeklyLease(100);
        clock.advance(Duration.ofSeconds(4));

        leaseService.decrementLeaseBudget(QuotaEntityType.KEY, KEY_ID, QuotaWindow.WEEKLY, 1.0);

        assertEquals(6, cache.ttl(LEASE_KEY));
    }

    @Test
    void shouldNeverOverspendUnderConcurrentDecrements() throws Exception {
        weeklyLease(100);
        int threads = 20;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<LeaseDecrementResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return leaseService.decrementLeaseBudget(QuotaEntityType.KEY, KEY_ID, QuotaWindow.WEEKLY, 0.5);
                }));
            }
            start.countDown();

            int decremented = 0;
            for (Future<LeaseDecrementResult> future : futures) {
                if (future.get(5, TimeUnit.SECONDS).getStatus() == LeaseDecrementResult.Status.DECREMENTED) {
                    decremented++;
                }
            }
            assertEquals(10, decremented);
            assertEquals(0.0, weeklyLease(100).orElseThrow().getRemainingBudget(), 1e-9);
        } finally {
            executor.shutdownNow();
        }
    }

    // ===== Fail open =====

    @Test
    void shouldComputeLeaseFromDatabaseWhenCacheUnavailable() {
        cache.setAvailable(false);

        BudgetLease lease = weeklyLease(100).orElseThrow();

        assertEquals(5.0, lease.getRemainingBudget(), 1e-9);
        assertEquals(10.0, lease.getCurrentUsage(), 1e-9);
        cache.setAvailable(true);
        assertFalse(cache.exists(LEASE_KEY));
    }

    @Test
    void shouldFailOpenDecrementWhenCacheUnavailable() {
        cache.setAvailable(false);

        LeaseDecrementResult result = leaseService.decrementLeaseBudget(QuotaEntityType.KEY, KEY_ID,
                QuotaWindow.WEEKLY, 1.0);

        assertEquals(LeaseDecrementResult.Status.FAIL_OPEN, result.getStatus());
        assertTrue(result.isSuccess());
        assertTrue(result.isFailOpen());
    }

    @Test
    void shouldComputeLeaseFromDatabaseWhenCacheThrows() {
        leaseService = newService(failingCache());

        assertEquals(5.0, weeklyLease(100).orElseThrow().getRemainingBudget(), 1e-9);
        assertEquals(LeaseDecrementResult.Status.FAIL_OPEN,
                leaseService.decrementLeaseBudget(QuotaEntityType.KEY, KEY_ID, QuotaWindow.WEEKLY, 1.0)
                        .getStatus());
    }

    @Test
    void shouldFailOpenWhenLedgerThrows() {
        when(costAggregator.sumCost(any(), anyLong(), any(), any())).thenThrow(new IllegalStateException("db down"));

        assertTrue(weeklyLease(100).isEmpty());
        assertFalse(cache.exists(LEASE_KEY));
    }

    // ===== Admission =====

    @Test
    void shouldAllowWhileLeaseHasBudget() {
        AdmissionOutcome outcome = leaseService.checkCostLease(QuotaEntityType.KEY, KEY_ID, QuotaWindow.WEEKLY, 100,
                null, ResetMode.FIXED);

        assertEquals(AdmissionOutcome.Status.ALLOWED, outcome.getStatus());
        assertEquals(10.0, outcome.getCurrent().doubleValue(), 1e-9);
    }

    @Test
    void shouldDenyWhenLimitExhausted() {
        when(costAggregator.sumCost(eq(QuotaEntityType.KEY), eq(KEY_ID), any(), any())).thenReturn(12.34);

        AdmissionOutcome outcome = leaseService.checkCostLease(QuotaEntityType.KEY, KEY_ID, QuotaWindow.WEEKLY, 10,
                null, ResetMode.FIXED);

        assertEquals(AdmissionOutcome.Status.DENIED, outcome.getStatus());
        assertFalse(outcome.isAllowed());
        assertEquals("Key weekly spend limit reached (12.3400/10.0)", outcome.getReason());
    }

    @Test
    void shouldDenyFromLedgerWhenCacheUnavailable() {
        cache.setAvailable(false);
        when(costAggregator.sumCost(eq(QuotaEntityType.KEY), eq(KEY_ID), any(), any())).thenReturn(150.0);

        AdmissionOutcome outcome = leaseService.checkCostLease(QuotaEntityType.KEY, KEY_ID, QuotaWindow.WEEKLY, 100,
                null, ResetMode.FIXED);

        assertEquals(AdmissionOutcome.Status.DENIED, outcome.getStatus());
        assertEquals("Key weekly spend limit reached (150.0000/100.0)", outcome.getReason());
    }

    @Test
    void shouldDenyFromLedgerWhenCacheThrows() {
        leaseService = newService(failingCache());
        when(costAggregator.sumCost(eq(QuotaEntityType.KEY), eq(KEY_ID), any(), any())).thenReturn(100.0);

        AdmissionOutcome outcome = leaseService.checkCostLease(QuotaEntityType.KEY, KEY_ID, QuotaWindow.WEEKLY, 100,
                null, ResetMode.FIXED);

        assertEquals(AdmissionOutcome.Status.DENIED, outcome.getStatus());
    }

    @Test
    void shouldReportUnknownWhenLeaseUnavailable() {
        cache.setAvailable(false);
        when(costAggregator.sumCost(any(), anyLong(), any(), any())).thenThrow(new IllegalStateException("db down"));

        AdmissionOutcome outcome = leaseService.checkCostLease(QuotaEntityType.KEY, KEY_ID, QuotaWindow.WEEKLY, 10,
                null, ResetMode.FIXED);

        assertEquals(AdmissionOutcome.Status.UNKNOWN, outcome.getStatus());
        assertTrue(outcome.isAllowed());
    }

    @Test
    void shouldAllowWithoutLimit() {
        AdmissionOutcome outcome = leaseService.checkCostLease(QuotaEntityType.KEY, KEY_ID, QuotaWindow.WEEKLY, 0,
                null, ResetMode.FIXED);

        assertEquals(AdmissionOutcome.Status.ALLOWED, outcome.getStatus());
        verifyNoInteractions(costAggregator);
    }
}
