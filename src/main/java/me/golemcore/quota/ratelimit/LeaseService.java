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

import me.golemcore.quota.domain.model.AdmissionOutcome;
import me.golemcore.quota.domain.model.BudgetLease;
import me.golemcore.quota.domain.model.LeaseDecrementResult;
import me.golemcore.quota.domain.model.QuotaEntityType;
import me.golemcore.quota.domain.model.QuotaSettings;
import me.golemcore.quota.domain.model.QuotaWindow;
import me.golemcore.quota.domain.model.ResetMode;
import me.golemcore.quota.domain.model.TimeRange;
import me.golemcore.quota.port.outbound.CostAggregatorPort;
import me.golemcore.quota.port.outbound.QuotaCacheException;
import me.golemcore.quota.port.outbound.QuotaCachePort;
import me.golemcore.quota.port.outbound.QuotaSettingsPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Lease-based budget slicer.
 *
 * <p>
 * Instead of reading a running counter on every request, each entity and
 * window gets a small slice of its remaining budget, snapshotted from the cost
 * ledger and stored in the cache as JSON under
 * {@code lease:{entityType}:{entityId}:{window}}. Requests spend the slice
 * through an atomic decrement; the lease is rebuilt from the database when it
 * expires ({@code refreshIntervalSeconds}) or the configured limit changes.
 *
 * <p>
 * Without the cache the lease is computed from the ledger on every call, so an
 * exhausted budget still denies. A ledger failure degrades to fail-open (an
 * empty lease), as does a cache failure during a decrement
 * ({@link LeaseDecrementResult.Status#FAIL_OPEN}).
 *
 * @see LeaseCalculator
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LeaseService {

    private final QuotaCachePort cache;
    private final CostAggregatorPort costAggregator;
    private final QuotaSettingsPort settingsPort;
    private final TimeWindowResolver windowResolver;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Return the cached lease when it is still fresh and was computed for the
     * same limit, otherwise rebuild it from the database. Empty means the ledger
     * could not be read and the caller should fail open.
     */
    public Optional<BudgetLease> getCostLease(QuotaEntityType entityType, long entityId, QuotaWindow window,
            double limitAmount, String resetTime, ResetMode resetMode) {
        String key = QuotaKeys.lease(entityType, entityId, window);
        if (!cache.isAvailable()) {
            log.warn("[LeaseService] Cache unavailable, computing lease {} from the database", key);
            return refreshFromDb(entityType, entityId, window, limitAmount, resetTime, resetMode);
        }

        try {
            Optional<String> cached = cache.get(key);
            if (cached.isPresent()) {
                Optional<BudgetLease> lease = parseLease(key, cached.get());
                if (lease.isPresent() && isUsable(lease.get(), limitAmount)) {
                    log.debug("[LeaseService] Lease hit {}: remaining={}", key, lease.get().getRemainingBudget());
                    return lease;
                }
                log.debug("[LeaseService] Lease {} is stale, refreshing", key);
            }
        } catch (QuotaCacheException e) {
            log.warn("[LeaseService] Failed to read lease {}, computing from the database: {}", key,
                    e.getMessage());
        }
        return refreshFromDb(entityType, entityId, window, limitAmount, resetTime, resetMode);
    }

    /**
     * Build a new lease from the cost ledger and store it with the refresh
     * interval as its expiry. The lease is returned even when it cannot be
     * cached; only a ledger failure yields an empty result.
     */
    public Optional<BudgetLease> refreshFromDb(QuotaEntityType entityType, long entityId, QuotaWindow window,
            double limitAmount, String resetTime, ResetMode resetMode) {
        String key = QuotaKeys.lease(entityType, entityId, window);
        try {
            QuotaSettings settings = settingsPort.getQuotaSettings();
            long ttlSeconds = settings.getRefreshIntervalSeconds() > 0
                    ? settings.getRefreshIntervalSeconds()
                    : QuotaSettings.DEFAULT_REFRESH_INTERVAL_SECONDS;
            double percent = settings.leasePercentFor(window);

            TimeRange range = windowResolver.resolve(window, resetTime, resetMode);
            double currentUsage = costAggregator.sumCost(entityType, entityId, range.startTime(), range.endTime());
            double remainingBudget = LeaseCalculator.calculateLeaseSlice(limitAmount, currentUsage, percent,
                    settings.getLeaseCapUsd());

            BudgetLease lease = BudgetLease.builder()
                    .entityType(entityType)
                    .entityId(entityId)
                    .window(window)
                    .resetMode(resetMode)
                    .resetTime(resetTime)
                    .snapshotAtMs(clock.millis())
                    .currentUsage(currentUsage)
                    .limitAmount(limitAmount)
                    .remainingBudget(remainingBudget)
                    .ttlSeconds(ttlSeconds)
                    .build();

            storeLease(key, lease);
            log.info("[LeaseService] Refreshed lease {}: usage={}, limit={}, slice={}, ttl={}s", key, currentUsage,
                    limitAmount, remainingBudget, ttlSeconds);
            return Optional.of(lease);
        } catch (Exception e) { // NOSONAR
            log.error("[LeaseService] Failed to refresh lease {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Atomically spend {@code cost} from the cached lease, keeping its expiry.
     */
    public LeaseDecrementResult decrementLeaseBudget(QuotaEntityType entityType, long entityId,
            QuotaWindow window, double cost) {
        if (!cache.isAvailable()) {
            return LeaseDecrementResult.failOpen();
        }

        String key = QuotaKeys.lease(entityType, entityId, window);
        try {
            QuotaCachePort.DecrementReply reply = cache.decrementLease(key, cost);
            if (!reply.found()) {
                log.debug("[LeaseService] No lease {} to decrement", key);
                return LeaseDecrementResult.notFound();
            }
            if (!reply.success()) {
                log.debug("[LeaseService] Lease {} cannot cover cost {}", key, cost);
                return LeaseDecrementResult.insufficient();
            }
            log.debug("[LeaseService] Decremented lease {} by {}: remaining={}", key, cost, reply.newRemaining());
            return LeaseDecrementResult.decremented(reply.newRemaining());
        } catch (QuotaCacheException e) {
            log.error("[LeaseService] Failed to decrement lease {}: {}", key, e.getMessage());
            return LeaseDecrementResult.failOpen();
        }
    }

    /**
     * Admission check backed by the lease: an exhausted slice denies, a missing
     * lease fails open.
     */
    public AdmissionOutcome checkCostLease(QuotaEntityType entityType, long entityId, QuotaWindow window,
            double limitAmount, String resetTime, ResetMode resetMode) {
        if (limitAmount <= 0) {
            return AdmissionOutcome.allowed();
        }
        Optional<BudgetLease> lease = getCostLease(entityType, entityId, window, limitAmount, resetTime, resetMode);
        if (lease.isEmpty()) {
            return AdmissionOutcome.unknown();
        }
        BudgetLease current = lease.get();
        if (current.getRemainingBudget() <= 0) {
            return AdmissionOutcome.denied(
                    QuotaMessages.spendLimitReached(entityType, window, current.getCurrentUsage(), limitAmount),
                    current.getCurrentUsage(), limitAmount);
        }
        return AdmissionOutcome.allowed(current.getCurrentUsage());
    }

    private boolean isUsable(BudgetLease lease, double limitAmount) {
        return !lease.isExpired(clock.millis()) && Double.compare(lease.getLimitAmount(), limitAmount) == 0;
    }

    private void storeLease(String key, BudgetLease lease) throws JsonProcessingException {
        if (!cache.isAvailable()) {
            return;
        }
        String json = objectMapper.writeValueAsString(lease);
        try {
            cache.set(key, json, lease.getTtlSeconds());
        } catch (QuotaCacheException e) {
            log.warn("[LeaseService] Failed to cache lease {}: {}", key, e.getMessage());
        }
    }

    private Optional<BudgetLease> parseLease(String key, String json) {
        try {
            return Optional.of(objectMapper.readValue(json, BudgetLease.class));
        } catch (JsonProcessingException e) {
            log.warn("[LeaseService] Unreadable lease {}, rebuilding: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
