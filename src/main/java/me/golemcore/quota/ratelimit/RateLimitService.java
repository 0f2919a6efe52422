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
import me.golemcore.quota.domain.model.CostLimits;
import me.golemcore.quota.domain.model.QuotaEntityType;
import me.golemcore.quota.domain.model.QuotaWindow;
import me.golemcore.quota.domain.model.SessionAdmission;
import me.golemcore.quota.domain.model.TimeRange;
import me.golemcore.quota.infrastructure.config.QuotaProperties;
import me.golemcore.quota.port.outbound.CostAggregatorPort;
import me.golemcore.quota.port.outbound.QuotaCacheException;
import me.golemcore.quota.port.outbound.QuotaCachePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Counter-based cost tracker and the entry point for request admission.
 *
 * <p>
 * Spend is kept in the shared cache per entity:
 * <ul>
 * <li><b>5h</b> - rolling set of timestamped samples
 * ({@code {type}:{id}:cost_5h_rolling})</li>
 * <li><b>weekly / monthly</b> - scalar counters whose expiry is aligned to the
 * natural window boundary ({@code {type}:{id}:cost_weekly})</li>
 * <li><b>user daily</b> - scalar reset at local midnight
 * ({@code user:{id}:daily_cost}, deduplicated through
 * {@code user:{id}:daily_cost_samples})</li>
 * </ul>
 *
 * <p>
 * The database stays authoritative. A missing counter, an unavailable cache or
 * a cache error sends the check to the cost ledger, which also warms the cache.
 * A failing ledger fails open: the outcome is
 * {@link AdmissionOutcome.Status#UNKNOWN} and the request proceeds.
 *
 * <p>
 * Writes ({@code track*}) run on the {@link CostTrackingDispatcher} and never
 * fail the caller.
 *
 * @since 1.0
 * @see TimeWindowResolver
 * @see SessionTracker
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitService {

    private final QuotaCachePort cache;
    private final CostAggregatorPort costAggregator;
    private final TimeWindowResolver windowResolver;
    private final SessionTracker sessionTracker;
    private final CostTrackingDispatcher trackingDispatcher;
    private final QuotaProperties properties;
    private final Clock clock;

    // ==================== COST LIMITS ====================

    /**
     * Check the configured 5h, weekly and monthly limits in that order. The
     * first window whose spend has reached its limit denies.
     */
    public AdmissionOutcome checkCostLimits(QuotaEntityType entityType, long entityId, CostLimits limits) {
        List<CostLimits.Limit> configured = limits != null ? limits.configured() : List.of();
        if (configured.isEmpty()) {
            return AdmissionOutcome.allowed();
        }
        if (!cache.isAvailable()) {
            log.warn("[RateLimit] Cache unavailable, checking {}:{} cost limits against the database",
                    entityType.getCode(), entityId);
            return checkFromDatabase(entityType, entityId, configured);
        }

        try {
            for (CostLimits.Limit limit : configured) {
                Optional<Double> current = readCachedCost(entityType, entityId, limit.window());
                if (current.isEmpty()) {
                    log.info("[RateLimit] Cache miss for {}:{} {}, querying database", entityType.getCode(),
                            entityId, limit.window().getCode());
                    return checkFromDatabase(entityType, entityId, configured);
                }
                if (current.get() >= limit.amount()) {
                    return deny(entityType, limit, current.get());
                }
            }
            return AdmissionOutcome.allowed();
        } catch (QuotaCacheException e) {
            log.warn("[RateLimit] Cache check failed for {}:{}, falling back to database: {}",
                    entityType.getCode(), entityId, e.getMessage());
            return checkFromDatabase(entityType, entityId, configured);
        }
    }

    /**
     * Check the limits against the cost ledger and warm the cache with what was
     * read.
     */
    public AdmissionOutcome checkFromDatabase(QuotaEntityType entityType, long entityId, CostLimits limits) {
        List<CostLimits.Limit> configured = limits != null ? limits.configured() : List.of();
        if (configured.isEmpty()) {
            return AdmissionOutcome.allowed();
        }
        return checkFromDatabase(entityType, entityId, configured);
    }

    private AdmissionOutcome checkFromDatabase(QuotaEntityType entityType, long entityId,
            List<CostLimits.Limit> configured) {
        try {
            for (CostLimits.Limit limit : configured) {
                double current = sumFromDatabase(entityType, entityId, limit.window());
                warmCostCache(entityType, entityId, limit.window(), current);
                if (current >= limit.amount()) {
                    return deny(entityType, limit, current);
                }
            }
            return AdmissionOutcome.allowed();
        } catch (Exception e) { // NOSONAR
            log.error("[RateLimit] Database cost check failed for {}:{}, failing open: {}", entityType.getCode(),
                    entityId, e.getMessage());
            return AdmissionOutcome.unknown();
        }
    }

    /**
     * Current spend of the entity in the window: cache first, then the ledger.
     * Returns 0 when both fail.
     */
    public double getCurrentCost(QuotaEntityType entityType, long entityId, QuotaWindow window) {
        if (window != QuotaWindow.DAILY && cache.isAvailable()) {
            try {
                Optional<Double> cached = readCachedCost(entityType, entityId, window);
                if (cached.isPresent()) {
                    return cached.get();
                }
                log.info("[RateLimit] Cache miss for {}:{} {}, querying database", entityType.getCode(), entityId,
                        window.getCode());
            } catch (QuotaCacheException e) {
                log.warn("[RateLimit] Cache read failed for {}:{} {}: {}", entityType.getCode(), entityId,
                        window.getCode(), e.getMessage());
            }
        }

        try {
            double current = sumFromDatabase(entityType, entityId, window);
            if (window != QuotaWindow.DAILY) {
                warmCostCache(entityType, entityId, window, current);
            }
            return current;
        } catch (Exception e) { // NOSONAR
            log.error("[RateLimit] Failed to get current cost for {}:{} {}: {}", entityType.getCode(), entityId,
                    window.getCode(), e.getMessage());
            return 0;
        }
    }

    /**
     * Fold a realized request cost into the key and provider counters. The
     * sample member is fixed before the first attempt, so a retry after a lost
     * reply does not count the cost twice. The future never completes
     * exceptionally.
     */
    public CompletableFuture<Void> trackCost(Long keyId, Long providerId, String sessionId, double cost) {
        if (cost <= 0 || (keyId == null && providerId == null)) {
            return CompletableFuture.completedFuture(null);
        }
        long now = clock.millis();
        String member = now + ":" + QuotaMessages.plainAmount(cost) + ":" + nonce(sessionId);
        long rollingTtl = properties.getCost().getRollingFallbackTtlSeconds();
        long weeklyTtl = windowResolver.ttlSeconds(QuotaWindow.WEEKLY);
        long monthlyTtl = windowResolver.ttlSeconds(QuotaWindow.MONTHLY);
        long cutoff = now - QuotaWindow.FIVE_HOURS.getRollingDuration().toMillis();

        return trackingDispatcher.submit("trackCost", () -> {
            if (!cache.isAvailable()) {
                log.debug("[RateLimit] Cache unavailable, cost not tracked (key={}, provider={})", keyId,
                        providerId);
                return;
            }
            if (keyId != null) {
                recordEntityCost(QuotaEntityType.KEY, keyId, cutoff, now, member, cost, rollingTtl, weeklyTtl,
                        monthlyTtl);
            }
            if (providerId != null) {
                recordEntityCost(QuotaEntityType.PROVIDER, providerId, cutoff, now, member, cost, rollingTtl,
                        weeklyTtl, monthlyTtl);
            }
            log.debug("[RateLimit] Tracked cost: key={}, provider={}, cost={}", keyId, providerId, cost);
        });
    }

    private void recordEntityCost(QuotaEntityType entityType, long entityId, long cutoff, long now, String member,
            double cost, long rollingTtl, long weeklyTtl, long monthlyTtl) {
        Map<String, Long> counters = new LinkedHashMap<>();
        counters.put(QuotaKeys.fixedCost(entityType, entityId, QuotaWindow.WEEKLY), weeklyTtl);
        counters.put(QuotaKeys.fixedCost(entityType, entityId, QuotaWindow.MONTHLY), monthlyTtl);
        boolean applied = cache.recordCost(QuotaKeys.rollingCost(entityType, entityId), cutoff, now, member,
                rollingTtl, cost, counters);
        if (!applied) {
            log.debug("[RateLimit] Cost sample {} already recorded for {}:{}", member, entityType.getCode(),
                    entityId);
        }
    }

    // ==================== USER LIMITS ====================

    /**
     * Sliding-window request counter. {@code current} is the number of requests
     * seen in the window before this one.
     */
    public AdmissionOutcome checkUserRPM(long userId, int rpmLimit) {
        if (rpmLimit <= 0) {
            return AdmissionOutcome.allowed();
        }
        if (!cache.isAvailable()) {
            log.warn("[RateLimit] Cache unavailable, skipping RPM check for user {}", userId);
            return AdmissionOutcome.unknown();
        }

        String key = QuotaKeys.userRpm(userId);
        long now = clock.millis();
        long windowMs = properties.getCost().getRpmWindowSeconds() * 1000L;
        try {
            long count = cache.pruneAndCount(key, now - windowMs);
            if (count >= rpmLimit) {
                return AdmissionOutcome.denied(QuotaMessages.rpmLimitReached(count, rpmLimit), count, rpmLimit);
            }
            cache.batch()
                    .zadd(key, now, now + ":" + nonce(null))
                    .expire(key, properties.getCost().getRpmKeyTtlSeconds())
                    .execute();
            return AdmissionOutcome.allowed(count);
        } catch (QuotaCacheException e) {
            log.error("[RateLimit] RPM check failed for user {}: {}", userId, e.getMessage());
            return AdmissionOutcome.unknown();
        }
    }

    public AdmissionOutcome checkUserDailyCost(long userId, double dailyLimit) {
        if (dailyLimit <= 0) {
            return AdmissionOutcome.allowed();
        }

        Optional<Double> cached = readUserDailyCost(userId);
        double current;
        if (cached.isPresent()) {
            current = cached.get();
        } else {
            try {
                current = costAggregator.sumCostToday(userId);
            } catch (Exception e) { // NOSONAR
                log.error("[RateLimit] Daily cost check failed for user {}, failing open: {}", userId,
                        e.getMessage());
                return AdmissionOutcome.unknown();
            }
            warmUserDailyCost(userId, current);
        }

        if (current >= dailyLimit) {
            return AdmissionOutcome.denied(
                    QuotaMessages.spendLimitReached(QuotaEntityType.USER, QuotaWindow.DAILY, current, dailyLimit),
                    current, dailyLimit);
        }
        return AdmissionOutcome.allowed(current);
    }

    public CompletableFuture<Void> trackUserDailyCost(long userId, double cost) {
        if (cost <= 0) {
            return CompletableFuture.completedFuture(null);
        }
        String key = QuotaKeys.userDailyCost(userId);
        String samples = QuotaKeys.userDailyCostSamples(userId);
        long ttl = windowResolver.secondsUntilMidnight();
        long now = clock.millis();
        String member = now + ":" + QuotaMessages.plainAmount(cost) + ":" + nonce(null);
        long dedupeSeconds = properties.getTracking().getDedupeWindowSeconds();
        return trackingDispatcher.submit("trackUserDailyCost", () -> {
            if (!cache.isAvailable()) {
                return;
            }
            boolean applied = cache.recordCost(samples, now - dedupeSeconds * 1000L, now, member, dedupeSeconds,
                    cost, Map.of(key, ttl));
            log.debug("[RateLimit] Tracked user daily cost: user={}, cost={}, applied={}", userId, cost, applied);
        });
    }

    /**
     * Lifetime spend limit, optionally restricted to the last
     * {@code maxAgeDays}. The ledger sum is cached briefly and never
     * incremented.
     */
    public AdmissionOutcome checkTotalCostLimit(QuotaEntityType entityType, long entityId, Double totalLimit,
            Integer maxAgeDays) {
        if (totalLimit == null || totalLimit <= 0) {
            return AdmissionOutcome.allowed();
        }

        String key = QuotaKeys.totalCost(entityType, entityId);
        Optional<Double> cached = Optional.empty();
        if (cache.isAvailable()) {
            try {
                cached = cache.get(key).flatMap(value -> parseAmount(key, value));
            } catch (QuotaCacheException e) {
                log.warn("[RateLimit] Cache read failed for {}: {}", key, e.getMessage());
            }
        }

        double current;
        if (cached.isPresent()) {
            current = cached.get();
        } else {
            try {
                current = costAggregator.sumTotalCost(entityType, entityId, maxAgeDays);
            } catch (Exception e) { // NOSONAR
                log.error("[RateLimit] Total cost check failed for {}:{}, failing open: {}", entityType.getCode(),
                        entityId, e.getMessage());
                return AdmissionOutcome.unknown();
            }
            writeQuietly(key, current, properties.getCost().getTotalCostCacheTtlSeconds());
        }

        if (current >= totalLimit) {
            return AdmissionOutcome.denied(QuotaMessages.totalSpendLimitReached(entityType, current, totalLimit),
                    current, totalLimit);
        }
        return AdmissionOutcome.allowed(current);
    }

    // ==================== SESSIONS ====================

    /**
     * Read-only concurrent-session check for key, user or provider scopes.
     */
    public AdmissionOutcome checkSessionLimit(QuotaEntityType entityType, long entityId, long limit) {
        if (limit <= 0) {
            return AdmissionOutcome.allowed();
        }
        long count = switch (entityType) {
        case KEY -> sessionTracker.getKeySessionCount(entityId);
        case USER -> sessionTracker.getUserSessionCount(entityId);
        case PROVIDER -> sessionTracker.getProviderSessionCount(entityId);
        };
        if (count >= limit) {
            return AdmissionOutcome.denied(QuotaMessages.sessionLimitReached(entityType, count, limit), count, limit);
        }
        return AdmissionOutcome.allowed(count);
    }

    public SessionAdmission checkAndTrackProviderSession(long providerId, String sessionId, long limit) {
        return sessionTracker.checkAndTrackProviderSession(providerId, sessionId, limit);
    }

    // ==================== INTERNALS ====================

    private Optional<Double> readCachedCost(QuotaEntityType entityType, long entityId, QuotaWindow window) {
        if (window == QuotaWindow.FIVE_HOURS) {
            String key = QuotaKeys.rollingCost(entityType, entityId);
            double sum = cache.sumRollingWindow(key, clock.millis(), window.getRollingDuration().toMillis());
            if (sum == 0 && !cache.exists(key)) {
                return Optional.empty();
            }
            return Optional.of(sum);
        }
        String key = QuotaKeys.fixedCost(entityType, entityId, window);
        return cache.get(key).flatMap(value -> parseAmount(key, value));
    }

    private double sumFromDatabase(QuotaEntityType entityType, long entityId, QuotaWindow window) {
        TimeRange range = windowResolver.resolve(window);
        return costAggregator.sumCost(entityType, entityId, range.startTime(), range.endTime());
    }

    /**
     * The rolling window is warmed with the whole ledger sum as one sample at
     * now; its samples' real timestamps are not known.
     */
    private void warmCostCache(QuotaEntityType entityType, long entityId, QuotaWindow window, double amount) {
        if (!cache.isAvailable()) {
            return;
        }
        try {
            if (window == QuotaWindow.FIVE_HOURS) {
                if (amount > 0) {
                    String key = QuotaKeys.rollingCost(entityType, entityId);
                    long now = clock.millis();
                    cache.addRollingSample(key, amount, now, window.getRollingDuration().toMillis(),
                            properties.getCost().getRollingFallbackTtlSeconds());
                    log.info("[RateLimit] Cache warmed for {}, value={} (rolling window)", key, amount);
                }
                return;
            }
            String key = QuotaKeys.fixedCost(entityType, entityId, window);
            long ttl = windowResolver.ttlSeconds(window);
            cache.set(key, QuotaMessages.plainAmount(amount), ttl);
            log.info("[RateLimit] Cache warmed for {}, value={}, ttl={}s", key, amount, ttl);
        } catch (QuotaCacheException e) {
            log.warn("[RateLimit] Failed to warm cache for {}:{} {}: {}", entityType.getCode(), entityId,
                    window.getCode(), e.getMessage());
        }
    }

    private Optional<Double> readUserDailyCost(long userId) {
        if (!cache.isAvailable()) {
            log.warn("[RateLimit] Cache unavailable, querying database for user {} daily cost", userId);
            return Optional.empty();
        }
        String key = QuotaKeys.userDailyCost(userId);
        try {
            Optional<Double> cached = cache.get(key).flatMap(value -> parseAmount(key, value));
            if (cached.isEmpty()) {
                log.info("[RateLimit] Cache miss for {}, querying database", key);
            }
            return cached;
        } catch (QuotaCacheException e) {
            log.warn("[RateLimit] Cache read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void warmUserDailyCost(long userId, double amount) {
        if (cache.isAvailable()) {
            writeQuietly(QuotaKeys.userDailyCost(userId), amount, windowResolver.secondsUntilMidnight());
        }
    }

    private void writeQuietly(String key, double amount, long ttlSeconds) {
        if (!cache.isAvailable()) {
            return;
        }
        try {
            cache.set(key, QuotaMessages.plainAmount(amount), ttlSeconds);
        } catch (QuotaCacheException e) {
            log.warn("[RateLimit] Failed to cache {}: {}", key, e.getMessage());
        }
    }

    private Optional<Double> parseAmount(String key, String value) {
        try {
            return Optional.of(Double.parseDouble(value));
        } catch (NumberFormatException e) {
            log.warn("[RateLimit] Ignoring unreadable cached value for {}: {}", key, value);
            return Optional.empty();
        }
    }

    private AdmissionOutcome deny(QuotaEntityType entityType, CostLimits.Limit limit, double current) {
        return AdmissionOutcome.denied(
                QuotaMessages.spendLimitReached(entityType, limit.window(), current, limit.amount()),
                current, limit.amount());
    }

    private static String nonce(String sessionId) {
        String random = Long.toHexString(ThreadLocalRandom.current().nextLong());
        return sessionId != null ? sessionId + "-" + random : random;
    }
}
