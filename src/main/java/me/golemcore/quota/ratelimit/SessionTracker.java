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

import me.golemcore.quota.domain.model.QuotaEntityType;
import me.golemcore.quota.domain.model.SessionAdmission;
import me.golemcore.quota.infrastructure.config.QuotaProperties;
import me.golemcore.quota.port.outbound.CacheBatch;
import me.golemcore.quota.port.outbound.QuotaCacheException;
import me.golemcore.quota.port.outbound.QuotaCachePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Tracks concurrent sessions per key, user, provider and globally.
 *
 * <p>
 * Each scope is a time-ordered set of session ids scored by last-seen time. A
 * session counts toward a ceiling only while {@code now - score < sessionTtl};
 * stale members are pruned lazily on read and, with a small probability, on
 * write. The provider ceiling is enforced by one atomic check-and-track so two
 * concurrent requests cannot both take the last slot.
 *
 * <p>
 * Every failure fails open: counts read as 0 and admissions as unknown.
 */
@Component
@Slf4j
public class SessionTracker {

    static final long DEFAULT_SESSION_TTL_SECONDS = 300;

    private final QuotaCachePort cache;
    private final Clock clock;
    private final DoubleSupplier random;
    private final long sessionTtlSeconds;
    private final long setTtlSeconds;
    private final double cleanupProbability;
    private final int cleanupMaxRemovals;

    @Autowired
    public SessionTracker(QuotaCachePort cache, QuotaProperties properties, Clock clock) {
        this(cache, properties, clock, () -> ThreadLocalRandom.current().nextDouble());
    }

    SessionTracker(QuotaCachePort cache, QuotaProperties properties, Clock clock, DoubleSupplier random) {
        this.cache = cache;
        this.clock = clock;
        this.random = random;
        QuotaProperties.SessionProperties session = properties.getSession();
        this.sessionTtlSeconds = session.getTtlSeconds() > 0 ? session.getTtlSeconds() : DEFAULT_SESSION_TTL_SECONDS;
        this.setTtlSeconds = Math.max(session.getFallbackTtlSeconds(), sessionTtlSeconds);
        this.cleanupProbability = session.getCleanupProbability();
        this.cleanupMaxRemovals = session.getCleanupMaxRemovals();
    }

    public long getSessionTtlSeconds() {
        return sessionTtlSeconds;
    }

    /**
     * Atomically admit {@code sessionId} against the provider's ceiling. An
     * already tracked session is always admitted and only refreshed.
     */
    public SessionAdmission checkAndTrackProviderSession(long providerId, String sessionId, long limit) {
        if (limit <= 0) {
            return SessionAdmission.allowed(0, false);
        }
        if (!cache.isAvailable()) {
            log.warn("[SessionTracker] Cache unavailable, admitting session {} for provider {}", sessionId,
                    providerId);
            return SessionAdmission.unknown();
        }

        String key = QuotaKeys.activeSessions(QuotaEntityType.PROVIDER, providerId);
        try {
            QuotaCachePort.SessionTrackReply reply = cache.checkAndTrackSession(key, sessionId, limit,
                    clock.millis(), sessionTtlSeconds * 1000L, setTtlSeconds);
            if (!reply.allowed()) {
                log.debug("[SessionTracker] Provider {} at session limit ({}/{})", providerId, reply.count(), limit);
                return SessionAdmission.denied(reply.count(),
                        QuotaMessages.sessionLimitReached(QuotaEntityType.PROVIDER, reply.count(), limit));
            }
            return SessionAdmission.allowed(reply.count(), reply.tracked());
        } catch (QuotaCacheException e) {
            log.error("[SessionTracker] Check-and-track failed for provider {}: {}", providerId, e.getMessage());
            return SessionAdmission.unknown();
        }
    }

    public long getKeySessionCount(long keyId) {
        return countActive(QuotaKeys.activeSessions(QuotaEntityType.KEY, keyId));
    }

    public long getUserSessionCount(long userId) {
        return countActive(QuotaKeys.activeSessions(QuotaEntityType.USER, userId));
    }

    public long getProviderSessionCount(long providerId) {
        return countActive(QuotaKeys.activeSessions(QuotaEntityType.PROVIDER, providerId));
    }

    public long getGlobalSessionCount() {
        return countActive(QuotaKeys.GLOBAL_ACTIVE_SESSIONS);
    }

    /**
     * Active session counts for several providers in one round trip. Providers
     * are reported as 0 when the cache fails.
     */
    public Map<Long, Long> getProviderSessionCounts(Collection<Long> providerIds) {
        Map<Long, Long> counts = new LinkedHashMap<>();
        if (providerIds == null || providerIds.isEmpty()) {
            return counts;
        }
        Map<String, Long> keyToProvider = new LinkedHashMap<>();
        for (Long providerId : providerIds) {
            counts.put(providerId, 0L);
            keyToProvider.put(QuotaKeys.activeSessions(QuotaEntityType.PROVIDER, providerId), providerId);
        }
        if (!cache.isAvailable()) {
            return counts;
        }

        try {
            Map<String, Long> byKey = cache.pruneAndCountAll(new ArrayList<>(keyToProvider.keySet()), staleCutoff());
            byKey.forEach((key, count) -> counts.put(keyToProvider.get(key), count));
        } catch (QuotaCacheException e) {
            log.error("[SessionTracker] Batch session count failed: {}", e.getMessage());
        }
        return counts;
    }

    /**
     * Register a new session in the global, key and user scopes and bind it to
     * its key.
     */
    public void trackSession(String sessionId, long keyId, Long userId) {
        if (!cache.isAvailable()) {
            return;
        }
        long now = clock.millis();
        List<String> scopes = new ArrayList<>(3);
        scopes.add(QuotaKeys.GLOBAL_ACTIVE_SESSIONS);
        scopes.add(QuotaKeys.activeSessions(QuotaEntityType.KEY, keyId));
        if (userId != null) {
            scopes.add(QuotaKeys.activeSessions(QuotaEntityType.USER, userId));
        }

        try {
            CacheBatch batch = cache.batch();
            for (String scope : scopes) {
                batch.zadd(scope, now, sessionId).expire(scope, setTtlSeconds);
            }
            batch.set(QuotaKeys.sessionBinding(sessionId, QuotaEntityType.KEY), String.valueOf(keyId),
                    sessionTtlSeconds)
                    .set(QuotaKeys.sessionLastSeen(sessionId), String.valueOf(now), sessionTtlSeconds)
                    .execute();
            log.debug("[SessionTracker] Tracked session {} (key={}, user={})", sessionId, keyId, userId);
        } catch (QuotaCacheException e) {
            log.error("[SessionTracker] Failed to track session {}: {}", sessionId, e.getMessage());
            return;
        }
        maybeCleanup(scopes);
    }

    /**
     * Re-score the session in every scope it belongs to and extend the scope
     * sets and bindings, keeping long-lived streaming sessions alive.
     */
    public void refreshSession(String sessionId, long keyId, long providerId) {
        if (!cache.isAvailable()) {
            return;
        }
        long now = clock.millis();
        List<String> scopes = List.of(
                QuotaKeys.GLOBAL_ACTIVE_SESSIONS,
                QuotaKeys.activeSessions(QuotaEntityType.KEY, keyId),
                QuotaKeys.activeSessions(QuotaEntityType.PROVIDER, providerId));

        try {
            CacheBatch batch = cache.batch();
            for (String scope : scopes) {
                batch.zadd(scope, now, sessionId).expire(scope, setTtlSeconds);
            }
            batch.set(QuotaKeys.sessionBinding(sessionId, QuotaEntityType.KEY), String.valueOf(keyId),
                    sessionTtlSeconds)
                    .set(QuotaKeys.sessionBinding(sessionId, QuotaEntityType.PROVIDER), String.valueOf(providerId),
                            sessionTtlSeconds)
                    .set(QuotaKeys.sessionLastSeen(sessionId), String.valueOf(now), sessionTtlSeconds)
                    .execute();
        } catch (QuotaCacheException e) {
            log.error("[SessionTracker] Failed to refresh session {}: {}", sessionId, e.getMessage());
            return;
        }
        maybeCleanup(scopes);
    }

    /**
     * Remove the session from every scope and drop its bindings. User scopes
     * are left to expire by recency.
     */
    public void terminateSession(String sessionId, long keyId, long providerId) {
        if (!cache.isAvailable()) {
            return;
        }
        try {
            cache.batch()
                    .zrem(QuotaKeys.GLOBAL_ACTIVE_SESSIONS, sessionId)
                    .zrem(QuotaKeys.activeSessions(QuotaEntityType.KEY, keyId), sessionId)
                    .zrem(QuotaKeys.activeSessions(QuotaEntityType.PROVIDER, providerId), sessionId)
                    .delete(QuotaKeys.sessionBinding(sessionId, QuotaEntityType.KEY))
                    .delete(QuotaKeys.sessionBinding(sessionId, QuotaEntityType.PROVIDER))
                    .delete(QuotaKeys.sessionLastSeen(sessionId))
                    .execute();
            log.debug("[SessionTracker] Terminated session {}", sessionId);
        } catch (QuotaCacheException e) {
            log.error("[SessionTracker] Failed to terminate session {}: {}", sessionId, e.getMessage());
        }
    }

    /**
     * Ids of all sessions active in the global scope, oldest first.
     */
    public List<String> getActiveSessions() {
        if (!cache.isAvailable()) {
            return List.of();
        }
        try {
            cache.pruneAndCount(QuotaKeys.GLOBAL_ACTIVE_SESSIONS, staleCutoff());
            return cache.members(QuotaKeys.GLOBAL_ACTIVE_SESSIONS);
        } catch (QuotaCacheException e) {
            log.error("[SessionTracker] Failed to list active sessions: {}", e.getMessage());
            return List.of();
        }
    }

    private long countActive(String key) {
        if (!cache.isAvailable()) {
            return 0;
        }
        try {
            return cache.pruneAndCount(key, staleCutoff());
        } catch (QuotaCacheException e) {
            log.error("[SessionTracker] Failed to count sessions in {}: {}", key, e.getMessage());
            return 0;
        }
    }

    private void maybeCleanup(List<String> scopes) {
        if (random.getAsDouble() >= cleanupProbability) {
            return;
        }
        long cutoff = staleCutoff();
        for (String scope : scopes) {
            try {
                long removed = cache.pruneBounded(scope, cutoff, cleanupMaxRemovals);
                if (removed > 0) {
                    log.debug("[SessionTracker] Cleaned {} stale session(s) from {}", removed, scope);
                }
            } catch (QuotaCacheException e) {
                log.warn("[SessionTracker] Cleanup of {} failed: {}", scope, e.getMessage());
            }
        }
    }

    private long staleCutoff() {
        return clock.millis() - sessionTtlSeconds * 1000L;
    }
}
