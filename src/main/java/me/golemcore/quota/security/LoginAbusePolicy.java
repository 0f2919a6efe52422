package me.golemcore.quota.security;

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

import me.golemcore.quota.domain.model.LoginAbuseDecision;
import me.golemcore.quota.infrastructure.config.QuotaProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-memory brute-force guard for key login attempts.
 *
 * <p>
 * Failed attempts are counted per client IP and per submitted key within a
 * sliding window. Once a scope has reached its threshold, the next check locks
 * it out for {@code lockoutSeconds}. A successful login clears both scopes.
 *
 * <p>
 * The map is bounded: at most once per {@code sweepIntervalMs} expired windows
 * and lockouts are dropped, then the oldest entries beyond
 * {@code maxTrackedEntries} are evicted. State is per instance and is not
 * shared across gateway nodes.
 */
@Component
@Slf4j
public class LoginAbusePolicy {

    private static final String IP_SCOPE = "ip:";
    private static final String KEY_SCOPE = "key:";

    private final Map<String, AttemptRecord> attempts = new LinkedHashMap<>();
    private final QuotaProperties.LoginAbuseProperties config;
    private final Clock clock;
    private long lastSweepAtMs;

    public LoginAbusePolicy(QuotaProperties properties, Clock clock) {
        this.config = properties.getLoginAbuse();
        this.clock = clock;
    }

    public synchronized LoginAbuseDecision check(String ip, String key) {
        long now = clock.millis();
        sweepStaleEntries(now);

        LoginAbuseDecision ipDecision = checkScope(IP_SCOPE + ip, config.getMaxAttemptsPerIp(),
                LoginAbuseDecision.IP_RATE_LIMITED, now);
        if (!ipDecision.isAllowed() || isBlank(key)) {
            return ipDecision;
        }
        return checkScope(KEY_SCOPE + key, config.getMaxAttemptsPerKey(), LoginAbuseDecision.KEY_RATE_LIMITED, now);
    }

    public synchronized void recordFailure(String ip, String key) {
        long now = clock.millis();
        sweepStaleEntries(now);

        recordFailureForScope(IP_SCOPE + ip, config.getMaxAttemptsPerIp(), now);
        if (!isBlank(key)) {
            recordFailureForScope(KEY_SCOPE + key, config.getMaxAttemptsPerKey(), now);
        }
        evictExcess();
    }

    public synchronized void recordSuccess(String ip, String key) {
        reset(ip, key);
    }

    public synchronized void reset(String ip, String key) {
        attempts.remove(IP_SCOPE + ip);
        if (!isBlank(key)) {
            attempts.remove(KEY_SCOPE + key);
        }
    }

    synchronized int trackedEntries() {
        return attempts.size();
    }

    private LoginAbuseDecision checkScope(String scopeKey, int threshold, String reason, long now) {
        AttemptRecord entry = attempts.get(scopeKey);
        if (entry == null) {
            return LoginAbuseDecision.allow();
        }

        if (entry.lockedUntilMs != null) {
            if (entry.lockedUntilMs > now) {
                return LoginAbuseDecision.lockedOut(retryAfterSeconds(entry.lockedUntilMs, now), reason);
            }
            attempts.remove(scopeKey);
            return LoginAbuseDecision.allow();
        }

        if (isWindowExpired(entry, now)) {
            attempts.remove(scopeKey);
            return LoginAbuseDecision.allow();
        }

        if (entry.count >= threshold) {
            entry.lockedUntilMs = now + config.getLockoutSeconds() * 1000L;
            log.info("[LoginAbuse] Locked out {} for {}s after {} failed attempt(s)", scopeKey,
                    config.getLockoutSeconds(), entry.count);
            return LoginAbuseDecision.lockedOut(retryAfterSeconds(entry.lockedUntilMs, now), reason);
        }
        return LoginAbuseDecision.allow();
    }

    private void recordFailureForScope(String scopeKey, int threshold, long now) {
        AttemptRecord entry = attempts.get(scopeKey);
        if (entry == null) {
            attempts.put(scopeKey, firstAttempt(threshold, now));
            return;
        }

        if (entry.lockedUntilMs != null) {
            if (entry.lockedUntilMs > now) {
                return;
            }
            attempts.put(scopeKey, firstAttempt(threshold, now));
            return;
        }

        if (isWindowExpired(entry, now)) {
            attempts.put(scopeKey, firstAttempt(threshold, now));
            return;
        }

        entry.count++;
        if (entry.count >= threshold) {
            entry.lockedUntilMs = now + config.getLockoutSeconds() * 1000L;
            log.info("[LoginAbuse] Locked out {} for {}s after {} failed attempt(s)", scopeKey,
                    config.getLockoutSeconds(), entry.count);
        }
    }

    private AttemptRecord firstAttempt(int threshold, long now) {
        AttemptRecord entry = new AttemptRecord(1, now);
        if (threshold <= 1) {
            entry.lockedUntilMs = now + config.getLockoutSeconds() * 1000L;
        }
        return entry;
    }

    private void sweepStaleEntries(long now) {
        if (now - lastSweepAtMs < config.getSweepIntervalMs()) {
            return;
        }
        lastSweepAtMs = now;

        int before = attempts.size();
        attempts.entrySet().removeIf(e -> {
            AttemptRecord entry = e.getValue();
            if (entry.lockedUntilMs != null) {
                return entry.lockedUntilMs <= now;
            }
            return isWindowExpired(entry, now);
        });
        evictExcess();
        if (before != attempts.size()) {
            log.debug("[LoginAbuse] Swept {} stale entr(ies)", before - attempts.size());
        }
    }

    private void evictExcess() {
        int excess = attempts.size() - config.getMaxTrackedEntries();
        Iterator<String> oldest = attempts.keySet().iterator();
        while (excess > 0 && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
            excess--;
        }
    }

    private boolean isWindowExpired(AttemptRecord entry, long now) {
        return now - entry.firstAttemptMs >= config.getWindowSeconds() * 1000L;
    }

    private static long retryAfterSeconds(long lockedUntilMs, long now) {
        return Math.max(1, (lockedUntilMs - now + 999) / 1000);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class AttemptRecord {
        private int count;
        private final long firstAttemptMs;
        private Long lockedUntilMs;

        private AttemptRecord(int count, long firstAttemptMs) {
            this.count = count;
            this.firstAttemptMs = firstAttemptMs;
        }
    }
}
