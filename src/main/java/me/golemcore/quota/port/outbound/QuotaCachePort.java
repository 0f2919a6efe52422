package me.golemcore.quota.port.outbound;

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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Port to the shared, multi-writer cache holding all quota state (counters,
 * leases, active-session sets).
 *
 * <p>
 * Operations that must be atomic (check-then-register, read-modify-write) are
 * exposed as single methods so the adapter can run them as one server-side
 * script. Independent writes go through {@link #batch()} and are pipelined.
 *
 * <p>
 * Every method may throw {@link QuotaCacheException}; callers decide whether a
 * failure falls back to the database or fails open.
 *
 * @see QuotaCacheException
 */
public interface QuotaCachePort {

    /**
     * Whether the cache is configured and its client is usable. A {@code false}
     * answer lets callers skip the cache without paying for a failed round trip.
     */
    boolean isAvailable();

    Optional<String> get(String key);

    boolean exists(String key);

    /**
     * Set a scalar value with an expiry in seconds.
     */
    void set(String key, String value, long ttlSeconds);

    /**
     * Atomically prune samples older than {@code nowMs - windowMs}, add one
     * sample of {@code amount} scored at {@code nowMs}, re-arm the key expiry and
     * return the sum of the samples left in the window.
     */
    double addRollingSample(String key, double amount, long nowMs, long windowMs, long ttlSeconds);

    /**
     * Atomically prune samples older than {@code nowMs - windowMs} and return the
     * sum of the remaining samples (0 when the key is absent).
     */
    double sumRollingWindow(String key, long nowMs, long windowMs);

    /**
     * Remove members scored at or below {@code cutoffScore} and return the
     * remaining member count.
     */
    long pruneAndCount(String key, long cutoffScore);

    /**
     * {@link #pruneAndCount(String, long)} for several keys in one pipeline.
     */
    Map<String, Long> pruneAndCountAll(List<String> keys, long cutoffScore);

    /**
     * Remove at most {@code maxRemovals} members scored at or below
     * {@code cutoffScore}, oldest first. Returns the number removed.
     */
    long pruneBounded(String key, long cutoffScore, int maxRemovals);

    /**
     * Members of a time-ordered set, oldest first.
     */
    List<String> members(String key);

    /**
     * Atomically record one realized cost: prune {@code sampleKey} below
     * {@code cutoffScore}, add {@code member} scored at {@code nowMs} and re-arm
     * its expiry; only when the member was not already present, increment every
     * counter in {@code counterTtls} by {@code amount} and re-arm its expiry.
     * Replaying the same member is therefore safe after a lost reply.
     *
     * @return {@code true} when the counters were incremented, {@code false}
     *         for a replay
     */
    boolean recordCost(String sampleKey, long cutoffScore, long nowMs, String member, long sampleTtlSeconds,
            double amount, Map<String, Long> counterTtls);

    /**
     * Atomically: prune members older than {@code nowMs - sessionTtlMs}; if
     * {@code sessionId} is not a member and the count has reached {@code limit},
     * deny without adding; otherwise add or re-score {@code sessionId} at
     * {@code nowMs} and set the key expiry to {@code keyTtlSeconds}.
     */
    SessionTrackReply checkAndTrackSession(String key, String sessionId, long limit, long nowMs,
            long sessionTtlMs, long keyTtlSeconds);

    /**
     * Atomically decrement {@code remainingBudget} of the JSON lease stored at
     * {@code key} by {@code cost}, preserving the key's remaining expiry.
     */
    DecrementReply decrementLease(String key, double cost);

    /**
     * Start a pipeline of independent writes.
     */
    CacheBatch batch();

    /**
     * Reply of {@link #checkAndTrackSession}. {@code count} is the member count
     * after the call (or at the time of the deny).
     */
    record SessionTrackReply(boolean allowed, long count, boolean tracked) {
    }

    /**
     * Reply of {@link #decrementLease}: {@code found=false} when the key is
     * absent; otherwise {@code success} tells whether the budget covered the cost
     * and {@code newRemaining} is the budget after the call (0 when insufficient).
     */
    record DecrementReply(boolean found, boolean success, double newRemaining) {
    }
}
