package me.golemcore.quota.adapter.outbound.redis;

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

/**
 * Server-side scripts for the operations that must be atomic.
 *
 * <p>
 * Fractional results are returned as strings: Redis truncates Lua numbers to
 * integers when converting replies.
 */
final class QuotaLuaScripts {

    private QuotaLuaScripts() {
    }

    /**
     * Sums the amounts of rolling samples. Members are
     * {@code timestamp:amount[:nonce]}.
     */
    private static final String SUM_SAMPLES_FUNCTION = """
            local function sum_samples(key)
              local members = redis.call('ZRANGE', key, 0, -1)
              local total = 0
              for _, member in ipairs(members) do
                local first = string.find(member, ':', 1, true)
                if first then
                  local second = string.find(member, ':', first + 1, true)
                  local amount
                  if second then
                    amount = string.sub(member, first + 1, second - 1)
                  else
                    amount = string.sub(member, first + 1)
                  end
                  total = total + (tonumber(amount) or 0)
                end
              end
              return total
            end
            """;

    /**
     * KEYS[1] = sample set; ARGV = cutoff, now, member, ttlSeconds.
     * Returns the window sum after adding the sample.
     */
    static final String ADD_ROLLING_SAMPLE = SUM_SAMPLES_FUNCTION + """
            redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', ARGV[1])
            redis.call('ZADD', KEYS[1], ARGV[2], ARGV[3])
            redis.call('EXPIRE', KEYS[1], ARGV[4])
            return tostring(sum_samples(KEYS[1]))
            """;

    /**
     * KEYS[1] = sample set; ARGV = cutoff. Returns the window sum.
     */
    static final String SUM_ROLLING_WINDOW = SUM_SAMPLES_FUNCTION + """
            redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', ARGV[1])
            return tostring(sum_samples(KEYS[1]))
            """;

    /**
     * KEYS[1] = sample set, KEYS[2..n] = float counters; ARGV = cutoff, now,
     * member, sampleTtlSeconds, amount, then one ttlSeconds per counter. The
     * counters are incremented only when the member is new, so replaying the
     * same member is a no-op. Returns 1 when applied, 0 for a replay.
     */
    static final String RECORD_COST = """
            redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', ARGV[1])
            local added = redis.call('ZADD', KEYS[1], ARGV[2], ARGV[3])
            if tonumber(ARGV[4]) > 0 then
              redis.call('EXPIRE', KEYS[1], ARGV[4])
            end
            if added == 0 then
              return 0
            end
            for i = 2, #KEYS do
              redis.call('INCRBYFLOAT', KEYS[i], ARGV[5])
              local ttl = tonumber(ARGV[4 + i])
              if ttl and ttl > 0 then
                redis.call('EXPIRE', KEYS[i], ttl)
              end
            end
            return 1
            """;

    /**
     * KEYS[1] = active session set; ARGV = sessionId, limit, now, cutoff,
     * keyTtlSeconds. Returns {allowed, count, newlyTracked}.
     */
    static final String CHECK_AND_TRACK_SESSION = """
            redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', ARGV[4])
            local tracked = redis.call('ZSCORE', KEYS[1], ARGV[1])
            local count = redis.call('ZCARD', KEYS[1])
            local limit = tonumber(ARGV[2])
            if limit > 0 and not tracked and count >= limit then
              return {0, count, 0}
            end
            redis.call('ZADD', KEYS[1], ARGV[3], ARGV[1])
            redis.call('EXPIRE', KEYS[1], ARGV[5])
            if tracked then
              return {1, count, 0}
            end
            return {1, count + 1, 1}
            """;

    /**
     * KEYS[1] = lease JSON; ARGV = cost. Returns {status, newRemaining} where
     * status is -1 (missing), 0 (insufficient) or 1 (decremented). The
     * remaining expiry is kept.
     */
    static final String DECREMENT_LEASE = """
            local raw = redis.call('GET', KEYS[1])
            if not raw then
              return {'-1', '0'}
            end
            local lease = cjson.decode(raw)
            local cost = tonumber(ARGV[1])
            local remaining = tonumber(lease.remainingBudget) or 0
            if remaining < cost then
              return {'0', '0'}
            end
            local newRemaining = remaining - cost
            lease.remainingBudget = newRemaining
            local encoded = cjson.encode(lease)
            local ttl = redis.call('TTL', KEYS[1])
            if ttl > 0 then
              redis.call('SETEX', KEYS[1], ttl, encoded)
            else
              redis.call('SET', KEYS[1], encoded)
            end
            return {'1', tostring(newRemaining)}
            """;

    /**
     * KEYS[1] = sorted set; ARGV = cutoff, maxRemovals. Removes at most
     * maxRemovals members scored at or below cutoff, oldest first.
     */
    static final String PRUNE_BOUNDED = """
            local stale = redis.call('ZRANGEBYSCORE', KEYS[1], '-inf', ARGV[1], 'LIMIT', 0, tonumber(ARGV[2]))
            if #stale == 0 then
              return 0
            end
            return redis.call('ZREM', KEYS[1], unpack(stale))
            """;
}
