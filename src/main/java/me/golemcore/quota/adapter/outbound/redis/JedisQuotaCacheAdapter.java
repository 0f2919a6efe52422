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

import me.golemcore.quota.infrastructure.config.QuotaProperties;
import me.golemcore.quota.port.outbound.CacheBatch;
import me.golemcore.quota.port.outbound.QuotaCacheException;
import me.golemcore.quota.port.outbound.QuotaCachePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.Response;
import redis.clients.jedis.exceptions.JedisException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;

/**
 * Redis implementation of {@link QuotaCachePort} on a pooled Jedis client.
 *
 * <p>
 * Atomic operations run as Lua scripts ({@link QuotaLuaScripts}); batches are
 * pipelined. Every Jedis failure surfaces as {@link QuotaCacheException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JedisQuotaCacheAdapter implements QuotaCachePort {

    private static final String NEGATIVE_INFINITY = "-inf";

    private final JedisPool jedisPool;
    private final QuotaProperties properties;

    @Override
    public boolean isAvailable() {
        return properties.getRedis().isEnabled() && !jedisPool.isClosed();
    }

    @Override
    public Optional<String> get(String key) {
        return execute("GET " + key, jedis -> Optional.ofNullable(jedis.get(key)));
    }

    @Override
    public boolean exists(String key) {
        return execute("EXISTS " + key, jedis -> jedis.exists(key));
    }

    @Override
    public void set(String key, String value, long ttlSeconds) {
        execute("SET " + key, jedis -> ttlSeconds > 0 ? jedis.setex(key, ttlSeconds, value) : jedis.set(key, value));
    }

    @Override
    public double addRollingSample(String key, double amount, long nowMs, long windowMs, long ttlSeconds) {
        String member = nowMs + ":" + BigDecimal.valueOf(amount).toPlainString() + ":"
                + Long.toHexString(ThreadLocalRandom.current().nextLong());
        Object reply = execute("addRollingSample " + key, jedis -> jedis.eval(QuotaLuaScripts.ADD_ROLLING_SAMPLE,
                List.of(key),
                List.of(String.valueOf(nowMs - windowMs), String.valueOf(nowMs), member,
                        String.valueOf(ttlSeconds))));
        return toDouble(reply);
    }

    @Override
    public double sumRollingWindow(String key, long nowMs, long windowMs) {
        Object reply = execute("sumRollingWindow " + key, jedis -> jedis.eval(QuotaLuaScripts.SUM_ROLLING_WINDOW,
                List.of(key), List.of(String.valueOf(nowMs - windowMs))));
        return toDouble(reply);
    }

    @Override
    public long pruneAndCount(String key, long cutoffScore) {
        return pruneAndCountAll(List.of(key), cutoffScore).getOrDefault(key, 0L);
    }

    @Override
    public Map<String, Long> pruneAndCountAll(List<String> keys, long cutoffScore) {
        return execute("pruneAndCount", jedis -> {
            Map<String, Response<Long>> responses = new LinkedHashMap<>();
            try (Pipeline pipeline = jedis.pipelined()) {
                for (String key : keys) {
                    pipeline.zremrangeByScore(key, NEGATIVE_INFINITY, String.valueOf(cutoffScore));
                    responses.put(key, pipeline.zcard(key));
                }
                pipeline.sync();
            }

            Map<String, Long> counts = new LinkedHashMap<>();
            responses.forEach((key, response) -> counts.put(key, response.get()));
            return counts;
        });
    }

    @Override
    public long pruneBounded(String key, long cutoffScore, int maxRemovals) {
        if (maxRemovals <= 0) {
            return 0;
        }
        Object reply = execute("pruneBounded " + key, jedis -> jedis.eval(QuotaLuaScripts.PRUNE_BOUNDED,
                List.of(key), List.of(String.valueOf(cutoffScore), String.valueOf(maxRemovals))));
        return toLong(reply);
    }

    @Override
    public List<String> members(String key) {
        return execute("ZRANGE " + key, jedis -> jedis.zrange(key, 0, -1));
    }

    @Override
    public boolean recordCost(String sampleKey, long cutoffScore, long nowMs, String member, long sampleTtlSeconds,
            double amount, Map<String, Long> counterTtls) {
        List<String> keys = new ArrayList<>();
        keys.add(sampleKey);
        List<String> args = new ArrayList<>(List.of(String.valueOf(cutoffScore), String.valueOf(nowMs), member,
                String.valueOf(sampleTtlSeconds), BigDecimal.valueOf(amount).toPlainString()));
        counterTtls.forEach((counter, ttl) -> {
            keys.add(counter);
            args.add(String.valueOf(ttl));
        });
        Object reply = execute("recordCost " + sampleKey,
                jedis -> jedis.eval(QuotaLuaScripts.RECORD_COST, keys, args));
        return toLong(reply) == 1;
    }

    @Override
    public SessionTrackReply checkAndTrackSession(String key, String sessionId, long limit, long nowMs,
            long sessionTtlMs, long keyTtlSeconds) {
        Object reply = execute("checkAndTrackSession " + key,
                jedis -> jedis.eval(QuotaLuaScripts.CHECK_AND_TRACK_SESSION, List.of(key),
                        List.of(sessionId, String.valueOf(limit), String.valueOf(nowMs),
                                String.valueOf(nowMs - sessionTtlMs), String.valueOf(keyTtlSeconds))));
        List<?> values = toList(reply, 3);
        return new SessionTrackReply(toLong(values.get(0)) == 1, toLong(values.get(1)), toLong(values.get(2)) == 1);
    }

    @Override
    public DecrementReply decrementLease(String key, double cost) {
        Object reply = execute("decrementLease " + key, jedis -> jedis.eval(QuotaLuaScripts.DECREMENT_LEASE,
                List.of(key), List.of(String.valueOf(cost))));
        List<?> values = toList(reply, 2);
        long status = toLong(values.get(0));
        if (status < 0) {
            return new DecrementReply(false, false, -1);
        }
        return new DecrementReply(true, status == 1, toDouble(values.get(1)));
    }

    @Override
    public CacheBatch batch() {
        return new JedisCacheBatch(this);
    }

    <T> T execute(String operation, Function<Jedis, T> action) {
        try (Jedis jedis = jedisPool.getResource()) {
            return action.apply(jedis);
        } catch (JedisException e) {
            log.debug("[QuotaCache] {} failed: {}", operation, e.getMessage());
            throw new QuotaCacheException("Cache operation failed: " + operation, e);
        }
    }

    private static List<?> toList(Object reply, int expectedSize) {
        if (reply instanceof List<?> list && list.size() >= expectedSize) {
            return list;
        }
        throw new QuotaCacheException("Unexpected script reply: " + reply);
    }

    private static long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value));
        } catch (NumberFormatException e) {
            throw new QuotaCacheException("Unexpected integer reply: " + value, e);
        }
    }

    private static double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value == null) {
            return 0;
        }
        try {
            return Double.parseDouble(String.valueOf(value));
        } catch (NumberFormatException e) {
            throw new QuotaCacheException("Unexpected numeric reply: " + value, e);
        }
    }
}
