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

import me.golemcore.quota.port.outbound.CacheBatch;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.exceptions.JedisDataException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Queues writes and sends them in one Jedis pipeline on {@link #execute()}.
 * An error reply to any queued command fails the whole batch; the commands
 * before and after it have still been applied.
 */
class JedisCacheBatch implements CacheBatch {

    private final JedisQuotaCacheAdapter adapter;
    private final List<Consumer<Pipeline>> operations = new ArrayList<>();

    JedisCacheBatch(JedisQuotaCacheAdapter adapter) {
        this.adapter = adapter;
    }

    @Override
    public CacheBatch zadd(String key, double score, String member) {
        operations.add(pipeline -> pipeline.zadd(key, score, member));
        return this;
    }

    @Override
    public CacheBatch zrem(String key, String member) {
        operations.add(pipeline -> pipeline.zrem(key, member));
        return this;
    }

    @Override
    public CacheBatch incrementByFloat(String key, double amount) {
        operations.add(pipeline -> pipeline.incrByFloat(key, amount));
        return this;
    }

    @Override
    public CacheBatch expire(String key, long ttlSeconds) {
        if (ttlSeconds > 0) {
            operations.add(pipeline -> pipeline.expire(key, ttlSeconds));
        }
        return this;
    }

    @Override
    public CacheBatch set(String key, String value, long ttlSeconds) {
        if (ttlSeconds > 0) {
            operations.add(pipeline -> pipeline.setex(key, ttlSeconds, value));
        } else {
            operations.add(pipeline -> pipeline.set(key, value));
        }
        return this;
    }

    @Override
    public CacheBatch delete(String key) {
        operations.add(pipeline -> pipeline.del(key));
        return this;
    }

    @Override
    public void execute() {
        if (operations.isEmpty()) {
            return;
        }
        adapter.execute("pipeline(" + operations.size() + ")", jedis -> {
            List<Object> replies;
            try (Pipeline pipeline = jedis.pipelined()) {
                operations.forEach(operation -> operation.accept(pipeline));
                replies = pipeline.syncAndReturnAll();
            }
            for (Object reply : replies) {
                if (reply instanceof JedisDataException error) {
                    throw error;
                }
            }
            return null;
        });
    }
}
