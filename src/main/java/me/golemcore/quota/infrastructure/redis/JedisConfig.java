package me.golemcore.quota.infrastructure.redis;

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
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

/**
 * Spring configuration for the pooled Jedis client.
 *
 * <p>
 * Creates a shared {@link JedisPool} configured from
 * {@link QuotaProperties.RedisProperties}. Connections are opened lazily, so a
 * Redis server that is down at startup only makes cache calls fail, and every
 * caller falls back or fails open.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
public class JedisConfig {

    private final QuotaProperties properties;

    @Bean(destroyMethod = "close")
    public JedisPool jedisPool() {
        QuotaProperties.RedisProperties redis = properties.getRedis();

        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(redis.getMaxTotal());
        poolConfig.setMaxIdle(redis.getMaxIdle());
        poolConfig.setMinIdle(redis.getMinIdle());
        poolConfig.setJmxEnabled(false);

        String password = redis.getPassword() == null || redis.getPassword().isBlank() ? null : redis.getPassword();
        return new JedisPool(poolConfig, redis.getHost(), redis.getPort(), redis.getTimeoutMs(), password,
                redis.getDatabase());
    }
}
