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

/**
 * Pipelined batch of independent cache writes. Operations are queued and sent
 * on {@link #execute()}; they are not atomic with each other.
 */
public interface CacheBatch {

    CacheBatch zadd(String key, double score, String member);

    CacheBatch zrem(String key, String member);

    CacheBatch incrementByFloat(String key, double amount);

    CacheBatch expire(String key, long ttlSeconds);

    CacheBatch set(String key, String value, long ttlSeconds);

    CacheBatch delete(String key);

    /**
     * Send all queued operations.
     *
     * @throws QuotaCacheException
     *             if the pipeline could not be executed
     */
    void execute();
}
