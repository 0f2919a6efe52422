package me.golemcore.quota.infrastructure.config;

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

import me.golemcore.quota.adapter.outbound.cost.NoOpCostAggregatorAdapter;
import me.golemcore.quota.port.outbound.CostAggregatorPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core beans of the quota engine.
 *
 * <p>
 * This configuration provides:
 * <ul>
 * <li>the {@link Clock} every time read goes through</li>
 * <li>the {@link ObjectMapper} used for lease JSON</li>
 * <li>the executor behind cost-tracking writes</li>
 * <li>a no-op {@link CostAggregatorPort} when the host application supplies
 * none</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class QuotaAutoConfiguration {

    public static final String COST_TRACKING_EXECUTOR = "costTrackingExecutor";

    private final QuotaProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(name = COST_TRACKING_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService costTrackingExecutor() {
        int threads = Math.max(1, properties.getTracking().getThreads());
        return Executors.newFixedThreadPool(threads, daemonThreadFactory("quota-tracking-"));
    }

    @Bean
    @ConditionalOnMissingBean(CostAggregatorPort.class)
    public CostAggregatorPort costAggregatorPort() {
        return new NoOpCostAggregatorAdapter();
    }

    @PostConstruct
    public void init() {
        QuotaProperties.RedisProperties redis = properties.getRedis();
        log.info("Quota engine starting (timezone={})", properties.getTimezone());
        if (redis.isEnabled()) {
            log.info("Quota cache: redis://{}:{}/{}", redis.getHost(), redis.getPort(), redis.getDatabase());
        } else {
            log.warn("Quota cache disabled, cost checks will query the database on every request");
        }
    }

    static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
