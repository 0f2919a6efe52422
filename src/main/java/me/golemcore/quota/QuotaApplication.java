package me.golemcore.quota;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Quota and concurrency admission control for an AI gateway.
 *
 * <h2>Components</h2>
 * <ul>
 * <li><b>Time-Window Resolver</b> - turns 5h, daily, weekly and monthly
 * windows into absolute ranges and cache TTLs</li>
 * <li><b>Counter-Based Cost Tracker</b> - running spend counters in Redis with
 * database fallback and cache warming</li>
 * <li><b>Lease-Based Budget Slicer</b> - small budget slices spent through an
 * atomic decrement</li>
 * <li><b>Concurrent-Session Tracker</b> - atomic check-and-track of active
 * sessions per key, user and provider</li>
 * <li><b>Login Abuse Policy</b> - in-memory brute-force lockout</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Engine          → RateLimitService, LeaseService, SessionTracker
 * Ports           → QuotaCachePort, CostAggregatorPort, QuotaSettingsPort
 * Adapters        → Jedis cache, properties-backed settings
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code quota.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class QuotaApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuotaApplication.class, args);
    }

}
