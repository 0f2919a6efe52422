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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration of the quota engine, bound from {@code quota.*}.
 */
@Component
@ConfigurationProperties(prefix = "quota")
@Data
public class QuotaProperties {

    /**
     * IANA time zone for fixed windows, calendar weeks/months and midnight
     * resets.
     */
    private String timezone = "UTC";

    private RedisProperties redis = new RedisProperties();
    private SessionProperties session = new SessionProperties();
    private CostProperties cost = new CostProperties();
    private LeaseProperties lease = new LeaseProperties();
    private TrackingProperties tracking = new TrackingProperties();
    private LoginAbuseProperties loginAbuse = new LoginAbuseProperties();

    @Data
    public static class RedisProperties {
        private boolean enabled = true;
        private String host = "localhost";
        private int port = 6379;
        private String password = "";
        private int database = 0;
        private int timeoutMs = 2000;
        private int maxTotal = 32;
        private int maxIdle = 8;
        private int minIdle = 0;
    }

    @Data
    public static class SessionProperties {
        private long ttlSeconds = 300;
        private long fallbackTtlSeconds = 3600;
        private double cleanupProbability = 0.01;
        private int cleanupMaxRemovals = 1000;
    }

    @Data
    public static class CostProperties {
        private long rollingFallbackTtlSeconds = 21600;
        private long rpmWindowSeconds = 60;
        private long rpmKeyTtlSeconds = 120;
        private long totalCostCacheTtlSeconds = 300;
    }

    @Data
    public static class LeaseProperties {
        private long refreshIntervalSeconds = 10;
        private double percent5h = 0.05;
        private double percentDaily = 0.05;
        private double percentWeekly = 0.05;
        private double percentMonthly = 0.05;
        private Double capUsd;
    }

    // ==================== COST TRACKING ====================

    @Data
    public static class TrackingProperties {
        private int threads = 2;
        private int maxAttempts = 3;
        private long retryBackoffMs = 50;
        private long dedupeWindowSeconds = 300;
    }

    // ==================== LOGIN ABUSE ====================

    @Data
    public static class LoginAbuseProperties {
        private int maxAttemptsPerIp = 10;
        private int maxAttemptsPerKey = 10;
        private long windowSeconds = 300;
        private long lockoutSeconds = 900;
        private int maxTrackedEntries = 10_000;
        private long sweepIntervalMs = 60_000;
    }
}
