package me.golemcore.quota.ratelimit;

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

import me.golemcore.quota.domain.model.QuotaEntityType;
import me.golemcore.quota.domain.model.QuotaWindow;

/**
 * Deterministic cache key scheme shared by every gateway instance.
 */
public final class QuotaKeys {

    public static final String GLOBAL_ACTIVE_SESSIONS = "{active_sessions}:global:active_sessions";

    private QuotaKeys() {
    }

    /**
     * {@code lease:{entityType}:{entityId}:{window}}
     */
    public static String lease(QuotaEntityType entityType, long entityId, QuotaWindow window) {
        return "lease:" + entityType.getCode() + ":" + entityId + ":" + window.getCode();
    }

    /**
     * Rolling 5h sample set, e.g. {@code key:42:cost_5h_rolling}.
     */
    public static String rollingCost(QuotaEntityType entityType, long entityId) {
        return entityType.getCode() + ":" + entityId + ":cost_5h_rolling";
    }

    /**
     * Fixed-window scalar, e.g. {@code provider:7:cost_weekly}.
     */
    public static String fixedCost(QuotaEntityType entityType, long entityId, QuotaWindow window) {
        return entityType.getCode() + ":" + entityId + ":cost_" + window.getCode();
    }

    public static String totalCost(QuotaEntityType entityType, long entityId) {
        return entityType.getCode() + ":" + entityId + ":cost_total";
    }

    public static String userRpm(long userId) {
        return "user:" + userId + ":rpm_window";
    }

    public static String userDailyCost(long userId) {
        return "user:" + userId + ":daily_cost";
    }

    /**
     * Recently recorded daily cost samples, kept only to skip replays.
     */
    public static String userDailyCostSamples(long userId) {
        return "user:" + userId + ":daily_cost_samples";
    }

    public static String activeSessions(QuotaEntityType entityType, long entityId) {
        return entityType.getCode() + ":" + entityId + ":active_sessions";
    }

    public static String sessionBinding(String sessionId, QuotaEntityType entityType) {
        return "session:" + sessionId + ":" + entityType.getCode();
    }

    public static String sessionLastSeen(String sessionId) {
        return "session:" + sessionId + ":last_seen";
    }
}
