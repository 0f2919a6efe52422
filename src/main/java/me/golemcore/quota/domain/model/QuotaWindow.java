package me.golemcore.quota.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

/**
 * Spend window kinds. The 5h window is always rolling; daily honours the
 * configured {@link ResetMode}; weekly and monthly follow the calendar.
 */
public enum QuotaWindow {

    FIVE_HOURS("5h", Duration.ofHours(5), "5-hour", "5 hours"),
    DAILY("daily", Duration.ofHours(24), "daily", "24 hours"),
    WEEKLY("weekly", Duration.ofDays(7), "weekly", "week"),
    MONTHLY("monthly", Duration.ofDays(30), "monthly", "month");

    private final String code;
    private final Duration rollingDuration;
    private final String label;
    private final String periodDescription;

    QuotaWindow(String code, Duration rollingDuration, String label, String periodDescription) {
        this.code = code;
        this.rollingDuration = rollingDuration;
        this.label = label;
        this.periodDescription = periodDescription;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Length of the trailing window when the window is evaluated in rolling mode.
     */
    public Duration getRollingDuration() {
        return rollingDuration;
    }

    /**
     * Adjective used in user-facing deny reasons ("5-hour spend limit reached").
     */
    public String getLabel() {
        return label;
    }

    public String getPeriodDescription() {
        return periodDescription;
    }

    @JsonCreator
    public static QuotaWindow fromCode(String code) {
        for (QuotaWindow window : values()) {
            if (window.code.equalsIgnoreCase(code)) {
                return window;
            }
        }
        throw new IllegalArgumentException("Unknown quota window: " + code);
    }
}
