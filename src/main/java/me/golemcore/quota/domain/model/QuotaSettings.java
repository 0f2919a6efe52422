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

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * System-wide lease tuning.
 */
@Data
@Builder
public class QuotaSettings {

    public static final long DEFAULT_REFRESH_INTERVAL_SECONDS = 10;
    public static final double DEFAULT_LEASE_PERCENT = 0.05;

    private long refreshIntervalSeconds;
    private Map<QuotaWindow, Double> leasePercentByWindow;
    private Double leaseCapUsd; // null means no absolute cap

    public double leasePercentFor(QuotaWindow window) {
        if (leasePercentByWindow == null) {
            return DEFAULT_LEASE_PERCENT;
        }
        Double percent = leasePercentByWindow.get(window);
        return percent != null ? percent : DEFAULT_LEASE_PERCENT;
    }
}
