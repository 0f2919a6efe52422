package me.golemcore.quota.adapter.outbound.settings;

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

import me.golemcore.quota.domain.model.QuotaSettings;
import me.golemcore.quota.domain.model.QuotaWindow;
import me.golemcore.quota.infrastructure.config.QuotaProperties;
import me.golemcore.quota.port.outbound.QuotaSettingsPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Lease tuning read from {@code quota.lease.*}.
 */
@Component
@RequiredArgsConstructor
public class PropertiesQuotaSettingsAdapter implements QuotaSettingsPort {

    private final QuotaProperties properties;

    @Override
    public QuotaSettings getQuotaSettings() {
        QuotaProperties.LeaseProperties lease = properties.getLease();

        Map<QuotaWindow, Double> percents = new EnumMap<>(QuotaWindow.class);
        percents.put(QuotaWindow.FIVE_HOURS, lease.getPercent5h());
        percents.put(QuotaWindow.DAILY, lease.getPercentDaily());
        percents.put(QuotaWindow.WEEKLY, lease.getPercentWeekly());
        percents.put(QuotaWindow.MONTHLY, lease.getPercentMonthly());

        long refreshInterval = lease.getRefreshIntervalSeconds() > 0
                ? lease.getRefreshIntervalSeconds()
                : QuotaSettings.DEFAULT_REFRESH_INTERVAL_SECONDS;

        return QuotaSettings.builder()
                .refreshIntervalSeconds(refreshInterval)
                .leasePercentByWindow(percents)
                .leaseCapUsd(lease.getCapUsd())
                .build();
    }
}
