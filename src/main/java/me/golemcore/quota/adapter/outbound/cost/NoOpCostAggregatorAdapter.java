package me.golemcore.quota.adapter.outbound.cost;

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
import me.golemcore.quota.port.outbound.CostAggregatorPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fallback cost aggregator used when the host application registers no
 * ledger. Every sum is 0, so database fallbacks never deny.
 */
@Slf4j
public class NoOpCostAggregatorAdapter implements CostAggregatorPort {

    private final AtomicBoolean warned = new AtomicBoolean(false);

    @Override
    public double sumCost(QuotaEntityType entityType, long entityId, Instant startTime, Instant endTime) {
        warnOnce();
        return 0;
    }

    @Override
    public double sumCostToday(long userId) {
        warnOnce();
        return 0;
    }

    @Override
    public double sumTotalCost(QuotaEntityType entityType, long entityId, Integer maxAgeDays) {
        warnOnce();
        return 0;
    }

    private void warnOnce() {
        if (warned.compareAndSet(false, true)) {
            log.warn("[RateLimit] No cost ledger configured, database fallbacks report zero spend");
        }
    }
}
