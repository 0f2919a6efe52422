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

import me.golemcore.quota.domain.model.QuotaEntityType;

import java.time.Instant;

/**
 * Port to the authoritative cost ledger. Implementations must be safe for
 * concurrent use and return non-negative USD amounts; an entity without rows
 * sums to {@code 0}.
 */
public interface CostAggregatorPort {

    /**
     * Sum of recorded cost for the entity with {@code startTime <= t < endTime}.
     */
    double sumCost(QuotaEntityType entityType, long entityId, Instant startTime, Instant endTime);

    /**
     * Cost of the user since today's midnight in the configured time zone.
     */
    double sumCostToday(long userId);

    /**
     * Lifetime cost of the entity, optionally restricted to the last
     * {@code maxAgeDays} days ({@code null} means all history).
     */
    double sumTotalCost(QuotaEntityType entityType, long entityId, Integer maxAgeDays);
}
