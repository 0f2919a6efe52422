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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Short-lived slice of the remaining spend budget of one entity and window.
 *
 * <p>
 * The database stays authoritative: {@code currentUsage} is the ledger total at
 * {@code snapshotAtMs}, and {@code remainingBudget} is the slice that may be
 * spent through atomic decrements until the lease expires after
 * {@code ttlSeconds}. Stored in the cache as JSON; the decrement script rewrites
 * {@code remainingBudget} in place.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetLease {

    private QuotaEntityType entityType;
    private long entityId;
    private QuotaWindow window;
    private ResetMode resetMode;
    private String resetTime;
    private long snapshotAtMs;
    private double currentUsage;
    private double limitAmount;
    private double remainingBudget;
    private long ttlSeconds;

    public boolean isExpired(long nowMs) {
        return nowMs >= snapshotAtMs + ttlSeconds * 1000L;
    }
}
