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

import java.util.ArrayList;
import java.util.List;

/**
 * Spend limits (USD) of a key or provider. A null, zero or negative amount means
 * unlimited.
 */
@Data
@Builder
public class CostLimits {

    private Double fiveHour;
    private Double weekly;
    private Double monthly;

    /**
     * Configured limits in evaluation order (5h, weekly, monthly).
     */
    public List<Limit> configured() {
        List<Limit> limits = new ArrayList<>(3);
        addIfConfigured(limits, QuotaWindow.FIVE_HOURS, fiveHour);
        addIfConfigured(limits, QuotaWindow.WEEKLY, weekly);
        addIfConfigured(limits, QuotaWindow.MONTHLY, monthly);
        return limits;
    }

    private static void addIfConfigured(List<Limit> limits, QuotaWindow window, Double amount) {
        if (amount != null && amount > 0) {
            limits.add(new Limit(window, amount));
        }
    }

    public record Limit(QuotaWindow window, double amount) {
    }
}
