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

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Deny reasons and cached amount formatting shared by the trackers.
 */
final class QuotaMessages {

    private QuotaMessages() {
    }

    /**
     * e.g. {@code Key 5-hour spend limit reached (12.3400/10.0)}
     */
    static String spendLimitReached(QuotaEntityType entityType, QuotaWindow window, double current,
            double limit) {
        return String.format(Locale.ROOT, "%s %s spend limit reached (%.4f/%s)",
                entityType.getDisplayName(), window.getLabel(), current, limit);
    }

    static String totalSpendLimitReached(QuotaEntityType entityType, double current, double limit) {
        return String.format(Locale.ROOT, "%s total spend limit reached (%.4f/%s)",
                entityType.getDisplayName(), current, limit);
    }

    static String sessionLimitReached(QuotaEntityType entityType, long count, long limit) {
        return entityType.getDisplayName() + " concurrent session limit reached (" + count + "/" + limit + ")";
    }

    static String rpmLimitReached(long count, long limit) {
        return "User RPM limit reached (" + count + "/" + limit + ")";
    }

    /**
     * Cached amounts are written without exponent notation so every reader
     * (including server-side scripts) parses them the same way.
     */
    static String plainAmount(double amount) {
        return BigDecimal.valueOf(amount).toPlainString();
    }
}
