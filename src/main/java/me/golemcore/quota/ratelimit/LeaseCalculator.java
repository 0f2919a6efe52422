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

/**
 * Computes the size of a budget lease slice.
 *
 * <pre>
 * remaining = max(0, limit - usage)
 * slice     = min(limit * percent, remaining, cap)
 * </pre>
 *
 * Percent is clamped to {@code [0, 1]}, a negative cap counts as {@code 0} and
 * the result is rounded to four decimals. The slice never exceeds what is left
 * of the limit, so a lease cannot grant spend the ledger has not got.
 */
public final class LeaseCalculator {

    private static final double ROUNDING_SCALE = 10_000d;

    private LeaseCalculator() {
    }

    public static double calculateLeaseSlice(double limitAmount, double currentUsage, double percent,
            Double capUsd) {
        double remaining = Math.max(0, limitAmount - currentUsage);
        if (remaining == 0) {
            return 0;
        }
        double clampedPercent = Math.min(1, Math.max(0, percent));
        double slice = Math.min(limitAmount * clampedPercent, remaining);
        if (capUsd != null) {
            slice = Math.min(slice, Math.max(0, capUsd));
        }
        return Math.max(0, round(slice));
    }

    static double round(double value) {
        return Math.round(value * ROUNDING_SCALE) / ROUNDING_SCALE;
    }
}
