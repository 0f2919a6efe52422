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

import java.time.Instant;

/**
 * Describes when a window resets, for response headers and usage displays.
 */
@Data
@Builder
public class ResetInfo {

    private ResetType type;
    private String period;
    private Instant resetAt; // null for rolling windows

    public enum ResetType {
        /** Trailing window, no reset instant. */
        ROLLING,
        /** Calendar boundary (week or month start). */
        NATURAL,
        /** Configured time of day. */
        CUSTOM
    }
}
