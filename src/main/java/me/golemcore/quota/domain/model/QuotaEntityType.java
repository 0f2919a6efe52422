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

/**
 * Owner of a quota: an API key, the account (user) owning keys, or an upstream
 * provider.
 */
public enum QuotaEntityType {

    KEY("key", "Key"), USER("user", "User"), PROVIDER("provider", "Provider");

    private final String code;
    private final String displayName;

    QuotaEntityType(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    /**
     * Code used in cache keys and serialized leases.
     */
    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static QuotaEntityType fromCode(String code) {
        for (QuotaEntityType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown quota entity type: " + code);
    }
}
