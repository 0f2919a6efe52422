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

@Data
@Builder
public class LoginAbuseDecision {

    public static final String IP_RATE_LIMITED = "ip_rate_limited";
    public static final String KEY_RATE_LIMITED = "key_rate_limited";

    private boolean allowed;
    private Long retryAfterSeconds;
    private String reason;

    public static LoginAbuseDecision allow() {
        return LoginAbuseDecision.builder()
                .allowed(true)
                .build();
    }

    public static LoginAbuseDecision lockedOut(long retryAfterSeconds, String reason) {
        return LoginAbuseDecision.builder()
                .allowed(false)
                .retryAfterSeconds(retryAfterSeconds)
                .reason(reason)
                .build();
    }
}
