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

/**
 * Result of an atomic concurrent-session check-and-track.
 *
 * <p>
 * {@code tracked} is true only when the session was newly added to the scope;
 * a refresh of an already tracked session is allowed with
 * {@code tracked=false}.
 */
@Data
@Builder
public class SessionAdmission {

    private AdmissionOutcome.Status status;
    private long count;
    private boolean tracked;
    private String reason;

    public boolean isAllowed() {
        return status != AdmissionOutcome.Status.DENIED;
    }

    public static SessionAdmission allowed(long count, boolean tracked) {
        return SessionAdmission.builder()
                .status(AdmissionOutcome.Status.ALLOWED)
                .count(count)
                .tracked(tracked)
                .build();
    }

    public static SessionAdmission denied(long count, String reason) {
        return SessionAdmission.builder()
                .status(AdmissionOutcome.Status.DENIED)
                .count(count)
                .tracked(false)
                .reason(reason)
                .build();
    }

    public static SessionAdmission unknown() {
        return SessionAdmission.builder()
                .status(AdmissionOutcome.Status.UNKNOWN)
                .count(0)
                .tracked(false)
                .build();
    }
}
