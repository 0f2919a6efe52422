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
 * Result of an admission check.
 *
 * <p>
 * {@link Status#UNKNOWN} means a non-authoritative dependency failed and the
 * check could not be evaluated; callers treat it exactly like
 * {@link Status#ALLOWED}. Only {@link Status#DENIED} carries a reason meant to
 * be shown to the client.
 */
@Data
@Builder
public class AdmissionOutcome {

    private Status status;
    private String reason;
    private Double current;
    private Double limit;

    public enum Status {
        ALLOWED, DENIED, UNKNOWN
    }

    public boolean isAllowed() {
        return status != Status.DENIED;
    }

    public boolean isFailOpen() {
        return status == Status.UNKNOWN;
    }

    public static AdmissionOutcome allowed() {
        return AdmissionOutcome.builder()
                .status(Status.ALLOWED)
                .build();
    }

    public static AdmissionOutcome allowed(double current) {
        return AdmissionOutcome.builder()
                .status(Status.ALLOWED)
                .current(current)
                .build();
    }

    public static AdmissionOutcome denied(String reason, double current, double limit) {
        return AdmissionOutcome.builder()
                .status(Status.DENIED)
                .reason(reason)
                .current(current)
                .limit(limit)
                .build();
    }

    public static AdmissionOutcome unknown() {
        return AdmissionOutcome.builder()
                .status(Status.UNKNOWN)
                .build();
    }
}
