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
 * Result of an atomic lease decrement.
 */
@Data
@Builder
public class LeaseDecrementResult {

    public static final double NOT_AVAILABLE = -1;

    private Status status;
    private double newRemaining;

    public enum Status {
        /** Budget was sufficient and has been decremented. */
        DECREMENTED,
        /** Remaining budget is smaller than the cost; nothing changed. */
        INSUFFICIENT,
        /** No lease is cached for the entity and window. */
        NOT_FOUND,
        /** The cache failed; admission proceeds. */
        FAIL_OPEN
    }

    public boolean isSuccess() {
        return status == Status.DECREMENTED || status == Status.FAIL_OPEN;
    }

    public boolean isFailOpen() {
        return status == Status.FAIL_OPEN;
    }

    /**
     * Maps the decrement onto the common admission vocabulary: a missing lease
     * cannot be judged and is reported as unknown.
     */
    public AdmissionOutcome.Status toOutcomeStatus() {
        return switch (status) {
        case DECREMENTED -> AdmissionOutcome.Status.ALLOWED;
        case INSUFFICIENT -> AdmissionOutcome.Status.DENIED;
        case NOT_FOUND, FAIL_OPEN -> AdmissionOutcome.Status.UNKNOWN;
        };
    }

    public static LeaseDecrementResult decremented(double newRemaining) {
        return LeaseDecrementResult.builder()
                .status(Status.DECREMENTED)
                .newRemaining(newRemaining)
                .build();
    }

    public static LeaseDecrementResult insufficient() {
        return LeaseDecrementResult.builder()
                .status(Status.INSUFFICIENT)
                .newRemaining(0)
                .build();
    }

    public static LeaseDecrementResult notFound() {
        return LeaseDecrementResult.builder()
                .status(Status.NOT_FOUND)
                .newRemaining(NOT_AVAILABLE)
                .build();
    }

    public static LeaseDecrementResult failOpen() {
        return LeaseDecrementResult.builder()
                .status(Status.FAIL_OPEN)
                .newRemaining(NOT_AVAILABLE)
                .build();
    }
}
