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

import me.golemcore.quota.infrastructure.config.QuotaAutoConfiguration;
import me.golemcore.quota.infrastructure.config.QuotaProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs cost-tracking writes off the request thread.
 *
 * <p>
 * A completed request must never fail because its cost could not be recorded,
 * so the returned future always completes normally: the task is retried up to
 * {@code quota.tracking.max-attempts} times with a fixed backoff and the final
 * failure is only logged. A failed attempt may already have been applied, so
 * tasks must be safe to run again. Callers may join the future (tests do) or
 * ignore it.
 */
@Component
@Slf4j
public class CostTrackingDispatcher {

    private final Executor executor;
    private final int maxAttempts;
    private final long retryBackoffMs;

    public CostTrackingDispatcher(@Qualifier(QuotaAutoConfiguration.COST_TRACKING_EXECUTOR) Executor executor,
            QuotaProperties properties) {
        this.executor = executor;
        this.maxAttempts = Math.max(1, properties.getTracking().getMaxAttempts());
        this.retryBackoffMs = Math.max(0, properties.getTracking().getRetryBackoffMs());
    }

    public CompletableFuture<Void> submit(String operation, Runnable task) {
        try {
            return CompletableFuture.runAsync(() -> runWithRetry(operation, task), executor);
        } catch (RejectedExecutionException e) {
            log.warn("[CostTracking] Executor rejected {}: {}", operation, e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
    }

    private void runWithRetry(String operation, Runnable task) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                task.run();
                return;
            } catch (Exception e) { // NOSONAR
                if (attempt == maxAttempts) {
                    log.error("[CostTracking] {} failed after {} attempt(s): {}", operation, attempt,
                            e.getMessage());
                    return;
                }
                log.debug("[CostTracking] {} attempt {} failed, retrying: {}", operation, attempt, e.getMessage());
                if (!sleepBeforeRetry()) {
                    log.warn("[CostTracking] {} interrupted, giving up", operation);
                    return;
                }
            }
        }
    }

    private boolean sleepBeforeRetry() {
        if (retryBackoffMs == 0) {
            return true;
        }
        try {
            Thread.sleep(retryBackoffMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
