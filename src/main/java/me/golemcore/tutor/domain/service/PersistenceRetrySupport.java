package me.golemcore.tutor.domain.service;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tutor.infrastructure.config.TutorProperties;
import me.golemcore.tutor.port.outbound.DuplicateRecordException;
import me.golemcore.tutor.port.outbound.PersistenceException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Runs persistence operations with exponential backoff and jitter.
 *
 * <p>
 * A {@link DuplicateRecordException} means the record is already stored and
 * counts as success. Non-retryable failures stop immediately. Background saves
 * never propagate failures to the caller; they are logged once every attempt
 * is exhausted.
 */
@Component
@Slf4j
public class PersistenceRetrySupport {

    private final TutorProperties.PersistenceProperties policy;
    private final ExecutorService executor;
    private final Sleeper sleeper;
    private final Random jitterRandom = new Random();

    @Autowired
    public PersistenceRetrySupport(TutorProperties properties) {
        this(properties.getPersistence(), Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "tutor-persistence");
            t.setDaemon(true);
            return t;
        }), Thread::sleep);
    }

    PersistenceRetrySupport(TutorProperties.PersistenceProperties policy, ExecutorService executor,
            Sleeper sleeper) {
        this.policy = policy;
        this.executor = executor;
        this.sleeper = sleeper;
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
    }

    /**
     * Run synchronously, retrying retryable failures.
     *
     * @throws PersistenceException
     *             after the last failed attempt
     */
    public <T> T call(String operation, Supplier<T> action) {
        int maxAttempts = Math.max(1, policy.getMaxAttempts());
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (DuplicateRecordException e) {
                log.debug("[Persistence] {}: already stored ({})", operation, e.getMessage());
                return null;
            } catch (PersistenceException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                lastFailure = e;
            } catch (IllegalArgumentException e) {
                throw e;
            } catch (RuntimeException e) { // NOSONAR - unknown storage failures are retried
                lastFailure = e;
            }
            if (attempt < maxAttempts) {
                long delay = delayFor(attempt);
                log.warn("[Persistence] {} failed (attempt {}/{}), retrying in {}ms: {}",
                        operation, attempt, maxAttempts, delay, lastFailure.getMessage());
                pause(delay);
            }
        }
        throw lastFailure instanceof PersistenceException persistenceException
                ? persistenceException
                : new PersistenceException(operation + " failed after " + maxAttempts + " attempts", lastFailure);
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Best-effort background write. The returned future always completes
     * normally.
     */
    public CompletableFuture<Void> runAsync(String operation, Runnable action) {
        return CompletableFuture.runAsync(() -> run(operation, action), executor)
                .exceptionally(e -> {
                    log.error("[Persistence] {} abandoned after retries: {}", operation, e.getMessage());
                    return null;
                });
    }

    long delayFor(int attempt) {
        double exponential = policy.getBaseDelay().toMillis() * Math.pow(policy.getBackoffFactor(), attempt - 1);
        double capped = Math.min(exponential, policy.getMaxDelay().toMillis());
        double spread = capped * policy.getJitter();
        double jittered = capped - spread + jitterRandom.nextDouble() * spread * 2;
        return Math.max(0L, Math.round(jittered));
    }

    private void pause(long millis) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PersistenceException("Interrupted while waiting to retry", e, false);
        }
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
