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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.port.outbound.TutorPersistencePort;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Working tutor contexts keyed by user and subject.
 *
 * <p>
 * A context is loaded from persistence on first use and cached afterwards.
 * All mutation of a context happens while holding its key's lock (see
 * {@link #withContext}), so two turns for the same subject never interleave.
 * A learner without a subject yet works on a per-user draft context that is
 * re-keyed once a subject is created.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TutorContextService {

    static final String UNASSIGNED = "_unassigned";

    private final TutorPersistencePort persistencePort;
    private final PersistenceRetrySupport retrySupport;
    private final ObjectMapper objectMapper;

    private final Map<ContextKey, TutorContext> contexts = new ConcurrentHashMap<>();
    private final Map<ContextKey, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<ContextKey, CompletableFuture<Void>> pendingSaves = new ConcurrentHashMap<>();

    /**
     * Run {@code action} on the context for the given key while holding its
     * lock.
     */
    public <T> T withContext(String userId, String subjectId, Function<TutorContext, T> action) {
        ContextKey key = ContextKey.of(userId, subjectId);
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.apply(resolve(key));
        } finally {
            lock.unlock();
        }
    }

    public Optional<TutorContext> find(String userId, String subjectId) {
        ContextKey key = ContextKey.of(userId, subjectId);
        TutorContext cached = contexts.get(key);
        if (cached != null) {
            return Optional.of(snapshot(cached));
        }
        if (subjectId == null) {
            return Optional.empty();
        }
        return retrySupport.call("load context " + key, () -> persistencePort.loadContext(userId, subjectId));
    }

    /**
     * Register the context under its current subject id and drop it from the
     * key it was loaded under. Called after a turn that created or switched
     * the subject.
     */
    public void bind(TutorContext context, String previousSubjectId) {
        if (!context.hasSubject()) {
            return;
        }
        ContextKey key = ContextKey.of(context.getUserId(), context.getSubjectId());
        TutorContext previous = contexts.put(key, context);
        if (previous != null && previous != context) {
            log.debug("[Context] Replaced cached context for {}", key);
        }
        ContextKey previousKey = ContextKey.of(context.getUserId(), previousSubjectId);
        if (!previousKey.equals(key)) {
            contexts.remove(previousKey, context);
        }
    }

    public void evict(String userId, String subjectId) {
        ContextKey key = ContextKey.of(userId, subjectId);
        contexts.remove(key);
        locks.remove(key);
    }

    /**
     * Snapshot the context and store it in the background. Must be called by
     * the lock holder.
     *
     * <p>
     * Saves for one key are chained, so a snapshot is only written after every
     * earlier snapshot of the same context (including its retries) has
     * finished.
     */
    public CompletableFuture<Void> saveAsync(TutorContext context) {
        if (context.getUserId() == null || !context.hasSubject()) {
            return CompletableFuture.completedFuture(null);
        }
        TutorContext copy = snapshot(context);
        String userId = copy.getUserId();
        String subjectId = copy.getSubjectId();
        ContextKey key = ContextKey.of(userId, subjectId);
        CompletableFuture<Void> save = pendingSaves.compute(key, (k, previous) -> {
            CompletableFuture<Void> after = previous != null ? previous : CompletableFuture.completedFuture(null);
            return after.thenCompose(ignored -> retrySupport.runAsync("save context " + k, () -> {
                persistencePort.saveContext(userId, subjectId, copy);
                persistencePort.saveSubject(userId, copy.getSubject());
            }));
        });
        save.whenComplete((ignored, error) -> pendingSaves.remove(key, save));
        return save;
    }

    /**
     * Deep copy through Jackson, detached from further mutation.
     */
    public TutorContext snapshot(TutorContext context) {
        return objectMapper.convertValue(context, TutorContext.class);
    }

    private TutorContext resolve(ContextKey key) {
        TutorContext cached = contexts.get(key);
        if (cached != null) {
            return cached;
        }
        TutorContext loaded = null;
        if (!UNASSIGNED.equals(key.subjectId())) {
            try {
                loaded = retrySupport.call("load context " + key,
                        () -> persistencePort.loadContext(key.userId(), key.subjectId())).orElse(null);
            } catch (RuntimeException e) { // NOSONAR - a fresh context is better than failing the turn
                log.warn("[Context] Failed to load {}, starting fresh: {}", key, e.getMessage());
            }
        }
        TutorContext context = loaded != null ? loaded : TutorContext.builder().userId(key.userId()).build();
        if (context.getUserId() == null) {
            context.setUserId(key.userId());
        }
        TutorContext existing = contexts.putIfAbsent(key, context);
        return existing != null ? existing : context;
    }

    record ContextKey(String userId, String subjectId) {

        static ContextKey of(String userId, String subjectId) {
            if (userId == null || userId.isBlank()) {
                throw new IllegalArgumentException("userId is required");
            }
            return new ContextKey(userId, subjectId == null || subjectId.isBlank() ? UNASSIGNED : subjectId);
        }

        @Override
        public String toString() {
            return userId + "/" + subjectId;
        }
    }
}
