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
import me.golemcore.tutor.domain.model.AssistantInfo;
import me.golemcore.tutor.domain.model.AssistantSpec;
import me.golemcore.tutor.domain.model.SessionHandle;
import me.golemcore.tutor.infrastructure.config.TutorProperties;
import me.golemcore.tutor.port.outbound.AssistantPort;
import me.golemcore.tutor.port.outbound.AssistantServiceException;
import me.golemcore.tutor.port.outbound.SessionStore;
import me.golemcore.tutor.port.outbound.TutorPersistencePort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the thread and assistant pair of every subject.
 *
 * <p>
 * Initialization is single-flight per subject: the first caller creates a
 * future and performs the work, concurrent callers wait on the same future.
 * A persisted handle is reused when both its assistant and its thread still
 * resolve on the remote side.
 */
@Service
@Slf4j
public class AssistantSessionManager {

    static final String ALL_MODELS_FAILED = "Failed to create assistant with any available model";

    private final AssistantPort assistantPort;
    private final SessionStore sessionStore;
    private final TutorPersistencePort persistencePort;
    private final PersistenceRetrySupport retrySupport;
    private final AssistantInstructionsService instructionsService;
    private final ObjectProvider<ToolDispatcher> toolDispatcherProvider;
    private final TutorProperties properties;
    private final Clock clock;
    private final ExecutorService initExecutor;

    private final Map<String, CompletableFuture<SessionHandle>> inFlight = new ConcurrentHashMap<>();

    @Autowired
    public AssistantSessionManager(AssistantPort assistantPort, SessionStore sessionStore,
            TutorPersistencePort persistencePort, PersistenceRetrySupport retrySupport,
            AssistantInstructionsService instructionsService, ObjectProvider<ToolDispatcher> toolDispatcherProvider,
            TutorProperties properties, Clock clock) {
        this(assistantPort, sessionStore, persistencePort, retrySupport, instructionsService, toolDispatcherProvider,
                properties, clock, Executors.newCachedThreadPool(r -> {
                    Thread t = new Thread(r, "tutor-session-init");
                    t.setDaemon(true);
                    return t;
                }));
    }

    AssistantSessionManager(AssistantPort assistantPort, SessionStore sessionStore,
            TutorPersistencePort persistencePort, PersistenceRetrySupport retrySupport,
            AssistantInstructionsService instructionsService, ObjectProvider<ToolDispatcher> toolDispatcherProvider,
            TutorProperties properties, Clock clock, ExecutorService initExecutor) {
        this.assistantPort = assistantPort;
        this.sessionStore = sessionStore;
        this.persistencePort = persistencePort;
        this.retrySupport = retrySupport;
        this.instructionsService = instructionsService;
        this.toolDispatcherProvider = toolDispatcherProvider;
        this.properties = properties;
        this.clock = clock;
        this.initExecutor = initExecutor;
    }

    @PreDestroy
    void shutdown() {
        initExecutor.shutdownNow();
    }

    public SessionHandle getOrCreateSession(String subjectId, String subjectName) {
        return getOrCreateSession(subjectId, subjectName, null);
    }

    /**
     * Return the live session for a subject, creating the thread and assistant
     * if needed.
     *
     * @param replayMessage
     *            user message to post into a freshly created thread, or
     *            {@code null}
     * @throws SessionCreationException
     *             when no candidate model could back an assistant
     * @throws AssistantServiceException
     *             on other remote failures
     */
    public SessionHandle getOrCreateSession(String subjectId, String subjectName, String replayMessage) {
        Optional<SessionHandle> live = sessionStore.get(subjectId);
        if (live.isPresent()) {
            return live.get();
        }

        CompletableFuture<SessionHandle> created = new CompletableFuture<>();
        CompletableFuture<SessionHandle> existing = inFlight.putIfAbsent(subjectId, created);
        if (existing != null) {
            log.debug("[Session] Joining in-flight initialization for {}", subjectId);
            return join(existing, properties.getSession().getInitTimeout());
        }

        try {
            SessionHandle handle = initialize(subjectId, subjectName, replayMessage);
            created.complete(handle);
            return handle;
        } catch (RuntimeException e) {
            created.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(subjectId, created);
        }
    }

    /**
     * Start initialization in the background, e.g. right after a subject was
     * created. Failures are logged; the next turn retries.
     */
    public CompletableFuture<SessionHandle> initializeAsync(String subjectId, String subjectName,
            String replayMessage) {
        return CompletableFuture.supplyAsync(() -> getOrCreateSession(subjectId, subjectName, replayMessage),
                initExecutor)
                .exceptionally(e -> {
                    log.warn("[Session] Background initialization for {} failed: {}", subjectId, e.getMessage());
                    return null;
                });
    }

    /**
     * Wait for an in-flight initialization of the subject, if there is one.
     *
     * @return {@code false} when the wait timed out or was interrupted
     */
    public boolean awaitInitialization(String subjectId, Duration timeout) {
        CompletableFuture<SessionHandle> pending = subjectId != null ? inFlight.get(subjectId) : null;
        if (pending == null) {
            return true;
        }
        log.debug("[Session] Waiting for initialization of {}", subjectId);
        try {
            pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (ExecutionException e) {
            // the waiting turn retries initialization itself
            log.debug("[Session] Initialization of {} failed: {}", subjectId, e.getCause().getMessage());
            return true;
        } catch (TimeoutException e) {
            log.warn("[Session] Initialization of {} still running after {}", subjectId, timeout);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public Optional<String> threadIdFor(String subjectId) {
        return sessionStore.get(subjectId).map(SessionHandle::getThreadId);
    }

    public Optional<String> assistantIdFor(String subjectId) {
        return sessionStore.get(subjectId).map(SessionHandle::getAssistantId);
    }

    /**
     * Release the remote thread and assistant of a subject. Remote deletion is
     * best effort; the local mapping and the persisted handle are always
     * removed.
     */
    public void teardown(String subjectId) {
        Optional<SessionHandle> handle = sessionStore.delete(subjectId);
        if (handle.isEmpty()) {
            try {
                handle = persistencePort.loadSessionHandle(subjectId);
            } catch (RuntimeException e) { // NOSONAR - nothing to release then
                log.debug("[Session] No persisted handle for {}: {}", subjectId, e.getMessage());
            }
        }
        handle.ifPresent(h -> {
            if (assistantPort.isAvailable()) {
                deleteQuietly("thread " + h.getThreadId(), () -> assistantPort.deleteThread(h.getThreadId()));
                deleteQuietly("assistant " + h.getAssistantId(),
                        () -> assistantPort.deleteAssistant(h.getAssistantId()));
            }
        });
        retrySupport.runAsync("delete session handle " + subjectId,
                () -> persistencePort.deleteSessionHandle(subjectId));
        log.info("[Session] Released session for {}", subjectId);
    }

    private SessionHandle initialize(String subjectId, String subjectName, String replayMessage) {
        Optional<SessionHandle> live = sessionStore.get(subjectId);
        if (live.isPresent()) {
            return live.get();
        }

        Optional<SessionHandle> restored = restore(subjectId);
        if (restored.isPresent()) {
            log.info("[Session] Reusing assistant {} for {}", restored.get().getAssistantId(), subjectId);
            return sessionStore.putIfAbsent(restored.get());
        }

        String threadId = assistantPort.createThread();
        AssistantInfo assistant;
        try {
            assistant = createAssistant(subjectName);
        } catch (SessionCreationException e) {
            deleteQuietly("thread " + threadId, () -> assistantPort.deleteThread(threadId));
            throw e;
        }

        SessionHandle handle = SessionHandle.builder()
                .subjectId(subjectId)
                .threadId(threadId)
                .assistantId(assistant.id())
                .assistantName(assistant.name())
                .model(assistant.model())
                .createdAt(Instant.now(clock))
                .build();

        if (replayMessage != null && !replayMessage.isBlank()) {
            assistantPort.addUserMessage(threadId, replayMessage);
            log.debug("[Session] Replayed first user message into thread {}", threadId);
        }

        retrySupport.runAsync("save session handle " + subjectId, () -> persistencePort.saveSessionHandle(handle));
        log.info("[Session] Created assistant {} ({}) and thread {} for {}", assistant.id(), assistant.model(),
                threadId, subjectId);
        return sessionStore.putIfAbsent(handle);
    }

    private Optional<SessionHandle> restore(String subjectId) {
        Optional<SessionHandle> persisted;
        try {
            persisted = persistencePort.loadSessionHandle(subjectId);
        } catch (RuntimeException e) { // NOSONAR - fall through to a fresh session
            log.warn("[Session] Could not load persisted handle for {}: {}", subjectId, e.getMessage());
            return Optional.empty();
        }
        if (persisted.isEmpty()) {
            return Optional.empty();
        }
        SessionHandle handle = persisted.get();
        try {
            boolean valid = handle.getAssistantId() != null && handle.getThreadId() != null
                    && assistantPort.retrieveAssistant(handle.getAssistantId()).isPresent()
                    && assistantPort.threadExists(handle.getThreadId());
            if (!valid) {
                log.info("[Session] Persisted handle for {} is stale, creating a new session", subjectId);
            }
            return valid ? Optional.of(handle) : Optional.empty();
        } catch (AssistantServiceException e) {
            log.warn("[Session] Validating persisted handle for {} failed: {}", subjectId, e.getMessage());
            return Optional.empty();
        }
    }

    private AssistantInfo createAssistant(String subjectName) {
        String name = properties.getLlm().getAssistantNamePrefix() + subjectName;
        String instructions = instructionsService.render(subjectName);
        ToolDispatcher dispatcher = toolDispatcherProvider.getObject();
        List<String> models = properties.getLlm().getModels();

        AssistantServiceException lastFailure = null;
        for (String model : models) {
            try {
                log.debug("[Session] Creating assistant '{}' with model {}", name, model);
                return assistantPort.createAssistant(AssistantSpec.builder()
                        .name(name)
                        .instructions(instructions)
                        .model(model)
                        .tools(dispatcher.definitions())
                        .build());
            } catch (AssistantServiceException e) {
                log.warn("[Session] Model {} rejected: {}", model, e.getMessage());
                lastFailure = e;
            }
        }
        throw new SessionCreationException(ALL_MODELS_FAILED, lastFailure);
    }

    private SessionHandle join(CompletableFuture<SessionHandle> future, Duration timeout) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new SessionCreationException("Session initialization failed", cause);
        } catch (TimeoutException e) {
            throw new AssistantServiceException("assistant.timeout",
                    "Session initialization did not finish within " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssistantServiceException("assistant.aborted", "Interrupted while waiting for session", e);
        }
    }

    private void deleteQuietly(String what, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) { // NOSONAR - remote cleanup is best effort
            log.warn("[Session] Failed to delete {}: {}", what, e.getMessage());
        }
    }
}
