package me.golemcore.tutor.domain.service;

import me.golemcore.tutor.adapter.outbound.session.InMemorySessionStore;
import me.golemcore.tutor.domain.model.AssistantInfo;
import me.golemcore.tutor.domain.model.AssistantSpec;
import me.golemcore.tutor.domain.model.SessionHandle;
import me.golemcore.tutor.infrastructure.config.TutorProperties;
import me.golemcore.tutor.port.outbound.AssistantPort;
import me.golemcore.tutor.port.outbound.AssistantServiceException;
import me.golemcore.tutor.port.outbound.TutorPersistencePort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AssistantSessionManagerTest {

    private static final String SUBJECT_ID = "subject_1";

    private AssistantPort assistantPort;
    private TutorPersistencePort persistencePort;
    private PersistenceRetrySupport retrySupport;
    private InMemorySessionStore sessionStore;
    private AssistantSessionManager manager;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        assistantPort = mock(AssistantPort.class);
        persistencePort = mock(TutorPersistencePort.class);
        AssistantInstructionsService instructionsService = mock(AssistantInstructionsService.class);
        ToolDispatcher toolDispatcher = mock(ToolDispatcher.class);
        ObjectProvider<ToolDispatcher> dispatcherProvider = mock(ObjectProvider.class);
        when(dispatcherProvider.getObject()).thenReturn(toolDispatcher);
        when(toolDispatcher.definitions()).thenReturn(List.of());
        when(instructionsService.render(anyString())).thenReturn("Teach well");
        when(assistantPort.isAvailable()).thenReturn(true);
        when(persistencePort.loadSessionHandle(anyString())).thenReturn(Optional.empty());

        TutorProperties properties = new TutorProperties();
        properties.getLlm().setModels(new ArrayList<>(List.of("gpt-4o", "gpt-4o-mini")));
        properties.getSession().setInitTimeout(Duration.ofSeconds(5));
        TutorProperties.PersistenceProperties policy = new TutorProperties.PersistenceProperties();
        policy.setMaxAttempts(1);
        retrySupport = new PersistenceRetrySupport(policy, Executors.newSingleThreadExecutor(), millis -> {
        });
        sessionStore = new InMemorySessionStore();
        manager = new AssistantSessionManager(assistantPort, sessionStore, persistencePort, retrySupport,
                instructionsService, dispatcherProvider, properties,
                Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC),
                Executors.newCachedThreadPool());
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
        retrySupport.shutdown();
    }

    @Test
    void shouldCreateThreadAndAssistantOnce() {
        when(assistantPort.createThread()).thenReturn("thread_1");
        when(assistantPort.createAssistant(any())).thenReturn(new AssistantInfo("asst_1", "Tutor", "gpt-4o"));

        SessionHandle first = manager.getOrCreateSession(SUBJECT_ID, "Algebra");
        SessionHandle second = manager.getOrCreateSession(SUBJECT_ID, "Algebra");

        assertSame(first, second);
        assertEquals("thread_1", first.getThreadId());
        assertEquals("asst_1", first.getAssistantId());
        assertEquals(Optional.of("thread_1"), manager.threadIdFor(SUBJECT_ID));
        verify(assistantPort, times(1)).createThread();
        verify(persistencePort, timeout(1000)).saveSessionHandle(first);
    }

    @Test
    void shouldShareInitializationBetweenConcurrentCallers() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(assistantPort.createThread()).thenAnswer(invocation -> {
            release.await(2, TimeUnit.SECONDS);
            return "thread_1";
        });
        when(assistantPort.createAssistant(any())).thenReturn(new AssistantInfo("asst_1", "Tutor", "gpt-4o"));

        ExecutorService callers = Executors.newFixedThreadPool(6);
        try {
            List<Future<SessionHandle>> futures = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                futures.add(callers.submit(() -> manager.getOrCreateSession(SUBJECT_ID, "Algebra")));
            }
            Thread.sleep(100);
            release.countDown();

            SessionHandle expected = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<SessionHandle> future : futures) {
                assertSame(expected, future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            callers.shutdownNow();
        }

        verify(assistantPort, times(1)).createThread();
        verify(assistantPort, times(1)).createAssistant(any());
    }

    @Test
    void shouldFallBackToNextModel() {
        when(assistantPort.createThread()).thenReturn("thread_1");
        when(assistantPort.createAssistant(argThat(spec -> spec != null && "gpt-4o".equals(spec.getModel()))))
                .thenThrow(new AssistantServiceException("assistant.model_unavailable", "no access"));
        when(assistantPort.createAssistant(argThat(spec -> spec != null && "gpt-4o-mini".equals(spec.getModel()))))
                .thenReturn(new AssistantInfo("asst_2", "Tutor", "gpt-4o-mini"));

        SessionHandle handle = manager.getOrCreateSession(SUBJECT_ID, "Algebra");

        assertEquals("gpt-4o-mini", handle.getModel());
        verify(assistantPort, times(2)).createAssistant(any(AssistantSpec.class));
    }

    @Test
    void shouldFailAndReleaseThreadWhenNoModelWorks() {
        when(assistantPort.createThread()).thenReturn("thread_1");
        when(assistantPort.createAssistant(any()))
                .thenThrow(new AssistantServiceException("assistant.model_unavailable", "no access"));

        SessionCreationException thrown = assertThrows(SessionCreationException.class,
                () -> manager.getOrCreateSession(SUBJECT_ID, "Algebra"));

        assertEquals(AssistantSessionManager.ALL_MODELS_FAILED, thrown.getMessage());
        verify(assistantPort).deleteThread("thread_1");
        assertTrue(manager.threadIdFor(SUBJECT_ID).isEmpty());
    }

    @Test
    void shouldReusePersistedHandleWhenStillValid() {
        SessionHandle persisted = SessionHandle.builder()
                .subjectId(SUBJECT_ID).threadId("thread_old").assistantId("asst_old").build();
        when(persistencePort.loadSessionHandle(SUBJECT_ID)).thenReturn(Optional.of(persisted));
        when(assistantPort.retrieveAssistant("asst_old"))
                .thenReturn(Optional.of(new AssistantInfo("asst_old", "Tutor", "gpt-4o")));
        when(assistantPort.threadExists("thread_old")).thenReturn(true);

        SessionHandle handle = manager.getOrCreateSession(SUBJECT_ID, "Algebra");

        assertEquals("thread_old", handle.getThreadId());
        verify(assistantPort, never()).createThread();
    }

    @Test
    void shouldReplaceStaleHandleAndReplayFirstMessage() {
        SessionHandle persisted = SessionHandle.builder()
                .subjectId(SUBJECT_ID).threadId("thread_old").assistantId("asst_old").build();
        when(persistencePort.loadSessionHandle(SUBJECT_ID)).thenReturn(Optional.of(persisted));
        when(assistantPort.retrieveAssistant("asst_old")).thenReturn(Optional.empty());
        when(assistantPort.createThread()).thenReturn("thread_new");
        when(assistantPort.createAssistant(any())).thenReturn(new AssistantInfo("asst_new", "Tutor", "gpt-4o"));

        SessionHandle handle = manager.getOrCreateSession(SUBJECT_ID, "Algebra", "I want to learn algebra");

        assertEquals("thread_new", handle.getThreadId());
        verify(assistantPort).addUserMessage("thread_new", "I want to learn algebra");
    }

    @Test
    void shouldReportCompletedBackgroundInitialization() {
        when(assistantPort.createThread()).thenReturn("thread_1");
        when(assistantPort.createAssistant(any())).thenReturn(new AssistantInfo("asst_1", "Tutor", "gpt-4o"));

        SessionHandle handle = manager.initializeAsync(SUBJECT_ID, "Algebra", null).join();

        assertEquals("thread_1", handle.getThreadId());
        assertTrue(manager.awaitInitialization(SUBJECT_ID, Duration.ofMillis(10)));
    }

    @Test
    void shouldTeardownRemoteSessionAndHandle() {
        when(assistantPort.createThread()).thenReturn("thread_1");
        when(assistantPort.createAssistant(any())).thenReturn(new AssistantInfo("asst_1", "Tutor", "gpt-4o"));
        manager.getOrCreateSession(SUBJECT_ID, "Algebra");

        manager.teardown(SUBJECT_ID);

        verify(assistantPort).deleteThread("thread_1");
        verify(assistantPort).deleteAssistant("asst_1");
        verify(persistencePort, timeout(1000)).deleteSessionHandle(SUBJECT_ID);
        assertTrue(manager.assistantIdFor(SUBJECT_ID).isEmpty());
    }
}
