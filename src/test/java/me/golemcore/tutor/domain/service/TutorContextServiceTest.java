package me.golemcore.tutor.domain.service;

import me.golemcore.tutor.domain.model.ConversationTurn;
import me.golemcore.tutor.domain.model.Subject;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.infrastructure.config.AutoConfiguration;
import me.golemcore.tutor.infrastructure.config.TutorProperties;
import me.golemcore.tutor.port.outbound.PersistenceException;
import me.golemcore.tutor.port.outbound.TutorPersistencePort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TutorContextServiceTest {

    private static final String USER = "user-1";

    private TutorPersistencePort persistencePort;
    private PersistenceRetrySupport retrySupport;
    private TutorContextService service;

    @BeforeEach
    void setUp() {
        persistencePort = mock(TutorPersistencePort.class);
        TutorProperties.PersistenceProperties policy = new TutorProperties.PersistenceProperties();
        policy.setMaxAttempts(1);
        retrySupport = new PersistenceRetrySupport(policy, Executors.newSingleThreadExecutor(), millis -> {
        });
        service = new TutorContextService(persistencePort, retrySupport, AutoConfiguration.objectMapper());
    }

    @AfterEach
    void tearDown() {
        retrySupport.shutdown();
    }

    @Test
    void shouldLoadContextOnceAndCacheIt() {
        TutorContext stored = contextWithSubject("subject_1");
        when(persistencePort.loadContext(USER, "subject_1")).thenReturn(Optional.of(stored));

        TutorContext first = service.withContext(USER, "subject_1", ctx -> ctx);
        TutorContext second = service.withContext(USER, "subject_1", ctx -> ctx);

        assertSame(stored, first);
        assertSame(first, second);
        verify(persistencePort, times(1)).loadContext(USER, "subject_1");
    }

    @Test
    void shouldStartFreshWhenLoadFails() {
        when(persistencePort.loadContext(USER, "subject_1")).thenThrow(new PersistenceException("down", null));

        TutorContext context = service.withContext(USER, "subject_1", ctx -> ctx);

        assertEquals(USER, context.getUserId());
        assertTrue(context.getConversationHistory().isEmpty());
    }

    @Test
    void shouldUseDraftContextWithoutSubject() {
        TutorContext draft = service.withContext(USER, null, ctx -> ctx);

        assertEquals(USER, draft.getUserId());
        assertSame(draft, service.withContext(USER, "  ", ctx -> ctx));
        verify(persistencePort, never()).loadContext(anyString(), anyString());
    }

    @Test
    void shouldRekeyDraftContextWhenSubjectIsBound() {
        TutorContext draft = service.withContext(USER, null, ctx -> {
            ctx.setSubject(Subject.builder().id("subject_new").name("Chemistry").build());
            return ctx;
        });

        service.bind(draft, null);

        assertSame(draft, service.withContext(USER, "subject_new", ctx -> ctx));
        assertNotSame(draft, service.withContext(USER, null, ctx -> ctx));
    }

    @Test
    void shouldRejectMissingUser() {
        assertThrows(IllegalArgumentException.class, () -> service.withContext(" ", "subject_1", ctx -> ctx));
    }

    @Test
    void shouldSerializeTurnsForSameSubject() throws Exception {
        when(persistencePort.loadContext(USER, "subject_1")).thenReturn(Optional.empty());
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?>[] futures = new Future<?>[4];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = pool.submit(() -> {
                    start.await();
                    for (int j = 0; j < 250; j++) {
                        service.withContext(USER, "subject_1", ctx -> {
                            ctx.appendTurn(ConversationTurn.user("msg", Instant.EPOCH));
                            return null;
                        });
                    }
                    return null;
                });
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        int historySize = service.withContext(USER, "subject_1", ctx -> ctx.getConversationHistory().size());
        assertEquals(1000, historySize);
    }

    @Test
    void shouldSaveDetachedSnapshot() {
        TutorContext context = contextWithSubject("subject_1");

        service.saveAsync(context).join();
        context.appendTurn(ConversationTurn.user("after save", Instant.EPOCH));

        verify(persistencePort).saveContext(eq(USER), eq("subject_1"),
                argThat(saved -> saved != context
                        && saved.getConversationHistory().size() == 1));
        verify(persistencePort).saveSubject(eq(USER), any(Subject.class));
    }

    @Test
    void shouldWriteSnapshotsInOrderWhenEarlierSaveIsRetried() {
        TutorProperties.PersistenceProperties policy = new TutorProperties.PersistenceProperties();
        policy.setMaxAttempts(3);
        policy.setBaseDelay(Duration.ofMillis(50));
        PersistenceRetrySupport pooledRetry = new PersistenceRetrySupport(policy, Executors.newFixedThreadPool(2),
                Thread::sleep);
        TutorContextService pooledService = new TutorContextService(persistencePort, pooledRetry,
                AutoConfiguration.objectMapper());
        AtomicInteger calls = new AtomicInteger();
        List<Integer> written = new CopyOnWriteArrayList<>();
        doAnswer(invocation -> {
            if (calls.getAndIncrement() == 0) {
                throw new PersistenceException("storage busy", null);
            }
            TutorContext saved = invocation.getArgument(2);
            written.add(saved.getConversationHistory().size());
            return null;
        }).when(persistencePort).saveContext(eq(USER), eq("subject_1"), any(TutorContext.class));

        try {
            TutorContext context = contextWithSubject("subject_1");
            CompletableFuture<Void> first = pooledService.saveAsync(context);
            context.appendTurn(ConversationTurn.user("second", Instant.EPOCH));
            CompletableFuture<Void> second = pooledService.saveAsync(context);

            second.join();

            assertTrue(first.isDone());
            assertEquals(List.of(1, 2), written);
        } finally {
            pooledRetry.shutdown();
        }
    }

    @Test
    void shouldSkipSaveWithoutSubject() {
        TutorContext context = TutorContext.builder().userId(USER).build();

        service.saveAsync(context).join();

        verify(persistencePort, never()).saveContext(anyString(), anyString(), any());
    }

    @Test
    void findShouldReturnCopyOfCachedContext() {
        when(persistencePort.loadContext(USER, "subject_1")).thenReturn(Optional.of(contextWithSubject("subject_1")));
        TutorContext cached = service.withContext(USER, "subject_1", ctx -> ctx);

        TutorContext found = service.find(USER, "subject_1").orElseThrow();

        assertNotSame(cached, found);
        assertEquals("subject_1", found.getSubjectId());
        assertEquals(1, found.getConversationHistory().size());
    }

    private static TutorContext contextWithSubject(String subjectId) {
        TutorContext context = TutorContext.builder()
                .userId(USER)
                .subject(Subject.builder().id(subjectId).name("Algebra").build())
                .build();
        context.appendTurn(ConversationTurn.user("hello", Instant.parse("2026-03-01T10:00:00Z")));
        return context;
    }
}
