package me.golemcore.tutor.domain.loop;

import me.golemcore.tutor.domain.content.ContentNormalizer;
import me.golemcore.tutor.domain.content.DiversitySelector;
import me.golemcore.tutor.domain.content.MasteryEvaluator;
import me.golemcore.tutor.domain.model.AssistantRun;
import me.golemcore.tutor.domain.model.ContentType;
import me.golemcore.tutor.domain.model.Lesson;
import me.golemcore.tutor.domain.model.LessonPlan;
import me.golemcore.tutor.domain.model.PendingToolCall;
import me.golemcore.tutor.domain.model.RunStatus;
import me.golemcore.tutor.domain.model.SessionHandle;
import me.golemcore.tutor.domain.model.Subject;
import me.golemcore.tutor.domain.model.ToolOutput;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.domain.model.TutorResponse;
import me.golemcore.tutor.domain.model.TutorToolName;
import me.golemcore.tutor.domain.model.TutorTurnRequest;
import me.golemcore.tutor.domain.service.AssistantSessionManager;
import me.golemcore.tutor.domain.service.LessonPlanService;
import me.golemcore.tutor.domain.service.PersistenceRetrySupport;
import me.golemcore.tutor.domain.service.SubjectClassifier;
import me.golemcore.tutor.domain.service.SubjectService;
import me.golemcore.tutor.domain.service.ToolDispatcher;
import me.golemcore.tutor.domain.service.TutorContextService;
import me.golemcore.tutor.infrastructure.config.AutoConfiguration;
import me.golemcore.tutor.infrastructure.config.TutorProperties;
import me.golemcore.tutor.port.outbound.AssistantPort;
import me.golemcore.tutor.port.outbound.AssistantServiceException;
import me.golemcore.tutor.port.outbound.TutorPersistencePort;
import me.golemcore.tutor.tools.ClarifyingQuestionTool;
import me.golemcore.tutor.tools.InteractiveComponentTool;
import me.golemcore.tutor.tools.NewSubjectTool;
import me.golemcore.tutor.tools.NextLessonTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TutorOrchestratorTest {

    private static final String USER = "user-1";
    private static final String SUBJECT_ID = "subject_1";
    private static final String THREAD_ID = "thread_1";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private AssistantPort assistantPort;
    private AssistantSessionManager sessionManager;
    private TutorPersistencePort persistencePort;
    private SubjectService subjectService;
    private TutorProperties properties;
    private TutorOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        assistantPort = mock(AssistantPort.class);
        sessionManager = mock(AssistantSessionManager.class);
        persistencePort = mock(TutorPersistencePort.class);
        subjectService = mock(SubjectService.class);
        properties = new TutorProperties();
        properties.getPersistence().setMaxAttempts(1);

        ObjectMapper objectMapper = AutoConfiguration.objectMapper();
        TutorContextService contextService = new TutorContextService(persistencePort,
                new PersistenceRetrySupport(properties), objectMapper);
        ContentNormalizer contentNormalizer = new ContentNormalizer(CLOCK);
        ToolDispatcher toolDispatcher = new ToolDispatcher(List.of(
                new ClarifyingQuestionTool(),
                new InteractiveComponentTool(contentNormalizer),
                new NewSubjectTool(subjectService),
                new NextLessonTool(new LessonPlanService(new MasteryEvaluator(), CLOCK), contentNormalizer,
                        new DiversitySelector(new Random(7)))), objectMapper);
        RunPoller runPoller = new RunPoller(assistantPort, properties.getRun(), millis -> {
        });

        orchestrator = new TutorOrchestrator(assistantPort, sessionManager, runPoller, toolDispatcher,
                contextService, subjectService, contentNormalizer, new ContextualInstructionsBuilder(),
                new AmbiguityGuard(properties),
                new FallbackResponder(new SubjectClassifier(), toolDispatcher, CLOCK),
                new InteractionMessageBuilder(new DiversitySelector(new Random(3)), objectMapper),
                properties, CLOCK);

        when(sessionManager.awaitInitialization(any(), any())).thenReturn(true);
        when(sessionManager.getOrCreateSession(eq(SUBJECT_ID), anyString(), any())).thenReturn(SessionHandle.builder()
                .subjectId(SUBJECT_ID).threadId(THREAD_ID).assistantId("asst_1").build());
        when(assistantPort.isAvailable()).thenReturn(true);
        when(persistencePort.loadContext(USER, SUBJECT_ID)).thenReturn(Optional.of(storedContext()));
    }

    @Test
    void shouldAskClarifyingQuestionForVagueMessage() {
        TutorResponse response = orchestrator.respond(request(SUBJECT_ID, "hi"));

        assertEquals(AmbiguityGuard.CLARIFYING_QUESTION, response.getResponseText());
        assertEquals(TutorToolName.CLARIFYING_QUESTION, response.getToolCalls().get(0).getName());
        assertEquals(List.of("Explain Lesson 1: Variables", "Give me a practice question", "Summarize my progress"),
                response.getToolCalls().get(0).getResult().get("options"));
        assertFalse(response.isDegraded());
        verify(assistantPort, never()).startRun(anyString(), anyString(), any());
        assertEquals(2, response.getContext().getConversationHistory().size());
    }

    @Test
    void shouldAddExactlyOneExplainerWhenTurnProducedNoContent() {
        when(assistantPort.startRun(eq(THREAD_ID), eq("asst_1"), anyString())).thenReturn(run(RunStatus.COMPLETED));
        when(assistantPort.latestAssistantText(THREAD_ID)).thenReturn(Optional.of("Variables hold values."));

        TutorResponse response = orchestrator.respond(request(SUBJECT_ID, "What are variables used for?"));

        assertEquals("Variables hold values.", response.getResponseText());
        assertEquals(1, response.getContents().size());
        assertEquals(ContentType.EXPLAINER, response.getContents().get(0).type());
        assertEquals(1, response.getToolCalls().size());
        assertTrue(response.getToolCalls().get(0).getId().startsWith("safety_net_"));
        Lesson lesson = response.getContext().getCurrentLesson();
        assertEquals(List.of(ContentType.EXPLAINER), lesson.getRecentContentTypes());
        verify(assistantPort).addUserMessage(THREAD_ID, "What are variables used for?");
    }

    @Test
    void shouldAddExplainerAfterNextLessonEvenWhenToolProducedContent() {
        TutorContext stored = storedContext();
        stored.getLessonPlan().getLessons().get(0).setCompleted(true);
        stored.getLessonPlan().getLessons().add(Lesson.builder()
                .id("lesson_2")
                .title("Lesson 2: Equations")
                .description("Learn about equations")
                .build());
        when(persistencePort.loadContext(USER, SUBJECT_ID)).thenReturn(Optional.of(stored));
        AssistantRun requiresAction = run(RunStatus.REQUIRES_ACTION);
        requiresAction.setRequiredToolCalls(new ArrayList<>(List.of(
                new PendingToolCall("call_next", "next_lesson", "{\"current_lesson_id\":\"lesson_1\"}"))));
        when(assistantPort.startRun(eq(THREAD_ID), eq("asst_1"), anyString())).thenReturn(requiresAction);
        when(assistantPort.submitToolOutputs(eq(THREAD_ID), eq("run_1"), anyList()))
                .thenReturn(run(RunStatus.COMPLETED));
        when(assistantPort.latestAssistantText(THREAD_ID)).thenReturn(Optional.of("On to equations."));

        TutorResponse response = orchestrator.respond(request(SUBJECT_ID, "Let's move to the next lesson"));

        assertEquals(TutorToolName.NEXT_LESSON, response.getToolCalls().get(0).getName());
        assertEquals(1, response.getToolCalls().stream()
                .filter(record -> record.getId().startsWith("safety_net_"))
                .count());
        assertEquals(3, response.getContents().size());
        assertEquals(ContentType.EXPLAINER, response.getContents().get(2).type());
        assertEquals("lesson_2", response.getContext().getCurrentLesson().getId());
    }

    @Test
    void shouldSubmitAllToolOutputsOfRoundInOneRequest() {
        AssistantRun requiresAction = run(RunStatus.REQUIRES_ACTION);
        requiresAction.setRequiredToolCalls(new ArrayList<>(List.of(
                new PendingToolCall("call_a", "interactive_component",
                        "{\"type\":\"multiple-choice\",\"content\":{\"question\":\"x + 2 = 5?\"},"
                                + "\"learning_objective\":\"Solve for x\"}"),
                new PendingToolCall("call_b", "clarifying_question", "{\"question\":\"Ready for more?\"}"))));
        when(assistantPort.startRun(eq(THREAD_ID), eq("asst_1"), anyString())).thenReturn(requiresAction);
        when(assistantPort.submitToolOutputs(eq(THREAD_ID), eq("run_1"), anyList()))
                .thenReturn(run(RunStatus.COMPLETED));
        when(assistantPort.latestAssistantText(THREAD_ID)).thenReturn(Optional.of("Try this one."));

        TutorResponse response = orchestrator.respond(request(SUBJECT_ID, "Give me a practice problem"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ToolOutput>> outputs = ArgumentCaptor.forClass(List.class);
        verify(assistantPort, times(1)).submitToolOutputs(eq(THREAD_ID), eq("run_1"), outputs.capture());
        assertEquals(List.of("call_a", "call_b"),
                outputs.getValue().stream().map(ToolOutput::toolCallId).toList());
        assertEquals(2, response.getToolCalls().size());
        assertEquals(1, response.getContents().size());
        assertEquals(ContentType.MULTIPLE_CHOICE, response.getContents().get(0).type());
        assertNull(response.getErrorCode());
    }

    @Test
    void shouldStartSubjectOfflineWhenAssistantNotConfigured() {
        when(assistantPort.isAvailable()).thenReturn(false);
        when(subjectService.startSubject(any(TutorContext.class), eq("Math"), any(), any()))
                .thenAnswer(invocation -> {
                    TutorContext context = invocation.getArgument(0);
                    Subject subject = Subject.builder().id("subject_new").name("Math").build();
                    context.setSubject(subject);
                    return subject;
                });

        TutorResponse response = orchestrator.respond(request(null, "I want to learn math"));

        assertEquals("I'll help you learn Math. Let's get started!", response.getResponseText());
        assertTrue(response.isDegraded());
        assertEquals("subject_new", response.getContext().getSubjectId());
        verify(sessionManager, never()).initializeAsync(anyString(), anyString(), any());
        verify(assistantPort, never()).createThread();
    }

    @Test
    void shouldApologizeWhenAssistantNotConfiguredAndNoSubjectDetected() {
        when(assistantPort.isAvailable()).thenReturn(false);

        TutorResponse response = orchestrator.respond(request(null, "good morning tutor"));

        assertEquals(FallbackResponder.APOLOGY, response.getResponseText());
        assertEquals(AssistantErrorClassifier.NOT_CONFIGURED, response.getErrorCode());
    }

    @Test
    void shouldInitializeSessionInBackgroundForNewSubject() {
        when(subjectService.startSubject(any(TutorContext.class), eq("Chemistry"), any(), any()))
                .thenAnswer(invocation -> {
                    TutorContext context = invocation.getArgument(0);
                    Subject subject = Subject.builder().id("subject_chem").name("Chemistry").build();
                    context.setSubject(subject);
                    return subject;
                });

        orchestrator.respond(request(null, "teach me chemistry"));

        verify(sessionManager).initializeAsync("subject_chem", "Chemistry", "teach me chemistry");
    }

    @Test
    void shouldDegradeWithRetryOnRemoteFailure() {
        when(assistantPort.startRun(anyString(), anyString(), anyString()))
                .thenThrow(new AssistantServiceException(AssistantErrorClassifier.RATE_LIMIT, "slow down"));

        TutorResponse response = orchestrator.respond(request(SUBJECT_ID, "Explain variables to me"));

        assertTrue(response.isDegraded());
        assertEquals(FallbackResponder.APOLOGY, response.getResponseText());
        assertEquals(AssistantErrorClassifier.RATE_LIMIT, response.getErrorCode());
        assertEquals(TutorOrchestrator.SEND_MESSAGE_ACTION, response.getRetry().action());
        assertEquals(Map.of("message", "Explain variables to me"), response.getRetry().data());
        assertNotNull(response.getContext());
    }

    @Test
    void shouldTimeOutWithinRequestedDeadline() {
        when(assistantPort.startRun(anyString(), anyString(), anyString())).thenReturn(run(RunStatus.QUEUED));
        when(assistantPort.retrieveRun(THREAD_ID, "run_1")).thenReturn(run(RunStatus.IN_PROGRESS));
        TutorTurnRequest request = TutorTurnRequest.builder()
                .userId(USER)
                .subjectId(SUBJECT_ID)
                .message("Explain variables to me")
                .timeout(properties.getRun().getPollInterval())
                .build();

        TutorResponse response = orchestrator.respond(request);

        assertEquals(AssistantErrorClassifier.TIMEOUT, response.getErrorCode());
        verify(assistantPort, times(1)).retrieveRun(THREAD_ID, "run_1");
    }

    @Test
    void shouldClassifyFailedRun() {
        AssistantRun failed = run(RunStatus.FAILED);
        failed.setLastErrorCode("server_error");
        when(assistantPort.startRun(anyString(), anyString(), anyString())).thenReturn(failed);

        TutorResponse response = orchestrator.respond(request(SUBJECT_ID, "Explain variables to me"));

        assertEquals(AssistantErrorClassifier.SERVER_ERROR, response.getErrorCode());
    }

    @Test
    void shouldStopAfterMaxToolRounds() {
        properties.getRun().setMaxToolRounds(2);
        AssistantRun requiresAction = run(RunStatus.REQUIRES_ACTION);
        requiresAction.setRequiredToolCalls(new ArrayList<>(List.of(
                new PendingToolCall("call_a", "clarifying_question", "{\"question\":\"Again?\"}"))));
        when(assistantPort.startRun(anyString(), anyString(), anyString())).thenReturn(requiresAction);
        when(assistantPort.submitToolOutputs(anyString(), anyString(), anyList())).thenReturn(requiresAction);

        TutorResponse response = orchestrator.respond(request(SUBJECT_ID, "Explain variables to me"));

        assertEquals(AssistantErrorClassifier.RUN_FAILED, response.getErrorCode());
        verify(assistantPort, times(2)).submitToolOutputs(anyString(), anyString(), anyList());
    }

    @Test
    void shouldUsePlaceholderTextWhenAssistantSaysNothing() {
        when(assistantPort.startRun(anyString(), anyString(), anyString())).thenReturn(run(RunStatus.COMPLETED));
        when(assistantPort.latestAssistantText(THREAD_ID)).thenReturn(Optional.of("  "));

        TutorResponse response = orchestrator.respond(request(SUBJECT_ID, "Explain variables to me"));

        assertEquals(TutorOrchestrator.NO_TEXT_RESPONSE, response.getResponseText());
    }

    @Test
    void shouldTurnInteractionIntoFollowUpMessage() {
        when(assistantPort.startRun(anyString(), anyString(), anyString())).thenReturn(run(RunStatus.COMPLETED));
        when(assistantPort.latestAssistantText(THREAD_ID)).thenReturn(Optional.of("Correct!"));

        TutorResponse response = orchestrator.handleInteraction(USER, SUBJECT_ID, "answer_submitted",
                Map.of("answer", "3", "isCorrect", true));

        assertEquals("Correct!", response.getResponseText());
        assertEquals(1, response.getContext().getLearningProgress().getCorrectAnswers());
        verify(assistantPort).addUserMessage(eq(THREAD_ID),
                startsWith("I submitted my answer (answer submitted)"));
    }

    @Test
    void shouldRejectBlankInput() {
        assertThrows(IllegalArgumentException.class, () -> orchestrator.respond(request(SUBJECT_ID, " ")));
        assertThrows(IllegalArgumentException.class,
                () -> orchestrator.handleInteraction(USER, SUBJECT_ID, "", Map.of()));
    }

    private static TutorTurnRequest request(String subjectId, String message) {
        return TutorTurnRequest.builder().userId(USER).subjectId(subjectId).message(message).build();
    }

    private static AssistantRun run(RunStatus status) {
        return AssistantRun.builder().id("run_1").threadId(THREAD_ID).status(status).build();
    }

    private static TutorContext storedContext() {
        Lesson lesson = Lesson.builder()
                .id("lesson_1")
                .title("Lesson 1: Variables")
                .description("Learn about variables")
                .build();
        return TutorContext.builder()
                .userId(USER)
                .subject(Subject.builder().id(SUBJECT_ID).name("Algebra").active(true).build())
                .lessonPlan(LessonPlan.builder()
                        .subject("Algebra")
                        .lessons(new ArrayList<>(List.of(lesson)))
                        .build())
                .build();
    }
}
