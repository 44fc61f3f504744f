package me.golemcore.tutor.domain.loop;

import me.golemcore.tutor.domain.model.RetryAffordance;
import me.golemcore.tutor.domain.model.Subject;
import me.golemcore.tutor.domain.model.ToolFailureKind;
import me.golemcore.tutor.domain.model.ToolResult;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.domain.model.TutorResponse;
import me.golemcore.tutor.domain.model.TutorToolName;
import me.golemcore.tutor.domain.service.SubjectClassifier;
import me.golemcore.tutor.domain.service.ToolDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FallbackResponderTest {

    private ToolDispatcher toolDispatcher;
    private FallbackResponder responder;
    private RetryAffordance retry;

    @BeforeEach
    void setUp() {
        toolDispatcher = mock(ToolDispatcher.class);
        responder = new FallbackResponder(new SubjectClassifier(), toolDispatcher, Clock.systemUTC());
        retry = new RetryAffordance("send_message", Map.of("message", "hello"));
    }

    @Test
    void shouldStartSubjectNamedInMessage() {
        TutorContext context = TutorContext.builder().userId("user-1").build();
        when(toolDispatcher.dispatch(eq("new_subject"), anyMap(), eq(context))).thenAnswer(invocation -> {
            context.setSubject(Subject.builder().id("subject_1").name("Math").build());
            return ToolResult.success(Map.of("success", true));
        });

        TutorResponse response = responder.respond(context, "I want to learn math", "assistant.not_configured",
                retry);

        assertTrue(response.isDegraded());
        assertEquals("I'll help you learn Math. Let's get started!", response.getResponseText());
        assertEquals(TutorToolName.NEW_SUBJECT, response.getToolCalls().get(0).getName());
        assertEquals("Math", response.getToolCalls().get(0).getParameters().get("name"));
        assertEquals(1, context.getConversationHistory().size());
    }

    @Test
    void shouldApologizeWhenNoSubjectDetected() {
        TutorContext context = TutorContext.builder().userId("user-1").build();

        TutorResponse response = responder.respond(context, "hello there", "assistant.rate_limit", retry);

        assertEquals(FallbackResponder.APOLOGY, response.getResponseText());
        assertEquals("assistant.rate_limit", response.getErrorCode());
        assertSame(retry, response.getRetry());
        verify(toolDispatcher, never()).dispatch(anyString(), anyMap(), any());
    }

    @Test
    void shouldNotStartSecondSubject() {
        TutorContext context = TutorContext.builder()
                .userId("user-1")
                .subject(Subject.builder().id("subject_1").name("History").build())
                .build();

        TutorResponse response = responder.respond(context, "I want to learn math", "assistant.timeout", retry);

        assertEquals(FallbackResponder.APOLOGY, response.getResponseText());
        verify(toolDispatcher, never()).dispatch(anyString(), anyMap(), any());
    }

    @Test
    void shouldApologizeWhenSubjectCreationFails() {
        TutorContext context = TutorContext.builder().userId("user-1").build();
        when(toolDispatcher.dispatch(eq("new_subject"), anyMap(), eq(context)))
                .thenReturn(ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "disk full"));

        TutorResponse response = responder.respond(context, "teach me chemistry", null, retry);

        assertEquals(FallbackResponder.APOLOGY, response.getResponseText());
    }

    @Test
    void shouldNeverThrow() {
        TutorContext context = TutorContext.builder().userId("user-1").build();
        when(toolDispatcher.dispatch(anyString(), anyMap(), any())).thenThrow(new IllegalStateException("boom"));

        TutorResponse response = responder.respond(context, "teach me chemistry", "assistant.error.unknown", retry);

        assertTrue(response.isDegraded());
        assertEquals(FallbackResponder.APOLOGY, response.getResponseText());
    }
}
