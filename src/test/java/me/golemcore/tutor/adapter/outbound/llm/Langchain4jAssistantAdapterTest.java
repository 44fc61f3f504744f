package me.golemcore.tutor.adapter.outbound.llm;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import me.golemcore.tutor.domain.loop.AssistantErrorClassifier;
import me.golemcore.tutor.domain.model.AssistantInfo;
import me.golemcore.tutor.domain.model.AssistantRun;
import me.golemcore.tutor.domain.model.AssistantSpec;
import me.golemcore.tutor.domain.model.RunStatus;
import me.golemcore.tutor.domain.model.ToolDefinition;
import me.golemcore.tutor.domain.model.ToolOutput;
import me.golemcore.tutor.infrastructure.config.TutorProperties;
import me.golemcore.tutor.port.outbound.AssistantServiceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jAssistantAdapterTest {

    private TutorProperties properties;
    private ChatModel chatModel;
    private List<String> createdModels;
    private Langchain4jAssistantAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new TutorProperties();
        TutorProperties.ProviderProperties openai = new TutorProperties.ProviderProperties();
        openai.setApiKey("sk-test");
        properties.getLlm().getLangchain4j().getProviders().put("openai", openai);
        chatModel = mock(ChatModel.class);
        createdModels = new ArrayList<>();
        adapter = new Langchain4jAssistantAdapter(properties, (name, config) -> {
            createdModels.add(name);
            return chatModel;
        });
    }

    @Test
    void shouldBeAvailableOnlyWithProviderKey() {
        assertTrue(adapter.isAvailable());
        properties.getLlm().getLangchain4j().getProviders().clear();
        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldRejectModelWithoutConfiguredProvider() {
        AssistantServiceException error = assertThrows(AssistantServiceException.class,
                () -> adapter.createAssistant(spec("anthropic/claude-sonnet-4-0")));

        assertEquals(AssistantErrorClassifier.MODEL_UNAVAILABLE, error.getCode());
        assertTrue(createdModels.isEmpty());
    }

    @Test
    void shouldReuseModelAcrossAssistants() {
        AssistantInfo first = adapter.createAssistant(spec("gpt-4o"));
        adapter.createAssistant(spec("gpt-4o"));

        assertEquals(List.of("gpt-4o"), createdModels);
        assertEquals(Optional.of(first), adapter.retrieveAssistant(first.id()));
        adapter.deleteAssistant(first.id());
        assertTrue(adapter.retrieveAssistant(first.id()).isEmpty());
    }

    @Test
    void shouldCompleteRunWithPlainAnswer() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(response(AiMessage.from("Variables store values.")));
        AssistantInfo assistant = adapter.createAssistant(spec("gpt-4o"));
        String threadId = adapter.createThread();
        adapter.addUserMessage(threadId, "What is a variable?");

        AssistantRun run = adapter.startRun(threadId, assistant.id(), "Current lesson: Variables");

        assertEquals(RunStatus.COMPLETED, run.getStatus());
        assertEquals(run, adapter.retrieveRun(threadId, run.getId()));
        assertEquals(Optional.of("Variables store values."), adapter.latestAssistantText(threadId));

        ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(request.capture());
        SystemMessage system = assertInstanceOf(SystemMessage.class, request.getValue().messages().get(0));
        assertEquals("Teach well\n\nCurrent lesson: Variables", system.text());
        assertEquals(1, request.getValue().toolSpecifications().size());
    }

    @Test
    void shouldRoundTripToolCallsThroughThread() {
        ToolExecutionRequest call = ToolExecutionRequest.builder()
                .id("call_1")
                .name("next_lesson")
                .arguments("{}")
                .build();
        when(chatModel.chat(any(ChatRequest.class)))
                .thenReturn(response(AiMessage.from(call)))
                .thenReturn(response(AiMessage.from("On to lesson two.")));
        AssistantInfo assistant = adapter.createAssistant(spec("gpt-4o"));
        String threadId = adapter.createThread();
        adapter.addUserMessage(threadId, "Next please");

        AssistantRun run = adapter.startRun(threadId, assistant.id(), null);
        assertEquals(RunStatus.REQUIRES_ACTION, run.getStatus());
        assertEquals("next_lesson", run.getRequiredToolCalls().get(0).getName());

        AssistantRun finished = adapter.submitToolOutputs(threadId, run.getId(),
                List.of(new ToolOutput("call_1", "{\"success\":true}")));

        assertEquals(RunStatus.COMPLETED, finished.getStatus());
        assertTrue(finished.getRequiredToolCalls().isEmpty());
        ArgumentCaptor<ChatRequest> requests = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel, times(2)).chat(requests.capture());
        ToolExecutionResultMessage result = assertInstanceOf(ToolExecutionResultMessage.class,
                requests.getAllValues().get(1).messages().get(3));
        assertEquals("next_lesson", result.toolName());
        assertEquals("{\"success\":true}", result.text());
    }

    @Test
    void shouldRejectOutputsForSettledRun() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(response(AiMessage.from("Done.")));
        AssistantInfo assistant = adapter.createAssistant(spec("gpt-4o"));
        String threadId = adapter.createThread();
        adapter.addUserMessage(threadId, "Hello there");
        AssistantRun run = adapter.startRun(threadId, assistant.id(), null);

        AssistantServiceException error = assertThrows(AssistantServiceException.class,
                () -> adapter.submitToolOutputs(threadId, run.getId(), List.of()));

        assertEquals(AssistantErrorClassifier.INVALID_REQUEST, error.getCode());
    }

    @Test
    void shouldClassifyModelFailures() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RateLimitException("quota"));
        AssistantInfo assistant = adapter.createAssistant(spec("gpt-4o"));
        String threadId = adapter.createThread();

        AssistantServiceException error = assertThrows(AssistantServiceException.class,
                () -> adapter.startRun(threadId, assistant.id(), null));

        assertEquals(AssistantErrorClassifier.RATE_LIMIT, error.getCode());
    }

    @Test
    void shouldFailOnUnknownThreadAndAssistant() {
        assertEquals(AssistantErrorClassifier.THREAD, assertThrows(AssistantServiceException.class,
                () -> adapter.addUserMessage("thread_missing", "hi")).getCode());

        String threadId = adapter.createThread();
        assertEquals(AssistantErrorClassifier.ASSISTANT_MISSING, assertThrows(AssistantServiceException.class,
                () -> adapter.startRun(threadId, "asst_missing", null)).getCode());

        adapter.deleteThread(threadId);
        assertFalse(adapter.threadExists(threadId));
    }

    @Test
    void shouldConvertToolSchema() {
        ToolSpecification specification = Langchain4jAssistantAdapter.toToolSpecification(ToolDefinition.builder()
                .name("new_subject")
                .description("Start a subject")
                .inputSchema(Map.of(
                        "type", "object",
                        "required", List.of("name"),
                        "properties", Map.of(
                                "name", Map.of("type", "string", "description", "Subject name"),
                                "difficulty_level", Map.of("type", "string",
                                        "enum", List.of("beginner", "intermediate", "advanced")))))
                .build());

        JsonObjectSchema parameters = specification.parameters();
        assertEquals(List.of("name"), parameters.required());
        assertInstanceOf(JsonEnumSchema.class, parameters.properties().get("difficulty_level"));
        assertEquals("openai", Langchain4jAssistantAdapter.providerOf("gpt-4o"));
        assertEquals("anthropic", Langchain4jAssistantAdapter.providerOf("anthropic/claude-sonnet-4-0"));
    }

    private static AssistantSpec spec(String model) {
        return AssistantSpec.builder()
                .name("Tutor")
                .instructions("Teach well")
                .model(model)
                .tools(List.of(ToolDefinition.builder()
                        .name("next_lesson")
                        .description("Advance to the next lesson")
                        .inputSchema(Map.of("type", "object", "properties", Map.of()))
                        .build()))
                .build();
    }

    private static ChatResponse response(AiMessage message) {
        return ChatResponse.builder().aiMessage(message).build();
    }
}
