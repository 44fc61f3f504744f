package me.golemcore.tutor.adapter.outbound.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.tutor.domain.loop.AssistantErrorClassifier;
import me.golemcore.tutor.domain.model.AssistantInfo;
import me.golemcore.tutor.domain.model.AssistantRun;
import me.golemcore.tutor.domain.model.AssistantSpec;
import me.golemcore.tutor.domain.model.RunStatus;
import me.golemcore.tutor.domain.model.ToolDefinition;
import me.golemcore.tutor.domain.model.ToolOutput;
import me.golemcore.tutor.infrastructure.config.AutoConfiguration;
import me.golemcore.tutor.infrastructure.config.TutorProperties;
import me.golemcore.tutor.infrastructure.http.FeignClientFactory;
import me.golemcore.tutor.port.outbound.AssistantServiceException;
import me.golemcore.tutor.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenAiAssistantsAdapterTest {

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();

    private OkHttpMockEngine engine;
    private TutorProperties properties;
    private OpenAiAssistantsAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        properties = new TutorProperties();
        properties.getLlm().getOpenai().setApiKey("sk-test");
        properties.getLlm().getOpenai().setBaseUrl("http://assistants.test/v1");
        adapter = new OpenAiAssistantsAdapter(properties, new FeignClientFactory(engine.client(), objectMapper));
    }

    @Test
    void shouldReportAvailabilityFromApiKey() {
        assertTrue(adapter.isAvailable());
        properties.getLlm().getOpenai().setApiKey(" ");
        assertFalse(adapter.isAvailable());
        assertEquals(OpenAiAssistantsAdapter.PROVIDER_ID, adapter.getProviderId());
    }

    @Test
    void shouldCreateThreadWithAssistantsHeaders() {
        engine.enqueueJson(200, "{\"id\":\"thread_abc\",\"object\":\"thread\"}");

        assertEquals("thread_abc", adapter.createThread());

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("/v1/threads", request.target());
        assertEquals("Bearer sk-test", request.header("Authorization"));
        assertEquals("assistants=v2", request.header("OpenAI-Beta"));
    }

    @Test
    void shouldCreateAssistantWithFunctionTools() throws Exception {
        engine.enqueueJson(200, "{\"id\":\"asst_1\",\"name\":\"Tutor\",\"model\":\"gpt-4o\"}");
        AssistantSpec spec = AssistantSpec.builder()
                .name("Tutor")
                .instructions("Teach well")
                .model("gpt-4o")
                .tools(List.of(ToolDefinition.builder()
                        .name("next_lesson")
                        .description("Advance")
                        .inputSchema(Map.of("type", "object"))
                        .build()))
                .build();

        AssistantInfo info = adapter.createAssistant(spec);

        assertEquals(new AssistantInfo("asst_1", "Tutor", "gpt-4o"), info);
        JsonNode body = objectMapper.readTree(engine.takeRequest().body());
        assertEquals("function", body.at("/tools/0/type").asText());
        assertEquals("next_lesson", body.at("/tools/0/function/name").asText());
        assertEquals("object", body.at("/tools/0/function/parameters/type").asText());
    }

    @Test
    void shouldMapRequiredToolCalls() throws Exception {
        engine.enqueueJson(200, """
                {"id":"run_1","thread_id":"thread_1","status":"requires_action",
                 "required_action":{"type":"submit_tool_outputs","submit_tool_outputs":{"tool_calls":[
                   {"id":"call_1","type":"function","function":{"name":"lesson_complete","arguments":"{\\"lesson_id\\":\\"lesson_1\\"}"}}
                 ]}}}
                """);

        AssistantRun run = adapter.startRun("thread_1", "asst_1", "Current lesson: Variables");

        assertEquals(RunStatus.REQUIRES_ACTION, run.getStatus());
        assertEquals(1, run.getRequiredToolCalls().size());
        assertEquals("lesson_complete", run.getRequiredToolCalls().get(0).getName());
        assertEquals("{\"lesson_id\":\"lesson_1\"}", run.getRequiredToolCalls().get(0).getArguments());
        JsonNode body = objectMapper.readTree(engine.takeRequest().body());
        assertEquals("asst_1", body.get("assistant_id").asText());
        assertEquals("Current lesson: Variables", body.get("additional_instructions").asText());
    }

    @Test
    void shouldSubmitAllOutputsInOneRequest() throws Exception {
        engine.enqueueJson(200, "{\"id\":\"run_1\",\"thread_id\":\"thread_1\",\"status\":\"queued\"}");

        AssistantRun run = adapter.submitToolOutputs("thread_1", "run_1",
                List.of(new ToolOutput("call_1", "{\"success\":true}"), new ToolOutput("call_2", "{}")));

        assertEquals(RunStatus.QUEUED, run.getStatus());
        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("/v1/threads/thread_1/runs/run_1/submit_tool_outputs", request.target());
        JsonNode outputs = objectMapper.readTree(request.body()).get("tool_outputs");
        assertEquals(2, outputs.size());
        assertEquals("call_2", outputs.get(1).get("tool_call_id").asText());
        assertEquals(1, engine.getRequestCount());
    }

    @Test
    void shouldMapRunError() {
        engine.enqueueJson(200, """
                {"id":"run_1","thread_id":"thread_1","status":"failed",
                 "last_error":{"code":"rate_limit_exceeded","message":"Too many requests"}}
                """);

        AssistantRun run = adapter.retrieveRun("thread_1", "run_1");

        assertEquals(RunStatus.FAILED, run.getStatus());
        assertEquals("rate_limit_exceeded", run.getLastErrorCode());
        assertEquals("Too many requests", run.getLastErrorMessage());
    }

    @Test
    void shouldReturnNewestAssistantText() {
        engine.enqueueJson(200, """
                {"data":[
                  {"id":"msg_3","role":"assistant","content":[
                    {"type":"text","text":{"value":"First part"}},
                    {"type":"text","text":{"value":"Second part"}}]},
                  {"id":"msg_2","role":"user","content":[{"type":"text","text":{"value":"Question"}}]},
                  {"id":"msg_1","role":"assistant","content":[{"type":"text","text":{"value":"Older"}}]}
                ]}
                """);

        Optional<String> text = adapter.latestAssistantText("thread_1");

        assertEquals(Optional.of("First part\nSecond part"), text);
        assertEquals("/v1/threads/thread_1/messages?order=desc&limit=10", engine.takeRequest().target());
    }

    @Test
    void shouldTreatMissingThreadAsAbsent() {
        engine.enqueueJson(404, "{\"error\":{\"message\":\"No thread found with id 'thread_x'.\"}}");

        assertFalse(adapter.threadExists("thread_x"));
    }

    @Test
    void shouldClassifyHttpFailures() {
        engine.enqueueJson(401, "{\"error\":{\"message\":\"Incorrect API key provided\"}}");
        engine.enqueueJson(429, "{\"error\":{\"message\":\"Rate limit reached\"}}");
        engine.enqueueJson(503, "{\"error\":{\"message\":\"Overloaded\"}}");

        assertEquals(AssistantErrorClassifier.AUTH,
                assertThrows(AssistantServiceException.class, () -> adapter.createThread()).getCode());
        assertEquals(AssistantErrorClassifier.RATE_LIMIT,
                assertThrows(AssistantServiceException.class, () -> adapter.addUserMessage("thread_1", "hi"))
                        .getCode());
        assertEquals(AssistantErrorClassifier.SERVER_ERROR,
                assertThrows(AssistantServiceException.class, () -> adapter.retrieveRun("thread_1", "run_1"))
                        .getCode());
        assertEquals(3, engine.getRequestCount());
    }
}
