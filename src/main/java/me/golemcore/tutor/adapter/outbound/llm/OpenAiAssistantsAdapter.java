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

package me.golemcore.tutor.adapter.outbound.llm;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.Feign;
import feign.FeignException;
import feign.Param;
import feign.RequestLine;
import feign.Retryer;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tutor.domain.loop.AssistantErrorClassifier;
import me.golemcore.tutor.domain.model.AssistantInfo;
import me.golemcore.tutor.domain.model.AssistantRun;
import me.golemcore.tutor.domain.model.AssistantSpec;
import me.golemcore.tutor.domain.model.PendingToolCall;
import me.golemcore.tutor.domain.model.RunStatus;
import me.golemcore.tutor.domain.model.ToolDefinition;
import me.golemcore.tutor.domain.model.ToolOutput;
import me.golemcore.tutor.infrastructure.config.TutorProperties;
import me.golemcore.tutor.infrastructure.http.FeignClientFactory;
import me.golemcore.tutor.port.outbound.AssistantServiceException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Assistant adapter for the OpenAI Assistants v2 REST API using Feign +
 * OkHttp.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code tutor.llm.openai.api-key} - API key for authentication
 * <li>{@code tutor.llm.openai.base-url} - Base URL of the API
 * </ul>
 *
 * <p>
 * Provider ID: {@code "openai-assistants"}
 *
 * <p>
 * Lazy initialization: the Feign client is built on first use.
 *
 * @see AssistantProviderAdapter
 * @see FeignClientFactory
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAiAssistantsAdapter implements AssistantProviderAdapter {

    public static final String PROVIDER_ID = "openai-assistants";

    private static final String ASSISTANTS_BETA = "assistants=v2";

    private final TutorProperties properties;
    private final FeignClientFactory feignClientFactory;

    private volatile AssistantsApi client;

    private synchronized AssistantsApi client() {
        if (client == null) {
            TutorProperties.OpenAiProperties openai = properties.getLlm().getOpenai();
            String apiKey = openai.getApiKey();
            Feign.Builder builder = Feign.builder()
                    .retryer(Retryer.NEVER_RETRY)
                    .requestInterceptor(template -> template
                            .header("Authorization", "Bearer " + apiKey)
                            .header("OpenAI-Beta", ASSISTANTS_BETA)
                            .header("Content-Type", "application/json"));
            client = feignClientFactory.create(AssistantsApi.class, openai.getBaseUrl(), builder);
            log.info("[Assistant] OpenAI Assistants adapter initialized with URL: {}", openai.getBaseUrl());
        }
        return client;
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getOpenai().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String createThread() {
        return call("create thread", () -> client().createThread(Map.of()).getId());
    }

    @Override
    public boolean threadExists(String threadId) {
        return lookup("retrieve thread", () -> client().retrieveThread(threadId)).isPresent();
    }

    @Override
    public void deleteThread(String threadId) {
        call("delete thread", () -> client().deleteThread(threadId));
    }

    @Override
    public void addUserMessage(String threadId, String content) {
        MessageRequest request = new MessageRequest();
        request.setRole("user");
        request.setContent(content);
        call("add message", () -> client().createMessage(threadId, request));
    }

    @Override
    public AssistantInfo createAssistant(AssistantSpec spec) {
        AssistantRequest request = new AssistantRequest();
        request.setName(spec.getName());
        request.setInstructions(spec.getInstructions());
        request.setModel(spec.getModel());
        request.setTools(spec.getTools() != null
                ? spec.getTools().stream().map(OpenAiAssistantsAdapter::toApiTool).toList()
                : List.of());
        ApiAssistant created = call("create assistant", () -> client().createAssistant(request));
        return new AssistantInfo(created.getId(), created.getName(), created.getModel());
    }

    @Override
    public Optional<AssistantInfo> retrieveAssistant(String assistantId) {
        return lookup("retrieve assistant", () -> client().retrieveAssistant(assistantId))
                .map(assistant -> new AssistantInfo(assistant.getId(), assistant.getName(), assistant.getModel()));
    }

    @Override
    public void deleteAssistant(String assistantId) {
        call("delete assistant", () -> client().deleteAssistant(assistantId));
    }

    @Override
    public AssistantRun startRun(String threadId, String assistantId, String additionalInstructions) {
        RunRequest request = new RunRequest();
        request.setAssistantId(assistantId);
        if (additionalInstructions != null && !additionalInstructions.isBlank()) {
            request.setAdditionalInstructions(additionalInstructions);
        }
        return toRun(call("create run", () -> client().createRun(threadId, request)));
    }

    @Override
    public AssistantRun retrieveRun(String threadId, String runId) {
        return toRun(call("retrieve run", () -> client().retrieveRun(threadId, runId)));
    }

    @Override
    public AssistantRun submitToolOutputs(String threadId, String runId, List<ToolOutput> outputs) {
        SubmitToolOutputsRequest request = new SubmitToolOutputsRequest();
        request.setToolOutputs(outputs.stream().map(output -> {
            ApiToolOutput apiOutput = new ApiToolOutput();
            apiOutput.setToolCallId(output.toolCallId());
            apiOutput.setOutput(output.output());
            return apiOutput;
        }).toList());
        return toRun(call("submit tool outputs", () -> client().submitToolOutputs(threadId, runId, request)));
    }

    @Override
    public Optional<String> latestAssistantText(String threadId) {
        MessageList messages = call("list messages", () -> client().listMessages(threadId, 10));
        if (messages == null || messages.getData() == null) {
            return Optional.empty();
        }
        return messages.getData().stream()
                .filter(message -> "assistant".equals(message.getRole()))
                .findFirst()
                .map(OpenAiAssistantsAdapter::textOf)
                .filter(text -> !text.isBlank());
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (FeignException e) {
            String code = AssistantErrorClassifier.classifyHttpStatus(e.status(), e.contentUTF8());
            throw new AssistantServiceException(code, operation + " failed with HTTP " + e.status(), e);
        } catch (RuntimeException e) { // NOSONAR - every transport failure gets a reason code
            throw AssistantErrorClassifier.wrap(operation, e);
        }
    }

    private <T> Optional<T> lookup(String operation, Supplier<T> action) {
        try {
            return Optional.ofNullable(call(operation, action));
        } catch (AssistantServiceException e) {
            if (e.getCause() instanceof FeignException.NotFound) {
                return Optional.empty();
            }
            throw e;
        }
    }

    private static ApiTool toApiTool(ToolDefinition definition) {
        ApiFunctionDefinition function = new ApiFunctionDefinition();
        function.setName(definition.getName());
        function.setDescription(definition.getDescription());
        function.setParameters(definition.getInputSchema());
        ApiTool tool = new ApiTool();
        tool.setType("function");
        tool.setFunction(function);
        return tool;
    }

    private static AssistantRun toRun(ApiRun run) {
        List<PendingToolCall> calls = new ArrayList<>();
        if (run.getRequiredAction() != null && run.getRequiredAction().getSubmitToolOutputs() != null
                && run.getRequiredAction().getSubmitToolOutputs().getToolCalls() != null) {
            for (ApiToolCall toolCall : run.getRequiredAction().getSubmitToolOutputs().getToolCalls()) {
                calls.add(PendingToolCall.builder()
                        .id(toolCall.getId())
                        .name(toolCall.getFunction() != null ? toolCall.getFunction().getName() : null)
                        .arguments(toolCall.getFunction() != null ? toolCall.getFunction().getArguments() : null)
                        .build());
            }
        }
        return AssistantRun.builder()
                .id(run.getId())
                .threadId(run.getThreadId())
                .status(run.getStatus() != null ? RunStatus.fromValue(run.getStatus()) : null)
                .requiredToolCalls(calls)
                .lastErrorCode(run.getLastError() != null ? run.getLastError().getCode() : null)
                .lastErrorMessage(run.getLastError() != null ? run.getLastError().getMessage() : null)
                .build();
    }

    private static String textOf(ApiMessage message) {
        if (message.getContent() == null) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (ApiContentPart part : message.getContent()) {
            if ("text".equals(part.getType()) && part.getText() != null && part.getText().getValue() != null) {
                if (!text.isEmpty()) {
                    text.append('\n');
                }
                text.append(part.getText().getValue());
            }
        }
        return text.toString();
    }

    // Feign API interface
    public interface AssistantsApi {

        @RequestLine("POST /threads")
        ApiObject createThread(Map<String, Object> body);

        @RequestLine("GET /threads/{threadId}")
        ApiObject retrieveThread(@Param("threadId") String threadId);

        @RequestLine("DELETE /threads/{threadId}")
        ApiObject deleteThread(@Param("threadId") String threadId);

        @RequestLine("POST /threads/{threadId}/messages")
        ApiObject createMessage(@Param("threadId") String threadId, MessageRequest request);

        @RequestLine("GET /threads/{threadId}/messages?order=desc&limit={limit}")
        MessageList listMessages(@Param("threadId") String threadId, @Param("limit") int limit);

        @RequestLine("POST /assistants")
        ApiAssistant createAssistant(AssistantRequest request);

        @RequestLine("GET /assistants/{assistantId}")
        ApiAssistant retrieveAssistant(@Param("assistantId") String assistantId);

        @RequestLine("DELETE /assistants/{assistantId}")
        ApiObject deleteAssistant(@Param("assistantId") String assistantId);

        @RequestLine("POST /threads/{threadId}/runs")
        ApiRun createRun(@Param("threadId") String threadId, RunRequest request);

        @RequestLine("GET /threads/{threadId}/runs/{runId}")
        ApiRun retrieveRun(@Param("threadId") String threadId, @Param("runId") String runId);

        @RequestLine("POST /threads/{threadId}/runs/{runId}/submit_tool_outputs")
        ApiRun submitToolOutputs(@Param("threadId") String threadId, @Param("runId") String runId,
                SubmitToolOutputsRequest request);
    }

    // API DTOs
    @Data
    public static class ApiObject {
        private String id;
        private String object;
        private Boolean deleted;
    }

    @Data
    public static class MessageRequest {
        private String role;
        private String content;
    }

    @Data
    public static class MessageList {
        private List<ApiMessage> data;
    }

    @Data
    public static class ApiMessage {
        private String id;
        private String role;
        private List<ApiContentPart> content;
    }

    @Data
    public static class ApiContentPart {
        private String type;
        private ApiText text;
    }

    @Data
    public static class ApiText {
        private String value;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class AssistantRequest {
        private String name;
        private String instructions;
        private String model;
        private List<ApiTool> tools;
    }

    @Data
    public static class ApiAssistant {
        private String id;
        private String name;
        private String model;
    }

    @Data
    public static class ApiTool {
        private String type;
        private ApiFunctionDefinition function;
    }

    @Data
    public static class ApiFunctionDefinition {
        private String name;
        private String description;
        private Map<String, Object> parameters;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RunRequest {
        @JsonProperty("assistant_id")
        private String assistantId;
        @JsonProperty("additional_instructions")
        private String additionalInstructions;
    }

    @Data
    public static class ApiRun {
        private String id;
        @JsonProperty("thread_id")
        private String threadId;
        private String status;
        @JsonProperty("required_action")
        private ApiRequiredAction requiredAction;
        @JsonProperty("last_error")
        private ApiError lastError;
    }

    @Data
    public static class ApiRequiredAction {
        private String type;
        @JsonProperty("submit_tool_outputs")
        private ApiSubmitToolOutputs submitToolOutputs;
    }

    @Data
    public static class ApiSubmitToolOutputs {
        @JsonProperty("tool_calls")
        private List<ApiToolCall> toolCalls;
    }

    @Data
    public static class ApiToolCall {
        private String id;
        private String type;
        private ApiFunctionCall function;
    }

    @Data
    public static class ApiFunctionCall {
        private String name;
        private String arguments;
    }

    @Data
    public static class ApiError {
        private String code;
        private String message;
    }

    @Data
    public static class SubmitToolOutputsRequest {
        @JsonProperty("tool_outputs")
        private List<ApiToolOutput> toolOutputs;
    }

    @Data
    public static class ApiToolOutput {
        @JsonProperty("tool_call_id")
        private String toolCallId;
        private String output;
    }
}
