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

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
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
import me.golemcore.tutor.port.outbound.AssistantServiceException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

/**
 * Assistant adapter that emulates threads, assistants and runs in process on
 * top of a langchain4j {@link ChatModel}.
 *
 * <p>
 * Supported providers:
 * <ul>
 * <li>OpenAI (and OpenAI-compatible endpoints) - models without a prefix or
 * with {@code openai/}
 * <li>Anthropic - models prefixed with {@code anthropic/}
 * </ul>
 *
 * <p>
 * A run executes synchronously when it is started or when tool outputs are
 * submitted, so {@link #retrieveRun} always returns a settled status. Threads
 * and assistants live in memory only; a persisted session handle does not
 * survive a restart and is recreated on the next turn.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@Slf4j
public class Langchain4jAssistantAdapter implements AssistantProviderAdapter {

    public static final String PROVIDER_ID = "langchain4j";

    private static final String PROVIDER_OPENAI = "openai";
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";

    private final TutorProperties properties;
    private final BiFunction<String, TutorProperties.ProviderProperties, ChatModel> modelFactory;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();
    private final Map<String, EmulatedAssistant> assistants = new ConcurrentHashMap<>();
    private final Map<String, EmulatedThread> threads = new ConcurrentHashMap<>();

    @Autowired
    public Langchain4jAssistantAdapter(TutorProperties properties) {
        this.properties = properties;
        this.modelFactory = this::createModel;
    }

    Langchain4jAssistantAdapter(TutorProperties properties,
            BiFunction<String, TutorProperties.ProviderProperties, ChatModel> modelFactory) {
        this.properties = properties;
        this.modelFactory = modelFactory;
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        return properties.getLlm().getLangchain4j().getProviders().values().stream()
                .anyMatch(provider -> provider.getApiKey() != null && !provider.getApiKey().isBlank());
    }

    @Override
    public String createThread() {
        String id = "thread_" + UUID.randomUUID();
        threads.put(id, new EmulatedThread());
        return id;
    }

    @Override
    public boolean threadExists(String threadId) {
        return threadId != null && threads.containsKey(threadId);
    }

    @Override
    public void deleteThread(String threadId) {
        threads.remove(threadId);
    }

    @Override
    public void addUserMessage(String threadId, String content) {
        EmulatedThread thread = thread(threadId);
        synchronized (thread) {
            thread.messages.add(UserMessage.from(content));
        }
    }

    @Override
    public AssistantInfo createAssistant(AssistantSpec spec) {
        String provider = providerOf(spec.getModel());
        TutorProperties.ProviderProperties config = properties.getLlm().getLangchain4j().getProviders().get(provider);
        if (config == null || config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new AssistantServiceException(AssistantErrorClassifier.MODEL_UNAVAILABLE,
                    "No API key configured for provider '" + provider + "' (model " + spec.getModel() + ")");
        }

        ChatModel model;
        try {
            model = models.computeIfAbsent(spec.getModel(), name -> modelFactory.apply(name, config));
        } catch (RuntimeException e) { // NOSONAR - builder failures mean the model is unusable
            throw AssistantErrorClassifier.wrap("create model " + spec.getModel(), e);
        }

        String id = "asst_" + UUID.randomUUID();
        List<ToolSpecification> tools = spec.getTools() != null
                ? spec.getTools().stream().map(Langchain4jAssistantAdapter::toToolSpecification).toList()
                : List.of();
        assistants.put(id, new EmulatedAssistant(id, spec.getName(), spec.getModel(), spec.getInstructions(),
                tools, model));
        log.debug("[Assistant] Emulated assistant {} on model {} with {} tools", id, spec.getModel(), tools.size());
        return new AssistantInfo(id, spec.getName(), spec.getModel());
    }

    @Override
    public Optional<AssistantInfo> retrieveAssistant(String assistantId) {
        EmulatedAssistant assistant = assistantId != null ? assistants.get(assistantId) : null;
        return Optional.ofNullable(assistant).map(a -> new AssistantInfo(a.id(), a.name(), a.modelName()));
    }

    @Override
    public void deleteAssistant(String assistantId) {
        assistants.remove(assistantId);
    }

    @Override
    public AssistantRun startRun(String threadId, String assistantId, String additionalInstructions) {
        EmulatedThread thread = thread(threadId);
        EmulatedAssistant assistant = assistants.get(assistantId);
        if (assistant == null) {
            throw new AssistantServiceException(AssistantErrorClassifier.ASSISTANT_MISSING,
                    "No assistant found with id '" + assistantId + "'");
        }

        EmulatedRun run = new EmulatedRun("run_" + UUID.randomUUID(), threadId, assistant, additionalInstructions);
        synchronized (thread) {
            thread.runs.put(run.id, run);
            advance(thread, run);
        }
        return run.snapshot();
    }

    @Override
    public AssistantRun retrieveRun(String threadId, String runId) {
        EmulatedThread thread = thread(threadId);
        synchronized (thread) {
            return run(thread, runId).snapshot();
        }
    }

    @Override
    public AssistantRun submitToolOutputs(String threadId, String runId, List<ToolOutput> outputs) {
        EmulatedThread thread = thread(threadId);
        synchronized (thread) {
            EmulatedRun run = run(thread, runId);
            if (run.status != RunStatus.REQUIRES_ACTION) {
                throw new AssistantServiceException(AssistantErrorClassifier.INVALID_REQUEST,
                        "Run " + runId + " is not waiting for tool outputs");
            }
            Map<String, String> toolNames = new HashMap<>();
            for (ToolExecutionRequest request : run.pending) {
                toolNames.put(request.id(), request.name());
            }
            for (ToolOutput output : outputs) {
                thread.messages.add(ToolExecutionResultMessage.from(output.toolCallId(),
                        toolNames.getOrDefault(output.toolCallId(), "unknown"), output.output()));
            }
            run.pending = List.of();
            advance(thread, run);
            return run.snapshot();
        }
    }

    @Override
    public Optional<String> latestAssistantText(String threadId) {
        EmulatedThread thread = threads.get(threadId);
        if (thread == null) {
            return Optional.empty();
        }
        synchronized (thread) {
            return Optional.ofNullable(thread.latestText).filter(text -> !text.isBlank());
        }
    }

    private void advance(EmulatedThread thread, EmulatedRun run) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(systemPrompt(run)));
        messages.addAll(thread.messages);

        ChatRequest.Builder request = ChatRequest.builder().messages(messages);
        if (!run.assistant.tools().isEmpty()) {
            request.toolSpecifications(run.assistant.tools());
        }

        ChatResponse response;
        try {
            response = run.assistant.model().chat(request.build());
        } catch (RuntimeException e) { // NOSONAR - classified for the orchestrator
            run.status = RunStatus.FAILED;
            String code = AssistantErrorClassifier.classifyFromThrowable(e);
            run.lastErrorCode = code;
            run.lastErrorMessage = e.getMessage();
            throw AssistantErrorClassifier.wrap("run " + run.id, e);
        }

        AiMessage aiMessage = response.aiMessage();
        thread.messages.add(aiMessage);
        if (aiMessage.hasToolExecutionRequests()) {
            run.pending = List.copyOf(aiMessage.toolExecutionRequests());
            run.status = RunStatus.REQUIRES_ACTION;
            log.debug("[Assistant] Run {} requested {} tool calls", run.id, run.pending.size());
        } else {
            thread.latestText = aiMessage.text();
            run.status = RunStatus.COMPLETED;
        }
    }

    private static String systemPrompt(EmulatedRun run) {
        String instructions = run.assistant.instructions() != null ? run.assistant.instructions() : "";
        if (run.additionalInstructions == null || run.additionalInstructions.isBlank()) {
            return instructions;
        }
        return instructions + "\n\n" + run.additionalInstructions;
    }

    private EmulatedThread thread(String threadId) {
        EmulatedThread thread = threadId != null ? threads.get(threadId) : null;
        if (thread == null) {
            throw new AssistantServiceException(AssistantErrorClassifier.THREAD,
                    "No thread found with id '" + threadId + "'");
        }
        return thread;
    }

    private static EmulatedRun run(EmulatedThread thread, String runId) {
        EmulatedRun run = thread.runs.get(runId);
        if (run == null) {
            throw new AssistantServiceException(AssistantErrorClassifier.RUN_FAILED,
                    "No run found with id '" + runId + "'");
        }
        return run;
    }

    static String providerOf(String model) {
        if (model != null && model.contains("/")) {
            return model.substring(0, model.indexOf('/'));
        }
        return PROVIDER_OPENAI;
    }

    private static String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    private ChatModel createModel(String model, TutorProperties.ProviderProperties config) {
        TutorProperties.Langchain4jProperties settings = properties.getLlm().getLangchain4j();
        String modelName = stripProviderPrefix(model);
        Duration timeout = Duration.ofMillis(settings.getTimeoutMs());

        if (PROVIDER_ANTHROPIC.equals(providerOf(model))) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0)
                    .maxTokens(4096)
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            if (settings.getTemperature() != null) {
                builder.temperature(settings.getTemperature());
            }
            return builder.build();
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .timeout(timeout);
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (settings.getTemperature() != null) {
            builder.temperature(settings.getTemperature());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    static ToolSpecification toToolSpecification(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> props) {
            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            for (Map.Entry<?, ?> entry : props.entrySet()) {
                schemaBuilder.addProperty(String.valueOf(entry.getKey()),
                        toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
            if (schema.get("required") instanceof List<?> required && !required.isEmpty()) {
                schemaBuilder.required(required.stream().map(String::valueOf).toList());
            }
            builder.parameters(schemaBuilder.build());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private static JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = paramSchema.get("type") instanceof String t ? t : "string";
        String description = paramSchema.get("description") instanceof String d && !d.isBlank() ? d : null;

        if (paramSchema.get("enum") instanceof List<?> enumValues && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder()
                    .enumValues(enumValues.stream().map(String::valueOf).toList())
                    .description(description)
                    .build();
        }

        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (paramSchema.get("items") instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            yield builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            if (paramSchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                for (Map.Entry<?, ?> entry : nested.entrySet()) {
                    builder.addProperty(String.valueOf(entry.getKey()),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield builder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    private record EmulatedAssistant(String id, String name, String modelName, String instructions,
            List<ToolSpecification> tools, ChatModel model) {
    }

    private static final class EmulatedThread {
        private final List<ChatMessage> messages = new ArrayList<>();
        private final Map<String, EmulatedRun> runs = new ConcurrentHashMap<>();
        private String latestText;
    }

    private static final class EmulatedRun {
        private final String id;
        private final String threadId;
        private final EmulatedAssistant assistant;
        private final String additionalInstructions;
        private RunStatus status = RunStatus.QUEUED;
        private List<ToolExecutionRequest> pending = List.of();
        private String lastErrorCode;
        private String lastErrorMessage;

        private EmulatedRun(String id, String threadId, EmulatedAssistant assistant, String additionalInstructions) {
            this.id = id;
            this.threadId = threadId;
            this.assistant = assistant;
            this.additionalInstructions = additionalInstructions;
        }

        private AssistantRun snapshot() {
            return AssistantRun.builder()
                    .id(id)
                    .threadId(threadId)
                    .status(status)
                    .requiredToolCalls(pending.stream()
                            .map(request -> PendingToolCall.builder()
                                    .id(request.id())
                                    .name(request.name())
                                    .arguments(request.arguments())
                                    .build())
                            .toList())
                    .lastErrorCode(lastErrorCode)
                    .lastErrorMessage(lastErrorMessage)
                    .build();
        }
    }
}
