package me.golemcore.tutor.domain.loop;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tutor.domain.content.ContentNormalizer;
import me.golemcore.tutor.domain.content.ContentOutputs;
import me.golemcore.tutor.domain.model.AssistantRun;
import me.golemcore.tutor.domain.model.ContentType;
import me.golemcore.tutor.domain.model.ConversationTurn;
import me.golemcore.tutor.domain.model.InteractiveContent;
import me.golemcore.tutor.domain.model.LearnerLevel;
import me.golemcore.tutor.domain.model.Lesson;
import me.golemcore.tutor.domain.model.RetryAffordance;
import me.golemcore.tutor.domain.model.RunStatus;
import me.golemcore.tutor.domain.model.SessionHandle;
import me.golemcore.tutor.domain.model.Subject;
import me.golemcore.tutor.domain.model.ToolCallRecord;
import me.golemcore.tutor.domain.model.ToolDispatchResult;
import me.golemcore.tutor.domain.model.ToolOutput;
import me.golemcore.tutor.domain.model.ToolResult;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.domain.model.TutorContextOverrides;
import me.golemcore.tutor.domain.model.TutorResponse;
import me.golemcore.tutor.domain.model.TutorToolName;
import me.golemcore.tutor.domain.model.TutorTurnRequest;
import me.golemcore.tutor.domain.service.AssistantSessionManager;
import me.golemcore.tutor.domain.service.SessionCreationException;
import me.golemcore.tutor.domain.service.SubjectService;
import me.golemcore.tutor.domain.service.ToolDispatcher;
import me.golemcore.tutor.domain.service.TutorContextService;
import me.golemcore.tutor.infrastructure.config.TutorProperties;
import me.golemcore.tutor.port.outbound.AssistantPort;
import me.golemcore.tutor.port.outbound.AssistantServiceException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Runs one learner turn against the subject's assistant.
 *
 * <p>
 * A turn holds the subject's context lock from the moment the user message
 * is appended until the updated context has been handed to persistence.
 * Remote failures of any kind end in the degraded fallback; the learner
 * always gets a text response.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TutorOrchestrator {

    static final String SEND_MESSAGE_ACTION = "send_message";
    static final String NO_TEXT_RESPONSE = "Unable to generate a response. Check server logs for details.";

    private final AssistantPort assistantPort;
    private final AssistantSessionManager sessionManager;
    private final RunPoller runPoller;
    private final ToolDispatcher toolDispatcher;
    private final TutorContextService contextService;
    private final SubjectService subjectService;
    private final ContentNormalizer contentNormalizer;
    private final ContextualInstructionsBuilder instructionsBuilder;
    private final AmbiguityGuard ambiguityGuard;
    private final FallbackResponder fallbackResponder;
    private final InteractionMessageBuilder interactionMessageBuilder;
    private final TutorProperties properties;
    private final Clock clock;

    public TutorResponse respond(TutorTurnRequest request) {
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            throw new IllegalArgumentException("message is required");
        }
        awaitPendingSession(request.getSubjectId());

        Map<String, Object> retryData = new LinkedHashMap<>();
        retryData.put("message", request.getMessage());
        RetryAffordance retry = new RetryAffordance(SEND_MESSAGE_ACTION, retryData);
        return contextService.withContext(request.getUserId(), request.getSubjectId(),
                context -> runTurn(context, request.getMessage(), request.getOverrides(), retry,
                        request.getTimeout()));
    }

    /**
     * Feed a rendering-layer interaction event back into the conversation as
     * a synthesized follow-up message.
     */
    public TutorResponse handleInteraction(String userId, String subjectId, String action,
            Map<String, Object> data) {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action is required");
        }
        awaitPendingSession(subjectId);

        RetryAffordance retry = new RetryAffordance(action, data != null ? new LinkedHashMap<>(data) : Map.of());
        return contextService.withContext(userId, subjectId, context -> {
            String message = interactionMessageBuilder.build(context, action, data);
            log.debug("[Orchestrator] Interaction '{}' -> {}", action, message);
            return runTurn(context, message, null, retry, null);
        });
    }

    private void awaitPendingSession(String subjectId) {
        if (!sessionManager.awaitInitialization(subjectId, properties.getSession().getInitTimeout())) {
            log.warn("[Orchestrator] Proceeding without waiting for session of {}", subjectId);
        }
    }

    private TutorResponse runTurn(TutorContext context, String message, TutorContextOverrides overrides,
            RetryAffordance retry, Duration runTimeout) {
        String subjectBefore = context.getSubjectId();
        if (overrides != null) {
            overrides.applyTo(context);
        }
        int historyBefore = context.getConversationHistory().size();
        context.appendTurn(ConversationTurn.user(message, Instant.now(clock)));

        boolean remoteReady = assistantPort.isAvailable() && context.hasSubject();
        TutorResponse response = null;
        if (!remoteReady) {
            response = fallbackResponder.tryStartSubject(context, message).orElse(null);
        }
        if (response == null && ambiguityGuard.isAmbiguous(message)) {
            response = clarify(context);
        }
        if (response == null && !remoteReady) {
            String code = assistantPort.isAvailable() ? "tutor.no_subject" : AssistantErrorClassifier.NOT_CONFIGURED;
            log.info("[Orchestrator] Remote turn skipped ({}), using fallback", code);
            response = fallbackResponder.respond(context, message, code, retry);
        }
        if (response == null) {
            response = converseOrFallback(context, message, historyBefore, retry, runTimeout);
        }

        finishTurn(context, subjectBefore, message, response);
        return response;
    }

    private TutorResponse converseOrFallback(TutorContext context, String message, int historyBefore,
            RetryAffordance retry, Duration runTimeout) {
        try {
            return converse(context, message, historyBefore, runTimeout);
        } catch (AssistantServiceException e) {
            log.warn("[Orchestrator] Assistant call failed [{}]: {}", e.getCode(), e.getMessage());
            return fallbackResponder.respond(context, message, e.getCode(), retry);
        } catch (SessionCreationException e) {
            log.error("[Orchestrator] No session for subject {}: {}", context.getSubjectId(), e.getMessage());
            return fallbackResponder.respond(context, message, AssistantErrorClassifier.MODEL_UNAVAILABLE, retry);
        } catch (RuntimeException e) { // NOSONAR - any failure degrades the turn
            String code = AssistantErrorClassifier.classifyFromThrowable(e);
            log.error("[Orchestrator] Turn failed [{}]", code, e);
            return fallbackResponder.respond(context, message, code, retry);
        }
    }

    private TutorResponse converse(TutorContext context, String message, int historyBefore,
            Duration runTimeout) {
        Subject subject = context.getSubject();
        String replay = context.firstUserMessageBefore(historyBefore);
        SessionHandle session = sessionManager.getOrCreateSession(subject.getId(), subject.getName(), replay);
        String threadId = session.getThreadId();

        assistantPort.addUserMessage(threadId, message);
        AssistantRun run = assistantPort.startRun(threadId, session.getAssistantId(),
                instructionsBuilder.build(context));
        run = runPoller.awaitSettled(run, runTimeout);

        List<ToolCallRecord> records = new ArrayList<>();
        List<InteractiveContent> contents = new ArrayList<>();
        int rounds = 0;
        int maxRounds = properties.getRun().getMaxToolRounds();
        while (run.requiresAction()) {
            if (rounds >= maxRounds) {
                throw new AssistantServiceException(AssistantErrorClassifier.RUN_FAILED,
                        "Run " + run.getId() + " exceeded " + maxRounds + " tool rounds");
            }
            List<ToolDispatchResult> results = toolDispatcher.dispatchAll(run.getRequiredToolCalls(), context);
            List<ToolOutput> outputs = new ArrayList<>();
            for (ToolDispatchResult result : results) {
                records.add(result.record());
                contents.addAll(result.result().getContents());
                outputs.add(result.toToolOutput());
            }
            log.debug("[Orchestrator] Submitting {} tool outputs for run {}", outputs.size(), run.getId());
            run = assistantPort.submitToolOutputs(threadId, run.getId(), outputs);
            run = runPoller.awaitSettled(run, runTimeout);
            rounds++;
        }

        if (run.getStatus() != RunStatus.COMPLETED) {
            String code = AssistantErrorClassifier.classifyRunError(run.getLastErrorCode());
            throw new AssistantServiceException(code, "Run " + run.getId() + " ended as " + run.getStatus()
                    + (run.getLastErrorMessage() != null ? ": " + run.getLastErrorMessage() : ""));
        }

        String text = assistantPort.latestAssistantText(threadId)
                .filter(t -> !t.isBlank())
                .orElse(NO_TEXT_RESPONSE);

        applySafetyNet(context, records, contents);
        context.appendTurn(ConversationTurn.assistant(text, records, Instant.now(clock)));
        log.info("[Orchestrator] Turn for {} finished: {} tool calls, {} content items", subject.getId(),
                records.size(), contents.size());

        return TutorResponse.builder()
                .responseText(text)
                .toolCalls(records)
                .contents(contents)
                .build();
    }

    /**
     * During active instruction a turn without an interactive_component call
     * gets a default explainer for the current lesson, even when other tools
     * produced content.
     */
    private void applySafetyNet(TutorContext context, List<ToolCallRecord> records,
            List<InteractiveContent> contents) {
        boolean hadInteractiveCall = records.stream()
                .anyMatch(record -> record.getName() == TutorToolName.INTERACTIVE_COMPONENT);
        Lesson lesson = context.getCurrentLesson();
        if (hadInteractiveCall || lesson == null || lesson.getTitle() == null) {
            return;
        }

        LearnerLevel level = LearnerLevel.orDefault(context.getUserLevel());
        InteractiveContent explainer = contentNormalizer.lessonExplainer(lesson.getTitle(), lesson.getDescription(),
                level, context.getSubjectId());
        lesson.recordContentType(ContentType.EXPLAINER);
        contents.add(explainer);

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("type", ContentType.EXPLAINER.getWireName());
        parameters.put("learning_objective", lesson.getTitle());
        parameters.put("difficulty", level.getValue());
        records.add(ToolCallRecord.builder()
                .id("safety_net_" + UUID.randomUUID())
                .name(TutorToolName.INTERACTIVE_COMPONENT)
                .parameters(parameters)
                .result(ContentOutputs.describe(explainer))
                .build());
        log.debug("[Orchestrator] Added default explainer for '{}'", lesson.getTitle());
    }

    private TutorResponse clarify(TutorContext context) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("question", AmbiguityGuard.CLARIFYING_QUESTION);
        parameters.put("context", AmbiguityGuard.CLARIFYING_CONTEXT);
        Lesson lesson = context.getCurrentLesson();
        if (lesson != null) {
            parameters.put("options", List.of("Explain " + lesson.getTitle(), "Give me a practice question",
                    "Summarize my progress"));
        }
        ToolResult result = toolDispatcher.dispatch(TutorToolName.CLARIFYING_QUESTION.getWireName(), parameters,
                context);
        ToolCallRecord record = ToolCallRecord.builder()
                .id("clarify_" + UUID.randomUUID())
                .name(TutorToolName.CLARIFYING_QUESTION)
                .parameters(parameters)
                .result(result.toOutputMap())
                .build();
        Object question = result.toOutputMap().get("question");
        String text = question instanceof String q ? q : AmbiguityGuard.CLARIFYING_QUESTION;
        context.appendTurn(ConversationTurn.assistant(text, List.of(record), Instant.now(clock)));
        return TutorResponse.builder()
                .responseText(text)
                .toolCalls(new ArrayList<>(List.of(record)))
                .build();
    }

    private void finishTurn(TutorContext context, String subjectBefore, String message, TutorResponse response) {
        String subjectAfter = context.getSubjectId();
        if (context.hasSubject() && !Objects.equals(subjectBefore, subjectAfter)) {
            contextService.bind(context, subjectBefore);
            if (assistantPort.isAvailable()) {
                String replay = context.firstUserMessageBefore(context.getConversationHistory().size());
                sessionManager.initializeAsync(subjectAfter, context.getSubject().getName(), replay);
            }
        }

        contextService.saveAsync(context);
        subjectService.recordTurn(context.getUserId(), subjectAfter, message, response.getResponseText(),
                response.getContents());
        response.setContext(contextService.snapshot(context));
    }
}
