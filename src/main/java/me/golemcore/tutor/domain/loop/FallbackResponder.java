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
import me.golemcore.tutor.domain.model.ConversationTurn;
import me.golemcore.tutor.domain.model.RetryAffordance;
import me.golemcore.tutor.domain.model.SubjectDetection;
import me.golemcore.tutor.domain.model.ToolCallRecord;
import me.golemcore.tutor.domain.model.ToolResult;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.domain.model.TutorResponse;
import me.golemcore.tutor.domain.model.TutorToolName;
import me.golemcore.tutor.domain.service.SubjectClassifier;
import me.golemcore.tutor.domain.service.ToolDispatcher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Answers a turn without the assistant service. Starts a subject when the
 * message clearly names one, and apologizes otherwise. Never throws.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FallbackResponder {

    public static final String APOLOGY = "I'm sorry, I encountered an error while processing your request. "
            + "Please check your OpenAI API key configuration and try again.";

    private final SubjectClassifier subjectClassifier;
    private final ToolDispatcher toolDispatcher;
    private final Clock clock;

    public TutorResponse respond(TutorContext context, String message, String errorCode, RetryAffordance retry) {
        try {
            return tryStartSubject(context, message)
                    .orElseGet(() -> apologize(context, errorCode, retry));
        } catch (RuntimeException e) { // NOSONAR - last line of defense
            log.error("[Orchestrator] Fallback failed", e);
            return TutorResponse.builder()
                    .responseText(APOLOGY)
                    .degraded(true)
                    .errorCode(errorCode)
                    .retry(retry)
                    .build();
        }
    }

    /**
     * Create the subject named by the message, if the learner has none yet.
     */
    public Optional<TutorResponse> tryStartSubject(TutorContext context, String message) {
        if (context.hasSubject()) {
            return Optional.empty();
        }
        SubjectDetection detection = subjectClassifier.classify(message);
        if (!detection.isDetected()) {
            return Optional.empty();
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("name", detection.subjectName());
        ToolResult result = toolDispatcher.dispatch(TutorToolName.NEW_SUBJECT.getWireName(), parameters, context);
        if (!result.isSuccess()) {
            log.warn("[Orchestrator] Fallback could not start subject '{}': {}", detection.subjectName(),
                    result.getError());
            return Optional.empty();
        }
        log.info("[Orchestrator] Fallback started subject '{}' (confidence {})", detection.subjectName(),
                detection.confidence());

        ToolCallRecord record = ToolCallRecord.builder()
                .id("fallback_" + UUID.randomUUID())
                .name(TutorToolName.NEW_SUBJECT)
                .parameters(parameters)
                .result(result.toOutputMap())
                .build();
        String text = "I'll help you learn " + detection.subjectName() + ". Let's get started!";
        context.appendTurn(ConversationTurn.assistant(text, List.of(record), Instant.now(clock)));
        return Optional.of(TutorResponse.builder()
                .responseText(text)
                .toolCalls(new ArrayList<>(List.of(record)))
                .degraded(true)
                .build());
    }

    private TutorResponse apologize(TutorContext context, String errorCode, RetryAffordance retry) {
        context.appendTurn(ConversationTurn.assistant(APOLOGY, List.of(), Instant.now(clock)));
        return TutorResponse.builder()
                .responseText(APOLOGY)
                .degraded(true)
                .errorCode(errorCode)
                .retry(retry)
                .build();
    }
}
