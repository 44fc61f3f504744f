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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tutor.domain.content.DiversitySelector;
import me.golemcore.tutor.domain.model.ContentCategory;
import me.golemcore.tutor.domain.model.ContentType;
import me.golemcore.tutor.domain.model.LearningProgress;
import me.golemcore.tutor.domain.model.Lesson;
import me.golemcore.tutor.domain.model.TutorContext;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a rendering-layer interaction event into the follow-up message sent
 * to the tutor, and records graded answers in the learning progress.
 *
 * <p>
 * Must be called by the holder of the subject's context lock.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InteractionMessageBuilder {

    private static final int MAX_DATA_LENGTH = 2000;

    private final DiversitySelector diversitySelector;
    private final ObjectMapper objectMapper;

    public String build(TutorContext context, String action, Map<String, Object> data) {
        String normalized = action != null ? action.trim().toLowerCase(Locale.ROOT) : "";
        Map<String, Object> payload = data != null ? data : Map.of();
        recordGrade(context, normalized, payload);

        return switch (normalized) {
        case "answer_submitted", "fill_blank_submitted", "drag_drop_submitted", "quiz_submitted",
                "highlights_checked" ->
            "I submitted my answer (" + normalized.replace('_', ' ') + "): " + describe(payload)
                    + ". Please give me feedback on it.";
        case "next_question", "next_exercise", "next_problem" -> nextContentRequest(context, normalized);
        case "request_hint" -> "Can you give me a hint for this? " + describe(payload);
        case "explain_more", "concept_expanded" -> "Can you explain this in more detail? " + describe(payload);
        case "examples_requested" -> "Can you show me more examples? " + describe(payload);
        case "ready_for_practice", "ready_for_next" ->
            "I'm ready to practice. Please give me a practice exercise for the current lesson.";
        case "retry_content" -> "Please generate that content again.";
        default -> "I interacted with the learning content (" + (normalized.isEmpty() ? "unknown" : normalized)
                + "): " + describe(payload);
        };
    }

    private String nextContentRequest(TutorContext context, String action) {
        Lesson lesson = context.getCurrentLesson();
        List<ContentType> recent = lesson != null ? lesson.getRecentContentTypes() : List.of();
        ContentType type = diversitySelector.selectType(ContentCategory.fromAction(action), recent);
        String noun = action.substring("next_".length());
        String topic = lesson != null ? " about " + lesson.getTitle() : "";
        return "Please give me another " + noun + topic + ". Use the interactive_component tool with type \""
                + type.getWireName() + "\".";
    }

    private void recordGrade(TutorContext context, String action, Map<String, Object> payload) {
        LearningProgress progress = context.getLearningProgress();
        if (progress == null) {
            progress = new LearningProgress();
            context.setLearningProgress(progress);
        }
        Integer score = intValue(payload.get("score"));
        Integer total = intValue(payload.get("total"));
        if ("quiz_submitted".equals(action) && score != null && total != null) {
            progress.recordScore(score, total);
            return;
        }
        Object correct = payload.containsKey("isCorrect") ? payload.get("isCorrect") : payload.get("correct");
        if (correct instanceof Boolean flag) {
            progress.recordAttempt(flag);
        }
    }

    private String describe(Map<String, Object> payload) {
        if (payload.isEmpty()) {
            return "{}";
        }
        try {
            String json = objectMapper.writeValueAsString(payload);
            return json.length() > MAX_DATA_LENGTH ? json.substring(0, MAX_DATA_LENGTH) + "..." : json;
        } catch (JsonProcessingException e) {
            log.debug("[Orchestrator] Interaction payload not serializable: {}", e.getOriginalMessage());
            return payload.toString();
        }
    }

    private static Integer intValue(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
