package me.golemcore.tutor.domain.content;

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
import me.golemcore.tutor.domain.model.ContentType;
import me.golemcore.tutor.domain.model.InteractiveContent;
import me.golemcore.tutor.domain.model.LearnerLevel;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Completes AI-supplied content so the rendering layer can always display it.
 *
 * <p>
 * Each content type has a fixed set of required fields. A field that is
 * missing, blank or an empty list is filled with a labelled placeholder
 * derived from the learning objective. Fields supplied by the assistant are
 * kept as they are, including ones this class does not know about.
 */
@Component
@RequiredArgsConstructor
public class ContentNormalizer {

    static final String DEFAULT_OBJECTIVE = "this topic";
    static final String RAW_SUFFIX = "Raw";

    private final Clock clock;

    /**
     * Pure normalization of one payload.
     *
     * @return a new map holding every required field for {@code type}
     */
    public Map<String, Object> normalize(ContentType type, Map<String, Object> aiData, String learningObjective,
            LearnerLevel difficulty) {
        Map<String, Object> data = aiData != null ? new LinkedHashMap<>(aiData) : new LinkedHashMap<>();
        String objective = learningObjective != null && !learningObjective.isBlank()
                ? learningObjective.trim()
                : DEFAULT_OBJECTIVE;
        LearnerLevel level = LearnerLevel.orDefault(difficulty);

        return switch (type != null ? type : ContentType.PLACEHOLDER) {
        case EXPLAINER -> explainer(data, objective, level);
        case MULTIPLE_CHOICE -> multipleChoice(data, objective);
        case FILL_BLANK -> fillBlank(data, objective);
        case DRAG_DROP -> dragDrop(data, objective);
        case STEP_SOLVER -> stepSolver(data, objective);
        case CONCEPT_CARD -> conceptCard(data, objective, level);
        case INTERACTIVE_EXAMPLE -> interactiveExample(data, objective);
        case PROGRESS_QUIZ -> progressQuiz(data, objective);
        case GRAPH_VISUALIZER -> graphVisualizer(data, objective);
        case FORMULA_EXPLORER -> formulaExplorer(data, objective);
        case TEXT_HIGHLIGHTER -> textHighlighter(data, objective);
        case PLACEHOLDER -> placeholder(data, objective);
        };
    }

    /**
     * Normalize and wrap into a new immutable {@link InteractiveContent}.
     */
    public InteractiveContent create(ContentType type, Map<String, Object> aiData, String learningObjective,
            LearnerLevel difficulty, String subjectId) {
        ContentType effectiveType = type != null ? type : ContentType.PLACEHOLDER;
        Map<String, Object> data = normalize(effectiveType, aiData, learningObjective, difficulty);
        return new InteractiveContent(
                "content_" + UUID.randomUUID(),
                effectiveType,
                String.valueOf(data.get("title")),
                data,
                learningObjective,
                LearnerLevel.orDefault(difficulty),
                subjectId,
                Instant.now(clock));
    }

    /**
     * Default explainer for a lesson, used when a turn produced no content.
     */
    public InteractiveContent lessonExplainer(String lessonTitle, String lessonDescription, LearnerLevel difficulty,
            String subjectId) {
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("heading", "Introduction to " + lessonTitle);
        section.put("paragraphs", List.of(lessonDescription != null && !lessonDescription.isBlank()
                ? lessonDescription
                : "An introduction to " + lessonTitle + "."));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("title", lessonTitle);
        data.put("overview", "Overview of " + lessonTitle);
        data.put("sections", List.of(section));
        data.put("conclusion", "Summary of " + lessonTitle);
        return create(ContentType.EXPLAINER, data, lessonTitle, difficulty, subjectId);
    }

    // ==================== Per-type branches ====================

    private Map<String, Object> explainer(Map<String, Object> data, String objective, LearnerLevel level) {
        text(data, "title", objective);
        text(data, "overview", "Understanding " + objective);
        list(data, "sections", () -> List.of(Map.of(
                "heading", "Introduction to " + objective,
                "paragraphs", List.of("Placeholder: an introduction to " + objective + "."))));
        text(data, "conclusion", "Summary of " + objective);
        value(data, "difficulty", level.getValue());
        return data;
    }

    private Map<String, Object> multipleChoice(Map<String, Object> data, String objective) {
        text(data, "title", "Multiple Choice: " + objective);
        text(data, "question", "Question about " + objective);
        list(data, "choices", () -> List.of(
                Map.of("id", "a", "text", "Placeholder answer about " + objective, "isCorrect", true),
                Map.of("id", "b", "text", "Placeholder distractor", "isCorrect", false)));
        text(data, "explanation", "Practice question for: " + objective);
        return data;
    }

    private Map<String, Object> fillBlank(Map<String, Object> data, String objective) {
        text(data, "title", "Fill in the Blanks: " + objective);
        text(data, "question", "Fill in the blanks about " + objective);
        text(data, "text", "Complete the following sentences about " + objective + ".");
        text(data, "template", "This lesson is about ___.");
        list(data, "answers", () -> List.of(objective));
        list(data, "blanks", () -> List.of(Map.of(
                "id", "blank_1",
                "answer", objective,
                "placeholder", "Enter the key term")));
        list(data, "hints", () -> List.of("Think about the main idea of " + objective + "."));
        return data;
    }

    private Map<String, Object> dragDrop(Map<String, Object> data, String objective) {
        text(data, "title", "Drag & Drop: " + objective);
        text(data, "instructions", "Organize items related to " + objective);
        list(data, "items", () -> List.of(Map.of(
                "id", "item_1",
                "content", objective,
                "targetId", "target_1")));
        list(data, "targets", () -> List.of(Map.of(
                "id", "target_1",
                "label", "Related to " + objective)));
        return data;
    }

    private Map<String, Object> stepSolver(Map<String, Object> data, String objective) {
        text(data, "title", "Step-by-Step: " + objective);
        text(data, "description", "Solve a problem about " + objective + " one step at a time");
        text(data, "problem", "Practice problem for " + objective);
        list(data, "steps", () -> List.of(Map.of(
                "title", "Step 1",
                "content", "Placeholder: identify what " + objective + " asks for")));
        list(data, "hints", () -> List.of("Break the problem into smaller steps."));
        return data;
    }

    private Map<String, Object> conceptCard(Map<String, Object> data, String objective, LearnerLevel level) {
        text(data, "title", objective);
        text(data, "summary", "Key concept: " + objective);
        text(data, "details", "This concept is fundamental to understanding the subject.");
        list(data, "keyPoints", () -> List.of("Core idea of " + objective));
        list(data, "examples", () -> List.of("Placeholder example of " + objective));
        value(data, "difficulty", level.getValue());
        return data;
    }

    private Map<String, Object> interactiveExample(Map<String, Object> data, String objective) {
        text(data, "title", "Interactive Example: " + objective);
        text(data, "description", "Explore " + objective + " interactively");
        list(data, "controls", () -> List.of(Map.of(
                "id", "control_1",
                "type", "slider",
                "label", "Adjust " + objective,
                "min", 0,
                "max", 10,
                "step", 1,
                "defaultValue", 5)));
        list(data, "display", () -> List.of(Map.of(
                "id", "display_1",
                "type", "text",
                "content", "Placeholder: observe how " + objective + " changes")));
        text(data, "explanation", "This interactive example helps you understand " + objective);
        return data;
    }

    private Map<String, Object> progressQuiz(Map<String, Object> data, String objective) {
        text(data, "title", "Progress Quiz: " + objective);
        text(data, "description", "Test your knowledge of " + objective);
        list(data, "questions", () -> List.of(Map.of(
                "id", "q1",
                "type", "short-answer",
                "question", "Placeholder: describe the main idea of " + objective,
                "correctAnswer", objective)));
        value(data, "passingScore", 70);
        return data;
    }

    private Map<String, Object> graphVisualizer(Map<String, Object> data, String objective) {
        text(data, "title", "Graph: " + objective);
        text(data, "description", "Visualizing data for " + objective);
        list(data, "data", () -> List.of(Map.of("x", 0, "y", 0), Map.of("x", 1, "y", 1)));
        text(data, "chartType", "line");
        return data;
    }

    private Map<String, Object> formulaExplorer(Map<String, Object> data, String objective) {
        text(data, "title", "Formula Explorer: " + objective);
        text(data, "description", "Explore the formula for " + objective);
        text(data, "formula", "y = f(x)");
        list(data, "variables", () -> List.of(Map.of(
                "symbol", "x",
                "name", "Placeholder input",
                "value", 1)));
        list(data, "steps", () -> List.of("Identify each variable in the formula."));
        return data;
    }

    private Map<String, Object> textHighlighter(Map<String, Object> data, String objective) {
        text(data, "title", "Text Analysis: " + objective);
        text(data, "description", "Analyze text related to " + objective);
        text(data, "text", "Sample text for " + objective);
        list(data, "categories", () -> List.of(Map.of(
                "id", "key_terms",
                "name", "Key terms",
                "color", "#3B82F6")));
        return data;
    }

    private Map<String, Object> placeholder(Map<String, Object> data, String objective) {
        text(data, "title", objective);
        text(data, "description", "Interactive content for " + objective);
        return data;
    }

    // ==================== Field helpers ====================

    private static void text(Map<String, Object> data, String key, String fallback) {
        if (isMissing(data.get(key))) {
            data.put(key, fallback);
        }
    }

    /**
     * A list field holding a non-collection value counts as missing. The
     * original value is kept under {@code <key>Raw}.
     */
    private static void list(Map<String, Object> data, String key, Supplier<List<?>> fallback) {
        Object current = data.get(key);
        if (current != null && !(current instanceof Collection<?>)) {
            data.put(key + RAW_SUFFIX, current);
            data.put(key, fallback.get());
            return;
        }
        if (isMissing(current)) {
            data.put(key, fallback.get());
        }
    }

    private static void value(Map<String, Object> data, String key, Object fallback) {
        if (isMissing(data.get(key))) {
            data.put(key, fallback);
        }
    }

    private static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String text) {
            return text.isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }
}
