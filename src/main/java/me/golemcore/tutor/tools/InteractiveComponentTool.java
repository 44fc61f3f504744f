package me.golemcore.tutor.tools;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.tutor.domain.component.TutorTool;
import me.golemcore.tutor.domain.content.ContentNormalizer;
import me.golemcore.tutor.domain.content.ContentOutputs;
import me.golemcore.tutor.domain.model.ContentType;
import me.golemcore.tutor.domain.model.InteractiveContent;
import me.golemcore.tutor.domain.model.LearnerLevel;
import me.golemcore.tutor.domain.model.Lesson;
import me.golemcore.tutor.domain.model.ToolDefinition;
import me.golemcore.tutor.domain.model.ToolResult;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.domain.model.TutorToolName;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Turns assistant-authored content into a normalized interactive item.
 */
@Component
@Slf4j
public class InteractiveComponentTool implements TutorTool {

    private static final List<String> TYPE_NAMES = Arrays.stream(ContentType.values())
            .map(ContentType::getWireName)
            .toList();

    private final ContentNormalizer contentNormalizer;

    public InteractiveComponentTool(ContentNormalizer contentNormalizer) {
        this.contentNormalizer = contentNormalizer;
    }

    @Override
    public TutorToolName getToolName() {
        return TutorToolName.INTERACTIVE_COMPONENT;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName().getWireName())
                .description("Create an interactive learning component to teach or test understanding.")
                .inputSchema(ToolSchemas.object(List.of("type", "content", "learning_objective"), Map.of(
                        "type", ToolSchemas.enumeration("Type of interactive component to create", TYPE_NAMES),
                        "content", ToolSchemas.freeObject("Content data specific to the component type"),
                        "learning_objective", ToolSchemas.string(
                                "What the student should learn from this interaction"),
                        "difficulty", ToolSchemas.enumeration("Difficulty level of the interaction",
                                ToolSchemas.LEVELS))))
                .build();
    }

    @Override
    public ToolResult execute(TutorContext context, Map<String, Object> parameters) {
        String rawType = ToolArguments.string(parameters, "type");
        ContentType type = ContentType.fromWireName(rawType).orElse(ContentType.PLACEHOLDER);
        if (rawType != null && type == ContentType.PLACEHOLDER && !"placeholder".equalsIgnoreCase(rawType)) {
            log.debug("[Tools] Unknown component type '{}', rendering placeholder", rawType);
        }
        LearnerLevel difficulty = ToolArguments.level(parameters, "difficulty");
        if (difficulty == null) {
            difficulty = context.getUserLevel();
        }

        InteractiveContent content = contentNormalizer.create(type, ToolArguments.object(parameters, "content"),
                ToolArguments.string(parameters, "learning_objective"), difficulty, context.getSubjectId());

        Lesson lesson = context.getCurrentLesson();
        if (lesson != null) {
            lesson.recordContentType(type);
        }
        return ToolResult.success(ContentOutputs.describe(content), List.of(content));
    }
}
