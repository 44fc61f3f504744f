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

import me.golemcore.tutor.domain.component.TutorTool;
import me.golemcore.tutor.domain.model.ToolDefinition;
import me.golemcore.tutor.domain.model.ToolFailureKind;
import me.golemcore.tutor.domain.model.ToolResult;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.domain.model.TutorToolName;
import me.golemcore.tutor.domain.service.SummaryComposer;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Progress, lesson or concept summaries composed from the context.
 */
@Component
public class SummaryRequestTool implements TutorTool {

    private final SummaryComposer summaryComposer;

    public SummaryRequestTool(SummaryComposer summaryComposer) {
        this.summaryComposer = summaryComposer;
    }

    @Override
    public TutorToolName getToolName() {
        return TutorToolName.SUMMARY_REQUEST;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName().getWireName())
                .description("Provide a summary of lessons, concepts, or progress.")
                .inputSchema(ToolSchemas.object(List.of("content_type"), Map.of(
                        "content_type", ToolSchemas.enumeration("What type of content to summarize",
                                "lesson", "concept", "progress"),
                        "scope", ToolSchemas.string(
                                "Specific scope of the summary (e.g., \"current lesson\", \"last week\")"))))
                .build();
    }

    @Override
    public ToolResult execute(TutorContext context, Map<String, Object> parameters) {
        String contentType = ToolArguments.string(parameters, "content_type", "").toLowerCase(Locale.ROOT);
        String scope = ToolArguments.string(parameters, "scope");
        String summary = switch (contentType) {
        case "progress" -> summaryComposer.progressSummary(context);
        case "lesson" -> summaryComposer.lessonSummary(context.getCurrentLesson());
        case "concept" -> summaryComposer.conceptSummary(scope);
        default -> null;
        };
        if (summary == null) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "content_type must be one of lesson, concept, progress");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "summary");
        payload.put("contentType", contentType);
        payload.put("content", summary);
        payload.put("scope", scope);
        return ToolResult.success(payload);
    }
}
