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
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class ReviewRequestTool implements TutorTool {

    private static final String DEFAULT_REVIEW_TYPE = "comprehensive";

    @Override
    public TutorToolName getToolName() {
        return TutorToolName.REVIEW_REQUEST;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName().getWireName())
                .description("Initiate a review session for previously learned material.")
                .inputSchema(ToolSchemas.object(List.of("topics"), Map.of(
                        "topics", ToolSchemas.stringArray("Specific topics to review"),
                        "focus_areas", ToolSchemas.stringArray("Areas where the student struggled previously"),
                        "review_type", ToolSchemas.enumeration("Type of review session", "quick",
                                DEFAULT_REVIEW_TYPE))))
                .build();
    }

    @Override
    public ToolResult execute(TutorContext context, Map<String, Object> parameters) {
        List<String> topics = ToolArguments.stringList(parameters, "topics");
        if (topics.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "At least one review topic is required");
        }
        String reviewType = ToolArguments.string(parameters, "review_type", DEFAULT_REVIEW_TYPE);
        if (context.getLearningProgress() != null) {
            context.getLearningProgress().setNeedsReview(true);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "review_session");
        payload.put("topics", topics);
        payload.put("focusAreas", ToolArguments.stringList(parameters, "focus_areas"));
        payload.put("reviewType", reviewType);
        payload.put("message", "Starting " + reviewType + " review of: " + String.join(", ", topics));
        return ToolResult.success(payload);
    }
}
