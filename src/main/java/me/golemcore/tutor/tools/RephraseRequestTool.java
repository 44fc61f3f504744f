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
import me.golemcore.tutor.domain.model.LearnerLevel;
import me.golemcore.tutor.domain.model.ToolDefinition;
import me.golemcore.tutor.domain.model.ToolResult;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.domain.model.TutorToolName;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class RephraseRequestTool implements TutorTool {

    @Override
    public TutorToolName getToolName() {
        return TutorToolName.REPHRASE_REQUEST;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName().getWireName())
                .description("Explain the same concept in a different way or at a different level.")
                .inputSchema(ToolSchemas.object(List.of("original_content", "style"), Map.of(
                        "original_content", ToolSchemas.string("The original content that needs to be rephrased"),
                        "style", ToolSchemas.enumeration("How to rephrase the content",
                                "simpler", "more_detailed", "visual", "practical"),
                        "target_level", ToolSchemas.enumeration(
                                "Target difficulty level for the rephrased content", ToolSchemas.LEVELS))))
                .build();
    }

    @Override
    public ToolResult execute(TutorContext context, Map<String, Object> parameters) {
        String style = ToolArguments.string(parameters, "style", "simpler");
        LearnerLevel targetLevel = ToolArguments.level(parameters, "target_level");
        if (targetLevel == null) {
            targetLevel = LearnerLevel.orDefault(context.getUserLevel());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "rephrase");
        payload.put("originalContent", ToolArguments.string(parameters, "original_content"));
        payload.put("style", style);
        payload.put("targetLevel", targetLevel.getValue());
        payload.put("message", "Rephrasing content in a " + style.replace('_', ' ') + " way...");
        return ToolResult.success(payload);
    }
}
