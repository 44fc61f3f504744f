package me.golemcore.tutor.domain.component;

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

import me.golemcore.tutor.domain.model.ToolDefinition;
import me.golemcore.tutor.domain.model.ToolResult;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.domain.model.TutorToolName;

import java.util.Map;

/**
 * A function the tutor assistant can call.
 *
 * <p>
 * Tools run synchronously on the turn's thread while the subject lock is
 * held, and may mutate the given context. Expected failures are returned as
 * {@link ToolResult#failure}; anything thrown is converted to a failure by
 * the dispatcher.
 */
public interface TutorTool {

    TutorToolName getToolName();

    /**
     * Returns the tool definition with JSON Schema for function calling.
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool against the working context.
     *
     * @param context
     *            context of the current turn
     * @param parameters
     *            arguments decoded from the assistant's JSON
     * @return the tool result
     */
    ToolResult execute(TutorContext context, Map<String, Object> parameters);
}
