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

import me.golemcore.tutor.domain.model.InteractiveContent;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tool output shape for a generated piece of interactive content.
 */
public final class ContentOutputs {

    private ContentOutputs() {
    }

    public static Map<String, Object> describe(InteractiveContent content) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("type", "interactive_component");
        output.put("contentId", content.id());
        output.put("componentType", content.type().getWireName());
        output.put("content", content.data());
        output.put("learningObjective", content.learningObjective());
        output.put("difficulty", content.difficulty() != null ? content.difficulty().getValue() : null);
        return output;
    }
}
