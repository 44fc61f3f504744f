package me.golemcore.tutor.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Interactive content kinds understood by the rendering layer.
 */
public enum ContentType {

    EXPLAINER("explainer"),
    MULTIPLE_CHOICE("multiple-choice"),
    FILL_BLANK("fill-blank"),
    DRAG_DROP("drag-drop"),
    STEP_SOLVER("step-solver"),
    CONCEPT_CARD("concept-card"),
    INTERACTIVE_EXAMPLE("interactive-example"),
    PROGRESS_QUIZ("progress-quiz"),
    GRAPH_VISUALIZER("graph-visualizer"),
    FORMULA_EXPLORER("formula-explorer"),
    TEXT_HIGHLIGHTER("text-highlighter"),
    PLACEHOLDER("placeholder");

    private final String wireName;

    ContentType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<ContentType> fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if ("quiz".equals(normalized)) {
            return Optional.of(PROGRESS_QUIZ);
        }
        for (ContentType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static ContentType fromJson(String raw) {
        return fromWireName(raw).orElse(PLACEHOLDER);
    }
}
