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

import java.util.Optional;

/**
 * The fixed set of functions a tutor assistant may call.
 */
public enum TutorToolName {

    NEW_SUBJECT("new_subject"),
    NEW_LESSON_PLAN("new_lesson_plan"),
    UPDATE_LESSON_PLAN("update_lesson_plan"),
    CLARIFYING_QUESTION("clarifying_question"),
    LESSON_COMPLETE("lesson_complete"),
    NEXT_LESSON("next_lesson"),
    INTERACTIVE_COMPONENT("interactive_component"),
    SUBJECT_COMPLETE("subject_complete"),
    REVIEW_REQUEST("review_request"),
    SUMMARY_REQUEST("summary_request"),
    REPHRASE_REQUEST("rephrase_request"),
    FEEDBACK_LOG("feedback_log");

    private final String wireName;

    TutorToolName(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<TutorToolName> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (TutorToolName tool : values()) {
            if (tool.wireName.equals(name)) {
                return Optional.of(tool);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static TutorToolName fromJson(String name) {
        return fromWireName(name).orElse(null);
    }
}
