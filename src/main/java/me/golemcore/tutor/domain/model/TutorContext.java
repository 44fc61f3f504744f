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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Full per-subject tutoring state: the unit that is loaded, mutated by a turn,
 * and persisted afterwards.
 *
 * <p>
 * The conversation history only grows through {@link #appendTurn}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TutorContext {

    private String userId;
    private Subject subject;
    private LessonPlan lessonPlan;

    @Builder.Default
    private LearningProgress learningProgress = new LearningProgress();

    @Builder.Default
    private List<ConversationTurn> conversationHistory = new ArrayList<>();

    @Builder.Default
    private List<String> userGoals = new ArrayList<>();

    private LearnerLevel userLevel;
    private LearnerPreferences preferences;
    private String instructionOverrides;

    public void appendTurn(ConversationTurn turn) {
        if (conversationHistory == null) {
            conversationHistory = new ArrayList<>();
        }
        conversationHistory.add(turn);
    }

    public List<ConversationTurn> getConversationHistory() {
        return conversationHistory != null ? Collections.unmodifiableList(conversationHistory) : List.of();
    }

    @JsonIgnore
    public String getSubjectId() {
        return subject != null ? subject.getId() : null;
    }

    @JsonIgnore
    public boolean hasSubject() {
        return subject != null && subject.getId() != null && !subject.getId().isBlank();
    }

    @JsonIgnore
    public Lesson getCurrentLesson() {
        return lessonPlan != null ? lessonPlan.getCurrentLesson() : null;
    }

    /**
     * First user message recorded before the given history size, if any.
     */
    public String firstUserMessageBefore(int historySize) {
        List<ConversationTurn> history = getConversationHistory();
        int limit = Math.min(historySize, history.size());
        for (int i = 0; i < limit; i++) {
            ConversationTurn turn = history.get(i);
            if (turn.isUser() && turn.getContent() != null && !turn.getContent().isBlank()) {
                return turn.getContent();
            }
        }
        return null;
    }
}
