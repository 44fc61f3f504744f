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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Partial context supplied by the caller for a single turn. Only non-null
 * fields are merged into the working context.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TutorContextOverrides {

    private Subject subject;
    private LessonPlan lessonPlan;
    private LearningProgress learningProgress;
    private List<String> userGoals;
    private LearnerLevel userLevel;
    private LearnerPreferences preferences;
    private String instructionOverrides;

    public void applyTo(TutorContext context) {
        if (subject != null) {
            context.setSubject(subject);
        }
        if (lessonPlan != null) {
            context.setLessonPlan(lessonPlan);
        }
        if (learningProgress != null) {
            context.setLearningProgress(learningProgress);
        }
        if (userGoals != null) {
            context.setUserGoals(new ArrayList<>(userGoals));
        }
        if (userLevel != null) {
            context.setUserLevel(userLevel);
        }
        if (preferences != null) {
            context.setPreferences(preferences);
        }
        if (instructionOverrides != null) {
            context.setInstructionOverrides(instructionOverrides);
        }
    }
}
