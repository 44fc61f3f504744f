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
import java.util.List;

/**
 * Ordered lessons for one subject.
 *
 * <p>
 * {@code currentLessonIndex} stays within {@code [0, lessons.size()]}; the
 * upper bound means every lesson has been passed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LessonPlan {

    private String subject;
    private LearnerLevel difficulty;
    private String estimatedDuration;

    @Builder.Default
    private List<Lesson> lessons = new ArrayList<>();

    private int currentLessonIndex;

    @JsonIgnore
    public Lesson getCurrentLesson() {
        if (lessons == null || currentLessonIndex < 0 || currentLessonIndex >= lessons.size()) {
            return null;
        }
        return lessons.get(currentLessonIndex);
    }

    @JsonIgnore
    public boolean isOnLastLesson() {
        return lessons != null && !lessons.isEmpty() && currentLessonIndex == lessons.size() - 1;
    }

    @JsonIgnore
    public LessonPlanState getState() {
        if (lessons == null || lessons.isEmpty()) {
            return LessonPlanState.NO_PLAN;
        }
        return currentLessonIndex >= lessons.size() ? LessonPlanState.COMPLETE : LessonPlanState.ACTIVE;
    }

    @JsonIgnore
    public long getCompletedCount() {
        return lessons == null ? 0 : lessons.stream().filter(Lesson::isCompleted).count();
    }

    @JsonIgnore
    public boolean isAllCompleted() {
        return lessons != null && !lessons.isEmpty() && getCompletedCount() == lessons.size();
    }

    public Lesson findLesson(String lessonId) {
        if (lessons == null || lessonId == null) {
            return null;
        }
        return lessons.stream()
                .filter(lesson -> lessonId.equals(lesson.getId()))
                .findFirst()
                .orElse(null);
    }
}
