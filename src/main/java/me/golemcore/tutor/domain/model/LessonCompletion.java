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

/**
 * Result of recording completion for a lesson.
 */
public record LessonCompletion(Status status, Lesson lesson, boolean allLessonsCompleted, double subjectProgress) {

    public enum Status {
        RECORDED, NO_PLAN, LESSON_NOT_FOUND
    }

    public static LessonCompletion rejected(Status status) {
        return new LessonCompletion(status, null, false, 0.0);
    }

    public boolean recorded() {
        return status == Status.RECORDED;
    }
}
