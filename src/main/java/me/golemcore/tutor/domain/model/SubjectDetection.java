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
 * Result of classifying a free-text message as a request to study a subject.
 */
public record SubjectDetection(Kind kind, String subjectName, double confidence) {

    public enum Kind {
        NO_MATCH, DETECTED
    }

    private static final SubjectDetection NO_MATCH = new SubjectDetection(Kind.NO_MATCH, null, 0.0);

    public static SubjectDetection noMatch() {
        return NO_MATCH;
    }

    public static SubjectDetection detected(String subjectName, double confidence) {
        return new SubjectDetection(Kind.DETECTED, subjectName, confidence);
    }

    public boolean isDetected() {
        return kind == Kind.DETECTED;
    }
}
