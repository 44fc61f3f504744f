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
 * A single lesson inside a {@link LessonPlan}.
 *
 * <p>
 * {@code recentContentTypes} is a bounded history, most recent first, used to
 * avoid repeating the same interactive content type back to back.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Lesson {

    public static final int RECENT_CONTENT_WINDOW = 3;

    private String id;
    private String title;
    private String description;
    private boolean completed;
    private String achievement;

    @Builder.Default
    private List<ConceptInfo> concepts = new ArrayList<>();

    private Integer currentConceptIndex;

    @Builder.Default
    private List<String> learningObjectives = new ArrayList<>();

    @Builder.Default
    private List<ContentType> recentContentTypes = new ArrayList<>();

    public void recordContentType(ContentType type) {
        if (type == null) {
            return;
        }
        if (recentContentTypes == null) {
            recentContentTypes = new ArrayList<>();
        }
        recentContentTypes.add(0, type);
        while (recentContentTypes.size() > RECENT_CONTENT_WINDOW) {
            recentContentTypes.remove(recentContentTypes.size() - 1);
        }
    }

    @JsonIgnore
    public ConceptInfo getCurrentConcept() {
        if (concepts == null || currentConceptIndex == null) {
            return null;
        }
        if (currentConceptIndex < 0 || currentConceptIndex >= concepts.size()) {
            return null;
        }
        return concepts.get(currentConceptIndex);
    }
}
