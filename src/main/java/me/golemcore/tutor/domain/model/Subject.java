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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A topic the learner is studying. Progress is a percentage in
 * {@code [0, 100]} derived from completed lessons.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subject {

    private String id;
    private String name;
    private String description;
    private double progress;
    private boolean active;
    private Instant createdAt;
    private Instant lastActiveAt;
    private Instant completedAt;

    @Builder.Default
    private List<String> topicKeywords = new ArrayList<>();

    public void touch(Instant now) {
        this.lastActiveAt = now;
    }
}
