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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stored copy of an {@link InteractiveContent} in the subject's content feed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentFeedItem {

    private String id;
    private String userId;
    private String subjectId;
    private ContentType type;
    private String title;

    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();

    private int orderIndex;
    private Instant timestamp;

    public static ContentFeedItem from(String userId, InteractiveContent content, int orderIndex) {
        return ContentFeedItem.builder()
                .id(content.id())
                .userId(userId)
                .subjectId(content.subjectId())
                .type(content.type())
                .title(content.title())
                .data(new LinkedHashMap<>(content.data()))
                .orderIndex(orderIndex)
                .timestamp(content.createdAt())
                .build();
    }
}
