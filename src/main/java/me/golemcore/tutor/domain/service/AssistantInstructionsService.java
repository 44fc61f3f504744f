package me.golemcore.tutor.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.tutor.infrastructure.config.TutorProperties;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Renders the assistant instructions from the configured prompt template.
 * The template is read once; {@code {{subject}}} is replaced per subject.
 */
@Service
@Slf4j
public class AssistantInstructionsService {

    static final String SUBJECT_PLACEHOLDER = "{{subject}}";
    private static final String FALLBACK_TEMPLATE = "You are an adaptive tutor teaching " + SUBJECT_PLACEHOLDER
            + ". Use the available tools to plan lessons, generate interactive content and track progress.";

    private final String template;

    public AssistantInstructionsService(TutorProperties properties, ResourceLoader resourceLoader) {
        this.template = load(resourceLoader, properties.getPrompts().getInstructionsTemplate());
    }

    public String render(String subjectName) {
        String subject = subjectName != null && !subjectName.isBlank() ? subjectName : "this subject";
        return template.replace(SUBJECT_PLACEHOLDER, subject);
    }

    private static String load(ResourceLoader resourceLoader, String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("[Session] Instructions template not found at {}, using built-in default", location);
            return FALLBACK_TEMPLATE;
        }
        try (InputStream is = resource.getInputStream()) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read instructions template " + location, e);
        }
    }
}
