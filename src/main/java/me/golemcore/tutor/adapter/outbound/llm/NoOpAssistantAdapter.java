package me.golemcore.tutor.adapter.outbound.llm;

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
import me.golemcore.tutor.domain.loop.AssistantErrorClassifier;
import me.golemcore.tutor.domain.model.AssistantInfo;
import me.golemcore.tutor.domain.model.AssistantRun;
import me.golemcore.tutor.domain.model.AssistantSpec;
import me.golemcore.tutor.domain.model.ToolOutput;
import me.golemcore.tutor.port.outbound.AssistantServiceException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * No-op assistant adapter used when no assistant service is configured.
 *
 * <p>
 * It reports itself unavailable, so the orchestrator never reaches the remote
 * operations; if it does, they fail with
 * {@link AssistantErrorClassifier#NOT_CONFIGURED}.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpAssistantAdapter implements AssistantProviderAdapter {

    public static final String PROVIDER_ID = "none";

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String createThread() {
        throw notConfigured("createThread");
    }

    @Override
    public boolean threadExists(String threadId) {
        return false;
    }

    @Override
    public void deleteThread(String threadId) {
        // nothing was created
    }

    @Override
    public void addUserMessage(String threadId, String content) {
        throw notConfigured("addUserMessage");
    }

    @Override
    public AssistantInfo createAssistant(AssistantSpec spec) {
        throw notConfigured("createAssistant");
    }

    @Override
    public Optional<AssistantInfo> retrieveAssistant(String assistantId) {
        return Optional.empty();
    }

    @Override
    public void deleteAssistant(String assistantId) {
        // nothing was created
    }

    @Override
    public AssistantRun startRun(String threadId, String assistantId, String additionalInstructions) {
        throw notConfigured("startRun");
    }

    @Override
    public AssistantRun retrieveRun(String threadId, String runId) {
        throw notConfigured("retrieveRun");
    }

    @Override
    public AssistantRun submitToolOutputs(String threadId, String runId, List<ToolOutput> outputs) {
        throw notConfigured("submitToolOutputs");
    }

    @Override
    public Optional<String> latestAssistantText(String threadId) {
        return Optional.empty();
    }

    private static AssistantServiceException notConfigured(String operation) {
        log.warn("NoOpAssistantAdapter: {}() called - no assistant service configured", operation);
        return new AssistantServiceException(AssistantErrorClassifier.NOT_CONFIGURED,
                "No assistant service configured");
    }
}
