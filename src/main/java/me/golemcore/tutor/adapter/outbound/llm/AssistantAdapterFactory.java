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

package me.golemcore.tutor.adapter.outbound.llm;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tutor.domain.model.AssistantInfo;
import me.golemcore.tutor.domain.model.AssistantRun;
import me.golemcore.tutor.domain.model.AssistantSpec;
import me.golemcore.tutor.domain.model.ToolOutput;
import me.golemcore.tutor.infrastructure.config.TutorProperties;
import me.golemcore.tutor.port.outbound.AssistantPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Factory for selecting the assistant adapter based on configuration.
 *
 * <p>
 * The active adapter is chosen by {@code tutor.llm.provider}:
 * <ul>
 * <li>openai-assistants - OpenAI Assistants v2 REST API
 * <li>langchain4j - in-process emulation on OpenAI or Anthropic chat models
 * <li>none - no-op adapter, every turn takes the fallback path
 * </ul>
 *
 * <p>
 * All adapters are always available as Spring beans. Selection happens in
 * {@link #init()}.
 *
 * @see OpenAiAssistantsAdapter
 * @see Langchain4jAssistantAdapter
 * @see NoOpAssistantAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class AssistantAdapterFactory implements AssistantPort {

    private final TutorProperties properties;
    private final List<AssistantProviderAdapter> adapters;

    private final Map<String, AssistantProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private AssistantProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (AssistantProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered assistant adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getLlm().getProvider();
        activeAdapter = adaptersByProvider.get(provider);
        if (activeAdapter == null) {
            activeAdapter = adaptersByProvider.get(NoOpAssistantAdapter.PROVIDER_ID);
            if (activeAdapter == null && !adapters.isEmpty()) {
                activeAdapter = adapters.get(0);
            }
            log.warn("Provider '{}' not found, using: {}", provider,
                    activeAdapter != null ? activeAdapter.getProviderId() : NoOpAssistantAdapter.PROVIDER_ID);
        } else {
            log.info("Active assistant provider: {} (available: {})", provider, activeAdapter.isAvailable());
        }
    }

    public AssistantPort getActiveAdapter() {
        return activeAdapter;
    }

    // ==================== AssistantPort delegation ====================

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : NoOpAssistantAdapter.PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }

    @Override
    public String createThread() {
        return activeAdapter.createThread();
    }

    @Override
    public boolean threadExists(String threadId) {
        return activeAdapter.threadExists(threadId);
    }

    @Override
    public void deleteThread(String threadId) {
        activeAdapter.deleteThread(threadId);
    }

    @Override
    public void addUserMessage(String threadId, String content) {
        activeAdapter.addUserMessage(threadId, content);
    }

    @Override
    public AssistantInfo createAssistant(AssistantSpec spec) {
        return activeAdapter.createAssistant(spec);
    }

    @Override
    public Optional<AssistantInfo> retrieveAssistant(String assistantId) {
        return activeAdapter.retrieveAssistant(assistantId);
    }

    @Override
    public void deleteAssistant(String assistantId) {
        activeAdapter.deleteAssistant(assistantId);
    }

    @Override
    public AssistantRun startRun(String threadId, String assistantId, String additionalInstructions) {
        return activeAdapter.startRun(threadId, assistantId, additionalInstructions);
    }

    @Override
    public AssistantRun retrieveRun(String threadId, String runId) {
        return activeAdapter.retrieveRun(threadId, runId);
    }

    @Override
    public AssistantRun submitToolOutputs(String threadId, String runId, List<ToolOutput> outputs) {
        return activeAdapter.submitToolOutputs(threadId, runId, outputs);
    }

    @Override
    public Optional<String> latestAssistantText(String threadId) {
        return activeAdapter.latestAssistantText(threadId);
    }
}
