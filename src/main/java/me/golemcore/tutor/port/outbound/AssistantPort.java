package me.golemcore.tutor.port.outbound;

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

import me.golemcore.tutor.domain.model.AssistantInfo;
import me.golemcore.tutor.domain.model.AssistantRun;
import me.golemcore.tutor.domain.model.AssistantSpec;
import me.golemcore.tutor.domain.model.ToolOutput;

import java.util.List;
import java.util.Optional;

/**
 * Port for a remote assistant service offering persistent conversation
 * threads, tool-enabled assistants and asynchronous runs.
 *
 * <p>
 * All methods are blocking. Remote failures are raised as
 * {@link AssistantServiceException} carrying a classified reason code.
 */
public interface AssistantPort {

    String getProviderId();

    /**
     * Whether credentials are configured. When false, callers must not attempt
     * remote calls.
     */
    boolean isAvailable();

    String createThread();

    /**
     * Check that a previously created thread still resolves.
     */
    boolean threadExists(String threadId);

    void deleteThread(String threadId);

    void addUserMessage(String threadId, String content);

    AssistantInfo createAssistant(AssistantSpec spec);

    Optional<AssistantInfo> retrieveAssistant(String assistantId);

    void deleteAssistant(String assistantId);

    AssistantRun startRun(String threadId, String assistantId, String additionalInstructions);

    AssistantRun retrieveRun(String threadId, String runId);

    /**
     * Submit outputs for every pending tool call of a run in a single request.
     */
    AssistantRun submitToolOutputs(String threadId, String runId, List<ToolOutput> outputs);

    /**
     * Text of the most recent assistant message in the thread.
     */
    Optional<String> latestAssistantText(String threadId);
}
