package me.golemcore.tutor.domain.loop;

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
import me.golemcore.tutor.domain.model.AssistantRun;
import me.golemcore.tutor.infrastructure.config.TutorProperties;
import me.golemcore.tutor.port.outbound.AssistantPort;
import me.golemcore.tutor.port.outbound.AssistantServiceException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Polls a run at a fixed interval until it leaves the queued and in-progress
 * states. Polling gives up after the caller's timeout, or
 * {@code tutor.run.timeout} when none is given; interrupting the polling
 * thread aborts it.
 */
@Component
@Slf4j
public class RunPoller {

    private final AssistantPort assistantPort;
    private final TutorProperties.RunProperties runProperties;
    private final Sleeper sleeper;

    @Autowired
    public RunPoller(AssistantPort assistantPort, TutorProperties properties) {
        this(assistantPort, properties.getRun(), Thread::sleep);
    }

    RunPoller(AssistantPort assistantPort, TutorProperties.RunProperties runProperties, Sleeper sleeper) {
        this.assistantPort = assistantPort;
        this.runProperties = runProperties;
        this.sleeper = sleeper;
    }

    /**
     * @return the first snapshot of the run that is no longer pending
     * @throws AssistantServiceException
     *             {@code assistant.timeout} when the deadline passes,
     *             {@code assistant.aborted} when interrupted
     */
    public AssistantRun awaitSettled(AssistantRun run) {
        return awaitSettled(run, null);
    }

    /**
     * Same as {@link #awaitSettled(AssistantRun)} with a caller-supplied
     * deadline; {@code null} falls back to {@code tutor.run.timeout}.
     */
    public AssistantRun awaitSettled(AssistantRun run, Duration requestedTimeout) {
        Duration interval = runProperties.getPollInterval();
        Duration timeout = requestedTimeout != null ? requestedTimeout : runProperties.getTimeout();
        long maxPolls = maxPolls(interval, timeout);

        AssistantRun current = run;
        long polls = 0;
        while (current.getStatus() == null || current.getStatus().isPending()) {
            if (polls >= maxPolls) {
                log.warn("[Orchestrator] Run {} still {} after {}", current.getId(), current.getStatus(), timeout);
                throw new AssistantServiceException(AssistantErrorClassifier.TIMEOUT,
                        "Run " + current.getId() + " did not finish within " + timeout);
            }
            pause(interval.toMillis());
            current = assistantPort.retrieveRun(run.getThreadId(), run.getId());
            polls++;
        }
        log.debug("[Orchestrator] Run {} settled as {} after {} polls", current.getId(), current.getStatus(), polls);
        return current;
    }

    static long maxPolls(Duration interval, Duration timeout) {
        long intervalMillis = Math.max(1L, interval.toMillis());
        return Math.max(1L, (timeout.toMillis() + intervalMillis - 1) / intervalMillis);
    }

    private void pause(long millis) {
        if (Thread.currentThread().isInterrupted()) {
            throw new AssistantServiceException(AssistantErrorClassifier.ABORTED, "Polling interrupted");
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssistantServiceException(AssistantErrorClassifier.ABORTED, "Polling interrupted", e);
        }
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
