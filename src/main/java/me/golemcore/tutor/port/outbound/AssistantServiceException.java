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

/**
 * Failure talking to the assistant service. The message is prefixed with a
 * machine-readable reason code, e.g. {@code [assistant.rate_limit] ...}.
 */
public class AssistantServiceException extends RuntimeException {

    private final String code;

    public AssistantServiceException(String code, String message) {
        super("[" + code + "] " + message);
        this.code = code;
    }

    public AssistantServiceException(String code, String message, Throwable cause) {
        super("[" + code + "] " + message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
