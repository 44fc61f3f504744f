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

import me.golemcore.tutor.port.outbound.AssistantServiceException;

import java.io.InterruptedIOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies assistant-service failures into stable machine-readable reason
 * codes.
 */
public final class AssistantErrorClassifier {

    public static final String AUTH = "assistant.auth";
    public static final String RATE_LIMIT = "assistant.rate_limit";
    public static final String MODEL_UNAVAILABLE = "assistant.model_unavailable";
    public static final String CONTEXT_LENGTH_EXCEEDED = "assistant.context_length_exceeded";
    public static final String ASSISTANT_MISSING = "assistant.assistant";
    public static final String THREAD = "assistant.thread";
    public static final String RUN_FAILED = "assistant.run_failed";
    public static final String INVALID_REQUEST = "assistant.invalid_request";
    public static final String SERVER_ERROR = "assistant.server_error";
    public static final String TIMEOUT = "assistant.timeout";
    public static final String ABORTED = "assistant.aborted";
    public static final String NOT_CONFIGURED = "assistant.not_configured";
    public static final String UNKNOWN = "assistant.error.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";

    private AssistantErrorClassifier() {
    }

    /**
     * Wrap any failure into an {@link AssistantServiceException}, keeping the
     * code of an already classified one.
     */
    public static AssistantServiceException wrap(String operation, Throwable throwable) {
        if (throwable instanceof AssistantServiceException classified) {
            return classified;
        }
        String code = classifyFromThrowable(throwable);
        String detail = throwable != null && throwable.getMessage() != null
                ? throwable.getMessage()
                : throwable != null ? throwable.getClass().getSimpleName() : "unknown";
        return new AssistantServiceException(code, operation + " failed: " + detail, throwable);
    }

    /**
     * Classify a failure based on the throwable types in its cause chain.
     */
    public static String classifyFromThrowable(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            if (current instanceof AssistantServiceException classified) {
                return classified.getCode();
            }

            String byType = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }

            String byMessage = classifyFromMessage(current.getMessage());
            if (!UNKNOWN.equals(byMessage)) {
                return byMessage;
            }

            current = current.getCause();
        }
        return UNKNOWN;
    }

    /**
     * Map an HTTP status of the assistant service to a reason code. The
     * response body refines 400 and 404 answers.
     */
    public static String classifyHttpStatus(int status, String body) {
        String fromBody = classifyFromMessage(body);
        if (status == 401 || status == 403) {
            return AUTH;
        }
        if (status == 429) {
            return RATE_LIMIT;
        }
        if (status == 408 || status == 504) {
            return TIMEOUT;
        }
        if (status >= 500) {
            return SERVER_ERROR;
        }
        if (!UNKNOWN.equals(fromBody)) {
            return fromBody;
        }
        if (status == 404) {
            return THREAD;
        }
        if (status >= 400) {
            return INVALID_REQUEST;
        }
        return UNKNOWN;
    }

    /**
     * Map a run's {@code last_error.code} to a reason code.
     */
    public static String classifyRunError(String lastErrorCode) {
        if (lastErrorCode == null || lastErrorCode.isBlank()) {
            return RUN_FAILED;
        }
        return switch (lastErrorCode.toLowerCase(Locale.ROOT)) {
        case "rate_limit_exceeded" -> RATE_LIMIT;
        case "invalid_prompt" -> INVALID_REQUEST;
        case "server_error" -> SERVER_ERROR;
        default -> RUN_FAILED;
        };
    }

    public static boolean isTransientCode(String code) {
        return RATE_LIMIT.equals(code) || TIMEOUT.equals(code) || SERVER_ERROR.equals(code);
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return ABORTED;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return TIMEOUT;
        }
        if (throwable instanceof InterruptedIOException) {
            return ABORTED;
        }

        String className = throwable.getClass().getName();
        if (className.startsWith("feign.")) {
            Integer status = readStatus(throwable, "status");
            if (status != null && status > 0) {
                return classifyHttpStatus(status, throwable.getMessage());
            }
            return UNKNOWN;
        }
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return UNKNOWN;
        }
        String simpleName = throwable.getClass().getSimpleName();
        return switch (simpleName) {
        case "RateLimitException" -> RATE_LIMIT;
        case "TimeoutException" -> TIMEOUT;
        case "AuthenticationException" -> AUTH;
        case "ModelNotFoundException", "UnresolvedModelServerException" -> MODEL_UNAVAILABLE;
        case "InvalidRequestException", "ContentFilteredException", "UnsupportedFeatureException" -> INVALID_REQUEST;
        case "InternalServerException" -> SERVER_ERROR;
        case "HttpException" -> {
            Integer status = readStatus(throwable, "statusCode");
            yield status != null ? classifyHttpStatus(status, throwable.getMessage()) : UNKNOWN;
        }
        default -> UNKNOWN;
        };
    }

    private static Integer readStatus(Throwable throwable, String accessor) {
        try {
            Method method = throwable.getClass().getMethod(accessor);
            Object result = method.invoke(throwable);
            if (result instanceof Integer status) {
                return status;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
            return null;
        }
        return null;
    }

    private static String classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN;
        }

        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("context_length_exceeded")
                || normalized.contains("context length")
                || normalized.contains("maximum context")
                || normalized.contains("prompt is too long")) {
            return CONTEXT_LENGTH_EXCEEDED;
        }
        if (normalized.contains("model_not_found")
                || normalized.contains("does not exist or you do not have access")
                || normalized.contains("unsupported model")) {
            return MODEL_UNAVAILABLE;
        }
        if (normalized.contains("no assistant found")) {
            return ASSISTANT_MISSING;
        }
        if (normalized.contains("no thread found")) {
            return THREAD;
        }
        return UNKNOWN;
    }
}
