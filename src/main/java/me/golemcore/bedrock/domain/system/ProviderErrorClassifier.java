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

package me.golemcore.bedrock.domain.system;

import me.golemcore.bedrock.domain.model.ProviderException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Machine-readable codes for model runtime failures.
 *
 * <p>
 * Codes travel as a prefix of the exception message ({@code [bedrock.throttling]
 * Too many requests}) so they survive wrapping. Only throttling and
 * service-unavailable codes are transient.
 */
public final class ProviderErrorClassifier {

    public static final String THROTTLING = "bedrock.throttling";
    public static final String SERVICE_UNAVAILABLE = "bedrock.service_unavailable";
    public static final String AUTHENTICATION = "bedrock.authentication";
    public static final String VALIDATION = "bedrock.validation";
    public static final String MODEL_NOT_FOUND = "bedrock.model_not_found";
    public static final String MODEL_TIMEOUT = "bedrock.model_timeout";
    public static final String INTERNAL_SERVER = "bedrock.internal_server";
    public static final String HTTP_ERROR = "bedrock.http_error";
    public static final String TRANSPORT = "bedrock.transport";
    public static final String REQUEST_TIMEOUT = "bedrock.request.timeout";
    public static final String REQUEST_ABORTED = "bedrock.request.aborted";
    public static final String NOT_CONFIGURED = "bedrock.not_configured";
    public static final String UNKNOWN = "bedrock.error.unknown";

    private static final String THROTTLING_EXCEPTION = "throttlingexception";
    private static final String SERVICE_UNAVAILABLE_EXCEPTION = "serviceunavailableexception";

    private ProviderErrorClassifier() {
    }

    /**
     * Classify an HTTP error response.
     *
     * @param status
     *            HTTP status code
     * @param errorType
     *            value of the {@code x-amzn-ErrorType} header or the
     *            {@code __type} body field, may be null
     */
    public static String classifyHttp(int status, String errorType) {
        String type = errorType != null ? errorType.toLowerCase(Locale.ROOT) : "";
        if (status == 429 || type.contains(THROTTLING_EXCEPTION)) {
            return THROTTLING;
        }
        if (status == 503 || type.contains(SERVICE_UNAVAILABLE_EXCEPTION)) {
            return SERVICE_UNAVAILABLE;
        }
        if (status == 401 || status == 403) {
            return AUTHENTICATION;
        }
        if (status == 404) {
            return MODEL_NOT_FOUND;
        }
        if (status == 408 || status == 504) {
            return MODEL_TIMEOUT;
        }
        if (status >= 500) {
            return INTERNAL_SERVER;
        }
        if (status >= 400) {
            return VALIDATION;
        }
        return HTTP_ERROR;
    }

    /**
     * Classify a failure by walking its cause chain.
     */
    public static String classifyFromThrowable(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            if (current instanceof ProviderException providerException) {
                return providerException.getCode();
            }
            String embedded = extractCode(current.getMessage());
            if (embedded != null) {
                return embedded;
            }
            if (current instanceof CancellationException || current instanceof InterruptedException) {
                return REQUEST_ABORTED;
            }
            if (current instanceof SocketTimeoutException || current instanceof TimeoutException) {
                return REQUEST_TIMEOUT;
            }
            if (current instanceof IOException) {
                return TRANSPORT;
            }
            current = current.getCause();
        }
        return UNKNOWN;
    }

    /**
     * Prefix a human diagnostic with a machine-readable code.
     */
    public static String withCode(String code, String message) {
        if (message == null || message.isBlank()) {
            return "[" + code + "]";
        }
        if (message.startsWith("[" + code + "]")) {
            return message;
        }
        return "[" + code + "] " + message;
    }

    /**
     * Extract a code from diagnostics like: "[bedrock.some.code] details".
     */
    public static String extractCode(String message) {
        if (message == null || message.isBlank() || message.charAt(0) != '[') {
            return null;
        }
        int end = message.indexOf(']');
        if (end <= 1) {
            return null;
        }
        return message.substring(1, end);
    }

    public static boolean isTransientCode(String code) {
        return THROTTLING.equals(code) || SERVICE_UNAVAILABLE.equals(code);
    }
}
