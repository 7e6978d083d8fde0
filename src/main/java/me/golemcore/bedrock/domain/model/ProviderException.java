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
package me.golemcore.bedrock.domain.model;

/**
 * Failure reported by the model provider or the transport in front of it.
 * {@link #getCode()} carries the machine-readable classification.
 */
public abstract class ProviderException extends RuntimeException {

    private final String code;
    private final int statusCode;

    protected ProviderException(String code, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    /**
     * HTTP status of the failed call, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Whether a connection refresh should precede the next attempt.
     */
    public abstract boolean isTransient();
}
