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

package me.golemcore.bedrock.adapter.outbound.bedrock;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Response;
import feign.Util;
import feign.codec.ErrorDecoder;
import lombok.RequiredArgsConstructor;
import me.golemcore.bedrock.domain.model.PermanentProviderException;
import me.golemcore.bedrock.domain.model.ProviderException;
import me.golemcore.bedrock.domain.model.TransientProviderException;
import me.golemcore.bedrock.domain.system.ProviderErrorClassifier;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collection;

/**
 * Maps Bedrock error responses to provider exceptions. Throttling and
 * service-unavailable responses become {@link TransientProviderException},
 * anything else {@link PermanentProviderException}.
 *
 * <p>
 * The error type is read from the {@code x-amzn-ErrorType} header, falling
 * back to the {@code __type} field of the JSON body.
 */
@RequiredArgsConstructor
public class BedrockErrorDecoder implements ErrorDecoder {

    static final String ERROR_TYPE_HEADER = "x-amzn-ErrorType";

    private final ObjectMapper objectMapper;

    @Override
    public Exception decode(String methodKey, Response response) {
        int status = response.status();
        JsonNode body = readBody(response);
        String errorType = errorType(response, body);
        String code = ProviderErrorClassifier.classifyHttp(status, errorType);

        String detail = body.path("message").asText(body.path("Message").asText(""));
        StringBuilder message = new StringBuilder("HTTP ").append(status);
        if (errorType != null) {
            message.append(' ').append(shortType(errorType));
        }
        if (!detail.isBlank()) {
            message.append(": ").append(detail);
        }

        String diagnostic = ProviderErrorClassifier.withCode(code, message.toString());
        ProviderException exception = ProviderErrorClassifier.isTransientCode(code)
                ? new TransientProviderException(code, status, diagnostic)
                : new PermanentProviderException(code, status, diagnostic);
        return exception;
    }

    private JsonNode readBody(Response response) {
        if (response.body() == null) {
            return objectMapper.createObjectNode();
        }
        try (Reader reader = response.body().asReader(StandardCharsets.UTF_8)) {
            String raw = Util.toString(reader);
            if (raw.isBlank()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(raw);
        } catch (IOException e) {
            // Not JSON: classification falls back to status and header
            return objectMapper.createObjectNode();
        }
    }

    private static String errorType(Response response, JsonNode body) {
        Collection<String> values = response.headers().get(ERROR_TYPE_HEADER);
        if (values != null && !values.isEmpty()) {
            return values.iterator().next();
        }
        String type = body.path("__type").asText("");
        return type.isBlank() ? null : type;
    }

    // "ThrottlingException:http://internal.amazon.com/..." -> "ThrottlingException"
    private static String shortType(String errorType) {
        int colon = errorType.indexOf(':');
        String type = colon > 0 ? errorType.substring(0, colon) : errorType;
        int hash = type.lastIndexOf('#');
        return hash >= 0 ? type.substring(hash + 1) : type;
    }
}
