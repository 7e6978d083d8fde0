package me.golemcore.bedrock.adapter.outbound.bedrock;

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Request;
import feign.Response;
import me.golemcore.bedrock.domain.model.PermanentProviderException;
import me.golemcore.bedrock.domain.model.TransientProviderException;
import me.golemcore.bedrock.domain.system.ProviderErrorClassifier;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BedrockErrorDecoderTest {

    private static final String METHOD_KEY = "BedrockRuntimeApi#invokeModel(String,String,ObjectNode)";

    private final BedrockErrorDecoder decoder = new BedrockErrorDecoder(new ObjectMapper());

    @Test
    void shouldDecodeThrottlingAsTransient() {
        Response response = response(429,
                Map.of("x-amzn-ErrorType", List.of("ThrottlingException:http://internal.amazon.com/coral/")),
                "{\"message\":\"Too many requests\"}");

        Exception exception = decoder.decode(METHOD_KEY, response);

        TransientProviderException transientException = assertInstanceOf(TransientProviderException.class,
                exception);
        assertEquals(ProviderErrorClassifier.THROTTLING, transientException.getCode());
        assertEquals(429, transientException.getStatusCode());
        assertEquals("[bedrock.throttling] HTTP 429 ThrottlingException: Too many requests",
                transientException.getMessage());
    }

    @Test
    void shouldDecodeServiceUnavailableStatusWithoutBody() {
        Exception exception = decoder.decode(METHOD_KEY, response(503, Map.of(), null));

        TransientProviderException transientException = assertInstanceOf(TransientProviderException.class,
                exception);
        assertEquals(ProviderErrorClassifier.SERVICE_UNAVAILABLE, transientException.getCode());
    }

    @Test
    void shouldPreferErrorTypeOverStatus() {
        Response response = response(400, Map.of(), "{\"__type\":\"ServiceUnavailableException\"}");

        assertInstanceOf(TransientProviderException.class, decoder.decode(METHOD_KEY, response));
    }

    @Test
    void shouldDecodeValidationAsPermanent() {
        Response response = response(400, Map.of(),
                "{\"__type\":\"com.amazon.coral.validate#ValidationException\",\"message\":\"Malformed input\"}");

        PermanentProviderException exception = assertInstanceOf(PermanentProviderException.class,
                decoder.decode(METHOD_KEY, response));
        assertEquals(ProviderErrorClassifier.VALIDATION, exception.getCode());
        assertEquals("[bedrock.validation] HTTP 400 ValidationException: Malformed input", exception.getMessage());
    }

    @Test
    void shouldDecodeAuthenticationFailure() {
        PermanentProviderException exception = assertInstanceOf(PermanentProviderException.class,
                decoder.decode(METHOD_KEY, response(403, Map.of(), "{\"Message\":\"Invalid API key\"}")));

        assertEquals(ProviderErrorClassifier.AUTHENTICATION, exception.getCode());
        assertTrue(exception.getMessage().endsWith("Invalid API key"));
    }

    @Test
    void shouldToleratePlainTextBody() {
        PermanentProviderException exception = assertInstanceOf(PermanentProviderException.class,
                decoder.decode(METHOD_KEY, response(500, Map.of(), "upstream exploded")));

        assertEquals(ProviderErrorClassifier.INTERNAL_SERVER, exception.getCode());
        assertEquals("[bedrock.internal_server] HTTP 500", exception.getMessage());
    }

    private static Response response(int status, Map<String, List<String>> headers, String body) {
        Request request = Request.create(Request.HttpMethod.POST, "http://mock.bedrock.local/model/m/invoke",
                Map.of(), null, StandardCharsets.UTF_8, null);
        Response.Builder builder = Response.builder()
                .status(status)
                .reason("mock")
                .request(request)
                .headers(Map.<String, Collection<String>>copyOf(headers));
        if (body != null) {
            builder.body(body, StandardCharsets.UTF_8);
        }
        return builder.build();
    }
}
