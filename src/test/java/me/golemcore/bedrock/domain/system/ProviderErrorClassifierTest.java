package me.golemcore.bedrock.domain.system;

import me.golemcore.bedrock.domain.model.TransientProviderException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class ProviderErrorClassifierTest {

    @ParameterizedTest
    @CsvSource({
            "429, , bedrock.throttling",
            "400, ThrottlingException, bedrock.throttling",
            "503, , bedrock.service_unavailable",
            "500, ServiceUnavailableException:http://internal, bedrock.service_unavailable",
            "401, , bedrock.authentication",
            "403, AccessDeniedException, bedrock.authentication",
            "404, ResourceNotFoundException, bedrock.model_not_found",
            "408, , bedrock.model_timeout",
            "424, ModelErrorException, bedrock.validation",
            "500, InternalServerException, bedrock.internal_server",
            "302, , bedrock.http_error"
    })
    void shouldClassifyHttpStatus(int status, String errorType, String expected) {
        assertEquals(expected, ProviderErrorClassifier.classifyHttp(status, errorType));
    }

    @Test
    void shouldTreatOnlyThrottlingAndUnavailableAsTransient() {
        assertTrue(ProviderErrorClassifier.isTransientCode(ProviderErrorClassifier.THROTTLING));
        assertTrue(ProviderErrorClassifier.isTransientCode(ProviderErrorClassifier.SERVICE_UNAVAILABLE));
        assertFalse(ProviderErrorClassifier.isTransientCode(ProviderErrorClassifier.INTERNAL_SERVER));
        assertFalse(ProviderErrorClassifier.isTransientCode(ProviderErrorClassifier.REQUEST_TIMEOUT));
        assertFalse(ProviderErrorClassifier.isTransientCode(null));
    }

    @Test
    void shouldReadCodeFromProviderException() {
        TransientProviderException exception = new TransientProviderException(
                ProviderErrorClassifier.THROTTLING, 429, "slow down");

        assertEquals(ProviderErrorClassifier.THROTTLING,
                ProviderErrorClassifier.classifyFromThrowable(new RuntimeException("wrapped", exception)));
    }

    @Test
    void shouldReadEmbeddedCodeFromMessage() {
        RuntimeException exception = new RuntimeException("[bedrock.validation] HTTP 400");

        assertEquals(ProviderErrorClassifier.VALIDATION, ProviderErrorClassifier.classifyFromThrowable(exception));
    }

    @Test
    void shouldClassifyTransportFailuresFromCauseChain() {
        assertEquals(ProviderErrorClassifier.REQUEST_TIMEOUT, ProviderErrorClassifier.classifyFromThrowable(
                new RuntimeException("read failed", new SocketTimeoutException("timeout"))));
        assertEquals(ProviderErrorClassifier.TRANSPORT, ProviderErrorClassifier.classifyFromThrowable(
                new RuntimeException("send failed", new IOException("connection reset"))));
        assertEquals(ProviderErrorClassifier.REQUEST_ABORTED,
                ProviderErrorClassifier.classifyFromThrowable(new CancellationException()));
        assertEquals(ProviderErrorClassifier.UNKNOWN,
                ProviderErrorClassifier.classifyFromThrowable(new IllegalStateException("boom")));
        assertEquals(ProviderErrorClassifier.UNKNOWN, ProviderErrorClassifier.classifyFromThrowable(null));
    }

    @Test
    void shouldPrefixMessageWithCodeOnce() {
        String tagged = ProviderErrorClassifier.withCode(ProviderErrorClassifier.THROTTLING, "slow down");

        assertEquals("[bedrock.throttling] slow down", tagged);
        assertEquals(tagged, ProviderErrorClassifier.withCode(ProviderErrorClassifier.THROTTLING, tagged));
        assertEquals("[bedrock.throttling]", ProviderErrorClassifier.withCode(ProviderErrorClassifier.THROTTLING,
                null));
        assertEquals(ProviderErrorClassifier.THROTTLING, ProviderErrorClassifier.extractCode(tagged));
        assertNull(ProviderErrorClassifier.extractCode("no code here"));
        assertNull(ProviderErrorClassifier.extractCode("[] empty"));
    }
}
