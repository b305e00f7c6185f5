package me.golemcore.datapilot.adapter.outbound.provider;

import dev.langchain4j.exception.RateLimitException;
import feign.FeignException;
import feign.RetryableException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TransientErrorClassifierTest {

    @Test
    void shouldTreatRateLimitsAndTimeoutsAsTransient() {
        assertTrue(TransientErrorClassifier.isTransient(mock(RateLimitException.class)));
        assertTrue(TransientErrorClassifier.isTransient(new TimeoutException()));
        assertTrue(TransientErrorClassifier.isTransient(new SocketTimeoutException("read")));
        assertTrue(TransientErrorClassifier.isTransient(mock(RetryableException.class)));
    }

    @Test
    void shouldLookThroughCauseChain() {
        RuntimeException wrapped = new RuntimeException("call failed", new IOException("Connection reset"));

        assertTrue(TransientErrorClassifier.isTransient(wrapped));
    }

    @Test
    void shouldUseMessageMarkers() {
        assertTrue(TransientErrorClassifier.isTransient(new RuntimeException("HTTP 429 Too Many Requests")));
        assertTrue(TransientErrorClassifier.isTransient(new RuntimeException("Anthropic API is overloaded")));
        assertFalse(TransientErrorClassifier.isTransient(new RuntimeException("invalid x-api-key")));
        assertFalse(TransientErrorClassifier.isTransient(null));
    }

    @Test
    void shouldClassifyFeignStatusCodes() {
        assertTrue(TransientErrorClassifier.isTransient(feignError(503)));
        assertTrue(TransientErrorClassifier.isTransient(feignError(429)));
        assertTrue(TransientErrorClassifier.isTransient(feignError(408)));
        assertFalse(TransientErrorClassifier.isTransient(feignError(401)));
        assertFalse(TransientErrorClassifier.isTransient(feignError(400)));
    }

    @Test
    void shouldExtractResetHints() {
        assertEquals(12, TransientErrorClassifier.resetHintSeconds(
                new RuntimeException("{\"error\":\"rate_limit\",\"reset_seconds\": 12}")));
        assertEquals(30, TransientErrorClassifier.resetHintSeconds(
                new RuntimeException("wrapper", new RuntimeException("Retry-After: 30"))));
        assertEquals(-1, TransientErrorClassifier.resetHintSeconds(new RuntimeException("busy")));
    }

    private static FeignException feignError(int status) {
        FeignException exception = mock(FeignException.class);
        when(exception.status()).thenReturn(status);
        return exception;
    }
}
