package com.relationship.scoring.judgment;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class OpenAiJudgmentProviderTest {

    private static final JudgmentRequest REQUEST =
            new JudgmentRequest("001xx000003DGg2", "Judge the link.", "{\"flags\":{}}");

    @Nested
    @DisplayName("Unit Tests (no network required)")
    class UnitTests {

        @Test
        @DisplayName("Provider name includes model")
        void providerNameIncludesModel() {
            OpenAiJudgmentProvider provider = OpenAiJudgmentProvider.builder().apiKey("sk-test").build();
            assertEquals("OpenAI/gpt-4o", provider.getProviderName());
            assertEquals("gpt-4o", provider.getModel());
        }

        @Test
        @DisplayName("Builder creates provider with custom settings")
        void builderWithCustomSettings() {
            OpenAiJudgmentProvider provider = OpenAiJudgmentProvider.builder()
                    .baseUrl("http://localhost:8080/v1/")
                    .model("gpt-4o-mini")
                    .timeout(Duration.ofSeconds(5))
                    .apiKey("sk-test")
                    .build();

            assertEquals("OpenAI/gpt-4o-mini", provider.getProviderName());
        }

        @Test
        @DisplayName("Not available without an API key")
        void notAvailableWithoutKey() {
            assertFalse(OpenAiJudgmentProvider.builder().build().isAvailable());
            assertFalse(OpenAiJudgmentProvider.builder().apiKey("  ").build().isAvailable());
            assertTrue(OpenAiJudgmentProvider.builder().apiKey("sk-test").build().isAvailable());
        }
    }

    @Nested
    @DisplayName("HTTP Exchange Tests")
    class HttpExchangeTests {

        private HttpClient httpClient;
        private HttpResponse<String> response;
        private OpenAiJudgmentProvider provider;

        @BeforeEach
        @SuppressWarnings("unchecked")
        void setUp() {
            httpClient = mock(HttpClient.class);
            response = mock(HttpResponse.class);
            provider = OpenAiJudgmentProvider.builder()
                    .baseUrl("http://localhost:8080/v1/")
                    .apiKey("sk-test")
                    .httpClient(httpClient)
                    .build();
        }

        @Test
        @DisplayName("Returns the first choice's content")
        void returnsContent() throws Exception {
            when(response.statusCode()).thenReturn(200);
            when(response.body()).thenReturn("""
                    {"id": "chatcmpl-1", "object": "chat.completion",
                     "choices": [{"index": 0, "finish_reason": "stop",
                                  "message": {"role": "assistant", "content": "{\\"confidence_score\\": 80}"}}]}
                    """);
            doReturn(response).when(httpClient).send(any(), any());

            String content = provider.requestJudgment(REQUEST);

            assertEquals("{\"confidence_score\": 80}", content);
            ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
            verify(httpClient).send(captor.capture(), any());
            HttpRequest sent = captor.getValue();
            assertEquals("http://localhost:8080/v1/chat/completions", sent.uri().toString());
            assertEquals("POST", sent.method());
            assertEquals("Bearer sk-test", sent.headers().firstValue("Authorization").orElse(null));
        }

        @Test
        @DisplayName("Non-200 status raises JudgmentException")
        void non200Status() throws Exception {
            when(response.statusCode()).thenReturn(429);
            when(response.body()).thenReturn("rate limited");
            doReturn(response).when(httpClient).send(any(), any());

            JudgmentException e = assertThrows(JudgmentException.class, () -> provider.requestJudgment(REQUEST));
            assertEquals("Judgment service returned status 429: rate limited", e.getMessage());
        }

        @Test
        @DisplayName("Empty choices raise JudgmentException")
        void noChoices() throws Exception {
            when(response.statusCode()).thenReturn(200);
            when(response.body()).thenReturn("{\"id\": \"x\", \"choices\": []}");
            doReturn(response).when(httpClient).send(any(), any());

            JudgmentException e = assertThrows(JudgmentException.class, () -> provider.requestJudgment(REQUEST));
            assertEquals("Judgment service returned no choices", e.getMessage());
        }

        @Test
        @DisplayName("I/O failures are wrapped")
        void ioFailure() throws Exception {
            doThrow(new IOException("connection refused")).when(httpClient).send(any(), any());

            JudgmentException e = assertThrows(JudgmentException.class, () -> provider.requestJudgment(REQUEST));
            assertEquals("Error calling judgment service: connection refused", e.getMessage());
            assertInstanceOf(IOException.class, e.getCause());
        }

        @Test
        @DisplayName("Interruption restores the interrupt flag")
        void interrupted() throws Exception {
            doThrow(new InterruptedException("stop")).when(httpClient).send(any(), any());

            assertThrows(JudgmentException.class, () -> provider.requestJudgment(REQUEST));
            assertTrue(Thread.interrupted());
        }
    }
}
