package com.jalarm.delivery.http;

import com.jalarm.config.JalarmProperties;
import com.jalarm.config.SecretsConfig;
import com.jalarm.error.SchedulingException.DeliveryFailureException;
import com.jalarm.support.CapturingExchangeFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HttpTaskRunnerTest {

    private final CapturingExchangeFunction exchange = new CapturingExchangeFunction();
    private final JalarmProperties properties = new JalarmProperties();
    private final SecretsConfig secrets = mock(SecretsConfig.class);
    private HttpTaskRunner runner;

    @BeforeEach
    void setUp() {
        properties.getTaskRunner().setEndpoints(List.of("http://worker-a:8787", "http://worker-b:8787"));
        when(secrets.getTelegramBotToken()).thenReturn("123456789:AAE_test-token-value-0123456789abcdef");
        when(secrets.getTaskRunnerApiKey()).thenReturn("runner-key");
        runner = new HttpTaskRunner(WebClient.builder().exchangeFunction(exchange), properties, secrets);
    }

    @Test
    void postsScheduledTaskToFirstEndpoint() {
        exchange.respond(HttpStatus.OK, "{}");

        StepVerifier.create(runner.run("-100777", "morning-weather", "What's the weather?", null))
                .verifyComplete();

        assertEquals(1, exchange.requests().size());
        CapturingExchangeFunction.CapturedRequest request = exchange.requests().get(0);
        assertEquals("http://worker-a:8787/scheduled-task", request.url());
        assertEquals("true", request.header("X-Scheduled-Task"));
        assertEquals("runner-key", request.header("X-API-Key"));
        assertTrue(request.body().contains("\"chatId\":\"-100777\""));
        assertTrue(request.body().contains("\"senderId\":\"system\""));
        assertTrue(request.body().contains("\"isGroup\":true"));
        assertTrue(request.body().contains("\"scheduleId\":\"morning-weather\""));
        assertTrue(request.body().contains("\"prompt\":\"What's the weather?\""));
        assertTrue(request.body().contains("\"botToken\":\"123456789:AAE_test-token-value-0123456789abcdef\""));
    }

    @Test
    void ownerBotTokenTakesPrecedenceOverDefault() {
        exchange.respond(HttpStatus.OK, "{}");

        StepVerifier.create(runner.run("42", "digest", "Summarize", "987654321:AAF_second-bot"))
                .verifyComplete();

        String body = exchange.requests().get(0).body();
        assertTrue(body.contains("\"botToken\":\"987654321:AAF_second-bot\""));
        assertFalse(body.contains("123456789:AAE"));
    }

    @Test
    void triesNextEndpointAfterFailure() {
        exchange.fail(new IOException("Connection refused"))
                .respond(HttpStatus.OK, "{}");

        StepVerifier.create(runner.run("42", "digest", "Summarize", null))
                .verifyComplete();

        assertEquals(2, exchange.requests().size());
        assertEquals("http://worker-b:8787/scheduled-task", exchange.requests().get(1).url());
        assertTrue(exchange.requests().get(1).body().contains("\"isGroup\":false"));
    }

    @Test
    void allEndpointsFailingIsDeliveryFailureWithLastError() {
        exchange.respond(HttpStatus.SERVICE_UNAVAILABLE, "starting")
                .respond(HttpStatus.INTERNAL_SERVER_ERROR, "worker crashed");

        StepVerifier.create(runner.run("42", "digest", "Summarize", null))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(DeliveryFailureException.class, e);
                    assertEquals("Failed to execute scheduled task: 500 - worker crashed", e.getMessage());
                })
                .verify();
    }

    @Test
    void omitsApiKeyHeaderWhenNotConfigured() {
        when(secrets.getTaskRunnerApiKey()).thenReturn("");
        exchange.respond(HttpStatus.OK, "{}");

        StepVerifier.create(runner.run("42", "digest", "Summarize", null)).verifyComplete();

        assertNull(exchange.requests().get(0).header("X-API-Key"));
    }

    @Test
    void noEndpointsConfiguredFailsFast() {
        properties.getTaskRunner().setEndpoints(List.of());

        StepVerifier.create(runner.run("42", "digest", "Summarize", null))
                .expectError(DeliveryFailureException.class)
                .verify();
        assertTrue(exchange.requests().isEmpty());
    }
}
