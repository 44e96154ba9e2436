package com.jalarm.delivery.http;

import com.jalarm.config.JalarmProperties;
import com.jalarm.config.SecretsConfig;
import com.jalarm.delivery.TaskRunner;
import com.jalarm.error.SchedulingException.DeliveryFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hands a due schedule to the agent worker over HTTP. Endpoints are tried in
 * configured order; the first 2xx response wins.
 */
@Component
public class HttpTaskRunner implements TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(HttpTaskRunner.class);

    private final WebClient webClient;
    private final JalarmProperties properties;
    private final SecretsConfig secretsConfig;

    public HttpTaskRunner(WebClient.Builder webClientBuilder,
                          JalarmProperties properties,
                          SecretsConfig secretsConfig) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
        this.secretsConfig = secretsConfig;
    }

    @Override
    public Mono<Void> run(String ownerId, String scheduleId, String payload, String botToken) {
        List<String> endpoints = properties.getTaskRunner().getEndpoints();
        if (endpoints == null || endpoints.isEmpty()) {
            return Mono.error(new DeliveryFailureException("No task runner endpoints configured"));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chatId", ownerId);
        body.put("senderId", "system");
        body.put("isGroup", ownerId.startsWith("-"));
        body.put("scheduleId", scheduleId);
        body.put("prompt", payload);
        body.put("botToken", resolveToken(botToken));

        AtomicReference<Throwable> lastError = new AtomicReference<>();
        return Flux.fromIterable(endpoints)
                .concatMap(endpoint -> post(endpoint, body)
                        .thenReturn(endpoint)
                        .onErrorResume(e -> {
                            lastError.set(e);
                            log.warn("Task runner endpoint {} failed for schedule={}: {}",
                                    endpoint, scheduleId, describe(e));
                            return Mono.empty();
                        }))
                .next()
                .doOnNext(endpoint -> log.info("Schedule {} handed to {}", scheduleId, endpoint))
                .switchIfEmpty(Mono.defer(() -> Mono.error(new DeliveryFailureException(
                        "Failed to execute scheduled task: "
                                + (lastError.get() != null ? describe(lastError.get()) : "Unknown error"),
                        lastError.get()))))
                .then();
    }

    private Mono<Void> post(String endpoint, Map<String, Object> body) {
        WebClient.RequestBodySpec request = webClient.post()
                .uri(endpoint + properties.getTaskRunner().getPath())
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Scheduled-Task", "true");
        String apiKey = secretsConfig.getTaskRunnerApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            request = request.header("X-API-Key", apiKey);
        }
        return request.bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .then();
    }

    private String resolveToken(String botToken) {
        if (botToken != null && !botToken.isBlank()) {
            return botToken;
        }
        return secretsConfig.getTelegramBotToken();
    }

    private static String describe(Throwable e) {
        if (e instanceof WebClientResponseException wcre) {
            return wcre.getStatusCode().value() + " - " + wcre.getResponseBodyAsString();
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
