package com.jalarm.delivery.telegram;

import com.jalarm.config.JalarmProperties;
import com.jalarm.config.SecretsConfig;
import com.jalarm.delivery.Notifier;
import com.jalarm.error.SchedulingException.DeliveryFailureException;
import com.jalarm.reminder.DeliveryTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends reminders through the Telegram Bot API. Tries a MarkdownV2 message first and
 * falls back to plain text when Telegram rejects the formatted variant.
 */
@Component
public class TelegramNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

    private static final String MARKDOWN_SPECIALS = "_*[]()~`>#+-=|{}.!\\";

    private final WebClient webClient;
    private final SecretsConfig secretsConfig;

    public TelegramNotifier(WebClient.Builder webClientBuilder,
                            JalarmProperties properties,
                            SecretsConfig secretsConfig) {
        this.webClient = webClientBuilder
                .baseUrl(properties.getTelegram().getApiBase())
                .build();
        this.secretsConfig = secretsConfig;
    }

    @Override
    public String channelType() { return "telegram"; }

    @Override
    public Mono<Void> send(DeliveryTarget target, String payload) {
        String token = resolveToken(target);
        if (token == null) {
            return Mono.error(new DeliveryFailureException(
                    "No bot token configured for chat " + target.getChatId()));
        }

        Map<String, Object> rich = new LinkedHashMap<>();
        rich.put("chat_id", target.getChatId());
        rich.put("text", "⏰ *Reminder*\n\n" + escapeMarkdown(payload));
        rich.put("parse_mode", "MarkdownV2");

        Map<String, Object> plain = new LinkedHashMap<>();
        plain.put("chat_id", target.getChatId());
        plain.put("text", "⏰ Reminder\n\n" + payload);

        return post(token, rich)
                .onErrorResume(WebClientResponseException.class, e -> {
                    log.warn("Formatted send to chat={} rejected with {}, retrying as plain text",
                            target.getChatId(), e.getStatusCode().value());
                    return post(token, plain);
                })
                .onErrorMap(WebClientResponseException.class, e -> new DeliveryFailureException(
                        "Telegram API error: " + e.getStatusCode().value() + " - " + e.getResponseBodyAsString(), e));
    }

    private Mono<Void> post(String token, Map<String, Object> body) {
        return webClient.post()
                .uri("/bot" + token + "/sendMessage")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .then();
    }

    private String resolveToken(DeliveryTarget target) {
        if (target.getBotToken() != null && !target.getBotToken().isBlank()) {
            return target.getBotToken();
        }
        String fallback = secretsConfig.getTelegramBotToken();
        return fallback != null && !fallback.isBlank() ? fallback : null;
    }

    static String escapeMarkdown(String text) {
        if (text == null) return "";
        StringBuilder sb = new StringBuilder(text.length() + 16);
        for (char c : text.toCharArray()) {
            if (MARKDOWN_SPECIALS.indexOf(c) >= 0) sb.append('\\');
            sb.append(c);
        }
        return sb.toString();
    }
}
