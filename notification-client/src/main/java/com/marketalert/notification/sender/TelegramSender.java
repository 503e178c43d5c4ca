package com.marketalert.notification.sender;

import com.marketalert.common.model.AlertKind;
import com.marketalert.common.provider.AlertNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * {@link AlertNotifier} posting plain-text messages through the Telegram Bot API
 * {@code sendMessage} method.
 *
 * <p>Single attempt per message, bounded by {@code timeout}. Any failure (non-2xx, transport
 * error, timeout) is logged and reported as {@code false}; nothing is retried. When the sender
 * is disabled or missing its token/chat id the message is logged instead of sent.
 */
public class TelegramSender implements AlertNotifier {

    private static final Logger log = LoggerFactory.getLogger(TelegramSender.class);

    private final WebClient webClient;
    private final String botToken;
    private final String chatId;
    private final boolean enabled;
    private final Duration timeout;

    public TelegramSender(WebClient webClient, String botToken, String chatId, boolean enabled, Duration timeout) {
        this.webClient = webClient;
        this.botToken  = botToken;
        this.chatId    = chatId;
        this.enabled   = enabled;
        this.timeout   = timeout;
    }

    @Override
    public Mono<Boolean> send(String text, AlertKind kind) {
        if (!isConfigured()) {
            log.info("Telegram disabled or not configured. Logging alert instead. kind={} text={}",
                     kind, abbreviate(text));
            return Mono.just(false);
        }

        return webClient.post()
            .uri("/bot" + botToken + "/sendMessage")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of(
                "chat_id", chatId,
                "text", text,
                "disable_web_page_preview", true))
            .retrieve()
            .toBodilessEntity()
            .map(r -> r.getStatusCode().is2xxSuccessful())
            .timeout(timeout)
            .doOnNext(ok -> log.info("Telegram notification sent. kind={} ok={}", kind, ok))
            .onErrorResume(e -> {
                log.error("Telegram notification failed. kind={} reason={}", kind, redact(e.toString()));
                return Mono.just(false);
            })
            .defaultIfEmpty(false);
    }

    public boolean isConfigured() {
        return enabled && botToken != null && !botToken.isBlank() && chatId != null && !chatId.isBlank();
    }

    /** Masks the bot token, which WebClient errors carry inside the request URI. */
    String redact(String message) {
        if (message == null || botToken == null || botToken.isBlank()) {
            return message;
        }
        return message.replace(botToken, "***");
    }

    private static String abbreviate(String text) {
        String oneLine = text.replace('\n', ' ');
        return oneLine.length() <= 120 ? oneLine : oneLine.substring(0, 117) + "...";
    }
}
