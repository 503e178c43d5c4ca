package com.marketalert.notification.config;

import com.marketalert.common.provider.AlertNotifier;
import com.marketalert.notification.sender.TelegramSender;
import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class NotificationConfig {

    @Value("${telegram.base-url:https://api.telegram.org}")
    private String baseUrl;

    @Value("${telegram.bot-token:}")
    private String botToken;

    @Value("${telegram.chat-id:}")
    private String chatId;

    @Value("${telegram.enabled:true}")
    private boolean enabled;

    @Value("${telegram.timeout-seconds:10}")
    private int timeoutSeconds;

    @Bean
    public WebClient telegramWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutSeconds * 1_000)
            .responseTimeout(Duration.ofSeconds(timeoutSeconds));

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }

    @Bean
    public AlertNotifier alertNotifier(WebClient telegramWebClient) {
        return new TelegramSender(telegramWebClient, botToken, chatId, enabled, Duration.ofSeconds(timeoutSeconds));
    }
}
