package com.marketalert.scheduler.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Refuses to start the process without the data-source and messaging-sink credentials.
 *
 * <p>Runs while the context is being built, so a failure aborts startup before the
 * scheduling loop is started. {@code alert.require-credentials=false} disables the check
 * for local dry runs, where the notifier only logs.
 */
@Component
public class StartupConfigurationValidator {

    private static final Logger log = LoggerFactory.getLogger(StartupConfigurationValidator.class);

    @Value("${mboum.api-key:}")
    private String mboumApiKey;

    @Value("${telegram.bot-token:}")
    private String telegramBotToken;

    @Value("${telegram.chat-id:}")
    private String telegramChatId;

    @Value("${alert.require-credentials:true}")
    private boolean requireCredentials;

    @PostConstruct
    public void validate() {
        List<String> missing = missingCredentials(mboumApiKey, telegramBotToken, telegramChatId);
        log.info("CONFIG_CHECK MBOUM_API_KEY={} TELEGRAM_BOT_TOKEN={} TELEGRAM_CHAT_ID={}",
                 status(mboumApiKey), status(telegramBotToken), status(telegramChatId));
        if (missing.isEmpty()) {
            return;
        }
        if (!requireCredentials) {
            log.warn("CONFIG_CHECK credentials missing but not required, running dry. missing={}", missing);
            return;
        }
        throw new MissingConfigurationException(missing);
    }

    static List<String> missingCredentials(String mboumApiKey, String telegramBotToken, String telegramChatId) {
        List<String> missing = new ArrayList<>();
        if (isBlank(mboumApiKey)) {
            missing.add("MBOUM_API_KEY");
        }
        if (isBlank(telegramBotToken)) {
            missing.add("TELEGRAM_BOT_TOKEN");
        }
        if (isBlank(telegramChatId)) {
            missing.add("TELEGRAM_CHAT_ID");
        }
        return missing;
    }

    private static String status(String value) {
        return isBlank(value) ? "MISSING" : "SET";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
