package com.marketalert.scheduler.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StartupConfigurationValidatorTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withBean(StartupConfigurationValidator.class);

    @Test
    void namesEveryMissingCredential() {
        assertThat(StartupConfigurationValidator.missingCredentials("", " ", null))
            .containsExactly("MBOUM_API_KEY", "TELEGRAM_BOT_TOKEN", "TELEGRAM_CHAT_ID");
        assertThat(StartupConfigurationValidator.missingCredentials("key", "token", "")).containsExactly("TELEGRAM_CHAT_ID");
        assertThat(StartupConfigurationValidator.missingCredentials("key", "token", "42")).isEmpty();
    }

    @Test
    void refusesToStartWithoutCredentials() {
        runner
            .withPropertyValues("mboum.api-key=key")
            .run(context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure())
                    .hasRootCauseInstanceOf(MissingConfigurationException.class)
                    .rootCause()
                    .hasMessageContaining("TELEGRAM_BOT_TOKEN")
                    .hasMessageContaining("TELEGRAM_CHAT_ID");
            });
    }

    @Test
    void startsWhenAllCredentialsPresent() {
        runner
            .withPropertyValues("mboum.api-key=key", "telegram.bot-token=123:abc", "telegram.chat-id=-100")
            .run(context -> assertThat(context).hasNotFailed());
    }

    @Test
    void dryRunToleratesMissingCredentials() {
        runner
            .withPropertyValues("alert.require-credentials=false")
            .run(context -> assertThat(context).hasNotFailed());
    }

    @Test
    void exceptionKeepsTheMissingNames() {
        MissingConfigurationException e = new MissingConfigurationException(List.of("MBOUM_API_KEY"));
        assertThat(e.getMissing()).containsExactly("MBOUM_API_KEY");
        assertThat(e.getMessage()).contains("MBOUM_API_KEY");
    }
}
