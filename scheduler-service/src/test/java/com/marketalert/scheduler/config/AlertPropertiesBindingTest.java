package com.marketalert.scheduler.config;

import com.marketalert.common.rule.RuleThresholds;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AlertPropertiesBindingTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withUserConfiguration(PropertiesConfig.class);

    @Test
    void emptyConfigurationYieldsDefaults() {
        runner.run(context -> {
            AlertProperties props = context.getBean(AlertProperties.class);

            assertThat(props.market().timezone()).isEqualTo("America/New_York");
            assertThat(props.market().openHour()).isEqualTo(6);
            assertThat(props.market().closeHour()).isEqualTo(18);
            assertThat(props.rules().toThresholds()).isEqualTo(RuleThresholds.defaults());
            assertThat(props.rules().cooldown()).isEqualTo(Duration.ofSeconds(300));
            assertThat(props.baseline().capacity()).isEqualTo(30);
            assertThat(props.baseline().minSamples()).isEqualTo(5);
            assertThat(props.scan().summaryTopK()).isEqualTo(5);
            assertThat(props.intervals().primaryScan()).isEqualTo(Duration.ofSeconds(30));
            assertThat(props.intervals().derivativeScan()).isEqualTo(Duration.ofSeconds(180));
            assertThat(props.intervals().marketRecheck()).isEqualTo(Duration.ofSeconds(60));
            assertThat(props.intervals().tick()).isEqualTo(Duration.ofSeconds(1));
            assertThat(props.watchlist().ttl()).isEqualTo(Duration.ofHours(24));
        });
    }

    @Test
    void bindsOverrides() {
        runner
            .withPropertyValues(
                "alert.market.timezone=Europe/London",
                "alert.market.open-hour=8",
                "alert.rules.min-percent-move=3.5",
                "alert.rules.cooldown=10m",
                "alert.intervals.primary-scan=15s",
                "alert.scan.top-movers-limit=50",
                "alert.watchlist.ttl=0s")
            .run(context -> {
                AlertProperties props = context.getBean(AlertProperties.class);

                assertThat(props.market().timezone()).isEqualTo("Europe/London");
                assertThat(props.market().openHour()).isEqualTo(8);
                assertThat(props.market().closeHour()).isEqualTo(18);
                assertThat(props.rules().minPercentMove()).isEqualTo(3.5);
                assertThat(props.rules().exactBidShares()).isEqualTo(100L);
                assertThat(props.rules().cooldown()).isEqualTo(Duration.ofMinutes(10));
                assertThat(props.intervals().primaryScan()).isEqualTo(Duration.ofSeconds(15));
                assertThat(props.intervals().summary()).isEqualTo(Duration.ofSeconds(300));
                assertThat(props.scan().topMoversLimit()).isEqualTo(50);
                assertThat(props.watchlist().ttl()).isEqualTo(Duration.ZERO);
            });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(AlertProperties.class)
    static class PropertiesConfig {
    }
}
