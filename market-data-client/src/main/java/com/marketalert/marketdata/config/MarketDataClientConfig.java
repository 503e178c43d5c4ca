package com.marketalert.marketdata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketalert.common.provider.MarketDataProvider;
import com.marketalert.marketdata.client.MboumEndpoints;
import com.marketalert.marketdata.client.MboumMarketDataClient;
import com.marketalert.marketdata.parser.MboumResponseParser;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class MarketDataClientConfig {

    private static final Logger log = LoggerFactory.getLogger(MarketDataClientConfig.class);

    @Value("${mboum.base-url:https://api.mboum.com}")
    private String baseUrl;

    @Value("${mboum.api-key:}")
    private String apiKey;

    @Value("${mboum.connect-timeout-millis:10000}")
    private int connectTimeoutMillis;

    @Value("${mboum.response-timeout-seconds:15}")
    private int responseTimeoutSeconds;

    @Value("${mboum.paths.screener:/v1/screener}")
    private String screenerPath;

    @Value("${mboum.screener-filter:day_gainers}")
    private String screenerFilter;

    @Value("${mboum.paths.insider-trades:/v1/markets/insider-trades}")
    private String insiderTradesPath;

    @Value("${mboum.paths.unusual-options:/v1/markets/options/unusual-options-activity}")
    private String unusualOptionsPath;

    @Value("${mboum.paths.quote:/v1/markets/stock/quotes}")
    private String quotePath;

    @Bean
    public WebClient mboumWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
            .responseTimeout(Duration.ofSeconds(responseTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(responseTimeoutSeconds, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(serverErrorFilter())
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public MboumResponseParser mboumResponseParser(ObjectMapper objectMapper) {
        return new MboumResponseParser(objectMapper);
    }

    @Bean
    public MarketDataProvider marketDataProvider(WebClient mboumWebClient, MboumResponseParser mboumResponseParser) {
        MboumEndpoints endpoints = new MboumEndpoints(
            screenerPath, screenerFilter, insiderTradesPath, unusualOptionsPath, quotePath);
        return new MboumMarketDataClient(mboumWebClient, mboumResponseParser, endpoints, apiKey,
                                         Duration.ofSeconds(responseTimeoutSeconds));
    }

    private ExchangeFilterFunction serverErrorFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new IllegalStateException("MBOUM server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("MBOUM_REQUEST method={} url={}", clientRequest.method(), sanitize(clientRequest.url().toString()));
            return Mono.just(clientRequest);
        });
    }

    /** MBOUM also accepts the key as an {@code apikey} query parameter; never log it. */
    static String sanitize(String url) {
        return url.replaceAll("(?i)(apikey=)[^&]+", "$1***");
    }
}
