package com.insightfinance.marketdata.config;

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

/**
 * One {@link WebClient} per external provider, each with its own base URL and timeouts.
 * Response timeouts are enforced by Reactor Netty; adapters add a matching {@code Mono.timeout}.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Value("${alpha-vantage.base-url:https://www.alphavantage.co}")
    private String alphaVantageBaseUrl;

    @Value("${alpha-vantage.timeout:15s}")
    private Duration alphaVantageTimeout;

    @Value("${yahoo-finance.base-url:https://query1.finance.yahoo.com}")
    private String yahooFinanceBaseUrl;

    @Value("${yahoo-finance.timeout:10s}")
    private Duration yahooFinanceTimeout;

    @Value("${coingecko.base-url:https://api.coingecko.com/api/v3}")
    private String coinGeckoBaseUrl;

    @Value("${coingecko.timeout:10s}")
    private Duration coinGeckoTimeout;

    @Bean
    public WebClient alphaVantageWebClient(WebClient.Builder builder) {
        return build(builder, alphaVantageBaseUrl, alphaVantageTimeout);
    }

    @Bean
    public WebClient yahooFinanceWebClient(WebClient.Builder builder) {
        // the chart endpoint rejects requests without a browser-like agent
        return build(builder.clone().defaultHeader("User-Agent", "Mozilla/5.0"),
            yahooFinanceBaseUrl, yahooFinanceTimeout);
    }

    @Bean
    public WebClient coinGeckoWebClient(WebClient.Builder builder) {
        return build(builder, coinGeckoBaseUrl, coinGeckoTimeout);
    }

    private WebClient build(WebClient.Builder builder, String baseUrl, Duration timeout) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(timeout)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS))
            );

        return builder.clone()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(serverErrorFilter())
            .filter(loggingFilter())
            .build();
    }

    private ExchangeFilterFunction serverErrorFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new IllegalStateException("Market data server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String uri = clientRequest.url().toString();
            String sanitized = uri.replaceAll("apikey=[^&]+", "apikey=***");
            log.debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
