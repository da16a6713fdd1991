package com.stockinsights.marketdata.config;

import com.stockinsights.common.exception.UpstreamUnavailableException;
import com.stockinsights.marketdata.client.AlphaVantageClient;
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
 * Builds the single outbound HTTP client for the market-data provider and hands it to
 * {@link AlphaVantageClient}. Constructed once at startup; no other component creates clients.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Value("${alpha-vantage.base-url:https://www.alphavantage.co}")
    private String baseUrl;

    @Value("${alpha-vantage.api-key:demo}")
    private String apiKey;

    @Value("${alpha-vantage.timeout:15s}")
    private Duration timeout;

    @Value("${alpha-vantage.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Bean
    public WebClient alphaVantageWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(timeout)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS))
            );

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
            .filter(serverErrorFilter())
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public AlphaVantageClient alphaVantageClient(WebClient alphaVantageWebClient) {
        return new AlphaVantageClient(alphaVantageWebClient, apiKey, timeout);
    }

    private ExchangeFilterFunction serverErrorFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return clientResponse.releaseBody()
                    .then(Mono.error(new UpstreamUnavailableException(
                        "Market data server error: " + clientResponse.statusCode())));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = clientRequest.url().toString().replaceAll("apikey=[^&]+", "apikey=***");
            log.debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
