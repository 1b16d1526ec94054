package com.apichain.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.netty.channel.ChannelOption;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.netty.http.client.HttpClient;

/**
 * Creates the {@link WebClient} sequence runs go through.
 */
@Configuration
@Slf4j
public class HttpClientFactory {

    /**
     * A WebClient with a connect timeout and a transport-level retry.
     * <p>
     * Only requests that never reached the server ({@link WebClientRequestException}: connection refused,
     * connect timeout, reset) are retried, with exponential backoff starting at 200ms. A response of any
     * status, and a response that is too slow, are passed to the caller unchanged.
     *
     * @param connectTimeoutMs connect timeout in milliseconds.
     * @param maxAttempts      total attempts per request, including the first one.
     */
    @Bean
    public WebClient webClient(@Value("${transport.connect-timeout-ms:3000}") int connectTimeoutMs,
                               @Value("${transport.retry.max-attempts:3}") int maxAttempts) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(200), 2))
                .retryOnException(e -> e instanceof WebClientRequestException)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        Retry retry = registry.retry("api-chain-transport");
        retry.getEventPublisher().onRetry(event ->
                log.debug("Retrying request (attempt {}): {}", event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .filter((request, next) -> next.exchange(request)
                        .transform(RetryOperator.of(retry)))
                .build();
    }
}
