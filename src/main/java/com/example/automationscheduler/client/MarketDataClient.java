package com.example.automationscheduler.client;

import com.example.automationscheduler.client.ClientModels.PriceResponse;
import com.example.automationscheduler.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;

/**
 * Client for the market data provider. Responses may omit symbols; callers must tolerate that.
 */
@Slf4j
@Component
public class MarketDataClient {

    private static final String SERVICE = "Market Data";

    private final WebClient webClient;

    public MarketDataClient(@Qualifier("marketDataWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * Current reference prices, possibly for a subset of {@code symbols}.
     * No retry: a slow price read must not hold up the scheduling cycle.
     */
    @CircuitBreaker(name = "marketData")
    public Map<String, BigDecimal> getPrices(Collection<String> symbols) {
        if (symbols.isEmpty()) {
            return Map.of();
        }

        try {
            var response = webClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/api/v1/prices").queryParam("symbols", String.join(",", symbols)).build())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse ->
                            clientResponse.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE, clientResponse.statusCode().value(), body))))
                    .bodyToMono(PriceResponse.class)
                    .timeout(Duration.ofSeconds(5))
                    .block();
            return response != null && response.getPrices() != null ? response.getPrices() : Map.of();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Failed to fetch prices for {}: {}", symbols, e.getMessage());
            throw new ExternalServiceException(SERVICE, e);
        }
    }

    /**
     * Heartbeat check of the realtime feed. Completes empty on success, errors otherwise.
     */
    public Mono<Void> ping() {
        return webClient.get()
                .uri("/api/v1/feed/ping")
                .retrieve()
                .toBodilessEntity()
                .then();
    }
}
