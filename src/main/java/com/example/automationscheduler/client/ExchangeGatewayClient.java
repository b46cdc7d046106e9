package com.example.automationscheduler.client;

import com.example.automationscheduler.client.ClientModels.AddMarginRequest;
import com.example.automationscheduler.client.ClientModels.AddMarginResponse;
import com.example.automationscheduler.client.ClientModels.ClosePositionRequest;
import com.example.automationscheduler.client.ClientModels.ClosePositionResponse;
import com.example.automationscheduler.client.ClientModels.PositionView;
import com.example.automationscheduler.client.ClientModels.PositionsResponse;
import com.example.automationscheduler.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Client for the exchange gateway, which holds account credentials and talks to the exchange.
 * <p>
 * Mutating calls carry an idempotency key derived from the job, so a re-delivered
 * execution does not apply the same action twice.
 */
@Slf4j
@Component
public class ExchangeGatewayClient {

    private static final String SERVICE = "Exchange Gateway";

    private final WebClient webClient;

    public ExchangeGatewayClient(@Qualifier("exchangeGatewayWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @CircuitBreaker(name = "exchangeGateway")
    @Retry(name = "exchangeGateway")
    public List<PositionView> getRunningPositions(String exchangeAccountId) {
        try {
            var response = webClient.get()
                    .uri("/api/v1/accounts/{accountId}/positions?status=running", exchangeAccountId)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::toException)
                    .bodyToMono(PositionsResponse.class)
                    .timeout(Duration.ofSeconds(15))
                    .block();
            return response != null && response.getPositions() != null ? response.getPositions() : List.of();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to fetch positions for account {}: {}", exchangeAccountId, e.getMessage());
            throw new ExternalServiceException(SERVICE, e);
        }
    }

    /**
     * Add margin to a running position. Not retried here: the job queue owns retries for mutations.
     */
    @CircuitBreaker(name = "exchangeGateway")
    public AddMarginResponse addMargin(String exchangeAccountId, String positionId, AddMarginRequest request) {
        log.info("Adding {} margin to position {} on account {}", request.getAmount(), positionId, exchangeAccountId);

        try {
            return webClient.post()
                    .uri("/api/v1/accounts/{accountId}/positions/{positionId}/margin", exchangeAccountId, positionId)
                    .header("Idempotency-Key", request.getIdempotencyKey())
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::toException)
                    .bodyToMono(AddMarginResponse.class)
                    .timeout(Duration.ofSeconds(30))
                    .block();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to add margin to position {}: {}", positionId, e.getMessage());
            throw new ExternalServiceException(SERVICE, e);
        }
    }

    @CircuitBreaker(name = "exchangeGateway")
    public ClosePositionResponse closePosition(String exchangeAccountId, String positionId, ClosePositionRequest request) {
        log.info("Closing position {} on account {} ({})", positionId, exchangeAccountId, request.getReason());

        try {
            return webClient.post()
                    .uri("/api/v1/accounts/{accountId}/positions/{positionId}/close", exchangeAccountId, positionId)
                    .header("Idempotency-Key", request.getIdempotencyKey())
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::toException)
                    .bodyToMono(ClosePositionResponse.class)
                    .timeout(Duration.ofSeconds(30))
                    .block();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to close position {}: {}", positionId, e.getMessage());
            throw new ExternalServiceException(SERVICE, e);
        }
    }

    private Mono<? extends Throwable> toException(ClientResponse response) {
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.error(new ExternalServiceException(SERVICE, response.statusCode().value(), body)));
    }
}
