package com.example.automationscheduler.client;

import com.example.automationscheduler.client.ClientModels.AutomationRecord;
import com.example.automationscheduler.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Client for the automation registry: the source of truth for whether an automation is
 * active and which account, config and plan tier it belongs to.
 */
@Slf4j
@Component
public class AutomationRegistryClient {

    private static final String SERVICE = "Automation Registry";

    private final WebClient webClient;

    public AutomationRegistryClient(@Qualifier("automationRegistryWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * Look up an automation.
     *
     * @return the record, or empty if the registry does not know the id
     * @throws ExternalServiceException if the registry cannot be reached
     */
    @CircuitBreaker(name = "automationRegistry", fallbackMethod = "getFallback")
    @Retry(name = "automationRegistry")
    public Optional<AutomationRecord> get(String automationId) {
        log.debug("Looking up automation {}", automationId);

        try {
            return webClient.get()
                    .uri("/api/v1/automations/{automationId}", automationId)
                    .exchangeToMono(response -> {
                        if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                            return response.releaseBody().then(Mono.<AutomationRecord>empty());
                        }
                        if (response.statusCode().isError()) {
                            return response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.<AutomationRecord>error(
                                            new ExternalServiceException(SERVICE, response.statusCode().value(), body)));
                        }
                        return response.bodyToMono(AutomationRecord.class);
                    })
                    .timeout(Duration.ofSeconds(10))
                    .blockOptional();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to look up automation {}: {}", automationId, e.getMessage());
            throw new ExternalServiceException(SERVICE, e);
        }
    }

    /**
     * All automations currently marked active
     */
    @CircuitBreaker(name = "automationRegistry")
    @Retry(name = "automationRegistry")
    public List<AutomationRecord> listActive() {
        try {
            var records = webClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/api/v1/automations").queryParam("active", true).build())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE, response.statusCode().value(), body))))
                    .bodyToMono(new ParameterizedTypeReference<List<AutomationRecord>>() {
                    })
                    .timeout(Duration.ofSeconds(30))
                    .block();
            return records != null ? records : List.of();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to list active automations: {}", e.getMessage());
            throw new ExternalServiceException(SERVICE, e);
        }
    }

    @SuppressWarnings("unused")
    private Optional<AutomationRecord> getFallback(String automationId, Exception e) {
        log.warn("Circuit breaker open for Automation Registry, automation: {}, error: {}", automationId, e.getMessage());
        if (e instanceof ExternalServiceException external) {
            throw external;
        }
        throw new ExternalServiceException(SERVICE, "Service temporarily unavailable (circuit breaker open)", e);
    }
}
