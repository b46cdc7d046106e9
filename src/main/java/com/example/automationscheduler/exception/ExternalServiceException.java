package com.example.automationscheduler.exception;

import lombok.Getter;

/**
 * Failure talking to the automation registry, market data provider or exchange gateway.
 * <p>
 * Transport errors and circuit-breaker rejections carry no status and are retryable.
 * HTTP errors are retryable only for 5xx, 408 and 429.
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String serviceName;
    private final Integer httpStatusCode;
    private final String responseBody;
    private final boolean retryable;

    public ExternalServiceException(String serviceName, String message) {
        this(serviceName, message, (Throwable) null);
    }

    public ExternalServiceException(String serviceName, Throwable cause) {
        this(serviceName, cause.getMessage(), cause);
    }

    public ExternalServiceException(String serviceName, String message, Throwable cause) {
        super("[" + serviceName + "] " + message, cause);
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
        this.retryable = true;
    }

    public ExternalServiceException(String serviceName, int httpStatusCode, String responseBody) {
        super("[" + serviceName + "] HTTP " + httpStatusCode + ": " + responseBody);
        this.serviceName = serviceName;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
        this.retryable = isRetryableStatus(httpStatusCode);
    }

    public static boolean isRetryableStatus(int httpStatusCode) {
        return httpStatusCode >= 500 || httpStatusCode == 408 || httpStatusCode == 429;
    }
}
