package com.example.automationscheduler.service.handler;

import com.example.automationscheduler.exception.ExternalServiceException;
import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Result of one handler run.
 * <p>
 * Tells the executor whether to ack, skip or fail the job, and carries what goes into the execution log.
 */
@Data
@Builder
public class AutomationExecutionResult {

    public enum Status {
        SUCCESS,

        /**
         * Nothing to do or not enough data: terminal, not a failure
         */
        SKIPPED,

        FAILURE
    }

    private Status status;

    private String errorMessage;

    /**
     * Error classification for analysis
     */
    private String errorType;

    /**
     * Why the job was skipped
     */
    private String skipReason;

    @Builder.Default
    private Map<String, Object> resultData = new HashMap<>();

    /**
     * Failures such as validation errors or rejected orders should not be retried
     */
    @Builder.Default
    private boolean retryable = true;

    public static AutomationExecutionResult success() {
        return AutomationExecutionResult.builder().status(Status.SUCCESS).build();
    }

    public static AutomationExecutionResult success(Map<String, Object> resultData) {
        return AutomationExecutionResult.builder()
                .status(Status.SUCCESS)
                .resultData(resultData != null ? new HashMap<>(resultData) : new HashMap<>())
                .build();
    }

    public static AutomationExecutionResult skipped(String reason) {
        return AutomationExecutionResult.builder()
                .status(Status.SKIPPED)
                .skipReason(reason)
                .build();
    }

    public static AutomationExecutionResult failure(String errorMessage, String errorType) {
        return AutomationExecutionResult.builder()
                .status(Status.FAILURE)
                .errorMessage(errorMessage)
                .errorType(errorType)
                .retryable(true)
                .build();
    }

    public static AutomationExecutionResult failure(Exception e) {
        return AutomationExecutionResult.builder()
                .status(Status.FAILURE)
                .errorMessage(e.getMessage())
                .errorType(e.getClass().getSimpleName())
                .retryable(true)
                .build();
    }

    public static AutomationExecutionResult permanentFailure(String errorMessage, String errorType) {
        return AutomationExecutionResult.builder()
                .status(Status.FAILURE)
                .errorMessage(errorMessage)
                .errorType(errorType)
                .retryable(false)
                .build();
    }

    /**
     * Classify an HTTP status from the exchange: 5xx, 408 and 429 are worth retrying
     */
    public static AutomationExecutionResult httpFailure(int statusCode, String errorMessage) {
        var retryable = ExternalServiceException.isRetryableStatus(statusCode);
        return AutomationExecutionResult.builder()
                .status(Status.FAILURE)
                .errorMessage(errorMessage)
                .errorType("HTTP_" + statusCode)
                .retryable(retryable)
                .build();
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    public boolean isFailure() {
        return status == Status.FAILURE;
    }

    public AutomationExecutionResult withResultData(String key, Object value) {
        if (this.resultData == null) {
            this.resultData = new HashMap<>();
        }
        this.resultData.put(key, value);
        return this;
    }
}
