package com.example.automationscheduler.service.handler;

import com.example.automationscheduler.domain.enums.AutomationType;
import com.example.automationscheduler.domain.model.ExecutionJob;

/**
 * Interface for automation handlers.
 * <p>
 * Each automation type that can run has one handler implementation.
 * <p>
 * Handlers should:
 * - Be stateless
 * - Translate exchange errors into results instead of throwing
 * - Be safe to run twice for the same job (at-least-once delivery)
 */
public interface AutomationHandler {

    AutomationType getAutomationType();

    /**
     * Run the automation against the data captured in the job
     *
     * @param job The claimed execution job
     * @return Result of the execution
     */
    AutomationExecutionResult execute(ExecutionJob job);

    default boolean supports(AutomationType type) {
        return getAutomationType() == type;
    }

    /**
     * Validate job data before execution (optional override)
     *
     * @param job The job to validate
     * @throws IllegalArgumentException if validation fails
     */
    default void validate(ExecutionJob job) {
        if (job.getExchangeAccountId() == null || job.getExchangeAccountId().isBlank()) {
            throw new IllegalArgumentException("Exchange account ID is required");
        }
    }
}
