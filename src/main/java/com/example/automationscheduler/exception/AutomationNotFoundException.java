package com.example.automationscheduler.exception;

import lombok.Getter;

@Getter
public class AutomationNotFoundException extends RuntimeException {

    private final String automationId;

    public AutomationNotFoundException(String automationId) {
        super("Automation not found or inactive: " + automationId);
        this.automationId = automationId;
    }
}
