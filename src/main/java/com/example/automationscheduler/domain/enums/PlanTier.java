package com.example.automationscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Subscription tier of an automation's owner.
 * <p>
 * Used only to order execution work: a lower {@code priority} value is served first.
 * Also carries the check interval an automation gets when its record does not set one.
 */
@Getter
@RequiredArgsConstructor
public enum PlanTier {

    FREE("free", 5, 15),
    BASIC("basic", 4, 10),
    ADVANCED("advanced", 3, 5),
    PRO("pro", 2, 2),
    LIFETIME("lifetime", 1, 1);

    private final String code;

    /**
     * Queue priority, 1 is served first
     */
    private final int priority;

    /**
     * Check interval used when the automation does not define its own
     */
    private final int defaultIntervalMinutes;

    /**
     * Find PlanTier by its code value
     */
    public static PlanTier fromCode(String code) {
        for (var tier : values()) {
            if (tier.getCode().equalsIgnoreCase(code)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown plan tier code: " + code);
    }

    /**
     * Lenient lookup: unknown or missing tiers are treated as FREE
     */
    public static PlanTier fromCodeOrFree(String code) {
        if (code == null) {
            return FREE;
        }
        for (var tier : values()) {
            if (tier.getCode().equalsIgnoreCase(code) || tier.name().equalsIgnoreCase(code)) {
                return tier;
            }
        }
        return FREE;
    }

    /**
     * Reverse mapping used when reading per-tier queue counts
     */
    public static PlanTier fromPriority(int priority) {
        for (var tier : values()) {
            if (tier.getPriority() == priority) {
                return tier;
            }
        }
        return FREE;
    }
}
