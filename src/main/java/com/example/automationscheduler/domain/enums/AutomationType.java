package com.example.automationscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Kinds of trading-safety automations. Runnable types have a handler that knows how to run one cycle.
 */
@Getter
@RequiredArgsConstructor
public enum AutomationType {

    MARGIN_GUARD("margin_guard", "Margin Guard", List.of("BTCUSD")),
    TP_SL("tp_sl", "Take Profit / Stop Loss", List.of("BTCUSD")),
    AUTO_ENTRY("auto_entry", "Auto Entry", List.of("BTCUSD"));

    private final String code;
    private final String displayName;

    /**
     * Symbols to price when the automation config does not list its own
     */
    private final List<String> defaultSymbols;

    public static AutomationType fromCode(String code) {
        for (var type : values()) {
            if (type.getCode().equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown automation type: " + code);
    }

    /**
     * Type of a registry record. Records without a type predate the other automations and are margin guards.
     *
     * @throws IllegalArgumentException for a type this service does not know
     */
    public static AutomationType fromRegistryCode(String code) {
        if (code == null || code.isBlank()) {
            return MARGIN_GUARD;
        }
        return fromCode(code);
    }
}
