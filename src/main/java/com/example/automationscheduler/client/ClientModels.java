package com.example.automationscheduler.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Request/Response DTOs for external service clients
 */
public class ClientModels {
    private ClientModels() {
    }

    // === Automation Registry Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AutomationRecord {
        private String id;
        private boolean active;
        private String ownerId;
        private String exchangeAccountId;
        /**
         * Automation type code, e.g. margin_guard
         */
        private String type;
        private Map<String, Object> config;
        /**
         * Owner's plan tier code, e.g. pro
         */
        private String planTier;
        private Integer intervalMinutes;
    }

    // === Market Data Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PriceResponse {
        private Map<String, BigDecimal> prices;
        private String timestamp;
    }

    // === Exchange Gateway Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PositionView {
        private String id;
        private String symbol;
        /**
         * b (buy/long) or s (sell/short)
         */
        private String side;
        private BigDecimal quantity;
        private BigDecimal entryPrice;
        private BigDecimal liquidationPrice;
        private BigDecimal markPrice;
        /**
         * Margin in account units (sats)
         */
        private long margin;
        private BigDecimal takeProfit;
        private BigDecimal stopLoss;
        private boolean running;

        public boolean isLong() {
            return "b".equalsIgnoreCase(side) || "long".equalsIgnoreCase(side) || "buy".equalsIgnoreCase(side);
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PositionsResponse {
        private List<PositionView> positions;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AddMarginRequest {
        private long amount;
        /**
         * Caller-supplied key so a repeated request for the same cycle is applied once
         */
        private String idempotencyKey;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AddMarginResponse {
        private String positionId;
        private long margin;
        private BigDecimal liquidationPrice;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ClosePositionRequest {
        private String reason;
        private String idempotencyKey;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ClosePositionResponse {
        private String positionId;
        private String status;
        private BigDecimal exitPrice;
    }
}
