package com.example.automationscheduler.service.handler;

import com.example.automationscheduler.client.ClientModels.AddMarginRequest;
import com.example.automationscheduler.client.ClientModels.PositionView;
import com.example.automationscheduler.client.ExchangeGatewayClient;
import com.example.automationscheduler.domain.enums.AutomationType;
import com.example.automationscheduler.domain.model.ExecutionJob;
import com.example.automationscheduler.exception.ExternalServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Handler for MARGIN_GUARD automations.
 * <p>
 * Adds margin to positions whose price has moved too close to liquidation.
 * <p>
 * Expected config:
 * - margin_threshold: percent of the entry-to-liquidation distance that may be consumed before acting
 * - add_margin_percentage: percent of the position's current margin to add
 * - mode: global (all positions) or selected
 * - selected_positions: position ids watched in selected mode
 * <p>
 * For a position: distance = |entry - liquidation|, activation = distance * (1 - threshold / 100),
 * trigger = liquidation + activation for longs and liquidation - activation for shorts.
 * A long is at risk when price &lt;= trigger, a short when price &gt;= trigger.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarginGuardHandler implements AutomationHandler {

    static final String THRESHOLD_KEY = "margin_threshold";
    static final String ADD_PERCENTAGE_KEY = "add_margin_percentage";
    static final String MODE_KEY = "mode";
    static final String SELECTED_POSITIONS_KEY = "selected_positions";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ExchangeGatewayClient exchangeGatewayClient;

    @Override
    public AutomationType getAutomationType() {
        return AutomationType.MARGIN_GUARD;
    }

    @Override
    public void validate(ExecutionJob job) {
        AutomationHandler.super.validate(job);

        var threshold = job.getConfigDecimal(THRESHOLD_KEY);
        if (threshold == null || threshold.signum() <= 0 || threshold.compareTo(HUNDRED) >= 0) {
            throw new IllegalArgumentException("margin_threshold must be between 0 and 100 exclusive");
        }
        var addPercentage = job.getConfigDecimal(ADD_PERCENTAGE_KEY);
        if (addPercentage == null || addPercentage.signum() <= 0) {
            throw new IllegalArgumentException("add_margin_percentage must be positive");
        }
    }

    @Override
    public AutomationExecutionResult execute(ExecutionJob job) {
        var accountId = job.getExchangeAccountId();
        log.info("Executing MARGIN_GUARD for automation {} (cycle {}, account {})", job.getAutomationId(), job.getCycle(), accountId);

        var threshold = job.getConfigDecimal(THRESHOLD_KEY);
        var addPercentage = job.getConfigDecimal(ADD_PERCENTAGE_KEY);

        List<PositionView> positions;
        try {
            positions = exchangeGatewayClient.getRunningPositions(accountId);
        } catch (ExternalServiceException e) {
            log.error("Could not load positions for automation {}: {}", job.getAutomationId(), e.getMessage());
            return toFailure(e);
        }

        var watched = positions.stream().filter(position -> isMonitored(job, position)).toList();
        if (watched.isEmpty()) {
            return AutomationExecutionResult.success(Map.of("positionsChecked", 0, "marginAdded", List.of()));
        }

        var actions = new ArrayList<Map<String, Object>>();
        var priced = 0;
        for (var position : watched) {
            var price = resolvePrice(job, position);
            if (price == null) {
                log.warn("No usable price for position {} of automation {}", position.getId(), job.getAutomationId());
                continue;
            }
            priced++;

            var trigger = triggerPrice(position, threshold);
            if (trigger == null || !isAtRisk(position, price, trigger)) {
                continue;
            }

            var amount = marginToAdd(position.getMargin(), addPercentage);
            if (amount <= 0) {
                log.warn("Position {} has no margin to scale, skipping", position.getId());
                continue;
            }

            log.warn("Position {} at risk: price {} crossed trigger {} (liquidation {}), adding {} margin",
                    position.getId(), price, trigger, position.getLiquidationPrice(), amount);
            try {
                var response = exchangeGatewayClient.addMargin(accountId, position.getId(), AddMarginRequest.builder()
                        .amount(amount)
                        .idempotencyKey(job.getJobId() + ":" + position.getId())
                        .build());
                var action = new HashMap<String, Object>();
                action.put("positionId", position.getId());
                action.put("amount", amount);
                action.put("price", price.toPlainString());
                action.put("triggerPrice", trigger.toPlainString());
                if (response != null && response.getLiquidationPrice() != null) {
                    action.put("newLiquidationPrice", response.getLiquidationPrice().toPlainString());
                }
                actions.add(action);
            } catch (ExternalServiceException e) {
                log.error("Adding margin to position {} failed: {}", position.getId(), e.getMessage());
                return toFailure(e);
            }
        }

        if (priced == 0) {
            return AutomationExecutionResult.skipped("insufficient_market_data");
        }

        return AutomationExecutionResult.success(Map.of(
                "positionsChecked", priced,
                "marginAdded", actions
        ));
    }

    boolean isMonitored(ExecutionJob job, PositionView position) {
        if (!position.isRunning()) {
            return false;
        }
        var mode = job.getConfigString(MODE_KEY);
        if ("selected".equalsIgnoreCase(mode) || "unitario".equalsIgnoreCase(mode)) {
            return job.getConfigStringList(SELECTED_POSITIONS_KEY).contains(position.getId());
        }
        return true;
    }

    /**
     * Snapshot price for the position's symbol. When the feed was unhealthy at capture time the
     * position's own mark price is used instead.
     */
    BigDecimal resolvePrice(ExecutionJob job, PositionView position) {
        var snapshot = job.getMarketSnapshot();
        if (snapshot != null && snapshot.isFeedHealthy()) {
            var symbol = position.getSymbol() != null ? position.getSymbol() : AutomationType.MARGIN_GUARD.getDefaultSymbols().get(0);
            var price = snapshot.priceOf(symbol);
            if (price.isPresent()) {
                return price.get();
            }
        }
        var markPrice = position.getMarkPrice();
        return markPrice != null && markPrice.signum() > 0 ? markPrice : null;
    }

    static BigDecimal triggerPrice(PositionView position, BigDecimal thresholdPercent) {
        var entry = position.getEntryPrice();
        var liquidation = position.getLiquidationPrice();
        if (entry == null || liquidation == null || entry.signum() <= 0 || liquidation.signum() <= 0) {
            return null;
        }
        var distance = entry.subtract(liquidation).abs();
        var activation = distance.multiply(BigDecimal.ONE.subtract(thresholdPercent.divide(HUNDRED, 10, RoundingMode.HALF_UP)));
        return position.isLong() ? liquidation.add(activation) : liquidation.subtract(activation);
    }

    static boolean isAtRisk(PositionView position, BigDecimal price, BigDecimal trigger) {
        return position.isLong() ? price.compareTo(trigger) <= 0 : price.compareTo(trigger) >= 0;
    }

    static long marginToAdd(long margin, BigDecimal percent) {
        return BigDecimal.valueOf(margin)
                .multiply(percent)
                .divide(HUNDRED, 0, RoundingMode.DOWN)
                .longValue();
    }

    private AutomationExecutionResult toFailure(ExternalServiceException e) {
        if (e.getHttpStatusCode() != null) {
            return AutomationExecutionResult.httpFailure(e.getHttpStatusCode(), e.getMessage());
        }
        return AutomationExecutionResult.failure(e);
    }
}
