package com.example.automationscheduler.service.handler;

import com.example.automationscheduler.client.ClientModels.ClosePositionRequest;
import com.example.automationscheduler.client.ClientModels.PositionView;
import com.example.automationscheduler.client.ExchangeGatewayClient;
import com.example.automationscheduler.domain.enums.AutomationType;
import com.example.automationscheduler.domain.model.ExecutionJob;
import com.example.automationscheduler.exception.ExternalServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Handler for TP_SL automations.
 * <p>
 * Closes a running position once the price crosses its take-profit or stop-loss level.
 * Levels come from config (take_profit, stop_loss) and fall back to the levels set on the position.
 * Optional selected_positions restricts which positions are watched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TakeProfitStopLossHandler implements AutomationHandler {

    static final String TAKE_PROFIT_KEY = "take_profit";
    static final String STOP_LOSS_KEY = "stop_loss";
    static final String SELECTED_POSITIONS_KEY = "selected_positions";

    private final ExchangeGatewayClient exchangeGatewayClient;

    @Override
    public AutomationType getAutomationType() {
        return AutomationType.TP_SL;
    }

    @Override
    public AutomationExecutionResult execute(ExecutionJob job) {
        var accountId = job.getExchangeAccountId();
        log.info("Executing TP_SL for automation {} (cycle {}, account {})", job.getAutomationId(), job.getCycle(), accountId);

        List<PositionView> positions;
        try {
            positions = exchangeGatewayClient.getRunningPositions(accountId);
        } catch (ExternalServiceException e) {
            return toFailure(e);
        }

        var selected = job.getConfigStringList(SELECTED_POSITIONS_KEY);
        var closed = new ArrayList<String>();
        var priced = 0;
        var watched = 0;

        for (var position : positions) {
            if (!position.isRunning() || (!selected.isEmpty() && !selected.contains(position.getId()))) {
                continue;
            }
            watched++;

            var price = resolvePrice(job, position);
            if (price == null) {
                continue;
            }
            priced++;

            var reason = crossedLevel(position, price, levelOrDefault(job, TAKE_PROFIT_KEY, position.getTakeProfit()),
                    levelOrDefault(job, STOP_LOSS_KEY, position.getStopLoss()));
            if (reason == null) {
                continue;
            }

            log.info("Position {} crossed its {} level at {}, closing", position.getId(), reason, price);
            try {
                exchangeGatewayClient.closePosition(accountId, position.getId(), ClosePositionRequest.builder()
                        .reason(reason)
                        .idempotencyKey(job.getJobId() + ":" + position.getId())
                        .build());
                closed.add(position.getId());
            } catch (ExternalServiceException e) {
                log.error("Closing position {} failed: {}", position.getId(), e.getMessage());
                return toFailure(e);
            }
        }

        if (watched > 0 && priced == 0) {
            return AutomationExecutionResult.skipped("insufficient_market_data");
        }
        return AutomationExecutionResult.success(Map.of("positionsChecked", priced, "closedPositions", closed));
    }

    /**
     * take_profit or stop_loss when the price has crossed that level, null otherwise
     */
    static String crossedLevel(PositionView position, BigDecimal price, BigDecimal takeProfit, BigDecimal stopLoss) {
        if (position.isLong()) {
            if (takeProfit != null && price.compareTo(takeProfit) >= 0) {
                return TAKE_PROFIT_KEY;
            }
            if (stopLoss != null && price.compareTo(stopLoss) <= 0) {
                return STOP_LOSS_KEY;
            }
        } else {
            if (takeProfit != null && price.compareTo(takeProfit) <= 0) {
                return TAKE_PROFIT_KEY;
            }
            if (stopLoss != null && price.compareTo(stopLoss) >= 0) {
                return STOP_LOSS_KEY;
            }
        }
        return null;
    }

    private BigDecimal levelOrDefault(ExecutionJob job, String key, BigDecimal positionLevel) {
        var configured = job.getConfigDecimal(key);
        if (configured != null && configured.signum() > 0) {
            return configured;
        }
        return positionLevel != null && positionLevel.signum() > 0 ? positionLevel : null;
    }

    private BigDecimal resolvePrice(ExecutionJob job, PositionView position) {
        var snapshot = job.getMarketSnapshot();
        if (snapshot != null && snapshot.isFeedHealthy()) {
            var symbol = position.getSymbol() != null ? position.getSymbol() : AutomationType.TP_SL.getDefaultSymbols().get(0);
            var price = snapshot.priceOf(symbol);
            if (price.isPresent()) {
                return price.get();
            }
        }
        var markPrice = position.getMarkPrice();
        return markPrice != null && markPrice.signum() > 0 ? markPrice : null;
    }

    private AutomationExecutionResult toFailure(ExternalServiceException e) {
        if (e.getHttpStatusCode() != null) {
            return AutomationExecutionResult.httpFailure(e.getHttpStatusCode(), e.getMessage());
        }
        return AutomationExecutionResult.failure(e);
    }
}
