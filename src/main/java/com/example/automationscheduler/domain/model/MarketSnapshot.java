package com.example.automationscheduler.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reference prices captured when an execution job was enqueued. May be partial or empty.
 */
@Value
@Builder
public class MarketSnapshot {

    @Builder.Default
    Map<String, BigDecimal> prices = Map.of();

    /**
     * Symbols that were requested but not returned
     */
    @Builder.Default
    List<String> missingSymbols = List.of();

    Instant capturedAt;

    /**
     * Liveness of the realtime feed at capture time
     */
    boolean feedHealthy;

    public static MarketSnapshot empty(Collection<String> requested, Instant capturedAt, boolean feedHealthy) {
        return MarketSnapshot.builder()
                .missingSymbols(List.copyOf(requested))
                .capturedAt(capturedAt)
                .feedHealthy(feedHealthy)
                .build();
    }

    public Optional<BigDecimal> priceOf(String symbol) {
        return Optional.ofNullable(prices.get(symbol));
    }

    public boolean isEmpty() {
        return prices.isEmpty();
    }

    public boolean isComplete() {
        return missingSymbols.isEmpty();
    }

    /**
     * JSON-friendly form stored with the job. Prices are kept as strings to preserve scale.
     */
    public Map<String, Object> toMap() {
        var priceMap = new LinkedHashMap<String, Object>();
        prices.forEach((symbol, price) -> priceMap.put(symbol, price.toPlainString()));

        var map = new HashMap<String, Object>();
        map.put("prices", priceMap);
        map.put("missingSymbols", missingSymbols);
        map.put("capturedAt", capturedAt != null ? capturedAt.toString() : null);
        map.put("feedHealthy", feedHealthy);
        return map;
    }

    public static MarketSnapshot fromMap(Map<String, Object> map) {
        if (map == null || map.isEmpty()) {
            return MarketSnapshot.builder().build();
        }

        var prices = new LinkedHashMap<String, BigDecimal>();
        if (map.get("prices") instanceof Map<?, ?> rawPrices) {
            rawPrices.forEach((symbol, price) -> {
                if (price != null) {
                    prices.put(String.valueOf(symbol), new BigDecimal(price.toString()));
                }
            });
        }

        List<String> missing = List.of();
        if (map.get("missingSymbols") instanceof Collection<?> rawMissing) {
            missing = rawMissing.stream().map(String::valueOf).toList();
        }

        var capturedAt = map.get("capturedAt") instanceof String text ? Instant.parse(text) : null;

        return MarketSnapshot.builder()
                .prices(prices)
                .missingSymbols(missing)
                .capturedAt(capturedAt)
                .feedHealthy(Boolean.TRUE.equals(map.get("feedHealthy")))
                .build();
    }
}
