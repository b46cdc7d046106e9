package com.example.automationscheduler.dto;

import com.example.automationscheduler.domain.enums.PlanTier;
import com.example.automationscheduler.queue.QueueStats;
import com.example.automationscheduler.queue.QueueStats.TierStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-tier counts of one queue, keyed by tier code
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatsResponse {

    private String queue;
    private Map<String, TierStats> tiers;
    private long totalPending;
    private long totalInFlight;
    private long totalDeadLettered;

    public static QueueStatsResponse from(QueueStats stats) {
        var tiers = new LinkedHashMap<String, TierStats>();
        for (var tier : PlanTier.values()) {
            tiers.put(tier.getCode(), stats.forTier(tier));
        }
        return QueueStatsResponse.builder()
                .queue(stats.getQueue().getCode())
                .tiers(tiers)
                .totalPending(stats.totalPending())
                .totalInFlight(stats.totalInFlight())
                .totalDeadLettered(stats.totalDeadLettered())
                .build();
    }
}
