package com.example.automationscheduler.queue;

import com.example.automationscheduler.domain.enums.JobStatus;
import com.example.automationscheduler.domain.enums.PlanTier;
import com.example.automationscheduler.domain.enums.QueueName;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Job counts of one queue, broken down by plan tier.
 */
@Value
public class QueueStats {

    QueueName queue;
    Map<PlanTier, TierStats> tiers;

    @Value
    @Builder(toBuilder = true)
    public static class TierStats {
        long pending;
        long inFlight;
        long deadLettered;
        long completed;
        long skipped;

        public static TierStats empty() {
            return TierStats.builder().build();
        }

        TierStats plus(JobStatus status, long count) {
            if (status == JobStatus.PENDING || status == JobStatus.RETRY_PENDING) {
                return toBuilder().pending(pending + count).build();
            }
            if (status == JobStatus.PROCESSING) {
                return toBuilder().inFlight(inFlight + count).build();
            }
            if (status == JobStatus.DEAD_LETTER) {
                return toBuilder().deadLettered(deadLettered + count).build();
            }
            if (status == JobStatus.COMPLETED) {
                return toBuilder().completed(completed + count).build();
            }
            return toBuilder().skipped(skipped + count).build();
        }
    }

    public TierStats forTier(PlanTier tier) {
        return tiers.getOrDefault(tier, TierStats.empty());
    }

    public long totalPending() {
        return tiers.values().stream().mapToLong(TierStats::getPending).sum();
    }

    public long totalInFlight() {
        return tiers.values().stream().mapToLong(TierStats::getInFlight).sum();
    }

    public long totalDeadLettered() {
        return tiers.values().stream().mapToLong(TierStats::getDeadLettered).sum();
    }

    /**
     * Accumulates (priority, status, count) rows into per-tier stats
     */
    public static class Accumulator {
        private final QueueName queue;
        private final Map<PlanTier, TierStats> tiers = new EnumMap<>(PlanTier.class);

        public Accumulator(QueueName queue) {
            this.queue = queue;
            for (var tier : PlanTier.values()) {
                tiers.put(tier, TierStats.empty());
            }
        }

        public Accumulator add(int priority, JobStatus status, long count) {
            var tier = PlanTier.fromPriority(priority);
            tiers.put(tier, tiers.get(tier).plus(status, count));
            return this;
        }

        public QueueStats build() {
            return new QueueStats(queue, Collections.unmodifiableMap(new EnumMap<>(tiers)));
        }
    }
}
