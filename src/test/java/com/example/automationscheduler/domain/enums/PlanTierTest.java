package com.example.automationscheduler.domain.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PlanTier Tests")
class PlanTierTest {

    @Nested
    @DisplayName("Priority")
    class PriorityTests {

        @Test
        @DisplayName("Should rank lifetime first and free last")
        void shouldRankTiers() {
            assertThat(PlanTier.LIFETIME.getPriority()).isEqualTo(1);
            assertThat(PlanTier.PRO.getPriority()).isEqualTo(2);
            assertThat(PlanTier.ADVANCED.getPriority()).isEqualTo(3);
            assertThat(PlanTier.BASIC.getPriority()).isEqualTo(4);
            assertThat(PlanTier.FREE.getPriority()).isEqualTo(5);
        }

        @Test
        @DisplayName("Should map priority back to its tier")
        void shouldMapPriorityBack() {
            for (var tier : PlanTier.values()) {
                assertThat(PlanTier.fromPriority(tier.getPriority())).isEqualTo(tier);
            }
        }

        @Test
        @DisplayName("Should treat unknown priority as free")
        void shouldTreatUnknownPriorityAsFree() {
            assertThat(PlanTier.fromPriority(42)).isEqualTo(PlanTier.FREE);
        }
    }

    @Nested
    @DisplayName("Code lookup")
    class CodeLookupTests {

        @Test
        @DisplayName("Should find tier by code ignoring case")
        void shouldFindByCode() {
            assertThat(PlanTier.fromCode("pro")).isEqualTo(PlanTier.PRO);
            assertThat(PlanTier.fromCode("LIFETIME")).isEqualTo(PlanTier.LIFETIME);
        }

        @Test
        @DisplayName("Should reject unknown code in strict lookup")
        void shouldRejectUnknownCode() {
            assertThatThrownBy(() -> PlanTier.fromCode("platinum"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("platinum");
        }

        @Test
        @DisplayName("Should fall back to free for unknown or missing code")
        void shouldFallBackToFree() {
            assertThat(PlanTier.fromCodeOrFree("platinum")).isEqualTo(PlanTier.FREE);
            assertThat(PlanTier.fromCodeOrFree(null)).isEqualTo(PlanTier.FREE);
            assertThat(PlanTier.fromCodeOrFree("ADVANCED")).isEqualTo(PlanTier.ADVANCED);
        }
    }

    @Test
    @DisplayName("Should give higher tiers shorter default intervals")
    void shouldGiveHigherTiersShorterIntervals() {
        assertThat(PlanTier.FREE.getDefaultIntervalMinutes()).isEqualTo(15);
        assertThat(PlanTier.BASIC.getDefaultIntervalMinutes()).isEqualTo(10);
        assertThat(PlanTier.ADVANCED.getDefaultIntervalMinutes()).isEqualTo(5);
        assertThat(PlanTier.PRO.getDefaultIntervalMinutes()).isEqualTo(2);
        assertThat(PlanTier.LIFETIME.getDefaultIntervalMinutes()).isEqualTo(1);
    }
}
