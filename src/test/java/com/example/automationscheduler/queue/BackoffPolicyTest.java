package com.example.automationscheduler.queue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BackoffPolicy Tests")
class BackoffPolicyTest {

    @Test
    @DisplayName("Should double the delay after each failure")
    void shouldDoubleDelay() {
        assertThat(BackoffPolicy.delayFor(2000, 2.0, 0)).isEqualTo(Duration.ofSeconds(2));
        assertThat(BackoffPolicy.delayFor(2000, 2.0, 1)).isEqualTo(Duration.ofSeconds(4));
        assertThat(BackoffPolicy.delayFor(2000, 2.0, 2)).isEqualTo(Duration.ofSeconds(8));
    }

    @Test
    @DisplayName("Should keep a constant delay with multiplier one")
    void shouldKeepConstantDelay() {
        assertThat(BackoffPolicy.delayFor(500, 1.0, 5)).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    @DisplayName("Should reject negative failure count")
    void shouldRejectNegativeFailures() {
        assertThatThrownBy(() -> BackoffPolicy.delayFor(2000, 2.0, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
