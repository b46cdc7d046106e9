package com.example.automationscheduler.liveness;

import com.example.automationscheduler.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ConnectionLivenessMonitor Tests")
class ConnectionLivenessMonitorTest {

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private PingSender pingSender;

    @Mock
    private ScheduledFuture<?> pingFuture;

    private final List<Runnable> pingTasks = new ArrayList<>();
    private final List<Runnable> timeoutTasks = new ArrayList<>();
    private final List<LivenessEvent> events = new ArrayList<>();

    private MutableClock clock;
    private ConnectionLivenessMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");

        doAnswer(invocation -> {
            pingTasks.add(invocation.getArgument(0));
            return pingFuture;
        }).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
        doAnswer(invocation -> {
            timeoutTasks.add(invocation.getArgument(0));
            return mock(ScheduledFuture.class);
        }).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

        monitor = new ConnectionLivenessMonitor("market-feed", taskScheduler, clock,
                Duration.ofSeconds(30), Duration.ofSeconds(10), 3, pingSender);
        monitor.addListener(events::add);
    }

    private void firePing() {
        pingTasks.get(pingTasks.size() - 1).run();
    }

    private void fireLatestTimeout() {
        timeoutTasks.get(timeoutTasks.size() - 1).run();
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Should enter HEALTHY on start and schedule pings")
        void shouldStartHealthy() {
            // When
            monitor.start();

            // Then
            assertThat(monitor.getState()).isEqualTo(LivenessState.HEALTHY);
            assertThat(pingTasks).hasSize(1);
            assertThat(events).extracting(LivenessEvent::getCurrent).containsExactly(LivenessState.HEALTHY);
            assertThat(events.get(0).getPrevious()).isEqualTo(LivenessState.STOPPED);
        }

        @Test
        @DisplayName("Should ignore start while already active")
        void shouldIgnoreSecondStart() {
            monitor.start();
            monitor.start();

            assertThat(pingTasks).hasSize(1);
            assertThat(events).hasSize(1);
        }

        @Test
        @DisplayName("Should stop from any state and cancel the ping task")
        void shouldStop() {
            // Given
            monitor.start();
            firePing();
            fireLatestTimeout();

            // When
            monitor.stop();

            // Then
            assertThat(monitor.getState()).isEqualTo(LivenessState.STOPPED);
            assertThat(monitor.getMissedPongs()).isZero();
            verify(pingFuture).cancel(false);
        }

        @Test
        @DisplayName("Should not publish anything when stopping an idle monitor")
        void shouldIgnoreIdleStop() {
            monitor.stop();

            assertThat(events).isEmpty();
        }
    }

    @Nested
    @DisplayName("Heartbeat")
    class HeartbeatTests {

        @BeforeEach
        void start() {
            monitor.start();
            events.clear();
        }

        @Test
        @DisplayName("Should send numbered pings and record latency on pong")
        void shouldRecordLatency() {
            // Given
            firePing();
            verify(pingSender).sendPing(1L);

            // When
            clock.advance(Duration.ofMillis(250));
            monitor.onPong(1L);

            // Then
            assertThat(monitor.getLastLatency()).isEqualTo(Duration.ofMillis(250));
            assertThat(monitor.getState()).isEqualTo(LivenessState.HEALTHY);
            assertThat(events).isEmpty();
        }

        @Test
        @DisplayName("Should degrade on a missed pong and recover on the next answer")
        void shouldDegradeThenRecover() {
            // Given
            firePing();
            fireLatestTimeout();
            assertThat(monitor.getState()).isEqualTo(LivenessState.DEGRADED);
            assertThat(monitor.getMissedPongs()).isEqualTo(1);

            // When
            firePing();
            monitor.onPong(2L);

            // Then
            assertThat(monitor.getState()).isEqualTo(LivenessState.HEALTHY);
            assertThat(monitor.getMissedPongs()).isZero();
            assertThat(events).extracting(LivenessEvent::getCurrent)
                    .containsExactly(LivenessState.DEGRADED, LivenessState.HEALTHY);
        }

        @Test
        @DisplayName("Should declare the connection dead after the maximum missed pongs")
        void shouldGoDead() {
            // When
            for (var i = 0; i < 3; i++) {
                firePing();
                fireLatestTimeout();
            }

            // Then
            assertThat(monitor.getState()).isEqualTo(LivenessState.DEAD);
            assertThat(events.get(events.size() - 1).isConnectionDead()).isTrue();
            assertThat(events.get(events.size() - 1).getMissedPongs()).isEqualTo(3);
            verify(pingFuture).cancel(false);
        }

        @Test
        @DisplayName("Should stay dead until restarted")
        void shouldStayDeadUntilRestart() {
            // Given
            for (var i = 0; i < 3; i++) {
                firePing();
                fireLatestTimeout();
            }

            // When
            firePing();
            monitor.onPong(4L);

            // Then
            assertThat(monitor.getState()).isEqualTo(LivenessState.DEAD);

            monitor.start();
            assertThat(monitor.getState()).isEqualTo(LivenessState.HEALTHY);
            assertThat(monitor.getMissedPongs()).isZero();
        }

        @Test
        @DisplayName("Should ignore a pong that arrives after its timeout")
        void shouldIgnoreLatePong() {
            // Given
            firePing();
            fireLatestTimeout();

            // When
            monitor.onPong(1L);

            // Then
            assertThat(monitor.getState()).isEqualTo(LivenessState.DEGRADED);
            assertThat(monitor.getMissedPongs()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should count an unsent ping as missed when its timeout fires")
        void shouldSurviveSendFailure() {
            // Given
            doThrow(new IllegalStateException("socket closed")).when(pingSender).sendPing(anyLong());

            // When
            firePing();
            fireLatestTimeout();

            // Then
            assertThat(monitor.getState()).isEqualTo(LivenessState.DEGRADED);
        }

        @Test
        @DisplayName("Should keep notifying other listeners when one throws")
        void shouldIsolateListenerFailures() {
            // Given
            monitor.addListener(event -> {
                throw new IllegalStateException("listener bug");
            });
            var seen = new ArrayList<LivenessEvent>();
            monitor.addListener(seen::add);

            // When
            firePing();
            fireLatestTimeout();

            // Then
            assertThat(seen).hasSize(1);
            assertThat(monitor.getState()).isEqualTo(LivenessState.DEGRADED);
        }
    }
}
