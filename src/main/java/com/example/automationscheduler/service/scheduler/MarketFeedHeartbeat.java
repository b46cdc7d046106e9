package com.example.automationscheduler.service.scheduler;

import com.example.automationscheduler.client.MarketDataClient;
import com.example.automationscheduler.config.AutomationSchedulerProperties;
import com.example.automationscheduler.liveness.ConnectionLivenessMonitor;
import com.example.automationscheduler.liveness.LivenessEvent;
import com.example.automationscheduler.liveness.LivenessListener;
import com.example.automationscheduler.liveness.PingSender;
import com.example.automationscheduler.service.alert.SlackAlertService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Keeps a liveness monitor on the market data feed by pinging its heartbeat endpoint.
 * <p>
 * The scheduler stamps every market snapshot with {@link #isFeedHealthy()}. A dead feed is
 * reported to Slack and monitoring restarts one ping interval later.
 */
@Slf4j
@Component
public class MarketFeedHeartbeat implements PingSender, LivenessListener {

    static final String CONNECTION_NAME = "market-feed";

    private final MarketDataClient marketDataClient;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final SlackAlertService slackAlertService;
    private final AutomationSchedulerProperties.Liveness settings;
    private final ConnectionLivenessMonitor monitor;

    private volatile boolean shuttingDown;

    public MarketFeedHeartbeat(MarketDataClient marketDataClient, TaskScheduler taskScheduler, Clock clock,
                               SlackAlertService slackAlertService, AutomationSchedulerProperties properties) {
        this.marketDataClient = marketDataClient;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.slackAlertService = slackAlertService;
        this.settings = properties.getLiveness();
        this.monitor = new ConnectionLivenessMonitor(CONNECTION_NAME, taskScheduler, clock,
                Duration.ofMillis(settings.getPingIntervalMs()),
                Duration.ofMillis(settings.getPongTimeoutMs()),
                settings.getMaxMissedPongs(),
                this);
        this.monitor.addListener(this);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!settings.isEnabled()) {
            log.info("Market feed liveness monitoring is disabled, snapshots are marked healthy");
            return;
        }
        monitor.start();
    }

    @PreDestroy
    public void stop() {
        shuttingDown = true;
        monitor.stop();
    }

    /**
     * True while the feed answers pings. Always true when monitoring is disabled.
     */
    public boolean isFeedHealthy() {
        return !settings.isEnabled() || monitor.isHealthy();
    }

    public ConnectionLivenessMonitor getMonitor() {
        return monitor;
    }

    @Override
    public void sendPing(long pingId) {
        marketDataClient.ping().subscribe(
                ignored -> {
                },
                error -> log.debug("Market feed ping {} failed: {}", pingId, error.getMessage()),
                () -> monitor.onPong(pingId));
    }

    @Override
    public void onTransition(LivenessEvent event) {
        log.info("Market feed liveness {} -> {} (missed pongs {})", event.getPrevious(), event.getCurrent(), event.getMissedPongs());
        if (!event.isConnectionDead()) {
            return;
        }

        slackAlertService.sendErrorAlert(
                "Market feed unresponsive",
                String.format("No heartbeat answer after %d pings; snapshots are marked unhealthy", event.getMissedPongs()),
                "Connection: " + event.getConnectionName());
        taskScheduler.schedule(this::restart, clock.instant().plusMillis(settings.getPingIntervalMs()));
    }

    void restart() {
        if (shuttingDown) {
            return;
        }
        log.info("Restarting market feed liveness monitoring");
        monitor.start();
    }
}
