package com.example.automationscheduler.service.alert;

import com.example.automationscheduler.config.SlackProperties;
import com.example.automationscheduler.domain.entity.QueuedJob;
import com.example.automationscheduler.domain.model.SchedulerJob;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * Sends operator alerts to Slack for dead-lettered jobs and broken scheduler chains.
 */
@Slf4j
@Service
public class SlackAlertService {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneId.of("UTC"));

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:automation-scheduler}")
    private String applicationName;

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Alert that a job exhausted its retries (or failed permanently) and sits in the dead-letter view.
     * Runs asynchronously to not block job processing.
     */
    @Async
    public void sendDeadLetterAlert(QueuedJob job) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Job {} was dead-lettered but no alert was sent.", job.getId());
            return;
        }

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), buildDeadLetterPayload(job));
            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for dead-lettered job {}", job.getId());
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for job {}: {}", job.getId(), e.getMessage(), e);
        }
    }

    /**
     * Alert that an automation's scheduler chain could not be continued.
     */
    @Async
    public void sendChainBrokenAlert(SchedulerJob job, Throwable cause) {
        if (!isConfigured()) {
            log.warn("Slack alerting disabled. Chain broken alert not sent for automation {}", job.getAutomationId());
            return;
        }

        try {
            var payload = Payload.builder()
                    .channel(slackProperties.getChannel())
                    .username(applicationName)
                    .iconEmoji(":rotating_light:")
                    .text(":rotating_light: *Automation Chain Broken - Automation Is No Longer Scheduled*")
                    .attachments(List.of(
                            Attachment.builder()
                                    .color("danger")
                                    .title("Automation " + job.getAutomationId())
                                    .fields(Arrays.asList(
                                            field("Automation ID", job.getAutomationId(), true),
                                            field("Owner", job.getOwnerId(), true),
                                            field("Plan Tier", job.getPlanTier() != null ? job.getPlanTier().getCode() : "-", true),
                                            field("Cycle", String.valueOf(job.getCycle()), true),
                                            field("Error", "```" + truncate(cause != null ? cause.getMessage() : "Unknown error", 400) + "```", false)
                                    ))
                                    .footer(applicationName + " | Supervisor will resubmit; verify the automation resumes")
                                    .ts(String.valueOf(Instant.now().getEpochSecond()))
                                    .build()
                    ))
                    .build();

            slack.send(slackProperties.getWebhookUrl(), payload);
        } catch (Exception e) {
            log.error("Error sending Slack chain broken alert: {}", e.getMessage(), e);
        }
    }

    @Async
    public void sendErrorAlert(String title, String message, String details) {
        if (!isConfigured()) {
            log.warn("Slack alerting disabled. Error alert not sent: {}", title);
            return;
        }

        try {
            var payload = Payload.builder()
                    .channel(slackProperties.getChannel())
                    .username(applicationName)
                    .iconEmoji(":warning:")
                    .text(":warning: *" + title + "*")
                    .attachments(List.of(
                            Attachment.builder()
                                    .color("warning")
                                    .text(message)
                                    .fields(details != null ? List.of(field("Details", truncate(details, 500), false)) : List.of())
                                    .footer(applicationName)
                                    .ts(String.valueOf(Instant.now().getEpochSecond()))
                                    .build()
                    ))
                    .build();

            slack.send(slackProperties.getWebhookUrl(), payload);
        } catch (Exception e) {
            log.error("Error sending Slack error alert: {}", e.getMessage(), e);
        }
    }

    Payload buildDeadLetterPayload(QueuedJob job) {
        var jobId = job.getId().toString();
        var lastError = job.getLastError() != null ? job.getLastError() : "Unknown error";
        var type = job.getAutomationType() != null ? job.getAutomationType().getDisplayName() : job.getQueueName().getCode();

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Automation Job Dead-Lettered - Manual Intervention Required*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(type + " - " + job.getAutomationId())
                                .titleLink(slackProperties.getDashboardBaseUrl() + "/queues/jobs/" + jobId + "/executions")
                                .fields(Arrays.asList(
                                        field("Job ID", jobId, true),
                                        field("Queue", job.getQueueName().getCode(), true),
                                        field("Automation ID", job.getAutomationId(), true),
                                        field("Plan Tier", job.getPlanTier() != null ? job.getPlanTier().getCode() : "-", true),
                                        field("Attempts", String.valueOf(job.getAttemptsUsed()), true),
                                        field("Enqueued At", job.getEnqueuedAt() != null ? DATE_FORMATTER.format(job.getEnqueuedAt()) : "-", true),
                                        field("Last Error", "```" + truncate(lastError, 400) + "```", false)
                                ))
                                .footer(applicationName + " | Investigate, then requeue from the dead-letter view")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled() && slackProperties.getWebhookUrl() != null && !slackProperties.getWebhookUrl().isBlank();
    }

    private Field field(String title, String value, boolean shortValue) {
        return Field.builder()
                .title(title)
                .value(value != null ? value : "-")
                .valueShortEnough(shortValue)
                .build();
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
