package com.example.cronscheduler.service.alert;

import com.example.cronscheduler.config.SlackProperties;
import com.example.cronscheduler.domain.entity.CronJob;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * Sends alerts to Slack when a cron job keeps failing.
 * <p>
 * Messages go to the on-call channel with enough job detail to start
 * investigating without opening the admin API.
 */
@Slf4j
@Service
public class SlackAlertService {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneOffset.UTC);

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:cron-scheduler-service}")
    private String applicationName;

    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Alert that a job reached the failure threshold.
     * Runs asynchronously so the run loop is not held up by Slack.
     */
    @Async
    public void sendJobFailureAlert(CronJob job, String errorMessage) {
        if (!isEnabled()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Job {} is failing but no alert was sent.", job.getId());
            return;
        }

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), buildJobFailurePayload(job, errorMessage));

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for failing job {}", job.getId());
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for job {}: {}", job.getId(), e.getMessage(), e);
        }
    }

    Payload buildJobFailurePayload(CronJob job, String errorMessage) {
        var jobId = job.getId().toString();
        var metadata = job.getMetadata();
        var lastError = errorMessage != null ? errorMessage : "Unknown error";

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Cron Job Failing Repeatedly*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(job.getName() + " - " + job.getFunctionName())
                                .titleLink(slackProperties.getDashboardBaseUrl() + "/jobs/" + jobId)
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Job ID")
                                                .value(jobId)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Schedule")
                                                .value(job.getSchedule())
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Tenant")
                                                .value(job.getTenantId() != null ? job.getTenantId() : "system")
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Errors / Executions")
                                                .value(metadata.getErrorCount() + " / " + metadata.getExecutionCount())
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Next Run")
                                                .value(job.getNextRun() != null ? DATE_FORMATTER.format(job.getNextRun()) : "not scheduled")
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Last Error")
                                                .value("```" + truncate(lastError, 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | Investigate, then force a run or deactivate the job")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private boolean isEnabled() {
        return slackProperties.isEnabled() && slackProperties.getWebhookUrl() != null && !slackProperties.getWebhookUrl().isBlank();
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
