package com.example.jobscheduler.service.alert;

import com.example.jobscheduler.config.SchedulerConfig;
import com.example.jobscheduler.config.SlackProperties;
import com.example.jobscheduler.domain.model.JobEvent;
import com.example.jobscheduler.service.listener.JobExecutionListener;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sends a Slack alert when a job handler fails.
 * <p>
 * Alerts for the same job are rate limited so a job failing on every tick does not flood the channel.
 */
@Slf4j
@Component
public class SlackAlertListener implements JobExecutionListener {

    private final SlackProperties slackProperties;
    private final Slack slack;
    private final Clock clock;
    private final Map<String, Instant> lastAlertByJob = new ConcurrentHashMap<>();

    @Value("${spring.application.name:job-scheduler}")
    private String applicationName;

    @Autowired
    public SlackAlertListener(SlackProperties slackProperties, Clock clock) {
        this(slackProperties, Slack.getInstance(), clock);
    }

    SlackAlertListener(SlackProperties slackProperties, Slack slack, Clock clock) {
        this.slackProperties = slackProperties;
        this.slack = slack;
        this.clock = clock;
    }

    @Override
    public void onExecuted(JobEvent event) {
        lastAlertByJob.remove(event.getJobId());
    }

    /**
     * Runs on the alert executor so a slow webhook never holds a job worker
     */
    @Async(SchedulerConfig.ALERT_EXECUTOR)
    @Override
    public void onError(JobEvent event, Throwable error) {
        if (!slackProperties.isEnabled() || slackProperties.getWebhookUrl() == null || slackProperties.getWebhookUrl().isBlank()) {
            log.debug("Slack alerting disabled. Failure of job {} not alerted", event.getJobId());
            return;
        }
        if (!claimAlertSlot(event.getJobId())) {
            log.debug("Slack alert for job {} suppressed by cooldown", event.getJobId());
            return;
        }

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), buildFailurePayload(event));
            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for failed job {}", event.getJobId());
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for job {}: {}", event.getJobId(), e.getMessage(), e);
        }
    }

    private boolean claimAlertSlot(String jobId) {
        var now = clock.instant();
        var cooldownEnd = now.minusSeconds(slackProperties.getAlertCooldownSeconds());
        var claimed = new boolean[1];
        lastAlertByJob.compute(jobId, (id, last) -> {
            if (last == null || !last.isAfter(cooldownEnd)) {
                claimed[0] = true;
                return now;
            }
            return last;
        });
        return claimed[0];
    }

    Payload buildFailurePayload(JobEvent event) {
        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Scheduled Job Failed*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title("Job: " + event.getJobId())
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Job ID")
                                                .value(event.getJobId())
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Scheduled For")
                                                .value(String.valueOf(event.getScheduledFireTime()))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Error")
                                                .value("```" + truncate(event.getErrorDetail(), 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName)
                                .ts(String.valueOf(event.getTimestamp().getEpochSecond()))
                                .build()
                ))
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
