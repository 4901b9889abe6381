package com.example.jobscheduler.service.alert;

import com.example.jobscheduler.config.SchedulerConfig;
import com.example.jobscheduler.config.SlackProperties;
import com.example.jobscheduler.domain.model.JobEvent;
import com.example.jobscheduler.support.MutableClock;
import com.slack.api.Slack;
import com.slack.api.webhook.Payload;
import com.slack.api.webhook.WebhookResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.annotation.Async;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SlackAlertListener Tests")
class SlackAlertListenerTest {

    private static final String WEBHOOK = "https://hooks.slack.com/services/T000/B000/XXXX";
    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    @Mock
    private Slack slack;

    @Mock
    private WebhookResponse okResponse;

    private SlackProperties slackProperties;
    private MutableClock clock;
    private SlackAlertListener listener;

    @BeforeEach
    void setUp() {
        slackProperties = new SlackProperties();
        slackProperties.setEnabled(true);
        slackProperties.setWebhookUrl(WEBHOOK);
        slackProperties.setAlertCooldownSeconds(300);
        clock = new MutableClock(NOW);
        listener = new SlackAlertListener(slackProperties, slack, clock);
        ReflectionTestUtils.setField(listener, "applicationName", "job-scheduler");
    }

    private JobEvent failure(String jobId) {
        var error = new IllegalStateException("downstream unavailable");
        return JobEvent.error(jobId, NOW, clock.instant(), Duration.ofMillis(40), error);
    }

    @Nested
    @DisplayName("When alerting is enabled")
    class Enabled {

        @Test
        @DisplayName("Should send one alert per failure outside the cooldown")
        void shouldSendAlert() throws Exception {
            when(okResponse.getCode()).thenReturn(200);
            when(slack.send(eq(WEBHOOK), any(Payload.class))).thenReturn(okResponse);
            var event = failure("report");

            listener.onError(event, event.getError());

            verify(slack).send(eq(WEBHOOK), any(Payload.class));
        }

        @Test
        @DisplayName("Should suppress repeated alerts for the same job within the cooldown")
        void shouldApplyCooldown() throws Exception {
            when(okResponse.getCode()).thenReturn(200);
            when(slack.send(eq(WEBHOOK), any(Payload.class))).thenReturn(okResponse);

            var first = failure("report");
            listener.onError(first, first.getError());
            clock.advance(Duration.ofSeconds(60));
            var second = failure("report");
            listener.onError(second, second.getError());

            verify(slack, times(1)).send(eq(WEBHOOK), any(Payload.class));

            clock.advance(Duration.ofSeconds(300));
            var third = failure("report");
            listener.onError(third, third.getError());

            verify(slack, times(2)).send(eq(WEBHOOK), any(Payload.class));
        }

        @Test
        @DisplayName("Should alert again right away after the job recovered")
        void shouldResetCooldownOnSuccess() throws Exception {
            when(okResponse.getCode()).thenReturn(200);
            when(slack.send(eq(WEBHOOK), any(Payload.class))).thenReturn(okResponse);

            var first = failure("report");
            listener.onError(first, first.getError());
            listener.onExecuted(JobEvent.success("report", NOW, NOW, Duration.ofMillis(10)));
            var second = failure("report");
            listener.onError(second, second.getError());

            verify(slack, times(2)).send(eq(WEBHOOK), any(Payload.class));
        }

        @Test
        @DisplayName("Should contain a webhook failure")
        void shouldContainSendFailure() throws Exception {
            when(slack.send(eq(WEBHOOK), any(Payload.class))).thenThrow(new IOException("connection reset"));
            var event = failure("report");

            assertThatCode(() -> listener.onError(event, event.getError())).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Should include job id, fire time and error in the payload")
        void shouldBuildPayload() {
            var payload = listener.buildFailurePayload(failure("report"));

            assertThat(payload.getChannel()).isEqualTo("#oncall-alerts");
            assertThat(payload.getUsername()).isEqualTo("job-scheduler");
            assertThat(payload.getAttachments()).hasSize(1);
            var attachment = payload.getAttachments().get(0);
            assertThat(attachment.getTitle()).isEqualTo("Job: report");
            assertThat(attachment.getFields())
                    .anySatisfy(field -> assertThat(field.getValue()).contains("IllegalStateException: downstream unavailable"))
                    .anySatisfy(field -> assertThat(field.getValue()).isEqualTo(NOW.toString()));
        }
    }

    @Test
    @DisplayName("Should send failure alerts on the alert executor")
    void shouldSendOnAlertExecutor() throws Exception {
        var onError = SlackAlertListener.class.getMethod("onError", JobEvent.class, Throwable.class);

        assertThat(onError.getAnnotation(Async.class)).isNotNull();
        assertThat(onError.getAnnotation(Async.class).value()).isEqualTo(SchedulerConfig.ALERT_EXECUTOR);
    }

    @Test
    @DisplayName("Should not send when alerting is disabled")
    void shouldNotSendWhenDisabled() throws Exception {
        slackProperties.setEnabled(false);
        var event = failure("report");

        listener.onError(event, event.getError());

        verify(slack, never()).send(anyString(), any(Payload.class));
    }

    @Test
    @DisplayName("Should not send when the webhook URL is missing")
    void shouldNotSendWithoutWebhook() throws Exception {
        slackProperties.setWebhookUrl(" ");
        var event = failure("report");

        listener.onError(event, event.getError());

        verify(slack, never()).send(anyString(), any(Payload.class));
    }
}
