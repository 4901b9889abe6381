package com.example.jobscheduler.service.scheduler;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.domain.enums.JobOutcome;
import com.example.jobscheduler.domain.model.IntervalSpec;
import com.example.jobscheduler.domain.model.JobDefinition;
import com.example.jobscheduler.exception.LockUnavailableException;
import com.example.jobscheduler.lock.DistributedMutex;
import com.example.jobscheduler.lock.InMemoryLockStoreClient;
import com.example.jobscheduler.lock.LockStoreClient;
import com.example.jobscheduler.service.handler.JobExecutionContext;
import com.example.jobscheduler.service.handler.JobHandler;
import com.example.jobscheduler.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("JobInvoker Tests")
class JobInvokerTest {

    private static final Instant FIRE_TIME = Instant.parse("2024-03-10T12:00:00Z");
    private static final String LOCK_KEY = "scheduler:lock:report";

    private MutableClock clock;
    private InMemoryLockStoreClient store;
    private JobSchedulerProperties properties;
    private JobInvoker invoker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(FIRE_TIME);
        store = new InMemoryLockStoreClient(clock);
        properties = new JobSchedulerProperties();
        properties.setInstanceId("instance-a");
        invoker = new JobInvoker(new DistributedMutex(store, properties, clock), properties, clock);
    }

    private JobDefinition job(JobHandler handler, boolean distributed) {
        return JobDefinition.builder()
                .jobId("report")
                .triggerSpec(IntervalSpec.ofSeconds(30))
                .handler(handler)
                .distributed(distributed)
                .lockTtlSeconds(300)
                .build();
    }

    @Nested
    @DisplayName("Distributed jobs")
    class DistributedJobs {

        @Test
        @DisplayName("Should hold the lock while the handler runs and release it afterwards")
        void shouldHoldLockDuringHandler() {
            var tokenDuringRun = new AtomicReference<String>();
            var context = new AtomicReference<JobExecutionContext>();

            var event = invoker.invoke(job(ctx -> {
                context.set(ctx);
                tokenDuringRun.set(store.currentToken(LOCK_KEY).orElse(null));
                clock.advance(Duration.ofMillis(250));
            }, true), FIRE_TIME);

            assertThat(event.getOutcome()).isEqualTo(JobOutcome.SUCCESS);
            assertThat(event.getDuration()).isEqualTo(Duration.ofMillis(250));
            assertThat(tokenDuringRun.get()).isNotNull();
            assertThat(store.currentToken(LOCK_KEY)).isEmpty();
            assertThat(context.get().isLockHeld()).isTrue();
            assertThat(context.get().getInstanceId()).isEqualTo("instance-a");
            assertThat(context.get().getScheduledFireTime()).isEqualTo(FIRE_TIME);
        }

        @Test
        @DisplayName("Should release the lock when the handler throws")
        void shouldReleaseLockOnError() {
            var event = invoker.invoke(job(ctx -> {
                throw new IllegalStateException("downstream unavailable");
            }, true), FIRE_TIME);

            assertThat(event.getOutcome()).isEqualTo(JobOutcome.ERROR);
            assertThat(event.getErrorDetail()).isEqualTo("IllegalStateException: downstream unavailable");
            assertThat(event.getError()).isInstanceOf(IllegalStateException.class);
            assertThat(store.currentToken(LOCK_KEY)).isEmpty();
        }

        @Test
        @DisplayName("Should release the lock and keep the interrupt flag when the handler is interrupted")
        void shouldReleaseLockOnInterrupt() {
            try {
                var event = invoker.invoke(job(ctx -> {
                    throw new InterruptedException("shutdown");
                }, true), FIRE_TIME);

                assertThat(event.getOutcome()).isEqualTo(JobOutcome.ERROR);
                assertThat(store.currentToken(LOCK_KEY)).isEmpty();
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
            } finally {
                Thread.interrupted();
            }
        }

        @Test
        @DisplayName("Should report an Error thrown by the handler as a failed run and release the lock")
        void shouldContainHandlerError() {
            var event = invoker.invoke(job(ctx -> {
                throw new AssertionError("bad state");
            }, true), FIRE_TIME);

            assertThat(event.getOutcome()).isEqualTo(JobOutcome.ERROR);
            assertThat(event.getError()).isInstanceOf(AssertionError.class);
            assertThat(event.getErrorDetail()).isEqualTo("AssertionError: bad state");
            assertThat(store.currentToken(LOCK_KEY)).isEmpty();
        }

        @Test
        @DisplayName("Should skip without running the handler when another instance holds the lock")
        void shouldSkipWhenLockHeld() {
            store.setIfAbsent(LOCK_KEY, "other-instance-token", Duration.ofSeconds(300));
            var ran = new AtomicBoolean();

            var event = invoker.invoke(job(ctx -> ran.set(true), true), FIRE_TIME);

            assertThat(event.getOutcome()).isEqualTo(JobOutcome.SKIPPED_LOCK_HELD);
            assertThat(event.getDuration()).isNull();
            assertThat(ran).isFalse();
            assertThat(store.currentToken(LOCK_KEY)).contains("other-instance-token");
        }

        @Test
        @DisplayName("Should skip when the lock store is unreachable")
        void shouldSkipWhenStoreUnavailable() {
            var failingStore = mock(LockStoreClient.class);
            when(failingStore.setIfAbsent(anyString(), anyString(), any(Duration.class)))
                    .thenThrow(new LockUnavailableException(LOCK_KEY, new RuntimeException("connection refused")));
            var failingInvoker = new JobInvoker(new DistributedMutex(failingStore, properties, clock), properties, clock);
            var ran = new AtomicBoolean();

            var event = failingInvoker.invoke(job(ctx -> ran.set(true), true), FIRE_TIME);

            assertThat(event.getOutcome()).isEqualTo(JobOutcome.SKIPPED_LOCK_HELD);
            assertThat(event.getErrorDetail()).contains("connection refused");
            assertThat(ran).isFalse();
        }
    }

    @Test
    @DisplayName("Should run non-distributed jobs without touching the lock store")
    void shouldRunLocalJobWithoutLock() {
        store.setIfAbsent(LOCK_KEY, "other-instance-token", Duration.ofSeconds(300));
        var lockHeld = new AtomicReference<Boolean>();

        var event = invoker.invoke(job(ctx -> lockHeld.set(ctx.isLockHeld()), false), FIRE_TIME);

        assertThat(event.getOutcome()).isEqualTo(JobOutcome.SUCCESS);
        assertThat(lockHeld.get()).isFalse();
        assertThat(store.currentToken(LOCK_KEY)).contains("other-instance-token");
    }

    @Test
    @DisplayName("Should derive an instance id when none is configured")
    void shouldDeriveInstanceId() {
        var defaults = new JobSchedulerProperties();

        var derived = new JobInvoker(new DistributedMutex(store, defaults, clock), defaults, clock);

        assertThat(derived.getInstanceId()).isNotBlank();
    }
}
