package com.example.jobscheduler.service.health;

import com.example.jobscheduler.domain.enums.SchedulerState;
import com.example.jobscheduler.lock.LockStoreClient;
import com.example.jobscheduler.service.scheduler.SchedulerCore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("LockStoreHealthIndicator Tests")
class LockStoreHealthIndicatorTest {

    @Mock
    private LockStoreClient lockStoreClient;

    @Mock
    private SchedulerCore schedulerCore;

    @InjectMocks
    private LockStoreHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        when(lockStoreClient.getStoreName()).thenReturn("redis");
        when(schedulerCore.getState()).thenReturn(SchedulerState.RUNNING);
        when(schedulerCore.getInstanceId()).thenReturn("instance-a");
        when(schedulerCore.listJobs()).thenReturn(List.of());
    }

    @Test
    @DisplayName("Should report UP when the lock store answers")
    void shouldReportUp() {
        when(lockStoreClient.ping()).thenReturn(true);

        var health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("lockStore", "redis").containsEntry("jobs", 0);
    }

    @Test
    @DisplayName("Should report DOWN when the ping fails")
    void shouldReportDownOnFailedPing() {
        when(lockStoreClient.ping()).thenReturn(false);

        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    @DisplayName("Should report DOWN when the ping throws")
    void shouldReportDownOnPingError() {
        when(lockStoreClient.ping()).thenThrow(new IllegalStateException("connection pool exhausted"));

        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.DOWN);
    }
}
