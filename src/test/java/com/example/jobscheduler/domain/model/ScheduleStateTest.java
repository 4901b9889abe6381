package com.example.jobscheduler.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ScheduleState Tests")
class ScheduleStateTest {

    @Test
    @DisplayName("Should refuse slots beyond max instances")
    void shouldRefuseBeyondCapacity() {
        var state = new ScheduleState(Instant.EPOCH);

        assertThat(state.tryReserveInstance(2)).isTrue();
        assertThat(state.tryReserveInstance(2)).isTrue();
        assertThat(state.tryReserveInstance(2)).isFalse();
        assertThat(state.getRunningInstances()).isEqualTo(2);

        state.releaseInstance();
        assertThat(state.tryReserveInstance(2)).isTrue();
    }

    @Test
    @DisplayName("Should never drop below zero on release")
    void shouldNotGoNegative() {
        var state = new ScheduleState(Instant.EPOCH);

        state.releaseInstance();

        assertThat(state.getRunningInstances()).isZero();
    }

    @Test
    @DisplayName("Should grant exactly max instances slots under contention")
    void shouldGrantExactCapacityConcurrently() throws Exception {
        var state = new ScheduleState(Instant.EPOCH);
        var pool = Executors.newFixedThreadPool(8);
        var startGate = new CountDownLatch(1);
        try {
            var results = new ArrayList<Future<Boolean>>();
            for (var i = 0; i < 32; i++) {
                Callable<Boolean> attempt = () -> {
                    startGate.await();
                    return state.tryReserveInstance(3);
                };
                results.add(pool.submit(attempt));
            }
            startGate.countDown();

            var granted = 0;
            for (var result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    granted++;
                }
            }
            assertThat(granted).isEqualTo(3);
            assertThat(state.getRunningInstances()).isEqualTo(3);
        } finally {
            pool.shutdownNow();
        }
    }
}
