package com.umitunal.qcron.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class SchedulerConfigTest {

    @Test
    @DisplayName("Should apply defaults")
    void testDefaults() {
        SchedulerConfig config = SchedulerConfig.newBuilder("node-a", Duration.ofMinutes(2)).build();

        assertThat(config.getInstanceId()).isEqualTo("node-a");
        assertThat(config.getLeaseDuration()).isEqualTo(Duration.ofMinutes(2));
        assertThat(config.getPollInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getMaxExecutionTime()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getClockSkewTolerance()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getMaxBackoff()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getRetryDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.getWorkerPoolSize()).isEqualTo(4);
        assertThat(config.getMaxAttempts()).isEqualTo(1);
        assertThat(config.getBatchSize()).isEqualTo(100);
        assertThat(config.getZone()).isEqualTo(ZoneOffset.UTC);
        assertThat(config.getClock()).isNotNull();
    }

    @Test
    @DisplayName("Lease must outlast the worst-case occurrence plus clock skew")
    void testLeaseBound() {
        // 60s execution + 5s skew
        assertThatThrownBy(() -> SchedulerConfig.newBuilder("node-a", Duration.ofSeconds(65)).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("leaseDuration");
        assertThat(SchedulerConfig.newBuilder("node-a", Duration.ofSeconds(66)).build()).isNotNull();

        // 3 x 60s attempts + 2 x 10s delay + 5s skew = 205s
        SchedulerConfig.Builder retrying = SchedulerConfig.newBuilder("node-a", Duration.ofSeconds(205))
                .withMaxAttempts(3)
                .withRetryDelay(Duration.ofSeconds(10));
        assertThatThrownBy(retrying::build).isInstanceOf(IllegalArgumentException.class);

        SchedulerConfig config = SchedulerConfig.newBuilder("node-a", Duration.ofSeconds(206))
                .withMaxAttempts(3)
                .withRetryDelay(Duration.ofSeconds(10))
                .build();
        assertThat(config.worstCaseOccurrenceTime()).isEqualTo(Duration.ofSeconds(200));
    }

    @Test
    @DisplayName("Should reject invalid settings")
    void testValidation() {
        Duration lease = Duration.ofMinutes(5);

        assertThatThrownBy(() -> SchedulerConfig.newBuilder(" ", lease).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SchedulerConfig.newBuilder("node-a", Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SchedulerConfig.newBuilder("node-a", lease).withPollInterval(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SchedulerConfig.newBuilder("node-a", lease).withWorkerPoolSize(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SchedulerConfig.newBuilder("node-a", lease).withMaxAttempts(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SchedulerConfig.newBuilder("node-a", lease).withBatchSize(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SchedulerConfig.newBuilder("node-a", lease).withZone(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should accept an injected clock")
    void testClock() {
        Clock fixed = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

        SchedulerConfig config = SchedulerConfig.newBuilder("node-a", Duration.ofMinutes(2))
                .withClock(fixed)
                .build();

        assertThat(config.getClock()).isSameAs(fixed);
    }
}
