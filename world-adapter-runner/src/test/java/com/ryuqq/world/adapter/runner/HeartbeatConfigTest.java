package com.ryuqq.world.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * HeartbeatConfig 유닛 테스트.
 *
 * @author World Team
 * @since 1.0.0
 */
class HeartbeatConfigTest {

    @Test
    void 기본_설정값() {
        // when
        HeartbeatConfig config = new HeartbeatConfig();

        // then
        assertThat(config.periodMs()).isEqualTo(500);
        assertThat(config.phaseAligned()).isTrue();
        assertThat(config.shutdownTimeoutMs()).isEqualTo(2000);
        assertThat(config.threadName()).isEqualTo("world-heartbeat");
    }

    @Test
    void withX_메서드는_해당_값만_변경() {
        // given
        HeartbeatConfig config = new HeartbeatConfig();

        // when
        HeartbeatConfig changed = config
            .withPeriodMs(20)
            .withPhaseAligned(false)
            .withShutdownTimeoutMs(100)
            .withThreadName("test-heartbeat");

        // then
        assertThat(changed).isEqualTo(new HeartbeatConfig(20, false, 100, "test-heartbeat"));
        assertThat(config).isEqualTo(new HeartbeatConfig());
    }

    @Test
    void periodMs가_양수가_아니면_예외() {
        assertThatThrownBy(() -> new HeartbeatConfig(0, true, 2000, "world-heartbeat"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("periodMs must be positive (current: 0)");
    }

    @Test
    void shutdownTimeoutMs가_양수가_아니면_예외() {
        assertThatThrownBy(() -> new HeartbeatConfig().withShutdownTimeoutMs(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("shutdownTimeoutMs must be positive (current: -1)");
    }

    @Test
    void threadName이_공백이면_예외() {
        assertThatThrownBy(() -> new HeartbeatConfig().withThreadName(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("threadName");
        assertThatThrownBy(() -> new HeartbeatConfig().withThreadName(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
