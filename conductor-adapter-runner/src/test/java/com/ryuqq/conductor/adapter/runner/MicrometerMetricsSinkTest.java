package com.ryuqq.conductor.adapter.runner;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MicrometerMetricsSink 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class MicrometerMetricsSinkTest {

    private SimpleMeterRegistry meterRegistry;
    private MicrometerMetricsSink sink;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        sink = new MicrometerMetricsSink(meterRegistry);
    }

    @Test
    void 같은_이름과_태그의_카운터는_누적() {
        // when
        sink.increment("orchestra.actions", Map.of("domain", "finance", "status", "success"));
        sink.increment("orchestra.actions", Map.of("domain", "finance", "status", "success"));
        sink.increment("orchestra.actions", Map.of("domain", "finance", "status", "failed"));

        // then
        assertThat(meterRegistry.get("orchestra.actions").tags("status", "success").counter().count())
            .isEqualTo(2.0);
        assertThat(meterRegistry.get("orchestra.actions").tags("status", "failed").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void 게이지는_설정과_증감을_모두_지원() {
        // when
        sink.setGauge("orchestra.orchestras.active", Map.of(), 3);
        sink.adjustGauge("orchestra.orchestras.active", Map.of(), -1);
        sink.adjustGauge("orchestra.coordination.sessions.active", Map.of(), 1);

        // then
        assertThat(meterRegistry.get("orchestra.orchestras.active").gauge().value()).isEqualTo(2.0);
        assertThat(meterRegistry.get("orchestra.coordination.sessions.active").gauge().value()).isEqualTo(1.0);
        assertThat(meterRegistry.find("orchestra.orchestras.active").gauges()).hasSize(1);
    }

    @Test
    void 태그별로_게이지를_분리() {
        // when
        sink.setGauge("orchestra.agents.active", Map.of("domain", "finance"), 2);
        sink.setGauge("orchestra.agents.active", Map.of("domain", "database"), 5);

        // then
        assertThat(meterRegistry.get("orchestra.agents.active").tags("domain", "finance").gauge().value())
            .isEqualTo(2.0);
        assertThat(meterRegistry.get("orchestra.agents.active").tags("domain", "database").gauge().value())
            .isEqualTo(5.0);
    }

    @Test
    void 소요_시간은_타이머로_기록() {
        // when
        sink.recordDuration("orchestra.action.duration", Map.of("domain", "finance"), Duration.ofMillis(120));

        // then
        Timer timer = meterRegistry.get("orchestra.action.duration").timer();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(120.0);
    }

    @Test
    void null_태그_값은_none으로_기록() {
        // given
        Map<String, String> tags = new HashMap<>();
        tags.put("error_code", null);

        // when
        sink.increment("orchestra.errors", tags);

        // then
        assertThat(meterRegistry.get("orchestra.errors").tags("error_code", "none").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void null_레지스트리는_예외() {
        assertThatThrownBy(() -> new MicrometerMetricsSink(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
