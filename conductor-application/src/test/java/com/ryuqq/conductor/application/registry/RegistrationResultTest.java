package com.ryuqq.conductor.application.registry;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RegistrationResult 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RegistrationResultTest {

    @Test
    void registered_결과는_해시를_담고_오류가_없음() {
        // when
        RegistrationResult result = RegistrationResult.registered("a".repeat(64));

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.manifestHash()).hasSize(64);
        assertThat(result.errors()).isEmpty();
        assertThat(result.error()).isNull();
    }

    @Test
    void rejected_결과는_오류를_요약() {
        // when
        RegistrationResult result = RegistrationResult.rejected(List.of(
            "version: must match semver", "agents: at least one agent is required"));

        // then
        assertThat(result.success()).isFalse();
        assertThat(result.manifestHash()).isNull();
        assertThat(result.errors()).hasSize(2);
        assertThat(result.error()).isEqualTo(
            "Manifest validation failed: version: must match semver; agents: at least one agent is required");
    }

    @Test
    void 오류_목록은_방어적으로_복사() {
        // given
        List<String> errors = new ArrayList<>(List.of("domain: unknown"));

        // when
        RegistrationResult result = RegistrationResult.rejected(errors);
        errors.add("late addition");

        // then
        assertThat(result.errors()).containsExactly("domain: unknown");
    }

    @Test
    void 성공인데_해시가_없으면_예외() {
        assertThatThrownBy(() -> RegistrationResult.registered(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
