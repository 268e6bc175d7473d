package com.driftsentinel.core.config;

import com.driftsentinel.core.model.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link MonitorConfig}.
 */
class MonitorConfigTest {

    @Test
    @DisplayName("Should apply documented defaults")
    void shouldApplyDefaults() {
        MonitorConfig config = MonitorConfig.defaults();

        assertThat(config.getWindowCapacity()).isEqualTo(100);
        assertThat(config.getMaxAge()).isEqualTo(Duration.ZERO);
        assertThat(config.getDistanceMetric()).isEqualTo("psi");
        assertThat(config.getMinSamples()).isEqualTo(30);
        assertThat(config.getWarnThreshold()).isEqualTo(0.1);
        assertThat(config.getCriticalThreshold()).isEqualTo(0.25);
        assertThat(config.getConfidenceDropThreshold()).isEqualTo(0.2);
        assertThat(config.getAlertCooldown()).isEqualTo(Duration.ofMinutes(15));
        assertThat(config.getRecentAlertLimit()).isEqualTo(10);
        assertThat(config.getCriticalAlertThreshold()).isEqualTo(3);
        assertThat(config.getRetrainEvaluationPeriod()).isEqualTo(Duration.ofDays(7));
        assertThat(config.getMaxStaleness()).isEqualTo(Duration.ofDays(30));
    }

    @Test
    @DisplayName("Should derive critical confidence drop from the warning drop")
    void shouldDeriveCriticalDrop() {
        MonitorConfig config = MonitorConfig.builder().confidenceDropThreshold(0.1).build();

        assertThat(config.getCriticalConfidenceDropThreshold()).isCloseTo(0.15, within(1e-9));
        assertThat(MonitorConfig.defaults().getCriticalConfidenceDropThreshold()).isCloseTo(0.3, within(1e-9));
    }

    @Test
    @DisplayName("Should reject critical threshold not above warn threshold")
    void shouldRejectInvertedThresholds() {
        assertThatThrownBy(() -> MonitorConfig.builder().warnThreshold(0.3).criticalThreshold(0.3).build())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("criticalThreshold");
    }

    @Test
    @DisplayName("Should reject minimum sample count larger than the window")
    void shouldRejectMinSamplesAboveCapacity() {
        assertThatThrownBy(() -> MonitorConfig.builder().windowCapacity(10).minSamples(20).build())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("minSamples");
    }

    @Test
    @DisplayName("Should reject unknown distance metrics")
    void shouldRejectUnknownMetric() {
        assertThatThrownBy(() -> MonitorConfig.builder().distanceMetric("kl").build())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Unknown distance metric");
    }

    @Test
    @DisplayName("Should collect all violations in one exception")
    void shouldCollectAllViolations() {
        assertThatThrownBy(() -> MonitorConfig.builder()
                .windowCapacity(0)
                .confidenceDropThreshold(1.5)
                .alertCooldown(Duration.ofSeconds(-1))
                .maxStaleness(Duration.ZERO)
                .build())
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getViolations()).hasSizeGreaterThanOrEqualTo(4));
    }

    @Test
    @DisplayName("Should allow zero cool-down and zero critical alert threshold")
    void shouldAllowZeroCooldown() {
        MonitorConfig config = MonitorConfig.builder()
                .alertCooldown(Duration.ZERO)
                .criticalAlertThreshold(0)
                .build();

        assertThat(config.getAlertCooldown()).isZero();
        assertThat(config.getCriticalAlertThreshold()).isZero();
    }

    @Test
    @DisplayName("Should compare configurations by value")
    void shouldCompareByValue() {
        assertThat(MonitorConfig.builder().windowCapacity(50).build())
                .isEqualTo(MonitorConfig.builder().windowCapacity(50).build())
                .isNotEqualTo(MonitorConfig.defaults());
    }
}
