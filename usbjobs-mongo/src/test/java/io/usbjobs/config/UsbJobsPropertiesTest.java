package io.usbjobs.config;

import io.usbjobs.execution.VerificationConfig;
import io.usbjobs.execution.VerificationStrategy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UsbJobsPropertiesTest {

    @Test
    void defaultsShouldMatchDocumentedValues() {
        UsbJobsProperties props = new UsbJobsProperties();

        assertThat(props.getLeaseDuration()).isEqualTo(Duration.ofSeconds(300));
        assertThat(props.getPollInterval()).isEqualTo(Duration.ofMillis(5000));
        assertThat(props.getMaxConcurrentJobs()).isEqualTo(1);
        assertThat(props.getLeaseExtensionThresholdPercent()).isEqualTo(50);
        assertThat(props.getMaxAttempts()).isEqualTo(3);
        assertThat(props.getShutdownGracePeriod()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.isAllowPartialCopy()).isFalse();
        assertThat(props.getVerification().toConfig()).isEqualTo(VerificationConfig.defaults());
        assertThatCode(props::validate).doesNotThrowAnyException();
    }

    @Test
    void validateShouldRejectNonPositiveDurations() {
        UsbJobsProperties props = new UsbJobsProperties();
        props.setLeaseDuration(Duration.ZERO);

        assertThatThrownBy(props::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("leaseDuration");
    }

    @Test
    void validateShouldRejectOutOfRangeThreshold() {
        UsbJobsProperties props = new UsbJobsProperties();
        props.setLeaseExtensionThresholdPercent(100);

        assertThatThrownBy(props::validate).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void validateShouldRejectBadVerificationSettings() {
        UsbJobsProperties props = new UsbJobsProperties();
        props.getVerification().setStrategy(VerificationStrategy.FULL);
        props.getVerification().setSamplePercentage(0);

        assertThatThrownBy(props::validate).isInstanceOf(IllegalArgumentException.class);
    }
}
