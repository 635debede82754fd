package io.usbjobs.execution;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VerificationConfigTest {

    @Test
    void defaultSamplingShouldCheckTwentyPercentWithFloorOfTen() {
        VerificationConfig config = VerificationConfig.defaults();

        assertThat(config.sampleSize(1000)).isEqualTo(200);
        assertThat(config.sampleSize(30)).isEqualTo(10);
        assertThat(config.sampleSize(5)).isEqualTo(5);
        assertThat(config.sampleSize(0)).isZero();
    }

    @Test
    void samplingShouldRoundUp() {
        VerificationConfig config = new VerificationConfig(VerificationStrategy.SAMPLING, 33, 0);

        assertThat(config.sampleSize(10)).isEqualTo(4);
    }

    @Test
    void fullShouldCheckEverything() {
        assertThat(VerificationConfig.full().sampleSize(7)).isEqualTo(7);
    }

    @Test
    void shouldRejectOutOfRangePercentage() {
        assertThatThrownBy(() -> new VerificationConfig(VerificationStrategy.SAMPLING, 0, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new VerificationConfig(VerificationStrategy.SAMPLING, 101, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
