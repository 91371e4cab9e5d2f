package com.phillippitts.voicelink.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TimeUtilsTest {

    @Test
    void shouldTruncateNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(1_000_000L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(2_999_999L)).isEqualTo(2L);
        assertThat(TimeUtils.nanosToMillis(0L)).isZero();
    }

    @Test
    void elapsedSecondsKeepsSubSecondPrecision() throws InterruptedException {
        long start = System.nanoTime();
        Thread.sleep(20);

        double seconds = TimeUtils.elapsedSeconds(start);

        assertThat(seconds).isGreaterThanOrEqualTo(0.015);
        assertThat(seconds).isLessThan(1.0);
        assertThat(TimeUtils.elapsedMillis(start)).isCloseTo((long) (seconds * 1000), within(50L));
    }
}
