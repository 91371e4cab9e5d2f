package com.phillippitts.voicelink.service.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptionMetricsTest {

    private MeterRegistry registry;
    private TranscriptionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TranscriptionMetrics(registry);
    }

    @Test
    void recordsEngineLatencyPerEngine() {
        metrics.recordLatency("whisper", TimeUnit.MILLISECONDS.toNanos(100));
        metrics.recordLatency("whisper", TimeUnit.MILLISECONDS.toNanos(150));
        metrics.recordLatency("cloud", TimeUnit.MILLISECONDS.toNanos(300));

        Timer whisper = registry.find("voicelink.transcription.latency").tag("engine", "whisper").timer();
        assertThat(whisper).isNotNull();
        assertThat(whisper.count()).isEqualTo(2);
        assertThat(whisper.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250);
        assertThat(registry.find("voicelink.transcription.latency").tag("engine", "cloud").timer().count())
                .isEqualTo(1);
    }

    @Test
    void countsSuccessesAndFailuresByReason() {
        metrics.incrementSuccess("whisper");
        metrics.incrementFailure("whisper", "TRANSCRIPTION_FAILED");
        metrics.incrementFailure("whisper", "TRANSCRIPTION_FAILED");

        assertThat(registry.get("voicelink.transcription.success").tag("engine", "whisper").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("voicelink.transcription.failure")
                .tag("engine", "whisper").tag("reason", "TRANSCRIPTION_FAILED").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void recordsRequestsByRouteAndStatus() {
        metrics.recordRequest("health", 200, TimeUnit.MILLISECONDS.toNanos(2));
        metrics.recordRequest("transcribe", 504, TimeUnit.SECONDS.toNanos(30));

        assertThat(registry.get("voicelink.api.requests").tag("route", "health").tag("status", "200").timer().count())
                .isEqualTo(1);
        assertThat(registry.get("voicelink.api.requests").tag("route", "transcribe").tag("status", "504").timer()
                .totalTime(TimeUnit.SECONDS)).isEqualTo(30.0);
    }

    @Test
    void recordsStepOutcomes() {
        metrics.recordEnhancement(true);
        metrics.recordEnhancement(false);
        metrics.recordDiarization("stereo", true);

        assertThat(registry.get("voicelink.transcription.enhancement").tag("outcome", "failure").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("voicelink.transcription.diarization")
                .tag("method", "stereo").tag("outcome", "success").counter().count()).isEqualTo(1.0);
    }
}
