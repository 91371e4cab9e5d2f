package com.phillippitts.voicelink.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for the transcription pipeline and the HTTP API.
 *
 * <ul>
 *   <li>{@code voicelink.api.requests}: request latency by route and outcome code</li>
 *   <li>{@code voicelink.transcription.latency}: engine latency by engine</li>
 *   <li>{@code voicelink.transcription.success} / {@code .failure}: outcome counts by engine</li>
 *   <li>{@code voicelink.transcription.enhancement} and {@code .diarization}: step outcomes</li>
 * </ul>
 */
@Component
public class TranscriptionMetrics {

    private static final String API_PREFIX = "voicelink.api";
    private static final String METRIC_PREFIX = "voicelink.transcription";

    private final MeterRegistry registry;

    public TranscriptionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param route matched route ("health", "transcribe", "preflight", "unmatched")
     * @param status HTTP status code sent
     */
    public void recordRequest(String route, int status, long durationNanos) {
        Timer.builder(API_PREFIX + ".requests")
                .description("HTTP API request latency")
                .tag("route", route)
                .tag("status", String.valueOf(status))
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordLatency(String engineName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by the engine to transcribe audio")
                .tag("engine", engineName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String engineName) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful transcriptions")
                .tag("engine", engineName)
                .register(registry)
                .increment();
    }

    /**
     * @param reason error code of the failure
     */
    public void incrementFailure(String engineName, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed transcriptions")
                .tag("engine", engineName)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordEnhancement(boolean succeeded) {
        Counter.builder(METRIC_PREFIX + ".enhancement")
                .description("Enhancement attempts by outcome")
                .tag("outcome", succeeded ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordDiarization(String method, boolean succeeded) {
        Counter.builder(METRIC_PREFIX + ".diarization")
                .description("Diarization attempts by method and outcome")
                .tag("method", method)
                .tag("outcome", succeeded ? "success" : "failure")
                .register(registry)
                .increment();
    }
}
