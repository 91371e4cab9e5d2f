package com.phillippitts.voicelink.service.health;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code GET /health}, rebuilt on every request.
 *
 * @param timestamp seconds since the epoch
 */
public record HealthSnapshot(String status, String service, String version, double timestamp,
                             SystemInfo system, ApiInfo api, TranscriptionInfo transcription,
                             List<String> capabilities) {

    public record SystemInfo(String platform, String osVersion, int processorCount,
                             @JsonProperty("memoryUsageMB") double memoryUsageMB, double uptimeSeconds) {
    }

    public record ApiInfo(String endpoint, int port, @JsonProperty("isRunning") boolean isRunning, long requestsServed,
                          double averageProcessingTimeMs) {
    }

    /**
     * @param currentModel display name of the selected model, null when none is selected
     */
    public record TranscriptionInfo(String currentModel, boolean modelLoaded, List<String> availableModels,
                                    boolean enhancementEnabled, boolean wordReplacementEnabled) {
    }
}
