package com.phillippitts.voicelink.service.health;

import com.phillippitts.voicelink.config.properties.ApiServerProperties;
import com.phillippitts.voicelink.service.metrics.RequestStatistics;
import com.phillippitts.voicelink.service.model.ModelStore;
import com.phillippitts.voicelink.service.model.TranscriptionModel;
import com.phillippitts.voicelink.service.state.AppState;
import com.phillippitts.voicelink.service.state.AppStateOwner;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Assembles {@link HealthSnapshot}s from the state owner, the model store and the request counters.
 */
@Service
public class HealthService {

    static final List<String> CAPABILITIES = List.of(
            "speech-to-text",
            "multi-model-support",
            "ai-enhancement",
            "word-replacement",
            "local-transcription",
            "cloud-transcription",
            "speaker-diarization");

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final AppStateOwner stateOwner;
    private final ModelStore modelStore;
    private final RequestStatistics statistics;
    private final ApiServerProperties serverProperties;

    public HealthService(AppStateOwner stateOwner, ModelStore modelStore, RequestStatistics statistics,
                         ApiServerProperties serverProperties) {
        this.stateOwner = Objects.requireNonNull(stateOwner, "stateOwner");
        this.modelStore = Objects.requireNonNull(modelStore, "modelStore");
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        this.serverProperties = Objects.requireNonNull(serverProperties, "serverProperties");
    }

    public CompletableFuture<HealthSnapshot> snapshot(ApiStatus apiStatus) {
        List<String> available = modelStore.availableModels().stream().map(TranscriptionModel::name).toList();
        return stateOwner.snapshot().thenApply(state -> build(state, available, apiStatus));
    }

    private HealthSnapshot build(AppState state, List<String> availableModels, ApiStatus apiStatus) {
        Runtime runtime = Runtime.getRuntime();
        double usedMb = (runtime.totalMemory() - runtime.freeMemory()) / BYTES_PER_MB;
        RequestStatistics.Totals totals = statistics.snapshot();

        return new HealthSnapshot(
                "healthy",
                serverProperties.getServiceName(),
                serverProperties.getVersion(),
                System.currentTimeMillis() / 1000.0,
                new HealthSnapshot.SystemInfo(
                        System.getProperty("os.name"),
                        System.getProperty("os.version"),
                        runtime.availableProcessors(),
                        Math.round(usedMb * 100) / 100.0,
                        apiStatus.uptimeSeconds()),
                new HealthSnapshot.ApiInfo(
                        apiStatus.endpoint(),
                        apiStatus.port(),
                        apiStatus.running(),
                        totals.requestsServed(),
                        totals.averageProcessingMillis()),
                new HealthSnapshot.TranscriptionInfo(
                        state.hasModel() ? state.currentModel().displayName() : null,
                        state.modelLoaded(),
                        availableModels,
                        state.enhancementEnabled(),
                        state.wordReplacementEnabled()),
                CAPABILITIES);
    }
}
