package com.phillippitts.voicelink.service.health;

import com.phillippitts.voicelink.config.stt.WhisperConfig;
import com.phillippitts.voicelink.service.state.AppState;
import com.phillippitts.voicelink.service.state.AppStateOwner;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Actuator view of transcription readiness: a model is selected and, for local models,
 * the whisper.cpp binary is executable.
 */
@Component
public class ModelHealthIndicator implements HealthIndicator {

    private static final long STATE_TIMEOUT_MS = 2000;

    private final AppStateOwner stateOwner;
    private final WhisperConfig whisperConfig;

    public ModelHealthIndicator(AppStateOwner stateOwner, WhisperConfig whisperConfig) {
        this.stateOwner = stateOwner;
        this.whisperConfig = whisperConfig;
    }

    @Override
    public Health health() {
        AppState state;
        try {
            state = stateOwner.snapshot().get(STATE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Health.unknown().withDetail("status", "interrupted").build();
        } catch (ExecutionException | TimeoutException e) {
            return Health.down(e).withDetail("status", "state owner unresponsive").build();
        }

        Path binary = Path.of(whisperConfig.binaryPath());
        boolean binaryExecutable = Files.isRegularFile(binary) && Files.isExecutable(binary);

        if (!state.hasModel()) {
            return Health.outOfService()
                    .withDetail("status", "No transcription model selected")
                    .withDetail("whisperBinary", formatBinaryStatus(binaryExecutable, binary))
                    .build();
        }
        boolean local = state.currentModel().requiresLoad();
        Health.Builder builder = (!local || binaryExecutable) ? Health.up() : Health.down();
        return builder
                .withDetail("currentModel", state.currentModel().name())
                .withDetail("provider", state.currentModel().provider().name())
                .withDetail("modelLoaded", state.modelLoaded())
                .withDetail("whisperBinary", formatBinaryStatus(binaryExecutable, binary))
                .build();
    }

    private String formatBinaryStatus(boolean executable, Path path) {
        return executable ? "accessible and executable at " + path : "NOT FOUND or not executable at " + path;
    }
}
