package com.phillippitts.voicelink.service.health;

import com.phillippitts.voicelink.config.properties.EnhancementProperties;
import com.phillippitts.voicelink.config.properties.TranscriptionProperties;
import com.phillippitts.voicelink.config.properties.WordReplacementProperties;
import com.phillippitts.voicelink.config.stt.WhisperConfig;
import com.phillippitts.voicelink.service.model.ModelProvider;
import com.phillippitts.voicelink.service.model.TranscriptionModel;
import com.phillippitts.voicelink.service.state.AppStateOwner;
import com.phillippitts.voicelink.testutil.FakeModelStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ModelHealthIndicatorTest {

    @TempDir
    Path tempDir;

    private final ExecutorService inference = Executors.newSingleThreadExecutor();
    private AppStateOwner stateOwner;

    @AfterEach
    void tearDown() {
        if (stateOwner != null) {
            stateOwner.shutdown();
        }
        inference.shutdownNow();
    }

    private ModelHealthIndicator indicator(String binaryPath, TranscriptionModel... models) {
        stateOwner = new AppStateOwner(new FakeModelStore(models), inference,
                new TranscriptionProperties("auto", "", ""),
                new WordReplacementProperties(false, Map.of()),
                new EnhancementProperties(false, "", "", "", "p", 5));
        WhisperConfig config = new WhisperConfig(binaryPath, tempDir.toString(), 60, 2, 1 << 20, 1, 5);
        return new ModelHealthIndicator(stateOwner, config);
    }

    @Test
    void outOfServiceWithoutModel() {
        Health health = indicator(tempDir.resolve("missing").toString()).health();

        assertThat(health.getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
        assertThat(health.getDetails().get("whisperBinary").toString()).startsWith("NOT FOUND");
    }

    @Test
    void localModelNeedsExecutableBinary() throws Exception {
        TranscriptionModel local = new TranscriptionModel("ggml-tiny", null, ModelProvider.LOCAL,
                tempDir.resolve("ggml-tiny.bin"));
        ModelHealthIndicator indicator = indicator(tempDir.resolve("missing").toString(), local);
        stateOwner.selectModel("ggml-tiny").get(5, TimeUnit.SECONDS);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("currentModel", "ggml-tiny");
    }

    @Test
    void upWhenBinaryIsExecutable() throws Exception {
        Path binary = Files.createFile(tempDir.resolve("whisper-cli"));
        assertThat(binary.toFile().setExecutable(true)).isTrue();
        TranscriptionModel local = new TranscriptionModel("ggml-tiny", null, ModelProvider.LOCAL,
                tempDir.resolve("ggml-tiny.bin"));
        ModelHealthIndicator indicator = indicator(binary.toString(), local);
        stateOwner.selectModel("ggml-tiny").get(5, TimeUnit.SECONDS);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("modelLoaded", false);
    }

    @Test
    void cloudModelIsUpWithoutBinary() throws Exception {
        TranscriptionModel cloud = new TranscriptionModel("whisper-1", null, ModelProvider.CLOUD, null);
        ModelHealthIndicator indicator = indicator(tempDir.resolve("missing").toString(), cloud);
        stateOwner.selectModel("whisper-1").get(5, TimeUnit.SECONDS);

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
    }
}
