package com.phillippitts.voicelink.service.model;

import com.phillippitts.voicelink.config.stt.CloudSttConfig;
import com.phillippitts.voicelink.config.stt.WhisperConfig;
import com.phillippitts.voicelink.exception.ModelNotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalModelStoreTest {

    @TempDir
    Path modelsDir;

    private LocalModelStore store(boolean cloudEnabled) {
        return new LocalModelStore(
                new WhisperConfig("/opt/whisper/main", modelsDir.toString(), 10, 2, 1024, 1, 1),
                new CloudSttConfig(cloudEnabled, "https://api.openai.com", "k", List.of("whisper-1"), 1, 1, 1));
    }

    private Path ggml(String name) throws Exception {
        Path file = modelsDir.resolve(name);
        Files.write(file, new byte[]{'l', 'm', 'g', 'g', 1, 2, 3, 4});
        return file;
    }

    @Test
    void listsLocalModelsSortedThenCloudModels() throws Exception {
        ggml("ggml-small.bin");
        ggml("ggml-base.en.bin");
        Files.writeString(modelsDir.resolve("notes.txt"), "ignored");

        List<TranscriptionModel> models = store(true).availableModels();

        assertThat(models).extracting(TranscriptionModel::name)
                .containsExactly("ggml-base.en", "ggml-small", "whisper-1");
        assertThat(models.get(0).displayName()).isEqualTo("base.en");
        assertThat(models.get(2).provider()).isEqualTo(ModelProvider.CLOUD);
        assertThat(models.get(2).requiresLoad()).isFalse();
    }

    @Test
    void cloudModelsHiddenWhenDisabled() {
        assertThat(store(false).availableModels()).isEmpty();
        assertThat(store(false).findModel("whisper-1")).isEmpty();
    }

    @Test
    void findModelByName() throws Exception {
        ggml("ggml-tiny.bin");

        assertThat(store(false).findModel("ggml-tiny")).isPresent();
        assertThat(store(false).findModel("ggml-huge")).isEmpty();
        assertThat(store(false).findModel(" ")).isEmpty();
    }

    @Test
    void loadVerifiesGgmlMagic() throws Exception {
        Path good = ggml("ggml-tiny.bin");
        Path bad = modelsDir.resolve("ggml-broken.bin");
        Files.write(bad, new byte[]{'<', 'h', 't', 'm', 'l'});
        LocalModelStore store = store(false);

        store.loadModel(new TranscriptionModel("ggml-tiny", "tiny", ModelProvider.LOCAL, good));
        assertThatThrownBy(() -> store.loadModel(new TranscriptionModel("ggml-broken", "broken", ModelProvider.LOCAL, bad)))
                .isInstanceOf(ModelNotFoundException.class)
                .hasMessageContaining("not a GGML model file");
    }

    @Test
    void loadingMissingFileFails() {
        Path missing = modelsDir.resolve("ggml-gone.bin");

        assertThatThrownBy(() -> store(false).loadModel(
                new TranscriptionModel("ggml-gone", "gone", ModelProvider.LOCAL, missing)))
                .isInstanceOf(ModelNotFoundException.class);
    }

    @Test
    void missingDirectoryYieldsNoLocalModels() {
        LocalModelStore store = new LocalModelStore(
                new WhisperConfig("/opt/whisper/main", modelsDir.resolve("absent").toString(), 10, 2, 1024, 1, 1),
                new CloudSttConfig(false, "x", "", List.of(), 1, 1, 1));

        assertThat(store.availableModels()).isEmpty();
    }

    @Test
    void localModelRequiresPath() {
        assertThatThrownBy(() -> new TranscriptionModel("m", null, ModelProvider.LOCAL, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new TranscriptionModel("m", null, ModelProvider.CLOUD, null).displayName()).isEqualTo("m");
    }
}
