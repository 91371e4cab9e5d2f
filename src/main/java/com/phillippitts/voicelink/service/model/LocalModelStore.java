package com.phillippitts.voicelink.service.model;

import com.phillippitts.voicelink.config.stt.CloudSttConfig;
import com.phillippitts.voicelink.config.stt.WhisperConfig;
import com.phillippitts.voicelink.exception.ModelNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * {@link ModelStore} backed by the whisper.cpp models directory plus the configured cloud models.
 *
 * <p>Local models are files named {@code ggml-<name>.bin}; the model name is the file name without
 * the {@code .bin} suffix. Loading verifies the GGML magic so a truncated download fails here
 * rather than inside whisper.cpp.
 */
@Component
public class LocalModelStore implements ModelStore {

    private static final Logger LOG = LogManager.getLogger(LocalModelStore.class);

    private static final String MODEL_GLOB = "ggml-*.bin";
    // "ggml" written as a little-endian uint32 by whisper.cpp, and the big-endian form
    private static final byte[] GGML_MAGIC_LE = {'l', 'm', 'g', 'g'};
    private static final byte[] GGML_MAGIC_BE = {'g', 'g', 'm', 'l'};

    private final Path modelsDirectory;
    private final CloudSttConfig cloudConfig;

    public LocalModelStore(WhisperConfig whisperConfig, CloudSttConfig cloudConfig) {
        this.modelsDirectory = Path.of(whisperConfig.modelsDirectory()).toAbsolutePath().normalize();
        this.cloudConfig = cloudConfig;
    }

    @Override
    public List<TranscriptionModel> availableModels() {
        List<TranscriptionModel> models = new ArrayList<>(scanLocal());
        if (cloudConfig.enabled()) {
            for (String name : cloudConfig.models()) {
                models.add(new TranscriptionModel(name, name + " (cloud)", ModelProvider.CLOUD, null));
            }
        }
        return List.copyOf(models);
    }

    @Override
    public Optional<TranscriptionModel> findModel(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return availableModels().stream().filter(m -> m.name().equals(name)).findFirst();
    }

    @Override
    public void loadModel(TranscriptionModel model) {
        if (!model.requiresLoad()) {
            return;
        }
        Path path = model.path();
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new ModelNotFoundException(path.toString());
        }
        try (InputStream in = Files.newInputStream(path)) {
            byte[] magic = in.readNBytes(4);
            if (!startsWith(magic, GGML_MAGIC_LE) && !startsWith(magic, GGML_MAGIC_BE)) {
                throw new ModelNotFoundException(path + " (not a GGML model file)");
            }
        } catch (IOException e) {
            throw new ModelNotFoundException(path.toString(), e);
        }
        LOG.info("Model '{}' ready at {}", model.name(), path);
    }

    private List<TranscriptionModel> scanLocal() {
        if (!Files.isDirectory(modelsDirectory)) {
            LOG.debug("Models directory {} does not exist", modelsDirectory);
            return List.of();
        }
        List<TranscriptionModel> found = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(modelsDirectory, MODEL_GLOB)) {
            for (Path file : stream) {
                String fileName = file.getFileName().toString();
                String name = fileName.substring(0, fileName.length() - ".bin".length());
                found.add(new TranscriptionModel(name, name.substring("ggml-".length()), ModelProvider.LOCAL, file));
            }
        } catch (IOException e) {
            LOG.warn("Failed to scan models directory {}: {}", modelsDirectory, e.getMessage());
            return List.of();
        }
        found.sort(Comparator.comparing(TranscriptionModel::name));
        return found;
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
