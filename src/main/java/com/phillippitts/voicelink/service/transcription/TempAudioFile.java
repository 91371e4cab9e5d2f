package com.phillippitts.voicelink.service.transcription;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Uniquely named temporary file deleted on {@link #close()}.
 */
final class TempAudioFile implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(TempAudioFile.class);

    private final Path path;

    private TempAudioFile(Path path) {
        this.path = path;
    }

    /**
     * Writes {@code data} to {@code voicelink-<uuid>.<extension>} in {@code directory}.
     */
    static TempAudioFile write(Path directory, String extension, byte[] data) throws IOException {
        Files.createDirectories(directory);
        Path path = directory.resolve("voicelink-" + UUID.randomUUID() + "." + extension);
        Files.write(path, data);
        return new TempAudioFile(path);
    }

    Path path() {
        return path;
    }

    @Override
    public void close() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Failed to delete temp file {}: {}", path, e.getMessage());
        }
    }
}
