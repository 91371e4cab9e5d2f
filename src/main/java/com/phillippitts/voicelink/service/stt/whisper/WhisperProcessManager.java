package com.phillippitts.voicelink.service.stt.whisper;

import com.phillippitts.voicelink.config.stt.WhisperConfig;
import com.phillippitts.voicelink.exception.TranscriptionException;
import com.phillippitts.voicelink.service.process.ExternalProcessRunner;
import com.phillippitts.voicelink.service.process.ProcessSpec;
import com.phillippitts.voicelink.service.stt.TranscriptionOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds and runs the whisper.cpp command line for one transcription.
 *
 * <p>CLI contract:
 * <pre>
 * ${binary} -m ${model} -f ${wav} -l ${language} -t ${threads} -np -oj -of ${wav-without-ext} [-tdrz]
 * </pre>
 * whisper.cpp writes {@code ${wav-without-ext}.json}; the manager reads it, deletes it and returns the
 * JSON text. Process supervision (gobblers, timeout, kill on interrupt) is delegated to
 * {@link ExternalProcessRunner}.
 */
@Component
public class WhisperProcessManager {

    private static final Logger LOG = LogManager.getLogger(WhisperProcessManager.class);

    static final String TOOL = "whisper";

    private final ExternalProcessRunner runner;

    public WhisperProcessManager(ExternalProcessRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    /**
     * Runs whisper.cpp and returns its JSON output.
     *
     * @param wavPath normalized WAV created by the caller
     * @param modelPath GGML model file
     * @param options language and tinydiarize flag
     * @param cfg whisper configuration
     * @return JSON document produced by whisper.cpp (may be blank for silence)
     * @throws TranscriptionException on timeout, non-zero exit, interruption or I/O error
     */
    public String transcribe(Path wavPath, Path modelPath, TranscriptionOptions options, WhisperConfig cfg) {
        Objects.requireNonNull(wavPath, "wavPath");
        Objects.requireNonNull(modelPath, "modelPath");
        Objects.requireNonNull(cfg, "cfg");

        Path outputBase = outputBase(wavPath);
        Path jsonFile = outputBase.resolveSibling(outputBase.getFileName() + ".json");

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("binaryPath", cfg.binaryPath());
        context.put("modelPath", modelPath);

        try {
            runner.run(new ProcessSpec(TOOL, buildCommand(cfg, modelPath, wavPath, outputBase, options),
                    wavPath.getParent(), Duration.ofSeconds(cfg.timeoutSeconds()), cfg.maxStdoutBytes(), context));
            if (!Files.exists(jsonFile)) {
                throw new TranscriptionException("whisper.cpp produced no JSON output at " + jsonFile, TOOL);
            }
            String json = Files.readString(jsonFile, StandardCharsets.UTF_8);
            LOG.debug("Whisper JSON size={} chars", json.length());
            return json;
        } catch (IOException e) {
            throw new TranscriptionException("Failed to read whisper output: " + e.getMessage(), TOOL, e);
        } finally {
            try {
                Files.deleteIfExists(jsonFile);
            } catch (IOException e) {
                LOG.warn("Failed to delete whisper output {}: {}", jsonFile, e.getMessage());
            }
        }
    }

    List<String> buildCommand(WhisperConfig cfg, Path modelPath, Path wavPath, Path outputBase,
                              TranscriptionOptions options) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolvePath(cfg.binaryPath()).toString());
        cmd.add("-m");
        cmd.add(modelPath.toAbsolutePath().toString());
        cmd.add("-f");
        cmd.add(wavPath.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(options.language());
        cmd.add("-t");
        cmd.add(String.valueOf(cfg.threads()));
        cmd.add("-np");
        cmd.add("-oj");
        cmd.add("-of");
        cmd.add(outputBase.toAbsolutePath().toString());
        if (options.tinydiarize()) {
            cmd.add("-tdrz");
        }
        return cmd;
    }

    private static Path outputBase(Path wavPath) {
        String name = wavPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return wavPath.resolveSibling(dot > 0 ? name.substring(0, dot) : name);
    }

    /**
     * Resolves relative paths against the working directory so the command does not depend on
     * the process working directory.
     */
    private static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }
}
