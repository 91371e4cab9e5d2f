package com.phillippitts.voicelink.service.stt.whisper;

import com.phillippitts.voicelink.config.stt.WhisperConfig;
import com.phillippitts.voicelink.exception.TranscriptionException;
import com.phillippitts.voicelink.service.model.ModelProvider;
import com.phillippitts.voicelink.service.model.TranscriptionModel;
import com.phillippitts.voicelink.service.stt.AbstractSttEngine;
import com.phillippitts.voicelink.service.stt.EngineTranscript;
import com.phillippitts.voicelink.service.stt.TranscriptionOptions;
import com.phillippitts.voicelink.service.stt.util.ConcurrencyGuard;
import com.phillippitts.voicelink.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Local transcription through the whisper.cpp binary.
 *
 * <p>Each call runs its own subprocess against the normalized WAV file; at most
 * {@code stt.whisper.max-concurrent} processes run at once. Output is always JSON so segment
 * timestamps and tinydiarize speaker-turn flags are available for diarization.
 *
 * <p><b>Privacy:</b> never logs transcript text at INFO level, only timings and character counts.
 *
 * @see WhisperProcessManager
 * @see WhisperJsonParser
 */
@Component
public final class WhisperSttEngine extends AbstractSttEngine {

    private static final Logger LOG = LogManager.getLogger(WhisperSttEngine.class);
    private static final String ENGINE = "whisper";

    private final WhisperConfig cfg;
    private final WhisperProcessManager manager;
    private final ConcurrencyGuard concurrencyGuard;

    public WhisperSttEngine(WhisperConfig cfg, WhisperProcessManager manager) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.manager = Objects.requireNonNull(manager, "manager");
        this.concurrencyGuard = new ConcurrencyGuard(cfg.maxConcurrent(),
                cfg.acquireTimeoutSeconds() * 1000L, ENGINE);
    }

    @Override
    protected void doInitialize() {
        Path binary = Path.of(cfg.binaryPath());
        if (!Files.isRegularFile(binary) || !Files.isExecutable(binary)) {
            throw new TranscriptionException("whisper.cpp binary missing or not executable: " + binary, ENGINE);
        }
        LOG.info("Whisper engine initialized: bin={}, modelsDir={}, timeout={}s, threads={}",
                cfg.binaryPath(), cfg.modelsDirectory(), cfg.timeoutSeconds(), cfg.threads());
    }

    @Override
    public EngineTranscript transcribe(Path wavFile, TranscriptionModel model, TranscriptionOptions options) {
        Objects.requireNonNull(wavFile, "wavFile");
        Objects.requireNonNull(model, "model");
        ensureInitialized();

        concurrencyGuard.acquire();
        long startTime = System.nanoTime();
        try {
            String json = manager.transcribe(wavFile, model.path(), options, cfg);
            EngineTranscript transcript = WhisperJsonParser.parse(json);
            LOG.info("Whisper transcribed in {} ms (model={}, chars={}, segments={})",
                    TimeUtils.elapsedMillis(startTime), model.name(), transcript.text().length(),
                    transcript.segments().size());
            return transcript;
        } catch (RuntimeException e) {
            throw handleTranscriptionError(e);
        } finally {
            concurrencyGuard.release();
        }
    }

    @Override
    public String getEngineName() {
        return ENGINE;
    }

    @Override
    public ModelProvider provider() {
        return ModelProvider.LOCAL;
    }

    @Override
    protected void doClose() {
        // Processes are per call and already reaped by the runner
        LOG.debug("Whisper engine closed");
    }
}
