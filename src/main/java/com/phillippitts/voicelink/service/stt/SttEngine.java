package com.phillippitts.voicelink.service.stt;

import com.phillippitts.voicelink.exception.TranscriptionException;
import com.phillippitts.voicelink.service.model.ModelProvider;
import com.phillippitts.voicelink.service.model.TranscriptionModel;

import java.nio.file.Path;

/**
 * A transcription provider.
 *
 * <p>Implementations are shared by all connections and must be safe for concurrent
 * {@link #transcribe} calls. A call blocks for the duration of inference and must react to thread
 * interruption by aborting (the API cancels work that exceeds its processing ceiling).
 */
public interface SttEngine {

    /**
     * Prepares the engine. Idempotent.
     *
     * @throws TranscriptionException if the engine cannot be used
     */
    void initialize();

    /**
     * Transcribes a normalized 16 kHz mono PCM16 WAV file.
     *
     * @param wavFile normalized audio
     * @param model model to use; its provider matches {@link #provider()}
     * @param options per-request options
     * @return text and timestamped segments
     * @throws TranscriptionException if transcription fails
     */
    EngineTranscript transcribe(Path wavFile, TranscriptionModel model, TranscriptionOptions options);

    /**
     * Short engine name for logs and metrics tags ("whisper", "cloud").
     */
    String getEngineName();

    ModelProvider provider();

    boolean isHealthy();

    void close();
}
