package com.phillippitts.voicelink.service.transcription;

import com.phillippitts.voicelink.config.properties.DiarizationProperties;
import com.phillippitts.voicelink.config.properties.TranscriptionProperties;
import com.phillippitts.voicelink.exception.DiarizationException;
import com.phillippitts.voicelink.exception.DiarizationMethodNotImplementedException;
import com.phillippitts.voicelink.exception.InvalidAudioException;
import com.phillippitts.voicelink.exception.NoModelSelectedException;
import com.phillippitts.voicelink.exception.TranscriptionException;
import com.phillippitts.voicelink.server.http.ApiErrorCode;
import com.phillippitts.voicelink.service.audio.AudioContainer;
import com.phillippitts.voicelink.service.audio.AudioDecoder;
import com.phillippitts.voicelink.service.audio.AudioFormat;
import com.phillippitts.voicelink.service.audio.AudioFormatSniffer;
import com.phillippitts.voicelink.service.audio.DecodedAudio;
import com.phillippitts.voicelink.service.audio.WavWriter;
import com.phillippitts.voicelink.service.diarization.AlignedTranscription;
import com.phillippitts.voicelink.service.diarization.DiarizationAligner;
import com.phillippitts.voicelink.service.diarization.DiarizationMethod;
import com.phillippitts.voicelink.service.diarization.DiarizationParameters;
import com.phillippitts.voicelink.service.diarization.DiarizationResult;
import com.phillippitts.voicelink.service.diarization.SpeakerDiarizationService;
import com.phillippitts.voicelink.service.metrics.TranscriptionMetrics;
import com.phillippitts.voicelink.service.model.TranscriptionModel;
import com.phillippitts.voicelink.service.postprocess.EnhancementService;
import com.phillippitts.voicelink.service.postprocess.ReplacementResult;
import com.phillippitts.voicelink.service.postprocess.WordReplacementService;
import com.phillippitts.voicelink.service.state.AppState;
import com.phillippitts.voicelink.service.state.AppStateOwner;
import com.phillippitts.voicelink.service.stt.EngineTranscript;
import com.phillippitts.voicelink.service.stt.SttEngine;
import com.phillippitts.voicelink.service.stt.SttEngineRegistry;
import com.phillippitts.voicelink.service.stt.TranscriptSegment;
import com.phillippitts.voicelink.service.stt.TranscriptionOptions;
import com.phillippitts.voicelink.util.LogSanitizer;
import com.phillippitts.voicelink.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs one transcription request from uploaded bytes to response body.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>resolve the current model through {@link AppStateOwner} (loading it if needed)</li>
 *   <li>persist the upload to a temp file named after its sniffed container</li>
 *   <li>decode to 16 kHz mono PCM, keeping per-channel audio for diarization</li>
 *   <li>run the engine for the model's provider on a normalized temp WAV</li>
 *   <li>word replacement, then optional enhancement (failures are non-fatal)</li>
 *   <li>optional diarization and alignment</li>
 * </ol>
 *
 * <p>Steps 2 to 6 run on the inference executor. Every failure ends as a
 * {@link TranscriptionOutcome#failure} with an {@link ApiErrorCode}; no exception escapes the
 * returned future. Temp files are deleted on every path, including cancellation.
 */
@Service
public class TranscriptionCoordinator {

    private static final Logger LOG = LogManager.getLogger(TranscriptionCoordinator.class);

    private final AppStateOwner stateOwner;
    private final Executor inferenceExecutor;
    private final AudioFormatSniffer sniffer;
    private final AudioDecoder decoder;
    private final SttEngineRegistry engines;
    private final WordReplacementService wordReplacement;
    private final EnhancementService enhancement;
    private final SpeakerDiarizationService diarization;
    private final DiarizationAligner aligner;
    private final TranscriptionMetrics metrics;
    private final TranscriptionProperties transcriptionProperties;
    private final DiarizationProperties diarizationProperties;

    public TranscriptionCoordinator(AppStateOwner stateOwner,
                                    @Qualifier("inferenceExecutor") Executor inferenceExecutor,
                                    AudioFormatSniffer sniffer,
                                    AudioDecoder decoder,
                                    SttEngineRegistry engines,
                                    WordReplacementService wordReplacement,
                                    EnhancementService enhancement,
                                    SpeakerDiarizationService diarization,
                                    DiarizationAligner aligner,
                                    TranscriptionMetrics metrics,
                                    TranscriptionProperties transcriptionProperties,
                                    DiarizationProperties diarizationProperties) {
        this.stateOwner = Objects.requireNonNull(stateOwner, "stateOwner must not be null");
        this.inferenceExecutor = Objects.requireNonNull(inferenceExecutor, "inferenceExecutor must not be null");
        this.sniffer = Objects.requireNonNull(sniffer, "sniffer must not be null");
        this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
        this.engines = Objects.requireNonNull(engines, "engines must not be null");
        this.wordReplacement = Objects.requireNonNull(wordReplacement, "wordReplacement must not be null");
        this.enhancement = Objects.requireNonNull(enhancement, "enhancement must not be null");
        this.diarization = Objects.requireNonNull(diarization, "diarization must not be null");
        this.aligner = Objects.requireNonNull(aligner, "aligner must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.transcriptionProperties = Objects.requireNonNull(transcriptionProperties,
                "transcriptionProperties must not be null");
        this.diarizationProperties = Objects.requireNonNull(diarizationProperties,
                "diarizationProperties must not be null");
    }

    /**
     * Starts a transcription.
     *
     * @param audio uploaded file bytes
     * @param params diarization options ({@link DiarizationParameters#DISABLED} for none)
     * @return handle whose result never completes exceptionally except by {@link TranscriptionJob#cancel()}
     */
    public TranscriptionJob submit(byte[] audio, DiarizationParameters params) {
        Objects.requireNonNull(audio, "audio must not be null");
        DiarizationParameters diarizationParams = params == null ? DiarizationParameters.DISABLED : params;
        long startNanos = System.nanoTime();
        Map<String, String> logContext = ThreadContext.getImmutableContext();
        TranscriptionJob job = new TranscriptionJob();

        stateOwner.ensureModelLoaded()
                .thenCompose(model -> stateOwner.snapshot().thenApply(state -> new Prepared(model, state)))
                .whenComplete((prepared, err) -> {
                    if (job.result().isDone()) {
                        return;
                    }
                    if (err != null) {
                        job.result().complete(modelFailure(err));
                        return;
                    }
                    try {
                        inferenceExecutor.execute(() -> runOnWorker(job, logContext, () ->
                                process(audio, diarizationParams, prepared, startNanos)));
                    } catch (RejectedExecutionException e) {
                        LOG.warn("Inference pool saturated, rejecting transcription");
                        job.result().complete(TranscriptionOutcome.failure(ApiErrorCode.SERVER_BUSY,
                                "Server is busy, try again later"));
                    }
                });
        return job;
    }

    private void runOnWorker(TranscriptionJob job, Map<String, String> logContext, Pipeline pipeline) {
        if (!job.attachWorker(Thread.currentThread())) {
            LOG.debug("Transcription cancelled before it started");
            return;
        }
        ThreadContext.putAll(logContext);
        try {
            job.result().complete(pipeline.run());
        } catch (Exception e) {
            if (job.isCancelled()) {
                LOG.info("Transcription cancelled: {}", e.getMessage());
            } else {
                job.result().complete(pipelineFailure(e));
            }
        } finally {
            job.detachWorker();
        }
    }

    private TranscriptionOutcome process(byte[] audio, DiarizationParameters params, Prepared prepared,
                                         long startNanos) throws IOException {
        TranscriptionModel model = prepared.model();
        AppState state = prepared.state();
        AudioContainer container = sniffer.classify(audio);
        Path tempDir = tempDirectory();
        LOG.info("Transcribing {} bytes (container={}, model={}, diarization={})",
                audio.length, container, model.name(), params.enabled());

        try (TempAudioFile upload = TempAudioFile.write(tempDir, container.extension(), audio)) {
            DecodedAudio decoded = decoder.decode(upload.path(), container);
            byte[] wavBytes = WavWriter.encodePcm16Le(decoded.monoPcm(), AudioFormat.TARGET_SAMPLE_RATE,
                    AudioFormat.TARGET_CHANNELS);

            try (TempAudioFile wav = TempAudioFile.write(tempDir, "wav", wavBytes)) {
                DiarizationMethod method = params.enabled()
                        ? diarization.selectMethod(params, decoded.channelCount())
                        : null;
                boolean tinydiarize = method == DiarizationMethod.TINYDIARIZE;

                SttEngine engine = engines.engineFor(model.provider());
                long engineStart = System.nanoTime();
                EngineTranscript raw;
                try {
                    raw = engine.transcribe(wav.path(), model,
                            new TranscriptionOptions(state.language(), tinydiarize));
                } catch (RuntimeException e) {
                    metrics.incrementFailure(engine.getEngineName(), ApiErrorCode.TRANSCRIPTION_FAILED.name());
                    throw e;
                }
                long engineNanos = System.nanoTime() - engineStart;
                metrics.recordLatency(engine.getEngineName(), engineNanos);
                metrics.incrementSuccess(engine.getEngineName());

                return finish(raw, decoded, params, model, state, startNanos, engineNanos / 1_000_000_000.0);
            }
        }
    }

    private TranscriptionOutcome finish(EngineTranscript raw, DecodedAudio decoded, DiarizationParameters params,
                                        TranscriptionModel model, AppState state, long startNanos,
                                        double transcriptionSeconds) {
        String text = raw.text().trim();
        List<TranscriptSegment> segments = raw.segments();

        boolean replacementsApplied = false;
        if (state.wordReplacementEnabled()) {
            ReplacementResult replaced = wordReplacement.apply(text);
            text = replaced.text();
            replacementsApplied = replaced.changed();
            List<TranscriptSegment> rewritten = new ArrayList<>(segments.size());
            for (TranscriptSegment s : segments) {
                ReplacementResult r = wordReplacement.apply(s.text());
                replacementsApplied |= r.changed();
                rewritten.add(new TranscriptSegment(s.start(), s.end(), r.text(), s.confidence(), s.speakerTurnNext()));
            }
            segments = rewritten;
        }

        String enhancedText = null;
        Double enhancementTime = null;
        if (state.enhancementEnabled() && enhancement.isConfigured()) {
            long enhanceStart = System.nanoTime();
            try {
                enhancedText = enhancement.enhance(text);
                enhancementTime = TimeUtils.elapsedSeconds(enhanceStart);
                metrics.recordEnhancement(true);
            } catch (RuntimeException e) {
                metrics.recordEnhancement(false);
                LOG.warn("Enhancement failed: {}", e.getMessage());
            }
        }

        AlignedTranscription aligned = null;
        Double diarizationTime = null;
        String diarizationError = null;
        if (params.enabled()) {
            long diarizeStart = System.nanoTime();
            try {
                DiarizationResult result = diarization.diarize(decoded, segments, params);
                aligned = aligner.align(text, segments, result);
                diarizationTime = TimeUtils.elapsedSeconds(diarizeStart);
                metrics.recordDiarization(result.method().wireName(), true);
            } catch (DiarizationException e) {
                metrics.recordDiarization(diarization.selectMethod(params, decoded.channelCount()).wireName(), false);
                if (diarizationProperties.failOnError()) {
                    throw e;
                }
                LOG.warn("Diarization failed, returning plain transcript: {}", e.getMessage());
                diarizationError = e.getMessage();
            }
        }

        double processingSeconds = TimeUtils.elapsedSeconds(startNanos);
        TranscriptionMetadata metadata = new TranscriptionMetadata(
                model.displayName(),
                state.language(),
                decoded.durationSeconds(),
                processingSeconds,
                transcriptionSeconds,
                diarizationTime,
                enhancementTime,
                enhancedText != null,
                params.enabled() ? aligned != null : null,
                aligned != null ? aligned.method() : null,
                replacementsApplied,
                diarizationError);

        LOG.info("Transcription completed in {} ms (chars={}, speakers={})",
                TimeUtils.elapsedMillis(startNanos), text.length(), aligned == null ? 0 : aligned.speakers().size());
        LOG.debug("Transcript preview: \"{}\"", LogSanitizer.preview(text));

        if (aligned == null) {
            return TranscriptionOutcome.success(TranscriptionResponse.plain(text, enhancedText, metadata));
        }
        return TranscriptionOutcome.success(new TranscriptionResponse(true, text, enhancedText,
                aligned.segments(), aligned.speakers(), aligned.speakers().size(), aligned.textWithSpeakers(),
                metadata));
    }

    private Path tempDirectory() {
        String configured = transcriptionProperties.tempDirectory();
        return configured == null || configured.isBlank()
                ? Path.of(System.getProperty("java.io.tmpdir"))
                : Path.of(configured);
    }

    private static TranscriptionOutcome modelFailure(Throwable err) {
        Throwable cause = unwrap(err);
        if (cause instanceof NoModelSelectedException) {
            return TranscriptionOutcome.failure(ApiErrorCode.NO_MODEL, cause.getMessage());
        }
        if (cause instanceof RejectedExecutionException) {
            return TranscriptionOutcome.failure(ApiErrorCode.SERVER_BUSY, "Server is busy, try again later");
        }
        LOG.warn("Model load failed: {}", cause.getMessage());
        return TranscriptionOutcome.failure(ApiErrorCode.MODEL_LOAD_FAILED,
                "Failed to load transcription model: " + cause.getMessage());
    }

    static TranscriptionOutcome pipelineFailure(Throwable err) {
        Throwable cause = unwrap(err);
        if (cause instanceof InvalidAudioException) {
            LOG.warn("Audio processing failed: {}", cause.getMessage());
            return TranscriptionOutcome.failure(ApiErrorCode.AUDIO_PROCESSING_FAILED, cause.getMessage());
        }
        if (cause instanceof DiarizationMethodNotImplementedException) {
            return TranscriptionOutcome.failure(ApiErrorCode.DIARIZATION_NOT_IMPLEMENTED, cause.getMessage());
        }
        if (cause instanceof DiarizationException) {
            return TranscriptionOutcome.failure(ApiErrorCode.DIARIZATION_FAILED, cause.getMessage());
        }
        if (cause instanceof TranscriptionException) {
            LOG.warn("Transcription failed: {}", cause.getMessage());
            return TranscriptionOutcome.failure(ApiErrorCode.TRANSCRIPTION_FAILED, cause.getMessage());
        }
        LOG.error("Unexpected error during transcription", cause);
        return TranscriptionOutcome.failure(ApiErrorCode.INTERNAL_ERROR, "Internal server error");
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    private record Prepared(TranscriptionModel model, AppState state) {
    }

    @FunctionalInterface
    private interface Pipeline {
        TranscriptionOutcome run() throws Exception;
    }
}
