package com.phillippitts.voicelink.service.stt.cloud;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.voicelink.config.stt.CloudSttConfig;
import com.phillippitts.voicelink.exception.TranscriptionException;
import com.phillippitts.voicelink.service.model.ModelProvider;
import com.phillippitts.voicelink.service.model.TranscriptionModel;
import com.phillippitts.voicelink.service.stt.AbstractSttEngine;
import com.phillippitts.voicelink.service.stt.EngineTranscript;
import com.phillippitts.voicelink.service.stt.TranscriptSegment;
import com.phillippitts.voicelink.service.stt.TranscriptionOptions;
import com.phillippitts.voicelink.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Cloud transcription through an OpenAI-compatible {@code /v1/audio/transcriptions} endpoint.
 *
 * <p>The normalized WAV is posted as multipart/form-data with {@code response_format=verbose_json}
 * so segment timestamps are available for diarization. Transient I/O failures and 5xx/429 answers
 * are retried with exponential backoff and jitter; 4xx answers fail immediately.
 *
 * <p>Interruption aborts the request and is never retried.
 */
@Component
public final class CloudSttEngine extends AbstractSttEngine {

    private static final Logger LOG = LogManager.getLogger(CloudSttEngine.class);
    private static final String ENGINE = "cloud";
    private static final String TRANSCRIPTIONS_PATH = "/v1/audio/transcriptions";

    private final CloudSttConfig cfg;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public CloudSttEngine(CloudSttConfig cfg, ObjectMapper objectMapper) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(cfg.connectTimeoutSeconds()))
                .build();
    }

    @Override
    protected void doInitialize() {
        if (!cfg.enabled()) {
            throw new TranscriptionException("Cloud transcription is disabled (stt.cloud.enabled=false)", ENGINE);
        }
        if (cfg.apiKey() == null || cfg.apiKey().isBlank()) {
            throw new TranscriptionException("Cloud transcription requires stt.cloud.api-key", ENGINE);
        }
        LOG.info("Cloud engine initialized: baseUrl={}, models={}", cfg.baseUrl(), cfg.models());
    }

    @Override
    public EngineTranscript transcribe(Path wavFile, TranscriptionModel model, TranscriptionOptions options) {
        Objects.requireNonNull(wavFile, "wavFile");
        Objects.requireNonNull(model, "model");
        ensureInitialized();

        long startTime = System.nanoTime();
        int attempt = 0;
        Exception lastException = null;
        while (attempt < cfg.maxRetries()) {
            try {
                EngineTranscript transcript = attemptTranscribe(wavFile, model, options);
                LOG.info("Cloud transcribed in {} ms (model={}, chars={}, attempts={})",
                        TimeUtils.elapsedMillis(startTime), model.name(), transcript.text().length(), attempt + 1);
                return transcript;
            } catch (RetryableException | IOException e) {
                lastException = e;
                attempt++;
                if (attempt < cfg.maxRetries()) {
                    long backoffMs = (long) (Math.pow(2, attempt) * 1000 + ThreadLocalRandom.current().nextInt(1000));
                    LOG.warn("Cloud attempt {} failed, retrying in {}ms: {}", attempt, backoffMs, e.getMessage());
                    sleep(backoffMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TranscriptionException("Cloud transcription interrupted", ENGINE, e);
            } catch (RuntimeException e) {
                throw handleTranscriptionError(e);
            }
        }
        throw new TranscriptionException(
                String.format("Cloud transcription failed after %d attempts: %s", cfg.maxRetries(),
                        lastException == null ? "unknown" : lastException.getMessage()),
                ENGINE, lastException);
    }

    private EngineTranscript attemptTranscribe(Path wavFile, TranscriptionModel model, TranscriptionOptions options)
            throws IOException, InterruptedException, RetryableException {
        String boundary = "----voicelink" + UUID.randomUUID();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(trimTrailingSlash(cfg.baseUrl()) + TRANSCRIPTIONS_PATH))
                .timeout(Duration.ofSeconds(cfg.readTimeoutSeconds()))
                .header("Authorization", "Bearer " + cfg.apiKey())
                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .POST(HttpRequest.BodyPublishers.ofByteArray(buildMultipartBody(wavFile, model, options, boundary)))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new RetryableException("Cloud API returned status " + status);
        }
        if (status != 200) {
            throw new TranscriptionException("Cloud API returned status " + status + ": "
                    + abbreviate(response.body()), ENGINE);
        }
        return toTranscript(objectMapper.readValue(response.body(), CloudTranscriptionResponse.class));
    }

    static EngineTranscript toTranscript(CloudTranscriptionResponse body) {
        List<TranscriptSegment> segments = new ArrayList<>();
        for (CloudTranscriptionResponse.Segment s : body.segments()) {
            String text = s.text() == null ? "" : s.text().trim();
            if (text.isEmpty()) {
                continue;
            }
            Double confidence = s.avgLogprob() == null ? null : Math.min(1.0, Math.exp(s.avgLogprob()));
            segments.add(new TranscriptSegment(s.start(), s.end(), text, confidence, false));
        }
        return new EngineTranscript(body.text().trim(), segments);
    }

    private static byte[] buildMultipartBody(Path wavFile, TranscriptionModel model, TranscriptionOptions options,
                                             String boundary) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeText(out, "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"file\"; filename=\"" + wavFile.getFileName() + "\"\r\n"
                + "Content-Type: audio/wav\r\n\r\n");
        out.write(Files.readAllBytes(wavFile));
        writeText(out, "\r\n");
        writeField(out, boundary, "model", model.name());
        writeField(out, boundary, "response_format", "verbose_json");
        if (!"auto".equalsIgnoreCase(options.language())) {
            writeField(out, boundary, "language", options.language());
        }
        writeText(out, "--" + boundary + "--\r\n");
        return out.toByteArray();
    }

    private static void writeField(ByteArrayOutputStream out, String boundary, String name, String value) {
        writeText(out, "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"" + name + "\"\r\n\r\n"
                + value + "\r\n");
    }

    private static void writeText(ByteArrayOutputStream out, String text) {
        out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TranscriptionException("Cloud transcription interrupted", ENGINE, ie);
        }
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }

    @Override
    public String getEngineName() {
        return ENGINE;
    }

    @Override
    public ModelProvider provider() {
        return ModelProvider.CLOUD;
    }

    @Override
    protected void doClose() {
        LOG.debug("Cloud engine closed");
    }

    /** Server-side failure worth another attempt. */
    private static final class RetryableException extends Exception {
        RetryableException(String message) {
            super(message);
        }
    }
}
