package com.phillippitts.voicelink.server.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.voicelink.exception.InvalidParameterException;
import com.phillippitts.voicelink.server.RequestContext;
import com.phillippitts.voicelink.server.RequestHandler;
import com.phillippitts.voicelink.server.http.ApiErrorCode;
import com.phillippitts.voicelink.server.http.HttpRequest;
import com.phillippitts.voicelink.server.http.HttpResponse;
import com.phillippitts.voicelink.server.multipart.MultipartException;
import com.phillippitts.voicelink.server.multipart.MultipartExtractor;
import com.phillippitts.voicelink.server.multipart.MultipartForm;
import com.phillippitts.voicelink.service.diarization.DiarizationParameters;
import com.phillippitts.voicelink.service.transcription.TranscriptionCoordinator;
import com.phillippitts.voicelink.service.transcription.TranscriptionJob;
import com.phillippitts.voicelink.service.transcription.TranscriptionOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@code POST /api/transcribe}: parses the multipart form, runs the coordinator and waits at most
 * the processing timeout. On expiry the job is cancelled and 504 is returned.
 */
@Component
public class TranscribeHandler implements RequestHandler {

    private static final Logger LOG = LogManager.getLogger(TranscribeHandler.class);
    static final String TIMEOUT_MESSAGE = "Transcription timeout - file too large or complex";

    private final TranscriptionCoordinator coordinator;
    private final MultipartExtractor extractor;
    private final ObjectMapper objectMapper;

    public TranscribeHandler(TranscriptionCoordinator coordinator, ObjectMapper objectMapper) {
        this.coordinator = coordinator;
        this.extractor = new MultipartExtractor();
        this.objectMapper = objectMapper;
    }

    @Override
    public HttpResponse handle(HttpRequest request, RequestContext context) {
        MultipartForm form;
        DiarizationParameters params;
        try {
            String boundary = MultipartExtractor.boundaryFrom(request.contentType());
            form = extractor.extract(request.body(), boundary);
            params = DiarizationParameters.fromFields(form.fields());
        } catch (MultipartException e) {
            LOG.debug("Rejected multipart body: {}", e.getMessage());
            return HttpResponse.error(e.getReason().errorCode(), e.getMessage());
        } catch (InvalidParameterException e) {
            return HttpResponse.error(ApiErrorCode.INVALID_PARAMETER, e.getMessage());
        }

        LOG.info("Transcribe request: file={} ({} bytes), diarization={}",
                form.file().filename(), form.file().data().length, params.enabled());

        TranscriptionJob job = coordinator.submit(form.file().data(), params);
        TranscriptionOutcome outcome;
        try {
            outcome = job.result().get(context.processingTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            job.cancel();
            LOG.warn("Transcription exceeded {}s, cancelled", context.processingTimeout().toSeconds());
            return HttpResponse.error(ApiErrorCode.PROCESSING_TIMEOUT, TIMEOUT_MESSAGE);
        } catch (InterruptedException e) {
            job.cancel();
            Thread.currentThread().interrupt();
            return HttpResponse.error(ApiErrorCode.INTERNAL_ERROR, "Request interrupted");
        } catch (ExecutionException | CancellationException e) {
            LOG.error("Transcription job ended abnormally", e);
            return HttpResponse.error(ApiErrorCode.INTERNAL_ERROR, "Internal server error");
        }

        if (!outcome.isSuccess()) {
            return HttpResponse.error(outcome.errorCode(), outcome.errorMessage());
        }
        try {
            return HttpResponse.json(HttpStatus.OK, objectMapper.writeValueAsBytes(outcome.response()));
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize transcription response", e);
            return HttpResponse.error(ApiErrorCode.INTERNAL_ERROR, "Failed to serialize response");
        }
    }
}
