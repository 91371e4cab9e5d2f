package com.phillippitts.voicelink.server.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.voicelink.server.ListenerStatus;
import com.phillippitts.voicelink.server.RequestContext;
import com.phillippitts.voicelink.server.RequestHandler;
import com.phillippitts.voicelink.server.http.ApiErrorCode;
import com.phillippitts.voicelink.server.http.HttpRequest;
import com.phillippitts.voicelink.server.http.HttpResponse;
import com.phillippitts.voicelink.service.health.HealthService;
import com.phillippitts.voicelink.service.health.HealthSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@code GET /health}.
 */
@Component
public class HealthHandler implements RequestHandler {

    private static final Logger LOG = LogManager.getLogger(HealthHandler.class);
    private static final long SNAPSHOT_TIMEOUT_SECONDS = 5;

    private final HealthService healthService;
    private final ListenerStatus listenerStatus;
    private final ObjectMapper objectMapper;

    public HealthHandler(HealthService healthService, ListenerStatus listenerStatus, ObjectMapper objectMapper) {
        this.healthService = healthService;
        this.listenerStatus = listenerStatus;
        this.objectMapper = objectMapper;
    }

    @Override
    public HttpResponse handle(HttpRequest request, RequestContext context) {
        try {
            HealthSnapshot snapshot = healthService.snapshot(listenerStatus.current())
                    .get(SNAPSHOT_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            return HttpResponse.json(HttpStatus.OK, objectMapper.writeValueAsBytes(snapshot));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HttpResponse.error(ApiErrorCode.INTERNAL_ERROR, "Interrupted");
        } catch (ExecutionException | TimeoutException | JsonProcessingException e) {
            LOG.warn("Health snapshot failed: {}", e.toString());
            return HttpResponse.error(ApiErrorCode.INTERNAL_ERROR, "Health snapshot unavailable");
        }
    }
}
