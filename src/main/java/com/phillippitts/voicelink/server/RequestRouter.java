package com.phillippitts.voicelink.server;

import com.phillippitts.voicelink.server.handler.HealthHandler;
import com.phillippitts.voicelink.server.handler.TranscribeHandler;
import com.phillippitts.voicelink.server.http.ApiErrorCode;
import com.phillippitts.voicelink.server.http.HttpRequest;
import com.phillippitts.voicelink.server.http.HttpResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Maps method and path to a handler. Query strings are ignored.
 *
 * <pre>
 * GET     /health          health snapshot
 * POST    /api/transcribe  multipart transcription
 * OPTIONS *                CORS preflight
 * *                        404
 * </pre>
 */
@Component
public class RequestRouter {

    private static final Logger LOG = LogManager.getLogger(RequestRouter.class);

    /**
     * Route names double as the {@code route} metric tag.
     */
    public enum Route {
        HEALTH, TRANSCRIBE, PREFLIGHT, NOT_FOUND;

        public String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final HealthHandler healthHandler;
    private final TranscribeHandler transcribeHandler;

    public RequestRouter(HealthHandler healthHandler, TranscribeHandler transcribeHandler) {
        this.healthHandler = healthHandler;
        this.transcribeHandler = transcribeHandler;
    }

    public Route route(HttpRequest request) {
        String method = request.method().toUpperCase(Locale.ROOT);
        if (method.equals("OPTIONS")) {
            return Route.PREFLIGHT;
        }
        String path = request.path();
        if (method.equals("GET") && path.equals("/health")) {
            return Route.HEALTH;
        }
        if (method.equals("POST") && path.equals("/api/transcribe")) {
            return Route.TRANSCRIBE;
        }
        return Route.NOT_FOUND;
    }

    /**
     * Routes and runs the handler. Never throws.
     */
    public HttpResponse dispatch(HttpRequest request, RequestContext context) {
        Route route = route(request);
        try {
            return switch (route) {
                case HEALTH -> healthHandler.handle(request, context);
                case TRANSCRIBE -> transcribeHandler.handle(request, context);
                case PREFLIGHT -> HttpResponse.preflight();
                case NOT_FOUND -> HttpResponse.error(ApiErrorCode.NOT_FOUND,
                        "No route for " + request.method() + " " + request.path());
            };
        } catch (RuntimeException e) {
            LOG.error("Handler for {} failed", route, e);
            return HttpResponse.error(ApiErrorCode.INTERNAL_ERROR, "Internal server error");
        }
    }
}
