package com.phillippitts.voicelink.server;

import com.phillippitts.voicelink.server.http.HttpRequest;
import com.phillippitts.voicelink.server.http.HttpResponse;

/**
 * Handles one routed request. Runs on a connection thread and may block.
 */
@FunctionalInterface
public interface RequestHandler {

    /**
     * @return the response to write; never null. Unexpected exceptions are mapped to 500 by the router.
     */
    HttpResponse handle(HttpRequest request, RequestContext context);
}
