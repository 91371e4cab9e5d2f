package com.phillippitts.voicelink.server.http;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A fully framed HTTP/1.1 request.
 *
 * @param method request method, upper case as sent
 * @param target request target including any query string
 * @param version protocol version, e.g. {@code HTTP/1.1}
 * @param headers header map with case-insensitive keys
 * @param body raw body bytes, empty for header-only requests
 */
public record HttpRequest(String method, String target, String version, Map<String, String> headers, byte[] body) {

    public HttpRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(version, "version");
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        headers = Collections.unmodifiableMap(copy);
        body = body == null ? new byte[0] : body;
    }

    /**
     * Request path without the query string.
     */
    public String path() {
        int q = target.indexOf('?');
        return q >= 0 ? target.substring(0, q) : target;
    }

    /**
     * Header value, or null when absent. Lookup ignores case.
     */
    public String header(String name) {
        return headers.get(name);
    }

    public String contentType() {
        return header("Content-Type");
    }
}
