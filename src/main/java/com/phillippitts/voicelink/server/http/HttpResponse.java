package com.phillippitts.voicelink.server.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.http.HttpStatus;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An HTTP/1.1 response as written by the connection handler.
 *
 * <p>Serialization always derives {@code Content-Length} from the actual body, adds the permissive
 * CORS headers and {@code Connection: close}. Every connection carries exactly one response.
 */
public final class HttpResponse {

    public static final String JSON = "application/json";

    private static final ObjectMapper ERROR_MAPPER = JsonMapper.builder().build();

    private final int status;
    private final String contentType;
    private final byte[] body;
    private final Map<String, String> headers;

    private HttpResponse(int status, String contentType, byte[] body, Map<String, String> headers) {
        this.status = status;
        this.contentType = contentType;
        this.body = body == null ? new byte[0] : body;
        this.headers = headers;
    }

    public static HttpResponse json(HttpStatus status, byte[] body) {
        return new HttpResponse(status.value(), JSON, Objects.requireNonNull(body, "body"), Map.of());
    }

    /**
     * Structured failure body: {@code {"success":false,"error":{"code":...,"message":...}}}.
     */
    public static HttpResponse error(ApiErrorCode code, String message) {
        ErrorBody payload = new ErrorBody(false, new ErrorDetail(code.name(), message));
        byte[] bytes;
        try {
            bytes = ERROR_MAPPER.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            // Two strings cannot fail to serialize; keep a valid body regardless.
            bytes = ("{\"success\":false,\"error\":{\"code\":\"" + code.name() + "\"}}")
                    .getBytes(StandardCharsets.UTF_8);
        }
        return new HttpResponse(code.status().value(), JSON, bytes, Map.of());
    }

    /**
     * CORS preflight answer with an empty body.
     */
    public static HttpResponse preflight() {
        Map<String, String> extra = new LinkedHashMap<>();
        extra.put("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
        extra.put("Access-Control-Allow-Headers", "Content-Type");
        extra.put("Access-Control-Max-Age", "86400");
        return new HttpResponse(HttpStatus.OK.value(), "text/plain", new byte[0],
                Collections.unmodifiableMap(extra));
    }

    public int status() {
        return status;
    }

    public String contentType() {
        return contentType;
    }

    public byte[] body() {
        return body;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * Serializes status line, headers and body.
     */
    public byte[] toBytes() {
        StringBuilder head = new StringBuilder(256);
        head.append("HTTP/1.1 ").append(status).append(' ').append(reasonPhrase(status)).append("\r\n");
        head.append("Content-Type: ").append(contentType).append("\r\n");
        head.append("Content-Length: ").append(body.length).append("\r\n");
        head.append("Access-Control-Allow-Origin: *\r\n");
        headers.forEach((k, v) -> head.append(k).append(": ").append(v).append("\r\n"));
        head.append("Connection: close\r\n\r\n");

        byte[] headBytes = head.toString().getBytes(StandardCharsets.ISO_8859_1);
        ByteArrayOutputStream out = new ByteArrayOutputStream(headBytes.length + body.length);
        out.writeBytes(headBytes);
        out.writeBytes(body);
        return out.toByteArray();
    }

    /**
     * Interim response line (1xx) with no headers, e.g. {@code 100 Continue} or {@code 102 Processing}.
     */
    public static byte[] interim(HttpStatus status) {
        return ("HTTP/1.1 " + status.value() + " " + status.getReasonPhrase() + "\r\n\r\n")
                .getBytes(StandardCharsets.ISO_8859_1);
    }

    static String reasonPhrase(int status) {
        HttpStatus resolved = HttpStatus.resolve(status);
        return resolved != null ? resolved.getReasonPhrase() : "Unknown";
    }

    public record ErrorBody(boolean success, ErrorDetail error) {}

    public record ErrorDetail(String code, String message) {}
}
