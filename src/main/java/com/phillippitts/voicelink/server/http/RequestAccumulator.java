package com.phillippitts.voicelink.server.http;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Incremental HTTP/1.1 request framer.
 *
 * <p>Bytes are fed in arbitrary fragments through {@link #append(byte[], int, int)}. The framer
 * moves through an explicit phase machine:
 * <pre>
 * READING_HEADERS --CRLFCRLF--&gt; READING_BODY --Content-Length bytes--&gt; COMPLETE
 *        |                            |
 *        +--------- REJECTED ---------+
 * </pre>
 * Header-only requests go straight from READING_HEADERS to COMPLETE. A declared body above the cap
 * is rejected as soon as the headers are parsed, before any body byte is buffered.
 *
 * <p>Not thread-safe; one instance belongs to one connection task.
 */
public final class RequestAccumulator {

    private static final byte[] HEADER_TERMINATOR = {'\r', '\n', '\r', '\n'};

    /**
     * Framing phase.
     */
    public enum Phase {
        READING_HEADERS,
        READING_BODY,
        COMPLETE,
        REJECTED
    }

    /**
     * Parsed request line and headers, available once the header terminator has been seen.
     */
    public record RequestHead(String method, String target, String version,
                              Map<String, String> headers, long contentLength) {

        public String header(String name) {
            return headers.get(name);
        }

        public boolean expectsContinue() {
            String expect = headers.get("Expect");
            return expect != null && expect.trim().equalsIgnoreCase("100-continue");
        }
    }

    /**
     * Why the request was refused before dispatch.
     */
    public record Rejection(ApiErrorCode code, String message) {

        public HttpResponse toResponse() {
            return HttpResponse.error(code, message);
        }
    }

    private final long maxBodyBytes;
    private final int maxHeaderBytes;

    private final ByteArrayOutputStream headerBuffer = new ByteArrayOutputStream(1024);
    private ByteArrayOutputStream bodyBuffer;
    private Phase phase = Phase.READING_HEADERS;
    private RequestHead head;
    private Rejection rejection;
    private int scanFrom;

    public RequestAccumulator(long maxBodyBytes, int maxHeaderBytes) {
        if (maxBodyBytes < 0 || maxHeaderBytes <= 0) {
            throw new IllegalArgumentException("limits must be positive");
        }
        this.maxBodyBytes = maxBodyBytes;
        this.maxHeaderBytes = maxHeaderBytes;
    }

    /**
     * Feeds the next fragment read from the socket.
     *
     * @return the phase after consuming the fragment
     */
    public Phase append(byte[] data, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, data.length);
        switch (phase) {
            case READING_HEADERS -> consumeHeaderBytes(data, offset, length);
            case READING_BODY -> consumeBodyBytes(data, offset, length);
            default -> {
                // COMPLETE or REJECTED: trailing bytes are ignored, the connection closes after one response
            }
        }
        return phase;
    }

    public Phase phase() {
        return phase;
    }

    /**
     * Parsed head, or null while headers are still being read.
     */
    public RequestHead head() {
        return head;
    }

    public Rejection rejection() {
        return rejection;
    }

    /**
     * Number of body bytes buffered so far.
     */
    public long bodyBytesReceived() {
        return bodyBuffer == null ? 0 : bodyBuffer.size();
    }

    /**
     * Builds the framed request.
     *
     * @throws IllegalStateException unless the phase is COMPLETE
     */
    public HttpRequest toRequest() {
        if (phase != Phase.COMPLETE) {
            throw new IllegalStateException("Request not complete: " + phase);
        }
        byte[] body = bodyBuffer == null ? new byte[0] : bodyBuffer.toByteArray();
        return new HttpRequest(head.method(), head.target(), head.version(), head.headers(), body);
    }

    private void consumeHeaderBytes(byte[] data, int offset, int length) {
        headerBuffer.write(data, offset, length);
        byte[] buffered = headerBuffer.toByteArray();
        // Resume a few bytes back so a terminator split across fragments is still found
        int terminatorAt = indexOf(buffered, HEADER_TERMINATOR, Math.max(0, scanFrom - (HEADER_TERMINATOR.length - 1)));
        if (terminatorAt < 0) {
            scanFrom = buffered.length;
            if (buffered.length > maxHeaderBytes) {
                reject(ApiErrorCode.BAD_REQUEST, "Request header section exceeds " + maxHeaderBytes + " bytes");
            }
            return;
        }
        if (terminatorAt > maxHeaderBytes) {
            reject(ApiErrorCode.BAD_REQUEST, "Request header section exceeds " + maxHeaderBytes + " bytes");
            return;
        }

        String headerText = new String(buffered, 0, terminatorAt, StandardCharsets.ISO_8859_1);
        if (!parseHead(headerText)) {
            return;
        }

        if (head.contentLength() > maxBodyBytes) {
            reject(ApiErrorCode.PAYLOAD_TOO_LARGE, "Request body of " + head.contentLength()
                    + " bytes exceeds the limit of " + maxBodyBytes + " bytes");
            return;
        }
        if (head.contentLength() == 0) {
            phase = Phase.COMPLETE;
            return;
        }

        phase = Phase.READING_BODY;
        bodyBuffer = new ByteArrayOutputStream((int) Math.min(head.contentLength(), 1024 * 1024));
        int bodyStart = terminatorAt + HEADER_TERMINATOR.length;
        consumeBodyBytes(buffered, bodyStart, buffered.length - bodyStart);
    }

    private void consumeBodyBytes(byte[] data, int offset, int length) {
        long remaining = head.contentLength() - bodyBuffer.size();
        int take = (int) Math.min(remaining, length);
        bodyBuffer.write(data, offset, take);
        if (bodyBuffer.size() >= head.contentLength()) {
            phase = Phase.COMPLETE;
        }
    }

    private boolean parseHead(String headerText) {
        String[] lines = headerText.split("\r\n", -1);
        String[] requestLine = lines[0].split(" ", -1);
        if (requestLine.length != 3 || requestLine[0].isEmpty() || requestLine[1].isEmpty()
                || !requestLine[2].startsWith("HTTP/")) {
            reject(ApiErrorCode.BAD_REQUEST, "Malformed request line");
            return false;
        }

        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            int colon = line.indexOf(':');
            if (colon <= 0 || hasWhitespace(line, colon)) {
                reject(ApiErrorCode.BAD_REQUEST, "Malformed header line");
                return false;
            }
            String name = line.substring(0, colon);
            String value = line.substring(colon + 1).trim();
            headers.merge(name, value, (a, b) -> a + ", " + b);
        }

        if (headers.containsKey("Transfer-Encoding")) {
            reject(ApiErrorCode.BAD_REQUEST, "Transfer-Encoding is not supported; send Content-Length");
            return false;
        }

        long contentLength = 0;
        String declared = headers.get("Content-Length");
        if (declared != null) {
            try {
                contentLength = Long.parseLong(declared.trim());
            } catch (NumberFormatException e) {
                contentLength = -1;
            }
            if (contentLength < 0) {
                reject(ApiErrorCode.BAD_REQUEST, "Invalid Content-Length: " + declared);
                return false;
            }
        }

        head = new RequestHead(requestLine[0], requestLine[1], requestLine[2],
                Collections.unmodifiableMap(headers), contentLength);
        return true;
    }

    private static boolean hasWhitespace(String line, int end) {
        for (int i = 0; i < end; i++) {
            if (Character.isWhitespace(line.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private void reject(ApiErrorCode code, String message) {
        this.rejection = new Rejection(code, message);
        this.phase = Phase.REJECTED;
    }

    /**
     * Binary-safe search for {@code pattern} in {@code data} starting at {@code from}.
     */
    static int indexOf(byte[] data, byte[] pattern, int from) {
        outer:
        for (int i = Math.max(0, from); i <= data.length - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
