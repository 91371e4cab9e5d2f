package com.phillippitts.voicelink.server.multipart;

import com.phillippitts.voicelink.server.http.HeaderParameters;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Binary-safe multipart/form-data extractor.
 *
 * <p>Works directly on the body bytes: part payloads are never decoded as text, so audio with
 * arbitrary byte values (including CR, LF and boundary-like prefixes) survives unchanged. Each part
 * runs from the blank line after its headers up to the next {@code CRLF--boundary}.
 */
public final class MultipartExtractor {

    private static final Logger LOG = LogManager.getLogger(MultipartExtractor.class);

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] HEADER_END = {'\r', '\n', '\r', '\n'};
    static final String FILE_FIELD = "file";

    /**
     * Extracts the boundary parameter from a {@code Content-Type} header.
     *
     * @throws MultipartException with {@link MultipartException.Reason#MISSING_BOUNDARY} when the
     *         header is absent, not multipart/form-data, or lacks a boundary
     */
    public static String boundaryFrom(String contentType) {
        if (contentType == null || !HeaderParameters.primaryValue(contentType).equalsIgnoreCase("multipart/form-data")) {
            throw new MultipartException(MultipartException.Reason.MISSING_BOUNDARY,
                    "Content-Type must be multipart/form-data with a boundary");
        }
        String boundary = HeaderParameters.parse(contentType).get("boundary");
        if (boundary == null || boundary.isEmpty()) {
            throw new MultipartException(MultipartException.Reason.MISSING_BOUNDARY,
                    "Missing multipart boundary in Content-Type");
        }
        return boundary;
    }

    /**
     * Splits the body into parts and returns the {@code file} part plus all scalar fields.
     *
     * @throws MultipartException MALFORMED when the structure is broken, NO_FILE when no
     *         non-empty {@code file} part exists
     */
    public MultipartForm extract(byte[] body, String boundary) {
        byte[] delimiter = ("--" + boundary).getBytes(StandardCharsets.ISO_8859_1);
        byte[] partEnd = concat(CRLF, delimiter);

        int pos = indexOf(body, delimiter, 0);
        if (pos < 0) {
            throw malformed("Boundary not found in request body");
        }
        pos += delimiter.length;

        MultipartPart file = null;
        Map<String, String> fields = new LinkedHashMap<>();
        int partCount = 0;

        while (pos < body.length) {
            if (startsWith(body, pos, new byte[] {'-', '-'})) {
                break; // closing delimiter
            }
            if (!startsWith(body, pos, CRLF)) {
                throw malformed("Expected CRLF after boundary");
            }
            pos += CRLF.length;

            int dataStart;
            String headerText;
            if (startsWith(body, pos, CRLF)) {
                headerText = "";
                dataStart = pos + CRLF.length;
            } else {
                int headerEnd = indexOf(body, HEADER_END, pos);
                if (headerEnd < 0) {
                    throw malformed("Part headers are not terminated");
                }
                headerText = new String(body, pos, headerEnd - pos, StandardCharsets.UTF_8);
                dataStart = headerEnd + HEADER_END.length;
            }

            int dataEnd = indexOf(body, partEnd, dataStart);
            if (dataEnd < 0) {
                throw malformed("Part is not terminated by a boundary");
            }

            MultipartPart part = toPart(headerText, Arrays.copyOfRange(body, dataStart, dataEnd));
            partCount++;
            if (FILE_FIELD.equals(part.name())) {
                if (file == null) {
                    file = part;
                }
            } else if (part.name() != null && part.filename() == null) {
                fields.putIfAbsent(part.name(), new String(part.data(), StandardCharsets.UTF_8).trim());
            }
            pos = dataEnd + partEnd.length;
        }

        LOG.debug("Multipart body parsed: parts={}, fields={}", partCount, fields.keySet());
        if (file == null) {
            throw new MultipartException(MultipartException.Reason.NO_FILE, "Missing required 'file' field");
        }
        if (file.data().length == 0) {
            throw new MultipartException(MultipartException.Reason.NO_FILE, "Uploaded 'file' field is empty");
        }
        return new MultipartForm(file, fields);
    }

    private static MultipartPart toPart(String headerText, byte[] data) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (String line : headerText.split("\r\n")) {
            int colon = line.indexOf(':');
            if (colon > 0) {
                headers.put(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
            }
        }
        Map<String, String> disposition = HeaderParameters.parse(headers.get("Content-Disposition"));
        return new MultipartPart(Collections.unmodifiableMap(headers), disposition.get("name"),
                disposition.get("filename"), headers.get("Content-Type"), data);
    }

    private static MultipartException malformed(String message) {
        return new MultipartException(MultipartException.Reason.MALFORMED, message);
    }

    private static boolean startsWith(byte[] data, int at, byte[] prefix) {
        if (at + prefix.length > data.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[at + i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    /**
     * Forward byte search starting at {@code from}.
     */
    static int indexOf(byte[] data, byte[] pattern, int from) {
        if (pattern.length == 0) {
            return from;
        }
        byte first = pattern[0];
        int last = data.length - pattern.length;
        for (int i = Math.max(0, from); i <= last; i++) {
            if (data[i] != first) {
                continue;
            }
            int j = 1;
            while (j < pattern.length && data[i + j] == pattern[j]) {
                j++;
            }
            if (j == pattern.length) {
                return i;
            }
        }
        return -1;
    }
}
