package com.phillippitts.voicelink.server.http;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Parses {@code key=value} parameters of structured header values such as
 * {@code multipart/form-data; boundary="abc"} or {@code form-data; name="file"; filename="a.wav"}.
 */
public final class HeaderParameters {

    private HeaderParameters() {}

    /**
     * Returns the parameters after the first {@code ;}, keys case-insensitive, quotes removed.
     * Semicolons inside quoted values are kept.
     */
    public static Map<String, String> parse(String headerValue) {
        Map<String, String> params = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headerValue == null) {
            return params;
        }
        boolean inQuotes = false;
        int start = -1;
        for (int i = 0; i <= headerValue.length(); i++) {
            char c = i < headerValue.length() ? headerValue.charAt(i) : ';';
            if (c == '"') {
                inQuotes = !inQuotes;
            } else if (c == ';' && !inQuotes) {
                if (start >= 0) {
                    addParameter(params, headerValue.substring(start, i));
                }
                start = i + 1;
            }
        }
        return Collections.unmodifiableMap(params);
    }

    /**
     * Value before the first {@code ;}, trimmed, e.g. the media type.
     */
    public static String primaryValue(String headerValue) {
        if (headerValue == null) {
            return "";
        }
        int semi = headerValue.indexOf(';');
        return (semi >= 0 ? headerValue.substring(0, semi) : headerValue).trim();
    }

    private static void addParameter(Map<String, String> params, String raw) {
        int eq = raw.indexOf('=');
        if (eq <= 0) {
            return;
        }
        String key = raw.substring(0, eq).trim();
        String value = raw.substring(eq + 1).trim();
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1);
        }
        if (!key.isEmpty()) {
            params.putIfAbsent(key, value);
        }
    }
}
