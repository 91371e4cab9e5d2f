package com.phillippitts.voicelink.server.multipart;

import java.util.Map;
import java.util.Optional;

/**
 * Result of extracting a transcription upload.
 *
 * @param file the {@code file} part
 * @param fields every other named part, decoded as trimmed UTF-8 text
 */
public record MultipartForm(MultipartPart file, Map<String, String> fields) {

    public MultipartForm {
        fields = Map.copyOf(fields);
    }

    public Optional<String> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }
}
