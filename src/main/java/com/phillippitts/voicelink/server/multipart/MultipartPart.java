package com.phillippitts.voicelink.server.multipart;

import java.util.Map;

/**
 * One part of a multipart/form-data body.
 *
 * @param headers part headers (case-insensitive keys)
 * @param name form field name from {@code Content-Disposition}
 * @param filename uploaded file name, or null for plain fields
 * @param contentType declared part content type, or null
 * @param data raw payload bytes, exactly as sent
 */
public record MultipartPart(Map<String, String> headers, String name, String filename,
                            String contentType, byte[] data) {
}
