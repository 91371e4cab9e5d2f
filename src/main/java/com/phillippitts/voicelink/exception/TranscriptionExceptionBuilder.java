package com.phillippitts.voicelink.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Fluent builder for {@link TranscriptionException} with contextual details.
 *
 * <p>Used by the transcription engines and by the external process runner so that every
 * failure message carries the same shape:
 * <pre>
 * throw TranscriptionExceptionBuilder.create("Non-zero exit: 1")
 *         .engine("ffmpeg")
 *         .exitCode(1)
 *         .durationMs(420)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 *
 * <p>Resulting message: {@code Non-zero exit: 1 (exitCode=1, durationMs=420, stderr=...) (engine: ffmpeg)}.
 */
public final class TranscriptionExceptionBuilder {

    private final String message;
    private String engineName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private TranscriptionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static TranscriptionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TranscriptionExceptionBuilder(message);
    }

    public TranscriptionExceptionBuilder engine(String engineName) {
        this.engineName = engineName;
        return this;
    }

    public TranscriptionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /** Process exit code, for external process failures. */
    public TranscriptionExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public TranscriptionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key/value pair to the message. Null keys or values are ignored.
     */
    public TranscriptionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public TranscriptionException build() {
        String detailed = detailedMessage();
        String engine = engineName != null ? engineName : "unknown";
        return cause != null
                ? new TranscriptionException(detailed, engine, cause)
                : new TranscriptionException(detailed, engine);
    }

    private String detailedMessage() {
        StringJoiner details = new StringJoiner(", ", " (", ")");
        details.setEmptyValue("");
        if (exitCode != null) {
            details.add("exitCode=" + exitCode);
        }
        if (durationMs != null) {
            details.add("durationMs=" + durationMs);
        }
        metadata.forEach((k, v) -> details.add(k + "=" + v));
        return message + details;
    }
}
