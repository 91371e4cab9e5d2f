package com.phillippitts.voicelink.server.http;

import org.springframework.http.HttpStatus;

/**
 * Machine-readable error codes returned in {@code error.code}, each bound to its HTTP status.
 */
public enum ApiErrorCode {
    BAD_REQUEST(HttpStatus.BAD_REQUEST),
    MISSING_BOUNDARY(HttpStatus.BAD_REQUEST),
    MALFORMED_MULTIPART(HttpStatus.BAD_REQUEST),
    MISSING_FILE(HttpStatus.BAD_REQUEST),
    INVALID_PARAMETER(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    PAYLOAD_TOO_LARGE(HttpStatus.PAYLOAD_TOO_LARGE),
    NO_MODEL(HttpStatus.INTERNAL_SERVER_ERROR),
    MODEL_LOAD_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    AUDIO_PROCESSING_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    TRANSCRIPTION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    DIARIZATION_NOT_IMPLEMENTED(HttpStatus.INTERNAL_SERVER_ERROR),
    DIARIZATION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    SERVER_BUSY(HttpStatus.SERVICE_UNAVAILABLE),
    PROCESSING_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ApiErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
