package com.phillippitts.voicelink.service.transcription;

import com.phillippitts.voicelink.server.http.ApiErrorCode;

import java.util.Objects;

/**
 * Result of a transcription job: either a response body or a structured error.
 */
public final class TranscriptionOutcome {

    private final TranscriptionResponse response;
    private final ApiErrorCode errorCode;
    private final String errorMessage;

    private TranscriptionOutcome(TranscriptionResponse response, ApiErrorCode errorCode, String errorMessage) {
        this.response = response;
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }

    public static TranscriptionOutcome success(TranscriptionResponse response) {
        return new TranscriptionOutcome(Objects.requireNonNull(response, "response"), null, null);
    }

    public static TranscriptionOutcome failure(ApiErrorCode code, String message) {
        return new TranscriptionOutcome(null, Objects.requireNonNull(code, "code"),
                message == null ? code.name() : message);
    }

    public boolean isSuccess() {
        return response != null;
    }

    public TranscriptionResponse response() {
        return response;
    }

    public ApiErrorCode errorCode() {
        return errorCode;
    }

    public String errorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return isSuccess() ? "TranscriptionOutcome[success]" : "TranscriptionOutcome[" + errorCode + ": " + errorMessage + "]";
    }
}
