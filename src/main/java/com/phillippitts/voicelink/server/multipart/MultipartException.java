package com.phillippitts.voicelink.server.multipart;

import com.phillippitts.voicelink.server.http.ApiErrorCode;

/**
 * Thrown when a multipart body cannot be used. Always answered with 400.
 */
public class MultipartException extends RuntimeException {

    /**
     * Distinguishes a structurally broken body from a well-formed body lacking the file part.
     */
    public enum Reason {
        MISSING_BOUNDARY(ApiErrorCode.MISSING_BOUNDARY),
        MALFORMED(ApiErrorCode.MALFORMED_MULTIPART),
        NO_FILE(ApiErrorCode.MISSING_FILE);

        private final ApiErrorCode errorCode;

        Reason(ApiErrorCode errorCode) {
            this.errorCode = errorCode;
        }

        public ApiErrorCode errorCode() {
            return errorCode;
        }
    }

    private final Reason reason;

    public MultipartException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
