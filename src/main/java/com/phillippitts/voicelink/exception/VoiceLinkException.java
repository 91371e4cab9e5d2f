package com.phillippitts.voicelink.exception;

/**
 * Base exception for all VoiceLink application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class VoiceLinkException extends RuntimeException {

    public VoiceLinkException(String message) {
        super(message);
    }

    public VoiceLinkException(String message, Throwable cause) {
        super(message, cause);
    }

    public VoiceLinkException(Throwable cause) {
        super(cause);
    }
}
