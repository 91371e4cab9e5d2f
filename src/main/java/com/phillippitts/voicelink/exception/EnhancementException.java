package com.phillippitts.voicelink.exception;

/**
 * Thrown by an enhancement provider. Callers treat it as non-fatal.
 */
public class EnhancementException extends VoiceLinkException {

    public EnhancementException(String message) {
        super(message);
    }

    public EnhancementException(String message, Throwable cause) {
        super(message, cause);
    }
}
