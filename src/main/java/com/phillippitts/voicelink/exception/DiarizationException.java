package com.phillippitts.voicelink.exception;

/**
 * Base class for speaker diarization failures.
 */
public class DiarizationException extends VoiceLinkException {

    public DiarizationException(String message) {
        super(message);
    }

    public DiarizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
