package com.phillippitts.voicelink.exception;

/**
 * Thrown when diarization was requested but produced no usable speaker segments.
 */
public class DiarizationUnavailableException extends DiarizationException {

    public DiarizationUnavailableException(String detail) {
        super("No suitable diarization method available for this audio: " + detail);
    }
}
