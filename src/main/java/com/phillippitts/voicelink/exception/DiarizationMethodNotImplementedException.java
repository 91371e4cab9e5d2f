package com.phillippitts.voicelink.exception;

/**
 * Thrown when a client asks for a diarization method this server does not provide.
 */
public class DiarizationMethodNotImplementedException extends DiarizationException {

    private final String method;

    public DiarizationMethodNotImplementedException(String method) {
        super("Diarization method '" + method + "' is not yet implemented");
        this.method = method;
    }

    public String getMethod() {
        return method;
    }
}
