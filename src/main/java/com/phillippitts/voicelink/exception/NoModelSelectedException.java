package com.phillippitts.voicelink.exception;

/**
 * Thrown by the application state owner when a transcription needs a model but none is selected.
 */
public class NoModelSelectedException extends VoiceLinkException {

    public NoModelSelectedException() {
        super("No transcription model is currently selected");
    }
}
