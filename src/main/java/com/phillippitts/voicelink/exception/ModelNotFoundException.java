package com.phillippitts.voicelink.exception;

/**
 * Thrown when a transcription model cannot be found or read at its resolved location.
 * Surfaces to API clients as a model load failure.
 */
public class ModelNotFoundException extends VoiceLinkException {

    private final String modelPath;

    public ModelNotFoundException(String modelPath) {
        super("Transcription model not found at path: " + modelPath);
        this.modelPath = modelPath;
    }

    public ModelNotFoundException(String modelPath, Throwable cause) {
        super("Transcription model not found at path: " + modelPath, cause);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}
