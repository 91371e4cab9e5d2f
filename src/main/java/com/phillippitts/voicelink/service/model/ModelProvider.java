package com.phillippitts.voicelink.service.model;

/**
 * Where a model runs.
 */
public enum ModelProvider {
    /** whisper.cpp on this machine; needs a load step before first use. */
    LOCAL,
    /** Remote OpenAI-compatible transcription API; always ready. */
    CLOUD
}
