package com.phillippitts.voicelink.service.stt;

/**
 * Per-request engine options.
 *
 * @param language language code or {@code auto}
 * @param tinydiarize ask the engine to emit speaker-turn flags (whisper.cpp {@code -tdrz})
 */
public record TranscriptionOptions(String language, boolean tinydiarize) {

    public TranscriptionOptions {
        language = language == null || language.isBlank() ? "auto" : language;
    }
}
