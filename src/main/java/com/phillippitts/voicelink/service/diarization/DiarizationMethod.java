package com.phillippitts.voicelink.service.diarization;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How speaker segments were obtained.
 */
public enum DiarizationMethod {
    /** Left/right channel energy of a stereo recording. */
    STEREO("stereo"),
    /** Speaker-turn flags emitted by a tinydiarize whisper model. */
    TINYDIARIZE("tinydiarize"),
    /** External pyannote pipeline; not available in this server. */
    PYANNOTE("pyannote");

    private final String wireName;

    DiarizationMethod(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * @return the method, or null for {@code auto}
     * @throws IllegalArgumentException for unknown names
     */
    static DiarizationMethod fromWire(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.equals("auto")) {
            return null;
        }
        for (DiarizationMethod m : values()) {
            if (m.wireName.equals(v)) {
                return m;
            }
        }
        throw new IllegalArgumentException(value);
    }
}
