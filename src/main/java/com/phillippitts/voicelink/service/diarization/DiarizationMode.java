package com.phillippitts.voicelink.service.diarization;

import java.util.Locale;

/**
 * Speed/precision trade-off for signal-based diarization; sets the analysis window size.
 */
public enum DiarizationMode {
    FAST(1000),
    BALANCED(500),
    ACCURATE(250);

    private final int windowMillis;

    DiarizationMode(int windowMillis) {
        this.windowMillis = windowMillis;
    }

    public int windowMillis() {
        return windowMillis;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    static DiarizationMode fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
