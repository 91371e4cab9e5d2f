package com.phillippitts.voicelink.service.diarization;

/**
 * A time range attributed to one speaker.
 *
 * @param confidence detector confidence in [0,1], or null when the method reports none
 */
public record DiarizationSegment(double start, double end, String speaker, Double confidence) {

    public double duration() {
        return end - start;
    }
}
