package com.phillippitts.voicelink.service.stt;

/**
 * A timestamped piece of engine output.
 *
 * @param start start time in seconds
 * @param end end time in seconds
 * @param text segment text, trimmed
 * @param confidence engine confidence in [0,1], or null when the engine reports none
 * @param speakerTurnNext true when the engine flagged a speaker change after this segment
 */
public record TranscriptSegment(double start, double end, String text, Double confidence, boolean speakerTurnNext) {

    public TranscriptSegment(double start, double end, String text) {
        this(start, end, text, null, false);
    }

    public double duration() {
        return end - start;
    }
}
