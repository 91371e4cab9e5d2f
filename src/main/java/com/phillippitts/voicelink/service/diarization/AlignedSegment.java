package com.phillippitts.voicelink.service.diarization;

/**
 * Transcript segment attributed to a speaker.
 *
 * @param confidence transcription confidence, null when the engine reports none
 * @param speakerConfidence fraction of the segment covered by the chosen speaker
 */
public record AlignedSegment(double start, double end, String text, String speaker,
                             Double confidence, Double speakerConfidence) {

    public double duration() {
        return end - start;
    }
}
