package com.phillippitts.voicelink.service.stt;

import java.util.List;

/**
 * Raw engine output before post-processing.
 *
 * @param text full transcript as produced by the engine
 * @param segments timestamped segments in start order; may be empty
 */
public record EngineTranscript(String text, List<TranscriptSegment> segments) {

    public EngineTranscript {
        text = text == null ? "" : text;
        segments = segments == null ? List.of() : List.copyOf(segments);
    }
}
