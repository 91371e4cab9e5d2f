package com.phillippitts.voicelink.service.diarization;

import java.util.List;

/**
 * @param segments merged, speaker-attributed segments in start order
 * @param speakers distinct speaker labels, sorted
 * @param text the plain transcript
 * @param textWithSpeakers block rendering, one {@code [SPEAKER]:} heading per speaker change
 * @param inlineText inline rendering, {@code [SPEAKER]: text ...}
 * @param method diarization method that produced the speaker segments
 */
public record AlignedTranscription(List<AlignedSegment> segments, List<String> speakers, String text,
                                   String textWithSpeakers, String inlineText, DiarizationMethod method) {

    public AlignedTranscription {
        segments = List.copyOf(segments);
        speakers = List.copyOf(speakers);
    }
}
