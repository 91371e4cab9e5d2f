package com.phillippitts.voicelink.service.transcription;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.phillippitts.voicelink.service.diarization.AlignedSegment;

import java.util.List;

/**
 * Successful {@code POST /api/transcribe} body. Diarization fields are null (omitted) for plain
 * transcriptions.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranscriptionResponse(boolean success, String text, String enhancedText,
                                    List<AlignedSegment> segments, List<String> speakers, Integer numSpeakers,
                                    String textWithSpeakers, TranscriptionMetadata metadata) {

    static TranscriptionResponse plain(String text, String enhancedText, TranscriptionMetadata metadata) {
        return new TranscriptionResponse(true, text, enhancedText, null, null, null, null, metadata);
    }
}
