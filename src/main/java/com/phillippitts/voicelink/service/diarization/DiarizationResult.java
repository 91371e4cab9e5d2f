package com.phillippitts.voicelink.service.diarization;

import java.util.List;

/**
 * Speaker segments for a whole recording.
 *
 * @param segments segments in start order
 * @param speakers distinct speaker labels, sorted
 * @param totalDuration recording duration in seconds
 * @param method how the segments were obtained
 * @param processingTime seconds spent diarizing, null until measured
 */
public record DiarizationResult(List<DiarizationSegment> segments, List<String> speakers, double totalDuration,
                                DiarizationMethod method, Double processingTime) {

    public DiarizationResult {
        segments = List.copyOf(segments);
        speakers = List.copyOf(speakers);
    }

    public int numSpeakers() {
        return speakers.size();
    }

    DiarizationResult withProcessingTime(double seconds) {
        return new DiarizationResult(segments, speakers, totalDuration, method, seconds);
    }

    static DiarizationResult of(List<DiarizationSegment> segments, double totalDuration, DiarizationMethod method) {
        List<String> speakers = segments.stream().map(DiarizationSegment::speaker).distinct().sorted().toList();
        return new DiarizationResult(segments, speakers, totalDuration, method, null);
    }
}
