package com.phillippitts.voicelink.service.diarization;

import com.phillippitts.voicelink.service.stt.TranscriptSegment;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts tinydiarize speaker-turn flags into speaker segments.
 *
 * <p>Speakers are assigned in order starting at {@code SPEAKER_00}; every segment flagged with
 * {@code speakerTurnNext} hands the floor to the next speaker, cycling within {@code maxSpeakers}.
 * Consecutive segments of the same speaker coalesce.
 */
final class TinydiarizeTurns {

    private TinydiarizeTurns() {}

    static List<DiarizationSegment> fromTranscript(List<TranscriptSegment> transcript, int maxSpeakers) {
        int speakers = Math.max(1, maxSpeakers);
        List<DiarizationSegment> result = new ArrayList<>();
        int speaker = 0;
        double runStart = 0;
        double runEnd = 0;
        boolean open = false;
        for (TranscriptSegment segment : transcript) {
            if (!open) {
                runStart = segment.start();
                open = true;
            }
            runEnd = segment.end();
            if (segment.speakerTurnNext()) {
                result.add(new DiarizationSegment(runStart, runEnd, SpeakerLabels.label(speaker), null));
                speaker = (speaker + 1) % speakers;
                open = false;
            }
        }
        if (open) {
            result.add(new DiarizationSegment(runStart, runEnd, SpeakerLabels.label(speaker), null));
        }
        return coalesce(result);
    }

    // With maxSpeakers == 1 every turn lands on the same speaker
    private static List<DiarizationSegment> coalesce(List<DiarizationSegment> segments) {
        List<DiarizationSegment> out = new ArrayList<>();
        for (DiarizationSegment s : segments) {
            if (!out.isEmpty() && out.get(out.size() - 1).speaker().equals(s.speaker())) {
                DiarizationSegment last = out.remove(out.size() - 1);
                out.add(new DiarizationSegment(last.start(), s.end(), s.speaker(), null));
            } else {
                out.add(s);
            }
        }
        return out;
    }
}
