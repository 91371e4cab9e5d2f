package com.phillippitts.voicelink.service.diarization;

import com.phillippitts.voicelink.service.stt.TranscriptSegment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TinydiarizeTurnsTest {

    private static TranscriptSegment seg(double start, double end, boolean turn) {
        return new TranscriptSegment(start, end, "t", null, turn);
    }

    @Test
    void turnFlagsHandTheFloorToTheNextSpeaker() {
        List<DiarizationSegment> segments = TinydiarizeTurns.fromTranscript(List.of(
                seg(0, 1, false), seg(1, 2, true), seg(2, 3, true), seg(3, 4, false)), 2);

        assertThat(segments).extracting(DiarizationSegment::speaker)
                .containsExactly("SPEAKER_00", "SPEAKER_01", "SPEAKER_00");
        assertThat(segments.get(0).start()).isEqualTo(0.0);
        assertThat(segments.get(0).end()).isEqualTo(2.0);
        assertThat(segments.get(2).start()).isEqualTo(3.0);
        assertThat(segments.get(2).confidence()).isNull();
    }

    @Test
    void speakersCycleWithinMaximum() {
        List<DiarizationSegment> segments = TinydiarizeTurns.fromTranscript(List.of(
                seg(0, 1, true), seg(1, 2, true), seg(2, 3, true), seg(3, 4, false)), 3);

        assertThat(segments).extracting(DiarizationSegment::speaker)
                .containsExactly("SPEAKER_00", "SPEAKER_01", "SPEAKER_02", "SPEAKER_00");
    }

    @Test
    void singleSpeakerCoalescesEverything() {
        List<DiarizationSegment> segments = TinydiarizeTurns.fromTranscript(List.of(
                seg(0, 1, true), seg(1, 2, true), seg(2, 3, false)), 1);

        assertThat(segments).hasSize(1);
        assertThat(segments.get(0).end()).isEqualTo(3.0);
    }

    @Test
    void transcriptWithoutTurnsIsOneSpeaker() {
        List<DiarizationSegment> segments = TinydiarizeTurns.fromTranscript(List.of(seg(0, 2, false)), 2);

        assertThat(segments).extracting(DiarizationSegment::speaker).containsExactly("SPEAKER_00");
    }

    @Test
    void emptyTranscriptGivesNoSegments() {
        assertThat(TinydiarizeTurns.fromTranscript(List.of(), 2)).isEmpty();
    }
}
