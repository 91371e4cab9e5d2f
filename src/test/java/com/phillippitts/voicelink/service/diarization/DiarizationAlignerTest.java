package com.phillippitts.voicelink.service.diarization;

import com.phillippitts.voicelink.service.stt.TranscriptSegment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DiarizationAlignerTest {

    private final DiarizationAligner aligner = new DiarizationAligner();

    private static DiarizationResult speakers(DiarizationSegment... segments) {
        return DiarizationResult.of(List.of(segments), 10.0, DiarizationMethod.STEREO);
    }

    @Test
    void segmentTakesSpeakerWithLargestOverlap() {
        DiarizationResult diarization = speakers(
                new DiarizationSegment(0.0, 1.2, "SPEAKER_00", 0.9),
                new DiarizationSegment(1.2, 4.0, "SPEAKER_01", 0.8));

        AlignedTranscription aligned = aligner.align("hello",
                List.of(new TranscriptSegment(1.0, 3.0, "hello")), diarization);

        assertThat(aligned.segments()).hasSize(1);
        AlignedSegment segment = aligned.segments().get(0);
        assertThat(segment.speaker()).isEqualTo("SPEAKER_01");
        assertThat(segment.speakerConfidence()).isCloseTo(0.9, within(1e-9));
        assertThat(aligned.method()).isEqualTo(DiarizationMethod.STEREO);
    }

    @Test
    void segmentInsideOneTurnHasFullConfidence() {
        DiarizationResult diarization = speakers(
                new DiarizationSegment(0.0, 5.0, "SPEAKER_00", 0.7),
                new DiarizationSegment(5.0, 9.0, "SPEAKER_01", 0.7));

        AlignedSegment segment = aligner.align("inside",
                List.of(new TranscriptSegment(1.5, 3.5, "inside")), diarization).segments().get(0);

        assertThat(segment.speaker()).isEqualTo("SPEAKER_00");
        assertThat(segment.speakerConfidence()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void equalOverlapKeepsEarlierSpeaker() {
        DiarizationResult diarization = speakers(
                new DiarizationSegment(0.0, 1.0, "SPEAKER_01", null),
                new DiarizationSegment(1.0, 2.0, "SPEAKER_00", null));

        AlignedTranscription aligned = aligner.align("x", List.of(new TranscriptSegment(0.5, 1.5, "x")), diarization);

        assertThat(aligned.segments().get(0).speaker()).isEqualTo("SPEAKER_01");
    }

    @Test
    void segmentWithoutOverlapIsUnknown() {
        DiarizationResult diarization = speakers(new DiarizationSegment(0.0, 1.0, "SPEAKER_00", null));

        AlignedTranscription aligned = aligner.align("late",
                List.of(new TranscriptSegment(5.0, 6.0, "late")), diarization);

        AlignedSegment segment = aligned.segments().get(0);
        assertThat(segment.speaker()).isEqualTo(DiarizationAligner.UNKNOWN_SPEAKER);
        assertThat(segment.speakerConfidence()).isZero();
        assertThat(aligned.speakers()).containsExactly("SPEAKER_UNKNOWN");
    }

    @Test
    void mergesSameSpeakerAcrossShortGaps() {
        DiarizationResult diarization = speakers(
                new DiarizationSegment(0.0, 4.0, "SPEAKER_00", null),
                new DiarizationSegment(4.0, 9.0, "SPEAKER_01", null));

        AlignedTranscription aligned = aligner.align("hi there yes", List.of(
                new TranscriptSegment(0.0, 1.0, "hi", 0.9, false),
                new TranscriptSegment(1.5, 2.5, "there", 0.7, false),
                new TranscriptSegment(4.5, 5.0, "yes", 0.8, false)), diarization);

        assertThat(aligned.segments()).extracting(AlignedSegment::text).containsExactly("hi there", "yes");
        AlignedSegment first = aligned.segments().get(0);
        assertThat(first.start()).isEqualTo(0.0);
        assertThat(first.end()).isEqualTo(2.5);
        assertThat(first.confidence()).isEqualTo(0.7);
        assertThat(aligned.speakers()).containsExactly("SPEAKER_00", "SPEAKER_01");
        assertThat(aligned.text()).isEqualTo("hi there yes");
    }

    @Test
    void gapOfOneSecondOrMoreKeepsSegmentsApart() {
        List<AlignedSegment> merged = DiarizationAligner.mergeConsecutiveSameSpeaker(List.of(
                new AlignedSegment(0.0, 1.0, "a", "SPEAKER_00", null, 1.0),
                new AlignedSegment(2.0, 3.0, "b", "SPEAKER_00", null, 1.0)));

        assertThat(merged).hasSize(2);
    }

    @Test
    void missingConfidencesStayMissingWhenMerged() {
        List<AlignedSegment> merged = DiarizationAligner.mergeConsecutiveSameSpeaker(List.of(
                new AlignedSegment(0.0, 1.0, "a", "SPEAKER_00", null, 1.0),
                new AlignedSegment(1.2, 2.0, "b", "SPEAKER_00", null, 0.5)));

        assertThat(merged).hasSize(1);
        assertThat(merged.get(0).confidence()).isNull();
        assertThat(merged.get(0).speakerConfidence()).isEqualTo(0.5);
    }

    @Test
    void blockFormatHasOneHeadingPerSpeakerChange() {
        List<AlignedSegment> segments = List.of(
                new AlignedSegment(0.0, 1.0, "Hello.", "SPEAKER_00", null, 1.0),
                new AlignedSegment(3.0, 4.0, "Hi.", "SPEAKER_01", null, 1.0),
                new AlignedSegment(5.0, 6.0, "Bye.", "SPEAKER_00", null, 1.0));

        assertThat(DiarizationAligner.formatBlock(segments))
                .isEqualTo("[SPEAKER_00]:\nHello. \n\n[SPEAKER_01]:\nHi. \n\n[SPEAKER_00]:\nBye.");
    }

    @Test
    void inlineFormatPrefixesEachSpeakerChange() {
        List<AlignedSegment> segments = List.of(
                new AlignedSegment(0.0, 1.0, "Hello.", "SPEAKER_00", null, 1.0),
                new AlignedSegment(3.0, 4.0, "Hi.", "SPEAKER_01", null, 1.0));

        assertThat(DiarizationAligner.formatInline(segments))
                .isEqualTo("[SPEAKER_00]: Hello.  [SPEAKER_01]: Hi.");
    }

    @Test
    void emptyTranscriptAlignsToEmptyResult() {
        AlignedTranscription aligned = aligner.align(null, List.of(),
                speakers(new DiarizationSegment(0.0, 1.0, "SPEAKER_00", null)));

        assertThat(aligned.segments()).isEmpty();
        assertThat(aligned.text()).isEmpty();
        assertThat(aligned.textWithSpeakers()).isEmpty();
        assertThat(aligned.inlineText()).isEmpty();
    }
}
