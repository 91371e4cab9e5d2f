package com.phillippitts.voicelink.service.diarization;

import com.phillippitts.voicelink.service.stt.TranscriptSegment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Attributes transcript segments to speakers.
 *
 * <p>Each transcript segment takes the speaker whose diarization segment overlaps it the most;
 * ties keep the earlier speaker. The speaker confidence is the overlap divided by the transcript
 * segment's duration. A segment with no overlap is labelled {@value #UNKNOWN_SPEAKER} with
 * confidence 0.
 *
 * <p>Consecutive segments with the same speaker and a gap under {@value #MERGE_GAP_SECONDS}s
 * are merged in a single pass: texts joined by one space, the lower of each confidence kept.
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class DiarizationAligner {

    public static final String UNKNOWN_SPEAKER = "SPEAKER_UNKNOWN";
    static final double MERGE_GAP_SECONDS = 1.0;

    public AlignedTranscription align(String text, List<TranscriptSegment> transcript, DiarizationResult diarization) {
        Objects.requireNonNull(transcript, "transcript");
        Objects.requireNonNull(diarization, "diarization");

        List<AlignedSegment> aligned = new ArrayList<>(transcript.size());
        for (TranscriptSegment segment : transcript) {
            aligned.add(attribute(segment, diarization.segments()));
        }
        List<AlignedSegment> merged = mergeConsecutiveSameSpeaker(aligned);
        List<String> speakers = merged.stream().map(AlignedSegment::speaker).distinct().sorted().toList();

        return new AlignedTranscription(merged, speakers, text == null ? "" : text,
                formatBlock(merged), formatInline(merged), diarization.method());
    }

    private static AlignedSegment attribute(TranscriptSegment segment, List<DiarizationSegment> speakerSegments) {
        String bestSpeaker = UNKNOWN_SPEAKER;
        double bestOverlap = 0;
        for (DiarizationSegment candidate : speakerSegments) {
            double overlap = Math.min(segment.end(), candidate.end()) - Math.max(segment.start(), candidate.start());
            if (overlap > bestOverlap) {
                bestOverlap = overlap;
                bestSpeaker = candidate.speaker();
            }
        }
        double duration = segment.duration();
        double speakerConfidence = duration > 0 ? bestOverlap / duration : 0;
        return new AlignedSegment(segment.start(), segment.end(), segment.text(), bestSpeaker,
                segment.confidence(), speakerConfidence);
    }

    static List<AlignedSegment> mergeConsecutiveSameSpeaker(List<AlignedSegment> segments) {
        List<AlignedSegment> merged = new ArrayList<>();
        if (segments.isEmpty()) {
            return merged;
        }
        AlignedSegment current = segments.get(0);
        for (int i = 1; i < segments.size(); i++) {
            AlignedSegment next = segments.get(i);
            if (next.speaker().equals(current.speaker()) && next.start() - current.end() < MERGE_GAP_SECONDS) {
                current = new AlignedSegment(current.start(), next.end(), current.text() + " " + next.text(),
                        current.speaker(), minOf(current.confidence(), next.confidence()),
                        minOf(current.speakerConfidence(), next.speakerConfidence()));
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        return merged;
    }

    /** A missing confidence counts as 1.0 against a present one; two missing stay missing. */
    private static Double minOf(Double a, Double b) {
        if (a == null && b == null) {
            return null;
        }
        return Math.min(a == null ? 1.0 : a, b == null ? 1.0 : b);
    }

    /**
     * Renders one {@code [SPEAKER]:} heading per speaker change, blocks separated by a blank line.
     */
    public static String formatBlock(List<AlignedSegment> segments) {
        StringBuilder sb = new StringBuilder();
        String currentSpeaker = null;
        for (AlignedSegment segment : segments) {
            if (!segment.speaker().equals(currentSpeaker)) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append("\n[").append(segment.speaker()).append("]:\n");
                currentSpeaker = segment.speaker();
            }
            sb.append(segment.text()).append(' ');
        }
        return sb.toString().strip();
    }

    public static String formatInline(List<AlignedSegment> segments) {
        StringBuilder sb = new StringBuilder();
        String currentSpeaker = null;
        for (AlignedSegment segment : segments) {
            if (!segment.speaker().equals(currentSpeaker)) {
                sb.append(" [").append(segment.speaker()).append("]: ");
                currentSpeaker = segment.speaker();
            }
            sb.append(segment.text()).append(' ');
        }
        return sb.toString().strip();
    }
}
