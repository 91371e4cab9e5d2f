package com.phillippitts.voicelink.service.diarization;

import java.util.ArrayList;
import java.util.List;

/**
 * Channel-separation diarization for two-speaker stereo recordings (one speaker per channel).
 *
 * <p>The first two channels are cut into fixed windows. For each window the RMS level of each
 * channel is measured; the louder channel's speaker ({@code SPEAKER_00} left, {@code SPEAKER_01}
 * right) owns the window, with confidence {@code louder / (left + right)}. Windows where both
 * channels stay under the silence threshold are dropped and end the current segment. Adjacent
 * windows with the same speaker coalesce; the segment confidence is the mean over its windows.
 */
final class StereoChannelDiarizer {

    private static final double FULL_SCALE = 32768.0;

    private final double silenceThreshold;

    StereoChannelDiarizer(double silenceThreshold) {
        this.silenceThreshold = silenceThreshold;
    }

    List<DiarizationSegment> diarize(short[] left, short[] right, int sampleRate, DiarizationMode mode) {
        int frames = Math.min(left.length, right.length);
        int window = Math.max(1, (int) ((long) sampleRate * mode.windowMillis() / 1000));

        List<DiarizationSegment> segments = new ArrayList<>();
        Run run = null;
        for (int from = 0; from < frames; from += window) {
            int to = Math.min(frames, from + window);
            double l = rms(left, from, to);
            double r = rms(right, from, to);
            if (Math.max(l, r) < silenceThreshold) {
                if (run != null) {
                    segments.add(run.toSegment(sampleRate));
                    run = null;
                }
                continue;
            }
            int speaker = l >= r ? 0 : 1;
            double confidence = Math.max(l, r) / (l + r);
            if (run != null && run.speaker == speaker) {
                run.extend(to, confidence);
            } else {
                if (run != null) {
                    segments.add(run.toSegment(sampleRate));
                }
                run = new Run(speaker, from, to, confidence);
            }
        }
        if (run != null) {
            segments.add(run.toSegment(sampleRate));
        }
        return segments;
    }

    static double rms(short[] samples, int from, int to) {
        if (to <= from) {
            return 0;
        }
        double sum = 0;
        for (int i = from; i < to; i++) {
            double s = samples[i] / FULL_SCALE;
            sum += s * s;
        }
        return Math.sqrt(sum / (to - from));
    }

    private static final class Run {
        final int speaker;
        final int startFrame;
        int endFrame;
        double confidenceSum;
        int windows;

        Run(int speaker, int startFrame, int endFrame, double confidence) {
            this.speaker = speaker;
            this.startFrame = startFrame;
            this.endFrame = endFrame;
            this.confidenceSum = confidence;
            this.windows = 1;
        }

        void extend(int endFrame, double confidence) {
            this.endFrame = endFrame;
            this.confidenceSum += confidence;
            this.windows++;
        }

        DiarizationSegment toSegment(int sampleRate) {
            return new DiarizationSegment((double) startFrame / sampleRate, (double) endFrame / sampleRate,
                    SpeakerLabels.label(speaker), confidenceSum / windows);
        }
    }
}
