package com.phillippitts.voicelink.service.audio;

import java.util.ArrayList;
import java.util.List;

/**
 * Sample-level conversions on signed 16-bit little-endian PCM.
 */
public final class PcmConverter {

    private PcmConverter() {}

    /**
     * Splits interleaved PCM16LE into one sample array per channel. A trailing partial frame is dropped.
     */
    public static short[][] deinterleave(byte[] pcm, int channels) {
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be positive");
        }
        int frameBytes = channels * 2;
        int frames = pcm.length / frameBytes;
        short[][] out = new short[channels][frames];
        for (int f = 0; f < frames; f++) {
            int base = f * frameBytes;
            for (int c = 0; c < channels; c++) {
                int i = base + c * 2;
                out[c][f] = (short) ((pcm[i] & 0xFF) | (pcm[i + 1] << 8));
            }
        }
        return out;
    }

    /**
     * Linear-interpolation resampling. Adequate for speech headed to a 16 kHz recogniser.
     */
    public static short[] resample(short[] samples, int fromRate, int toRate) {
        if (fromRate == toRate || samples.length == 0) {
            return samples;
        }
        int outLength = (int) Math.max(1, Math.round((double) samples.length * toRate / fromRate));
        short[] out = new short[outLength];
        double step = (double) fromRate / toRate;
        for (int i = 0; i < outLength; i++) {
            double pos = i * step;
            int idx = (int) pos;
            if (idx >= samples.length - 1) {
                out[i] = samples[samples.length - 1];
                continue;
            }
            double frac = pos - idx;
            out[i] = (short) Math.round(samples[idx] + (samples[idx + 1] - samples[idx]) * frac);
        }
        return out;
    }

    /**
     * Averages all channels into one.
     */
    public static short[] downmix(short[][] channels) {
        if (channels.length == 1) {
            return channels[0];
        }
        int frames = channels[0].length;
        short[] out = new short[frames];
        for (int f = 0; f < frames; f++) {
            int sum = 0;
            for (short[] channel : channels) {
                sum += channel[f];
            }
            out[f] = (short) (sum / channels.length);
        }
        return out;
    }

    public static byte[] toLittleEndianBytes(short[] samples) {
        byte[] out = new byte[samples.length * 2];
        for (int i = 0; i < samples.length; i++) {
            out[i * 2] = (byte) (samples[i] & 0xFF);
            out[i * 2 + 1] = (byte) ((samples[i] >> 8) & 0xFF);
        }
        return out;
    }

    /**
     * Normalizes interleaved PCM16LE at any rate and channel count into {@link DecodedAudio}.
     */
    public static DecodedAudio normalize(byte[] pcm, int sampleRate, int channelCount) {
        short[][] split = deinterleave(pcm, channelCount);
        double duration = sampleRate > 0 ? (double) split[0].length / sampleRate : 0.0;

        List<short[]> resampled = new ArrayList<>(channelCount);
        for (short[] channel : split) {
            resampled.add(resample(channel, sampleRate, AudioFormat.TARGET_SAMPLE_RATE));
        }
        short[] mono = downmix(resampled.toArray(new short[0][]));
        List<short[]> perChannel = channelCount >= 2 ? resampled : List.of();
        return new DecodedAudio(toLittleEndianBytes(mono), channelCount, perChannel, duration);
    }
}
