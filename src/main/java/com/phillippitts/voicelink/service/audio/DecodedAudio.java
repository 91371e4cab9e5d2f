package com.phillippitts.voicelink.service.audio;

import java.util.List;

/**
 * Audio normalized for the engines, plus what diarization needs from the original.
 *
 * @param monoPcm 16 kHz mono PCM16LE, the engine input
 * @param channelCount channel count of the uploaded audio
 * @param channels per-channel 16 kHz samples when the upload had two or more channels, else empty
 * @param durationSeconds duration of the uploaded audio
 */
public record DecodedAudio(byte[] monoPcm, int channelCount, List<short[]> channels, double durationSeconds) {

    public DecodedAudio {
        channels = channels == null ? List.of() : List.copyOf(channels);
    }

    public boolean isMultiChannel() {
        return channels.size() >= 2;
    }
}
