package com.phillippitts.voicelink.service.diarization;

final class SpeakerLabels {

    private SpeakerLabels() {}

    static String label(int index) {
        return String.format("SPEAKER_%02d", index);
    }
}
