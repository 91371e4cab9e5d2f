package com.phillippitts.voicelink.service.audio;

import org.springframework.stereotype.Component;

/**
 * Classifies uploaded audio by fixed-offset magic bytes, ignoring any declared name or MIME type.
 *
 * <p>Pure and stateless; the same bytes always yield the same container.
 */
@Component
public class AudioFormatSniffer {

    /** Inputs shorter than this are never classified. */
    static final int MIN_HEADER_BYTES = 12;

    public AudioContainer classify(byte[] data) {
        if (data == null || data.length < MIN_HEADER_BYTES) {
            return AudioContainer.UNKNOWN;
        }
        // ID3 tag or MPEG frame sync (11 set bits)
        if (matches(data, 0, 'I', 'D', '3')
                || ((data[0] & 0xFF) == 0xFF && (data[1] & 0xE0) == 0xE0)) {
            return AudioContainer.MP3;
        }
        if (matches(data, 0, 'R', 'I', 'F', 'F') && matches(data, 8, 'W', 'A', 'V', 'E')) {
            return AudioContainer.WAV;
        }
        if (matches(data, 4, 'f', 't', 'y', 'p')) {
            return AudioContainer.M4A;
        }
        if (matches(data, 0, 'f', 'L', 'a', 'C')) {
            return AudioContainer.FLAC;
        }
        if (matches(data, 0, 'O', 'g', 'g', 'S')) {
            return AudioContainer.OGG;
        }
        // EBML header
        if ((data[0] & 0xFF) == 0x1A && (data[1] & 0xFF) == 0x45
                && (data[2] & 0xFF) == 0xDF && (data[3] & 0xFF) == 0xA3) {
            return AudioContainer.WEBM;
        }
        return AudioContainer.UNKNOWN;
    }

    private static boolean matches(byte[] data, int offset, char... expected) {
        for (int i = 0; i < expected.length; i++) {
            if (data[offset + i] != (byte) expected[i]) {
                return false;
            }
        }
        return true;
    }
}
