package com.phillippitts.voicelink.service.audio;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class AudioFormatSnifferTest {

    private final AudioFormatSniffer sniffer = new AudioFormatSniffer();

    private static byte[] header(String ascii, int offset) {
        byte[] data = new byte[32];
        byte[] magic = ascii.getBytes(StandardCharsets.ISO_8859_1);
        System.arraycopy(magic, 0, data, offset, magic.length);
        return data;
    }

    @Test
    void recognisesContainersByMagicBytes() {
        byte[] wav = header("RIFF", 0);
        System.arraycopy("WAVE".getBytes(StandardCharsets.ISO_8859_1), 0, wav, 8, 4);

        assertThat(sniffer.classify(wav)).isEqualTo(AudioContainer.WAV);
        assertThat(sniffer.classify(header("ID3", 0))).isEqualTo(AudioContainer.MP3);
        assertThat(sniffer.classify(header("ftyp", 4))).isEqualTo(AudioContainer.M4A);
        assertThat(sniffer.classify(header("fLaC", 0))).isEqualTo(AudioContainer.FLAC);
        assertThat(sniffer.classify(header("OggS", 0))).isEqualTo(AudioContainer.OGG);
    }

    @Test
    void recognisesMpegFrameSyncAndEbml() {
        byte[] mpeg = new byte[16];
        mpeg[0] = (byte) 0xFF;
        mpeg[1] = (byte) 0xFB;
        byte[] ebml = new byte[16];
        ebml[0] = 0x1A;
        ebml[1] = 0x45;
        ebml[2] = (byte) 0xDF;
        ebml[3] = (byte) 0xA3;

        assertThat(sniffer.classify(mpeg)).isEqualTo(AudioContainer.MP3);
        assertThat(sniffer.classify(ebml)).isEqualTo(AudioContainer.WEBM);
    }

    @Test
    void riffWithoutWaveIsUnknown() {
        assertThat(sniffer.classify(header("RIFF", 0))).isEqualTo(AudioContainer.UNKNOWN);
    }

    @Test
    void shortOrNullInputIsUnknown() {
        assertThat(sniffer.classify(null)).isEqualTo(AudioContainer.UNKNOWN);
        assertThat(sniffer.classify(Arrays.copyOf(header("ID3", 0), AudioFormatSniffer.MIN_HEADER_BYTES - 1)))
                .isEqualTo(AudioContainer.UNKNOWN);
    }

    @Test
    void containersCarryExtensions() {
        assertThat(AudioContainer.MP3.extension()).isEqualTo("mp3");
        assertThat(AudioContainer.UNKNOWN.extension()).isEqualTo("bin");
    }

    @Test
    void classificationIsRepeatableAndLeavesInputUntouched() {
        byte[] flac = header("fLaC", 0);
        byte[] copy = Arrays.copyOf(flac, flac.length);

        AudioContainer first = sniffer.classify(flac);

        assertThat(sniffer.classify(flac)).isEqualTo(first).isEqualTo(AudioContainer.FLAC);
        assertThat(flac).isEqualTo(copy);
    }
}
