package com.phillippitts.voicelink.service.audio;

import com.phillippitts.voicelink.exception.InvalidAudioException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class JavaSoundAudioDecoderTest {

    @TempDir
    Path tempDir;

    private final JavaSoundAudioDecoder decoder = new JavaSoundAudioDecoder();

    @Test
    void decodesStereo44kWavIntoMonoAndChannels() throws Exception {
        int frames = 44_100;
        short[] interleaved = new short[frames * 2];
        for (int i = 0; i < frames; i++) {
            interleaved[i * 2] = 8000;
            interleaved[i * 2 + 1] = 0;
        }
        Path wav = tempDir.resolve("stereo.wav");
        Files.write(wav, WavWriter.encodePcm16Le(PcmConverter.toLittleEndianBytes(interleaved), 44_100, 2));

        DecodedAudio decoded = decoder.decode(wav, AudioContainer.WAV);

        assertThat(decoded.channelCount()).isEqualTo(2);
        assertThat(decoded.isMultiChannel()).isTrue();
        assertThat(decoded.durationSeconds()).isCloseTo(1.0, within(0.01));
        assertThat(decoded.monoPcm().length).isCloseTo(32_000, within(4));
        assertThat(decoded.channels().get(0)[100]).isEqualTo((short) 8000);
        assertThat(decoded.channels().get(1)[100]).isEqualTo((short) 0);
    }

    @Test
    void decodesTargetFormatWavUnchanged() throws Exception {
        byte[] pcm = PcmConverter.toLittleEndianBytes(new short[]{1, 2, 3, 4});
        Path wav = tempDir.resolve("mono.wav");
        WavWriter.writePcm16LeMono16kHz(pcm, wav);

        DecodedAudio decoded = decoder.decode(wav, AudioContainer.WAV);

        assertThat(decoded.monoPcm()).isEqualTo(pcm);
        assertThat(decoded.channelCount()).isEqualTo(1);
    }

    @Test
    void garbageIsInvalidAudio() throws Exception {
        Path junk = tempDir.resolve("junk.bin");
        Files.write(junk, new byte[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13});

        assertThatThrownBy(() -> decoder.decode(junk, AudioContainer.UNKNOWN))
                .isInstanceOf(InvalidAudioException.class);
    }
}
