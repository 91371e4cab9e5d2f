package com.phillippitts.voicelink.service.audio;

import com.phillippitts.voicelink.exception.InvalidAudioException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes WAV (and AIFF/AU) uploads with Java Sound.
 *
 * <p>The source is converted to signed 16-bit little-endian PCM at its own rate and channel
 * count, then handed to {@link PcmConverter} for resampling and downmixing.
 */
@Component
public class JavaSoundAudioDecoder implements AudioDecoder {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioDecoder.class);

    @Override
    public boolean supports(AudioContainer container) {
        return container == AudioContainer.WAV || container == AudioContainer.UNKNOWN;
    }

    @Override
    public DecodedAudio decode(Path file, AudioContainer container) {
        try (AudioInputStream source = AudioSystem.getAudioInputStream(file.toFile())) {
            javax.sound.sampled.AudioFormat format = source.getFormat();
            int channels = format.getChannels();
            int sampleRate = Math.round(format.getSampleRate());
            if (channels <= 0 || sampleRate <= 0) {
                throw new InvalidAudioException("unsupported stream parameters: " + format);
            }

            javax.sound.sampled.AudioFormat target = new javax.sound.sampled.AudioFormat(
                    javax.sound.sampled.AudioFormat.Encoding.PCM_SIGNED,
                    format.getSampleRate(), 16, channels, channels * 2, format.getSampleRate(), false);

            byte[] pcm;
            if (matches(format, target)) {
                pcm = source.readAllBytes();
            } else {
                try (AudioInputStream converted = AudioSystem.getAudioInputStream(target, source)) {
                    pcm = converted.readAllBytes();
                }
            }
            LOG.debug("Decoded {} with Java Sound: rate={}, channels={}, bytes={}",
                    file.getFileName(), sampleRate, channels, pcm.length);
            return PcmConverter.normalize(pcm, sampleRate, channels);
        } catch (UnsupportedAudioFileException | IllegalArgumentException e) {
            throw new InvalidAudioException("Java Sound cannot decode " + container + " audio: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new InvalidAudioException("failed to read audio: " + e.getMessage(), e);
        }
    }

    private static boolean matches(javax.sound.sampled.AudioFormat actual, javax.sound.sampled.AudioFormat target) {
        return actual.getEncoding().equals(target.getEncoding())
                && actual.getSampleSizeInBits() == 16
                && !actual.isBigEndian();
    }
}
