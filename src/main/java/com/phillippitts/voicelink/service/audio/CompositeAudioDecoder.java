package com.phillippitts.voicelink.service.audio;

import com.phillippitts.voicelink.exception.InvalidAudioException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Picks the decoder for a sniffed container.
 *
 * <p>WAV and unrecognised input go to Java Sound first; when Java Sound rejects the encoding
 * (ADPCM, A-law, exotic headers) the file is retried through ffmpeg. All other containers go to
 * ffmpeg directly.
 */
@Primary
@Component
public class CompositeAudioDecoder implements AudioDecoder {

    private static final Logger LOG = LogManager.getLogger(CompositeAudioDecoder.class);

    private final JavaSoundAudioDecoder javaSound;
    private final FfmpegAudioDecoder ffmpeg;

    public CompositeAudioDecoder(JavaSoundAudioDecoder javaSound, FfmpegAudioDecoder ffmpeg) {
        this.javaSound = javaSound;
        this.ffmpeg = ffmpeg;
    }

    @Override
    public boolean supports(AudioContainer container) {
        return javaSound.supports(container) || ffmpeg.supports(container);
    }

    @Override
    public DecodedAudio decode(Path file, AudioContainer container) {
        if (!javaSound.supports(container)) {
            return ffmpeg.decode(file, container);
        }
        try {
            return javaSound.decode(file, container);
        } catch (InvalidAudioException e) {
            LOG.info("Java Sound rejected {} audio ({}); retrying with ffmpeg", container, e.getReason());
            return ffmpeg.decode(file, container);
        }
    }
}
