package com.phillippitts.voicelink.service.audio;

import com.phillippitts.voicelink.config.audio.FfmpegConfig;
import com.phillippitts.voicelink.exception.InvalidAudioException;
import com.phillippitts.voicelink.exception.TranscriptionException;
import com.phillippitts.voicelink.service.process.ExternalProcessRunner;
import com.phillippitts.voicelink.service.process.ProcessOutput;
import com.phillippitts.voicelink.service.process.ProcessSpec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Decodes compressed containers (MP3, M4A, FLAC, OGG, WebM) through ffmpeg.
 *
 * <p>ffprobe reports the channel count first; ffmpeg then writes a 16 kHz PCM WAV keeping up to two
 * channels so stereo diarization still sees both sides. The WAV is read back with
 * {@link JavaSoundAudioDecoder} and deleted.
 */
@Component
public class FfmpegAudioDecoder implements AudioDecoder {

    private static final Logger LOG = LogManager.getLogger(FfmpegAudioDecoder.class);

    private static final int PROBE_STDOUT_MAX_BYTES = 4 * 1024;

    private final ExternalProcessRunner runner;
    private final FfmpegConfig config;
    private final JavaSoundAudioDecoder wavDecoder;

    public FfmpegAudioDecoder(ExternalProcessRunner runner, FfmpegConfig config, JavaSoundAudioDecoder wavDecoder) {
        this.runner = runner;
        this.config = config;
        this.wavDecoder = wavDecoder;
    }

    @Override
    public boolean supports(AudioContainer container) {
        return true;
    }

    @Override
    public DecodedAudio decode(Path file, AudioContainer container) {
        int channels = Math.min(2, probeChannels(file));
        Path wav = file.resolveSibling(file.getFileName() + ".ffmpeg.wav");
        try {
            runner.run(new ProcessSpec("ffmpeg",
                    List.of(config.ffmpegPath(), "-nostdin", "-hide_banner", "-loglevel", "error", "-y",
                            "-i", file.toAbsolutePath().toString(),
                            "-vn", "-ac", String.valueOf(channels),
                            "-ar", String.valueOf(AudioFormat.TARGET_SAMPLE_RATE),
                            "-c:a", "pcm_s16le", wav.toAbsolutePath().toString()),
                    null, Duration.ofSeconds(config.timeoutSeconds()), PROBE_STDOUT_MAX_BYTES,
                    Map.of("container", container)));
            LOG.debug("ffmpeg converted {} ({}) to {} channel(s)", file.getFileName(), container, channels);
            return wavDecoder.decode(wav, AudioContainer.WAV);
        } catch (TranscriptionException e) {
            throw new InvalidAudioException("ffmpeg could not decode " + container + " audio", e);
        } finally {
            try {
                Files.deleteIfExists(wav);
            } catch (IOException e) {
                LOG.warn("Failed to delete ffmpeg output {}: {}", wav, e.getMessage());
            }
        }
    }

    /**
     * Channel count of the first audio stream; 1 when ffprobe reports nothing usable.
     */
    int probeChannels(Path file) {
        try {
            ProcessOutput out = runner.run(new ProcessSpec("ffprobe",
                    List.of(config.ffprobePath(), "-v", "error", "-select_streams", "a:0",
                            "-show_entries", "stream=channels", "-of", "csv=p=0",
                            file.toAbsolutePath().toString()),
                    null, Duration.ofSeconds(30), PROBE_STDOUT_MAX_BYTES, Map.of()));
            String first = out.stdout().strip().split("\\s+")[0];
            int channels = Integer.parseInt(first.replace(",", ""));
            return channels > 0 ? channels : 1;
        } catch (NumberFormatException e) {
            LOG.debug("ffprobe returned no channel count for {}; assuming mono", file.getFileName());
            return 1;
        } catch (TranscriptionException e) {
            throw new InvalidAudioException("ffprobe could not read audio stream", e);
        }
    }
}
