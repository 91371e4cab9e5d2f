package com.phillippitts.voicelink.config.audio;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Locations of the ffmpeg tools used to decode compressed uploads (MP3, M4A, FLAC, OGG, WebM).
 *
 * @param ffmpegPath ffmpeg executable, resolved via PATH when not absolute
 * @param ffprobePath ffprobe executable
 * @param timeoutSeconds ceiling for one decode
 */
@ConfigurationProperties(prefix = "audio.ffmpeg")
@Validated
public record FfmpegConfig(
        @DefaultValue("ffmpeg") @NotBlank String ffmpegPath,
        @DefaultValue("ffprobe") @NotBlank String ffprobePath,
        @DefaultValue("600") @Positive int timeoutSeconds
) {
}
