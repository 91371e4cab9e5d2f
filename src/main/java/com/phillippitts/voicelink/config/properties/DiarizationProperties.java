package com.phillippitts.voicelink.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Speaker diarization settings.
 *
 * @param failOnError when true a diarization failure fails the whole request; when false the
 *                    plain transcript is returned with the diarization error attached
 * @param defaultMaxSpeakers speaker count used when the client sends no {@code max_speakers}
 * @param silenceThreshold RMS level (0..1) below which a stereo analysis window counts as silent
 */
@ConfigurationProperties(prefix = "transcription.diarization")
@Validated
public record DiarizationProperties(
        @DefaultValue("true") boolean failOnError,
        @DefaultValue("2") @Positive int defaultMaxSpeakers,
        @DefaultValue("0.01") double silenceThreshold
) {
}
