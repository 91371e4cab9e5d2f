package com.phillippitts.voicelink.config.stt;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Configuration for the cloud transcription provider (OpenAI-compatible
 * {@code /v1/audio/transcriptions} endpoint).
 *
 * @param enabled whether cloud models are offered at all
 * @param baseUrl service base URL
 * @param apiKey bearer token
 * @param models model names exposed as selectable cloud models
 * @param connectTimeoutSeconds TCP connect timeout
 * @param readTimeoutSeconds whole-request timeout
 * @param maxRetries attempts before giving up on transient failures
 */
@ConfigurationProperties(prefix = "stt.cloud")
@Validated
public record CloudSttConfig(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("https://api.openai.com") String baseUrl,
        @DefaultValue("") String apiKey,
        @DefaultValue("whisper-1") List<String> models,
        @DefaultValue("10") @Positive int connectTimeoutSeconds,
        @DefaultValue("600") @Positive int readTimeoutSeconds,
        @DefaultValue("3") @Positive int maxRetries
) {
}
