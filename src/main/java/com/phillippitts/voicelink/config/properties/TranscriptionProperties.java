package com.phillippitts.voicelink.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * General transcription settings.
 *
 * <pre>
 * transcription.language=auto
 * transcription.default-model=ggml-base.en
 * transcription.temp-directory=/tmp/voicelink
 * </pre>
 *
 * @param language language code passed to engines, {@code auto} for detection
 * @param defaultModel model selected at startup (blank leaves the server without a model)
 * @param tempDirectory directory for per-request temporary audio (blank uses java.io.tmpdir)
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public record TranscriptionProperties(
        @DefaultValue("auto")
        @NotBlank(message = "Language code must not be blank")
        String language,

        @DefaultValue("")
        String defaultModel,

        @DefaultValue("")
        String tempDirectory
) {
}
