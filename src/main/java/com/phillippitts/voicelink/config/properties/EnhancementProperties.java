package com.phillippitts.voicelink.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the optional AI text enhancement step.
 *
 * <p>Enhancement talks to an OpenAI-compatible chat completions endpoint. It is considered
 * configured only when both {@code base-url} and {@code model} are set.
 *
 * @param enabled initial value of the enhancement toggle
 * @param baseUrl service base URL, e.g. {@code https://api.openai.com}
 * @param apiKey bearer token (may be blank for local servers)
 * @param model chat model name
 * @param prompt system prompt sent with every request
 * @param timeoutSeconds request timeout
 */
@ConfigurationProperties(prefix = "transcription.enhancement")
@Validated
public record EnhancementProperties(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("") String baseUrl,
        @DefaultValue("") String apiKey,
        @DefaultValue("") String model,
        @DefaultValue("Clean up this dictated transcript. Fix punctuation, capitalization and obvious "
                + "recognition mistakes. Do not add content. Reply with the corrected text only.")
        String prompt,
        @DefaultValue("30") @Positive int timeoutSeconds
) {
    public boolean isConfigured() {
        return !baseUrl.isBlank() && !model.isBlank();
    }
}
