package com.phillippitts.voicelink.config.stt;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Configuration properties for the local whisper.cpp engine.
 * Binds to properties prefixed with "stt.whisper".
 *
 * <p>Example application.properties:
 * <pre>
 * stt.whisper.binary-path=tools/whisper.cpp/main
 * stt.whisper.models-directory=models
 * stt.whisper.timeout-seconds=1200
 * stt.whisper.threads=4
 * stt.whisper.max-stdout-bytes=16777216
 * stt.whisper.max-concurrent=2
 * stt.whisper.acquire-timeout-seconds=600
 * </pre>
 *
 * @param binaryPath Path to the whisper.cpp binary executable
 * @param modelsDirectory Directory scanned for {@code ggml-*.bin} model files
 * @param timeoutSeconds Maximum time to wait for one transcription (in seconds)
 * @param threads Number of CPU threads to use for transcription
 * @param maxStdoutBytes Maximum stdout accumulation in bytes; JSON output for long files is large
 * @param maxConcurrent Maximum whisper.cpp processes running at once
 * @param acquireTimeoutSeconds How long a request waits for a free process slot
 */
@ConfigurationProperties(prefix = "stt.whisper")
@Validated
public record WhisperConfig(
        @DefaultValue("tools/whisper.cpp/main")
        @NotBlank(message = "Whisper binary path must not be blank")
        String binaryPath,

        @DefaultValue("models")
        @NotBlank(message = "Models directory must not be blank")
        String modelsDirectory,

        @DefaultValue("1200")
        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @DefaultValue("4")
        @Positive(message = "Thread count must be positive")
        int threads,

        @DefaultValue("16777216")
        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes,

        @DefaultValue("2")
        @Positive(message = "Max concurrent processes must be positive")
        int maxConcurrent,

        @DefaultValue("600")
        @Positive(message = "Acquire timeout must be positive")
        int acquireTimeoutSeconds
) {
}
