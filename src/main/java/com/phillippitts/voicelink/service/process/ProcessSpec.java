package com.phillippitts.voicelink.service.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What to run and how long to wait for it.
 *
 * @param toolName short name used in logs and error messages ("whisper", "ffmpeg")
 * @param command executable followed by its arguments
 * @param workingDirectory working directory, or null to inherit
 * @param timeout wall-clock ceiling; the process is killed when it elapses
 * @param maxStdoutBytes stdout accumulation cap
 * @param errorContext extra key/value pairs attached to failure messages
 */
public record ProcessSpec(String toolName, List<String> command, Path workingDirectory,
                          Duration timeout, int maxStdoutBytes, Map<String, Object> errorContext) {

    public ProcessSpec {
        Objects.requireNonNull(toolName, "toolName");
        Objects.requireNonNull(timeout, "timeout");
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        command = List.copyOf(command);
        errorContext = errorContext == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(errorContext));
    }
}
