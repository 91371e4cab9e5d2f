package com.phillippitts.voicelink.service.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A selectable transcription model.
 *
 * @param name identifier reported as {@code metadata.model} and {@code currentModel}
 * @param displayName human readable name
 * @param provider where the model runs
 * @param path model file for local models, null for cloud models
 */
public record TranscriptionModel(String name, String displayName, ModelProvider provider, Path path) {

    public TranscriptionModel {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(provider, "provider");
        if (provider == ModelProvider.LOCAL && path == null) {
            throw new IllegalArgumentException("local model requires a path");
        }
        displayName = displayName == null ? name : displayName;
    }

    public boolean requiresLoad() {
        return provider == ModelProvider.LOCAL;
    }
}
