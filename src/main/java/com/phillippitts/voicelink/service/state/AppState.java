package com.phillippitts.voicelink.service.state;

import com.phillippitts.voicelink.service.model.TranscriptionModel;

/**
 * Immutable snapshot of the application state shared by all connections.
 *
 * @param currentModel selected model, or null when none is selected
 * @param modelLoaded true once the selected model is ready for inference
 * @param enhancementEnabled enhancement toggle
 * @param wordReplacementEnabled word-replacement toggle
 * @param language language passed to engines
 */
public record AppState(TranscriptionModel currentModel, boolean modelLoaded, boolean enhancementEnabled,
                       boolean wordReplacementEnabled, String language) {

    public AppState withModel(TranscriptionModel model) {
        return new AppState(model, model != null && !model.requiresLoad(), enhancementEnabled,
                wordReplacementEnabled, language);
    }

    public AppState withModelLoaded(boolean loaded) {
        return new AppState(currentModel, loaded, enhancementEnabled, wordReplacementEnabled, language);
    }

    public AppState withEnhancementEnabled(boolean enabled) {
        return new AppState(currentModel, modelLoaded, enabled, wordReplacementEnabled, language);
    }

    public AppState withWordReplacementEnabled(boolean enabled) {
        return new AppState(currentModel, modelLoaded, enhancementEnabled, enabled, language);
    }

    public AppState withLanguage(String newLanguage) {
        return new AppState(currentModel, modelLoaded, enhancementEnabled, wordReplacementEnabled, newLanguage);
    }

    public boolean hasModel() {
        return currentModel != null;
    }
}
