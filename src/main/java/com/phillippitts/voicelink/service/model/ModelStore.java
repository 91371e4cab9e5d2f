package com.phillippitts.voicelink.service.model;

import com.phillippitts.voicelink.exception.ModelNotFoundException;

import java.util.List;
import java.util.Optional;

/**
 * Catalogue of models the server can use.
 */
public interface ModelStore {

    /**
     * Models currently available, local files first then cloud models.
     */
    List<TranscriptionModel> availableModels();

    Optional<TranscriptionModel> findModel(String name);

    /**
     * Prepares a local model for inference. Blocking; callers run it off the state owner thread.
     *
     * @throws ModelNotFoundException if the model file is missing, unreadable or not a GGML model
     */
    void loadModel(TranscriptionModel model);
}
