package com.phillippitts.voicelink.service.state;

import com.phillippitts.voicelink.config.properties.EnhancementProperties;
import com.phillippitts.voicelink.config.properties.TranscriptionProperties;
import com.phillippitts.voicelink.config.properties.WordReplacementProperties;
import com.phillippitts.voicelink.exception.ModelNotFoundException;
import com.phillippitts.voicelink.exception.NoModelSelectedException;
import com.phillippitts.voicelink.service.model.ModelStore;
import com.phillippitts.voicelink.service.model.TranscriptionModel;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Sole owner of the shared {@link AppState}.
 *
 * <p>The state lives on one dedicated thread; every read and every mutation is a task submitted to
 * that thread and answered through a {@link CompletableFuture}. Callers never hold a lock while
 * waiting. Blocking work (model loading, model lookup on disk) runs on the inference executor and
 * only its completion is posted back to the owner thread.
 *
 * <p>Model loads are deduplicated: concurrent {@link #ensureModelLoaded()} calls for the same model
 * share one in-flight load.
 */
@Component
public class AppStateOwner {

    private static final Logger LOG = LogManager.getLogger(AppStateOwner.class);
    static final String THREAD_NAME = "app-state-owner";

    private final ModelStore modelStore;
    private final Executor inferenceExecutor;
    private final TranscriptionProperties transcriptionProperties;
    private final ExecutorService owner;

    // Confined to the owner thread
    private AppState state;
    private CompletableFuture<TranscriptionModel> inFlightLoad;
    private TranscriptionModel inFlightModel;

    public AppStateOwner(ModelStore modelStore,
                         @Qualifier("inferenceExecutor") Executor inferenceExecutor,
                         TranscriptionProperties transcriptionProperties,
                         WordReplacementProperties wordReplacementProperties,
                         EnhancementProperties enhancementProperties) {
        this.modelStore = Objects.requireNonNull(modelStore, "modelStore");
        this.inferenceExecutor = Objects.requireNonNull(inferenceExecutor, "inferenceExecutor");
        this.transcriptionProperties = Objects.requireNonNull(transcriptionProperties, "transcriptionProperties");
        this.state = new AppState(null, false, enhancementProperties.enabled(),
                wordReplacementProperties.enabled(), transcriptionProperties.language());
        this.owner = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Selects the configured default model, if any. A missing default is logged, not fatal.
     */
    @PostConstruct
    void selectDefaultModel() {
        String name = transcriptionProperties.defaultModel();
        if (name == null || name.isBlank()) {
            LOG.info("No default transcription model configured");
            return;
        }
        selectModel(name).whenComplete((s, err) -> {
            if (err != null) {
                LOG.warn("Default model '{}' unavailable: {}", name, rootMessage(err));
            } else {
                LOG.info("Default model selected: {}", s.currentModel().name());
            }
        });
    }

    /**
     * Runs a read-only function against the current state on the owner thread.
     */
    public <T> CompletableFuture<T> call(Function<AppState, T> reader) {
        return CompletableFuture.supplyAsync(() -> reader.apply(state), owner);
    }

    /**
     * Applies a transition on the owner thread.
     *
     * @return the new state
     */
    public CompletableFuture<AppState> update(UnaryOperator<AppState> transition) {
        return CompletableFuture.supplyAsync(() -> {
            AppState next = Objects.requireNonNull(transition.apply(state), "transition result");
            if (!Objects.equals(next.currentModel(), state.currentModel())) {
                inFlightLoad = null;
                inFlightModel = null;
            }
            state = next;
            return next;
        }, owner);
    }

    public CompletableFuture<AppState> snapshot() {
        return call(Function.identity());
    }

    /**
     * Looks the model up on the inference executor, then makes it current on the owner thread.
     *
     * @return new state; fails with {@link ModelNotFoundException} for unknown names
     */
    public CompletableFuture<AppState> selectModel(String name) {
        return CompletableFuture
                .supplyAsync(() -> modelStore.findModel(name)
                        .orElseThrow(() -> new ModelNotFoundException(name)), inferenceExecutor)
                .thenComposeAsync(model -> update(s -> s.withModel(model)), owner);
    }

    public CompletableFuture<AppState> setEnhancementEnabled(boolean enabled) {
        return update(s -> s.withEnhancementEnabled(enabled));
    }

    public CompletableFuture<AppState> setWordReplacementEnabled(boolean enabled) {
        return update(s -> s.withWordReplacementEnabled(enabled));
    }

    /**
     * Resolves to the current model once it is ready for inference.
     *
     * <p>Cloud models are ready immediately. A local model that is not loaded yet is loaded on the
     * inference executor; concurrent callers share the same load.
     *
     * @return future failing with {@link NoModelSelectedException} when no model is selected, or with
     *         the load failure
     */
    public CompletableFuture<TranscriptionModel> ensureModelLoaded() {
        return CompletableFuture.supplyAsync(this::beginLoadIfNeeded, owner).thenCompose(Function.identity());
    }

    // Owner thread only
    private CompletableFuture<TranscriptionModel> beginLoadIfNeeded() {
        TranscriptionModel model = state.currentModel();
        if (model == null) {
            return CompletableFuture.failedFuture(new NoModelSelectedException());
        }
        if (state.modelLoaded() || !model.requiresLoad()) {
            return CompletableFuture.completedFuture(model);
        }
        if (inFlightLoad != null && model.equals(inFlightModel)) {
            return inFlightLoad;
        }

        CompletableFuture<TranscriptionModel> load = new CompletableFuture<>();
        inFlightLoad = load;
        inFlightModel = model;
        LOG.info("Loading model {}", model.name());
        try {
            CompletableFuture.runAsync(() -> modelStore.loadModel(model), inferenceExecutor)
                    .whenCompleteAsync((ignored, err) -> finishLoad(model, load, err), owner);
        } catch (RuntimeException e) {
            // Inference executor saturated
            finishLoad(model, load, e);
        }
        return load;
    }

    // Owner thread only
    private void finishLoad(TranscriptionModel model, CompletableFuture<TranscriptionModel> load, Throwable err) {
        if (inFlightLoad == load) {
            inFlightLoad = null;
            inFlightModel = null;
        }
        if (err != null) {
            LOG.warn("Model {} failed to load: {}", model.name(), rootMessage(err));
            load.completeExceptionally(err);
            return;
        }
        if (model.equals(state.currentModel())) {
            state = state.withModelLoaded(true);
        }
        LOG.info("Model {} loaded", model.name());
        load.complete(model);
    }

    private static String rootMessage(Throwable t) {
        Throwable cur = t;
        while (cur.getCause() != null && cur.getCause() != cur) {
            cur = cur.getCause();
        }
        return cur.getMessage();
    }

    @PreDestroy
    public void shutdown() {
        owner.shutdown();
        try {
            if (!owner.awaitTermination(1, TimeUnit.SECONDS)) {
                owner.shutdownNow();
            }
        } catch (InterruptedException e) {
            owner.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
