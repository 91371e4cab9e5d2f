package com.phillippitts.voicelink.service.stt;

import com.phillippitts.voicelink.exception.TranscriptionException;
import com.phillippitts.voicelink.service.model.ModelProvider;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the engine serving a model's provider.
 */
@Component
public class SttEngineRegistry {

    private static final Logger LOG = LogManager.getLogger(SttEngineRegistry.class);

    private final Map<ModelProvider, SttEngine> engines = new EnumMap<>(ModelProvider.class);

    public SttEngineRegistry(List<SttEngine> engines) {
        for (SttEngine engine : engines) {
            SttEngine previous = this.engines.put(engine.provider(), engine);
            if (previous != null) {
                throw new IllegalStateException("Two engines registered for provider " + engine.provider()
                        + ": " + previous.getEngineName() + ", " + engine.getEngineName());
            }
        }
    }

    /**
     * Tries to initialize every engine; failures are logged and retried on first use.
     */
    @PostConstruct
    void warmUp() {
        for (SttEngine engine : engines.values()) {
            try {
                engine.initialize();
                LOG.info("Engine '{}' initialized", engine.getEngineName());
            } catch (TranscriptionException e) {
                LOG.warn("Engine '{}' not ready at startup: {}", engine.getEngineName(), e.getMessage());
            }
        }
    }

    /**
     * @throws TranscriptionException when no engine serves the provider
     */
    public SttEngine engineFor(ModelProvider provider) {
        SttEngine engine = engines.get(provider);
        if (engine == null) {
            throw new TranscriptionException("No transcription engine for provider " + provider);
        }
        return engine;
    }

    public Collection<SttEngine> engines() {
        return engines.values();
    }
}
