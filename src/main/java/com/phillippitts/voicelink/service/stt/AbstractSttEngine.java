package com.phillippitts.voicelink.service.stt;

import com.phillippitts.voicelink.exception.TranscriptionException;
import jakarta.annotation.PreDestroy;

/**
 * Base class for {@link SttEngine} implementations providing lifecycle and state management.
 *
 * <p>Template Method: {@link #initialize()} and {@link #close()} are idempotent, synchronized on an
 * internal lock, and delegate to {@link #doInitialize()} / {@link #doClose()}. Unlike
 * initialization, {@link #transcribe} runs outside the lock so requests proceed in parallel.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li><b>Uninitialized:</b> created, or a previous initialization failed</li>
 *   <li><b>Initialized:</b> {@link #initialize()} succeeded</li>
 *   <li><b>Closed:</b> {@link #close()} called; a later {@link #initialize()} reopens the engine</li>
 * </ol>
 */
public abstract class AbstractSttEngine implements SttEngine {

    /** Guards {@link #initialized} and {@link #closed}. */
    protected final Object lock = new Object();

    protected boolean initialized = false;

    protected boolean closed = false;

    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized && !closed) {
                return;
            }
            doInitialize();
            initialized = true;
            closed = false;
        }
    }

    /**
     * Engine-specific initialization, called within the lock.
     *
     * @throws TranscriptionException if initialization fails
     */
    protected abstract void doInitialize();

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    @Override
    @PreDestroy
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            doClose();
            closed = true;
            initialized = false;
        }
    }

    /**
     * Engine-specific cleanup, called within the lock. Should log rather than throw.
     */
    protected abstract void doClose();

    /**
     * Initializes on first use so a missing binary at startup does not require a restart once fixed.
     *
     * @throws TranscriptionException if the engine still cannot be initialized
     */
    protected final void ensureInitialized() {
        if (!isHealthy()) {
            initialize();
        }
    }

    /**
     * Preserves {@link TranscriptionException} instances and wraps anything else with engine context.
     *
     * @return never returns normally; declared for {@code throw handleTranscriptionError(e)} call sites
     */
    protected final TranscriptionException handleTranscriptionError(Exception exception) {
        if (exception instanceof TranscriptionException te) {
            throw te;
        }
        throw new TranscriptionException(
                getEngineName() + " transcription failed: " + exception.getMessage(),
                getEngineName(),
                exception
        );
    }
}
