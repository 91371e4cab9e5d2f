package com.phillippitts.voicelink.service.stt.util;

import com.phillippitts.voicelink.exception.TranscriptionException;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds how many inference runs an engine executes at once.
 *
 * <p>Requests beyond the limit wait up to the configured timeout for a permit; an interrupted wait
 * (request cancelled) fails immediately.
 *
 * <pre>
 * guard.acquire();
 * try {
 *     return runInference();
 * } finally {
 *     guard.release();
 * }
 * </pre>
 */
public final class ConcurrencyGuard {

    private final Semaphore semaphore;
    private final long timeoutMs;
    private final String engineName;

    public ConcurrencyGuard(int permits, long timeoutMs, String engineName) {
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be positive");
        }
        this.semaphore = new Semaphore(permits, true);
        this.timeoutMs = timeoutMs;
        this.engineName = engineName;
    }

    /**
     * @throws TranscriptionException if no permit frees up in time or the thread is interrupted
     */
    public void acquire() {
        try {
            boolean acquired = semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new TranscriptionException(
                        engineName + " concurrency limit reached after " + timeoutMs + "ms wait",
                        engineName
                );
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscriptionException(
                    engineName + " transcription interrupted while waiting for a slot",
                    engineName,
                    e
            );
        }
    }

    public void release() {
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }
}
