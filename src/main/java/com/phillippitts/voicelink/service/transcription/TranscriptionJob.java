package com.phillippitts.voicelink.service.transcription;

import java.util.concurrent.CompletableFuture;

/**
 * Handle on a running transcription.
 *
 * <p>{@link #cancel()} completes the result as cancelled and interrupts the worker thread, which
 * aborts any engine subprocess or HTTP call and releases temp files on the way out.
 */
public final class TranscriptionJob {

    private final CompletableFuture<TranscriptionOutcome> result = new CompletableFuture<>();
    private final Object workerLock = new Object();
    private Thread worker;

    public CompletableFuture<TranscriptionOutcome> result() {
        return result;
    }

    public void cancel() {
        result.cancel(false);
        synchronized (workerLock) {
            if (worker != null) {
                worker.interrupt();
            }
        }
    }

    public boolean isCancelled() {
        return result.isCancelled();
    }

    /**
     * Registers the thread running this job.
     *
     * @return false when the job was already cancelled or completed; the thread must not proceed
     */
    boolean attachWorker(Thread thread) {
        synchronized (workerLock) {
            if (result.isDone()) {
                return false;
            }
            worker = thread;
            return true;
        }
    }

    /**
     * Detaches the worker and clears an interrupt aimed at this job, so the pool thread is clean for
     * its next task.
     */
    void detachWorker() {
        synchronized (workerLock) {
            worker = null;
            Thread.interrupted();
        }
    }
}
