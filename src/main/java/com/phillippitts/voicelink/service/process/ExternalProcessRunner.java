package com.phillippitts.voicelink.service.process;

import com.phillippitts.voicelink.exception.TranscriptionException;
import com.phillippitts.voicelink.exception.TranscriptionExceptionBuilder;
import com.phillippitts.voicelink.util.ProcessTimeouts;
import com.phillippitts.voicelink.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external tool (whisper.cpp, ffmpeg, ffprobe) to completion.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Start the process via {@link ProcessFactory}</li>
 *   <li>Capture stdout and stderr concurrently so neither pipe can fill and block the child</li>
 *   <li>Enforce the timeout and terminate runaway processes</li>
 *   <li>Kill the process when the calling thread is interrupted (request cancelled)</li>
 *   <li>Report failures as {@link TranscriptionException} with exit code, duration and stderr</li>
 * </ul>
 *
 * <p>Stateless: every call owns its own process and gobbler threads, so one runner serves
 * concurrent requests.
 */
@Component
public class ExternalProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ExternalProcessRunner.class);

    /** Maximum bytes captured from stderr per run. */
    static final int STDERR_MAX_BYTES = 256 * 1024;

    /** Maximum stderr characters quoted in error messages. */
    static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    private final ProcessFactory processFactory;

    public ExternalProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Runs the process and returns its output when it exits with status 0.
     *
     * @throws TranscriptionException on start failure, timeout, interruption or non-zero exit
     */
    public ProcessOutput run(ProcessSpec spec) {
        Objects.requireNonNull(spec, "spec");
        long startNanos = System.nanoTime();
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = null;
        Thread outGobbler = null;
        Thread errGobbler = null;

        try {
            LOG.debug("Starting {}: {}", spec.toolName(), spec.command());
            process = processFactory.start(spec.command(), spec.workingDirectory());

            // Start gobblers before waiting to avoid pipe deadlock
            outGobbler = startGobbler(process.getInputStream(), stdout, spec.toolName() + "-out",
                    spec.maxStdoutBytes());
            errGobbler = startGobbler(process.getErrorStream(), stderr, spec.toolName() + "-err",
                    STDERR_MAX_BYTES);

            boolean finished = process.waitFor(spec.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyProcess(process);
                throw failure(spec, "Timeout after " + spec.timeout().toSeconds() + "s", -1, stderr, startNanos, null);
            }

            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw failure(spec, "Non-zero exit: " + exitCode, exitCode, stderr, startNanos, null);
            }

            long durationMs = TimeUtils.elapsedMillis(startNanos);
            LOG.debug("{} finished in {}ms, stdout size={} chars", spec.toolName(), durationMs, stdout.length());
            return new ProcessOutput(snapshot(stdout), snapshot(stderr), exitCode, durationMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure(spec, "Interrupted", -1, stderr, startNanos, e);
        } catch (IOException e) {
            throw failure(spec, "I/O failure: " + e.getMessage(), -1, stderr, startNanos, e);
        } finally {
            if (process != null && process.isAlive()) {
                destroyProcess(process);
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        }
    }

    private static String snapshot(StringBuilder sb) {
        synchronized (sb) {
            return sb.toString();
        }
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a StringBuilder until the cap is reached, then keeps draining without
     * accumulating so the child never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        if (line.length() > available) {
                            sink.append(line, 0, available);
                            capReached = true;
                        } else {
                            sink.append(line);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        process.destroy();
        try {
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            // Caller was cancelled while we were cleaning up; make sure the child dies anyway
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    private static TranscriptionException failure(ProcessSpec spec, String msg, int exitCode,
                                                  StringBuilder stderr, long startNanos, Throwable cause) {
        String stderrText = snapshot(stderr);
        TranscriptionExceptionBuilder builder = TranscriptionExceptionBuilder.create(msg)
                .engine(spec.toolName())
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNanos));
        spec.errorContext().forEach(builder::metadata);
        builder.metadata("stderr", stderrText.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderrText.length())));
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }
}
