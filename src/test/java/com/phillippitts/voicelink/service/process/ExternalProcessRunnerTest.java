package com.phillippitts.voicelink.service.process;

import com.phillippitts.voicelink.exception.TranscriptionException;
import com.phillippitts.voicelink.testutil.FakeProcess;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ExternalProcessRunnerTest {

    private static ProcessSpec spec(Duration timeout) {
        return new ProcessSpec("ffmpeg", List.of("/usr/bin/ffmpeg", "-i", "in.mp3"), null, timeout, 1024,
                Map.of("container", "MP3"));
    }

    @Test
    void successReturnsCapturedOutput() {
        ExternalProcessRunner runner = new ExternalProcessRunner(
                new FakeProcess.Factory(new FakeProcess("line one\nline two", "warning", 0, 0)));

        ProcessOutput out = runner.run(spec(Duration.ofSeconds(5)));

        assertThat(out.stdout()).isEqualTo("line one\nline two");
        assertThat(out.stderr()).isEqualTo("warning");
        assertThat(out.exitCode()).isZero();
    }

    @Test
    void nonZeroExitIncludesStderrAndContext() {
        ExternalProcessRunner runner = new ExternalProcessRunner(
                new FakeProcess.Factory(new FakeProcess("", "Invalid data found", 1, 0)));

        assertThatThrownBy(() -> runner.run(spec(Duration.ofSeconds(5))))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("Non-zero exit: 1")
                .hasMessageContaining("container=MP3")
                .hasMessageContaining("stderr=Invalid data found")
                .hasMessageContaining("engine: ffmpeg");
    }

    @Test
    void timeoutDestroysProcess() {
        FakeProcess hung = new FakeProcess("", "", 0, FakeProcess.NEVER);
        ExternalProcessRunner runner = new ExternalProcessRunner(new FakeProcess.Factory(hung));

        long start = System.nanoTime();
        assertThatThrownBy(() -> runner.run(spec(Duration.ofMillis(200))))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("Timeout");

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(3000);
        assertThat(hung.wasDestroyCalled()).isTrue();
    }

    @Test
    void interruptKillsProcessAndKeepsInterruptFlag() {
        FakeProcess hung = new FakeProcess("", "", 0, FakeProcess.NEVER);
        ExternalProcessRunner runner = new ExternalProcessRunner(new FakeProcess.Factory(hung));
        AtomicReference<Throwable> failure = new AtomicReference<>();
        AtomicReference<Boolean> interruptedAfter = new AtomicReference<>();

        Thread worker = new Thread(() -> {
            try {
                runner.run(spec(Duration.ofMinutes(1)));
            } catch (TranscriptionException e) {
                failure.set(e);
                interruptedAfter.set(Thread.currentThread().isInterrupted());
            }
        });
        worker.start();
        await().atMost(2, TimeUnit.SECONDS).until(() -> worker.getState() == Thread.State.TIMED_WAITING);
        worker.interrupt();

        await().atMost(3, TimeUnit.SECONDS).until(() -> failure.get() != null);
        assertThat(failure.get()).hasMessageContaining("Interrupted");
        assertThat(interruptedAfter.get()).isTrue();
        assertThat(hung.wasDestroyCalled()).isTrue();
    }

    @Test
    void startFailureIsReportedAsTranscriptionException() {
        ExternalProcessRunner runner = new ExternalProcessRunner((command, dir) -> {
            throw new IOException("No such file or directory");
        });

        assertThatThrownBy(() -> runner.run(spec(Duration.ofSeconds(1))))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("I/O failure: No such file or directory");
    }

    @Test
    void stdoutIsCappedButStillDrained() {
        String big = "x".repeat(4000);
        ExternalProcessRunner runner = new ExternalProcessRunner(
                new FakeProcess.Factory(FakeProcess.succeeding(big)));

        ProcessOutput out = runner.run(spec(Duration.ofSeconds(5)));

        assertThat(out.stdout()).hasSize(1024);
    }

    @Test
    void concurrentRunsAreIndependent() {
        ExternalProcessRunner runner = new ExternalProcessRunner(
                (command, dir) -> new FakeProcess(command.get(0), "", 0, 50));

        List<CompletableFuture<String>> runs = List.of("a", "b", "c", "d").stream()
                .map(name -> CompletableFuture.supplyAsync(() -> runner.run(new ProcessSpec("tool", List.of(name),
                        null, Duration.ofSeconds(5), 1024, Map.of())).stdout()))
                .toList();

        assertThat(runs.stream().map(CompletableFuture::join).toList()).containsExactly("a", "b", "c", "d");
    }

    @Test
    void specRejectsEmptyCommand() {
        assertThatThrownBy(() -> new ProcessSpec("x", List.of(), null, Duration.ofSeconds(1), 1, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
