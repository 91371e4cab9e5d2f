package com.phillippitts.voicelink.service.stt.whisper;

import com.phillippitts.voicelink.config.stt.WhisperConfig;
import com.phillippitts.voicelink.exception.TranscriptionException;
import com.phillippitts.voicelink.service.process.ExternalProcessRunner;
import com.phillippitts.voicelink.service.stt.TranscriptionOptions;
import com.phillippitts.voicelink.testutil.FakeProcess;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WhisperProcessManagerTest {

    private static final String JSON = "{\"transcription\":[{\"offsets\":{\"from\":0,\"to\":900},\"text\":\" hi\"}]}";

    @TempDir
    Path tempDir;

    private WhisperConfig config(int timeoutSeconds) {
        return new WhisperConfig("/opt/whisper/main", tempDir.toString(), timeoutSeconds, 3, 1 << 20, 2, 5);
    }

    /**
     * Writes the JSON file whisper.cpp would produce at {@code -of <base>}.
     */
    private static FakeProcess.Factory writingJson(FakeProcess process, String json) {
        return new FakeProcess.Factory(process, command -> {
            String base = command.get(command.indexOf("-of") + 1);
            Files.writeString(Path.of(base + ".json"), json, StandardCharsets.UTF_8);
        });
    }

    @Test
    void readsAndDeletesJsonOutput() throws Exception {
        Path wav = Files.createFile(tempDir.resolve("voicelink-1.wav"));
        FakeProcess.Factory factory = writingJson(FakeProcess.succeeding(""), JSON);
        WhisperProcessManager manager = new WhisperProcessManager(new ExternalProcessRunner(factory));

        String json = manager.transcribe(wav, tempDir.resolve("ggml-base.bin"),
                new TranscriptionOptions("en", false), config(10));

        assertThat(json).isEqualTo(JSON);
        assertThat(tempDir.resolve("voicelink-1.json")).doesNotExist();
    }

    @Test
    void commandCarriesModelLanguageThreadsAndJsonFlags() {
        WhisperProcessManager manager = new WhisperProcessManager(
                new ExternalProcessRunner(new FakeProcess.Factory(FakeProcess.succeeding(""))));
        Path wav = tempDir.resolve("clip.wav");
        Path model = tempDir.resolve("ggml-small.bin");

        List<String> cmd = manager.buildCommand(config(10), model, wav, tempDir.resolve("clip"),
                new TranscriptionOptions("auto", true));

        assertThat(cmd.get(0)).isEqualTo("/opt/whisper/main");
        assertThat(cmd).containsSubsequence("-m", model.toAbsolutePath().toString());
        assertThat(cmd).containsSubsequence("-f", wav.toAbsolutePath().toString());
        assertThat(cmd).containsSubsequence("-l", "auto");
        assertThat(cmd).containsSubsequence("-t", "3");
        assertThat(cmd).contains("-np", "-oj");
        assertThat(cmd).endsWith("-tdrz");
    }

    @Test
    void tinydiarizeFlagOnlyWhenRequested() {
        WhisperProcessManager manager = new WhisperProcessManager(
                new ExternalProcessRunner(new FakeProcess.Factory(FakeProcess.succeeding(""))));

        List<String> cmd = manager.buildCommand(config(10), tempDir.resolve("m.bin"), tempDir.resolve("a.wav"),
                tempDir.resolve("a"), new TranscriptionOptions("en", false));

        assertThat(cmd).doesNotContain("-tdrz");
    }

    @Test
    void missingJsonOutputFails() throws Exception {
        Path wav = Files.createFile(tempDir.resolve("silent.wav"));
        WhisperProcessManager manager = new WhisperProcessManager(
                new ExternalProcessRunner(new FakeProcess.Factory(FakeProcess.succeeding(""))));

        assertThatThrownBy(() -> manager.transcribe(wav, tempDir.resolve("m.bin"),
                new TranscriptionOptions("en", false), config(10)))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("produced no JSON output");
    }

    @Test
    void nonZeroExitCarriesModelPathAndStderr() throws Exception {
        Path wav = Files.createFile(tempDir.resolve("bad.wav"));
        WhisperProcessManager manager = new WhisperProcessManager(new ExternalProcessRunner(
                new FakeProcess.Factory(new FakeProcess("", "failed to load model", 2, 0))));

        assertThatThrownBy(() -> manager.transcribe(wav, tempDir.resolve("ggml-tiny.bin"),
                new TranscriptionOptions("en", false), config(10)))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("Non-zero exit: 2")
                .hasMessageContaining("ggml-tiny.bin")
                .hasMessageContaining("failed to load model")
                .hasMessageContaining("engine: whisper");
    }
}
