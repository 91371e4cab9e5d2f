package com.phillippitts.voicelink.service.stt.whisper;

import com.phillippitts.voicelink.exception.TranscriptionException;
import com.phillippitts.voicelink.service.stt.EngineTranscript;
import com.phillippitts.voicelink.service.stt.TranscriptSegment;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WhisperJsonParserTest {

    @Test
    void parsesWhisperCppTranscriptionArray() {
        String json = """
                {"transcription":[
                  {"offsets":{"from":0,"to":1500},"text":" Hello there.",
                   "tokens":[{"text":"[_BEG_]","p":0.1},{"text":" Hello","p":0.9},{"text":" there","p":0.7}]},
                  {"offsets":{"from":1500,"to":3200},"text":" How are you?","speaker_turn_next":true}
                ]}
                """;

        EngineTranscript transcript = WhisperJsonParser.parse(json);

        assertThat(transcript.text()).isEqualTo("Hello there. How are you?");
        assertThat(transcript.segments()).hasSize(2);
        TranscriptSegment first = transcript.segments().get(0);
        assertThat(first.start()).isEqualTo(0.0);
        assertThat(first.end()).isEqualTo(1.5);
        assertThat(first.confidence()).isCloseTo(0.8, within(1e-9));
        assertThat(first.speakerTurnNext()).isFalse();
        TranscriptSegment second = transcript.segments().get(1);
        assertThat(second.confidence()).isNull();
        assertThat(second.speakerTurnNext()).isTrue();
    }

    @Test
    void parsesSegmentsLayoutWithTopLevelText() {
        String json = """
                {"text":" full text ","segments":[
                  {"start":0.0,"end":2.0,"text":" full","avg_logprob":-0.1},
                  {"start":2.0,"end":3.0,"text":" text"}
                ]}
                """;

        EngineTranscript transcript = WhisperJsonParser.parse(json);

        assertThat(transcript.text()).isEqualTo("full text");
        assertThat(transcript.segments().get(0).confidence()).isCloseTo(Math.exp(-0.1), within(1e-9));
        assertThat(transcript.segments().get(1).confidence()).isNull();
    }

    @Test
    void skipsBlankSegments() {
        String json = "{\"transcription\":[{\"offsets\":{\"from\":0,\"to\":10},\"text\":\"   \"}]}";

        EngineTranscript transcript = WhisperJsonParser.parse(json);

        assertThat(transcript.text()).isEmpty();
        assertThat(transcript.segments()).isEmpty();
    }

    @Test
    void blankOutputIsEmptyTranscript() {
        assertThat(WhisperJsonParser.parse("  ").text()).isEmpty();
        assertThat(WhisperJsonParser.parse(null).segments()).isEmpty();
    }

    @Test
    void invalidJsonIsTranscriptionException() {
        assertThatThrownBy(() -> WhisperJsonParser.parse("{not json"))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("Unparseable whisper output");
    }
}
