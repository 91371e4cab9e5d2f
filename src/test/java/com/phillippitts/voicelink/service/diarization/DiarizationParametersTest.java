package com.phillippitts.voicelink.service.diarization;

import com.phillippitts.voicelink.exception.InvalidParameterException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiarizationParametersTest {

    @Test
    void absentFieldsTakeDefaults() {
        DiarizationParameters params = DiarizationParameters.fromFields(Map.of());

        assertThat(params.enabled()).isFalse();
        assertThat(params.mode()).isEqualTo(DiarizationMode.BALANCED);
        assertThat(params.minSpeakers()).isNull();
        assertThat(params.maxSpeakers()).isNull();
        assertThat(params.method()).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"true", "1", "yes", "TRUE", " Yes "})
    void truthyValuesEnable(String value) {
        assertThat(DiarizationParameters.fromFields(Map.of("enable_diarization", value)).enabled()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"false", "0", "no", ""})
    void falsyOrBlankValuesDisable(String value) {
        assertThat(DiarizationParameters.fromFields(Map.of("enable_diarization", value)).enabled()).isFalse();
    }

    @Test
    void unknownBooleanIsRejected() {
        assertThatThrownBy(() -> DiarizationParameters.fromFields(Map.of("use_tinydiarize", "maybe")))
                .isInstanceOf(InvalidParameterException.class)
                .extracting(e -> ((InvalidParameterException) e).getParameter())
                .isEqualTo("use_tinydiarize");
    }

    @Test
    void parsesModeAndMethod() {
        DiarizationParameters params = DiarizationParameters.fromFields(Map.of(
                "enable_diarization", "true",
                "diarization_mode", "Accurate",
                "diarization_method", "stereo"));

        assertThat(params.mode()).isEqualTo(DiarizationMode.ACCURATE);
        assertThat(params.method()).isEqualTo(DiarizationMethod.STEREO);
    }

    @Test
    void autoMethodMeansAutomaticSelection() {
        assertThat(DiarizationParameters.fromFields(Map.of("diarization_method", "auto")).method()).isNull();
    }

    @Test
    void unknownModeOrMethodIsRejected() {
        assertThatThrownBy(() -> DiarizationParameters.fromFields(Map.of("diarization_mode", "turbo")))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("diarization_mode");
        assertThatThrownBy(() -> DiarizationParameters.fromFields(Map.of("diarization_method", "magic")))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("diarization_method");
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-2", "two", "1.5"})
    void speakerCountsMustBePositiveIntegers(String value) {
        assertThatThrownBy(() -> DiarizationParameters.fromFields(Map.of("min_speakers", value)))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void minAboveMaxIsRejected() {
        assertThatThrownBy(() -> DiarizationParameters.fromFields(Map.of("min_speakers", "3", "max_speakers", "2")))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("max_speakers");
    }

    @Test
    void equalMinAndMaxAreAccepted() {
        DiarizationParameters params = DiarizationParameters.fromFields(Map.of("min_speakers", "2", "max_speakers", "2"));

        assertThat(params.minSpeakers()).isEqualTo(2);
        assertThat(params.maxSpeakers()).isEqualTo(2);
    }

    @Test
    void noneMethodTurnsDiarizationOff() {
        DiarizationParameters params = DiarizationParameters.fromFields(Map.of(
                "enable_diarization", "true", "diarization_method", " None "));

        assertThat(params.enabled()).isFalse();
        assertThat(params.method()).isNull();
    }
}
