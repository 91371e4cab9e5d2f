package com.phillippitts.voicelink.config;

import com.phillippitts.voicelink.service.model.ModelProvider;
import com.phillippitts.voicelink.service.model.ModelStore;
import com.phillippitts.voicelink.service.model.TranscriptionModel;
import com.phillippitts.voicelink.service.stt.SttEngineRegistry;
import com.phillippitts.voicelink.testutil.FakeModelStore;
import com.phillippitts.voicelink.testutil.FakeSttEngine;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.nio.file.Path;
import java.util.List;

/**
 * Test doubles for integration tests that must not depend on whisper.cpp or model files.
 *
 * <p>The fake engine is deliberately not a bean: the production registry would otherwise see two
 * engines for the local provider. It is reachable through {@link #ENGINE} so tests can script it.
 */
@TestConfiguration
public class IntegrationTestConfiguration {

    public static final TranscriptionModel LOCAL_MODEL = new TranscriptionModel("ggml-base.en", "Base (English)",
            ModelProvider.LOCAL, Path.of("target/test-models/ggml-base.en.bin"));

    public static final FakeSttEngine ENGINE = new FakeSttEngine("whisper", ModelProvider.LOCAL);

    @Bean
    @Primary
    public ModelStore testModelStore() {
        return new FakeModelStore(LOCAL_MODEL);
    }

    @Bean
    @Primary
    public SttEngineRegistry testEngineRegistry() {
        return new SttEngineRegistry(List.of(ENGINE));
    }
}
