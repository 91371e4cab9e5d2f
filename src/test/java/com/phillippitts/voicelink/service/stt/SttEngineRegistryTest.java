package com.phillippitts.voicelink.service.stt;

import com.phillippitts.voicelink.exception.TranscriptionException;
import com.phillippitts.voicelink.service.model.ModelProvider;
import com.phillippitts.voicelink.testutil.FakeSttEngine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SttEngineRegistryTest {

    @Test
    void resolvesEngineByProvider() {
        FakeSttEngine local = new FakeSttEngine("whisper", ModelProvider.LOCAL);
        FakeSttEngine cloud = new FakeSttEngine("cloud", ModelProvider.CLOUD);

        SttEngineRegistry registry = new SttEngineRegistry(List.of(local, cloud));

        assertThat(registry.engineFor(ModelProvider.LOCAL)).isSameAs(local);
        assertThat(registry.engineFor(ModelProvider.CLOUD)).isSameAs(cloud);
        assertThat(registry.engines()).hasSize(2);
    }

    @Test
    void missingProviderIsTranscriptionException() {
        SttEngineRegistry registry = new SttEngineRegistry(List.of(new FakeSttEngine("whisper", ModelProvider.LOCAL)));

        assertThatThrownBy(() -> registry.engineFor(ModelProvider.CLOUD))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("CLOUD");
    }

    @Test
    void duplicateProviderIsRejected() {
        assertThatThrownBy(() -> new SttEngineRegistry(List.of(
                new FakeSttEngine("a", ModelProvider.LOCAL), new FakeSttEngine("b", ModelProvider.LOCAL))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void warmUpToleratesEnginesThatCannotStart() {
        FakeSttEngine broken = new FakeSttEngine("whisper", ModelProvider.LOCAL);
        broken.failInitialize = true;
        SttEngineRegistry registry = new SttEngineRegistry(List.of(broken));

        registry.warmUp();

        assertThat(broken.isHealthy()).isFalse();
    }
}
