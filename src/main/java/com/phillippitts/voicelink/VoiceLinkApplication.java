package com.phillippitts.voicelink;

import com.phillippitts.voicelink.config.audio.FfmpegConfig;
import com.phillippitts.voicelink.config.properties.DiarizationProperties;
import com.phillippitts.voicelink.config.properties.EnhancementProperties;
import com.phillippitts.voicelink.config.properties.TranscriptionProperties;
import com.phillippitts.voicelink.config.properties.WordReplacementProperties;
import com.phillippitts.voicelink.config.stt.CloudSttConfig;
import com.phillippitts.voicelink.config.stt.WhisperConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        WhisperConfig.class,
        CloudSttConfig.class,
        FfmpegConfig.class,
        TranscriptionProperties.class,
        WordReplacementProperties.class,
        EnhancementProperties.class,
        DiarizationProperties.class
})
public class VoiceLinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceLinkApplication.class, args);
    }

}
