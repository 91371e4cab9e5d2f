package com.phillippitts.voicelink.service.diarization;

import com.phillippitts.voicelink.config.properties.DiarizationProperties;
import com.phillippitts.voicelink.exception.DiarizationMethodNotImplementedException;
import com.phillippitts.voicelink.exception.DiarizationUnavailableException;
import com.phillippitts.voicelink.service.audio.AudioFormat;
import com.phillippitts.voicelink.service.audio.DecodedAudio;
import com.phillippitts.voicelink.service.stt.TranscriptSegment;
import com.phillippitts.voicelink.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Produces speaker segments for a recording.
 *
 * <p>Method selection, in order:
 * <ol>
 *   <li>an explicit {@code diarization_method}</li>
 *   <li>{@link DiarizationMethod#TINYDIARIZE} when {@code use_tinydiarize} is set</li>
 *   <li>{@link DiarizationMethod#STEREO} when the upload has two or more channels</li>
 *   <li>{@link DiarizationMethod#TINYDIARIZE} otherwise</li>
 * </ol>
 * A result without any speaker segment is reported as {@link DiarizationUnavailableException}.
 */
@Service
public class SpeakerDiarizationService {

    private static final Logger LOG = LogManager.getLogger(SpeakerDiarizationService.class);

    private final DiarizationProperties properties;
    private final StereoChannelDiarizer stereo;

    public SpeakerDiarizationService(DiarizationProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.stereo = new StereoChannelDiarizer(properties.silenceThreshold());
    }

    /**
     * Picks the method for a request before transcription, so the engine can be asked for
     * speaker turns when needed.
     */
    public DiarizationMethod selectMethod(DiarizationParameters params, int channelCount) {
        if (params.method() != null) {
            return params.method();
        }
        if (params.useTinydiarize()) {
            return DiarizationMethod.TINYDIARIZE;
        }
        return channelCount >= 2 ? DiarizationMethod.STEREO : DiarizationMethod.TINYDIARIZE;
    }

    /**
     * @throws DiarizationMethodNotImplementedException for methods this server does not provide
     * @throws DiarizationUnavailableException when no speaker segment could be produced
     */
    public DiarizationResult diarize(DecodedAudio audio, List<TranscriptSegment> transcript,
                                     DiarizationParameters params) {
        Objects.requireNonNull(audio, "audio");
        Objects.requireNonNull(transcript, "transcript");
        long start = System.nanoTime();

        DiarizationMethod method = selectMethod(params, audio.channelCount());
        LOG.info("Diarizing with method={}, mode={}, channels={}", method.wireName(), params.mode().wireName(),
                audio.channelCount());

        List<DiarizationSegment> segments = switch (method) {
            case STEREO -> {
                if (!audio.isMultiChannel()) {
                    throw new DiarizationUnavailableException("stereo separation needs at least two channels");
                }
                yield stereo.diarize(audio.channels().get(0), audio.channels().get(1),
                        AudioFormat.TARGET_SAMPLE_RATE, params.mode());
            }
            case TINYDIARIZE -> TinydiarizeTurns.fromTranscript(transcript, maxSpeakers(params));
            case PYANNOTE -> throw new DiarizationMethodNotImplementedException(method.wireName());
        };

        if (segments.isEmpty()) {
            throw new DiarizationUnavailableException(method.wireName() + " produced no speaker segments");
        }

        DiarizationResult result = DiarizationResult.of(segments, audio.durationSeconds(), method)
                .withProcessingTime(TimeUtils.elapsedSeconds(start));
        if (params.minSpeakers() != null && result.numSpeakers() < params.minSpeakers()) {
            LOG.debug("Found {} speaker(s), fewer than min_speakers={}", result.numSpeakers(), params.minSpeakers());
        }
        LOG.info("Diarization completed in {} ms: {} speakers, {} segments",
                TimeUtils.elapsedMillis(start), result.numSpeakers(), result.segments().size());
        return result;
    }

    private int maxSpeakers(DiarizationParameters params) {
        return params.maxSpeakers() != null ? params.maxSpeakers() : properties.defaultMaxSpeakers();
    }
}
