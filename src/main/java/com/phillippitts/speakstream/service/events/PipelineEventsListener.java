package com.phillippitts.speakstream.service.events;

import com.phillippitts.speakstream.service.session.event.PlaybackFailedEvent;
import com.phillippitts.speakstream.service.session.event.ResponseInterruptedEvent;
import com.phillippitts.speakstream.service.session.event.SegmentPlayedEvent;
import com.phillippitts.speakstream.service.session.event.SynthesisFailedEvent;
import com.phillippitts.speakstream.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central log output for pipeline events. Spoken text is previewed only, and repeated failure
 * warnings are throttled per channel and reason to avoid log spam.
 */
@Component
class PipelineEventsListener {
    private static final Logger LOG = LogManager.getLogger(PipelineEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onSynthesisFailed(SynthesisFailedEvent e) {
        String key = "synthesis-" + e.channelId() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Synthesis failing on channel {}: reason={}, seq={}, message={}. "
                    + "Check the synthesis provider.", e.channelId(), e.reason(), e.sequenceNumber(), e.message());
        }
    }

    @EventListener
    void onPlaybackFailed(PlaybackFailedEvent e) {
        String key = "playback-" + e.channelId();
        if (shouldLog(key)) {
            LOG.warn("Audio sink failing on channel {}: seq={}, message={}. Check the voice connection.",
                    e.channelId(), e.sequenceNumber(), e.message());
        }
    }

    @EventListener
    void onResponseInterrupted(ResponseInterruptedEvent e) {
        LOG.info("Response on channel {} interrupted ({}): {} task(s) cancelled, {} segment(s) discarded",
                e.channelId(), e.strategy(), e.tasksCancelled(), e.segmentsDiscarded());
    }

    @EventListener
    void onSegmentPlayed(SegmentPlayedEvent e) {
        LOG.debug("Played seq={} on channel {}: '{}'", e.sequenceNumber(), e.channelId(),
                LogSanitizer.preview(e.text(), 80));
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
