package com.phillippitts.speakstream.service.session.event;

import java.time.Duration;
import java.time.Instant;

/**
 * Emitted after a segment finished playing. Carries the spoken text so that listeners can log
 * or persist what the user actually heard.
 *
 * @param sessionId session that played the segment
 * @param channelId channel the session speaks on
 * @param sequenceNumber sequence number of the segment
 * @param text spoken text
 * @param playDuration time the sink took to play it
 * @param timestamp when playback finished
 */
public record SegmentPlayedEvent(
        String sessionId,
        String channelId,
        int sequenceNumber,
        String text,
        Duration playDuration,
        Instant timestamp
) {}
