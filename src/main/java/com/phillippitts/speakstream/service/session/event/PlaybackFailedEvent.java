package com.phillippitts.speakstream.service.session.event;

import java.time.Instant;

/**
 * Emitted when the audio sink failed to play one segment. Playback continues with the next one.
 */
public record PlaybackFailedEvent(
        String sessionId,
        String channelId,
        int sequenceNumber,
        String message,
        Instant timestamp
) {}
