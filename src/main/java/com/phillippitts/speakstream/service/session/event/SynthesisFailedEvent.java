package com.phillippitts.speakstream.service.session.event;

import java.time.Instant;

/**
 * Emitted when a chunk could not be synthesized after the failure policy ran.
 *
 * @param sessionId session that owns the chunk
 * @param channelId channel the session speaks on
 * @param sequenceNumber sequence number of the chunk
 * @param reason short category ("timeout", "provider", "fallback")
 * @param message error message
 * @param timestamp when the failure was reported
 */
public record SynthesisFailedEvent(
        String sessionId,
        String channelId,
        int sequenceNumber,
        String reason,
        String message,
        Instant timestamp
) {}
