package com.phillippitts.speakstream.service.session.event;

import com.phillippitts.speakstream.service.playback.InterruptionStrategy;

import java.time.Instant;

/**
 * Emitted when a spoken response is cut short.
 *
 * @param sessionId interrupted session
 * @param channelId channel the session speaks on
 * @param strategy how the response was truncated
 * @param tasksCancelled synthesis tasks dropped
 * @param segmentsDiscarded synthesized segments dropped before playing
 * @param timestamp when the interruption happened
 */
public record ResponseInterruptedEvent(
        String sessionId,
        String channelId,
        InterruptionStrategy strategy,
        int tasksCancelled,
        int segmentsDiscarded,
        Instant timestamp
) {}
