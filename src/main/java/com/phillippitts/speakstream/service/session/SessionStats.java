package com.phillippitts.speakstream.service.session;

import com.phillippitts.speakstream.service.playback.PlaybackStats;
import com.phillippitts.speakstream.service.synthesis.SynthesisQueueStats;

/**
 * Snapshot of one session.
 *
 * @param sessionId session id
 * @param channelId channel id
 * @param chunksEmitted chunks produced by the parser so far
 * @param streamFinished whether the text stream has ended
 * @param interrupted whether the response was interrupted
 * @param fallbackFrom first sequence number replaced by fallback re-synthesis, or -1
 * @param synthesis synthesis queue counters
 * @param playback playback queue counters
 */
public record SessionStats(
        String sessionId,
        String channelId,
        int chunksEmitted,
        boolean streamFinished,
        boolean interrupted,
        int fallbackFrom,
        SynthesisQueueStats synthesis,
        PlaybackStats playback
) {}
