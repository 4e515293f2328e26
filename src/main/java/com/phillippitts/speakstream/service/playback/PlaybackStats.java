package com.phillippitts.speakstream.service.playback;

/**
 * Point-in-time counters of a {@link PlaybackQueue}.
 *
 * @param state current lifecycle state
 * @param nextExpected next sequence number that may become ready
 * @param buffered segments in the reorder buffer waiting for a predecessor
 * @param ready segments next in line, not yet playing
 * @param playing whether a segment is at the sink right now
 * @param played segments played to completion
 * @param failed segments the sink failed on
 * @param discarded segments dropped by interruption, fallback or late arrival
 */
public record PlaybackStats(
        PlaybackState state,
        int nextExpected,
        int buffered,
        int ready,
        boolean playing,
        long played,
        long failed,
        long discarded
) {
}
