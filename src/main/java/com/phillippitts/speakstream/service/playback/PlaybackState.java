package com.phillippitts.speakstream.service.playback;

/** Lifecycle of a {@link PlaybackQueue}. */
public enum PlaybackState {
    /** Accepting and playing segments. */
    ACTIVE,
    /** Interrupted with DRAIN: playing the kept segments, accepting nothing new. */
    DRAINING,
    /** Interrupted; nothing more will play. */
    STOPPED,
    /** Closed by its owner. */
    CLOSED
}
