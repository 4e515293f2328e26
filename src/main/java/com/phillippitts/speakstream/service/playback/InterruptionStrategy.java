package com.phillippitts.speakstream.service.playback;

/**
 * How a response is cut short when the user starts speaking again.
 */
public enum InterruptionStrategy {
    /** Stop mid-segment and discard everything not yet played. */
    IMMEDIATE,
    /** Finish the current segment, then discard the rest. */
    GRACEFUL,
    /** Finish the current segment plus up to N segments that are already next in line. */
    DRAIN
}
