package com.phillippitts.speakstream.service.playback;

import com.phillippitts.speakstream.domain.AudioSegment;

/**
 * A segment waiting in the playback queue, stamped with its arrival time.
 */
record PlaybackItem(AudioSegment segment, long enqueuedAtNanos) {

    int sequenceNumber() {
        return segment.sequenceNumber();
    }
}
