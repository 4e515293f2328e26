package com.phillippitts.speakstream.service.playback;

import java.time.Duration;

/**
 * Describes one segment handed to the audio sink.
 *
 * @param sequenceNumber sequence number of the segment
 * @param text text that was spoken
 * @param sizeBytes audio size
 * @param synthesisLatency time the provider took to produce the audio
 * @param queueWait time between arrival in the playback queue and the start of playback
 * @param playDuration time the sink took to play (or to fail)
 */
public record PlaybackMetadata(
        int sequenceNumber,
        String text,
        int sizeBytes,
        Duration synthesisLatency,
        Duration queueWait,
        Duration playDuration
) {
}
