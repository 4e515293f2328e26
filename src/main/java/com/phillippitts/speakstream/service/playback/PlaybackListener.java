package com.phillippitts.speakstream.service.playback;

import com.phillippitts.speakstream.exception.PlaybackSinkException;

/**
 * Receives per-segment playback outcomes. Called on the playback worker thread, in sequence
 * order. Segments stopped by an IMMEDIATE interruption produce no callback.
 */
public interface PlaybackListener {

    void onComplete(PlaybackMetadata metadata);

    void onError(PlaybackSinkException error, PlaybackMetadata metadata);
}
