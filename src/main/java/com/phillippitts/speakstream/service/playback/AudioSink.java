package com.phillippitts.speakstream.service.playback;

import java.util.concurrent.CompletableFuture;

/**
 * Destination for synthesized audio, typically a voice-channel connection.
 *
 * <p>Only "accept bytes, signal when done" is required. {@link PlaybackQueue} calls
 * {@link #play(byte[])} for one segment at a time and waits for the returned future before the
 * next call.
 */
public interface AudioSink {

    /**
     * Starts playing one segment.
     *
     * @param audio opaque audio bytes from the synthesis provider
     * @return future completed when playback ends, or completed exceptionally on a sink failure
     */
    CompletableFuture<Void> play(byte[] audio);

    /**
     * Stops the segment that is playing right now, if any. Must be safe to call at any time.
     */
    void stop();
}
