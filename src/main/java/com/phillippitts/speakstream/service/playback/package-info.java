/**
 * Strict-order, interruptible audio playback.
 *
 * <p>{@link com.phillippitts.speakstream.service.playback.PlaybackQueue} restores sequence order
 * with a reorder buffer and plays one segment at a time through an
 * {@link com.phillippitts.speakstream.service.playback.AudioSink}.
 */
package com.phillippitts.speakstream.service.playback;
