/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.speakstream.exception.SpeakStreamException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.speakstream.exception.ParseBufferOverflowException} - Thrown when
 *       the sentence parser buffers too much text without a boundary (fatal)</li>
 *   <li>{@link com.phillippitts.speakstream.exception.SynthesisException} - Failure of one synthesis
 *       task, specialised as {@link com.phillippitts.speakstream.exception.SynthesisTimeoutException}
 *       and {@link com.phillippitts.speakstream.exception.SynthesisProviderException}</li>
 *   <li>{@link com.phillippitts.speakstream.exception.PlaybackSinkException} - The audio sink failed
 *       for one segment</li>
 * </ul>
 *
 * <p>Synthesis and playback exceptions are absorbed inside the pipeline and reported through
 * callbacks, events and metrics. Only parser overflow and API misuse propagate to callers.
 * Cancellation is not an error and has no exception type here.
 *
 * @since 1.0
 */
package com.phillippitts.speakstream.exception;
