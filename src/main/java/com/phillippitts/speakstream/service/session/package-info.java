/**
 * Per-response pipeline context.
 *
 * <p>A {@link com.phillippitts.speakstream.service.session.SpeechSession} owns one sentence
 * parser, one synthesis queue manager and one playback queue. Nothing is shared between
 * sessions except the executors and the provider client.
 * {@link com.phillippitts.speakstream.service.session.SpeechSessionManager} keeps at most one
 * active session per channel.
 */
package com.phillippitts.speakstream.service.session;
