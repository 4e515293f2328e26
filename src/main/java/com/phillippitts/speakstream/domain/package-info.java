/**
 * Immutable values that flow through the spoken-response pipeline:
 * {@link com.phillippitts.speakstream.domain.TextChunk} from the parser,
 * {@link com.phillippitts.speakstream.domain.AudioSegment} from synthesis, and the session's
 * {@link com.phillippitts.speakstream.domain.VoiceParams}.
 */
package com.phillippitts.speakstream.domain;
