/**
 * Bounded-concurrency speech synthesis.
 *
 * <p>{@link com.phillippitts.speakstream.service.synthesis.SynthesisQueueManager} admits text
 * chunks in order, runs at most {@code max-concurrent} provider calls at a time and reports each
 * outcome through a {@link com.phillippitts.speakstream.service.synthesis.SynthesisListener}.
 * The provider itself sits behind
 * {@link com.phillippitts.speakstream.service.synthesis.SynthesisProvider}.
 */
package com.phillippitts.speakstream.service.synthesis;
