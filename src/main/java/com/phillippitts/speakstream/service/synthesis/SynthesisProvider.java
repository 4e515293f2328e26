package com.phillippitts.speakstream.service.synthesis;

import com.phillippitts.speakstream.domain.VoiceParams;
import com.phillippitts.speakstream.exception.SynthesisException;

import java.time.Duration;

/**
 * Contract for text-to-speech providers. Only the request/response shape is consumed here;
 * transport and authentication belong to the implementation.
 *
 * <p>Thread Safety: Implementations must be thread-safe. Up to {@code max-concurrent} calls per
 * session run at the same time, from several sessions at once.
 */
public interface SynthesisProvider {

    /**
     * Synthesizes one piece of text. Blocking; may perform network I/O.
     *
     * <p>The caller enforces {@code timeout} independently, so implementations may treat it as a
     * hint for their own transport timeouts.
     *
     * @param text text to speak (never blank)
     * @param voice voice parameters of the session
     * @param timeout time budget for this call
     * @return encoded audio bytes, handed to the audio sink unchanged
     * @throws SynthesisException if the provider fails
     */
    byte[] synthesize(String text, VoiceParams voice, Duration timeout);

    /**
     * @return provider name for logging and monitoring
     */
    default String getProviderName() {
        return getClass().getSimpleName();
    }
}
