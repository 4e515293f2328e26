package com.phillippitts.speakstream.service.synthesis;

import com.phillippitts.speakstream.domain.VoiceParams;
import com.phillippitts.speakstream.exception.SynthesisProviderException;

import java.time.Duration;

/**
 * Placeholder provider registered when the application defines none. Every call fails, so
 * sessions still run and degrade through their failure policy instead of failing to start.
 */
public class NoopSynthesisProvider implements SynthesisProvider {

    @Override
    public byte[] synthesize(String text, VoiceParams voice, Duration timeout) {
        throw new SynthesisProviderException("No synthesis provider configured");
    }

    @Override
    public String getProviderName() {
        return "noop";
    }
}
