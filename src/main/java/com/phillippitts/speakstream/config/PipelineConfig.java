package com.phillippitts.speakstream.config;

import com.phillippitts.speakstream.service.synthesis.NoopSynthesisProvider;
import com.phillippitts.speakstream.service.synthesis.SynthesisProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires pipeline collaborators that applications may override.
 */
@Configuration
public class PipelineConfig {

    private static final Logger LOG = LogManager.getLogger(PipelineConfig.class);

    /**
     * Fallback provider used when the application does not define its own
     * {@link SynthesisProvider} bean. Every synthesis call fails.
     */
    @Bean
    @ConditionalOnMissingBean(SynthesisProvider.class)
    public SynthesisProvider synthesisProvider() {
        LOG.warn("No SynthesisProvider bean defined; using no-op provider (all synthesis calls will fail)");
        return new NoopSynthesisProvider();
    }
}
