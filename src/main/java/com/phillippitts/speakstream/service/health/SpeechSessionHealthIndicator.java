package com.phillippitts.speakstream.service.health;

import com.phillippitts.speakstream.service.session.SessionStats;
import com.phillippitts.speakstream.service.session.SpeechSession;
import com.phillippitts.speakstream.service.session.SpeechSessionManager;
import com.phillippitts.speakstream.service.synthesis.NoopSynthesisProvider;
import com.phillippitts.speakstream.service.synthesis.SynthesisProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for the speech pipeline.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: A real synthesis provider is configured</li>
 *   <li>DEGRADED: Only the no-op provider is configured, so every response will be silent</li>
 * </ul>
 * Details list the active sessions with their synthesis and playback state.
 *
 * <p>Exposed via /actuator/health when Actuator endpoints are published.
 */
@Component
public class SpeechSessionHealthIndicator implements HealthIndicator {

    private final SpeechSessionManager sessionManager;
    private final SynthesisProvider provider;

    public SpeechSessionHealthIndicator(SpeechSessionManager sessionManager, SynthesisProvider provider) {
        this.sessionManager = sessionManager;
        this.provider = provider;
    }

    @Override
    public Health health() {
        List<SpeechSession> sessions = sessionManager.activeSessions();
        Map<String, String> details = new LinkedHashMap<>();
        for (SpeechSession session : sessions) {
            details.put(session.getChannelId(), describe(session.stats()));
        }

        Health.Builder builder = provider instanceof NoopSynthesisProvider
                ? new Health.Builder().status("DEGRADED").withDetail("status", "No synthesis provider configured")
                : new Health.Builder().up().withDetail("status", "Synthesis provider configured");
        return builder
                .withDetail("provider", provider.getProviderName())
                .withDetail("activeSessions", sessions.size())
                .withDetail("sessions", details)
                .build();
    }

    private String describe(SessionStats stats) {
        return "session=" + stats.sessionId()
                + ", queued=" + stats.synthesis().queued()
                + ", inFlight=" + stats.synthesis().inFlight()
                + ", played=" + stats.playback().played()
                + ", playback=" + stats.playback().state();
    }
}
