package com.phillippitts.speakstream.service.session;

import com.phillippitts.speakstream.config.properties.SpeechPipelineProperties;
import com.phillippitts.speakstream.domain.VoiceParams;
import com.phillippitts.speakstream.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.speakstream.service.playback.AudioSink;
import com.phillippitts.speakstream.service.playback.InterruptionStrategy;
import com.phillippitts.speakstream.service.synthesis.SynthesisProvider;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * Registry of active speech sessions, one per channel.
 *
 * <p>Opening a response on a channel that is still speaking supersedes the old session: it is
 * interrupted immediately and closed before the new one is registered. Closed sessions remove
 * themselves from the registry.
 */
@Service
public class SpeechSessionManager {

    private static final Logger LOG = LogManager.getLogger(SpeechSessionManager.class);

    private final SpeechPipelineProperties properties;
    private final SessionResources resources;
    private final ConcurrentMap<String, SpeechSession> sessions = new ConcurrentHashMap<>();

    @Autowired
    public SpeechSessionManager(SpeechPipelineProperties properties,
                                SynthesisProvider provider,
                                @Qualifier("synthesisExecutor") Executor synthesisExecutor,
                                @Qualifier("playbackExecutor") Executor playbackExecutor,
                                PipelineMetricsPublisher metrics,
                                ApplicationEventPublisher publisher) {
        this(properties, new SessionResources(provider, synthesisExecutor, playbackExecutor, metrics, publisher));
    }

    public SpeechSessionManager(SpeechPipelineProperties properties, SessionResources resources) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.resources = Objects.requireNonNull(resources, "resources");
        LOG.info("SpeechSessionManager ready: provider={}, maxConcurrent={}, errorStrategy={}, interruption={}",
                resources.provider().getProviderName(), properties.getMaxConcurrent(),
                properties.getErrorStrategy(), properties.getInterruptionStrategy());
    }

    /**
     * Opens a session with the default voice.
     */
    public SpeechSession openSession(String channelId, AudioSink sink) {
        return openSession(channelId, sink,
                new VoiceParams(properties.getDefaultVoiceId(), properties.getDefaultSpeed()));
    }

    /**
     * Opens a new response on a channel, superseding any session still active there.
     *
     * @param channelId channel to speak on
     * @param sink audio sink of the channel
     * @param voice voice parameters for this response
     * @return the new session
     */
    public SpeechSession openSession(String channelId, AudioSink sink, VoiceParams voice) {
        Objects.requireNonNull(channelId, "channelId");
        SpeechSession session = new SpeechSession(channelId, sink, voice, properties, resources);
        session.onClose(() -> {
            if (sessions.remove(channelId, session)) {
                LOG.debug("Session {} removed from channel {}", session.getSessionId(), channelId);
            }
        });
        SpeechSession previous = sessions.put(channelId, session);
        if (previous != null) {
            LOG.info("Superseding session {} on channel {} with {}", previous.getSessionId(), channelId,
                    session.getSessionId());
            previous.interrupt(InterruptionStrategy.IMMEDIATE);
            previous.close();
        }
        return session;
    }

    public Optional<SpeechSession> getSession(String channelId) {
        return Optional.ofNullable(sessions.get(channelId));
    }

    /**
     * Interrupts the session active on a channel, if any, with the configured strategy.
     *
     * @return true if a session was interrupted
     */
    public boolean interrupt(String channelId) {
        SpeechSession session = sessions.get(channelId);
        if (session == null) {
            return false;
        }
        session.interrupt();
        return true;
    }

    /**
     * Closes and removes the session on a channel.
     *
     * @return true if a session was closed
     */
    public boolean closeSession(String channelId) {
        SpeechSession session = sessions.get(channelId);
        if (session == null) {
            return false;
        }
        session.close();
        return true;
    }

    public List<SpeechSession> activeSessions() {
        return new ArrayList<>(sessions.values());
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    @Scheduled(fixedRate = 60_000)
    void logSessionSummary() {
        if (sessions.isEmpty()) {
            return;
        }
        StringBuilder sb = new StringBuilder("Active speech sessions: ");
        sessions.forEach((channel, session) -> {
            SessionStats stats = session.stats();
            sb.append(channel).append('=').append(stats.sessionId())
                    .append("[chunks=").append(stats.chunksEmitted())
                    .append(", played=").append(stats.playback().played())
                    .append(", playback=").append(stats.playback().state())
                    .append("] ");
        });
        LOG.info(sb.toString().trim());
    }

    @PreDestroy
    void shutdown() {
        List<SpeechSession> open = activeSessions();
        if (!open.isEmpty()) {
            LOG.info("Closing {} active speech session(s)", open.size());
        }
        open.forEach(SpeechSession::close);
    }
}
