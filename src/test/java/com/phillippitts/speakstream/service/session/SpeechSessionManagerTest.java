package com.phillippitts.speakstream.service.session;

import com.phillippitts.speakstream.config.properties.SpeechPipelineProperties;
import com.phillippitts.speakstream.domain.VoiceParams;
import com.phillippitts.speakstream.service.playback.InterruptionStrategy;
import com.phillippitts.speakstream.service.session.event.ResponseInterruptedEvent;
import com.phillippitts.speakstream.testutil.EventCapturingPublisher;
import com.phillippitts.speakstream.testutil.RecordingAudioSink;
import com.phillippitts.speakstream.testutil.ScriptedSynthesisProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class SpeechSessionManagerTest {

    private ExecutorService executor;
    private EventCapturingPublisher events;
    private SpeechPipelineProperties properties;
    private SpeechSessionManager manager;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        events = new EventCapturingPublisher();
        properties = new SpeechPipelineProperties();
        properties.setDefaultVoiceId("narrator");
        properties.setDefaultSpeed(1.5);
        manager = new SpeechSessionManager(properties,
                new SessionResources(new ScriptedSynthesisProvider(), executor, executor, null, events));
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
        executor.shutdownNow();
    }

    @Test
    void shouldOpenSessionWithDefaultVoice() {
        SpeechSession session = manager.openSession("general", new RecordingAudioSink());

        assertThat(session.getVoice()).isEqualTo(new VoiceParams("narrator", 1.5));
        assertThat(manager.getSession("general")).containsSame(session);
        assertThat(manager.activeSessionCount()).isEqualTo(1);
    }

    @Test
    void shouldSupersedeSessionOnSameChannel() {
        RecordingAudioSink firstSink = new RecordingAudioSink().holdOn("An old answer.");
        SpeechSession first = manager.openSession("general", firstSink);
        first.acceptText("An old answer. ");
        await().atMost(Duration.ofSeconds(5)).until(() -> firstSink.played.size() == 1);

        SpeechSession second = manager.openSession("general", new RecordingAudioSink());

        assertThat(first.isClosed()).isTrue();
        assertThat(firstSink.stopCalls.get()).isGreaterThanOrEqualTo(1);
        assertThat(manager.getSession("general")).containsSame(second);
        assertThat(manager.activeSessionCount()).isEqualTo(1);
        assertThat(events.eventsOf(ResponseInterruptedEvent.class))
                .extracting(ResponseInterruptedEvent::strategy)
                .containsExactly(InterruptionStrategy.IMMEDIATE);
    }

    @Test
    void shouldKeepChannelsIndependent() {
        manager.openSession("general", new RecordingAudioSink());
        manager.openSession("music", new RecordingAudioSink(), VoiceParams.of("bass"));

        assertThat(manager.activeSessionCount()).isEqualTo(2);
        assertThat(manager.getSession("music").map(SpeechSession::getVoice))
                .contains(VoiceParams.of("bass"));
    }

    @Test
    void closedSessionShouldLeaveRegistry() {
        SpeechSession session = manager.openSession("general", new RecordingAudioSink());

        session.close();

        assertThat(manager.getSession("general")).isEmpty();
        assertThat(manager.closeSession("general")).isFalse();
    }

    @Test
    void interruptShouldUseConfiguredStrategy() {
        properties.setInterruptionStrategy(InterruptionStrategy.DRAIN);
        manager.openSession("general", new RecordingAudioSink());

        assertThat(manager.interrupt("general")).isTrue();
        assertThat(manager.interrupt("unknown")).isFalse();
        assertThat(events.eventsOf(ResponseInterruptedEvent.class))
                .extracting(ResponseInterruptedEvent::strategy)
                .containsExactly(InterruptionStrategy.DRAIN);
    }

    @Test
    void shutdownShouldCloseEverySession() {
        SpeechSession a = manager.openSession("a", new RecordingAudioSink());
        SpeechSession b = manager.openSession("b", new RecordingAudioSink());

        manager.logSessionSummary();
        manager.shutdown();

        assertThat(a.isClosed()).isTrue();
        assertThat(b.isClosed()).isTrue();
        assertThat(manager.activeSessionCount()).isZero();
    }
}
