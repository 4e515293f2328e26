package com.phillippitts.speakstream.service.session;

import com.phillippitts.speakstream.config.ThreadPoolConfig;
import com.phillippitts.speakstream.config.properties.SpeechPipelineProperties;
import com.phillippitts.speakstream.config.properties.ThreadPoolProperties;
import com.phillippitts.speakstream.domain.AudioSegment;
import com.phillippitts.speakstream.domain.VoiceParams;
import com.phillippitts.speakstream.exception.PlaybackSinkException;
import com.phillippitts.speakstream.exception.SynthesisException;
import com.phillippitts.speakstream.service.playback.PlaybackListener;
import com.phillippitts.speakstream.service.playback.PlaybackMetadata;
import com.phillippitts.speakstream.service.playback.PlaybackQueue;
import com.phillippitts.speakstream.service.synthesis.FailurePolicy;
import com.phillippitts.speakstream.service.synthesis.SynthesisListener;
import com.phillippitts.speakstream.service.synthesis.SynthesisQueueManager;
import com.phillippitts.speakstream.service.synthesis.SynthesisSettings;
import com.phillippitts.speakstream.testutil.RecordingAudioSink;
import com.phillippitts.speakstream.testutil.ScriptedSynthesisProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Several sessions sharing the executors built by {@link ThreadPoolConfig} with default sizing.
 */
class SharedExecutorSessionsTest {

    private static final VoiceParams VOICE = VoiceParams.of("test-voice");

    private ThreadPoolTaskExecutor synthesisExecutor;
    private ThreadPoolTaskExecutor playbackExecutor;
    private final List<AutoCloseable> opened = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        synthesisExecutor = (ThreadPoolTaskExecutor) config.synthesisExecutor();
        playbackExecutor = (ThreadPoolTaskExecutor) config.playbackExecutor();
    }

    @AfterEach
    void tearDown() throws Exception {
        for (AutoCloseable closeable : opened) {
            closeable.close();
        }
        synthesisExecutor.shutdown();
        playbackExecutor.shutdown();
    }

    @Test
    void everyChannelShouldStartPlayingWhileOthersAreStillSpeaking() {
        int channels = 4;
        List<RecordingAudioSink> sinks = new ArrayList<>();
        List<PlaybackQueue> queues = new ArrayList<>();
        for (int i = 0; i < channels; i++) {
            RecordingAudioSink sink = new RecordingAudioSink().holdOn("a");
            PlaybackQueue queue = new PlaybackQueue(sink, playbackExecutor, new NoOpPlaybackListener(), null);
            opened.add(queue);
            sinks.add(sink);
            queues.add(queue);
        }

        for (PlaybackQueue queue : queues) {
            queue.enqueue(0, segment(0, "a"));
            queue.enqueue(1, segment(1, "b"));
        }

        await().atMost(Duration.ofSeconds(2))
                .until(() -> sinks.stream().allMatch(sink -> sink.played.size() == 1));
        sinks.forEach(sink -> sink.release("a"));

        await().atMost(Duration.ofSeconds(5)).until(() -> queues.stream().allMatch(PlaybackQueue::isIdle));
        for (RecordingAudioSink sink : sinks) {
            assertThat(sink.played).containsExactly("a", "b");
        }
    }

    @Test
    void sessionsAtFullConcurrencyShouldNotTimeOutWaitingForEachOther() {
        ScriptedSynthesisProvider provider = new ScriptedSynthesisProvider(300);
        SynthesisSettings settings = new SynthesisSettings(3, FailurePolicy.SKIP, 0, Duration.ofMillis(500));
        CountingListener first = new CountingListener();
        CountingListener second = new CountingListener();
        SynthesisQueueManager firstManager = new SynthesisQueueManager(provider, synthesisExecutor, settings,
                VOICE, first, null);
        SynthesisQueueManager secondManager = new SynthesisQueueManager(provider, synthesisExecutor, settings,
                VOICE, second, null);
        opened.add(firstManager);
        opened.add(secondManager);

        for (int i = 0; i < 3; i++) {
            firstManager.enqueue("First session sentence " + i + ".");
            secondManager.enqueue("Second session sentence " + i + ".");
        }

        await().atMost(Duration.ofSeconds(5))
                .until(() -> first.completed.size() + first.errors.size() == 3
                        && second.completed.size() + second.errors.size() == 3);
        assertThat(first.errors).isEmpty();
        assertThat(second.errors).isEmpty();
        assertThat(provider.peakInFlight()).isEqualTo(6);
    }

    @Test
    void concurrentSessionsShouldEachSpeakTheirWholeResponse() {
        SpeechPipelineProperties properties = new SpeechPipelineProperties();
        properties.setMinChunkLength(5);
        properties.setMaxConcurrent(3);
        properties.setSynthesisTimeoutMs(2_000);
        ScriptedSynthesisProvider provider = new ScriptedSynthesisProvider(20);
        SessionResources resources = new SessionResources(provider, synthesisExecutor, playbackExecutor,
                null, null);

        int channels = 4;
        Map<String, RecordingAudioSink> sinks = new ConcurrentHashMap<>();
        List<SpeechSession> sessions = new ArrayList<>();
        for (int i = 0; i < channels; i++) {
            String channel = "channel-" + i;
            RecordingAudioSink sink = new RecordingAudioSink().holdOn(channel + " starts.");
            SpeechSession session = new SpeechSession(channel, sink, VOICE, properties, resources);
            opened.add(session);
            sinks.put(channel, sink);
            sessions.add(session);
        }

        for (SpeechSession session : sessions) {
            String channel = session.getChannelId();
            session.acceptText(channel + " starts. Then it goes on. And it ends.");
            session.finishStream();
        }

        await().atMost(Duration.ofSeconds(5))
                .until(() -> sinks.values().stream().allMatch(sink -> sink.played.size() == 1));
        sinks.forEach((channel, sink) -> sink.release(channel + " starts."));

        await().atMost(Duration.ofSeconds(5)).until(() -> sessions.stream().allMatch(SpeechSession::isComplete));
        sinks.forEach((channel, sink) ->
                assertThat(sink.played).containsExactly(channel + " starts.", "Then it goes on.", "And it ends."));
    }

    private static AudioSegment segment(int seq, String text) {
        return new AudioSegment(seq, text.getBytes(StandardCharsets.UTF_8), text, Duration.ZERO);
    }

    private static final class NoOpPlaybackListener implements PlaybackListener {
        @Override
        public void onComplete(PlaybackMetadata metadata) {
        }

        @Override
        public void onError(PlaybackSinkException error, PlaybackMetadata metadata) {
        }
    }

    private static final class CountingListener implements SynthesisListener {
        final List<Integer> completed = new CopyOnWriteArrayList<>();
        final Map<Integer, SynthesisException> errors = new ConcurrentHashMap<>();

        @Override
        public void onComplete(int sequenceNumber, AudioSegment segment) {
            completed.add(sequenceNumber);
        }

        @Override
        public void onError(int sequenceNumber, SynthesisException error) {
            errors.put(sequenceNumber, error);
        }
    }
}
