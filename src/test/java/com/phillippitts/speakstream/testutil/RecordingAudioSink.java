package com.phillippitts.speakstream.testutil;

import com.phillippitts.speakstream.service.playback.AudioSink;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for AudioSink that decodes audio as UTF-8 text and records it.
 *
 * <p>Playback completes at once unless the text was registered with {@link #holdOn(String)}
 * (completes on {@link #release(String)}) or {@link #failOn(String)} (completes exceptionally).
 */
public class RecordingAudioSink implements AudioSink {

    public final List<String> played = new CopyOnWriteArrayList<>();
    public final List<Long> playedAtNanos = new CopyOnWriteArrayList<>();
    public final AtomicInteger stopCalls = new AtomicInteger();

    private final Set<String> holds = ConcurrentHashMap.newKeySet();
    private final Set<String> failures = ConcurrentHashMap.newKeySet();
    private final Map<String, CompletableFuture<Void>> held = new ConcurrentHashMap<>();

    public RecordingAudioSink holdOn(String text) {
        holds.add(text);
        return this;
    }

    public RecordingAudioSink failOn(String text) {
        failures.add(text);
        return this;
    }

    public void release(String text) {
        CompletableFuture<Void> future = held.get(text);
        if (future != null) {
            future.complete(null);
        }
    }

    @Override
    public CompletableFuture<Void> play(byte[] audio) {
        String text = new String(audio, StandardCharsets.UTF_8);
        CompletableFuture<Void> result;
        if (failures.contains(text)) {
            result = CompletableFuture.failedFuture(new IllegalStateException("Sink rejected '" + text + "'"));
        } else if (holds.contains(text)) {
            result = new CompletableFuture<>();
            held.put(text, result);
        } else {
            result = CompletableFuture.completedFuture(null);
        }
        // Recorded last so a test that sees the text can release it
        playedAtNanos.add(System.nanoTime());
        played.add(text);
        return result;
    }

    @Override
    public void stop() {
        stopCalls.incrementAndGet();
    }
}
