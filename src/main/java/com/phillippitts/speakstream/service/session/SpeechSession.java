package com.phillippitts.speakstream.service.session;

import com.phillippitts.speakstream.config.properties.SpeechPipelineProperties;
import com.phillippitts.speakstream.domain.AudioSegment;
import com.phillippitts.speakstream.domain.TextChunk;
import com.phillippitts.speakstream.domain.VoiceParams;
import com.phillippitts.speakstream.exception.ParseBufferOverflowException;
import com.phillippitts.speakstream.exception.PlaybackSinkException;
import com.phillippitts.speakstream.exception.SynthesisException;
import com.phillippitts.speakstream.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.speakstream.service.parser.Abbreviations;
import com.phillippitts.speakstream.service.parser.SentenceParser;
import com.phillippitts.speakstream.service.playback.AudioSink;
import com.phillippitts.speakstream.service.playback.InterruptionStrategy;
import com.phillippitts.speakstream.service.playback.PlaybackListener;
import com.phillippitts.speakstream.service.playback.PlaybackMetadata;
import com.phillippitts.speakstream.service.playback.PlaybackQueue;
import com.phillippitts.speakstream.service.session.event.PlaybackFailedEvent;
import com.phillippitts.speakstream.service.session.event.ResponseInterruptedEvent;
import com.phillippitts.speakstream.service.session.event.SegmentPlayedEvent;
import com.phillippitts.speakstream.service.session.event.SynthesisFailedEvent;
import com.phillippitts.speakstream.service.synthesis.FallbackContext;
import com.phillippitts.speakstream.service.synthesis.SynthesisListener;
import com.phillippitts.speakstream.service.synthesis.SynthesisQueueManager;
import com.phillippitts.speakstream.service.synthesis.SynthesisSettings;
import com.phillippitts.speakstream.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * One spoken response on one channel: a sentence parser, a synthesis queue manager and a
 * playback queue wired together.
 *
 * <p>Text deltas go in through {@link #acceptText(String)}; each emitted chunk is submitted for
 * synthesis, and each synthesized segment is handed to playback, which restores sequence order.
 * Blank chunks and chunks that failed synthesis are reported to playback as skipped so that
 * later segments are not held back.
 *
 * <p>When the FALLBACK failure policy aborts synthesis, everything from the first undelivered
 * chunk onwards is dropped from playback; if {@code speech.pipeline.fallback-resynthesis} is on,
 * that text (plus anything the parser emits afterwards) is synthesized as one plain request once
 * the stream has finished.
 *
 * <p><b>Thread Safety:</b> {@link #acceptText} and {@link #finishStream} must be called from one
 * thread at a time (the text-arrival path). {@link #interrupt}, {@link #close} and
 * {@link #stats} may be called from any thread.
 */
public class SpeechSession implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(SpeechSession.class);

    static final String MDC_SESSION_ID = "sessionId";
    static final String MDC_CHANNEL_ID = "channelId";
    private static final int PREVIEW_CHARS = 60;

    private final String sessionId;
    private final String channelId;
    private final VoiceParams voice;
    private final SpeechPipelineProperties properties;
    private final SessionResources resources;
    private final PipelineMetricsPublisher metrics;

    private final SentenceParser parser;
    private final SynthesisQueueManager synthesis;
    private final PlaybackQueue playback;

    private final Object lock = new Object();
    private final TreeMap<Integer, String> chunkTexts = new TreeMap<>();
    private boolean streamFinished;
    private boolean interrupted;
    private boolean closed;
    private int fallbackFrom = -1;
    private boolean resynthesisStarted;
    private boolean resynthesisPending;
    private Runnable closeHook;

    public SpeechSession(String channelId,
                         AudioSink sink,
                         VoiceParams voice,
                         SpeechPipelineProperties properties,
                         SessionResources resources) {
        this.sessionId = UUID.randomUUID().toString().substring(0, 8);
        this.channelId = Objects.requireNonNull(channelId, "channelId");
        this.voice = Objects.requireNonNull(voice, "voice");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.resources = Objects.requireNonNull(resources, "resources");
        this.metrics = resources.metrics();

        this.parser = new SentenceParser(properties.getMinChunkLength(), properties.getMaxBufferChars(),
                Abbreviations.withAdditional(properties.getAdditionalAbbreviations()));
        this.synthesis = new SynthesisQueueManager(resources.provider(), resources.synthesisExecutor(),
                SynthesisSettings.from(properties), voice, new SynthesisCallbacks(), metrics);
        this.playback = new PlaybackQueue(Objects.requireNonNull(sink, "sink"), resources.playbackExecutor(),
                new PlaybackCallbacks(), metrics);
        LOG.debug("Session {} opened on channel {} (voice={}, policy={}, maxConcurrent={})", sessionId, channelId,
                voice.voiceId(), properties.getErrorStrategy(), properties.getMaxConcurrent());
    }

    /**
     * Feeds the next piece of the text stream.
     *
     * <p>Text arriving after an interruption is ignored.
     *
     * @param delta next text delta
     * @return number of chunks the delta completed
     * @throws ParseBufferOverflowException if the stream runs on without a sentence boundary;
     *         the session is closed before the exception propagates
     * @throws IllegalStateException if the stream was already finished or the session is closed
     */
    public int acceptText(String delta) {
        return inContext(() -> {
            synchronized (lock) {
                ensureOpen();
                if (interrupted) {
                    LOG.debug("Ignoring text after interruption ({} chars)", delta == null ? 0 : delta.length());
                    return 0;
                }
            }
            List<TextChunk> chunks;
            try {
                chunks = parser.addChunk(delta);
            } catch (ParseBufferOverflowException e) {
                LOG.error("Text stream exceeded {} chars without a sentence boundary, closing session",
                        e.getLimit());
                close();
                throw e;
            }
            chunks.forEach(this::route);
            return chunks.size();
        });
    }

    /**
     * Signals the end of the text stream and flushes the parser.
     *
     * @throws IllegalStateException if called twice or after close
     */
    public void finishStream() {
        inContext(() -> {
            synchronized (lock) {
                ensureOpen();
            }
            // Route the last chunk first so re-synthesis sees the whole remainder
            parser.finalizeChunks().ifPresent(this::route);
            synchronized (lock) {
                streamFinished = true;
            }
            LOG.debug("Stream finished after {} chunk(s)", parser.emittedCount());
            startResynthesisIfReady();
            return null;
        });
    }

    /**
     * Interrupts with the configured {@code speech.pipeline.interruption-strategy}.
     */
    public int interrupt() {
        return interrupt(properties.getInterruptionStrategy());
    }

    /**
     * Cuts the response short.
     *
     * <p>IMMEDIATE cancels all synthesis, GRACEFUL drops queued synthesis and lets running calls
     * finish, DRAIN keeps {@code speech.pipeline.drain-count} queued tasks alive.
     *
     * @return number of segments and tasks dropped
     */
    public int interrupt(InterruptionStrategy strategy) {
        Objects.requireNonNull(strategy, "strategy");
        return inContext(() -> {
            synchronized (lock) {
                if (closed || interrupted) {
                    return 0;
                }
                interrupted = true;
            }
            int drainCount = properties.getDrainCount();
            int cancelled = switch (strategy) {
                case IMMEDIATE -> synthesis.cancelAll();
                case GRACEFUL -> synthesis.cancelPending();
                case DRAIN -> synthesis.cancelAfter(drainCount);
            };
            int discarded = playback.interrupt(strategy, drainCount);
            metrics.interruptionTriggered(strategy.name().toLowerCase(Locale.ROOT));
            LOG.info("Response interrupted (strategy={}): {} task(s) cancelled, {} segment(s) discarded",
                    strategy, cancelled, discarded);
            publish(new ResponseInterruptedEvent(sessionId, channelId, strategy, cancelled, discarded, Instant.now()));
            return cancelled + discarded;
        });
    }

    /**
     * @return true once the stream has finished and nothing is left to synthesize or play
     */
    public boolean isComplete() {
        synchronized (lock) {
            if (closed) {
                return true;
            }
            if (!streamFinished && !interrupted) {
                return false;
            }
            if (resynthesisPending) {
                return false;
            }
            if (fallbackFrom >= 0 && properties.isFallbackResynthesis() && !resynthesisStarted && !interrupted) {
                return false;
            }
        }
        return synthesis.isIdle() && playback.isIdle();
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    public SessionStats stats() {
        boolean finished;
        boolean wasInterrupted;
        int fallback;
        synchronized (lock) {
            finished = streamFinished;
            wasInterrupted = interrupted;
            fallback = fallbackFrom;
        }
        return new SessionStats(sessionId, channelId, parser.emittedCount(), finished, wasInterrupted, fallback,
                synthesis.stats(), playback.stats());
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getChannelId() {
        return channelId;
    }

    public VoiceParams getVoice() {
        return voice;
    }

    /**
     * Stops playback, cancels synthesis and releases the session. Idempotent.
     */
    @Override
    public void close() {
        Runnable hook;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            hook = closeHook;
        }
        inContext(() -> {
            synthesis.close();
            playback.close();
            LOG.debug("Session closed");
            return null;
        });
        if (hook != null) {
            hook.run();
        }
    }

    /** Registers the action run once when the session closes. */
    void onClose(Runnable hook) {
        synchronized (lock) {
            this.closeHook = hook;
        }
    }

    // ---------------------------------------------------------------------------------------

    private void route(TextChunk chunk) {
        metrics.chunkDetected();
        if (chunk.isBlank()) {
            playback.markSkipped(chunk.sequenceNumber());
            return;
        }
        LOG.debug("Chunk seq={} detected: '{}'", chunk.sequenceNumber(),
                LogSanitizer.preview(chunk.text(), PREVIEW_CHARS));
        synchronized (lock) {
            if (interrupted || closed) {
                return;
            }
            chunkTexts.put(chunk.sequenceNumber(), chunk.spokenText());
            if (fallbackFrom >= 0) {
                return;
            }
        }
        synthesis.enqueue(chunk);
    }

    private void onFallback(FallbackContext context) {
        int from = context.firstUndelivered();
        synchronized (lock) {
            fallbackFrom = from;
        }
        int dropped = playback.discardFrom(from);
        LOG.warn("Fallback triggered by seq={}: dropped {} buffered segment(s) from seq={}",
                context.failedSequence(), dropped, from);
        startResynthesisIfReady();
    }

    /**
     * Synthesizes everything from the fallback point as a single request, once the stream ended.
     */
    private void startResynthesisIfReady() {
        int seq;
        String text;
        synchronized (lock) {
            if (fallbackFrom < 0 || !streamFinished || resynthesisStarted || interrupted || closed
                    || !properties.isFallbackResynthesis()) {
                return;
            }
            resynthesisStarted = true;
            resynthesisPending = true;
            seq = fallbackFrom;
            text = String.join(" ", chunkTexts.tailMap(fallbackFrom, true).values());
        }
        if (text.isBlank()) {
            synchronized (lock) {
                resynthesisPending = false;
            }
            playback.markSkipped(seq);
            return;
        }
        LOG.info("Re-synthesizing remaining text as seq={} ({} chars)", seq, text.length());
        Duration timeout = properties.getSynthesisTimeout();
        metrics.synthesisStarted();
        AtomicLong startNanos = new AtomicLong(System.nanoTime());
        CompletableFuture<byte[]> call = new CompletableFuture<>();
        try {
            resources.synthesisExecutor().execute(() -> {
                // Timed from the provider call, not from submission
                startNanos.set(System.nanoTime());
                call.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
                try {
                    call.complete(resources.provider().synthesize(text, voice, timeout));
                } catch (RuntimeException e) {
                    call.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            onResynthesized(seq, text, startNanos.get(), null, e);
            return;
        }
        call.whenComplete((audio, error) -> onResynthesized(seq, text, startNanos.get(), audio, error));
    }

    private void onResynthesized(int seq, String text, long startNanos, byte[] audio, Throwable error) {
        long elapsed = System.nanoTime() - startNanos;
        if (error == null && audio != null) {
            metrics.synthesisCompleted(elapsed);
            playback.enqueue(seq, new AudioSegment(seq, audio, text, Duration.ofNanos(elapsed)));
            synchronized (lock) {
                resynthesisPending = false;
            }
            return;
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        String reason = cause instanceof TimeoutException ? "timeout" : "fallback";
        String message = cause != null ? cause.getMessage() : "provider returned no audio";
        metrics.synthesisFailed(reason);
        LOG.warn("Fallback re-synthesis failed for seq={}: {}", seq, message);
        publish(new SynthesisFailedEvent(sessionId, channelId, seq, reason, message, Instant.now()));
        playback.markSkipped(seq);
        synchronized (lock) {
            resynthesisPending = false;
        }
    }

    private void publish(Object event) {
        ApplicationEventPublisher publisher = resources.eventPublisher();
        if (publisher == null) {
            return;
        }
        try {
            publisher.publishEvent(event);
        } catch (RuntimeException e) {
            LOG.warn("Failed to publish {}: {}", event.getClass().getSimpleName(), e.getMessage());
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Session " + sessionId + " is closed");
        }
    }

    private <T> T inContext(Supplier<T> action) {
        String previousSession = ThreadContext.get(MDC_SESSION_ID);
        String previousChannel = ThreadContext.get(MDC_CHANNEL_ID);
        ThreadContext.put(MDC_SESSION_ID, sessionId);
        ThreadContext.put(MDC_CHANNEL_ID, channelId);
        try {
            return action.get();
        } finally {
            restore(MDC_SESSION_ID, previousSession);
            restore(MDC_CHANNEL_ID, previousChannel);
        }
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            ThreadContext.remove(key);
        } else {
            ThreadContext.put(key, previous);
        }
    }

    private final class SynthesisCallbacks implements SynthesisListener {

        @Override
        public void onComplete(int sequenceNumber, AudioSegment segment) {
            // Check and enqueue together; onFallback sets fallbackFrom under the same lock
            synchronized (lock) {
                if (fallbackFrom >= 0 && sequenceNumber >= fallbackFrom) {
                    LOG.debug("Dropping seq={}, replaced by fallback re-synthesis", sequenceNumber);
                    return;
                }
                playback.enqueue(sequenceNumber, segment);
            }
        }

        @Override
        public void onError(int sequenceNumber, SynthesisException error) {
            if (!synthesis.isAborted()) {
                playback.markSkipped(sequenceNumber);
            }
            publish(new SynthesisFailedEvent(sessionId, channelId, sequenceNumber, error.reason(),
                    error.getMessage(), Instant.now()));
        }

        @Override
        public void onFallback(FallbackContext context) {
            SpeechSession.this.onFallback(context);
        }
    }

    private final class PlaybackCallbacks implements PlaybackListener {

        @Override
        public void onComplete(PlaybackMetadata metadata) {
            LOG.info("Spoke seq={} in {}ms: '{}'", metadata.sequenceNumber(), metadata.playDuration().toMillis(),
                    LogSanitizer.preview(metadata.text(), PREVIEW_CHARS));
            publish(new SegmentPlayedEvent(sessionId, channelId, metadata.sequenceNumber(), metadata.text(),
                    metadata.playDuration(), Instant.now()));
        }

        @Override
        public void onError(PlaybackSinkException error, PlaybackMetadata metadata) {
            publish(new PlaybackFailedEvent(sessionId, channelId, metadata.sequenceNumber(), error.getMessage(),
                    Instant.now()));
        }
    }
}
