package com.phillippitts.speakstream.service.playback;

import com.phillippitts.speakstream.domain.AudioSegment;
import com.phillippitts.speakstream.exception.PlaybackSinkException;
import com.phillippitts.speakstream.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.speakstream.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Strict-order, interruptible audio emitter.
 *
 * <p>Segments may arrive in any order. A segment whose sequence number equals
 * {@code nextExpected} becomes ready and advances the counter, pulling any buffered successors
 * along with it; others wait in a sequence-keyed reorder buffer. Sequence numbers that will never
 * produce audio (failed or blank chunks) must be reported with {@link #markSkipped(int)} so the
 * buffer does not wait for them forever.
 *
 * <p>A single worker job on the playback executor hands ready segments to the {@link AudioSink}
 * one at a time and waits for each to finish. A sink failure is reported for that segment only;
 * playback continues with the next one.
 *
 * <p><b>Thread Safety:</b> Thread-safe. {@link #enqueue} and {@link #markSkipped} never block.
 */
public class PlaybackQueue implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(PlaybackQueue.class);
    static final long REJECTED_RETRY_DELAY_MS = 50;

    private final AudioSink sink;
    private final Executor executor;
    private final PlaybackListener listener;
    private final PipelineMetricsPublisher metrics;

    private final Object lock = new Object();
    private final NavigableMap<Integer, PlaybackItem> reorderBuffer = new TreeMap<>();
    private final NavigableSet<Integer> skipped = new TreeSet<>();
    private final Deque<PlaybackItem> ready = new ArrayDeque<>();
    private final AtomicBoolean workerActive = new AtomicBoolean(false);
    private final AtomicBoolean retryScheduled = new AtomicBoolean(false);

    private int nextExpected;
    private int discardAbove = Integer.MAX_VALUE;
    private PlaybackState state = PlaybackState.ACTIVE;
    private PlaybackItem current;
    private CompletableFuture<Void> currentPlayback;
    private boolean hardStop;
    private long playedCount;
    private long failedCount;
    private long discardedCount;

    public PlaybackQueue(AudioSink sink, Executor executor, PlaybackListener listener,
                         PipelineMetricsPublisher metrics) {
        this(sink, executor, listener, metrics, 0);
    }

    /**
     * @param firstSequence sequence number of the first segment to play
     */
    public PlaybackQueue(AudioSink sink, Executor executor, PlaybackListener listener,
                         PipelineMetricsPublisher metrics, int firstSequence) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.metrics = metrics != null ? metrics : PipelineMetricsPublisher.NOOP;
        if (firstSequence < 0) {
            throw new IllegalArgumentException("firstSequence must be >= 0, got: " + firstSequence);
        }
        this.nextExpected = firstSequence;
    }

    /**
     * Accepts a synthesized segment.
     *
     * @return true if the segment was accepted; false if it was discarded because playback was
     *         interrupted or closed, or because the sequence number was already seen
     */
    public boolean enqueue(int sequenceNumber, AudioSegment segment) {
        Objects.requireNonNull(segment, "segment");
        if (segment.sequenceNumber() != sequenceNumber) {
            throw new IllegalArgumentException("Segment sequence " + segment.sequenceNumber()
                    + " does not match " + sequenceNumber);
        }
        synchronized (lock) {
            if (state != PlaybackState.ACTIVE) {
                discardedCount++;
                LOG.debug("Discarding segment seq={}, playback is {}", sequenceNumber, state);
                return false;
            }
            if (sequenceNumber > discardAbove) {
                discardedCount++;
                LOG.debug("Discarding seq={}, replaced from seq={}", sequenceNumber, discardAbove);
                return false;
            }
            if (sequenceNumber < nextExpected || reorderBuffer.containsKey(sequenceNumber)
                    || skipped.contains(sequenceNumber)) {
                discardedCount++;
                LOG.warn("Discarding duplicate or stale segment seq={} (next expected {})",
                        sequenceNumber, nextExpected);
                return false;
            }
            reorderBuffer.put(sequenceNumber, new PlaybackItem(segment, System.nanoTime()));
            advance();
        }
        scheduleWorker();
        return true;
    }

    /**
     * Declares that no audio will ever arrive for a sequence number.
     */
    public void markSkipped(int sequenceNumber) {
        synchronized (lock) {
            if (state != PlaybackState.ACTIVE || sequenceNumber < nextExpected || sequenceNumber > discardAbove
                    || reorderBuffer.containsKey(sequenceNumber)) {
                return;
            }
            skipped.add(sequenceNumber);
            advance();
        }
        scheduleWorker();
    }

    /**
     * Drops every segment with a sequence number at or above {@code fromSequence} that has not
     * started playing. Used when the rest of a response is replaced by a single re-synthesized
     * segment.
     *
     * <p>Afterwards only {@code fromSequence} itself (the replacement) and lower sequence numbers
     * are accepted; segments above it that arrive late are discarded.
     *
     * @return number of segments dropped
     */
    public int discardFrom(int fromSequence) {
        int dropped = 0;
        synchronized (lock) {
            discardAbove = Math.min(discardAbove, fromSequence);
            NavigableMap<Integer, PlaybackItem> tail = reorderBuffer.tailMap(fromSequence, true);
            dropped += tail.size();
            tail.clear();
            skipped.tailSet(fromSequence, true).clear();
            Iterator<PlaybackItem> it = ready.iterator();
            while (it.hasNext()) {
                if (it.next().sequenceNumber() >= fromSequence) {
                    it.remove();
                    dropped++;
                }
            }
            discardedCount += dropped;
        }
        if (dropped > 0) {
            LOG.debug("Discarded {} segment(s) from seq={}", dropped, fromSequence);
        }
        return dropped;
    }

    /**
     * Cuts playback short.
     *
     * @param strategy how to treat the segment playing now and those next in line
     * @param drainCount ready segments to keep for {@link InterruptionStrategy#DRAIN}; ignored otherwise
     * @return number of segments discarded
     */
    public int interrupt(InterruptionStrategy strategy, int drainCount) {
        Objects.requireNonNull(strategy, "strategy");
        if (drainCount < 0) {
            throw new IllegalArgumentException("drainCount must be >= 0, got: " + drainCount);
        }
        int discarded;
        boolean stopSink = false;
        CompletableFuture<Void> playing = null;
        synchronized (lock) {
            if (state == PlaybackState.STOPPED || state == PlaybackState.CLOSED) {
                return 0;
            }
            switch (strategy) {
                case IMMEDIATE -> {
                    discarded = clearAll();
                    state = PlaybackState.STOPPED;
                    hardStop = true;
                    stopSink = current != null;
                    playing = currentPlayback;
                }
                case GRACEFUL -> {
                    discarded = clearAll();
                    state = PlaybackState.STOPPED;
                }
                case DRAIN -> {
                    discarded = reorderBuffer.size();
                    reorderBuffer.clear();
                    skipped.clear();
                    while (ready.size() > drainCount) {
                        ready.pollLast();
                        discarded++;
                    }
                    state = ready.isEmpty() && current == null ? PlaybackState.STOPPED : PlaybackState.DRAINING;
                }
                default -> throw new IllegalStateException("Unknown strategy: " + strategy);
            }
            discardedCount += discarded;
        }
        stopCurrent(stopSink, playing);
        LOG.info("Playback interrupted (strategy={}), {} segment(s) discarded", strategy, discarded);
        return discarded;
    }

    public PlaybackStats stats() {
        synchronized (lock) {
            return new PlaybackStats(state, nextExpected, reorderBuffer.size(), ready.size(), current != null,
                    playedCount, failedCount, discardedCount);
        }
    }

    public PlaybackState getState() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * @return true when nothing is playing, ready or buffered
     */
    public boolean isIdle() {
        synchronized (lock) {
            return current == null && ready.isEmpty() && reorderBuffer.isEmpty();
        }
    }

    /**
     * Stops playback immediately and discards everything. Idempotent.
     */
    @Override
    public void close() {
        boolean stopSink;
        CompletableFuture<Void> playing;
        synchronized (lock) {
            if (state == PlaybackState.CLOSED) {
                return;
            }
            discardedCount += clearAll();
            state = PlaybackState.CLOSED;
            hardStop = true;
            stopSink = current != null;
            playing = currentPlayback;
        }
        stopCurrent(stopSink, playing);
        LOG.debug("PlaybackQueue closed");
    }

    // ---------------------------------------------------------------------------------------

    private void stopCurrent(boolean stopSink, CompletableFuture<Void> playing) {
        if (!stopSink) {
            return;
        }
        sink.stop();
        if (playing != null) {
            playing.cancel(true);
        }
    }

    /** Caller holds {@link #lock}. */
    private void advance() {
        while (true) {
            if (skipped.remove(nextExpected)) {
                nextExpected++;
                continue;
            }
            PlaybackItem item = reorderBuffer.remove(nextExpected);
            if (item == null) {
                return;
            }
            ready.addLast(item);
            nextExpected++;
        }
    }

    /** Caller holds {@link #lock}. */
    private int clearAll() {
        int count = ready.size() + reorderBuffer.size();
        ready.clear();
        reorderBuffer.clear();
        skipped.clear();
        return count;
    }

    private void scheduleWorker() {
        synchronized (lock) {
            if (ready.isEmpty()) {
                return;
            }
        }
        if (!workerActive.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::runWorker);
        } catch (RejectedExecutionException e) {
            workerActive.set(false);
            retryLater(e);
        }
    }

    /**
     * Tries to start the worker again after a delay. At most one retry is pending at a time; it
     * ends once the worker runs or nothing is left to play.
     */
    private void retryLater(RejectedExecutionException cause) {
        if (!retryScheduled.compareAndSet(false, true)) {
            return;
        }
        LOG.warn("Playback executor rejected worker, retrying in {}ms: {}", REJECTED_RETRY_DELAY_MS,
                cause.getMessage());
        CompletableFuture.delayedExecutor(REJECTED_RETRY_DELAY_MS, TimeUnit.MILLISECONDS).execute(() -> {
            retryScheduled.set(false);
            scheduleWorker();
        });
    }

    private void runWorker() {
        LOG.debug("Playback worker started");
        while (true) {
            PlaybackItem item;
            synchronized (lock) {
                boolean canPlay = state == PlaybackState.ACTIVE || state == PlaybackState.DRAINING;
                item = canPlay ? ready.pollFirst() : null;
                if (item == null) {
                    if (state == PlaybackState.DRAINING) {
                        state = PlaybackState.STOPPED;
                        LOG.debug("Drain complete, playback stopped");
                    }
                    workerActive.set(false);
                    return;
                }
                current = item;
            }
            if (!playOne(item)) {
                synchronized (lock) {
                    workerActive.set(false);
                }
                return;
            }
        }
    }

    /**
     * Plays one segment and waits for it.
     *
     * @return false if the worker thread was interrupted and must exit
     */
    private boolean playOne(PlaybackItem item) {
        AudioSegment segment = item.segment();
        long startNanos = System.nanoTime();
        Duration queueWait = Duration.ofNanos(startNanos - item.enqueuedAtNanos());
        metrics.playbackQueueWait(queueWait.toNanos());
        LOG.debug("Playing seq={} ({} bytes) preview='{}'", segment.sequenceNumber(), segment.sizeBytes(),
                LogSanitizer.preview(segment.sourceText(), 40));

        CompletableFuture<Void> playback;
        try {
            playback = sink.play(segment.audio());
        } catch (RuntimeException e) {
            playback = CompletableFuture.failedFuture(e);
        }
        if (playback == null) {
            playback = CompletableFuture.failedFuture(new IllegalStateException("Audio sink returned no future"));
        }

        boolean stopNow;
        synchronized (lock) {
            currentPlayback = playback;
            stopNow = hardStop;
        }
        if (stopNow) {
            sink.stop();
            playback.cancel(true);
        }

        try {
            playback.get();
            Duration played = Duration.ofNanos(System.nanoTime() - startNanos);
            synchronized (lock) {
                playedCount++;
            }
            metrics.playbackCompleted(played.toNanos());
            notifyComplete(metadata(segment, queueWait, played));
        } catch (CancellationException e) {
            LOG.debug("Playback of seq={} stopped by interruption", segment.sequenceNumber());
        } catch (ExecutionException e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            synchronized (lock) {
                failedCount++;
            }
            metrics.playbackFailed();
            PlaybackSinkException error = new PlaybackSinkException("Audio sink failed: "
                    + e.getCause().getMessage(), segment.sequenceNumber(), e.getCause());
            LOG.warn("Playback failed for seq={}, continuing with next segment: {}",
                    segment.sequenceNumber(), error.getMessage());
            notifyError(error, metadata(segment, queueWait, elapsed));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Playback worker interrupted while playing seq={}", segment.sequenceNumber());
            clearCurrent();
            return false;
        }
        clearCurrent();
        return true;
    }

    private void clearCurrent() {
        synchronized (lock) {
            current = null;
            currentPlayback = null;
        }
    }

    private static PlaybackMetadata metadata(AudioSegment segment, Duration queueWait, Duration playDuration) {
        return new PlaybackMetadata(segment.sequenceNumber(), segment.sourceText(), segment.sizeBytes(),
                segment.synthesisLatency(), queueWait, playDuration);
    }

    private void notifyComplete(PlaybackMetadata metadata) {
        try {
            listener.onComplete(metadata);
        } catch (RuntimeException e) {
            LOG.error("Playback listener failed in onComplete for seq={}", metadata.sequenceNumber(), e);
        }
    }

    private void notifyError(PlaybackSinkException error, PlaybackMetadata metadata) {
        try {
            listener.onError(error, metadata);
        } catch (RuntimeException e) {
            LOG.error("Playback listener failed in onError for seq={}", metadata.sequenceNumber(), e);
        }
    }
}
