package com.phillippitts.speakstream.service.synthesis;

import com.phillippitts.speakstream.domain.AudioSegment;
import com.phillippitts.speakstream.domain.TextChunk;
import com.phillippitts.speakstream.domain.VoiceParams;
import com.phillippitts.speakstream.exception.SynthesisException;
import com.phillippitts.speakstream.exception.SynthesisProviderException;
import com.phillippitts.speakstream.exception.SynthesisTimeoutException;
import com.phillippitts.speakstream.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.speakstream.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Bounded-concurrency scheduler that turns text chunks into audio segments.
 *
 * <p>Tasks are admitted in submission order to a FIFO queue and started while one of the
 * {@code maxConcurrent} permits is free. Each attempt runs the provider call on the shared
 * synthesis executor and is bounded by the configured timeout, counted from the start of the
 * provider call. Completion order is NOT
 * submission order: {@link SynthesisListener#onComplete} fires in whatever order the provider
 * returns, and callers restore order through the sequence number.
 *
 * <p>Failures never escape as exceptions. The {@link FailurePolicy} decides what happens:
 * <ul>
 *   <li>{@code SKIP}: report once through {@link SynthesisListener#onError} and move on</li>
 *   <li>{@code RETRY}: re-run the task while it keeps its permit, then behave like SKIP</li>
 *   <li>{@code FALLBACK}: report the failure, cancel everything else and call
 *       {@link SynthesisListener#onFallback}</li>
 * </ul>
 *
 * <p>Cancellation is cooperative. A cancelled queued task never starts; a cancelled running task
 * keeps its provider call (and permit) until the call returns, and the result is then discarded.
 *
 * <p><b>Thread Safety:</b> Thread-safe. {@link #enqueue} never blocks. One instance per session.
 */
public class SynthesisQueueManager implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(SynthesisQueueManager.class);
    private static final int PREVIEW_CHARS = 40;

    private final SynthesisProvider provider;
    private final Executor executor;
    private final SynthesisSettings settings;
    private final VoiceParams voice;
    private final SynthesisListener listener;
    private final PipelineMetricsPublisher metrics;
    private final Semaphore permits;

    private final Object lock = new Object();
    private final Deque<SynthesisTask> queue = new ArrayDeque<>();
    private final Map<Integer, SynthesisTask> inFlight = new LinkedHashMap<>();
    private int lastSequence = -1;
    private int callbacksPending;
    private int peakInFlight;
    private long enqueuedCount;
    private long completedCount;
    private long failedCount;
    private long cancelledCount;
    private long retryCount;
    private boolean aborted;
    private boolean closed;

    public SynthesisQueueManager(SynthesisProvider provider,
                                 Executor executor,
                                 SynthesisSettings settings,
                                 VoiceParams voice,
                                 SynthesisListener listener,
                                 PipelineMetricsPublisher metrics) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.voice = Objects.requireNonNull(voice, "voice");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.metrics = metrics != null ? metrics : PipelineMetricsPublisher.NOOP;
        this.permits = new Semaphore(settings.maxConcurrent());
    }

    /**
     * Admits a chunk for synthesis.
     *
     * <p>After the fallback policy has fired, new tasks are accepted but cancelled immediately.
     *
     * @param chunk chunk whose sequence number is greater than every earlier one
     * @return read-only handle to the task
     * @throws IllegalArgumentException if the sequence number does not increase
     * @throws IllegalStateException if the manager is closed
     */
    public SynthesisTask enqueue(TextChunk chunk) {
        Objects.requireNonNull(chunk, "chunk");
        SynthesisTask task = new SynthesisTask(chunk.sequenceNumber(), chunk.spokenText(), voice);
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("SynthesisQueueManager is closed");
            }
            if (chunk.sequenceNumber() <= lastSequence) {
                throw new IllegalArgumentException("Sequence number " + chunk.sequenceNumber()
                        + " must be greater than " + lastSequence);
            }
            lastSequence = chunk.sequenceNumber();
            enqueuedCount++;
            if (aborted) {
                task.cancel();
                cancelledCount++;
                LOG.debug("Task seq={} cancelled on arrival, response already aborted", task.getSequenceNumber());
                return task;
            }
            queue.addLast(task);
        }
        LOG.debug("Enqueued synthesis task seq={} preview='{}'", task.getSequenceNumber(),
                LogSanitizer.preview(task.getText(), PREVIEW_CHARS));
        dispatch();
        return task;
    }

    /**
     * Admits text under the next free sequence number.
     */
    public SynthesisTask enqueue(String text) {
        int next;
        synchronized (lock) {
            next = lastSequence + 1;
        }
        return enqueue(new TextChunk(next, text));
    }

    /**
     * Drops queued tasks and discards the results of running ones when they arrive.
     *
     * @return number of tasks cancelled
     */
    public int cancelAll() {
        int count;
        synchronized (lock) {
            count = cancelQueued(0);
            for (SynthesisTask task : inFlight.values()) {
                if (task.cancel()) {
                    count++;
                }
            }
            cancelledCount += count;
        }
        afterCancel("all", count);
        return count;
    }

    /**
     * Drops queued tasks; running tasks finish and deliver their results.
     *
     * @return number of tasks cancelled
     */
    public int cancelPending() {
        int count;
        synchronized (lock) {
            count = cancelQueued(0);
            cancelledCount += count;
        }
        afterCancel("pending", count);
        return count;
    }

    /**
     * Keeps running tasks and the next {@code keep} queued tasks, drops the rest.
     *
     * @param keep queued tasks to keep alive
     * @return number of tasks cancelled
     */
    public int cancelAfter(int keep) {
        if (keep < 0) {
            throw new IllegalArgumentException("keep must be >= 0, got: " + keep);
        }
        int count;
        synchronized (lock) {
            count = cancelQueued(keep);
            cancelledCount += count;
        }
        afterCancel("after", count);
        return count;
    }

    public SynthesisQueueStats stats() {
        synchronized (lock) {
            return new SynthesisQueueStats(queue.size(), inFlight.size(), settings.maxConcurrent(), peakInFlight,
                    enqueuedCount, completedCount, failedCount, cancelledCount, retryCount, aborted);
        }
    }

    /**
     * @return true once the fallback policy has fired
     */
    public boolean isAborted() {
        synchronized (lock) {
            return aborted;
        }
    }

    /**
     * @return true when nothing is queued, running or still being reported to the listener
     */
    public boolean isIdle() {
        synchronized (lock) {
            return queue.isEmpty() && inFlight.isEmpty() && callbacksPending == 0;
        }
    }

    public SynthesisSettings getSettings() {
        return settings;
    }

    /**
     * Cancels all work and rejects further submissions. Idempotent.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        int cancelled = cancelAll();
        LOG.debug("SynthesisQueueManager closed, {} task(s) cancelled", cancelled);
    }

    // ---------------------------------------------------------------------------------------

    /** Caller holds {@link #lock}. */
    private int cancelQueued(int keep) {
        int count = 0;
        int kept = 0;
        Iterator<SynthesisTask> it = queue.iterator();
        while (it.hasNext()) {
            SynthesisTask task = it.next();
            if (kept < keep) {
                kept++;
                continue;
            }
            it.remove();
            if (task.cancel()) {
                count++;
            }
        }
        return count;
    }

    private void afterCancel(String scope, int count) {
        metrics.tasksCancelled(scope, count);
        if (count > 0) {
            LOG.info("Cancelled {} synthesis task(s) (scope={})", count, scope);
        }
    }

    /**
     * Starts queued tasks while permits are free.
     */
    private void dispatch() {
        while (true) {
            SynthesisTask next;
            synchronized (lock) {
                if (closed || aborted || queue.isEmpty() || !permits.tryAcquire()) {
                    return;
                }
                next = queue.pollFirst();
                inFlight.put(next.getSequenceNumber(), next);
                peakInFlight = Math.max(peakInFlight, inFlight.size());
                next.markRunning();
            }
            startAttempt(next);
        }
    }

    private void startAttempt(SynthesisTask task) {
        if (task.isCancelled()) {
            LOG.debug("Task seq={} cancelled before start", task.getSequenceNumber());
            releaseAndContinue(task);
            return;
        }
        metrics.synthesisStarted();
        AtomicLong startNanos = new AtomicLong(System.nanoTime());
        CompletableFuture<byte[]> attempt = new CompletableFuture<>();
        try {
            executor.execute(() -> callProvider(task, attempt, startNanos));
        } catch (RejectedExecutionException e) {
            LOG.warn("Synthesis executor rejected task seq={}", task.getSequenceNumber());
            handleFailure(task, new SynthesisProviderException(
                    "Synthesis executor rejected task", task.getSequenceNumber(), e));
            return;
        }
        attempt.whenComplete((audio, error) -> onAttemptDone(task, startNanos.get(), audio, error));
    }

    /**
     * Runs on the synthesis executor. The timeout starts here, when the provider is called, not
     * when the attempt was submitted.
     */
    private void callProvider(SynthesisTask task, CompletableFuture<byte[]> attempt, AtomicLong startNanos) {
        if (task.isCancelled()) {
            attempt.completeExceptionally(new CancellationException("Task seq=" + task.getSequenceNumber()
                    + " cancelled before the provider call"));
            return;
        }
        startNanos.set(System.nanoTime());
        attempt.orTimeout(settings.timeout().toMillis(), TimeUnit.MILLISECONDS);
        try {
            attempt.complete(provider.synthesize(task.getText(), task.getVoice(), settings.timeout()));
        } catch (RuntimeException e) {
            attempt.completeExceptionally(e);
        }
    }

    private void onAttemptDone(SynthesisTask task, long startNanos, byte[] audio, Throwable error) {
        long elapsedNanos = System.nanoTime() - startNanos;
        if (error == null && audio == null) {
            error = new SynthesisProviderException("Provider returned no audio", task.getSequenceNumber(), null);
        }
        if (error != null) {
            handleFailure(task, translate(task, error));
            return;
        }

        synchronized (lock) {
            if (task.isCancelled()) {
                releaseSlot(task);
            } else {
                task.markCompleted();
                completedCount++;
                callbacksPending++;
                releaseSlot(task);
            }
        }
        if (task.isCancelled()) {
            LOG.debug("Discarding result of cancelled task seq={}", task.getSequenceNumber());
        } else {
            metrics.synthesisCompleted(elapsedNanos);
            LOG.debug("Synthesized seq={} in {}ms ({} bytes)", task.getSequenceNumber(),
                    TimeUnit.NANOSECONDS.toMillis(elapsedNanos), audio.length);
            AudioSegment segment = new AudioSegment(task.getSequenceNumber(), audio, task.getText(),
                    Duration.ofNanos(elapsedNanos));
            notifyComplete(segment);
        }
        dispatch();
    }

    private void handleFailure(SynthesisTask task, SynthesisException error) {
        FailurePolicy policy = settings.failurePolicy();
        if (policy == FailurePolicy.RETRY && retry(task, error)) {
            return;
        }
        if (policy == FailurePolicy.FALLBACK) {
            fallback(task, error);
            return;
        }
        skip(task, error);
    }

    private boolean retry(SynthesisTask task, SynthesisException error) {
        boolean cancelled;
        synchronized (lock) {
            cancelled = task.isCancelled();
            if (cancelled) {
                releaseSlot(task);
            } else if (task.getRetryCount() < settings.maxRetries()) {
                int attempt = task.incrementRetry();
                retryCount++;
                metrics.retryAttempted();
                LOG.warn("Synthesis attempt failed for seq={}, retry {}/{}: {}", task.getSequenceNumber(),
                        attempt, settings.maxRetries(), error.getMessage());
            } else {
                return false;
            }
        }
        if (cancelled) {
            dispatch();
        } else {
            startAttempt(task);
        }
        return true;
    }

    private void skip(SynthesisTask task, SynthesisException error) {
        synchronized (lock) {
            if (task.isCancelled()) {
                releaseSlot(task);
            } else {
                task.markFailed();
                failedCount++;
                callbacksPending++;
                releaseSlot(task);
            }
        }
        if (task.isCancelled()) {
            LOG.debug("Ignoring failure of cancelled task seq={}", task.getSequenceNumber());
        } else {
            metrics.synthesisFailed(error.reason());
            LOG.warn("Synthesis failed for seq={} after {} retr{}, skipping: {}", task.getSequenceNumber(),
                    task.getRetryCount(), task.getRetryCount() == 1 ? "y" : "ies", error.getMessage());
            notifyError(task.getSequenceNumber(), error);
        }
        dispatch();
    }

    private void fallback(SynthesisTask task, SynthesisException error) {
        FallbackContext context;
        int cancelled = 0;
        synchronized (lock) {
            if (task.isCancelled()) {
                releaseSlot(task);
                context = null;
            } else {
                task.markFailed();
                failedCount++;
                aborted = true;
                // onError and onFallback
                callbacksPending += 2;
                releaseSlot(task);

                List<SynthesisTask> remaining = new ArrayList<>();
                remaining.add(task);
                for (SynthesisTask running : inFlight.values()) {
                    if (running.cancel()) {
                        cancelled++;
                        remaining.add(running);
                    }
                }
                for (SynthesisTask queued : queue) {
                    if (queued.cancel()) {
                        cancelled++;
                        remaining.add(queued);
                    }
                }
                queue.clear();
                cancelledCount += cancelled;

                remaining.sort(Comparator.comparingInt(SynthesisTask::getSequenceNumber));
                String text = remaining.stream()
                        .map(SynthesisTask::getText)
                        .collect(Collectors.joining(" "));
                context = new FallbackContext(task.getSequenceNumber(),
                        remaining.get(0).getSequenceNumber(), text);
            }
        }
        if (context == null) {
            LOG.debug("Ignoring failure of cancelled task seq={}", task.getSequenceNumber());
            dispatch();
            return;
        }
        metrics.synthesisFailed(error.reason());
        metrics.tasksCancelled("fallback", cancelled);
        LOG.warn("Synthesis failed for seq={}, aborting response (fallback) and cancelling {} task(s): {}",
                task.getSequenceNumber(), cancelled, error.getMessage());
        notifyError(task.getSequenceNumber(), error);
        try {
            listener.onFallback(context);
        } catch (RuntimeException e) {
            LOG.error("Synthesis listener failed in onFallback for seq={}", task.getSequenceNumber(), e);
        } finally {
            callbackDone();
        }
    }

    /** Caller holds {@link #lock}. Idempotent per task. */
    private void releaseSlot(SynthesisTask task) {
        if (inFlight.remove(task.getSequenceNumber()) != null) {
            permits.release();
        }
    }

    private void releaseAndContinue(SynthesisTask task) {
        synchronized (lock) {
            releaseSlot(task);
        }
        dispatch();
    }

    private SynthesisException translate(SynthesisTask task, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause() : error;
        int seq = task.getSequenceNumber();
        if (cause instanceof TimeoutException) {
            return new SynthesisTimeoutException(seq, settings.timeout(), cause);
        }
        if (cause instanceof SynthesisException se && se.getSequenceNumber() == seq) {
            return se;
        }
        return new SynthesisProviderException("Synthesis provider failed: " + cause.getMessage(), seq, cause);
    }

    private void notifyComplete(AudioSegment segment) {
        try {
            listener.onComplete(segment.sequenceNumber(), segment);
        } catch (RuntimeException e) {
            LOG.error("Synthesis listener failed in onComplete for seq={}", segment.sequenceNumber(), e);
        } finally {
            callbackDone();
        }
    }

    private void notifyError(int sequenceNumber, SynthesisException error) {
        try {
            listener.onError(sequenceNumber, error);
        } catch (RuntimeException e) {
            LOG.error("Synthesis listener failed in onError for seq={}", sequenceNumber, e);
        } finally {
            callbackDone();
        }
    }

    private void callbackDone() {
        synchronized (lock) {
            callbacksPending--;
        }
    }
}
