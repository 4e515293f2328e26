package com.phillippitts.speakstream.service.synthesis;

import com.phillippitts.speakstream.domain.VoiceParams;

import java.util.Objects;

/**
 * One chunk's synthesis work inside a {@link SynthesisQueueManager}.
 *
 * <p>The manager owns the task and is the only writer; callers get it back from
 * {@link SynthesisQueueManager#enqueue} as a read-only handle. The status doubles as the
 * cooperative cancellation token: once it is {@link SynthesisStatus#CANCELLED}, the worker
 * does not start the task and discards a result that arrives later.
 */
public final class SynthesisTask {

    private final int sequenceNumber;
    private final String text;
    private final VoiceParams voice;

    private volatile SynthesisStatus status = SynthesisStatus.QUEUED;
    private volatile int retryCount;

    SynthesisTask(int sequenceNumber, String text, VoiceParams voice) {
        this.sequenceNumber = sequenceNumber;
        this.text = Objects.requireNonNull(text, "text");
        this.voice = Objects.requireNonNull(voice, "voice");
    }

    public int getSequenceNumber() {
        return sequenceNumber;
    }

    public String getText() {
        return text;
    }

    public VoiceParams getVoice() {
        return voice;
    }

    public SynthesisStatus getStatus() {
        return status;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public boolean isCancelled() {
        return status == SynthesisStatus.CANCELLED;
    }

    void markRunning() {
        status = SynthesisStatus.RUNNING;
    }

    void markCompleted() {
        status = SynthesisStatus.COMPLETED;
    }

    void markFailed() {
        status = SynthesisStatus.FAILED;
    }

    /**
     * @return true if the task was still live and is now cancelled
     */
    boolean cancel() {
        if (status.isTerminal()) {
            return false;
        }
        status = SynthesisStatus.CANCELLED;
        return true;
    }

    int incrementRetry() {
        return ++retryCount;
    }

    @Override
    public String toString() {
        return "SynthesisTask{seq=" + sequenceNumber + ", status=" + status + ", retries=" + retryCount + '}';
    }
}
