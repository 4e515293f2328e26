package com.phillippitts.speakstream.service.synthesis;

/** Lifecycle of a {@link SynthesisTask}. */
public enum SynthesisStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
