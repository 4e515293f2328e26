package com.phillippitts.speakstream.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void speakStreamExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        SpeakStreamException ex = new SpeakStreamException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
        assertThat(ex).isInstanceOf(RuntimeException.class);
    }

    @Test
    void parseBufferOverflowShouldCarryLimits() {
        ParseBufferOverflowException ex = new ParseBufferOverflowException(4001, 4000);

        assertThat(ex.getBufferedChars()).isEqualTo(4001);
        assertThat(ex.getLimit()).isEqualTo(4000);
        assertThat(ex.getMessage()).contains("4001").contains("4000");
        assertThat(ex).isInstanceOf(SpeakStreamException.class);
    }

    @Test
    void synthesisExceptionWithoutSequenceShouldKeepPlainMessage() {
        SynthesisException ex = new SynthesisException("provider down");

        assertThat(ex.getMessage()).isEqualTo("provider down");
        assertThat(ex.getSequenceNumber()).isEqualTo(SynthesisException.UNKNOWN_SEQUENCE);
        assertThat(ex.reason()).isEqualTo("error");
    }

    @Test
    void synthesisTimeoutShouldIncludeSequenceAndTimeout() {
        TimeoutException cause = new TimeoutException();
        SynthesisTimeoutException ex = new SynthesisTimeoutException(7, Duration.ofMillis(1500), cause);

        assertThat(ex.getMessage()).contains("1500ms").contains("sequence: 7");
        assertThat(ex.getSequenceNumber()).isEqualTo(7);
        assertThat(ex.getTimeout()).isEqualTo(Duration.ofMillis(1500));
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.reason()).isEqualTo("timeout");
        assertThat(ex).isInstanceOf(SynthesisException.class);
    }

    @Test
    void synthesisProviderExceptionShouldReportProviderReason() {
        RuntimeException cause = new RuntimeException("HTTP 503");
        SynthesisProviderException ex = new SynthesisProviderException("provider failed", 2, cause);

        assertThat(ex.getSequenceNumber()).isEqualTo(2);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.reason()).isEqualTo("provider");
    }

    @Test
    void playbackSinkExceptionShouldIncludeSequence() {
        PlaybackSinkException ex = new PlaybackSinkException("device lost", 4, new IllegalStateException());

        assertThat(ex.getSequenceNumber()).isEqualTo(4);
        assertThat(ex.getMessage()).isEqualTo("device lost (sequence: 4)");
        assertThat(ex).isInstanceOf(SpeakStreamException.class);
    }
}
