package com.phillippitts.speakstream.service.parser;

import com.phillippitts.speakstream.domain.TextChunk;
import com.phillippitts.speakstream.exception.ParseBufferOverflowException;
import com.phillippitts.speakstream.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Incremental sentence segmenter for text that arrives token by token.
 *
 * <p>A candidate boundary is a run of {@code . ! ?}, optionally followed by closing quotes or
 * brackets, followed by whitespace. The candidate is rejected when it is:
 * <ul>
 *   <li>a decimal point (digit on both sides)</li>
 *   <li>the period of a known abbreviation ({@link Abbreviations})</li>
 *   <li>the period of a run of initials such as {@code J.K.}</li>
 *   <li>an ellipsis (three or more trailing periods)</li>
 * </ul>
 *
 * <p>Every decision uses only the current sentence and a bounded lookahead. When the lookahead
 * is not available yet the parser waits for more text instead of guessing, so feeding a string
 * one character at a time yields the same chunks as feeding it in one call.
 *
 * <p>Chunks keep the exact source text, including the whitespace before them; concatenating
 * every chunk returned by {@link #addChunk(String)} and {@link #finalizeChunks()} reproduces the
 * input. Chunks whose trimmed length is below {@code minChunkLength} are held back and merged
 * with the next one.
 *
 * <p><b>Thread Safety:</b> Not thread-safe. One instance per session, driven from the text-arrival
 * path. Instances are not reusable after {@link #finalizeChunks()}.
 */
public class SentenceParser {

    private static final Logger LOG = LogManager.getLogger(SentenceParser.class);

    private static final Pattern INITIALS = Pattern.compile("\\p{Lu}(\\.\\p{Lu})*");
    private static final String CLOSERS = "\"')]}”’»";
    private static final int ELLIPSIS_MIN_PERIODS = 3;
    private static final int NEED_MORE = 0;

    private final int minChunkLength;
    private final int maxBufferChars;
    private final Set<String> abbreviations;

    private final StringBuilder buffer = new StringBuilder();
    private final StringBuilder pending = new StringBuilder();
    private int scanFrom;
    private int nextSequence;
    private boolean finalized;

    public SentenceParser(int minChunkLength) {
        this(minChunkLength, Integer.MAX_VALUE, Abbreviations.defaults());
    }

    /**
     * @param minChunkLength shortest trimmed chunk that is emitted on its own
     * @param maxBufferChars undecided text allowed before {@link ParseBufferOverflowException}
     * @param abbreviations lower-case abbreviations without the trailing period
     */
    public SentenceParser(int minChunkLength, int maxBufferChars, Set<String> abbreviations) {
        if (minChunkLength < 0) {
            throw new IllegalArgumentException("minChunkLength must be >= 0, got: " + minChunkLength);
        }
        if (maxBufferChars <= 0) {
            throw new IllegalArgumentException("maxBufferChars must be positive, got: " + maxBufferChars);
        }
        this.minChunkLength = minChunkLength;
        this.maxBufferChars = maxBufferChars;
        this.abbreviations = Set.copyOf(Objects.requireNonNull(abbreviations, "abbreviations"));
    }

    /**
     * Appends a text delta and returns the chunks it completes.
     *
     * @param delta next piece of the stream (null or empty is ignored)
     * @return completed chunks in order, possibly empty
     * @throws IllegalStateException if the parser was already finalized
     * @throws ParseBufferOverflowException if undecided text exceeds the configured limit
     */
    public List<TextChunk> addChunk(String delta) {
        ensureOpen();
        if (delta == null || delta.isEmpty()) {
            return Collections.emptyList();
        }
        buffer.append(delta);

        List<TextChunk> completed = new ArrayList<>();
        int end;
        while ((end = findBoundary()) > 0) {
            checkOverflow(end);
            String sentence = buffer.substring(0, end);
            buffer.delete(0, end);
            scanFrom = 0;
            accept(sentence, completed);
        }
        checkOverflow(buffer.length());
        return completed;
    }

    /**
     * Flushes whatever is still buffered when the upstream stream ends, even without terminal
     * punctuation. Must be called exactly once.
     *
     * @return the remaining text as a final chunk, or empty if nothing was buffered
     * @throws IllegalStateException if called more than once
     */
    public Optional<TextChunk> finalizeChunks() {
        ensureOpen();
        finalized = true;
        pending.append(buffer);
        buffer.setLength(0);
        if (pending.length() == 0) {
            return Optional.empty();
        }
        TextChunk last = new TextChunk(nextSequence++, pending.toString());
        pending.setLength(0);
        LOG.debug("Flushed final chunk seq={} preview='{}'", last.sequenceNumber(),
                LogSanitizer.preview(last.text(), 40));
        return Optional.of(last);
    }

    public boolean isFinalized() {
        return finalized;
    }

    /**
     * @return number of chunks emitted so far
     */
    public int emittedCount() {
        return nextSequence;
    }

    private void accept(String sentence, List<TextChunk> out) {
        pending.append(sentence);
        if (pending.toString().strip().length() < minChunkLength) {
            return;
        }
        TextChunk chunk = new TextChunk(nextSequence++, pending.toString());
        pending.setLength(0);
        out.add(chunk);
    }

    /**
     * Scans for the next accepted boundary.
     *
     * @return index just past the sentence, or -1 when none is decidable yet
     */
    private int findBoundary() {
        int i = scanFrom;
        while (i < buffer.length()) {
            if (!isTerminal(buffer.charAt(i))) {
                i++;
                continue;
            }
            int decision = evaluate(i);
            if (decision == NEED_MORE) {
                scanFrom = i;
                return -1;
            }
            if (decision > 0) {
                return decision;
            }
            i = -decision;
        }
        scanFrom = i;
        return -1;
    }

    /**
     * Decides the candidate starting at {@code pos}.
     *
     * @return end index (&gt; 0) when accepted, {@link #NEED_MORE}, or the negated index to
     *         resume scanning from when rejected
     */
    private int evaluate(int pos) {
        int len = buffer.length();
        int runEnd = pos;
        while (runEnd + 1 < len && isTerminal(buffer.charAt(runEnd + 1))) {
            runEnd++;
        }
        if (runEnd + 1 >= len) {
            return NEED_MORE;
        }
        boolean singlePeriod = runEnd == pos && buffer.charAt(pos) == '.';
        if (singlePeriod && isDecimalPoint(pos)) {
            return -(pos + 1);
        }

        int after = runEnd + 1;
        while (after < len && CLOSERS.indexOf(buffer.charAt(after)) >= 0) {
            after++;
        }
        if (after >= len) {
            return NEED_MORE;
        }
        if (!Character.isWhitespace(buffer.charAt(after))) {
            return -after;
        }
        if (trailingPeriods(pos, runEnd) >= ELLIPSIS_MIN_PERIODS) {
            return -after;
        }
        if (singlePeriod && (isAbbreviation(pos) || isInitial(pos))) {
            return -after;
        }
        return after;
    }

    private boolean isDecimalPoint(int pos) {
        return pos > 0
                && Character.isDigit(buffer.charAt(pos - 1))
                && Character.isDigit(buffer.charAt(pos + 1));
    }

    private boolean isAbbreviation(int pos) {
        String token = tokenBefore(pos);
        return !token.isEmpty() && abbreviations.contains(token.toLowerCase(Locale.ROOT));
    }

    private boolean isInitial(int pos) {
        String token = tokenBefore(pos);
        return !token.isEmpty() && INITIALS.matcher(token).matches();
    }

    /** Letters and inner periods immediately before {@code pos}, e.g. "Mr", "e.g", "J.K". */
    private String tokenBefore(int pos) {
        int start = pos;
        while (start > 0) {
            char c = buffer.charAt(start - 1);
            if (Character.isLetter(c) || c == '.') {
                start--;
            } else {
                break;
            }
        }
        while (start < pos && buffer.charAt(start) == '.') {
            start++;
        }
        return buffer.substring(start, pos);
    }

    private int trailingPeriods(int runStart, int runEnd) {
        int count = 0;
        for (int i = runEnd; i >= runStart && buffer.charAt(i) == '.'; i--) {
            count++;
        }
        return count;
    }

    private void checkOverflow(int undecidedChars) {
        if (undecidedChars > maxBufferChars) {
            throw new ParseBufferOverflowException(undecidedChars, maxBufferChars);
        }
    }

    private void ensureOpen() {
        if (finalized) {
            throw new IllegalStateException("SentenceParser already finalized; create a new instance per session");
        }
    }

    private static boolean isTerminal(char c) {
        return c == '.' || c == '!' || c == '?';
    }
}
