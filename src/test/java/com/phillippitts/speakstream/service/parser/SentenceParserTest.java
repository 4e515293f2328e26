package com.phillippitts.speakstream.service.parser;

import com.phillippitts.speakstream.domain.TextChunk;
import com.phillippitts.speakstream.exception.ParseBufferOverflowException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SentenceParserTest {

    private static final String[] FRAGMENTS = {
            "Hello there.", "Mr. Smith", "Dr. Who arrived", "$1,000.50", "3.14", "etc.", "e.g. apples",
            "J.K. Rowling", "U.S.", "Wait...", "What?!", "Stop!", "\"Hi.\"", "(Really.)", "and then",
            "Second", "v2.0.1", "...", "?", "ok", "A. B. C."
    };

    private static final String[] SEPARATORS = {" ", "  ", "\n", "", " . ", "! "};

    @Test
    void shouldNotSplitAfterTitleAbbreviation() {
        assertThat(spoken(parseWhole(0, "Hello Mr. Smith."))).containsExactly("Hello Mr. Smith.");
    }

    @Test
    void shouldNotSplitOnDecimalPoint() {
        assertThat(spoken(parseWhole(0, "Pi is 3.14. Great!"))).containsExactly("Pi is 3.14.", "Great!");
    }

    @Test
    void shouldNotSplitAfterInitials() {
        assertThat(spoken(parseWhole(0, "J.K. Rowling wrote it."))).containsExactly("J.K. Rowling wrote it.");
    }

    @Test
    void shouldTreatEllipsisAsContinuation() {
        assertThat(spoken(parseWhole(0, "I think... maybe."))).containsExactly("I think... maybe.");
    }

    @Test
    void shouldEndSentenceAfterPunctuationFollowingEllipsis() {
        assertThat(spoken(parseWhole(0, "Wait... What? Yes.")))
                .containsExactly("Wait... What?", "Yes.");
    }

    @Test
    void shouldMergeShortFragmentIntoFollowingChunk() {
        assertThat(spoken(parseWhole(10, "Hi. How are you?"))).containsExactly("Hi. How are you?");
    }

    @Test
    void shouldSplitOnExclamationAndQuestionMarks() {
        assertThat(spoken(parseWhole(0, "Really?! Yes. Go now!")))
                .containsExactly("Really?!", "Yes.", "Go now!");
    }

    @Test
    void shouldKeepClosingQuoteWithSentence() {
        assertThat(spoken(parseWhole(0, "He said \"Hi.\" Then he left.")))
                .containsExactly("He said \"Hi.\"", "Then he left.");
    }

    @Test
    void shouldNotSplitInsideLatinAbbreviation() {
        assertThat(spoken(parseWhole(0, "Fruit, e.g. apples, is good. Eat it.")))
                .containsExactly("Fruit, e.g. apples, is good.", "Eat it.");
    }

    @Test
    void shouldMatchAbbreviationsCaseInsensitively() {
        assertThat(spoken(parseWhole(0, "Meet DR. Who today.")))
                .containsExactly("Meet DR. Who today.");
    }

    @Test
    void shouldHonourAdditionalAbbreviations() {
        SentenceParser parser = new SentenceParser(0, 1000, Abbreviations.withAdditional(List.of("Approx.", "Univ")));
        List<TextChunk> chunks = new ArrayList<>(parser.addChunk("He went to Univ. of Texas. Then home."));
        parser.finalizeChunks().ifPresent(chunks::add);

        assertThat(spoken(chunks)).containsExactly("He went to Univ. of Texas.", "Then home.");
    }

    @Test
    void shouldNotEmitBoundaryWithoutLookahead() {
        SentenceParser parser = new SentenceParser(0);

        assertThat(parser.addChunk("Hello.")).isEmpty();
        assertThat(parser.addChunk(" ")).extracting(TextChunk::text).containsExactly("Hello.");
    }

    @Test
    void shouldNotSplitWhenPeriodIsFollowedByLetter() {
        assertThat(spoken(parseWhole(0, "Visit example.com today. Thanks.")))
                .containsExactly("Visit example.com today.", "Thanks.");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Hello Mr. Smith. How are you today? I am fine.",
            "Pi is 3.14. Great! The value 2.5 is smaller.",
            "J.K. Rowling wrote it. Dr. Who watched... and laughed. The end",
            "He said \"Stop!\" and ran. (Really.) Then silence...",
            "  Leading spaces. Multiple   spaces.  Trailing  ",
            "No terminal punctuation at all",
            "Numbers 1. 2. 3. and U.S. policy. Done?!",
            "It costs $1,000.50 today. That is a lot.",
            "Apples, pears, etc. Second sentence here. Third one."
    })
    void shouldProduceSameChunksWhenFedOneCharacterAtATime(String text) {
        for (int min : new int[]{0, 10}) {
            List<TextChunk> whole = parseWhole(min, text);
            List<TextChunk> streamed = parseByCharacter(min, text);

            assertThat(streamed).isEqualTo(whole);
        }
    }

    @Test
    void shouldProduceSameChunksWhateverTheDeltaBoundaries() {
        Random random = new Random(20240611L);
        for (int round = 0; round < 300; round++) {
            String text = generatedText(random);
            int min = random.nextInt(3) * 8;
            List<TextChunk> whole = parseWhole(min, text);

            assertThat(parseInRandomPieces(min, text, random)).as("random pieces of [%s]", text).isEqualTo(whole);
            assertThat(parseByCharacter(min, text)).as("characters of [%s]", text).isEqualTo(whole);
            assertThat(whole.stream().map(TextChunk::text).collect(Collectors.joining())).isEqualTo(text);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Hello Mr. Smith. How are you today? I am fine.",
            "  Leading spaces. Multiple   spaces.  Trailing  ",
            "Wait... What? Yes.\nNew line. Done.",
            ""
    })
    void shouldReproduceInputWhenChunksAreConcatenated(String text) {
        String joined = parseByCharacter(10, text).stream()
                .map(TextChunk::text)
                .collect(Collectors.joining());

        assertThat(joined).isEqualTo(text);
    }

    @Test
    void shouldAssignIncreasingSequenceNumbersFromZero() {
        List<TextChunk> chunks = parseWhole(0, "One. Two. Three.");

        assertThat(chunks).extracting(TextChunk::sequenceNumber).containsExactly(0, 1, 2);
    }

    @Test
    void shouldFlushTextWithoutTerminalPunctuationOnFinalize() {
        SentenceParser parser = new SentenceParser(0);

        assertThat(parser.addChunk("and then it just stops")).isEmpty();
        assertThat(parser.finalizeChunks()).map(TextChunk::text).contains("and then it just stops");
    }

    @Test
    void shouldFlushWhitespaceRemainderAsBlankChunk() {
        SentenceParser parser = new SentenceParser(0);
        parser.addChunk("Done. ");

        Optional<TextChunk> rest = parser.finalizeChunks();
        assertThat(rest).isPresent();
        assertThat(rest.get().isBlank()).isTrue();
        assertThat(rest.get().sequenceNumber()).isEqualTo(1);
    }

    @Test
    void shouldReturnEmptyOnFinalizeWhenNothingIsBuffered() {
        SentenceParser parser = new SentenceParser(0);

        assertThat(parser.finalizeChunks()).isEmpty();
    }

    @Test
    void shouldRejectUseAfterFinalize() {
        SentenceParser parser = new SentenceParser(0);
        parser.finalizeChunks();

        assertThat(parser.isFinalized()).isTrue();
        assertThatThrownBy(parser::finalizeChunks).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> parser.addChunk("more")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldIgnoreNullAndEmptyDeltas() {
        SentenceParser parser = new SentenceParser(0);

        assertThat(parser.addChunk(null)).isEmpty();
        assertThat(parser.addChunk("")).isEmpty();
        assertThat(parser.emittedCount()).isZero();
    }

    @Test
    void shouldThrowWhenUndecidedTextExceedsLimit() {
        SentenceParser parser = new SentenceParser(0, 10, Abbreviations.defaults());

        assertThatThrownBy(() -> parser.addChunk("this text never ends"))
                .isInstanceOfSatisfying(ParseBufferOverflowException.class,
                        e -> assertThat(e.getLimit()).isEqualTo(10));
    }

    @Test
    void shouldNotOverflowWhileSentencesKeepCompleting() {
        SentenceParser parser = new SentenceParser(0, 20, Set.of());

        for (int i = 0; i < 50; i++) {
            parser.addChunk("Short one. ");
        }

        assertThat(parser.emittedCount()).isEqualTo(50);
    }

    @Test
    void shouldRejectInvalidConstructorArguments() {
        assertThatThrownBy(() -> new SentenceParser(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SentenceParser(0, 0, Set.of())).isInstanceOf(IllegalArgumentException.class);
    }

    private static List<TextChunk> parseWhole(int minChunkLength, String text) {
        SentenceParser parser = new SentenceParser(minChunkLength);
        List<TextChunk> chunks = new ArrayList<>(parser.addChunk(text));
        parser.finalizeChunks().ifPresent(chunks::add);
        return chunks;
    }

    private static List<TextChunk> parseByCharacter(int minChunkLength, String text) {
        SentenceParser parser = new SentenceParser(minChunkLength);
        List<TextChunk> chunks = new ArrayList<>();
        for (int i = 0; i < text.length(); i++) {
            chunks.addAll(parser.addChunk(String.valueOf(text.charAt(i))));
        }
        parser.finalizeChunks().ifPresent(chunks::add);
        return chunks;
    }

    private static List<TextChunk> parseInRandomPieces(int minChunkLength, String text, Random random) {
        SentenceParser parser = new SentenceParser(minChunkLength);
        List<TextChunk> chunks = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            int end = Math.min(text.length(), i + 1 + random.nextInt(7));
            chunks.addAll(parser.addChunk(text.substring(i, end)));
            i = end;
        }
        parser.finalizeChunks().ifPresent(chunks::add);
        return chunks;
    }

    /** Joins fragments that exercise every boundary rule, with random spacing. */
    private static String generatedText(Random random) {
        StringBuilder text = new StringBuilder();
        int pieces = 1 + random.nextInt(10);
        for (int i = 0; i < pieces; i++) {
            text.append(FRAGMENTS[random.nextInt(FRAGMENTS.length)]);
            text.append(SEPARATORS[random.nextInt(SEPARATORS.length)]);
        }
        return text.toString();
    }

    private static List<String> spoken(List<TextChunk> chunks) {
        return chunks.stream().map(TextChunk::spokenText).toList();
    }
}
