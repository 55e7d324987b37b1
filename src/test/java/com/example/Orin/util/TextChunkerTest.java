package com.example.Orin.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextChunkerTest {

    private static final String WORDS = IntStream.range(0, 300)
            .mapToObj(i -> "word" + i)
            .collect(Collectors.joining(" "));

    @Test
    void shortTextIsOneChunk() {
        assertThat(TextChunker.split("  Annual leave is 20 days.  ", 1000, 100))
                .containsExactly("Annual leave is 20 days.");
    }

    @Test
    void blankTextYieldsNoChunks() {
        assertThat(TextChunker.split("   \n ", 1000, 100)).isEmpty();
        assertThat(TextChunker.split(null, 1000, 100)).isEmpty();
    }

    @Test
    void chunksRespectSizeAndCoverEveryWord() {
        List<String> chunks = TextChunker.split(WORDS, 50, 10);

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.length()).isLessThanOrEqualTo(50));

        Set<String> seen = new LinkedHashSet<>();
        chunks.forEach(chunk -> seen.addAll(Arrays.asList(chunk.split(" "))));
        assertThat(seen).containsAll(Arrays.asList(WORDS.split(" ")));
    }

    @Test
    void neighbouringChunksOverlap() {
        List<String> chunks = TextChunker.split(WORDS, 50, 10);

        for (int i = 1; i < chunks.size(); i++) {
            String firstWord = chunks.get(i).split(" ")[0];
            assertThat(chunks.get(i - 1)).contains(firstWord);
        }
    }

    @Test
    void prefersParagraphBreaks() {
        String text = "a".repeat(30) + "\n\n" + "b".repeat(30);

        List<String> chunks = TextChunker.split(text, 40, 5);

        assertThat(chunks.get(0)).isEqualTo("a".repeat(30));
    }

    @Test
    void hardCutsTextWithoutSeparators() {
        List<String> chunks = TextChunker.split("x".repeat(25), 10, 0);

        assertThat(chunks).containsExactly("x".repeat(10), "x".repeat(10), "x".repeat(5));
    }

    @Test
    void sameInputGivesSameChunks() {
        assertThat(TextChunker.split(WORDS, 120, 20)).isEqualTo(TextChunker.split(WORDS, 120, 20));
    }

    @Test
    void rejectsInvalidParameters() {
        assertThatThrownBy(() -> TextChunker.split("text", 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TextChunker.split("text", 10, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TextChunker.split("text", 10, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
