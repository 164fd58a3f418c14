package com.deepansh.wordplay.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextOperationsTest {

    @Test
    void countWords_blankOrNull_returnsZero() {
        assertThat(TextOperations.countWords(null)).isZero();
        assertThat(TextOperations.countWords("   \n ")).isZero();
    }

    @Test
    void countWords_mixedWhitespace_countsTokens() {
        assertThat(TextOperations.countWords("  one two\tthree\n\nfour ")).isEqualTo(4);
    }

    @Test
    void grep_caseInsensitive_findsAllMatches() {
        TextOperations.GrepResult result = TextOperations.grep("Cat cat CAT dog", "cat", false);
        assertThat(result.count()).isEqualTo(3);
        assertThat(result.matches()).containsExactly("Cat", "cat", "CAT");
    }

    @Test
    void grep_invalidPattern_throwsIllegalArgument() {
        assertThatThrownBy(() -> TextOperations.grep("text", "([", true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid pattern");
    }

    @Test
    void replace_nonGlobal_replacesFirstOnly() {
        TextOperations.ReplaceResult result = TextOperations.replace("a a a", "a", "b", false, true);
        assertThat(result.result()).isEqualTo("b a a");
        assertThat(result.count()).isEqualTo(1);
    }

    @Test
    void replace_replacementWithDollarSign_isLiteral() {
        TextOperations.ReplaceResult result = TextOperations.replace("price", "price", "$5", true, true);
        assertThat(result.result()).isEqualTo("$5");
    }

    @Test
    void splitParagraphs_dropsBlankParagraphs() {
        assertThat(TextOperations.splitParagraphs("First\n\n\n\nSecond\n  \n\nThird"))
                .containsExactly("First", "Second", "Third");
    }

    @Test
    void extractStructure_emptyContent_untitled() {
        TextOperations.DocumentStructure structure = TextOperations.extractStructure("");
        assertThat(structure.title()).isEqualTo("Untitled Document");
        assertThat(structure.paragraphs()).isEmpty();
    }

    @Test
    void extractStructure_titleIsFirstParagraph() {
        TextOperations.DocumentStructure structure = TextOperations.extractStructure("My Title\n\nBody text.");
        assertThat(structure.title()).isEqualTo("My Title");
        assertThat(structure.paragraphs()).extracting(TextOperations.Paragraph::id).containsExactly(0, 1);
    }

    @Test
    void analyze_countsSentencesAndReadingTime() {
        TextOperations.DocumentStats stats = TextOperations.analyze("One sentence. Two sentences!\n\nThree?");
        assertThat(stats.wordCount()).isEqualTo(5);
        assertThat(stats.paragraphCount()).isEqualTo(2);
        assertThat(stats.sentenceCount()).isEqualTo(3);
        assertThat(stats.estimatedReadingTimeMinutes()).isEqualTo(1);
    }
}
